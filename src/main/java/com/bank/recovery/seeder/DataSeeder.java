package com.bank.recovery.seeder;

import com.bank.recovery.model.Account;
import com.bank.recovery.model.Channel;
import com.bank.recovery.model.ConsentStatus;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.DebtorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Seeds Aerospike with sample debtors and accounts for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 *   - DEBTOR-001 / ACC-1001: consented, 1,250.00 outstanding, 45 days overdue
 *   - DEBTOR-002 / ACC-1002: consented, New York contact hours, 3,400.00 outstanding
 *   - DEBTOR-003 / ACC-1003: opted out; every turn is refused
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private final DebtorRepository debtorRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    public DataSeeder(DebtorRepository debtorRepository, AccountRepository accountRepository, Clock clock) {
        this.debtorRepository = debtorRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");

        long now = clock.millis();
        long consentAt = now - Duration.ofDays(90).toMillis();

        debtorRepository.save(Debtor.builder()
                .debtorId("DEBTOR-001")
                .name("Jordan Reyes")
                .email("jordan.reyes@example.com")
                .phone("+15550100001")
                .identifierLastFour("1234")
                .consentStatus(ConsentStatus.GRANTED)
                .consentAt(consentAt)
                .preferredChannel(Channel.CHAT)
                .build());
        accountRepository.save(account("ACC-1001", "DEBTOR-001", "4000-0000-1001", 1500.00, 1250.00, 45,
                now - Duration.ofDays(50).toMillis(), 150.00));

        debtorRepository.save(Debtor.builder()
                .debtorId("DEBTOR-002")
                .name("Sam Okafor")
                .email("sam.okafor@example.com")
                .phone("+15550100002")
                .identifierLastFour("5678")
                .consentStatus(ConsentStatus.GRANTED)
                .consentAt(consentAt)
                .timezone("America/New_York")
                .contactHoursStart("09:00")
                .contactHoursEnd("18:00")
                .preferredChannel(Channel.SMS)
                .build());
        accountRepository.save(account("ACC-1002", "DEBTOR-002", "4000-0000-1002", 4000.00, 3400.00, 120,
                now - Duration.ofDays(125).toMillis(), 200.00));

        debtorRepository.save(Debtor.builder()
                .debtorId("DEBTOR-003")
                .name("Alex Moreau")
                .email("alex.moreau@example.com")
                .identifierLastFour("9012")
                .consentStatus(ConsentStatus.REVOKED)
                .consentAt(consentAt)
                .optOutAt(now - Duration.ofDays(10).toMillis())
                .preferredChannel(Channel.EMAIL)
                .build());
        accountRepository.save(account("ACC-1003", "DEBTOR-003", "4000-0000-1003", 800.00, 800.00, 200,
                0L, 0.0));

        log.info("=== Data seeding complete: 3 debtors, 3 accounts ===");
    }

    private static Account account(String accountId, String debtorId, String number, double principal,
                                   double balance, int daysOverdue, long lastPaymentAt, double lastPaymentAmount) {
        return Account.builder()
                .accountId(accountId)
                .debtorId(debtorId)
                .accountNumber(number)
                .principalAmount(principal)
                .currentBalance(balance)
                .daysOverdue(daysOverdue)
                .lastPaymentAt(lastPaymentAt)
                .lastPaymentAmount(lastPaymentAmount)
                .build();
    }
}
