package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.Account;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.PaymentPlan;
import com.bank.recovery.model.PaymentReceipt;
import com.bank.recovery.model.PaymentRecord;
import com.bank.recovery.model.PaymentRequest;
import com.bank.recovery.model.PlanStatus;
import com.bank.recovery.model.ScheduledPayment;
import com.bank.recovery.model.ScheduledPaymentStatus;
import com.bank.recovery.model.Severity;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.repository.PaymentRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Plan acceptance and payment recording. Payments are allocated to the earliest pending
 * installments of an accepted or active plan on the account. The account is written before
 * the plan, and its balance is restored if the plan cannot be committed.
 */
@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final ConversationRepository conversationRepository;
    private final AccountRepository accountRepository;
    private final PaymentRepository paymentRepository;
    private final ConversationTurnExecutor turnExecutor;
    private final AuditEventSink auditSink;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PaymentService(ConversationRepository conversationRepository,
                          AccountRepository accountRepository,
                          PaymentRepository paymentRepository,
                          ConversationTurnExecutor turnExecutor,
                          AuditEventSink auditSink,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.conversationRepository = conversationRepository;
        this.accountRepository = accountRepository;
        this.paymentRepository = paymentRepository;
        this.turnExecutor = turnExecutor;
        this.auditSink = auditSink;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Accept a proposed plan. The debtor must be verified and the conversation still open.
     */
    @Observed(name = "plan.accept", contextualName = "accept-plan")
    public PaymentPlan acceptPlan(String conversationId, String planId) {
        return turnExecutor.execute(conversationId, () -> {
            Conversation stored = conversationRepository.findById(conversationId);
            if (stored == null) {
                throw RequestValidationException.notFound("Conversation", conversationId);
            }
            if (stored.getState().isTerminal()) {
                throw RequestValidationException.invalid("conversationId",
                        "Conversation is " + stored.getState() + " and cannot accept plans");
            }
            if (!stored.isIdentityVerified()) {
                throw RequestValidationException.invalid("conversationId",
                        "Identity must be verified before accepting a plan");
            }

            Conversation working = stored.copy();
            PaymentPlan plan = working.findPlan(planId)
                    .orElseThrow(() -> RequestValidationException.notFound("Payment plan", planId));
            if (plan.getStatus() != PlanStatus.PROPOSED) {
                throw RequestValidationException.invalid("planId",
                        "Plan is " + plan.getStatus() + ", only PROPOSED plans can be accepted");
            }

            long now = clock.millis();
            plan.setStatus(PlanStatus.ACCEPTED);
            plan.setAcceptedAt(now);
            if (working.getState() != ConversationState.PAYMENT_PROCESSING) {
                working.transitionTo(ConversationState.PAYMENT_PROCESSING);
            }
            working.setLastActivityAt(now);
            conversationRepository.commit(working);

            auditSink.publish(AuditEvent.builder()
                    .eventType(AuditEventType.PLAN_ACCEPTED)
                    .name(plan.getPlanType().name().toLowerCase())
                    .conversationId(conversationId)
                    .debtorId(working.getDebtorId())
                    .accountId(working.getAccountId())
                    .passed(true)
                    .severity(Severity.INFO)
                    .details("Plan " + planId + " accepted, " + plan.getInstallmentCount()
                            + " x " + plan.getInstallmentAmount())
                    .build());
            log.info("Plan {} accepted on conversation {}", planId, conversationId);
            return plan;
        });
    }

    /**
     * Record a payment against an account. Serialized per account so concurrent payments
     * cannot both read the same balance.
     */
    @Observed(name = "payment.record", contextualName = "record-payment")
    public PaymentReceipt recordPayment(PaymentRequest request) {
        if (request.accountId() == null || request.accountId().isBlank()) {
            throw RequestValidationException.invalid("accountId", "Account id is required");
        }
        if (!(request.amount() > 0)) {
            throw RequestValidationException.invalid("amount", "Payment amount must be positive");
        }

        return turnExecutor.execute("account:" + request.accountId(), () -> {
            Account account = accountRepository.findById(request.accountId());
            if (account == null) {
                throw RequestValidationException.notFound("Account", request.accountId());
            }
            BigDecimal amount = BigDecimal.valueOf(request.amount()).setScale(2, RoundingMode.HALF_UP);
            BigDecimal balance = BigDecimal.valueOf(account.getCurrentBalance()).setScale(2, RoundingMode.HALF_UP);
            if (amount.compareTo(balance) > 0) {
                throw RequestValidationException.invalid("amount",
                        "Payment " + amount + " exceeds outstanding balance " + balance);
            }

            long now = clock.millis();
            String transactionId = "TXN-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
            PaymentRecord record = PaymentRecord.builder()
                    .transactionId(transactionId)
                    .accountId(account.getAccountId())
                    .conversationId(request.conversationId())
                    .amount(amount.doubleValue())
                    .paymentMethod(request.paymentMethod())
                    .recordedAt(now)
                    .build();

            Allocation allocation = allocate(request, record, amount, now);

            double previousBalance = account.getCurrentBalance();
            double previousPaymentAmount = account.getLastPaymentAmount();
            long previousPaymentAt = account.getLastPaymentAt();
            BigDecimal newBalance = balance.subtract(amount);
            account.setCurrentBalance(newBalance.doubleValue());
            account.setLastPaymentAmount(amount.doubleValue());
            account.setLastPaymentAt(now);
            accountRepository.save(account);

            if (allocation != null) {
                try {
                    conversationRepository.commit(allocation.conversation());
                } catch (RuntimeException e) {
                    // Put the balance back so the whole payment can be retried
                    account.setCurrentBalance(previousBalance);
                    account.setLastPaymentAmount(previousPaymentAmount);
                    account.setLastPaymentAt(previousPaymentAt);
                    try {
                        accountRepository.save(account);
                    } catch (RuntimeException restoreFailure) {
                        e.addSuppressed(restoreFailure);
                        log.error("Could not restore balance of account {} after failed allocation of {}",
                                account.getAccountId(), transactionId, restoreFailure);
                    }
                    throw e;
                }
                record.setConversationId(allocation.conversation().getConversationId());
                record.setAllocatedPlanId(allocation.plan().getPlanId());
                record.setAllocatedInstallment(allocation.installmentNumber());
            }
            PlanStatus planStatus = allocation != null ? allocation.plan().getStatus() : null;
            paymentRepository.save(record);

            metricsConfig.recordPayment(record.getAllocatedPlanId() != null ? "allocated" : "unallocated");
            auditSink.publish(AuditEvent.builder()
                    .eventType(AuditEventType.PAYMENT)
                    .name("payment_recorded")
                    .conversationId(record.getConversationId())
                    .debtorId(account.getDebtorId())
                    .accountId(account.getAccountId())
                    .passed(true)
                    .severity(Severity.INFO)
                    .details("Payment " + transactionId + " of " + amount + ", balance now " + newBalance
                            + (record.getAllocatedPlanId() != null
                                ? ", installment " + record.getAllocatedInstallment() + " of " + record.getAllocatedPlanId()
                                : ", unallocated"))
                    .build());
            log.info("Payment {} recorded on account {}: amount={}, newBalance={}",
                    transactionId, account.getAccountId(), amount, newBalance);

            return PaymentReceipt.builder()
                    .transactionId(transactionId)
                    .accountId(account.getAccountId())
                    .amount(amount.doubleValue())
                    .newBalance(newBalance.doubleValue())
                    .allocatedPlanId(record.getAllocatedPlanId())
                    .allocatedInstallment(record.getAllocatedInstallment())
                    .planStatus(planStatus)
                    .recordedAt(now)
                    .build();
        });
    }

    private record Allocation(Conversation conversation, PaymentPlan plan, int installmentNumber) {
    }

    /**
     * Apply the amount to the pending installments of the first open plan, earliest first, on a
     * working copy of its conversation. An installment becomes PAID only once its paid amount
     * covers it. Returns null when no plan has anything pending. Nothing is committed here.
     */
    private Allocation allocate(PaymentRequest request, PaymentRecord record, BigDecimal amount, long now) {
        List<Conversation> candidates;
        if (request.conversationId() != null && !request.conversationId().isBlank()) {
            Conversation conversation = conversationRepository.findById(request.conversationId());
            if (conversation == null) {
                throw RequestValidationException.notFound("Conversation", request.conversationId());
            }
            if (!conversation.getAccountId().equals(request.accountId())) {
                throw RequestValidationException.invalid("conversationId",
                        "Conversation does not belong to account " + request.accountId());
            }
            candidates = List.of(conversation);
        } else {
            candidates = conversationRepository.findByAccountId(request.accountId());
        }

        for (Conversation stored : candidates) {
            Conversation working = stored.copy();
            Optional<PaymentPlan> plan = working.getPaymentPlans().stream()
                    .filter(p -> p.getStatus() == PlanStatus.ACCEPTED || p.getStatus() == PlanStatus.ACTIVE)
                    .filter(p -> nextPending(p).isPresent())
                    .findFirst();
            if (plan.isEmpty()) {
                continue;
            }

            PaymentPlan target = plan.get();
            int firstInstallment = nextPending(target).get().getInstallmentNumber();
            BigDecimal unapplied = amount;
            Optional<ScheduledPayment> next = nextPending(target);
            while (next.isPresent() && unapplied.signum() > 0) {
                ScheduledPayment installment = next.get();
                BigDecimal due = money(installment.getAmount());
                BigDecimal paid = money(installment.getPaidAmount());
                BigDecimal applied = unapplied.min(due.subtract(paid));
                paid = paid.add(applied);
                unapplied = unapplied.subtract(applied);

                installment.setPaidAmount(paid.doubleValue());
                installment.setTransactionId(record.getTransactionId());
                if (paid.compareTo(due) < 0) {
                    break;
                }
                installment.setStatus(ScheduledPaymentStatus.PAID);
                installment.setPaidAt(now);
                next = nextPending(target);
            }

            boolean remaining = nextPending(target).isPresent();
            target.setStatus(remaining ? PlanStatus.ACTIVE : PlanStatus.COMPLETED);
            if (!remaining) {
                target.setCompletedAt(now);
            }
            working.setLastActivityAt(now);
            return new Allocation(working, target, firstInstallment);
        }
        return null;
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private static Optional<ScheduledPayment> nextPending(PaymentPlan plan) {
        return plan.getScheduledPayments().stream()
                .filter(s -> s.getStatus() == ScheduledPaymentStatus.PENDING)
                .min(Comparator.comparingInt(ScheduledPayment::getInstallmentNumber));
    }
}
