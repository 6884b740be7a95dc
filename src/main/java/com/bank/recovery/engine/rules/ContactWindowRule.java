package com.bank.recovery.engine.rules;

import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.engine.ContactCheckContext;
import com.bank.recovery.engine.ContactRule;
import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ContactCheck;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Allows contact only inside the daily contact window and never on a prohibited weekday.
 *
 * The window is evaluated in the debtor's own zone, falling back to the policy zone, and is
 * half-open: {@code start <= now < end}. Debtor-specific hours replace the policy hours when
 * both are present. A window that cannot be parsed allows the contact and logs a warning.
 */
@Component
public class ContactWindowRule implements ContactRule {

    private static final Logger log = LoggerFactory.getLogger(ContactWindowRule.class);

    private final PolicyProperties policy;

    public ContactWindowRule(PolicyProperties policy) {
        this.policy = policy;
    }

    @Override
    public ContactCheck getSupportedCheck() {
        return ContactCheck.CONTACT_WINDOW;
    }

    @Override
    public ComplianceCheckResult evaluate(ContactCheckContext context) {
        Debtor debtor = context.getDebtor();
        ZonedDateTime local = context.getNow().atZone(resolveZone(debtor));

        if (policy.prohibitedContactDays().contains(local.getDayOfWeek())) {
            return ComplianceCheckResult.failed(ContactCheck.CONTACT_WINDOW.checkName(), Severity.WARNING,
                    "Contact not allowed on " + local.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.US));
        }

        String startText = hasDebtorWindow(debtor) ? debtor.getContactHoursStart() : policy.contactHoursStart();
        String endText = hasDebtorWindow(debtor) ? debtor.getContactHoursEnd() : policy.contactHoursEnd();

        LocalTime start;
        LocalTime end;
        try {
            start = LocalTime.parse(startText);
            end = LocalTime.parse(endText);
        } catch (DateTimeException | NullPointerException e) {
            log.warn("Unparsable contact window [{} - {}] for debtor {}, allowing contact: {}",
                    startText, endText, debtor.getDebtorId(), e.getMessage());
            return ComplianceCheckResult.builder()
                    .checkName(ContactCheck.CONTACT_WINDOW.checkName())
                    .passed(true)
                    .severity(Severity.WARNING)
                    .details("Contact window configuration invalid, contact allowed")
                    .build();
        }

        LocalTime current = local.toLocalTime();
        if (current.isBefore(start) || !current.isBefore(end)) {
            return ComplianceCheckResult.failed(ContactCheck.CONTACT_WINDOW.checkName(), Severity.WARNING,
                    String.format("Contact only allowed between %s and %s (%s)", startText, endText, local.getZone()));
        }

        return ComplianceCheckResult.passed(ContactCheck.CONTACT_WINDOW.checkName(),
                "Contact time is within allowed hours");
    }

    private boolean hasDebtorWindow(Debtor debtor) {
        return debtor.getContactHoursStart() != null && debtor.getContactHoursEnd() != null;
    }

    private ZoneId resolveZone(Debtor debtor) {
        if (debtor.getTimezone() != null && !debtor.getTimezone().isBlank()) {
            try {
                return ZoneId.of(debtor.getTimezone());
            } catch (DateTimeException e) {
                log.warn("Unknown timezone '{}' for debtor {}, using {}",
                        debtor.getTimezone(), debtor.getDebtorId(), policy.defaultTimezone());
            }
        }
        return policy.defaultZone();
    }
}
