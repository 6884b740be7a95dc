package com.bank.recovery.engine.rules;

import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.engine.ContactCheckContext;
import com.bank.recovery.engine.ContactRule;
import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ContactCheck;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Caps the number of conversations opened with a debtor on the current local day.
 */
@Component
public class DailyFrequencyRule implements ContactRule {

    private final PolicyProperties policy;

    public DailyFrequencyRule(PolicyProperties policy) {
        this.policy = policy;
    }

    @Override
    public ContactCheck getSupportedCheck() {
        return ContactCheck.DAILY_FREQUENCY;
    }

    @Override
    public ComplianceCheckResult evaluate(ContactCheckContext context) {
        ZoneId zone = policy.defaultZone();
        LocalDate today = context.getNow().atZone(zone).toLocalDate();

        long opened = context.getContactHistory().stream()
                .map(Conversation::getCreatedAt)
                .filter(createdAt -> Instant.ofEpochMilli(createdAt).atZone(zone).toLocalDate().equals(today))
                .count();

        if (opened >= policy.maxDailyContactAttempts()) {
            return ComplianceCheckResult.failed(ContactCheck.DAILY_FREQUENCY.checkName(), Severity.WARNING,
                    String.format("Maximum daily contact attempts (%d) exceeded", policy.maxDailyContactAttempts()));
        }
        return ComplianceCheckResult.passed(ContactCheck.DAILY_FREQUENCY.checkName(),
                String.format("Daily contact attempts: %d/%d", opened, policy.maxDailyContactAttempts()));
    }
}
