package com.bank.recovery.engine.rules;

import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.engine.ContactCheckContext;
import com.bank.recovery.engine.ContactRule;
import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ContactCheck;
import com.bank.recovery.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Caps the number of conversations opened with a debtor in the trailing seven days.
 */
@Component
public class WeeklyFrequencyRule implements ContactRule {

    private static final long WINDOW_MS = Duration.ofDays(7).toMillis();

    private final PolicyProperties policy;

    public WeeklyFrequencyRule(PolicyProperties policy) {
        this.policy = policy;
    }

    @Override
    public ContactCheck getSupportedCheck() {
        return ContactCheck.WEEKLY_FREQUENCY;
    }

    @Override
    public ComplianceCheckResult evaluate(ContactCheckContext context) {
        long windowStart = context.getNow().toEpochMilli() - WINDOW_MS;

        long opened = context.getContactHistory().stream()
                .filter(c -> c.getCreatedAt() >= windowStart)
                .count();

        if (opened >= policy.maxWeeklyContactAttempts()) {
            return ComplianceCheckResult.failed(ContactCheck.WEEKLY_FREQUENCY.checkName(), Severity.WARNING,
                    String.format("Maximum weekly contact attempts (%d) exceeded", policy.maxWeeklyContactAttempts()));
        }
        return ComplianceCheckResult.passed(ContactCheck.WEEKLY_FREQUENCY.checkName(),
                String.format("Weekly contact attempts: %d/%d", opened, policy.maxWeeklyContactAttempts()));
    }
}
