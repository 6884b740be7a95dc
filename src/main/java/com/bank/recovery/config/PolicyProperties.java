package com.bank.recovery.config;

import lombok.With;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.List;

/**
 * Regulatory and payment-policy limits. Bound once at startup and never mutated;
 * components that need a variation in tests build one with the {@code with*} methods.
 *
 * @param maxSettlementPercentage  highest settlement amount as a fraction of the live balance
 * @param maxInstallmentMonths     highest installment count of an installment plan
 * @param minimumInstallmentAmount lowest per-installment amount
 * @param contactHoursStart        start of the contact window, "HH:mm", inclusive
 * @param contactHoursEnd          end of the contact window, "HH:mm", exclusive
 * @param defaultTimezone          zone for the contact window when the debtor has none
 * @param firstDueDateOffsetDays   days from today to the first due date when a plan leaves it unset
 */
@With
@ConfigurationProperties(prefix = "recovery.policy")
public record PolicyProperties(
        @DefaultValue("0.70") double maxSettlementPercentage,
        @DefaultValue("12") int maxInstallmentMonths,
        @DefaultValue("25") double minimumInstallmentAmount,
        @DefaultValue("08:00") String contactHoursStart,
        @DefaultValue("21:00") String contactHoursEnd,
        @DefaultValue("3") int maxDailyContactAttempts,
        @DefaultValue("7") int maxWeeklyContactAttempts,
        @DefaultValue("SUNDAY") List<DayOfWeek> prohibitedContactDays,
        @DefaultValue("3") int maxVerificationAttempts,
        @DefaultValue("UTC") String defaultTimezone,
        @DefaultValue("7") int firstDueDateOffsetDays) {

    public PolicyProperties {
        prohibitedContactDays = prohibitedContactDays == null ? List.of() : List.copyOf(prohibitedContactDays);
        if (maxVerificationAttempts < 1) {
            throw new IllegalArgumentException("recovery.policy.max-verification-attempts must be >= 1");
        }
    }

    public static PolicyProperties defaults() {
        return new PolicyProperties(0.70, 12, 25.0, "08:00", "21:00", 3, 7,
                List.of(DayOfWeek.SUNDAY), 3, "UTC", 7);
    }

    public ZoneId defaultZone() {
        return ZoneId.of(defaultTimezone);
    }
}
