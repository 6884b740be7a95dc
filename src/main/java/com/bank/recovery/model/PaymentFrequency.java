package com.bank.recovery.model;

import java.time.LocalDate;
import java.util.Locale;

public enum PaymentFrequency {
    WEEKLY,
    BI_WEEKLY,
    MONTHLY;

    /**
     * Due date of the installment at {@code index} (0-based) counted from {@code first}.
     * Monthly steps are taken from the first date, not chained, so a plan starting on
     * the 31st keeps falling on the last day of shorter months instead of drifting.
     */
    public LocalDate dueDate(LocalDate first, int index) {
        return switch (this) {
            case WEEKLY -> first.plusWeeks(index);
            case BI_WEEKLY -> first.plusWeeks(2L * index);
            case MONTHLY -> first.plusMonths(index);
        };
    }

    public static PaymentFrequency fromValue(String value) {
        if (value == null || value.isBlank()) return MONTHLY;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("BIWEEKLY".equals(normalized)) return BI_WEEKLY;
        return PaymentFrequency.valueOf(normalized);
    }
}
