package com.bank.recovery.model;

public enum ScheduledPaymentStatus {
    PENDING,
    PAID,
    OVERDUE,
    SKIPPED
}
