package com.bank.recovery.model;

public enum PlanStatus {
    PROPOSED,
    ACCEPTED,
    ACTIVE,
    COMPLETED,
    DEFAULTED
}
