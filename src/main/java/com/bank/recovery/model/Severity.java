package com.bank.recovery.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isFailure() {
        return this == ERROR || this == CRITICAL;
    }
}
