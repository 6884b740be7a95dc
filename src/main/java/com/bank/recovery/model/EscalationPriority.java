package com.bank.recovery.model;

public enum EscalationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    public String estimatedResponseTime() {
        return (this == HIGH || this == URGENT) ? "2-4 hours" : "24-48 hours";
    }
}
