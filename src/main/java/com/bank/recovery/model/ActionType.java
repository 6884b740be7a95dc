package com.bank.recovery.model;

import java.util.Locale;

public enum ActionType {
    INFORM,
    COLLECT_PAYMENT,
    PROPOSE_PLAN,
    ACKNOWLEDGE,
    REQUEST_INFO,
    VERIFY_IDENTITY,
    ESCALATE,
    CLOSE;

    /**
     * Accepts both the enum name and the lower snake-case wire form ("propose_plan").
     */
    public static ActionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action type is required");
        }
        return ActionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
