package com.bank.recovery.model;

public enum TurnOutcome {
    // Generator proposal validated and applied
    PROCESSED,
    // Conversation had opted out, nothing recorded
    OPTED_OUT,
    // Contact not permitted right now, nothing recorded
    BLOCKED,
    // Conversation already with a human agent or closed; inbound recorded, generator skipped
    HANDED_OFF
}
