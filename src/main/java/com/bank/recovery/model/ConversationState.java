package com.bank.recovery.model;

/**
 * Conversation lifecycle. ESCALATED, CLOSED and OPTED_OUT are terminal; OPTED_OUT is
 * entered only through an explicit opt-out request and is never left.
 */
public enum ConversationState {
    INITIATED,
    IDENTITY_VERIFICATION,
    ACTIVE_NEGOTIATION,
    PAYMENT_PROCESSING,
    ESCALATED,
    CLOSED,
    OPTED_OUT;

    public boolean isTerminal() {
        return this == ESCALATED || this == CLOSED || this == OPTED_OUT;
    }

    public boolean canTransitionTo(ConversationState target) {
        if (this == target) return true;
        if (this == OPTED_OUT) return false;
        // Opt-out overrides an escalation, but a closed conversation stays closed
        if (target == OPTED_OUT) return this != CLOSED;
        return !isTerminal();
    }
}
