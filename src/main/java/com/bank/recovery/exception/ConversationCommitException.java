package com.bank.recovery.exception;

/**
 * A conversation change could not be stored. Nothing of the change is visible; the caller
 * may retry the whole operation.
 */
public class ConversationCommitException extends RuntimeException {

    private final String conversationId;
    private final boolean concurrentModification;

    public ConversationCommitException(String conversationId, String message, boolean concurrentModification,
                                       Throwable cause) {
        super(message, cause);
        this.conversationId = conversationId;
        this.concurrentModification = concurrentModification;
    }

    public String getConversationId() {
        return conversationId;
    }

    public boolean isConcurrentModification() {
        return concurrentModification;
    }
}
