package com.bank.recovery.model;

import java.util.List;

/**
 * Read-only snapshot of a conversation handed to the proposal generator and the
 * response validator. Built from the turn's working copy before the generator call.
 *
 * @param currentBalance live account balance at the time of the snapshot
 * @param recentMessages latest messages, oldest first, including the inbound one
 */
public record ConversationContext(String conversationId,
                                  String debtorId,
                                  String accountId,
                                  ConversationState state,
                                  Channel channel,
                                  boolean identityVerified,
                                  int verificationAttempts,
                                  double currentBalance,
                                  int daysOverdue,
                                  List<Message> recentMessages) {

    public ConversationContext {
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }
}
