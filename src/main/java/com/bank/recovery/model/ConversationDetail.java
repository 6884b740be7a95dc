package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Read model for a conversation with a summary of its debtor and account.
 */
@Schema(description = "Conversation with debtor and account summary")
public record ConversationDetail(Conversation conversation,
                                 String debtorName,
                                 Channel preferredChannel,
                                 boolean debtorOptedOut,
                                 String accountNumber,
                                 double currentBalance,
                                 int daysOverdue) {
}
