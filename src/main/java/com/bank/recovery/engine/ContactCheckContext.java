package com.bank.recovery.engine;

import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.Debtor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Inputs shared by every contact check of one gate evaluation.
 */
@Data
@Builder
public class ContactCheckContext {
    private Debtor debtor;

    // Conversation the contact belongs to; not yet persisted when this is a first contact
    private Conversation conversation;

    // Conversations opened with the debtor, the current one included
    private List<Conversation> contactHistory;

    // Single evaluation instant so every check sees the same clock reading
    private Instant now;
}
