package com.bank.recovery.generation;

import com.bank.recovery.model.ConversationContext;

import java.util.List;

public record GenerationRequest(String userMessage, ConversationContext context, List<ReferenceSnippet> references) {

    public GenerationRequest {
        references = references == null ? List.of() : List.copyOf(references);
    }
}
