package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of handing a conversation to a human agent")
public class EscalationResult {
    private String conversationId;
    private ConversationState state;
    private String reason;
    private EscalationPriority priority;
    @Schema(example = "24-48 hours")
    private String estimatedResponseTime;
    private long escalatedAt;
    @Schema(description = "False when the conversation was already escalated")
    private boolean newlyEscalated;
}
