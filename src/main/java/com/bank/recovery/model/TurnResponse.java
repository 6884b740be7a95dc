package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of processing one inbound debtor message")
public class TurnResponse {

    @Schema(description = "Conversation the turn belongs to; null when a new conversation was blocked before creation")
    private String conversationId;

    @Schema(description = "How the turn was handled", example = "PROCESSED")
    private TurnOutcome outcome;

    @Schema(description = "Conversation state after the turn", example = "ACTIVE_NEGOTIATION")
    private ConversationState state;

    @Schema(description = "Reply text returned to the debtor")
    private String message;

    @Schema(description = "Action taken after validation", example = "PROPOSE_PLAN")
    private ActionType action;

    @Schema(description = "Generator confidence in [0, 1]", example = "0.85")
    private Double confidence;

    private boolean escalated;

    @Builder.Default
    private List<String> complianceTags = new ArrayList<>();

    @Schema(description = "Identifier of the plan created during this turn, if any")
    private String planId;

    @Schema(description = "Name of the contact check that blocked the turn", example = "contact_window")
    private String blockedBy;

    private Severity blockSeverity;
}
