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
@Schema(description = "Outcome of one identity verification attempt")
public class VerificationResponse {
    private String conversationId;
    private boolean verified;
    private boolean locked;
    @Schema(description = "Attempts left before lockout", example = "2")
    private int attemptsRemaining;
    private ConversationState state;
    private String message;
}
