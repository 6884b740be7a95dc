package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

@Schema(description = "Inbound debtor message")
public record MessageRequest(
        @Schema(description = "Account the debtor is writing about", example = "ACC-1001")
        @NotBlank String accountId,
        @Schema(description = "Existing conversation id; omit to open a new conversation")
        String sessionId,
        @Schema(description = "Message text", example = "Can I set up a payment plan?")
        @NotBlank String message,
        Channel channel,
        Map<String, String> metadata) {

    public InboundMessage toInbound() {
        return new InboundMessage(accountId, sessionId, message, channel, metadata);
    }
}
