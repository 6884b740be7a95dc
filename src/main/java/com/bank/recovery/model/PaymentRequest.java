package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@Schema(description = "A payment received outside this service, to be recorded against an account")
public record PaymentRequest(
        @NotBlank String accountId,
        @Schema(description = "Conversation whose plans the payment is allocated to")
        String conversationId,
        @Positive double amount,
        @Schema(example = "ACH") String paymentMethod) {
}
