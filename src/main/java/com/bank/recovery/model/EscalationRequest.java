package com.bank.recovery.model;

import jakarta.validation.constraints.NotBlank;

public record EscalationRequest(@NotBlank String reason, EscalationPriority priority, String notes) {
}
