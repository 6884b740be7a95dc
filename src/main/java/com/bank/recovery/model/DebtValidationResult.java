package com.bank.recovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebtValidationResult {
    private String accountId;
    private int conversationsEscalated;
    private String message;
    private String nextSteps;
}
