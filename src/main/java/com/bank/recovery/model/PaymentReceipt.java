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
@Schema(description = "Confirmation of a recorded payment")
public class PaymentReceipt {
    private String transactionId;
    private String accountId;
    private double amount;
    @Schema(description = "Account balance after the payment", example = "1050.00")
    private double newBalance;
    private String allocatedPlanId;
    private int allocatedInstallment;
    private PlanStatus planStatus;
    private long recordedAt;
}
