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
@Schema(description = "A delinquent account under negotiation")
public class Account {

    @Schema(description = "Account identifier", example = "ACC-1001")
    private String accountId;

    @Schema(description = "Owning debtor", example = "DEBTOR-001")
    private String debtorId;

    @Schema(description = "Account number as printed on statements", example = "LN-2024-000117")
    private String accountNumber;

    private double principalAmount;

    @Schema(description = "Outstanding balance", example = "1200.00")
    private double currentBalance;

    @Builder.Default
    private String currency = "USD";

    @Schema(description = "Days past due", example = "90")
    private int daysOverdue;

    @Schema(description = "Last payment timestamp in epoch milliseconds, 0 if none", example = "1748736000000")
    private long lastPaymentAt;

    @Schema(description = "Amount of the last payment", example = "150.00")
    private double lastPaymentAmount;
}
