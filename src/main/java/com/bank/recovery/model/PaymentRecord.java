package com.bank.recovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A recorded (not executed) payment against an account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRecord {
    private String transactionId;
    private String accountId;
    private String conversationId;
    private double amount;
    private String paymentMethod;
    private long recordedAt;
    private String allocatedPlanId;     // null when no scheduled payment was pending
    private int allocatedInstallment;   // 0 when unallocated
}
