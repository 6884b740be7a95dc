package com.bank.recovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPayment {
    private int installmentNumber;      // 1-based
    private LocalDate dueDate;
    private double amount;
    @Builder.Default
    private ScheduledPaymentStatus status = ScheduledPaymentStatus.PENDING;
    private long paidAt;                // 0 until paid
    private double paidAmount;
    private String transactionId;
}
