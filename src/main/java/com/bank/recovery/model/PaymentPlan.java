package com.bank.recovery.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A derived payment plan and its schedule. Only the payment-progress fields
 * (status, acceptance/completion timestamps and the schedule rows' paid fields)
 * change once the plan has left PROPOSED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Payment plan derived from an accepted proposal")
public class PaymentPlan {

    @Schema(description = "Plan identifier", example = "PLAN-3f2a9c1e")
    private String planId;

    private String accountId;

    private String conversationId;

    @Schema(description = "Plan kind", example = "INSTALLMENT")
    private PlanType planType;

    @Schema(description = "Total agreed amount", example = "1200.00")
    private double totalAmount;

    @Schema(description = "Amount per installment", example = "200.00")
    private double installmentAmount;

    @Schema(description = "Number of installments (1 for settlement and one-time plans)", example = "6")
    private int installmentCount;

    @Schema(description = "First due date", example = "2025-11-10")
    private LocalDate firstDueDate;

    @Builder.Default
    private PaymentFrequency frequency = PaymentFrequency.MONTHLY;

    @Builder.Default
    private PlanStatus status = PlanStatus.PROPOSED;

    private long createdAt;
    private long acceptedAt;
    private long completedAt;

    @Builder.Default
    private List<ScheduledPayment> scheduledPayments = new ArrayList<>();

    public PaymentPlan copy() {
        List<ScheduledPayment> rows = new ArrayList<>();
        for (ScheduledPayment row : scheduledPayments) {
            rows.add(row.toBuilder().build());
        }
        return toBuilder().scheduledPayments(rows).build();
    }
}
