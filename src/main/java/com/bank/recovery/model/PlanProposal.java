package com.bank.recovery.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Structured plan attached to a proposal. For installment plans {@code amount} is the
 * per-installment amount; for settlement and one-time plans it is the whole payment.
 *
 * @param installments  installment count, may be null for non-installment kinds
 * @param firstDueDate  may be null, the builder then defaults it
 */
public record PlanProposal(PlanType type,
                           double amount,
                           Integer installments,
                           LocalDate firstDueDate,
                           PaymentFrequency frequency) {

    public PlanProposal {
        Objects.requireNonNull(type, "plan type");
        if (frequency == null) {
            frequency = PaymentFrequency.MONTHLY;
        }
    }

    public static PlanProposal settlement(double amount) {
        return new PlanProposal(PlanType.SETTLEMENT, amount, null, null, PaymentFrequency.MONTHLY);
    }

    public static PlanProposal oneTime(double amount) {
        return new PlanProposal(PlanType.ONE_TIME, amount, null, null, PaymentFrequency.MONTHLY);
    }

    public static PlanProposal installment(double amount, int installments, LocalDate firstDueDate,
                                           PaymentFrequency frequency) {
        return new PlanProposal(PlanType.INSTALLMENT, amount, installments, firstDueDate, frequency);
    }
}
