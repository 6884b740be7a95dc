package com.bank.recovery.plan;

import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.model.PaymentFrequency;
import com.bank.recovery.model.PaymentPlan;
import com.bank.recovery.model.PlanBuildResult;
import com.bank.recovery.model.PlanProposal;
import com.bank.recovery.model.PlanStatus;
import com.bank.recovery.model.PlanType;
import com.bank.recovery.model.PolicyViolation;
import com.bank.recovery.model.ScheduledPayment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Validates a proposed plan against payment policy and derives its schedule.
 *
 * Violations are returned as data; deciding what to do about them is up to the caller.
 * Amounts are compared as decimals so a settlement of exactly the allowed share passes.
 */
@Component
public class PaymentPlanBuilder {

    private final PolicyProperties policy;
    private final Clock clock;

    public PaymentPlanBuilder(PolicyProperties policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Check a proposal against the policy limits.
     *
     * @param currentBalance the account balance now, not the one quoted when the proposal was made
     * @return every violated limit, empty when the proposal is acceptable
     */
    public List<PolicyViolation> validate(double currentBalance, PlanProposal proposal) {
        List<PolicyViolation> violations = new ArrayList<>();
        if (!Double.isFinite(proposal.amount())) {
            // Nothing else can be checked against an amount that is not a number
            violations.add(new PolicyViolation(PolicyViolation.INVALID_AMOUNT,
                    "Payment amount must be a finite number, got " + proposal.amount()));
            return violations;
        }
        BigDecimal amount = BigDecimal.valueOf(proposal.amount());

        if (amount.signum() <= 0) {
            violations.add(new PolicyViolation(PolicyViolation.NON_POSITIVE_AMOUNT,
                    "Payment amount must be positive, got " + proposal.amount()));
        }

        switch (proposal.type()) {
            case SETTLEMENT -> {
                if (currentBalance <= 0) {
                    violations.add(new PolicyViolation(PolicyViolation.SETTLEMENT_PERCENTAGE,
                            "No outstanding balance to settle"));
                } else {
                    BigDecimal ceiling = BigDecimal.valueOf(currentBalance)
                            .multiply(BigDecimal.valueOf(policy.maxSettlementPercentage()));
                    if (amount.compareTo(ceiling) > 0) {
                        violations.add(new PolicyViolation(PolicyViolation.SETTLEMENT_PERCENTAGE,
                                String.format("Settlement %.2f is %.1f%% of balance %.2f, above the %.0f%% limit",
                                        proposal.amount(), proposal.amount() / currentBalance * 100,
                                        currentBalance, policy.maxSettlementPercentage() * 100)));
                    }
                }
            }
            case INSTALLMENT -> {
                Integer count = proposal.installments();
                if (count == null || count <= 0) {
                    violations.add(new PolicyViolation(PolicyViolation.INSTALLMENT_COUNT,
                            "Installment plan needs a positive installment count"));
                } else if (count > policy.maxInstallmentMonths()) {
                    violations.add(new PolicyViolation(PolicyViolation.INSTALLMENT_DURATION,
                            String.format("%d installments exceed the maximum of %d",
                                    count, policy.maxInstallmentMonths())));
                }
                if (amount.compareTo(BigDecimal.valueOf(policy.minimumInstallmentAmount())) < 0) {
                    violations.add(new PolicyViolation(PolicyViolation.MINIMUM_PAYMENT,
                            String.format("Installment %.2f is below the minimum of %.2f",
                                    proposal.amount(), policy.minimumInstallmentAmount())));
                }
            }
            case ONE_TIME -> {
                // Only the positive-amount rule applies
            }
        }
        return violations;
    }

    /**
     * Validate the proposal and, when it is acceptable, derive a PROPOSED plan with its schedule.
     * The returned plan has no account or conversation assigned yet.
     */
    public PlanBuildResult build(double currentBalance, PlanProposal proposal) {
        List<PolicyViolation> violations = validate(currentBalance, proposal);
        if (!violations.isEmpty()) {
            return new PlanBuildResult.Rejected(violations);
        }

        int count = proposal.type() == PlanType.INSTALLMENT ? proposal.installments() : 1;
        LocalDate firstDue = proposal.firstDueDate() != null
                ? proposal.firstDueDate()
                : LocalDate.now(clock).plusDays(policy.firstDueDateOffsetDays());
        BigDecimal installment = BigDecimal.valueOf(proposal.amount()).setScale(2, RoundingMode.HALF_UP);
        BigDecimal total = installment.multiply(BigDecimal.valueOf(count));

        PaymentPlan plan = PaymentPlan.builder()
                .planId("PLAN-" + UUID.randomUUID().toString().substring(0, 8))
                .planType(proposal.type())
                .totalAmount(total.doubleValue())
                .installmentAmount(installment.doubleValue())
                .installmentCount(count)
                .firstDueDate(firstDue)
                .frequency(proposal.frequency())
                .status(PlanStatus.PROPOSED)
                .createdAt(clock.millis())
                .scheduledPayments(schedule(firstDue, proposal.frequency(), count, installment.doubleValue()))
                .build();
        return new PlanBuildResult.Built(plan);
    }

    /**
     * Derive the schedule rows. Deterministic: the same inputs always give the same due dates.
     */
    public List<ScheduledPayment> schedule(LocalDate firstDueDate, PaymentFrequency frequency,
                                           int installments, double amount) {
        List<ScheduledPayment> rows = new ArrayList<>(installments);
        for (int i = 0; i < installments; i++) {
            rows.add(ScheduledPayment.builder()
                    .installmentNumber(i + 1)
                    .dueDate(frequency.dueDate(firstDueDate, i))
                    .amount(amount)
                    .build());
        }
        return rows;
    }
}
