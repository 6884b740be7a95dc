package com.bank.recovery.generation;

import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.model.ConversationContext;
import com.bank.recovery.model.PaymentFrequency;
import com.bank.recovery.model.PlanProposal;
import com.bank.recovery.model.ProposedAction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic keyword-routed generator. Used when no external generator is configured so
 * the service works end to end; it proposes only plans that stay inside the policy limits.
 */
public class ScriptedProposalGenerator implements ProposalGenerator {

    private static final List<String> ESCALATION_TRIGGERS = List.of(
            "lawyer", "attorney", "bankruptcy", "dispute", "validation", "not my debt",
            "supervisor", "manager", "harass", "hardship");

    private static final int PREFERRED_INSTALLMENTS = 6;

    private final PolicyProperties policy;

    public ScriptedProposalGenerator(PolicyProperties policy) {
        this.policy = policy;
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String text = request.userMessage() == null ? "" : request.userMessage().toLowerCase(Locale.ROOT);
        ConversationContext context = request.context();

        for (String trigger : ESCALATION_TRIGGERS) {
            if (text.contains(trigger)) {
                return generated(new ProposedAction.Escalate(
                        "I understand. I'm connecting you with a specialist who can help with this.",
                        "Debtor raised: " + trigger, 0.9, List.of("escalation_trigger")));
            }
        }

        if (!context.identityVerified()) {
            return generated(new ProposedAction.VerifyIdentity(
                    "Before we discuss your account, I need to verify your identity. Please provide the last "
                            + "four digits of your Social Security number and the amount of your last payment.",
                    0.95, false, List.of("identity_verification_required")));
        }

        double balance = context.currentBalance();
        if (balance <= 0 && (text.contains("settle") || text.contains("plan") || text.contains("pay"))) {
            return generated(new ProposedAction.Inform(
                    "Your account has no outstanding balance.", 0.9, false, List.of()));
        }

        if (text.contains("settle")) {
            double amount = BigDecimal.valueOf(balance)
                    .multiply(BigDecimal.valueOf(policy.maxSettlementPercentage()))
                    .setScale(2, RoundingMode.DOWN)
                    .doubleValue();
            return generated(new ProposedAction.ProposePlan(
                    String.format("I can offer a one-time settlement of $%,.2f to resolve this account in full.", amount),
                    PlanProposal.settlement(amount), 0.8, false, List.of("settlement_within_policy")));
        }

        if (text.contains("plan") || text.contains("installment") || text.contains("monthly")) {
            int count = Math.min(PREFERRED_INSTALLMENTS, policy.maxInstallmentMonths());
            BigDecimal amount = BigDecimal.valueOf(balance).divide(BigDecimal.valueOf(count), 2, RoundingMode.UP);
            if (amount.doubleValue() < policy.minimumInstallmentAmount()) {
                count = Math.max(1, (int) Math.floor(balance / policy.minimumInstallmentAmount()));
                amount = BigDecimal.valueOf(balance).divide(BigDecimal.valueOf(count), 2, RoundingMode.UP);
            }
            return generated(new ProposedAction.ProposePlan(
                    String.format("I can set up a %d-month payment plan with monthly payments of $%,.2f.",
                            count, amount.doubleValue()),
                    PlanProposal.installment(amount.doubleValue(), count, null, PaymentFrequency.MONTHLY),
                    0.85, false, List.of("installment_within_policy")));
        }

        if (text.contains("pay")) {
            return generated(new ProposedAction.CollectPayment(
                    String.format("You can pay the full balance of $%,.2f today.", balance),
                    PlanProposal.oneTime(balance), 0.85, false, List.of()));
        }

        if (text.contains("bye") || text.contains("that's all") || text.contains("no thanks")) {
            return generated(new ProposedAction.Close(
                    "Thank you for your time. Have a good day.", 0.9, false, List.of()));
        }

        return generated(new ProposedAction.Inform(
                "I'm here to help you resolve your account. You can ask about a payment plan, "
                        + "a settlement, or paying in full.", 0.7, false, List.of()));
    }

    private static GenerationResult generated(ProposedAction action) {
        return new GenerationResult.Generated(action);
    }
}
