package com.bank.recovery.validation;

import com.bank.recovery.model.ConversationContext;
import com.bank.recovery.model.PolicyViolation;
import com.bank.recovery.model.ProposedAction;
import com.bank.recovery.model.ValidatedProposal;
import com.bank.recovery.plan.PaymentPlanBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Gatekeeper between the proposal generator and the conversation state machine.
 *
 * All checks run; none short-circuits. Any violation turns the proposal into an escalation
 * with a neutral hand-off message, no plan and a {@value #VALIDATION_FAILED_TAG} label. The
 * input proposal is never modified.
 */
@Component
public class ResponseValidator {

    private static final Logger log = LoggerFactory.getLogger(ResponseValidator.class);

    public static final String VALIDATION_FAILED_TAG = "validation_failed";

    public static final String HANDOFF_MESSAGE =
            "I need to connect you with a specialist who can better assist with your request. "
                    + "They will contact you shortly.";

    // Threat and legal-action vocabulary, matched as whole words with common inflections
    private static final Pattern PROHIBITED_LANGUAGE = Pattern.compile(
            "\\b(threat(?:en(?:s|ed|ing)?|s)?"
                    + "|sue(?:s|d)?|suing"
                    + "|arrest(?:s|ed|ing)?"
                    + "|jail(?:ed)?"
                    + "|garnish(?:es|ed|ing|ment)?"
                    + "|seiz(?:e|es|ed|ing|ure)"
                    + "|ruin(?:s|ed|ing)?\\s+(?:your\\s+)?credit"
                    + "|legal\\s+action"
                    + "|courts?"
                    + "|lawsuits?)\\b",
            Pattern.CASE_INSENSITIVE);

    // Account facts that may only be discussed with a verified debtor
    private static final Pattern ACCOUNT_DISCLOSURE = Pattern.compile(
            "[$€£]|\\b(balance|amount|usd)\\b",
            Pattern.CASE_INSENSITIVE);

    // Asking for the last payment amount as a verification fact discloses nothing
    private static final Pattern VERIFICATION_FACT_REQUEST = Pattern.compile(
            "\\b(?:last\\s+payment\\s+amount|amount\\s+of\\s+(?:your|the)\\s+last\\s+payment)\\b",
            Pattern.CASE_INSENSITIVE);

    private final PaymentPlanBuilder planBuilder;

    public ResponseValidator(PaymentPlanBuilder planBuilder) {
        this.planBuilder = planBuilder;
    }

    public ValidatedProposal validate(ProposedAction proposal, ConversationContext context) {
        List<PolicyViolation> violations = new ArrayList<>();

        proposal.plan().ifPresent(plan ->
                violations.addAll(planBuilder.validate(context.currentBalance(), plan)));

        Matcher prohibited = PROHIBITED_LANGUAGE.matcher(proposal.message());
        if (prohibited.find()) {
            violations.add(new PolicyViolation(PolicyViolation.PROHIBITED_LANGUAGE,
                    "Message contains prohibited phrase '" + prohibited.group(1).toLowerCase() + "'"));
        }

        if (!context.identityVerified() && disclosesAccountFacts(proposal.message())) {
            violations.add(new PolicyViolation(PolicyViolation.IDENTITY_VERIFICATION,
                    "Account information shared without identity verification"));
        }

        if (violations.isEmpty()) {
            return new ValidatedProposal(proposal, violations, false);
        }

        String codes = violations.stream().map(PolicyViolation::code).distinct().collect(Collectors.joining(", "));
        log.warn("Proposal {} for conversation {} failed validation: {}",
                proposal.type(), context.conversationId(), codes);

        // An escalation the generator already asked for is still rewritten so no offending text goes out,
        // but it does not count as forced
        List<String> labels = new ArrayList<>(proposal.complianceLabels());
        labels.add(VALIDATION_FAILED_TAG);
        ProposedAction replacement = new ProposedAction.Escalate(HANDOFF_MESSAGE,
                "Proposal failed validation: " + codes, proposal.confidence(), labels);
        return new ValidatedProposal(replacement, violations, !proposal.escalation());
    }

    private static boolean disclosesAccountFacts(String message) {
        String remaining = VERIFICATION_FACT_REQUEST.matcher(message).replaceAll(" ");
        return ACCOUNT_DISCLOSURE.matcher(remaining).find();
    }
}
