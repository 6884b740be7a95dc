package com.bank.recovery.model;

import java.util.List;

/**
 * Output of the response validator: the proposal that may be acted on, the violations
 * found on the original, and whether the validator replaced it with an escalation.
 */
public record ValidatedProposal(ProposedAction proposal, List<PolicyViolation> violations, boolean forcedEscalation) {

    public ValidatedProposal {
        violations = List.copyOf(violations);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
