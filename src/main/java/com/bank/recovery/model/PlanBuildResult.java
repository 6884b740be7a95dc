package com.bank.recovery.model;

import java.util.List;

/**
 * Either a derived plan with its schedule, or the policy violations that prevented it.
 */
public sealed interface PlanBuildResult {

    record Built(PaymentPlan plan) implements PlanBuildResult {
    }

    record Rejected(List<PolicyViolation> violations) implements PlanBuildResult {
        public Rejected {
            violations = List.copyOf(violations);
        }
    }
}
