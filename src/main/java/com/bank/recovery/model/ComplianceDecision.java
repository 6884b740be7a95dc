package com.bank.recovery.model;

import java.util.List;

/**
 * Result of the contact compliance gate. Both variants carry every check that was
 * evaluated, in order, so passed checks can be reported alongside the blocking one.
 */
public sealed interface ComplianceDecision {

    List<ComplianceCheckResult> checks();

    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    record Allowed(List<ComplianceCheckResult> checks) implements ComplianceDecision {
        public Allowed {
            checks = List.copyOf(checks);
        }
    }

    record Blocked(String checkName, String reason, Severity severity, List<ComplianceCheckResult> checks)
            implements ComplianceDecision {
        public Blocked {
            checks = List.copyOf(checks);
        }
    }
}
