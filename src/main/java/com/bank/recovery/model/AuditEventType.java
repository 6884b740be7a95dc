package com.bank.recovery.model;

public enum AuditEventType {
    CONTACT_COMPLIANCE_CHECK,
    PROPOSAL_VALIDATION,
    GENERATOR_COMPLIANCE_LABEL,
    GENERATION_FALLBACK,
    VERIFICATION_ATTEMPT,
    ESCALATION,
    PLAN_CREATED,
    PLAN_ACCEPTED,
    PAYMENT,
    OPT_OUT,
    DEBT_VALIDATION
}
