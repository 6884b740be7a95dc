package com.bank.recovery.engine;

import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ContactCheck;

/**
 * One regulatory contact check. Each implementation handles a single {@link ContactCheck}.
 */
public interface ContactRule {

    ContactCheck getSupportedCheck();

    /**
     * @return the outcome of this check; a failed result blocks the contact
     */
    ComplianceCheckResult evaluate(ContactCheckContext context);
}
