package com.bank.recovery.engine.rules;

import com.bank.recovery.engine.ContactCheckContext;
import com.bank.recovery.engine.ContactRule;
import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ContactCheck;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Blocks every contact with a debtor who has opted out, whatever the other inputs.
 */
@Component
public class OptOutRule implements ContactRule {

    @Override
    public ContactCheck getSupportedCheck() {
        return ContactCheck.OPT_OUT;
    }

    @Override
    public ComplianceCheckResult evaluate(ContactCheckContext context) {
        Debtor debtor = context.getDebtor();
        if (debtor.isOptedOut()) {
            return ComplianceCheckResult.failed(ContactCheck.OPT_OUT.checkName(), Severity.CRITICAL,
                    "Debtor opted out on " + Instant.ofEpochMilli(debtor.getOptOutAt()));
        }
        return ComplianceCheckResult.passed(ContactCheck.OPT_OUT.checkName(), "Debtor has not opted out");
    }
}
