package com.bank.recovery.engine;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ComplianceDecision;
import com.bank.recovery.model.ContactCheck;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.Severity;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether contacting a debtor right now is permitted.
 * Uses the Strategy pattern: each {@link ContactCheck} is handled by a registered {@link ContactRule}.
 * Checks run in {@link ContactCheck} order and stop at the first failure; every evaluated
 * check is published to the audit sink, passed or failed.
 */
@Component
public class ContactComplianceGate {

    private static final Logger log = LoggerFactory.getLogger(ContactComplianceGate.class);

    private final Map<ContactCheck, ContactRule> ruleMap;
    private final AuditEventSink auditSink;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ContactComplianceGate(List<ContactRule> rules, AuditEventSink auditSink, Tracer tracer,
                                 MetricsConfig metricsConfig, Clock clock) {
        this.ruleMap = new EnumMap<>(ContactCheck.class);
        this.auditSink = auditSink;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (ContactRule rule : rules) {
            ruleMap.put(rule.getSupportedCheck(), rule);
            log.info("Registered contact rule: {} -> {}",
                    rule.getSupportedCheck(), rule.getClass().getSimpleName());
        }
        for (ContactCheck check : ContactCheck.values()) {
            if (!ruleMap.containsKey(check)) {
                throw new IllegalStateException("No contact rule registered for " + check);
            }
        }
    }

    /**
     * Evaluate every contact check for the given debtor and conversation.
     *
     * @param debtor               the debtor about to be contacted
     * @param conversation         the conversation the contact belongs to, possibly not yet persisted
     * @param recentContactHistory the debtor's conversations; the current one is counted whether listed or not
     * @return Allowed, or Blocked with the first failing check
     */
    @Observed(name = "compliance.evaluate_contact", contextualName = "evaluate-contact-gate")
    public ComplianceDecision evaluate(Debtor debtor, Conversation conversation, List<Conversation> recentContactHistory) {
        // The conversation being evaluated counts as a contact even before it is first saved
        List<Conversation> history = new ArrayList<>(recentContactHistory);
        boolean listed = history.stream()
                .anyMatch(c -> Objects.equals(c.getConversationId(), conversation.getConversationId()));
        if (!listed) {
            history.add(conversation);
        }

        ContactCheckContext context = ContactCheckContext.builder()
                .debtor(debtor)
                .conversation(conversation)
                .contactHistory(history)
                .now(clock.instant())
                .build();

        List<ComplianceCheckResult> results = new ArrayList<>();
        for (ContactCheck check : ContactCheck.values()) {
            ComplianceCheckResult result = runCheck(check, context);
            results.add(result);
            audit(result, debtor, conversation);

            if (!result.isPassed()) {
                metricsConfig.recordComplianceBlock(result.getCheckName());
                log.info("Contact blocked for debtor {} conversation {} by {}: {}",
                        debtor.getDebtorId(), conversation.getConversationId(),
                        result.getCheckName(), result.getDetails());
                return new ComplianceDecision.Blocked(result.getCheckName(), result.getDetails(),
                        result.getSeverity(), results);
            }
        }
        return new ComplianceDecision.Allowed(results);
    }

    private ComplianceCheckResult runCheck(ContactCheck check, ContactCheckContext context) {
        Span span = tracer.nextSpan()
                .name("compliance.check." + check.checkName())
                .tag("debtor.id", context.getDebtor().getDebtorId())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            ComplianceCheckResult result = ruleMap.get(check).evaluate(context);
            span.tag("check.passed", String.valueOf(result.isPassed()));
            return result;
        } catch (Exception e) {
            // A check that cannot run must not let the contact through
            span.error(e);
            log.error("Error evaluating contact check {} for debtor {}: {}",
                    check, context.getDebtor().getDebtorId(), e.getMessage(), e);
            return ComplianceCheckResult.failed(check.checkName(), Severity.ERROR,
                    "Check could not be evaluated: " + e.getMessage());
        } finally {
            span.end();
        }
    }

    private void audit(ComplianceCheckResult result, Debtor debtor, Conversation conversation) {
        auditSink.publish(AuditEvent.builder()
                .eventType(AuditEventType.CONTACT_COMPLIANCE_CHECK)
                .name(result.getCheckName())
                .conversationId(conversation.getConversationId())
                .debtorId(debtor.getDebtorId())
                .accountId(conversation.getAccountId())
                .passed(result.isPassed())
                .severity(result.getSeverity())
                .details(result.getDetails())
                .build());
    }
}
