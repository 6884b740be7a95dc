package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.audit.PiiMasker;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.Account;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.ClaimedIdentity;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.Severity;
import com.bank.recovery.model.VerificationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Multi-attempt identity check with lockout.
 *
 * Operates on the caller's working copy of the conversation; the caller commits it and then
 * hands the returned {@link Attempt} to {@link #publish(Attempt)}. Every counted attempt is audited.
 */
@Component
public class IdentityVerifier {

    private static final Logger log = LoggerFactory.getLogger(IdentityVerifier.class);

    public static final String LOCKOUT_REASON = "Identity verification attempts exhausted";

    private static final BigDecimal AMOUNT_TOLERANCE = new BigDecimal("0.01");

    private final PolicyProperties policy;
    private final AuditEventSink auditSink;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public IdentityVerifier(PolicyProperties policy, AuditEventSink auditSink,
                            MetricsConfig metricsConfig, Clock clock) {
        this.policy = policy;
        this.auditSink = auditSink;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Result of one call: the outcome and the audit events it produced, not yet published.
     *
     * @param metric    verification counter tag, null when nothing was checked
     * @param lockedOut whether this call exhausted the attempts and escalated the conversation
     */
    public record Attempt(VerificationOutcome outcome, List<AuditEvent> events, String metric, boolean lockedOut) {
        public Attempt {
            events = List.copyOf(events);
        }
    }

    /**
     * Check the claimed facts. Each supplied fact must match; a fact left out is not checked.
     *
     * @throws RequestValidationException if no fact is supplied or the conversation is closed to verification
     */
    public Attempt verify(Conversation conversation, Debtor debtor, Account account, ClaimedIdentity claimed) {
        int max = policy.maxVerificationAttempts();

        if (conversation.isIdentityVerified()) {
            return new Attempt(new VerificationOutcome.Verified(Math.max(0, max - conversation.getVerificationAttempts())),
                    List.of(), null, false);
        }
        if (conversation.getVerificationAttempts() >= max) {
            return new Attempt(new VerificationOutcome.Locked(),
                    List.of(attemptEvent(conversation, false, Severity.CRITICAL,
                            "Verification locked after " + max + " attempts")),
                    "locked", false);
        }
        if (conversation.getState().isTerminal()) {
            throw RequestValidationException.invalid("conversationId",
                    "Conversation is " + conversation.getState() + ", identity can no longer be verified");
        }
        if (claimed == null || claimed.isEmpty()) {
            throw RequestValidationException.invalid("claimedIdentity", "At least one identity fact is required");
        }

        conversation.setVerificationAttempts(conversation.getVerificationAttempts() + 1);
        int remaining = max - conversation.getVerificationAttempts();

        boolean identifierOk = isBlank(claimed.identifierLastFour())
                || claimed.identifierLastFour().trim().equals(debtor.getIdentifierLastFour());
        boolean paymentOk = isBlank(claimed.lastPaymentAmount())
                || amountMatches(claimed.lastPaymentAmount(), account.getLastPaymentAmount());

        log.info("Verification attempt {}/{} for conversation {}: identifier={} lastPayment={} -> {}",
                conversation.getVerificationAttempts(), max, conversation.getConversationId(),
                PiiMasker.maskFact(claimed.identifierLastFour()), PiiMasker.maskFact(claimed.lastPaymentAmount()),
                identifierOk && paymentOk ? "match" : "mismatch");

        if (identifierOk && paymentOk) {
            conversation.setIdentityVerified(true);
            conversation.transitionTo(ConversationState.ACTIVE_NEGOTIATION);
            conversation.getSessionData().put("verifiedAt", String.valueOf(clock.millis()));
            return new Attempt(new VerificationOutcome.Verified(remaining),
                    List.of(attemptEvent(conversation, true, Severity.INFO, "Identity verified")),
                    "verified", false);
        }

        if (remaining <= 0) {
            conversation.escalate(LOCKOUT_REASON, clock.millis());
            AuditEvent escalation = AuditEvent.builder()
                    .eventType(AuditEventType.ESCALATION)
                    .name("verification_lockout")
                    .conversationId(conversation.getConversationId())
                    .debtorId(conversation.getDebtorId())
                    .accountId(conversation.getAccountId())
                    .passed(false)
                    .severity(Severity.WARNING)
                    .details(LOCKOUT_REASON)
                    .build();
            return new Attempt(new VerificationOutcome.Locked(),
                    List.of(attemptEvent(conversation, false, Severity.CRITICAL,
                            "Verification failed, attempts exhausted"), escalation),
                    "locked", true);
        }

        return new Attempt(new VerificationOutcome.Failed(remaining),
                List.of(attemptEvent(conversation, false, Severity.WARNING,
                        "Identity verification failed, " + remaining + " attempts remaining")),
                "failed", false);
    }

    /**
     * Count and audit an attempt. Called once its conversation change, if any, has been stored.
     */
    public void publish(Attempt attempt) {
        if (attempt.metric() != null) {
            metricsConfig.recordVerification(attempt.metric());
        }
        if (attempt.lockedOut()) {
            metricsConfig.recordEscalation("verification_lockout");
        }
        attempt.events().forEach(auditSink::publish);
    }

    private boolean amountMatches(String claimed, double recorded) {
        try {
            BigDecimal value = new BigDecimal(claimed.trim().replace("$", "").replace(",", ""));
            return value.subtract(BigDecimal.valueOf(recorded)).abs().compareTo(AMOUNT_TOLERANCE) <= 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static AuditEvent attemptEvent(Conversation conversation, boolean passed, Severity severity,
                                           String details) {
        return AuditEvent.builder()
                .eventType(AuditEventType.VERIFICATION_ATTEMPT)
                .name("identity_verification")
                .conversationId(conversation.getConversationId())
                .debtorId(conversation.getDebtorId())
                .accountId(conversation.getAccountId())
                .passed(passed)
                .severity(severity)
                .details(details)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
