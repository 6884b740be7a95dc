package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.Account;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.DebtValidationResult;
import com.bank.recovery.model.EscalationPriority;
import com.bank.recovery.model.Severity;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.ConversationRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Handles a debtor's request to validate the debt: active negotiations on the account pause
 * and go to a human agent.
 */
@Service
public class DebtValidationService {

    private static final Logger log = LoggerFactory.getLogger(DebtValidationService.class);

    public static final String VALIDATION_REASON = "Debt validation requested";
    public static final String CONFIRMATION_MESSAGE = "Your debt validation request has been received. "
            + "Collection activities have been paused pending validation.";
    public static final String NEXT_STEPS =
            "You will receive validation documentation within 30 days as required by law.";

    private final AccountRepository accountRepository;
    private final ConversationRepository conversationRepository;
    private final ConversationTurnExecutor turnExecutor;
    private final AuditEventSink auditSink;
    private final EscalationNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public DebtValidationService(AccountRepository accountRepository,
                                 ConversationRepository conversationRepository,
                                 ConversationTurnExecutor turnExecutor,
                                 AuditEventSink auditSink,
                                 EscalationNotificationService notificationService,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.accountRepository = accountRepository;
        this.conversationRepository = conversationRepository;
        this.turnExecutor = turnExecutor;
        this.auditSink = auditSink;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "account.debt_validation", contextualName = "request-debt-validation")
    public DebtValidationResult requestValidation(String accountId, String conversationId) {
        Account account = accountRepository.findById(accountId);
        if (account == null) {
            throw RequestValidationException.notFound("Account", accountId);
        }

        int escalated = 0;
        for (Conversation conversation : conversationRepository.findByAccountId(accountId)) {
            if (escalateIfNegotiating(conversation.getConversationId())) {
                escalated++;
            }
        }

        auditSink.publish(AuditEvent.builder()
                .eventType(AuditEventType.DEBT_VALIDATION)
                .name("debt_validation_request")
                .conversationId(conversationId)
                .debtorId(account.getDebtorId())
                .accountId(accountId)
                .passed(true)
                .severity(Severity.INFO)
                .details(VALIDATION_REASON + "; " + escalated + " conversations escalated")
                .build());
        log.info("Debt validation requested for account {}, {} conversations escalated", accountId, escalated);

        return DebtValidationResult.builder()
                .accountId(accountId)
                .conversationsEscalated(escalated)
                .message(CONFIRMATION_MESSAGE)
                .nextSteps(NEXT_STEPS)
                .build();
    }

    private boolean escalateIfNegotiating(String conversationId) {
        boolean escalated = turnExecutor.execute(conversationId, () -> {
            Conversation stored = conversationRepository.findById(conversationId);
            if (stored == null || stored.getState() != ConversationState.ACTIVE_NEGOTIATION) {
                return false;
            }
            Conversation working = stored.copy();
            working.escalate(VALIDATION_REASON, clock.millis());
            working.setLastActivityAt(clock.millis());
            conversationRepository.commit(working);
            return true;
        });
        if (escalated) {
            metricsConfig.recordEscalation("debt_validation");
            notificationService.notifyEscalation(conversationId, null, VALIDATION_REASON, EscalationPriority.HIGH);
        }
        return escalated;
    }
}
