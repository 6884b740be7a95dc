package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.EscalationPriority;
import com.bank.recovery.model.EscalationResult;
import com.bank.recovery.model.Severity;
import com.bank.recovery.repository.ConversationRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Manual hand-off of a conversation to a human agent.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    private final ConversationRepository conversationRepository;
    private final ConversationTurnExecutor turnExecutor;
    private final AuditEventSink auditSink;
    private final EscalationNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public EscalationService(ConversationRepository conversationRepository,
                             ConversationTurnExecutor turnExecutor,
                             AuditEventSink auditSink,
                             EscalationNotificationService notificationService,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.conversationRepository = conversationRepository;
        this.turnExecutor = turnExecutor;
        this.auditSink = auditSink;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Escalate a conversation. Escalating an already escalated conversation changes nothing
     * and reports the existing reason.
     *
     * @throws RequestValidationException if the conversation is unknown, closed or opted out
     */
    @Observed(name = "conversation.escalate", contextualName = "escalate-conversation")
    public EscalationResult escalate(String conversationId, String reason, EscalationPriority priority, String notes) {
        if (reason == null || reason.isBlank()) {
            throw RequestValidationException.invalid("reason", "Escalation reason is required");
        }
        EscalationPriority effectivePriority = priority != null ? priority : EscalationPriority.NORMAL;

        return turnExecutor.execute(conversationId, () -> {
            Conversation stored = conversationRepository.findById(conversationId);
            if (stored == null) {
                throw RequestValidationException.notFound("Conversation", conversationId);
            }
            if (stored.getState() == ConversationState.ESCALATED) {
                return result(stored, effectivePriority, false);
            }
            if (stored.getState().isTerminal()) {
                throw RequestValidationException.invalid("conversationId",
                        "Conversation is " + stored.getState() + " and cannot be escalated");
            }

            Conversation working = stored.copy();
            working.escalate(reason, clock.millis());
            working.getSessionData().put("escalationPriority", effectivePriority.name());
            if (notes != null && !notes.isBlank()) {
                working.getSessionData().put("escalationNotes", notes);
            }
            working.setLastActivityAt(clock.millis());
            conversationRepository.commit(working);

            metricsConfig.recordEscalation("manual");
            auditSink.publish(AuditEvent.builder()
                    .eventType(AuditEventType.ESCALATION)
                    .name("manual")
                    .conversationId(conversationId)
                    .debtorId(working.getDebtorId())
                    .accountId(working.getAccountId())
                    .passed(true)
                    .severity(Severity.WARNING)
                    .details(reason)
                    .build());
            notificationService.notifyEscalation(conversationId, working.getAccountId(), reason, effectivePriority);
            log.info("Conversation {} escalated manually, priority={}", conversationId, effectivePriority);

            return result(working, effectivePriority, true);
        });
    }

    private static EscalationResult result(Conversation conversation, EscalationPriority priority, boolean newlyEscalated) {
        return EscalationResult.builder()
                .conversationId(conversation.getConversationId())
                .state(conversation.getState())
                .reason(conversation.getEscalationReason())
                .priority(priority)
                .estimatedResponseTime(priority.estimatedResponseTime())
                .escalatedAt(conversation.getEscalatedAt())
                .newlyEscalated(newlyEscalated)
                .build();
    }
}
