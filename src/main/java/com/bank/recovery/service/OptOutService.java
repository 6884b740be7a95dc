package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.OptOutResult;
import com.bank.recovery.model.Severity;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.repository.DebtorRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Records a debtor's request to stop all communication.
 */
@Service
public class OptOutService {

    private static final Logger log = LoggerFactory.getLogger(OptOutService.class);

    public static final String CONFIRMATION_MESSAGE = "You have been successfully removed from our contact list.";

    private final DebtorRepository debtorRepository;
    private final ConversationRepository conversationRepository;
    private final ConversationTurnExecutor turnExecutor;
    private final AuditEventSink auditSink;
    private final Clock clock;

    public OptOutService(DebtorRepository debtorRepository,
                         ConversationRepository conversationRepository,
                         ConversationTurnExecutor turnExecutor,
                         AuditEventSink auditSink,
                         Clock clock) {
        this.debtorRepository = debtorRepository;
        this.conversationRepository = conversationRepository;
        this.turnExecutor = turnExecutor;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    /**
     * Opt the debtor out and move each of their open conversations to OPTED_OUT. Repeating the
     * request keeps the original opt-out date.
     *
     * @param conversationId conversation the request arrived on, may be null
     */
    @Observed(name = "debtor.opt_out", contextualName = "opt-out")
    public OptOutResult optOut(String debtorId, String conversationId) {
        Debtor debtor = debtorRepository.findById(debtorId);
        if (debtor == null) {
            throw RequestValidationException.notFound("Debtor", debtorId);
        }

        long optOutAt = debtor.isOptedOut() ? debtor.getOptOutAt() : clock.millis();
        if (!debtor.isOptedOut()) {
            // Written first so the contact gate blocks new turns while conversations are being updated
            debtorRepository.markOptedOut(debtorId, optOutAt);
        }

        int updated = 0;
        for (Conversation conversation : conversationRepository.findByDebtorId(debtorId)) {
            if (optOutConversation(conversation.getConversationId())) {
                updated++;
            }
        }

        auditSink.publish(AuditEvent.builder()
                .eventType(AuditEventType.OPT_OUT)
                .name("opt_out")
                .conversationId(conversationId)
                .debtorId(debtorId)
                .passed(true)
                .severity(Severity.INFO)
                .details("Debtor opted out; " + updated + " conversations updated")
                .build());
        log.info("Debtor {} opted out, {} conversations moved to OPTED_OUT", debtorId, updated);

        return OptOutResult.builder()
                .debtorId(debtorId)
                .optOutAt(optOutAt)
                .conversationsUpdated(updated)
                .message(CONFIRMATION_MESSAGE)
                .build();
    }

    private boolean optOutConversation(String conversationId) {
        return turnExecutor.execute(conversationId, () -> {
            Conversation stored = conversationRepository.findById(conversationId);
            if (stored == null
                    || stored.getState() == ConversationState.CLOSED
                    || stored.getState() == ConversationState.OPTED_OUT) {
                return false;
            }
            Conversation working = stored.copy();
            working.transitionTo(ConversationState.OPTED_OUT);
            working.setLastActivityAt(clock.millis());
            conversationRepository.commit(working);
            return true;
        });
    }
}
