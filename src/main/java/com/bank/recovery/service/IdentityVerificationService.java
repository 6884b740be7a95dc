package com.bank.recovery.service;

import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.Account;
import com.bank.recovery.model.ClaimedIdentity;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.EscalationPriority;
import com.bank.recovery.model.Message;
import com.bank.recovery.model.MessageRole;
import com.bank.recovery.model.VerificationOutcome;
import com.bank.recovery.model.VerificationResponse;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.repository.DebtorRepository;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs an identity verification attempt as a serialized, committed conversation change.
 */
@Service
public class IdentityVerificationService {

    private final IdentityVerifier identityVerifier;
    private final ConversationRepository conversationRepository;
    private final DebtorRepository debtorRepository;
    private final AccountRepository accountRepository;
    private final ConversationTurnExecutor turnExecutor;
    private final EscalationNotificationService notificationService;
    private final Clock clock;

    public IdentityVerificationService(IdentityVerifier identityVerifier,
                                       ConversationRepository conversationRepository,
                                       DebtorRepository debtorRepository,
                                       AccountRepository accountRepository,
                                       ConversationTurnExecutor turnExecutor,
                                       EscalationNotificationService notificationService,
                                       Clock clock) {
        this.identityVerifier = identityVerifier;
        this.conversationRepository = conversationRepository;
        this.debtorRepository = debtorRepository;
        this.accountRepository = accountRepository;
        this.turnExecutor = turnExecutor;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Observed(name = "identity.verify", contextualName = "verify-identity")
    public VerificationResponse verify(String conversationId, ClaimedIdentity claimed) {
        return turnExecutor.execute(conversationId, () -> {
            Conversation stored = conversationRepository.findById(conversationId);
            if (stored == null) {
                throw RequestValidationException.notFound("Conversation", conversationId);
            }
            Account account = accountRepository.findById(stored.getAccountId());
            if (account == null) {
                throw RequestValidationException.notFound("Account", stored.getAccountId());
            }
            Debtor debtor = debtorRepository.findById(stored.getDebtorId());
            if (debtor == null) {
                throw RequestValidationException.notFound("Debtor", stored.getDebtorId());
            }

            Conversation working = stored.copy();
            int attemptsBefore = working.getVerificationAttempts();
            boolean wasEscalated = working.getState() == ConversationState.ESCALATED;

            IdentityVerifier.Attempt attempt = identityVerifier.verify(working, debtor, account, claimed);
            VerificationOutcome outcome = attempt.outcome();

            // Counted attempts change the conversation and are committed; a repeat on a locked one does not
            if (working.getVerificationAttempts() != attemptsBefore) {
                working.getMessages().add(Message.builder()
                        .messageId(UUID.randomUUID().toString())
                        .role(MessageRole.SYSTEM)
                        .content("Identity verification attempt " + working.getVerificationAttempts() + ": "
                                + describe(outcome))
                        .createdAt(clock.millis())
                        .build());
                working.setLastActivityAt(clock.millis());
                conversationRepository.commit(working);
            }
            identityVerifier.publish(attempt);

            if (!wasEscalated && working.getState() == ConversationState.ESCALATED) {
                notificationService.notifyEscalation(conversationId, working.getAccountId(),
                        working.getEscalationReason(), EscalationPriority.HIGH);
            }
            return toResponse(conversationId, working.getState(), outcome);
        });
    }

    private static String describe(VerificationOutcome outcome) {
        if (outcome instanceof VerificationOutcome.Verified) return "verified";
        if (outcome instanceof VerificationOutcome.Locked) return "failed, verification locked";
        return "failed";
    }

    private static VerificationResponse toResponse(String conversationId, ConversationState state,
                                                   VerificationOutcome outcome) {
        VerificationResponse.VerificationResponseBuilder response = VerificationResponse.builder()
                .conversationId(conversationId)
                .state(state)
                .attemptsRemaining(outcome.attemptsRemaining());
        if (outcome instanceof VerificationOutcome.Verified) {
            return response.verified(true).message("Identity verified successfully.").build();
        }
        if (outcome instanceof VerificationOutcome.Locked) {
            return response.locked(true)
                    .message("Maximum verification attempts exceeded. Escalating to human agent.").build();
        }
        return response.message("Identity verification failed. " + outcome.attemptsRemaining()
                + " attempts remaining.").build();
    }
}
