package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.*;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EscalationServiceTest {

    @Mock
    private ConversationRepository conversationRepository;
    @Mock
    private AuditEventSink auditSink;
    @Mock
    private EscalationNotificationService notificationService;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private EscalationService service;

    @BeforeEach
    void setUp() {
        service = new EscalationService(conversationRepository, new ConversationTurnExecutor(pool), auditSink,
                notificationService, new MetricsConfig(new SimpleMeterRegistry()), TestDataFactory.fixedClock());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void escalate_activeConversation() {
        when(conversationRepository.findById("CONV-1")).thenReturn(TestDataFactory.createVerifiedConversation(
                "CONV-1", "DEBTOR-1", "ACC-1"));

        EscalationResult result = service.escalate("CONV-1", "Debtor requested a supervisor",
                EscalationPriority.HIGH, "Called twice");

        assertThat(result.isNewlyEscalated()).isTrue();
        assertThat(result.getState()).isEqualTo(ConversationState.ESCALATED);
        assertThat(result.getEstimatedResponseTime()).isEqualTo(EscalationPriority.HIGH.estimatedResponseTime());

        ArgumentCaptor<Conversation> captor = ArgumentCaptor.forClass(Conversation.class);
        verify(conversationRepository).commit(captor.capture());
        assertThat(captor.getValue().getEscalationReason()).isEqualTo("Debtor requested a supervisor");
        assertThat(captor.getValue().getSessionData()).containsEntry("escalationNotes", "Called twice");
        verify(notificationService).notifyEscalation("CONV-1", "ACC-1", "Debtor requested a supervisor",
                EscalationPriority.HIGH);
    }

    @Test
    void escalate_alreadyEscalated_isNoOp() {
        Conversation stored = TestDataFactory.createConversation("CONV-1", "DEBTOR-1", "ACC-1",
                ConversationState.ESCALATED);
        stored.setEscalationReason("Earlier reason");
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        EscalationResult result = service.escalate("CONV-1", "Another reason", null, null);

        assertThat(result.isNewlyEscalated()).isFalse();
        assertThat(result.getReason()).isEqualTo("Earlier reason");
        verify(conversationRepository, never()).commit(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    void escalate_closedConversation_isRejected() {
        when(conversationRepository.findById("CONV-1")).thenReturn(TestDataFactory.createConversation(
                "CONV-1", "DEBTOR-1", "ACC-1", ConversationState.CLOSED));

        assertThatThrownBy(() -> service.escalate("CONV-1", "reason", null, null))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void escalate_blankReason_isRejected() {
        assertThatThrownBy(() -> service.escalate("CONV-1", " ", null, null))
                .isInstanceOf(RequestValidationException.class);
        verifyNoInteractions(conversationRepository);
    }
}
