package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.config.PolicyProperties;
import com.bank.recovery.exception.ConversationCommitException;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.*;
import com.bank.recovery.plan.PaymentPlanBuilder;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.repository.PaymentRepository;
import com.bank.recovery.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    @Mock
    private ConversationRepository conversationRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private AuditEventSink auditSink;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final PaymentPlanBuilder planBuilder =
            new PaymentPlanBuilder(PolicyProperties.defaults(), TestDataFactory.fixedClock());
    private PaymentService service;

    @BeforeEach
    void setUp() {
        service = new PaymentService(conversationRepository, accountRepository, paymentRepository,
                new ConversationTurnExecutor(pool), auditSink, new MetricsConfig(new SimpleMeterRegistry()),
                TestDataFactory.fixedClock());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private PaymentPlan plan(PlanStatus status, int installments) {
        PaymentPlan plan = ((PlanBuildResult.Built) planBuilder.build(1200,
                PlanProposal.installment(200, installments, LocalDate.of(2025, 11, 10), PaymentFrequency.MONTHLY)))
                .plan();
        plan.setStatus(status);
        plan.setAccountId("ACC-1");
        plan.setConversationId("CONV-1");
        return plan;
    }

    @Test
    void acceptPlan_movesPlanAndConversationForward() {
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        PaymentPlan proposed = plan(PlanStatus.PROPOSED, 6);
        stored.getPaymentPlans().add(proposed);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        PaymentPlan accepted = service.acceptPlan("CONV-1", proposed.getPlanId());

        assertThat(accepted.getStatus()).isEqualTo(PlanStatus.ACCEPTED);
        assertThat(accepted.getAcceptedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        ArgumentCaptor<Conversation> captor = ArgumentCaptor.forClass(Conversation.class);
        verify(conversationRepository).commit(captor.capture());
        assertThat(captor.getValue().getState()).isEqualTo(ConversationState.PAYMENT_PROCESSING);
        verify(auditSink).publish(argThat(e -> e.getEventType() == AuditEventType.PLAN_ACCEPTED));
    }

    @Test
    void acceptPlan_requiresVerifiedDebtor() {
        Conversation stored = TestDataFactory.createConversation("CONV-1", "DEBTOR-1", "ACC-1",
                ConversationState.IDENTITY_VERIFICATION);
        stored.getPaymentPlans().add(plan(PlanStatus.PROPOSED, 6));
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        assertThatThrownBy(() -> service.acceptPlan("CONV-1", stored.getPaymentPlans().get(0).getPlanId()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("verified");
        verify(conversationRepository, never()).commit(any());
    }

    @Test
    void acceptPlan_alreadyAccepted_isRejected() {
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        PaymentPlan plan = plan(PlanStatus.ACCEPTED, 6);
        stored.getPaymentPlans().add(plan);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        assertThatThrownBy(() -> service.acceptPlan("CONV-1", plan.getPlanId()))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void recordPayment_allocatesEarliestPendingInstallment() {
        Account account = TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 1200);
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        stored.getPaymentPlans().add(plan(PlanStatus.ACCEPTED, 6));
        when(accountRepository.findById("ACC-1")).thenReturn(account);
        when(conversationRepository.findByAccountId("ACC-1")).thenReturn(List.of(stored));

        PaymentReceipt receipt = service.recordPayment(new PaymentRequest("ACC-1", null, 200, "ACH"));

        assertThat(receipt.getTransactionId()).startsWith("TXN-");
        assertThat(receipt.getNewBalance()).isEqualTo(1000.0);
        assertThat(receipt.getAllocatedInstallment()).isEqualTo(1);
        assertThat(receipt.getPlanStatus()).isEqualTo(PlanStatus.ACTIVE);

        ArgumentCaptor<Conversation> captor = ArgumentCaptor.forClass(Conversation.class);
        verify(conversationRepository).commit(captor.capture());
        ScheduledPayment first = captor.getValue().getPaymentPlans().get(0).getScheduledPayments().get(0);
        assertThat(first.getStatus()).isEqualTo(ScheduledPaymentStatus.PAID);
        assertThat(first.getTransactionId()).isEqualTo(receipt.getTransactionId());

        verify(accountRepository).save(argThat(a -> a.getCurrentBalance() == 1000.0 && a.getLastPaymentAmount() == 200.0));
        verify(paymentRepository).save(argThat(p -> "CONV-1".equals(p.getConversationId())
                && p.getAllocatedPlanId() != null));
    }

    @Test
    void recordPayment_lastInstallment_completesPlan() {
        Account account = TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 200);
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        stored.getPaymentPlans().add(plan(PlanStatus.ACCEPTED, 1));
        when(accountRepository.findById("ACC-1")).thenReturn(account);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        PaymentReceipt receipt = service.recordPayment(new PaymentRequest("ACC-1", "CONV-1", 200, "CARD"));

        assertThat(receipt.getPlanStatus()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(receipt.getNewBalance()).isZero();
    }

    @Test
    void recordPayment_underpayment_leavesInstallmentPendingWithPartialAmount() {
        Account account = TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 1200);
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        stored.getPaymentPlans().add(plan(PlanStatus.ACCEPTED, 6));
        when(accountRepository.findById("ACC-1")).thenReturn(account);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        PaymentReceipt receipt = service.recordPayment(new PaymentRequest("ACC-1", "CONV-1", 150, "ACH"));

        assertThat(receipt.getNewBalance()).isEqualTo(1050.0);
        assertThat(receipt.getAllocatedInstallment()).isEqualTo(1);
        assertThat(receipt.getPlanStatus()).isEqualTo(PlanStatus.ACTIVE);
        ArgumentCaptor<Conversation> captor = ArgumentCaptor.forClass(Conversation.class);
        verify(conversationRepository).commit(captor.capture());
        ScheduledPayment first = captor.getValue().getPaymentPlans().get(0).getScheduledPayments().get(0);
        assertThat(first.getStatus()).isEqualTo(ScheduledPaymentStatus.PENDING);
        assertThat(first.getPaidAmount()).isEqualTo(150.0);
        assertThat(first.getPaidAt()).isZero();
    }

    @Test
    void recordPayment_topUpCompletesInstallmentAndCarriesRemainderForward() {
        Account account = TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 1050);
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        PaymentPlan plan = plan(PlanStatus.ACTIVE, 6);
        plan.getScheduledPayments().get(0).setPaidAmount(150);
        stored.getPaymentPlans().add(plan);
        when(accountRepository.findById("ACC-1")).thenReturn(account);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);

        PaymentReceipt receipt = service.recordPayment(new PaymentRequest("ACC-1", "CONV-1", 100, "ACH"));

        assertThat(receipt.getAllocatedInstallment()).isEqualTo(1);
        ArgumentCaptor<Conversation> captor = ArgumentCaptor.forClass(Conversation.class);
        verify(conversationRepository).commit(captor.capture());
        List<ScheduledPayment> rows = captor.getValue().getPaymentPlans().get(0).getScheduledPayments();
        assertThat(rows.get(0).getStatus()).isEqualTo(ScheduledPaymentStatus.PAID);
        assertThat(rows.get(0).getPaidAmount()).isEqualTo(200.0);
        assertThat(rows.get(0).getPaidAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(rows.get(1).getStatus()).isEqualTo(ScheduledPaymentStatus.PENDING);
        assertThat(rows.get(1).getPaidAmount()).isEqualTo(50.0);
    }

    @Test
    void recordPayment_accountSaveFailure_commitsNothing() {
        Account account = TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 1200);
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        stored.getPaymentPlans().add(plan(PlanStatus.ACCEPTED, 6));
        when(accountRepository.findById("ACC-1")).thenReturn(account);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);
        doThrow(new IllegalStateException("account store unavailable")).when(accountRepository).save(any());

        assertThatThrownBy(() -> service.recordPayment(new PaymentRequest("ACC-1", "CONV-1", 200, "ACH")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("account store unavailable");

        verify(conversationRepository, never()).commit(any());
        verify(paymentRepository, never()).save(any());
        verifyNoInteractions(auditSink);
        assertThat(stored.getPaymentPlans().get(0).getScheduledPayments().get(0).getStatus())
                .isEqualTo(ScheduledPaymentStatus.PENDING);
    }

    @Test
    void recordPayment_planCommitFailure_restoresBalance() {
        Account account = TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 1200);
        Conversation stored = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        stored.getPaymentPlans().add(plan(PlanStatus.ACCEPTED, 6));
        when(accountRepository.findById("ACC-1")).thenReturn(account);
        when(conversationRepository.findById("CONV-1")).thenReturn(stored);
        doThrow(new ConversationCommitException("CONV-1", "Concurrent modification", true, null))
                .when(conversationRepository).commit(any());

        assertThatThrownBy(() -> service.recordPayment(new PaymentRequest("ACC-1", "CONV-1", 200, "ACH")))
                .isInstanceOf(ConversationCommitException.class);

        InOrder order = inOrder(accountRepository, conversationRepository);
        order.verify(accountRepository).save(account);
        order.verify(conversationRepository).commit(any());
        order.verify(accountRepository).save(account);
        assertThat(account.getCurrentBalance()).isEqualTo(1200.0);
        assertThat(account.getLastPaymentAmount()).isEqualTo(150.0);
        assertThat(account.getLastPaymentAt()).isEqualTo(TestDataFactory.NOW.minusSeconds(86_400L * 40).toEpochMilli());
        verify(paymentRepository, never()).save(any());
        verifyNoInteractions(auditSink);
    }

    @Test
    void recordPayment_withoutPendingPlan_isUnallocated() {
        when(accountRepository.findById("ACC-1")).thenReturn(TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 500));
        when(conversationRepository.findByAccountId("ACC-1")).thenReturn(List.of());

        PaymentReceipt receipt = service.recordPayment(new PaymentRequest("ACC-1", null, 50, "ACH"));

        assertThat(receipt.getAllocatedPlanId()).isNull();
        assertThat(receipt.getPlanStatus()).isNull();
        assertThat(receipt.getNewBalance()).isEqualTo(450.0);
        verify(conversationRepository, never()).commit(any());
    }

    @Test
    void recordPayment_aboveBalance_isRejected() {
        when(accountRepository.findById("ACC-1")).thenReturn(TestDataFactory.createAccount("ACC-1", "DEBTOR-1", 100));

        assertThatThrownBy(() -> service.recordPayment(new PaymentRequest("ACC-1", null, 100.01, "ACH")))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("exceeds");
        verify(accountRepository, never()).save(any());
        verify(paymentRepository, never()).save(any());
    }

    @Test
    void recordPayment_nonPositiveAmount_isRejected() {
        assertThatThrownBy(() -> service.recordPayment(new PaymentRequest("ACC-1", null, 0, "ACH")))
                .isInstanceOf(RequestValidationException.class);
        verifyNoInteractions(accountRepository);
    }
}
