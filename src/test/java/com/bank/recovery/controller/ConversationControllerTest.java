package com.bank.recovery.controller;

import com.bank.recovery.exception.ConversationCommitException;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.*;
import com.bank.recovery.service.*;
import com.bank.recovery.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConversationController.class)
class ConversationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ConversationStateMachine stateMachine;

    @MockBean
    private IdentityVerificationService verificationService;

    @MockBean
    private EscalationService escalationService;

    @MockBean
    private ComplianceReportService complianceReportService;

    @MockBean
    private ConversationQueryService queryService;

    @MockBean
    private PaymentService paymentService;

    @Test
    void processMessage_success() throws Exception {
        when(stateMachine.processMessage(any(InboundMessage.class))).thenReturn(TurnResponse.builder()
                .conversationId("CONV-1")
                .outcome(TurnOutcome.PROCESSED)
                .state(ConversationState.IDENTITY_VERIFICATION)
                .action(ActionType.VERIFY_IDENTITY)
                .message("Please verify your identity.")
                .confidence(0.95)
                .complianceTags(List.of("identity_verification_required"))
                .build());

        mockMvc.perform(post("/api/v1/conversations/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new MessageRequest("ACC-1", null, "Hello", Channel.CHAT, Map.of()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("CONV-1"))
                .andExpect(jsonPath("$.outcome").value("PROCESSED"))
                .andExpect(jsonPath("$.state").value("IDENTITY_VERIFICATION"))
                .andExpect(jsonPath("$.complianceTags[0]").value("identity_verification_required"));
    }

    @Test
    void processMessage_blankMessage_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/conversations/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"ACC-1\",\"message\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("message"));

        verify(stateMachine, never()).processMessage(any());
    }

    @Test
    void processMessage_unknownAccount_notFound() throws Exception {
        when(stateMachine.processMessage(any(InboundMessage.class)))
                .thenThrow(RequestValidationException.notFound("Account", "ACC-404"));

        mockMvc.perform(post("/api/v1/conversations/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"ACC-404\",\"message\":\"hi\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Account not found: ACC-404"));
    }

    @Test
    void processMessage_commitConflict_serviceUnavailableAndRetryable() throws Exception {
        when(stateMachine.processMessage(any(InboundMessage.class)))
                .thenThrow(new ConversationCommitException("CONV-1", "Conversation was modified concurrently", true, null));

        mockMvc.perform(post("/api/v1/conversations/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"ACC-1\",\"sessionId\":\"CONV-1\",\"message\":\"hi\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retryable").value(true))
                .andExpect(jsonPath("$.conversationId").value("CONV-1"));
    }

    @Test
    void verifyIdentity_locked() throws Exception {
        when(verificationService.verify(eq("CONV-1"), any(ClaimedIdentity.class))).thenReturn(
                VerificationResponse.builder()
                        .conversationId("CONV-1")
                        .locked(true)
                        .attemptsRemaining(0)
                        .state(ConversationState.ESCALATED)
                        .message("Maximum verification attempts exceeded. Escalating to human agent.")
                        .build());

        mockMvc.perform(post("/api/v1/conversations/CONV-1/verify-identity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lastFourSsn\":\"0000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locked").value(true))
                .andExpect(jsonPath("$.attemptsRemaining").value(0))
                .andExpect(jsonPath("$.state").value("ESCALATED"));
    }

    @Test
    void escalate_success() throws Exception {
        when(escalationService.escalate("CONV-1", "Debtor asked for a supervisor", EscalationPriority.HIGH, null))
                .thenReturn(EscalationResult.builder()
                        .conversationId("CONV-1")
                        .state(ConversationState.ESCALATED)
                        .reason("Debtor asked for a supervisor")
                        .priority(EscalationPriority.HIGH)
                        .estimatedResponseTime("2-4 hours")
                        .newlyEscalated(true)
                        .build());

        mockMvc.perform(post("/api/v1/conversations/CONV-1/escalate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Debtor asked for a supervisor\",\"priority\":\"HIGH\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.estimatedResponseTime").value("2-4 hours"));
    }

    @Test
    void acceptPlan_notVerified_badRequest() throws Exception {
        when(paymentService.acceptPlan("CONV-1", "PLAN-1")).thenThrow(RequestValidationException.invalid(
                "conversationId", "Identity must be verified before accepting a plan"));

        mockMvc.perform(post("/api/v1/conversations/CONV-1/plans/PLAN-1/accept"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("conversationId"));
    }

    @Test
    void getConversation_success() throws Exception {
        Conversation conversation = TestDataFactory.createVerifiedConversation("CONV-1", "DEBTOR-1", "ACC-1");
        when(queryService.getConversation("CONV-1")).thenReturn(new ConversationDetail(conversation,
                "Test Debtor", Channel.CHAT, false, "4000-0000-ACC-1", 1200.0, 45));

        mockMvc.perform(get("/api/v1/conversations/CONV-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation.conversationId").value("CONV-1"))
                .andExpect(jsonPath("$.conversation.state").value("ACTIVE_NEGOTIATION"))
                .andExpect(jsonPath("$.currentBalance").value(1200.0))
                .andExpect(jsonPath("$.conversation.generation").doesNotExist());
    }

    @Test
    void getComplianceReport_success() throws Exception {
        when(complianceReportService.getReport("CONV-1")).thenReturn(ComplianceReport.builder()
                .conversationId("CONV-1")
                .overallStatus("failed")
                .checks(List.of(ComplianceCheckResult.failed("contact_time", Severity.WARNING, "Outside hours")))
                .failedCount(1)
                .build());

        mockMvc.perform(get("/api/v1/conversations/CONV-1/compliance-report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallStatus").value("failed"))
                .andExpect(jsonPath("$.checks[0].checkName").value("contact_time"));
    }
}
