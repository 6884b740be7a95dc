package com.bank.recovery.service;

import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.*;
import com.bank.recovery.repository.AuditEventRepository;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComplianceReportServiceTest {

    @Mock
    private AuditEventRepository auditEventRepository;
    @Mock
    private ConversationRepository conversationRepository;

    private ComplianceReportService service;

    @BeforeEach
    void setUp() {
        service = new ComplianceReportService(auditEventRepository, conversationRepository,
                TestDataFactory.fixedClock());
    }

    private static AuditEvent event(AuditEventType type, String name, boolean passed, Severity severity) {
        return AuditEvent.builder()
                .eventType(type)
                .name(name)
                .conversationId("CONV-1")
                .passed(passed)
                .severity(severity)
                .details(name)
                .build();
    }

    @Test
    void allPassed_reportsPassed() {
        when(conversationRepository.findById("CONV-1")).thenReturn(
                TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1", ConversationState.INITIATED));
        when(auditEventRepository.findByConversationId("CONV-1")).thenReturn(List.of(
                event(AuditEventType.CONTACT_COMPLIANCE_CHECK, "opt_out_status", true, Severity.INFO),
                event(AuditEventType.PROPOSAL_VALIDATION, "response_validation", true, Severity.INFO),
                event(AuditEventType.PLAN_CREATED, "installment", true, Severity.INFO)));

        ComplianceReport report = service.getReport("CONV-1");

        assertThat(report.getOverallStatus()).isEqualTo("passed");
        assertThat(report.getChecks()).hasSize(2);
        assertThat(report.isRequiresHumanReview()).isFalse();
        assertThat(report.getGeneratedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
    }

    @Test
    void nonCriticalFailure_reportsWarning() {
        when(conversationRepository.findById("CONV-1")).thenReturn(
                TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1", ConversationState.INITIATED));
        when(auditEventRepository.findByConversationId("CONV-1")).thenReturn(List.of(
                event(AuditEventType.CONTACT_COMPLIANCE_CHECK, "opt_out_status", true, Severity.INFO),
                event(AuditEventType.PROPOSAL_VALIDATION, "response_validation", false, Severity.WARNING)));

        ComplianceReport report = service.getReport("CONV-1");

        assertThat(report.getOverallStatus()).isEqualTo("warning");
        assertThat(report.getFailedCount()).isEqualTo(1);
        assertThat(report.isRequiresHumanReview()).isTrue();
    }

    @Test
    void criticalFailure_requiresHumanReview() {
        when(conversationRepository.findById("CONV-1")).thenReturn(
                TestDataFactory.createConversation("CONV-1", "D-1", "ACC-1", ConversationState.ESCALATED));
        when(auditEventRepository.findByConversationId("CONV-1")).thenReturn(List.of(
                event(AuditEventType.VERIFICATION_ATTEMPT, "identity_verification", false, Severity.WARNING),
                event(AuditEventType.VERIFICATION_ATTEMPT, "identity_verification", false, Severity.CRITICAL)));

        ComplianceReport report = service.getReport("CONV-1");

        assertThat(report.getOverallStatus()).isEqualTo("failed");
        assertThat(report.getFailedCount()).isEqualTo(2);
        assertThat(report.isRequiresHumanReview()).isTrue();
    }

    @Test
    void unknownConversation_isNotFound() {
        assertThatThrownBy(() -> service.getReport("CONV-404")).isInstanceOf(RequestValidationException.class);
    }
}
