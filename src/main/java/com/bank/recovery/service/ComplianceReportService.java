package com.bank.recovery.service;

import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.ComplianceCheckResult;
import com.bank.recovery.model.ComplianceReport;
import com.bank.recovery.model.Severity;
import com.bank.recovery.repository.AuditEventRepository;
import com.bank.recovery.repository.ConversationRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a compliance report for a conversation from its recorded audit trail.
 */
@Service
public class ComplianceReportService {

    private static final Set<AuditEventType> REPORTED_TYPES = EnumSet.of(
            AuditEventType.CONTACT_COMPLIANCE_CHECK,
            AuditEventType.PROPOSAL_VALIDATION,
            AuditEventType.GENERATOR_COMPLIANCE_LABEL,
            AuditEventType.VERIFICATION_ATTEMPT,
            AuditEventType.GENERATION_FALLBACK);

    private final AuditEventRepository auditEventRepository;
    private final ConversationRepository conversationRepository;
    private final Clock clock;

    public ComplianceReportService(AuditEventRepository auditEventRepository,
                                   ConversationRepository conversationRepository,
                                   Clock clock) {
        this.auditEventRepository = auditEventRepository;
        this.conversationRepository = conversationRepository;
        this.clock = clock;
    }

    public ComplianceReport getReport(String conversationId) {
        if (conversationRepository.findById(conversationId) == null) {
            throw RequestValidationException.notFound("Conversation", conversationId);
        }

        List<ComplianceCheckResult> checks = auditEventRepository.findByConversationId(conversationId).stream()
                .filter(e -> REPORTED_TYPES.contains(e.getEventType()))
                .map(ComplianceReportService::toCheck)
                .toList();

        int failed = (int) checks.stream().filter(c -> !c.isPassed()).count();
        boolean critical = checks.stream()
                .anyMatch(c -> !c.isPassed()
                        && (c.getSeverity() == Severity.CRITICAL || c.getSeverity() == Severity.ERROR));

        String overall = critical ? "failed" : failed > 0 ? "warning" : "passed";

        return ComplianceReport.builder()
                .conversationId(conversationId)
                .overallStatus(overall)
                .checks(checks)
                .failedCount(failed)
                .requiresHumanReview(!"passed".equals(overall))
                .generatedAt(clock.millis())
                .build();
    }

    private static ComplianceCheckResult toCheck(AuditEvent event) {
        return ComplianceCheckResult.builder()
                .checkName(event.getName())
                .passed(event.isPassed())
                .severity(event.getSeverity() != null ? event.getSeverity() : Severity.INFO)
                .details(event.getDetails())
                .build();
    }
}
