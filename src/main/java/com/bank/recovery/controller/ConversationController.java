package com.bank.recovery.controller;

import com.bank.recovery.model.ComplianceReport;
import com.bank.recovery.model.ConversationDetail;
import com.bank.recovery.model.EscalationRequest;
import com.bank.recovery.model.EscalationResult;
import com.bank.recovery.model.MessageRequest;
import com.bank.recovery.model.PaymentPlan;
import com.bank.recovery.model.TurnResponse;
import com.bank.recovery.model.VerificationResponse;
import com.bank.recovery.model.VerifyIdentityRequest;
import com.bank.recovery.service.ComplianceReportService;
import com.bank.recovery.service.ConversationQueryService;
import com.bank.recovery.service.ConversationStateMachine;
import com.bank.recovery.service.EscalationService;
import com.bank.recovery.service.IdentityVerificationService;
import com.bank.recovery.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/conversations")
@Tag(name = "Conversations", description = "Debtor message turns, identity verification, escalation and compliance reports")
public class ConversationController {

    private final ConversationStateMachine stateMachine;
    private final IdentityVerificationService verificationService;
    private final EscalationService escalationService;
    private final ComplianceReportService complianceReportService;
    private final ConversationQueryService queryService;
    private final PaymentService paymentService;

    public ConversationController(ConversationStateMachine stateMachine,
                                  IdentityVerificationService verificationService,
                                  EscalationService escalationService,
                                  ComplianceReportService complianceReportService,
                                  ConversationQueryService queryService,
                                  PaymentService paymentService) {
        this.stateMachine = stateMachine;
        this.verificationService = verificationService;
        this.escalationService = escalationService;
        this.complianceReportService = complianceReportService;
        this.queryService = queryService;
        this.paymentService = paymentService;
    }

    @Operation(summary = "Process a debtor message",
            description = "Runs one conversation turn: contact compliance checks, proposal generation, " +
                    "proposal validation and the resulting state transition. Omitting sessionId opens a new " +
                    "conversation. Blocked contacts return outcome BLOCKED and record nothing.")
    @PostMapping("/messages")
    public ResponseEntity<TurnResponse> processMessage(@Valid @RequestBody MessageRequest request) {
        return ResponseEntity.ok(stateMachine.processMessage(request.toInbound()));
    }

    @Operation(summary = "Verify the debtor's identity",
            description = "Checks the claimed last four identifier digits and/or last payment amount. " +
                    "Exhausting the attempts escalates the conversation to a human agent.")
    @PostMapping("/{conversationId}/verify-identity")
    public ResponseEntity<VerificationResponse> verifyIdentity(
            @Parameter(description = "Conversation ID", example = "CONV-7f3a")
            @PathVariable String conversationId,
            @RequestBody VerifyIdentityRequest request) {
        return ResponseEntity.ok(verificationService.verify(conversationId, request.toClaimedIdentity()));
    }

    @Operation(summary = "Escalate to a human agent")
    @PostMapping("/{conversationId}/escalate")
    public ResponseEntity<EscalationResult> escalate(
            @PathVariable String conversationId,
            @Valid @RequestBody EscalationRequest request) {
        return ResponseEntity.ok(escalationService.escalate(
                conversationId, request.reason(), request.priority(), request.notes()));
    }

    @Operation(summary = "Accept a proposed payment plan",
            description = "Only PROPOSED plans on a verified, open conversation can be accepted.")
    @PostMapping("/{conversationId}/plans/{planId}/accept")
    public ResponseEntity<PaymentPlan> acceptPlan(@PathVariable String conversationId,
                                                  @PathVariable String planId) {
        return ResponseEntity.ok(paymentService.acceptPlan(conversationId, planId));
    }

    @Operation(summary = "Get a conversation with debtor and account summary")
    @GetMapping("/{conversationId}")
    public ResponseEntity<ConversationDetail> getConversation(@PathVariable String conversationId) {
        return ResponseEntity.ok(queryService.getConversation(conversationId));
    }

    @Operation(summary = "Get the compliance report of a conversation",
            description = "Every recorded contact check, verification attempt and proposal validation. " +
                    "Overall status is failed, warning or passed.")
    @GetMapping("/{conversationId}/compliance-report")
    public ResponseEntity<ComplianceReport> getComplianceReport(@PathVariable String conversationId) {
        return ResponseEntity.ok(complianceReportService.getReport(conversationId));
    }
}
