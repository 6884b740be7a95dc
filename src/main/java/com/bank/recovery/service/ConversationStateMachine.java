package com.bank.recovery.service;

import com.bank.recovery.audit.AuditEventSink;
import com.bank.recovery.audit.PiiMasker;
import com.bank.recovery.config.ConversationProperties;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.engine.ContactComplianceGate;
import com.bank.recovery.exception.ConversationCommitException;
import com.bank.recovery.exception.RequestValidationException;
import com.bank.recovery.generation.ContextRetriever;
import com.bank.recovery.generation.GenerationRequest;
import com.bank.recovery.generation.GenerationResult;
import com.bank.recovery.generation.ProposalGenerator;
import com.bank.recovery.generation.ReferenceSnippet;
import com.bank.recovery.model.Account;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.Channel;
import com.bank.recovery.model.ComplianceDecision;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationContext;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.Debtor;
import com.bank.recovery.model.EscalationPriority;
import com.bank.recovery.model.InboundMessage;
import com.bank.recovery.model.Message;
import com.bank.recovery.model.MessageRole;
import com.bank.recovery.model.PaymentPlan;
import com.bank.recovery.model.PlanBuildResult;
import com.bank.recovery.model.PolicyViolation;
import com.bank.recovery.model.ProposedAction;
import com.bank.recovery.model.Severity;
import com.bank.recovery.model.TurnOutcome;
import com.bank.recovery.model.TurnResponse;
import com.bank.recovery.model.ValidatedProposal;
import com.bank.recovery.plan.PaymentPlanBuilder;
import com.bank.recovery.repository.AccountRepository;
import com.bank.recovery.repository.ConversationRepository;
import com.bank.recovery.repository.DebtorRepository;
import com.bank.recovery.validation.ResponseValidator;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Orchestrates one negotiation turn per inbound message.
 *
 * Pipeline:
 *   1. Opted-out conversation: fixed reply, nothing else
 *   2. Contact compliance gate; a block returns without recording anything
 *   3. Record the inbound message
 *   4. Ask the proposal generator, with a timeout, falling back to an escalation on failure
 *   5. Validate the proposal
 *   6. Apply the action (state change, plan derivation)
 *   7. Record the reply
 *   8. Commit the conversation as one write
 *
 * Turns of the same conversation are serialized through {@link ConversationTurnExecutor}.
 * Steps 3-7 work on a copy of the stored conversation, so a failed commit leaves no trace.
 * Escalation and plan events are held back until the commit has succeeded.
 */
@Service
public class ConversationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateMachine.class);

    public static final String OPTED_OUT_MESSAGE =
            "This contact has opted out of communications. No further messages will be sent.";
    public static final String BLOCKED_MESSAGE_PREFIX = "Contact not allowed at this time: ";
    public static final String FALLBACK_MESSAGE =
            "I'm experiencing technical difficulties and want to ensure you receive the best service. "
                    + "Let me connect you with a specialist who can assist you immediately.";
    public static final String FALLBACK_LABEL = "technical_failure_escalation";
    public static final String ESCALATED_REPLY =
            "Your conversation has been transferred to a specialist, who will contact you shortly.";
    public static final String CLOSED_REPLY =
            "This conversation has been closed. Please start a new conversation if you need further help.";

    private final ConversationRepository conversationRepository;
    private final AccountRepository accountRepository;
    private final DebtorRepository debtorRepository;
    private final ContactComplianceGate complianceGate;
    private final ResponseValidator responseValidator;
    private final PaymentPlanBuilder planBuilder;
    private final ProposalGenerator proposalGenerator;
    private final ContextRetriever contextRetriever;
    private final ConversationTurnExecutor turnExecutor;
    private final ExecutorService generatorExecutor;
    private final AuditEventSink auditSink;
    private final EscalationNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final ConversationProperties properties;
    private final Clock clock;

    public ConversationStateMachine(ConversationRepository conversationRepository,
                                    AccountRepository accountRepository,
                                    DebtorRepository debtorRepository,
                                    ContactComplianceGate complianceGate,
                                    ResponseValidator responseValidator,
                                    PaymentPlanBuilder planBuilder,
                                    ProposalGenerator proposalGenerator,
                                    ContextRetriever contextRetriever,
                                    ConversationTurnExecutor turnExecutor,
                                    @Qualifier("generatorExecutor") ExecutorService generatorExecutor,
                                    AuditEventSink auditSink,
                                    EscalationNotificationService notificationService,
                                    MetricsConfig metricsConfig,
                                    ConversationProperties properties,
                                    Clock clock) {
        this.conversationRepository = conversationRepository;
        this.accountRepository = accountRepository;
        this.debtorRepository = debtorRepository;
        this.complianceGate = complianceGate;
        this.responseValidator = responseValidator;
        this.planBuilder = planBuilder;
        this.proposalGenerator = proposalGenerator;
        this.contextRetriever = contextRetriever;
        this.turnExecutor = turnExecutor;
        this.generatorExecutor = generatorExecutor;
        this.auditSink = auditSink;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Process one inbound message. Opens a new conversation when the session id is absent or unknown.
     *
     * @throws RequestValidationException  for an unknown account or a session of another account
     * @throws ConversationCommitException if the turn could not be stored; nothing of it took effect
     */
    @Observed(name = "conversation.process_message", contextualName = "process-message")
    public TurnResponse processMessage(InboundMessage inbound) {
        if (inbound.text() == null || inbound.text().isBlank()) {
            throw RequestValidationException.invalid("message", "Message text is required");
        }
        if (inbound.accountId() == null || inbound.accountId().isBlank()) {
            throw RequestValidationException.invalid("accountId", "Account id is required");
        }
        String conversationId = inbound.sessionId() != null && !inbound.sessionId().isBlank()
                ? inbound.sessionId()
                : "CONV-" + UUID.randomUUID();

        return turnExecutor.execute(conversationId, () -> runTurn(conversationId, inbound));
    }

    private TurnResponse runTurn(String conversationId, InboundMessage inbound) {
        Account account = accountRepository.findById(inbound.accountId());
        if (account == null) {
            throw RequestValidationException.notFound("Account", inbound.accountId());
        }
        Conversation stored = conversationRepository.findById(conversationId);
        if (stored != null && !stored.getAccountId().equals(account.getAccountId())) {
            throw RequestValidationException.invalid("sessionId", "Conversation belongs to a different account");
        }
        Debtor debtor = debtorRepository.findById(account.getDebtorId());
        if (debtor == null) {
            throw RequestValidationException.notFound("Debtor", account.getDebtorId());
        }

        Conversation working = stored != null
                ? stored.copy()
                : newConversation(conversationId, account, inbound.channel());

        // 1. Opted out: answer, record nothing
        if (working.getState() == ConversationState.OPTED_OUT) {
            metricsConfig.recordTurn(TurnOutcome.OPTED_OUT.name(), "none");
            return TurnResponse.builder()
                    .conversationId(conversationId)
                    .outcome(TurnOutcome.OPTED_OUT)
                    .state(working.getState())
                    .message(OPTED_OUT_MESSAGE)
                    .build();
        }

        // 2. Contact compliance
        ComplianceDecision decision = complianceGate.evaluate(debtor, working,
                conversationRepository.findByDebtorId(debtor.getDebtorId()));
        if (decision instanceof ComplianceDecision.Blocked blocked) {
            metricsConfig.recordTurn(TurnOutcome.BLOCKED.name(), "none");
            return TurnResponse.builder()
                    .conversationId(stored != null ? conversationId : null)
                    .outcome(TurnOutcome.BLOCKED)
                    .state(working.getState())
                    .message(BLOCKED_MESSAGE_PREFIX + blocked.reason())
                    .blockedBy(blocked.checkName())
                    .blockSeverity(blocked.severity())
                    .build();
        }

        // 3. Inbound message
        long now = clock.millis();
        working.getMessages().add(message(MessageRole.USER, inbound.text(), null, List.of(), now));
        log.debug("Turn for conversation {} in state {}: {}", conversationId, working.getState(),
                PiiMasker.mask(inbound.text()));

        if (working.getState().isTerminal()) {
            return handOff(working);
        }

        // 4. Proposal
        ConversationContext context = buildContext(working, account);
        ProposedAction proposal = generateProposal(inbound.text(), context);

        // 5. Validation
        ValidatedProposal validated = responseValidator.validate(proposal, context);
        auditValidation(working, validated);

        // 6. Apply
        ProposedAction action = validated.proposal();
        String planId = null;
        String escalationSource = null;
        List<AuditEvent> stateEvents = new ArrayList<>();

        if (action.escalation()) {
            escalationSource = validated.forcedEscalation() ? "validation" : sourceOf(proposal);
            escalate(working, escalationReason(action), escalationSource, stateEvents);
        } else {
            switch (action.type()) {
                case VERIFY_IDENTITY -> {
                    if (!working.isIdentityVerified()) {
                        working.transitionTo(ConversationState.IDENTITY_VERIFICATION);
                    }
                }
                case PROPOSE_PLAN, COLLECT_PAYMENT -> {
                    working.transitionTo(ConversationState.ACTIVE_NEGOTIATION);
                    if (action.plan().isPresent()) {
                        PlanBuildResult built = planBuilder.build(account.getCurrentBalance(), action.plan().get());
                        if (built instanceof PlanBuildResult.Built b) {
                            planId = attachPlan(working, b.plan(), stateEvents);
                        } else if (built instanceof PlanBuildResult.Rejected rejected) {
                            action = rejectedPlanEscalation(action, rejected.violations());
                            escalationSource = "plan_rejected";
                            escalate(working, escalationReason(action), escalationSource, stateEvents);
                        }
                    }
                }
                case CLOSE -> working.transitionTo(ConversationState.CLOSED);
                default -> {
                    // Inform, acknowledge and request-info leave the state as it is
                }
            }
        }

        // 7. Reply
        working.getMessages().add(message(MessageRole.ASSISTANT, action.message(), action.confidence(),
                action.complianceLabels(), clock.millis()));
        working.setLastActivityAt(clock.millis());

        // 8. Commit
        conversationRepository.commit(working);

        stateEvents.forEach(auditSink::publish);
        if (escalationSource != null) {
            metricsConfig.recordEscalation(escalationSource);
            notificationService.notifyEscalation(working.getConversationId(), working.getAccountId(),
                    working.getEscalationReason(), priorityOf(escalationSource));
        }
        metricsConfig.recordTurn(TurnOutcome.PROCESSED.name(), action.type().name());
        metricsConfig.recordProposalConfidence(action.type().name(), action.confidence());
        log.info("Turn processed for conversation {}: action={} state={} plan={}",
                working.getConversationId(), action.type(), working.getState(), planId);

        return TurnResponse.builder()
                .conversationId(working.getConversationId())
                .outcome(TurnOutcome.PROCESSED)
                .state(working.getState())
                .message(action.message())
                .action(action.type())
                .confidence(action.confidence())
                .escalated(working.getState() == ConversationState.ESCALATED)
                .complianceTags(new ArrayList<>(action.complianceLabels()))
                .planId(planId)
                .build();
    }

    /**
     * Escalated and closed conversations belong to a human agent or are finished; the debtor's
     * message is kept for the agent and a fixed reply is returned without asking the generator.
     */
    private TurnResponse handOff(Conversation working) {
        String reply = working.getState() == ConversationState.CLOSED ? CLOSED_REPLY : ESCALATED_REPLY;
        working.getMessages().add(message(MessageRole.ASSISTANT, reply, null, List.of(), clock.millis()));
        working.setLastActivityAt(clock.millis());
        conversationRepository.commit(working);

        metricsConfig.recordTurn(TurnOutcome.HANDED_OFF.name(), "none");
        return TurnResponse.builder()
                .conversationId(working.getConversationId())
                .outcome(TurnOutcome.HANDED_OFF)
                .state(working.getState())
                .message(reply)
                .escalated(working.getState() == ConversationState.ESCALATED)
                .build();
    }

    private ProposedAction generateProposal(String userMessage, ConversationContext context) {
        List<ReferenceSnippet> references = retrieveReferences(userMessage, context);
        GenerationResult result = callGenerator(new GenerationRequest(userMessage, context, references));

        if (result instanceof GenerationResult.Generated generated) {
            if (!generated.proposal().complianceLabels().isEmpty()) {
                auditSink.publish(event(AuditEventType.GENERATOR_COMPLIANCE_LABEL, "generator_labels", context,
                        true, Severity.INFO, String.join(",", generated.proposal().complianceLabels())));
            }
            return generated.proposal();
        }

        GenerationResult.Failed failed = (GenerationResult.Failed) result;
        log.warn("Proposal generator failed for conversation {} ({}): {}, using fallback escalation",
                context.conversationId(), failed.kind(), failed.detail());
        metricsConfig.recordGenerationFallback(failed.kind().name());
        auditSink.publish(event(AuditEventType.GENERATION_FALLBACK, "generation_" + failed.kind().name().toLowerCase(),
                context, false, Severity.ERROR, failed.detail()));
        return fallbackProposal(failed.kind());
    }

    private GenerationResult callGenerator(GenerationRequest request) {
        Future<GenerationResult> future = generatorExecutor.submit(() -> proposalGenerator.generate(request));
        try {
            GenerationResult result = future.get(properties.getGeneratorTimeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null
                    || (result instanceof GenerationResult.Generated generated && generated.proposal() == null)) {
                return new GenerationResult.Failed(GenerationResult.FailureKind.INVALID_OUTPUT, "Generator returned nothing");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return new GenerationResult.Failed(GenerationResult.FailureKind.TIMEOUT,
                    "No proposal within " + properties.getGeneratorTimeoutMs() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // Malformed proposals fail their own construction (e.g. confidence outside [0, 1])
            GenerationResult.FailureKind kind = cause instanceof IllegalArgumentException || cause instanceof NullPointerException
                    ? GenerationResult.FailureKind.INVALID_OUTPUT
                    : GenerationResult.FailureKind.ERROR;
            return new GenerationResult.Failed(kind, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            // Cancelled turn: nothing has been committed, leave the conversation as it was
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConversationCommitException(request.context().conversationId(),
                    "Turn cancelled while waiting for the proposal generator", false, e);
        }
    }

    private List<ReferenceSnippet> retrieveReferences(String query, ConversationContext context) {
        try {
            return contextRetriever.retrieve(query, context.accountId(), context.debtorId(),
                    properties.getReferenceSnippetLimit());
        } catch (RuntimeException e) {
            log.warn("Context retrieval failed for conversation {}: {}", context.conversationId(), e.getMessage());
            return List.of();
        }
    }

    static ProposedAction fallbackProposal(GenerationResult.FailureKind kind) {
        return new ProposedAction.Escalate(FALLBACK_MESSAGE,
                "Proposal generator unavailable (" + kind.name().toLowerCase() + ")",
                1.0, List.of(FALLBACK_LABEL));
    }

    private ProposedAction rejectedPlanEscalation(ProposedAction action, List<PolicyViolation> violations) {
        String codes = violations.stream().map(PolicyViolation::code).distinct().collect(Collectors.joining(", "));
        List<String> labels = new ArrayList<>(action.complianceLabels());
        labels.add(ResponseValidator.VALIDATION_FAILED_TAG);
        return new ProposedAction.Escalate(ResponseValidator.HANDOFF_MESSAGE,
                "Payment plan rejected: " + codes, action.confidence(), labels);
    }

    private String attachPlan(Conversation working, PaymentPlan plan, List<AuditEvent> stateEvents) {
        plan.setAccountId(working.getAccountId());
        plan.setConversationId(working.getConversationId());
        working.getPaymentPlans().add(plan);
        stateEvents.add(AuditEvent.builder()
                .eventType(AuditEventType.PLAN_CREATED)
                .name(plan.getPlanType().name().toLowerCase())
                .conversationId(working.getConversationId())
                .debtorId(working.getDebtorId())
                .accountId(working.getAccountId())
                .passed(true)
                .details(String.format("Plan %s: %d x %.2f, total %.2f, first due %s",
                        plan.getPlanId(), plan.getInstallmentCount(), plan.getInstallmentAmount(),
                        plan.getTotalAmount(), plan.getFirstDueDate()))
                .build());
        return plan.getPlanId();
    }

    private void escalate(Conversation working, String reason, String source, List<AuditEvent> stateEvents) {
        working.escalate(reason, clock.millis());
        stateEvents.add(AuditEvent.builder()
                .eventType(AuditEventType.ESCALATION)
                .name(source)
                .conversationId(working.getConversationId())
                .debtorId(working.getDebtorId())
                .accountId(working.getAccountId())
                .passed(true)
                .severity(Severity.WARNING)
                .details(reason)
                .build());
    }

    private void auditValidation(Conversation working, ValidatedProposal validated) {
        String details = validated.hasViolations()
                ? validated.violations().stream().map(v -> v.code() + ": " + v.detail()).collect(Collectors.joining("; "))
                : "Proposal passed validation";
        validated.violations().forEach(v -> metricsConfig.recordProposalViolation(v.code()));
        auditSink.publish(AuditEvent.builder()
                .eventType(AuditEventType.PROPOSAL_VALIDATION)
                .name("response_validation")
                .conversationId(working.getConversationId())
                .debtorId(working.getDebtorId())
                .accountId(working.getAccountId())
                .passed(!validated.hasViolations())
                .severity(validated.hasViolations() ? Severity.ERROR : Severity.INFO)
                .details(details)
                .build());
    }

    private ConversationContext buildContext(Conversation working, Account account) {
        List<Message> messages = working.getMessages();
        int from = Math.max(0, messages.size() - properties.getRecentMessageLimit());
        return new ConversationContext(working.getConversationId(), working.getDebtorId(), working.getAccountId(),
                working.getState(), working.getChannel(), working.isIdentityVerified(),
                working.getVerificationAttempts(), account.getCurrentBalance(), account.getDaysOverdue(),
                messages.subList(from, messages.size()));
    }

    private Conversation newConversation(String conversationId, Account account, Channel channel) {
        long now = clock.millis();
        return Conversation.builder()
                .conversationId(conversationId)
                .debtorId(account.getDebtorId())
                .accountId(account.getAccountId())
                .state(ConversationState.INITIATED)
                .channel(channel)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }

    private static Message message(MessageRole role, String content, Double confidence, List<String> tags, long at) {
        return Message.builder()
                .messageId(UUID.randomUUID().toString())
                .role(role)
                .content(content)
                .confidence(confidence)
                .complianceTags(new ArrayList<>(tags))
                .createdAt(at)
                .build();
    }

    private static AuditEvent event(AuditEventType type, String name, ConversationContext context,
                                    boolean passed, Severity severity, String details) {
        return AuditEvent.builder()
                .eventType(type)
                .name(name)
                .conversationId(context.conversationId())
                .debtorId(context.debtorId())
                .accountId(context.accountId())
                .passed(passed)
                .severity(severity)
                .details(details)
                .build();
    }

    private static String escalationReason(ProposedAction action) {
        if (action instanceof ProposedAction.Escalate escalate && escalate.reason() != null) {
            return escalate.reason();
        }
        return "Escalation requested by proposal generator";
    }

    private static String sourceOf(ProposedAction original) {
        return original.complianceLabels().contains(FALLBACK_LABEL) ? "generation_fallback" : "generator";
    }

    private static EscalationPriority priorityOf(String source) {
        return switch (source) {
            case "validation", "plan_rejected" -> EscalationPriority.HIGH;
            case "generation_fallback" -> EscalationPriority.URGENT;
            default -> EscalationPriority.NORMAL;
        };
    }
}
