package com.bank.recovery.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Candidate next action produced per turn by the proposal generator. One variant per
 * action kind; only plan-carrying kinds expose a structured plan. Instances are
 * immutable: validation returns a replacement instead of rewriting one.
 */
public sealed interface ProposedAction {

    ActionType type();

    String message();

    double confidence();

    /** Whether the generator itself asked for a human hand-off. */
    boolean escalation();

    List<String> complianceLabels();

    default Optional<PlanProposal> plan() {
        return Optional.empty();
    }

    /**
     * Returns a copy of this action with {@code label} appended to its compliance labels.
     */
    ProposedAction withLabel(String label);

    static ProposedAction of(ActionType type, String message, PlanProposal plan,
                             double confidence, boolean escalation, List<String> labels) {
        return switch (type) {
            case INFORM -> new Inform(message, confidence, escalation, labels);
            case ACKNOWLEDGE -> new Acknowledge(message, confidence, escalation, labels);
            case REQUEST_INFO -> new RequestInfo(message, confidence, escalation, labels);
            case VERIFY_IDENTITY -> new VerifyIdentity(message, confidence, escalation, labels);
            case PROPOSE_PLAN -> new ProposePlan(message, plan, confidence, escalation, labels);
            case COLLECT_PAYMENT -> new CollectPayment(message, plan, confidence, escalation, labels);
            case ESCALATE -> new Escalate(message, null, confidence, labels);
            case CLOSE -> new Close(message, confidence, escalation, labels);
        };
    }

    private static double checkConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        return confidence;
    }

    private static List<String> appended(List<String> labels, String label) {
        List<String> copy = new ArrayList<>(labels);
        copy.add(label);
        return copy;
    }

    record Inform(String message, double confidence, boolean escalation, List<String> complianceLabels)
            implements ProposedAction {
        public Inform {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.INFORM;
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new Inform(message, confidence, escalation, appended(complianceLabels, label));
        }
    }

    record Acknowledge(String message, double confidence, boolean escalation, List<String> complianceLabels)
            implements ProposedAction {
        public Acknowledge {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.ACKNOWLEDGE;
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new Acknowledge(message, confidence, escalation, appended(complianceLabels, label));
        }
    }

    record RequestInfo(String message, double confidence, boolean escalation, List<String> complianceLabels)
            implements ProposedAction {
        public RequestInfo {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.REQUEST_INFO;
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new RequestInfo(message, confidence, escalation, appended(complianceLabels, label));
        }
    }

    record VerifyIdentity(String message, double confidence, boolean escalation, List<String> complianceLabels)
            implements ProposedAction {
        public VerifyIdentity {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.VERIFY_IDENTITY;
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new VerifyIdentity(message, confidence, escalation, appended(complianceLabels, label));
        }
    }

    record ProposePlan(String message, PlanProposal structuredPlan, double confidence, boolean escalation,
                       List<String> complianceLabels) implements ProposedAction {
        public ProposePlan {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.PROPOSE_PLAN;
        }

        @Override
        public Optional<PlanProposal> plan() {
            return Optional.ofNullable(structuredPlan);
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new ProposePlan(message, structuredPlan, confidence, escalation,
                    appended(complianceLabels, label));
        }
    }

    record CollectPayment(String message, PlanProposal structuredPlan, double confidence, boolean escalation,
                          List<String> complianceLabels) implements ProposedAction {
        public CollectPayment {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.COLLECT_PAYMENT;
        }

        @Override
        public Optional<PlanProposal> plan() {
            return Optional.ofNullable(structuredPlan);
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new CollectPayment(message, structuredPlan, confidence, escalation,
                    appended(complianceLabels, label));
        }
    }

    /**
     * Hand-off to a human agent. Always carries the escalation flag.
     *
     * @param reason why the hand-off happened, may be null for generator-initiated escalations
     */
    record Escalate(String message, String reason, double confidence, List<String> complianceLabels)
            implements ProposedAction {
        public Escalate {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.ESCALATE;
        }

        @Override
        public boolean escalation() {
            return true;
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new Escalate(message, reason, confidence, appended(complianceLabels, label));
        }
    }

    record Close(String message, double confidence, boolean escalation, List<String> complianceLabels)
            implements ProposedAction {
        public Close {
            Objects.requireNonNull(message, "message");
            checkConfidence(confidence);
            complianceLabels = complianceLabels == null ? List.of() : List.copyOf(complianceLabels);
        }

        @Override
        public ActionType type() {
            return ActionType.CLOSE;
        }

        @Override
        public ProposedAction withLabel(String label) {
            return new Close(message, confidence, escalation, appended(complianceLabels, label));
        }
    }
}
