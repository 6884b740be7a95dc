package com.bank.recovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One negotiation session with a debtor over a single account. Created on the first
 * inbound message, mutated only by the conversation state machine and the services it
 * serializes with, never deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {
    private String conversationId;
    private String debtorId;
    private String accountId;
    @Builder.Default
    private ConversationState state = ConversationState.INITIATED;
    private Channel channel;
    private int verificationAttempts;
    private boolean identityVerified;
    @Builder.Default
    private Map<String, String> sessionData = new LinkedHashMap<>();
    private String escalationReason;
    private long escalatedAt;           // 0 unless escalated
    private String assignedAgentId;
    private long createdAt;
    private long lastActivityAt;
    @Builder.Default
    private List<Message> messages = new ArrayList<>();
    @Builder.Default
    private List<PaymentPlan> paymentPlans = new ArrayList<>();

    // Store generation the record was read at; -1 for a conversation not yet persisted
    @JsonIgnore
    @Builder.Default
    private int generation = -1;

    @JsonIgnore
    public boolean isPersisted() {
        return generation >= 0;
    }

    /**
     * Move to {@code target}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transitionTo(ConversationState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Conversation " + conversationId + " cannot move from "
                    + state + " to " + target);
        }
        state = target;
    }

    public void escalate(String reason, long at) {
        transitionTo(ConversationState.ESCALATED);
        escalationReason = reason;
        escalatedAt = at;
    }

    public Optional<PaymentPlan> findPlan(String planId) {
        return paymentPlans.stream()
                .filter(p -> p.getPlanId().equals(planId))
                .findFirst();
    }

    /**
     * Deep copy used as the working copy of a turn. Changes on the copy become visible
     * only when it is committed.
     */
    public Conversation copy() {
        List<Message> messageCopies = new ArrayList<>();
        for (Message m : messages) {
            messageCopies.add(m.toBuilder()
                    .complianceTags(new ArrayList<>(m.getComplianceTags()))
                    .build());
        }
        List<PaymentPlan> planCopies = new ArrayList<>();
        for (PaymentPlan p : paymentPlans) {
            planCopies.add(p.copy());
        }
        return toBuilder()
                .sessionData(new LinkedHashMap<>(sessionData))
                .messages(messageCopies)
                .paymentPlans(planCopies)
                .build();
    }
}
