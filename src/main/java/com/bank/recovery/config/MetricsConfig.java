package com.bank.recovery.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger auditQueueDepth;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.auditQueueDepth = registry.gauge("audit.queue.depth", new AtomicInteger(0));
    }

    public void recordTurn(String outcome, String action) {
        Counter.builder("conversation.turn.count")
                .tag("outcome", outcome)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordProposalConfidence(String action, double confidence) {
        DistributionSummary.builder("conversation.proposal.confidence")
                .tag("action", action)
                .register(registry)
                .record(confidence);
    }

    public void recordComplianceBlock(String checkName) {
        Counter.builder("compliance.blocked.count")
                .tag("check", checkName)
                .register(registry)
                .increment();
    }

    public void recordProposalViolation(String code) {
        Counter.builder("proposal.violation.count")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void recordVerification(String outcome) {
        Counter.builder("identity.verification.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String source) {
        Counter.builder("conversation.escalation.count")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordGenerationFallback(String reason) {
        Counter.builder("generation.fallback.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPayment(String allocation) {
        Counter.builder("payment.recorded.count")
                .tag("allocation", allocation)
                .register(registry)
                .increment();
    }

    public void recordAuditDropped() {
        Counter.builder("audit.dropped.count")
                .register(registry)
                .increment();
    }

    public void recordAuditWriteFailure() {
        Counter.builder("audit.write.failure.count")
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateAuditQueueDepth(int depth) {
        auditQueueDepth.set(depth);
    }
}
