package com.bank.recovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "recovery.conversation")
public class ConversationProperties {

    // Upper bound on one generator call; on expiry the fallback escalation is used
    private long generatorTimeoutMs = 30_000;

    // Threads running generator calls; bounds concurrent calls to the external generator
    private int generatorPoolSize = 8;

    // Threads running conversation turns; different conversations proceed in parallel up to this
    private int turnPoolSize = 16;

    // How many of the latest messages the generator sees as context
    private int recentMessageLimit = 10;

    // How many reference snippets are retrieved per turn
    private int referenceSnippetLimit = 3;

    // Audit events buffered before new ones are dropped
    private int auditQueueCapacity = 10_000;

    // Wait for the audit queue to drain on shutdown
    private long auditDrainTimeoutMs = 5_000;
}
