package com.bank.recovery.config;

import com.bank.recovery.generation.ProposalGenerator;
import com.bank.recovery.generation.ScriptedProposalGenerator;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(PolicyProperties.class)
public class RecoveryRuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService turnExecutor(ConversationProperties properties) {
        return Executors.newFixedThreadPool(properties.getTurnPoolSize(), namedThreads("conversation-turn"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generatorExecutor(ConversationProperties properties) {
        return Executors.newFixedThreadPool(properties.getGeneratorPoolSize(), namedThreads("proposal-generator"));
    }

    /**
     * Keyword-routed generator used when no external generator bean is wired.
     */
    @Bean
    @ConditionalOnMissingBean(ProposalGenerator.class)
    public ProposalGenerator proposalGenerator(PolicyProperties policy) {
        return new ScriptedProposalGenerator(policy);
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
