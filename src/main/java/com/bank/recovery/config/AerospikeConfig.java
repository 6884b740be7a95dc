package com.bank.recovery.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Live cluster connection. Tests supply mocked client beans under the "test" profile instead.
 */
@Configuration
@Profile("!test")
public class AerospikeConfig {

    public static final String SET_DEBTORS = "debtors";
    public static final String SET_ACCOUNTS = "accounts";
    public static final String SET_CONVERSATIONS = "conversations";
    public static final String SET_AUDIT_EVENTS = "audit_events";
    public static final String SET_PAYMENTS = "payments";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:recovery}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        // Conversation commits are never retried by the client; a retry is a new turn
        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;
        clientPolicy.writePolicyDefault.maxRetries = 0;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        policy.maxRetries = 0;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
