package com.bank.recovery.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.recovery.config.AerospikeConfig;
import com.bank.recovery.exception.ConversationCommitException;
import com.bank.recovery.model.Channel;
import com.bank.recovery.model.Conversation;
import com.bank.recovery.model.ConversationState;
import com.bank.recovery.model.Message;
import com.bank.recovery.model.PaymentPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Stores a conversation, its message history and its payment plans as one record, so a
 * turn commit is a single write that is either fully visible or not at all.
 */
@Repository
public class ConversationRepository {

    private static final Logger log = LoggerFactory.getLogger(ConversationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ConversationRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy,
                                  ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = objectMapper;
    }

    public Conversation findById(String conversationId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONVERSATIONS, conversationId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Conversation> findByDebtorId(String debtorId) {
        return scanWhere("debtorId", debtorId);
    }

    public List<Conversation> findByAccountId(String accountId) {
        return scanWhere("accountId", accountId);
    }

    /**
     * Write the conversation as one record. A conversation read from the store is written
     * only if nobody else wrote it since (generation check); a new one only if the id is
     * still free. On success the conversation carries the new store generation.
     *
     * @throws ConversationCommitException if the write was rejected or failed; nothing was written
     */
    public void commit(Conversation conversation) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONVERSATIONS, conversation.getConversationId());

        WritePolicy policy = new WritePolicy(writePolicy);
        if (conversation.isPersisted()) {
            policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            policy.generation = conversation.getGeneration();
            policy.recordExistsAction = RecordExistsAction.REPLACE_ONLY;
        } else {
            policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        }

        Bin[] bins;
        try {
            bins = toBins(conversation);
        } catch (JsonProcessingException e) {
            throw new ConversationCommitException(conversation.getConversationId(),
                    "Conversation could not be serialized", false, e);
        }

        try {
            client.put(policy, key, bins);
        } catch (AerospikeException e) {
            boolean conflict = e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_EXISTS_ERROR;
            log.warn("Commit of conversation {} rejected (resultCode={}): {}",
                    conversation.getConversationId(), e.getResultCode(), e.getMessage());
            throw new ConversationCommitException(conversation.getConversationId(),
                    conflict ? "Conversation was modified concurrently" : "Conversation store unavailable",
                    conflict, e);
        }

        conversation.setGeneration(conversation.isPersisted() ? conversation.getGeneration() + 1 : 1);
    }

    private Bin[] toBins(Conversation c) throws JsonProcessingException {
        return new Bin[]{
                new Bin("convId", c.getConversationId()),
                new Bin("debtorId", c.getDebtorId()),
                new Bin("accountId", c.getAccountId()),
                new Bin("state", c.getState().name()),
                new Bin("channel", c.getChannel().name()),
                new Bin("verifyAttempts", c.getVerificationAttempts()),
                new Bin("verified", c.isIdentityVerified()),
                new Bin("sessionData", objectMapper.writeValueAsString(c.getSessionData())),
                new Bin("escReason", c.getEscalationReason()),
                new Bin("escalatedAt", c.getEscalatedAt()),
                new Bin("agentId", c.getAssignedAgentId()),
                new Bin("createdAt", c.getCreatedAt()),
                new Bin("lastActivityAt", c.getLastActivityAt()),
                new Bin("messages", objectMapper.writeValueAsString(c.getMessages())),
                new Bin("plans", objectMapper.writeValueAsString(c.getPaymentPlans()))
        };
    }

    private List<Conversation> scanWhere(String binName, String value) {
        List<Conversation> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CONVERSATIONS,
                (key, record) -> {
                    try {
                        if (value.equals(record.getString(binName))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read conversation record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Conversation::getCreatedAt));
        return results;
    }

    private Conversation mapRecord(Record record) {
        String id = record.getString("convId");
        try {
            return Conversation.builder()
                    .conversationId(id)
                    .debtorId(record.getString("debtorId"))
                    .accountId(record.getString("accountId"))
                    .state(ConversationState.valueOf(record.getString("state")))
                    .channel(Channel.valueOf(record.getString("channel")))
                    .verificationAttempts(record.getInt("verifyAttempts"))
                    .identityVerified(record.getBoolean("verified"))
                    .sessionData(readJson(record.getString("sessionData"), new TypeReference<LinkedHashMap<String, String>>() {},
                            new LinkedHashMap<>()))
                    .escalationReason(record.getString("escReason"))
                    .escalatedAt(record.getLong("escalatedAt"))
                    .assignedAgentId(record.getString("agentId"))
                    .createdAt(record.getLong("createdAt"))
                    .lastActivityAt(record.getLong("lastActivityAt"))
                    .messages(readJson(record.getString("messages"), new TypeReference<ArrayList<Message>>() {},
                            new ArrayList<>()))
                    .paymentPlans(readJson(record.getString("plans"), new TypeReference<ArrayList<PaymentPlan>>() {},
                            new ArrayList<>()))
                    .generation(record.generation)
                    .build();
        } catch (JsonProcessingException e) {
            // A partially read history must never be written back over the stored one
            throw new IllegalStateException("Corrupt conversation record " + id, e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type, T empty) throws JsonProcessingException {
        if (json == null || json.isEmpty()) return empty;
        return objectMapper.readValue(json, type);
    }
}
