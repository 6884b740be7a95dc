package com.bank.recovery.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.recovery.config.AerospikeConfig;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.model.AuditEventType;
import com.bank.recovery.model.Severity;
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
import java.util.Map;

@Repository
public class AuditEventRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditEventRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AuditEventRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = objectMapper;
    }

    public void save(AuditEvent event) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_EVENTS, event.getEventId());

        client.put(writePolicy, key,
                new Bin("eventId", event.getEventId()),
                new Bin("eventType", event.getEventType().name()),
                new Bin("name", event.getName()),
                new Bin("convId", event.getConversationId()),
                new Bin("debtorId", event.getDebtorId()),
                new Bin("accountId", event.getAccountId()),
                new Bin("passed", event.isPassed()),
                new Bin("severity", event.getSeverity().name()),
                new Bin("details", event.getDetails()),
                new Bin("attributes", serializeAttributes(event.getAttributes())),
                new Bin("occurredAt", event.getOccurredAt()));
    }

    /**
     * All events of a conversation, oldest first.
     */
    public List<AuditEvent> findByConversationId(String conversationId) {
        List<AuditEvent> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_EVENTS,
                (key, record) -> {
                    try {
                        if (!conversationId.equals(record.getString("convId"))) return;
                        AuditEvent event = AuditEvent.builder()
                                .eventId(record.getString("eventId"))
                                .eventType(AuditEventType.valueOf(record.getString("eventType")))
                                .name(record.getString("name"))
                                .conversationId(conversationId)
                                .debtorId(record.getString("debtorId"))
                                .accountId(record.getString("accountId"))
                                .passed(record.getBoolean("passed"))
                                .severity(Severity.valueOf(record.getString("severity")))
                                .details(record.getString("details"))
                                .attributes(deserializeAttributes(record.getString("attributes")))
                                .occurredAt(record.getLong("occurredAt"))
                                .build();
                        synchronized (results) {
                            results.add(event);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit event record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditEvent::getOccurredAt));
        return results;
    }

    private String serializeAttributes(Map<String, String> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (Exception e) {
            return "{}";
        }
    }

    private Map<String, String> deserializeAttributes(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (Exception e) {
            return new LinkedHashMap<>();
        }
    }
}
