package com.bank.recovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private String eventId;
    private AuditEventType eventType;
    private String name;                // check / label / event name
    private String conversationId;
    private String debtorId;
    private String accountId;
    private boolean passed;
    @Builder.Default
    private Severity severity = Severity.INFO;
    private String details;
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();
    private long occurredAt;
}
