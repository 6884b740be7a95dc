package com.bank.recovery.audit;

import com.bank.recovery.model.AuditEvent;

/**
 * Fire-and-forget destination for audit events.
 */
public interface AuditEventSink {

    /**
     * Hand an event over for recording. Never blocks and never throws; an event that
     * cannot be accepted is dropped and counted.
     */
    void publish(AuditEvent event);
}
