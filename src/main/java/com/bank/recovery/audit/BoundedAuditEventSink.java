package com.bank.recovery.audit;

import com.bank.recovery.config.ConversationProperties;
import com.bank.recovery.config.MetricsConfig;
import com.bank.recovery.model.AuditEvent;
import com.bank.recovery.repository.AuditEventRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Audit sink backed by a bounded queue and one consumer thread. The consumer writes each
 * event to the {@code AUDIT} logger and the audit store. When the queue is full the new
 * event is dropped and counted; publishers never wait.
 */
@Component
public class BoundedAuditEventSink implements AuditEventSink {

    private static final Logger log = LoggerFactory.getLogger(BoundedAuditEventSink.class);
    private static final Logger auditLog = LoggerFactory.getLogger("AUDIT");

    private final BlockingQueue<AuditEvent> queue;
    private final AuditEventRepository repository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final long drainTimeoutMs;

    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong writtenCount = new AtomicLong();
    private volatile boolean running;
    private Thread consumer;

    public BoundedAuditEventSink(AuditEventRepository repository, MetricsConfig metricsConfig,
                                 ConversationProperties properties, Clock clock) {
        this.queue = new ArrayBlockingQueue<>(properties.getAuditQueueCapacity());
        this.repository = repository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.drainTimeoutMs = properties.getAuditDrainTimeoutMs();
    }

    @PostConstruct
    public void start() {
        running = true;
        consumer = new Thread(this::consume, "audit-sink");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Audit sink started, capacity={}", queue.remainingCapacity());
    }

    @Override
    public void publish(AuditEvent event) {
        if (event == null) {
            return;
        }
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        if (event.getOccurredAt() == 0) {
            event.setOccurredAt(clock.millis());
        }
        if (!queue.offer(event)) {
            long dropped = droppedCount.incrementAndGet();
            metricsConfig.recordAuditDropped();
            // One line per thousand drops keeps an overflow from flooding the log
            if (dropped % 1000 == 1) {
                log.warn("Audit queue full, dropped {} events so far (latest: {} {})",
                        dropped, event.getEventType(), event.getName());
            }
        }
        metricsConfig.updateAuditQueueDepth(queue.size());
    }

    private void consume() {
        while (running || !queue.isEmpty()) {
            AuditEvent event;
            try {
                event = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event != null) {
                write(event);
            }
        }
    }

    private void write(AuditEvent event) {
        auditLog.info("type={} name={} conversation={} debtor={} account={} passed={} severity={} details={}",
                event.getEventType(), event.getName(), event.getConversationId(), event.getDebtorId(),
                event.getAccountId(), event.isPassed(), event.getSeverity(), PiiMasker.mask(event.getDetails()));
        try {
            repository.save(event);
            writtenCount.incrementAndGet();
        } catch (Exception e) {
            metricsConfig.recordAuditWriteFailure();
            log.error("Failed to store audit event {} ({}): {}",
                    event.getEventId(), event.getEventType(), e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (consumer == null) {
            return;
        }
        try {
            consumer.join(drainTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (consumer.isAlive()) {
            log.warn("Audit sink stopped with {} events still queued", queue.size());
        } else {
            log.info("Audit sink drained: written={}, dropped={}", writtenCount.get(), droppedCount.get());
        }
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public long getWrittenCount() {
        return writtenCount.get();
    }
}
