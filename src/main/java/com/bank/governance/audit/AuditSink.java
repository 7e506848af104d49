package com.bank.governance.audit;

import com.bank.governance.config.AuditConfig;
import com.bank.governance.config.MetricsConfig;
import com.bank.governance.repository.AuditRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-blocking audit writer. Callers {@link #append} and return immediately; a single daemon
 * worker drains the bounded queue into {@link AuditRepository}.
 *
 * <p>When the queue is full the oldest pending event is dropped. Dropped events and failed
 * writes both increment the audit-loss counter; neither is ever reported to the caller.
 */
@Component
public class AuditSink {

    private static final Logger log = LoggerFactory.getLogger(AuditSink.class);

    private static final long POLL_TIMEOUT_MS = 250;

    private final AuditRepository auditRepository;
    private final AuditConfig config;
    private final MetricsConfig metricsConfig;
    private final BlockingQueue<AuditEvent> queue;

    private final AtomicLong lossCount = new AtomicLong();
    private final AtomicLong writtenCount = new AtomicLong();

    private volatile boolean running;
    private Thread worker;

    public AuditSink(AuditRepository auditRepository, AuditConfig config, MetricsConfig metricsConfig) {
        this.auditRepository = auditRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.queue = new ArrayBlockingQueue<>(config.getQueueCapacity());
        metricsConfig.registerAuditQueue(queue);
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::drainLoop, "audit-writer");
        worker.setDaemon(true);
        worker.start();
        log.info("Audit sink started (capacity={}, enabled={})", config.getQueueCapacity(), config.isEnabled());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            worker.join(config.getShutdownTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            worker.interrupt();
        }
        List<AuditEvent> abandoned = new ArrayList<>();
        queue.drainTo(abandoned);
        abandoned.forEach(e -> recordLoss("shutdown"));
        log.info("Audit sink stopped: written={}, lost={}", writtenCount.get(), lossCount.get());
    }

    /**
     * Enqueue an event for asynchronous persistence. Never blocks.
     */
    public void append(AuditEvent event) {
        if (!config.isEnabled()) {
            return;
        }
        while (!queue.offer(event)) {
            AuditEvent dropped = queue.poll();
            if (dropped != null) {
                recordLoss("queue_full");
                log.debug("Audit queue full, dropped oldest event {}", dropped.getEventId());
            }
        }
    }

    /**
     * Write every currently queued event on the calling thread.
     *
     * @return number of events taken from the queue
     */
    public int flush() {
        int drained = 0;
        AuditEvent event;
        while ((event = queue.poll()) != null) {
            write(event);
            drained++;
        }
        return drained;
    }

    public long getLossCount() {
        return lossCount.get();
    }

    public long getWrittenCount() {
        return writtenCount.get();
    }

    public int getQueueDepth() {
        return queue.size();
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            try {
                AuditEvent event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    write(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void write(AuditEvent event) {
        try {
            if (event instanceof SecurityEventRecord securityEvent) {
                auditRepository.saveSecurityEvent(securityEvent);
            } else if (event instanceof HitlDecisionRecord decision) {
                auditRepository.saveHitlDecision(decision);
            } else {
                throw new IllegalArgumentException("Unsupported audit event " + event.getClass().getName());
            }
            writtenCount.incrementAndGet();
        } catch (Exception e) {
            recordLoss("write_failed");
            log.warn("Failed to persist audit event {}: {}", event.getEventId(), e.getMessage());
        }
    }

    private void recordLoss(String reason) {
        lossCount.incrementAndGet();
        metricsConfig.recordAuditLoss(reason);
    }
}
