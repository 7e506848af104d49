package com.bank.governance.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScan(String scanType, boolean safe, double durationMs) {
        Counter.builder("scan.count")
                .tag("scan_type", scanType)
                .tag("outcome", safe ? "safe" : "threat")
                .register(registry)
                .increment();

        DistributionSummary.builder("scan.duration_ms")
                .tag("scan_type", scanType)
                .register(registry)
                .record(durationMs);
    }

    public void recordThreatDetected(String threatType, String layer) {
        Counter.builder("threat.detected.count")
                .tag("threat_type", threatType)
                .tag("layer", layer)
                .register(registry)
                .increment();
    }

    public void recordClassifierFailure(String failurePolicy) {
        Counter.builder("semantic_classifier.failure.count")
                .tag("policy", failurePolicy)
                .register(registry)
                .increment();
    }

    public void recordPatternReload(String outcome) {
        Counter.builder("patterns.reload.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDecision(String tier, boolean interrupt) {
        Counter.builder("oversight.decision.count")
                .tag("tier", tier)
                .tag("interrupt", String.valueOf(interrupt))
                .register(registry)
                .increment();
    }

    public void recordReviewRequested(String tier) {
        Counter.builder("review.requested.count")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordReviewResolved(String status) {
        Counter.builder("review.resolved.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReviewsExpired(int count) {
        Counter.builder("review.expired.count")
                .register(registry)
                .increment(count);
    }

    public void recordAuditLoss(String reason) {
        Counter.builder("audit.loss")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void registerAuditQueue(Collection<?> queue) {
        registry.gaugeCollectionSize("audit.queue.depth", Tags.empty(), queue);
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
