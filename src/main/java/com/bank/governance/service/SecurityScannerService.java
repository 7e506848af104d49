package com.bank.governance.service;

import com.bank.governance.audit.AuditSink;
import com.bank.governance.audit.SecurityEventRecord;
import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.ScannerConfig;
import com.bank.governance.engine.Detection;
import com.bank.governance.engine.DetectionLayer;
import com.bank.governance.engine.InputSanitizer;
import com.bank.governance.engine.PatternSnapshot;
import com.bank.governance.engine.PatternStore;
import com.bank.governance.engine.layers.SemanticClassifierLayer;
import com.bank.governance.exception.PatternConfigurationException;
import com.bank.governance.model.DetectionPattern;
import com.bank.governance.model.Outcome;
import com.bank.governance.model.ScanContext;
import com.bank.governance.model.ScanResult;
import com.bank.governance.model.ScanType;
import com.bank.governance.model.ThreatType;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.LongAdder;

/**
 * Layered prompt-injection scanner for user input and inter-agent output.
 *
 * <p>Each scan reads one pattern snapshot, runs the detection layers in order until one fires,
 * and hands a hashed audit record to the {@link AuditSink} without waiting for it to be written.
 */
@Service
public class SecurityScannerService {

    private static final Logger log = LoggerFactory.getLogger(SecurityScannerService.class);

    private final PatternStore patternStore;
    private final List<DetectionLayer> layers;
    private final InputSanitizer sanitizer;
    private final AuditSink auditSink;
    private final ScannerConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    private final Map<ThreatType, LongAdder> threatCounters = new EnumMap<>(ThreatType.class);

    public SecurityScannerService(PatternStore patternStore, List<DetectionLayer> layers,
                                  InputSanitizer sanitizer, AuditSink auditSink,
                                  ScannerConfig config, MetricsConfig metricsConfig, Tracer tracer) {
        this.patternStore = patternStore;
        this.layers = layers.stream()
                .sorted(Comparator.comparingInt(DetectionLayer::getOrder))
                .toList();
        this.sanitizer = sanitizer;
        this.auditSink = auditSink;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;

        for (ThreatType type : ThreatType.values()) {
            threatCounters.put(type, new LongAdder());
        }
        for (DetectionLayer layer : this.layers) {
            log.info("Registered detection layer: {} -> {}", layer.getName(), layer.getClass().getSimpleName());
        }
    }

    /**
     * Scan untrusted user text.
     *
     * @return the scan result, or a rejection if the text is null or longer than the configured maximum
     */
    @Observed(name = "security.scan_input", contextualName = "scan-input")
    public Outcome<ScanResult> scanInput(String text, ScanContext context) {
        if (text == null) {
            return Outcome.rejected("text", "text must be a string");
        }
        int inputBytes = text.getBytes(StandardCharsets.UTF_8).length;
        if (inputBytes > config.getMaxInputLength()) {
            return Outcome.rejected("text", "input is " + inputBytes + " bytes, maximum is "
                    + config.getMaxInputLength());
        }
        ScanContext ctx = context != null ? context : ScanContext.empty();

        long start = System.nanoTime();
        PatternSnapshot snapshot = patternStore.current();
        Optional<Detection> detection = text.isBlank() ? Optional.empty() : detect(text, snapshot);

        ScanResult result;
        if (detection.isPresent()) {
            Detection d = detection.get();
            String sanitized = sanitizedFor(d, text, snapshot);
            result = ScanResult.threat(d.getThreatType(), d.getConfidence(), d.getMatchedPatterns(),
                    sanitized, elapsedMs(start), d.getReason(), d.getLayer());
            threatCounters.get(d.getThreatType()).increment();
            metricsConfig.recordThreatDetected(d.getThreatType().getValue(), d.getLayer());
            log.warn("Threat detected: type={}, layer={}, patterns={}, scanType={}, session={}, agent={}",
                    d.getThreatType().getValue(), d.getLayer(), d.getMatchedPatterns(),
                    ctx.getScanType().getValue(), ctx.getSessionId(), ctx.getAgentId());
        } else {
            result = ScanResult.safe(text, elapsedMs(start));
        }

        metricsConfig.recordScan(ctx.getScanType().getValue(), result.isSafe(), result.getScanDurationMs());
        auditSink.append(toSecurityEvent(result, text, inputBytes, ctx));
        log.debug("Scan complete: safe={}, snapshot=v{}, duration={}ms",
                result.isSafe(), snapshot.version(), result.getScanDurationMs());
        return Outcome.ok(result);
    }

    /**
     * Scan text produced by one agent before it is handed to another.
     */
    @Observed(name = "security.scan_agent_output", contextualName = "scan-agent-output")
    public Outcome<ScanResult> scanAgentOutput(String agentId, String output) {
        if (agentId == null || agentId.isBlank()) {
            return Outcome.rejected("agentId", "agentId is required for agent output scans");
        }
        return scanInput(output, ScanContext.builder()
                .agentId(agentId)
                .scanType(ScanType.AGENT_OUTPUT)
                .build());
    }

    // Semantic verdicts cover the whole input, and a threat with nothing removable leaves nothing safe to pass on.
    private String sanitizedFor(Detection detection, String text, PatternSnapshot snapshot) {
        if (SemanticClassifierLayer.NAME.equals(detection.getLayer())) {
            return "";
        }
        String sanitized = sanitizer.sanitize(text, snapshot);
        return sanitized.equals(text) ? "" : sanitized;
    }

    public String sanitize(String text) {
        return sanitizer.sanitize(text, patternStore.current());
    }

    public Outcome<DetectionPattern> addPattern(String patternText, String threatType) {
        if (patternText == null || patternText.isBlank()) {
            return Outcome.rejected("pattern", "pattern must not be blank");
        }
        ThreatType type;
        try {
            type = ThreatType.fromValue(threatType);
        } catch (IllegalArgumentException e) {
            return Outcome.rejected("threatType", e.getMessage());
        }
        try {
            return Outcome.ok(patternStore.add(patternText, type));
        } catch (PatternConfigurationException e) {
            log.warn("Rejected runtime pattern: {}", e.getMessage());
            return Outcome.rejected("pattern", e.getMessage());
        }
    }

    /**
     * Cumulative threat counts since startup, keyed by wire value, in taxonomy order.
     */
    public Map<String, Long> getThreatStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        threatCounters.forEach((type, counter) -> stats.put(type.getValue(), counter.sum()));
        return stats;
    }

    public PatternSnapshot getPatterns() {
        return patternStore.current();
    }

    /**
     * @throws PatternConfigurationException if the pattern file is rejected
     */
    public PatternSnapshot reloadPatterns() {
        return patternStore.reload();
    }

    private Optional<Detection> detect(String text, PatternSnapshot snapshot) {
        for (DetectionLayer layer : layers) {
            Span layerSpan = tracer.nextSpan()
                    .name("scan.layer." + layer.getName())
                    .tag("layer.name", layer.getName())
                    .tag("patterns.version", String.valueOf(snapshot.version()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(layerSpan)) {
                Optional<Detection> detection = layer.detect(text, snapshot);
                layerSpan.tag("layer.detected", String.valueOf(detection.isPresent()));
                if (detection.isPresent()) {
                    return detection;
                }
            } catch (Exception e) {
                layerSpan.error(e);
                log.error("Detection layer {} failed, continuing with next layer: {}",
                        layer.getName(), e.getMessage(), e);
            } finally {
                layerSpan.end();
            }
        }
        return Optional.empty();
    }

    private SecurityEventRecord toSecurityEvent(ScanResult result, String text, int inputBytes, ScanContext ctx) {
        return SecurityEventRecord.builder()
                .eventId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .inputHash(sha256Hex(text))
                .inputLength(inputBytes)
                .safe(result.isSafe())
                .threatType(result.getThreatType() != null ? result.getThreatType().getValue() : null)
                .confidence(result.getConfidence())
                .matchedPatterns(result.getMatchedPatterns())
                .scanDurationMs(result.getScanDurationMs())
                .sessionId(ctx.getSessionId())
                .userId(ctx.getUserId())
                .agentId(ctx.getAgentId())
                .scannerVersion(config.getScannerVersion())
                .scanType(ctx.getScanType().getValue())
                .build();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
