package com.bank.governance.engine.layers;

import com.bank.governance.client.SemanticClassifierClient;
import com.bank.governance.client.SemanticClassifierException;
import com.bank.governance.client.SemanticVerdict;
import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.ScannerConfig;
import com.bank.governance.engine.Detection;
import com.bank.governance.engine.DetectionLayer;
import com.bank.governance.engine.PatternSnapshot;
import com.bank.governance.model.ThreatType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Layer 3: delegates to the external semantic classifier when {@code enable-llm-guard} is set.
 * Classifier failures never escape; they resolve per the configured failure policy.
 */
@Component
public class SemanticClassifierLayer implements DetectionLayer {

    private static final Logger log = LoggerFactory.getLogger(SemanticClassifierLayer.class);

    public static final String NAME = "semantic";
    public static final String UNAVAILABLE_REASON = "semantic_classifier_unavailable";

    private final SemanticClassifierClient client;
    private final ScannerConfig config;
    private final MetricsConfig metricsConfig;

    public SemanticClassifierLayer(SemanticClassifierClient client, ScannerConfig config,
                                   MetricsConfig metricsConfig) {
        this.client = client;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 3;
    }

    @Override
    public Optional<Detection> detect(String text, PatternSnapshot snapshot) {
        if (!config.isEnableLlmGuard()) {
            return Optional.empty();
        }

        ScannerConfig.SemanticClassifier settings = config.getSemanticClassifier();
        SemanticVerdict verdict;
        try {
            verdict = client.classify(text);
        } catch (SemanticClassifierException e) {
            ScannerConfig.FailurePolicy policy = settings.getFailurePolicy();
            metricsConfig.recordClassifierFailure(policy.name());
            if (policy == ScannerConfig.FailurePolicy.FAIL_CLOSED) {
                log.warn("Semantic classifier unavailable, failing closed: {}", e.getMessage());
                return Optional.of(Detection.builder()
                        .threatType(ThreatType.CUSTOM)
                        .confidence(1.0)
                        .reason(UNAVAILABLE_REASON)
                        .layer(NAME)
                        .build());
            }
            log.warn("Semantic classifier unavailable, failing open: {}", e.getMessage());
            return Optional.empty();
        }

        if (!verdict.isMalicious() || verdict.getScore() < settings.getMaliciousThreshold()) {
            return Optional.empty();
        }
        ThreatType type = mapLabel(verdict.getLabel());
        return Optional.of(Detection.builder()
                .threatType(type)
                .confidence(verdict.getScore())
                .reason("semantic classifier flagged input"
                        + (verdict.getLabel() != null ? " as " + verdict.getLabel() : "")
                        + " (score " + verdict.getScore() + ")")
                .layer(NAME)
                .build());
    }

    private ThreatType mapLabel(String label) {
        if (label == null || label.isBlank()) {
            return ThreatType.CUSTOM;
        }
        try {
            return ThreatType.fromValue(label);
        } catch (IllegalArgumentException e) {
            log.debug("Unmapped classifier label '{}', reporting as custom", label);
            return ThreatType.CUSTOM;
        }
    }
}
