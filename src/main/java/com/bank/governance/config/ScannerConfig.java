package com.bank.governance.config;

import com.bank.governance.exception.GovernanceConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "governance.scanner")
public class ScannerConfig {

    // Optional JSON pattern file, appended after the built-in patterns.
    private String patternsFile;

    // How often (in seconds) to check the pattern file for changes.
    private int patternReloadSeconds = 30;

    // Gates the Layer 3 semantic classifier.
    private boolean enableLlmGuard = false;

    // Maximum scan input size in UTF-8 bytes.
    private int maxInputLength = 10240;

    // Written to every security_events row.
    private String scannerVersion = "1.0.0";

    private SemanticClassifier semanticClassifier = new SemanticClassifier();

    @Data
    public static class SemanticClassifier {
        private String url;
        private int timeoutMs = 500;
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_OPEN;
        // Classifier scores at or above this count as malicious.
        private double maliciousThreshold = 0.5;
    }

    /**
     * What a scan reports when the semantic classifier is unreachable or times out.
     * FAIL_OPEN keeps the pattern and structural verdict; FAIL_CLOSED blocks the input.
     */
    public enum FailurePolicy {
        FAIL_OPEN,
        FAIL_CLOSED
    }

    @PostConstruct
    public void validate() {
        if (maxInputLength <= 0) {
            throw new GovernanceConfigurationException("governance.scanner.max-input-length must be > 0");
        }
        if (patternReloadSeconds <= 0) {
            throw new GovernanceConfigurationException("governance.scanner.pattern-reload-seconds must be > 0");
        }
        if (semanticClassifier.getTimeoutMs() <= 0) {
            throw new GovernanceConfigurationException(
                    "governance.scanner.semantic-classifier.timeout-ms must be > 0");
        }
        double threshold = semanticClassifier.getMaliciousThreshold();
        if (threshold < 0 || threshold > 1) {
            throw new GovernanceConfigurationException(
                    "governance.scanner.semantic-classifier.malicious-threshold must be in [0, 1]");
        }
        if (enableLlmGuard && (semanticClassifier.getUrl() == null || semanticClassifier.getUrl().isBlank())) {
            throw new GovernanceConfigurationException(
                    "governance.scanner.semantic-classifier.url is required when enable-llm-guard is true");
        }
    }
}
