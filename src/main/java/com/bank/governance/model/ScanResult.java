package com.bank.governance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of scanning one piece of untrusted text. Only the {@link #safe} and {@link #threat}
 * factories create instances, so {@code safe == (threatType == null)} always holds.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Schema(description = "Result of a prompt-injection scan")
public class ScanResult {

    @JsonProperty("isSafe")
    @Schema(description = "Whether the text can be passed to an agent", example = "false")
    boolean safe;

    @Schema(description = "Detected threat category, null when safe", example = "instruction_override")
    ThreatType threatType;

    @Schema(description = "Detection confidence (0-1)", example = "0.95")
    double confidence;

    @Schema(description = "Identifiers of the patterns or heuristics that matched, in evaluation order",
            example = "[\"PAT-INSTRUCTION_OVERRIDE-1\"]")
    List<String> matchedPatterns;

    @Schema(description = "Input with detected injections removed; empty when nothing meaningful remains")
    String sanitizedInput;

    @Schema(description = "Wall-clock scan time in milliseconds", example = "0.42")
    double scanDurationMs;

    @Schema(description = "Operator-readable explanation of the verdict",
            example = "pattern PAT-INSTRUCTION_OVERRIDE-1 matched")
    String reason;

    @Schema(description = "Detection layer that produced the verdict", example = "pattern_match")
    String detectionLayer;

    public static ScanResult safe(String input, double scanDurationMs) {
        return new ScanResult(true, null, 1.0, List.of(), input,
                requireDuration(scanDurationMs), "no threat detected", null);
    }

    public static ScanResult threat(ThreatType threatType, double confidence, List<String> matchedPatterns,
                                    String sanitizedInput, double scanDurationMs,
                                    String reason, String detectionLayer) {
        if (threatType == null) {
            throw new IllegalArgumentException("threatType is required for an unsafe result");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        return new ScanResult(false, threatType, confidence,
                matchedPatterns != null ? List.copyOf(matchedPatterns) : List.of(),
                sanitizedInput, requireDuration(scanDurationMs), reason, detectionLayer);
    }

    private static double requireDuration(double scanDurationMs) {
        if (!(scanDurationMs >= 0.0)) {
            throw new IllegalArgumentException("scanDurationMs must be >= 0: " + scanDurationMs);
        }
        return scanDurationMs;
    }
}
