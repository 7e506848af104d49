package com.bank.governance.engine;

import com.bank.governance.model.DetectionPattern;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, ordered view of the detection patterns at one point in time.
 * A scan reads exactly one snapshot from start to finish.
 */
public record PatternSnapshot(long version, List<DetectionPattern> patterns, Instant loadedAt) {

    public PatternSnapshot {
        patterns = List.copyOf(patterns);
    }

    public List<DetectionPattern> enabledPatterns() {
        return patterns.stream()
                .filter(DetectionPattern::isEnabled)
                .toList();
    }

    public int size() {
        return patterns.size();
    }
}
