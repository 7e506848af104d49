package com.bank.governance.engine.layers;

import com.bank.governance.engine.Detection;
import com.bank.governance.engine.DetectionLayer;
import com.bank.governance.engine.PatternSnapshot;
import com.bank.governance.model.DetectionPattern;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Layer 1: enabled snapshot patterns in insertion order, first match wins.
 */
@Component
public class PatternMatchLayer implements DetectionLayer {

    public static final String NAME = "pattern_match";
    static final double CONFIDENCE = 0.95;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 1;
    }

    @Override
    public Optional<Detection> detect(String text, PatternSnapshot snapshot) {
        for (DetectionPattern pattern : snapshot.patterns()) {
            if (pattern.isEnabled() && pattern.matches(text)) {
                return Optional.of(Detection.builder()
                        .threatType(pattern.getThreatType())
                        .confidence(CONFIDENCE)
                        .matchedPattern(pattern.getId())
                        .reason("pattern " + pattern.getId() + " matched (" + pattern.getThreatType().getValue() + ")")
                        .layer(NAME)
                        .build());
            }
        }
        return Optional.empty();
    }
}
