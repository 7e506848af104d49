package com.bank.governance.engine;

import com.bank.governance.model.ThreatType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A positive verdict from a single detection layer.
 */
@Value
@Builder
public class Detection {
    ThreatType threatType;
    double confidence;
    @Singular
    List<String> matchedPatterns;
    String reason;
    String layer;
}
