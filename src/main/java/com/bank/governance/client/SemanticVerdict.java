package com.bank.governance.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classifier response: {@code {"malicious": true, "score": 0.93, "label": "jailbreak"}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SemanticVerdict {
    private boolean malicious;
    private double score;
    private String label;   // optional taxonomy hint
}
