package com.bank.governance.engine.layers;

import com.bank.governance.engine.Detection;
import com.bank.governance.engine.DetectionLayer;
import com.bank.governance.engine.PatternSnapshot;
import com.bank.governance.model.ThreatType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Layer 2: structural signs of injection that phrase lists miss. Two independent checks,
 * role-override phrasing and chat-template delimiters, evaluated in that order.
 */
@Component
public class StructuralHeuristicLayer implements DetectionLayer {

    public static final String NAME = "structural";
    public static final String ROLE_OVERRIDE_ID = "structural_role_override";
    public static final String DELIMITER_ID = "structural_delimiter";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // Gaps stay inside one sentence and match reluctantly, so removal never spans unrelated text.
    static final List<Pattern> ROLE_OVERRIDE = List.of(
            Pattern.compile("from\\s+now\\s+on[^.!?\\n]{0,80}?you('re|\\s+are)", FLAGS),
            Pattern.compile("for\\s+the\\s+rest\\s+of[^.!?\\n]{0,40}?conversation[^.!?\\n]{0,40}?you", FLAGS),
            Pattern.compile("new\\s+identity[^.!?\\n]{0,80}?you\\s+are", FLAGS));

    static final List<Pattern> DELIMITERS = List.of(
            Pattern.compile("<\\|[^|<>\\s]{1,40}\\|>", FLAGS),
            Pattern.compile("\\[/?INST\\]", FLAGS),
            Pattern.compile("###\\s*(System|Human|Assistant)", FLAGS),
            Pattern.compile("<(system|user|assistant)>", FLAGS),
            Pattern.compile("```\\s*system", FLAGS));

    static final double ROLE_OVERRIDE_CONFIDENCE = 0.85;
    static final double DELIMITER_CONFIDENCE = 0.90;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 2;
    }

    @Override
    public Optional<Detection> detect(String text, PatternSnapshot snapshot) {
        if (anyMatch(ROLE_OVERRIDE, text)) {
            return Optional.of(detection(ThreatType.ROLE_HIJACK, ROLE_OVERRIDE_CONFIDENCE, ROLE_OVERRIDE_ID,
                    "role override phrasing"));
        }
        if (anyMatch(DELIMITERS, text)) {
            return Optional.of(detection(ThreatType.DELIMITER_INJECTION, DELIMITER_CONFIDENCE, DELIMITER_ID,
                    "instruction delimiter or fabricated chat-role marker"));
        }
        return Optional.empty();
    }

    /**
     * All structural regexes, for removal by the sanitizer.
     */
    public static List<Pattern> removablePatterns() {
        List<Pattern> all = new ArrayList<>(ROLE_OVERRIDE);
        all.addAll(DELIMITERS);
        return all;
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private Detection detection(ThreatType type, double confidence, String id, String reason) {
        return Detection.builder()
                .threatType(type)
                .confidence(confidence)
                .matchedPattern(id)
                .reason(reason)
                .layer(NAME)
                .build();
    }
}
