package com.bank.governance.engine;

import com.bank.governance.model.DetectionPattern;
import com.bank.governance.model.PatternSource;
import com.bank.governance.model.ThreatType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default Layer 1 patterns (OWASP LLM01 prompt injection families). Order here is evaluation order.
 */
final class BuiltInPatterns {

    private static final Map<ThreatType, List<String>> DEFAULTS = new LinkedHashMap<>();

    static {
        DEFAULTS.put(ThreatType.INSTRUCTION_OVERRIDE, List.of(
                "ignore\\s+(all\\s+)?(previous\\s+)?instructions?",
                "ignore\\s+(your|the)\\s+instructions?",
                "disregard\\s+(all\\s+)?(prior\\s+)?(instructions?|context|safety\\s+guidelines?)",
                "forget\\s+(everything|what)\\s+(you|I)\\s+(said|told)",
                "override\\s+(your|the)\\s+(programming|instructions?)"));

        DEFAULTS.put(ThreatType.ROLE_HIJACK, List.of(
                "you\\s+are\\s+now\\s+",
                "act\\s+as\\s+(if\\s+you\\s+are\\s+)?",
                "pretend\\s+(to\\s+be|you('re|\\s+are))",
                "from\\s+now\\s+on\\s+you('re|\\s+are)"));

        DEFAULTS.put(ThreatType.PROMPT_LEAK, List.of(
                "(show|reveal|print|output)\\s+(me\\s+)?(your|the)\\s+(system\\s+)?prompt",
                "(show|reveal|print|output)\\s+(me\\s+)?(your|the)\\s+instructions?",
                "what\\s+(are|is)\\s+your\\s+(instructions?|system\\s+prompt)",
                "repeat\\s+(back\\s+)?(your|the)\\s+instructions?"));

        DEFAULTS.put(ThreatType.DELIMITER_INJECTION, List.of(
                "```\\s*system",
                "\\[INST\\]",
                "<\\|im_start\\|>",
                "Human:\\s*.*\\s*Assistant:"));

        DEFAULTS.put(ThreatType.JAILBREAK, List.of(
                "DAN\\s+mode",
                "developer\\s+mode\\s+(enabled|activated|for)",
                "(no|without)\\s+(ethical|safety)\\s+(guidelines|restrictions)"));
    }

    private BuiltInPatterns() {
    }

    /**
     * Compile the defaults with ids of the form {@code PAT-<THREAT_TYPE>-<n>}, n starting at 1 per type.
     */
    static List<DetectionPattern> compile() {
        List<DetectionPattern> patterns = new ArrayList<>();
        for (Map.Entry<ThreatType, List<String>> entry : DEFAULTS.entrySet()) {
            int n = 1;
            for (String regex : entry.getValue()) {
                String id = "PAT-" + entry.getKey().name() + "-" + n++;
                patterns.add(DetectionPattern.compile(id, entry.getKey(), regex, true, PatternSource.BUILT_IN));
            }
        }
        return patterns;
    }
}
