package com.bank.governance.engine;

import com.bank.governance.engine.layers.StructuralHeuristicLayer;
import com.bank.governance.model.DetectionPattern;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips detected injection substrings while keeping the surrounding text.
 *
 * <p>Removal and whitespace collapsing repeat until nothing changes, so the output never contains
 * a removable match and {@code sanitize(sanitize(x)) == sanitize(x)}.
 */
@Component
public class InputSanitizer {

    // trailing exfiltration requests left behind once the injection itself is removed
    private static final List<Pattern> FOLLOW_UP_PHRASES = List.of(
            Pattern.compile("and\\s+reveal\\s+\\w+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("and\\s+show\\s+\\w+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("and\\s+tell\\s+me\\s+\\w+", Pattern.CASE_INSENSITIVE));

    private static final Pattern FILLER_WORDS =
            Pattern.compile("\\b(and|the|a|an|to|for|is|are|was|were)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final int MIN_MEANINGFUL_LENGTH = 5;
    static final int MIN_RESULT_LENGTH = 3;

    public String sanitize(String text, PatternSnapshot snapshot) {
        if (text == null) {
            return "";
        }
        List<Pattern> threats = new ArrayList<>();
        for (DetectionPattern pattern : snapshot.enabledPatterns()) {
            threats.add(pattern.getCompiled());
        }
        threats.addAll(StructuralHeuristicLayer.removablePatterns());

        if (!anyMatch(threats, text)) {
            return text;
        }

        List<Pattern> removable = new ArrayList<>(threats);
        removable.addAll(FOLLOW_UP_PHRASES);

        String current = text;
        String previous;
        do {
            previous = current;
            current = collapse(removeAll(removable, current));
        } while (!current.equals(previous));

        String meaningful = collapse(FILLER_WORDS.matcher(current).replaceAll(""));
        if (meaningful.length() < MIN_MEANINGFUL_LENGTH) {
            return "";
        }
        if (current.length() < MIN_RESULT_LENGTH) {
            return "";
        }
        return current;
    }

    private static String removeAll(List<Pattern> patterns, String text) {
        String current = text;
        String previous;
        do {
            previous = current;
            for (Pattern p : patterns) {
                current = p.matcher(current).replaceAll("");
            }
        } while (!current.equals(previous));
        return current;
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
