package com.bank.governance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single detection rule owned by the pattern store. Regexes are compiled once, case-insensitively.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Schema(description = "Prompt-injection detection pattern")
public class DetectionPattern {

    @Schema(description = "Stable pattern identifier", example = "PAT-INSTRUCTION_OVERRIDE-1")
    String id;

    @Schema(description = "Threat category reported when this pattern matches", example = "instruction_override")
    ThreatType threatType;

    @Schema(description = "Case-insensitive regular expression", example = "ignore\\s+(all\\s+)?(previous\\s+)?instructions?")
    String pattern;

    @Schema(description = "Disabled patterns stay listed but are never evaluated", example = "true")
    boolean enabled;

    @Schema(description = "Origin of the pattern", example = "BUILT_IN")
    PatternSource source;

    @JsonIgnore
    Pattern compiled;

    /**
     * @throws PatternSyntaxException if the regex does not compile
     */
    public static DetectionPattern compile(String id, ThreatType threatType, String regex,
                                           boolean enabled, PatternSource source) {
        Pattern compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new DetectionPattern(id, threatType, regex, enabled, source, compiled);
    }

    public boolean matches(String text) {
        return compiled.matcher(text).find();
    }
}
