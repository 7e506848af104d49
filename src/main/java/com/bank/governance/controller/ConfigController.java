package com.bank.governance.controller;

import com.bank.governance.config.OversightConfig;
import com.bank.governance.config.OversightSettings;
import com.bank.governance.config.ScannerConfig;
import com.bank.governance.model.OversightTier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (oversight thresholds, scanner settings)")
public class ConfigController {

    private static final Logger log = LoggerFactory.getLogger(ConfigController.class);

    private final OversightConfig oversightConfig;
    private final ScannerConfig scannerConfig;

    public ConfigController(OversightConfig oversightConfig, ScannerConfig scannerConfig) {
        this.oversightConfig = oversightConfig;
        this.scannerConfig = scannerConfig;
    }

    // ── Oversight ──

    @Operation(summary = "Get oversight thresholds and action tiers")
    @GetMapping("/oversight")
    public ResponseEntity<Map<String, Object>> getOversightConfig() {
        return ResponseEntity.ok(describe(oversightConfig.current()));
    }

    @Operation(summary = "Update oversight thresholds and action tiers",
            description = "Omitted fields keep their current value. Changes apply immediately but reset on restart.")
    @PutMapping("/oversight")
    public synchronized ResponseEntity<?> updateOversightConfig(@RequestBody Map<String, Object> body) {
        OversightSettings current = oversightConfig.current();
        OversightTier defaultTier = current.defaultTier();
        if (body.get("defaultTier") != null) {
            try {
                defaultTier = OversightTier.fromValue(body.get("defaultTier").toString());
            } catch (IllegalArgumentException e) {
                return badRequest(e.getMessage(), "defaultTier");
            }
        }
        double confidence = toDouble(body, "confidenceThreshold", current.confidenceThreshold());
        double amount = toDouble(body, "amountThreshold", current.amountThreshold());
        double sampleRate = toDouble(body, "sampleRateTier2", current.sampleRateTier2());

        List<String> tier1 = toStringList(body, "tier1Actions", current.tier1Actions());
        List<String> tier3 = toStringList(body, "tier3Actions", current.tier3Actions());
        List<String> highRisk = toStringList(body, "highRiskDisputeTypes", current.highRiskDisputeTypes());
        if (tier1 == null) return badRequest("tier1Actions must be a list", "tier1Actions");
        if (tier3 == null) return badRequest("tier3Actions must be a list", "tier3Actions");
        if (highRisk == null) return badRequest("highRiskDisputeTypes must be a list", "highRiskDisputeTypes");

        OversightSettings next = new OversightSettings(defaultTier, confidence, amount, sampleRate, tier1, tier3, highRisk);
        String problem = next.describeProblem();
        if (problem != null) {
            return badRequest(problem, "oversight");
        }

        oversightConfig.apply(next);
        log.info("Oversight config updated: defaultTier={}, confidenceThreshold={}, amountThreshold={}, sampleRateTier2={}",
                defaultTier, confidence, amount, sampleRate);

        return ResponseEntity.ok(describe(next));
    }

    // ── Scanner (read-only) ──

    @Operation(summary = "Get scanner settings (read-only)")
    @GetMapping("/scanner")
    public ResponseEntity<Map<String, Object>> getScannerConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("patternsFile", scannerConfig.getPatternsFile());
        config.put("patternReloadSeconds", scannerConfig.getPatternReloadSeconds());
        config.put("enableLlmGuard", scannerConfig.isEnableLlmGuard());
        config.put("maxInputLength", scannerConfig.getMaxInputLength());
        config.put("scannerVersion", scannerConfig.getScannerVersion());
        config.put("semanticClassifierUrl", scannerConfig.getSemanticClassifier().getUrl());
        config.put("semanticClassifierTimeoutMs", scannerConfig.getSemanticClassifier().getTimeoutMs());
        config.put("failurePolicy", scannerConfig.getSemanticClassifier().getFailurePolicy().name());
        config.put("maliciousThreshold", scannerConfig.getSemanticClassifier().getMaliciousThreshold());
        return ResponseEntity.ok(config);
    }

    // ── Helpers ──

    private Map<String, Object> describe(OversightSettings settings) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("defaultTier", settings.defaultTier().name());
        config.put("confidenceThreshold", settings.confidenceThreshold());
        config.put("amountThreshold", settings.amountThreshold());
        config.put("sampleRateTier2", settings.sampleRateTier2());
        config.put("tier1Actions", settings.tier1Actions());
        config.put("tier3Actions", settings.tier3Actions());
        config.put("highRiskDisputeTypes", settings.highRiskDisputeTypes());
        return config;
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }

    // null signals a value that is present but not a list
    private List<String> toStringList(Map<String, Object> body, String key, List<String> defaultVal) {
        Object v = body.get(key);
        if (v == null) return new ArrayList<>(defaultVal);
        if (!(v instanceof List<?> raw)) return null;
        List<String> values = new ArrayList<>();
        for (Object item : raw) {
            String s = Objects.toString(item, "").trim().toLowerCase(Locale.ROOT);
            if (!s.isEmpty() && !values.contains(s)) {
                values.add(s);
            }
        }
        return values;
    }
}
