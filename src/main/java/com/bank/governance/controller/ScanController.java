package com.bank.governance.controller;

import com.bank.governance.engine.PatternSnapshot;
import com.bank.governance.model.DetectionPattern;
import com.bank.governance.model.Outcome;
import com.bank.governance.model.ScanContext;
import com.bank.governance.model.ScanRequest;
import com.bank.governance.model.ScanResult;
import com.bank.governance.model.ValidationError;
import com.bank.governance.service.SecurityScannerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/security")
@Tag(name = "Security Scanner", description = "Prompt-injection scanning of user input and inter-agent output")
public class ScanController {

    private final SecurityScannerService scannerService;

    public ScanController(SecurityScannerService scannerService) {
        this.scannerService = scannerService;
    }

    @Operation(summary = "Scan user input",
            description = "Runs pattern, structural and (optionally) semantic detection. " +
                    "Unsafe input is returned with a sanitized variant.")
    @ApiResponse(responseCode = "200", description = "Scan verdict",
            content = @Content(schema = @Schema(implementation = ScanResult.class)))
    @ApiResponse(responseCode = "400", description = "Missing or oversized text")
    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestBody ScanRequest request) {
        Outcome<ScanResult> outcome = scannerService.scanInput(request.getText(), ScanContext.builder()
                .sessionId(request.getSessionId())
                .userId(request.getUserId())
                .agentId(request.getAgentId())
                .build());
        return respond(outcome);
    }

    @Operation(summary = "Scan agent output",
            description = "Same detection as /scan, applied to text one agent hands to another. agentId is required.")
    @ApiResponse(responseCode = "200", description = "Scan verdict",
            content = @Content(schema = @Schema(implementation = ScanResult.class)))
    @ApiResponse(responseCode = "400", description = "Missing agentId or text")
    @PostMapping("/scan/agent-output")
    public ResponseEntity<?> scanAgentOutput(@RequestBody ScanRequest request) {
        return respond(scannerService.scanAgentOutput(request.getAgentId(), request.getText()));
    }

    @Operation(summary = "Sanitize text",
            description = "Removes known injection phrases and delimiters. Idempotent.")
    @PostMapping("/sanitize")
    public ResponseEntity<Map<String, String>> sanitize(@RequestBody Map<String, String> body) {
        return ResponseEntity.ok(Map.of("sanitized", scannerService.sanitize(body.get("text"))));
    }

    @Operation(summary = "List detection patterns",
            description = "Returns the active pattern snapshot: built-in, file and runtime patterns in evaluation order.")
    @GetMapping("/patterns")
    public ResponseEntity<PatternSnapshot> getPatterns() {
        return ResponseEntity.ok(scannerService.getPatterns());
    }

    @Operation(summary = "Add a runtime pattern",
            description = "Compiles and publishes a new pattern. Lost on restart; add to the pattern file to persist.")
    @ApiResponse(responseCode = "201", description = "Pattern published",
            content = @Content(schema = @Schema(implementation = DetectionPattern.class)))
    @ApiResponse(responseCode = "400", description = "Invalid regex or unknown threat type")
    @PostMapping("/patterns")
    public ResponseEntity<?> addPattern(@RequestBody Map<String, String> body) {
        Outcome<DetectionPattern> outcome = scannerService.addPattern(body.get("pattern"), body.get("threatType"));
        if (!outcome.isOk()) {
            return badRequest(outcome.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(outcome.get());
    }

    @Operation(summary = "Reload the pattern file",
            description = "Re-reads governance.scanner.patterns-file. A rejected file leaves the current patterns active.")
    @PostMapping("/patterns/reload")
    public ResponseEntity<PatternSnapshot> reloadPatterns() {
        return ResponseEntity.ok(scannerService.reloadPatterns());
    }

    @Operation(summary = "Threat statistics", description = "Detections per threat type since startup")
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Long>> getStats() {
        return ResponseEntity.ok(scannerService.getThreatStats());
    }

    private ResponseEntity<?> respond(Outcome<ScanResult> outcome) {
        if (!outcome.isOk()) {
            return badRequest(outcome.getError());
        }
        return ResponseEntity.ok(outcome.get());
    }

    private ResponseEntity<Map<String, String>> badRequest(ValidationError error) {
        return ResponseEntity.badRequest().body(Map.of("error", error.message(), "field", error.field()));
    }
}
