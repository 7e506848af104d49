package com.bank.governance.controller;

import com.bank.governance.model.ActionDescriptor;
import com.bank.governance.model.EscalationStats;
import com.bank.governance.model.InterruptDecision;
import com.bank.governance.model.Outcome;
import com.bank.governance.model.OversightTier;
import com.bank.governance.service.OversightService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/oversight")
@Tag(name = "Oversight", description = "Risk-tiered human-in-the-loop classification of agent actions")
public class OversightController {

    private final OversightService oversightService;

    public OversightController(OversightService oversightService) {
        this.oversightService = oversightService;
    }

    @Operation(summary = "Evaluate a proposed action",
            description = "Assigns an oversight tier and decides whether the agent must pause for human review. " +
                    "Every evaluation is written to the audit trail.")
    @ApiResponse(responseCode = "200", description = "Oversight decision",
            content = @Content(schema = @Schema(implementation = InterruptDecision.class)))
    @ApiResponse(responseCode = "400", description = "Confidence or amount out of range")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody ActionDescriptor action) {
        Outcome<InterruptDecision> outcome = oversightService.shouldInterrupt(action);
        if (!outcome.isOk()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", outcome.getError().message(),
                    "field", outcome.getError().field()));
        }
        return ResponseEntity.ok(outcome.get());
    }

    @Operation(summary = "Tier for an action type",
            description = "Type-based rules only; confidence and amount can still escalate a concrete action to Tier 2.")
    @GetMapping("/tier")
    public ResponseEntity<Map<String, Object>> getTier(
            @Parameter(description = "Dispute category", example = "fraud")
            @RequestParam(required = false) String disputeType,
            @Parameter(description = "Proposed action", example = "sar_filing")
            @RequestParam(required = false) String actionType) {
        OversightTier tier = oversightService.getTier(disputeType, actionType);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("disputeType", disputeType);
        response.put("actionType", actionType);
        response.put("tier", tier.getValue());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Escalation statistics",
            description = "Interrupt rates per tier, computed from the durable decision log")
    @GetMapping("/stats")
    public ResponseEntity<EscalationStats> getStats() {
        return ResponseEntity.ok(oversightService.getEscalationStats());
    }
}
