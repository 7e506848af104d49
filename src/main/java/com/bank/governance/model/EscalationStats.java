package com.bank.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Escalation statistics computed from the durable decision log")
public class EscalationStats {

    @Schema(description = "Decisions recorded in the audit log", example = "1200")
    private long totalDecisions;

    @Schema(description = "Decision count per tier")
    private Map<String, Long> tierCounts;

    @Schema(description = "Interrupting decision count per tier")
    private Map<String, Long> interruptCounts;

    @Schema(description = "Share of decisions in each tier that interrupted (0-1)")
    private Map<String, Double> interruptRates;

    @Schema(description = "Overall share of interrupting decisions (0-1)", example = "0.12")
    private double interruptRate;

    @Schema(description = "Overall share of automatically processed decisions (0-1)", example = "0.88")
    private double autoProcessRate;

    @Schema(description = "Audit events dropped since startup; stats may undercount by this much", example = "0")
    private long auditLoss;
}
