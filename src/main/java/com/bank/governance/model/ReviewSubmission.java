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
@Schema(description = "Request to place an interrupted action in front of a human reviewer")
public class ReviewSubmission {

    @Schema(description = "The interrupting decision returned by /api/v1/oversight/evaluate")
    private InterruptDecision decision;

    @Schema(description = "Everything the reviewer needs, stored verbatim")
    private Map<String, Object> context;
}
