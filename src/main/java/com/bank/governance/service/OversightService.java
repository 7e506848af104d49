package com.bank.governance.service;

import com.bank.governance.audit.AuditSink;
import com.bank.governance.audit.HitlDecisionRecord;
import com.bank.governance.config.MetricsConfig;
import com.bank.governance.engine.OversightClassifier;
import com.bank.governance.engine.OversightClassifier.Classification;
import com.bank.governance.model.ActionDescriptor;
import com.bank.governance.model.EscalationStats;
import com.bank.governance.model.InterruptDecision;
import com.bank.governance.model.Outcome;
import com.bank.governance.model.OversightTier;
import com.bank.governance.repository.AuditRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class OversightService {

    private static final Logger log = LoggerFactory.getLogger(OversightService.class);

    private final OversightClassifier classifier;
    private final AuditSink auditSink;
    private final AuditRepository auditRepository;
    private final MetricsConfig metricsConfig;

    public OversightService(OversightClassifier classifier,
                            AuditSink auditSink,
                            AuditRepository auditRepository,
                            MetricsConfig metricsConfig) {
        this.classifier = classifier;
        this.auditSink = auditSink;
        this.auditRepository = auditRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Classify a proposed action and decide whether it must pause for human review.
     * Every accepted call writes exactly one decision row to the audit trail.
     */
    @Observed(name = "oversight.should_interrupt", contextualName = "should-interrupt")
    public Outcome<InterruptDecision> shouldInterrupt(ActionDescriptor action) {
        if (action == null) {
            return Outcome.rejected("action", "action descriptor is required");
        }
        Double confidence = action.getConfidence();
        if (confidence == null) {
            return Outcome.rejected("confidence", "confidence is required");
        }
        if (!Double.isFinite(confidence) || confidence < 0 || confidence > 1) {
            return Outcome.rejected("confidence", "confidence must be in [0, 1], got " + confidence);
        }
        Double amount = action.getAmount();
        if (amount != null && (!Double.isFinite(amount) || amount < 0)) {
            return Outcome.rejected("amount", "amount must be a finite value >= 0, got " + amount);
        }
        String disputeType = action.getDisputeType() != null && !action.getDisputeType().isBlank()
                ? action.getDisputeType() : ActionDescriptor.DEFAULT_DISPUTE_TYPE;

        UUID decisionId = UUID.randomUUID();
        Classification classification = classifier.classify(
                decisionId, confidence, amount, disputeType, action.getActionType());

        InterruptDecision decision = InterruptDecision.builder()
                .shouldInterrupt(classification.isShouldInterrupt())
                .reason(classification.getReason())
                .tier(classification.getTier())
                .confidence(confidence)
                .amount(amount)
                .disputeType(disputeType)
                .actionType(action.getActionType())
                .sampled(classification.getSampled())
                .timestamp(Instant.now())
                .decisionId(decisionId)
                .build();

        metricsConfig.recordDecision(decision.getTier().getValue(), decision.isShouldInterrupt());
        if (decision.isShouldInterrupt()) {
            log.info("Action interrupted: decision={}, tier={}, action={}, reason={}",
                    decisionId, decision.getTier().getValue(), decision.getActionType(), decision.getReason());
        } else {
            log.debug("Action auto-processed: decision={}, tier={}, reason={}",
                    decisionId, decision.getTier().getValue(), decision.getReason());
        }

        auditSink.append(HitlDecisionRecord.builder()
                .decisionId(decisionId.toString())
                .timestamp(decision.getTimestamp().toEpochMilli())
                .shouldInterrupt(decision.isShouldInterrupt())
                .reason(decision.getReason())
                .tier(decision.getTier().getValue())
                .confidence(confidence)
                .amount(amount)
                .disputeType(disputeType)
                .actionType(decision.getActionType())
                .sessionId(action.getSessionId())
                .agentId(action.getAgentId())
                .build());

        return Outcome.ok(decision);
    }

    public Outcome<InterruptDecision> shouldInterrupt(double confidence, Double amount,
                                                      String disputeType, String actionType) {
        return shouldInterrupt(ActionDescriptor.builder()
                .confidence(confidence)
                .amount(amount)
                .disputeType(disputeType)
                .actionType(actionType)
                .build());
    }

    public OversightTier getTier(String disputeType, String actionType) {
        String dispute = disputeType != null && !disputeType.isBlank()
                ? disputeType : ActionDescriptor.DEFAULT_DISPUTE_TYPE;
        return classifier.tierFor(dispute, actionType);
    }

    /**
     * Escalation rates computed from the durable decision log, so they survive restarts.
     */
    public EscalationStats getEscalationStats() {
        List<HitlDecisionRecord> decisions = auditRepository.findAllHitlDecisions();

        Map<String, Long> tierCounts = new LinkedHashMap<>();
        Map<String, Long> interruptCounts = new LinkedHashMap<>();
        for (OversightTier tier : OversightTier.values()) {
            tierCounts.put(tier.getValue(), 0L);
            interruptCounts.put(tier.getValue(), 0L);
        }

        long interrupts = 0;
        for (HitlDecisionRecord decision : decisions) {
            tierCounts.merge(decision.getTier(), 1L, Long::sum);
            if (decision.isShouldInterrupt()) {
                interruptCounts.merge(decision.getTier(), 1L, Long::sum);
                interrupts++;
            }
        }

        Map<String, Double> interruptRates = new LinkedHashMap<>();
        tierCounts.forEach((tier, count) ->
                interruptRates.put(tier, ratio(interruptCounts.getOrDefault(tier, 0L), count)));

        long total = decisions.size();
        double interruptRate = ratio(interrupts, total);
        return EscalationStats.builder()
                .totalDecisions(total)
                .tierCounts(tierCounts)
                .interruptCounts(interruptCounts)
                .interruptRates(interruptRates)
                .interruptRate(interruptRate)
                .autoProcessRate(total == 0 ? 0.0 : 1.0 - interruptRate)
                .auditLoss(auditSink.getLossCount())
                .build();
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
