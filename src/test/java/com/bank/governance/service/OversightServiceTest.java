package com.bank.governance.service;

import com.bank.governance.audit.AuditSink;
import com.bank.governance.audit.HitlDecisionRecord;
import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.OversightConfig;
import com.bank.governance.engine.OversightClassifier;
import com.bank.governance.model.ActionDescriptor;
import com.bank.governance.model.EscalationStats;
import com.bank.governance.model.InterruptDecision;
import com.bank.governance.model.Outcome;
import com.bank.governance.model.OversightTier;
import com.bank.governance.repository.AuditRepository;
import com.bank.governance.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OversightServiceTest {

    @Mock private AuditSink auditSink;
    @Mock private AuditRepository auditRepository;
    @Mock private MetricsConfig metricsConfig;

    private OversightConfig config;
    private OversightService service;

    @BeforeEach
    void setUp() {
        config = new OversightConfig();
        service = new OversightService(new OversightClassifier(config), auditSink, auditRepository, metricsConfig);
    }

    @Test
    void tier1Action_interruptsAndAuditsOnce() {
        Outcome<InterruptDecision> outcome = service.shouldInterrupt(
                TestDataFactory.createAction(0.98, null, "general", "sar_filing"));

        InterruptDecision decision = outcome.get();
        assertThat(decision.isShouldInterrupt()).isTrue();
        assertThat(decision.getTier()).isEqualTo(OversightTier.TIER_1_HIGH);
        assertThat(decision.getReason()).isEqualTo("tier_1_action:sar_filing");
        assertThat(decision.getDecisionId()).isNotNull();
        assertThat(decision.getTimestamp()).isNotNull();

        ArgumentCaptor<HitlDecisionRecord> captor = ArgumentCaptor.forClass(HitlDecisionRecord.class);
        verify(auditSink, times(1)).append(captor.capture());
        HitlDecisionRecord record = captor.getValue();
        assertThat(record.getDecisionId()).isEqualTo(decision.getDecisionId().toString());
        assertThat(record.getTier()).isEqualTo("tier_1");
        assertThat(record.isShouldInterrupt()).isTrue();
        assertThat(record.getSessionId()).isEqualTo("sess-1");
        assertThat(record.getAgentId()).isEqualTo("dispute-agent");
        verify(metricsConfig).recordDecision("tier_1", true);
    }

    @Test
    void lowConfidenceHighAmount_sampledIntoReview() {
        config.setSampleRateTier2(1.0);

        InterruptDecision decision = service.shouldInterrupt(0.72, 15_000.0, "general", "refund_issue").get();

        assertThat(decision.getTier()).isEqualTo(OversightTier.TIER_2_MEDIUM);
        assertThat(decision.isShouldInterrupt()).isTrue();
        assertThat(decision.getSampled()).isTrue();
        assertThat(decision.getReason()).contains("low_confidence:0.72<0.85").contains("high_amount:15000>10000");
    }

    @Test
    void missingDisputeType_defaultsToGeneral() {
        InterruptDecision decision = service.shouldInterrupt(0.95, null, null, "info_lookup").get();

        assertThat(decision.getDisputeType()).isEqualTo("general");
        assertThat(decision.getTier()).isEqualTo(OversightTier.TIER_3_LOW);
        assertThat(decision.isShouldInterrupt()).isFalse();
    }

    @Test
    void invalidConfidence_rejectedWithoutAudit() {
        assertThat(service.shouldInterrupt(1.5, null, "general", "refund_issue").getError().field())
                .isEqualTo("confidence");
        assertThat(service.shouldInterrupt(-0.1, null, "general", "refund_issue").getError().field())
                .isEqualTo("confidence");
        assertThat(service.shouldInterrupt(Double.NaN, null, "general", "refund_issue").getError().field())
                .isEqualTo("confidence");
        assertThat(service.shouldInterrupt(ActionDescriptor.builder().actionType("refund_issue").build())
                .getError().field()).isEqualTo("confidence");
        verifyNoInteractions(auditSink);
    }

    @Test
    void invalidAmount_rejected() {
        assertThat(service.shouldInterrupt(0.9, -1.0, "general", "refund_issue").getError().field())
                .isEqualTo("amount");
        assertThat(service.shouldInterrupt(0.9, Double.POSITIVE_INFINITY, "general", "refund_issue")
                .getError().field()).isEqualTo("amount");
        verifyNoInteractions(auditSink);
    }

    @Test
    void nullDescriptor_rejected() {
        assertThat(service.shouldInterrupt(null).isOk()).isFalse();
    }

    @Test
    void everyDecision_getsDistinctId() {
        InterruptDecision first = service.shouldInterrupt(0.95, null, "general", "info_lookup").get();
        InterruptDecision second = service.shouldInterrupt(0.95, null, "general", "info_lookup").get();

        assertThat(first.getDecisionId()).isNotEqualTo(second.getDecisionId());
        verify(auditSink, times(2)).append(any(HitlDecisionRecord.class));
    }

    @Test
    void getTier_usesTypeRules() {
        assertThat(service.getTier("general", "fraud_escalation")).isEqualTo(OversightTier.TIER_1_HIGH);
        assertThat(service.getTier("account_takeover", "refund_issue")).isEqualTo(OversightTier.TIER_2_MEDIUM);
        assertThat(service.getTier(null, "knowledge_search")).isEqualTo(OversightTier.TIER_3_LOW);
    }

    @Test
    void getEscalationStats_computedFromDecisionLog() {
        when(auditRepository.findAllHitlDecisions()).thenReturn(List.of(
                TestDataFactory.createDecisionRecord("tier_1", true),
                TestDataFactory.createDecisionRecord("tier_1", true),
                TestDataFactory.createDecisionRecord("tier_2", true),
                TestDataFactory.createDecisionRecord("tier_2", false),
                TestDataFactory.createDecisionRecord("tier_2", false),
                TestDataFactory.createDecisionRecord("tier_2", false),
                TestDataFactory.createDecisionRecord("tier_3", false),
                TestDataFactory.createDecisionRecord("tier_3", false)));
        when(auditSink.getLossCount()).thenReturn(3L);

        EscalationStats stats = service.getEscalationStats();

        assertThat(stats.getTotalDecisions()).isEqualTo(8);
        assertThat(stats.getTierCounts()).containsEntry("tier_1", 2L).containsEntry("tier_2", 4L).containsEntry("tier_3", 2L);
        assertThat(stats.getInterruptCounts()).containsEntry("tier_1", 2L).containsEntry("tier_2", 1L);
        assertThat(stats.getInterruptRates().get("tier_1")).isEqualTo(1.0);
        assertThat(stats.getInterruptRates().get("tier_2")).isEqualTo(0.25);
        assertThat(stats.getInterruptRates().get("tier_3")).isEqualTo(0.0);
        assertThat(stats.getInterruptRate()).isCloseTo(0.375, within(1e-9));
        assertThat(stats.getAutoProcessRate()).isCloseTo(0.625, within(1e-9));
        assertThat(stats.getAuditLoss()).isEqualTo(3L);
    }

    @Test
    void getEscalationStats_emptyLog_zeroRates() {
        when(auditRepository.findAllHitlDecisions()).thenReturn(List.of());

        EscalationStats stats = service.getEscalationStats();

        assertThat(stats.getTotalDecisions()).isZero();
        assertThat(stats.getInterruptRate()).isZero();
        assertThat(stats.getAutoProcessRate()).isZero();
        assertThat(stats.getTierCounts()).containsOnlyKeys("tier_1", "tier_2", "tier_3");
    }
}
