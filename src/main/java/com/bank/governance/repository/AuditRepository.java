package com.bank.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.governance.audit.HitlDecisionRecord;
import com.bank.governance.audit.SecurityEventRecord;
import com.bank.governance.config.AerospikeConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only writer for the {@code security_events} and {@code hitl_decisions} sets.
 * Rows are written with CREATE_ONLY and never updated.
 */
@Repository
public class AuditRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final ObjectMapper objectMapper;

    public AuditRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.objectMapper = new ObjectMapper();
    }

    public void saveSecurityEvent(SecurityEventRecord event) {
        Key key = new Key(namespace, AerospikeConfig.SET_SECURITY_EVENTS, event.getEventId());

        client.put(createOnlyPolicy, key,
                new Bin("eventId", event.getEventId()),
                new Bin("timestamp", event.getTimestamp()),
                new Bin("inputHash", event.getInputHash()),
                new Bin("inputLength", event.getInputLength()),
                new Bin("isSafe", event.isSafe()),
                stringBin("threatType", event.getThreatType()),
                new Bin("confidence", event.getConfidence()),
                new Bin("matchedPatterns", serializeList(event.getMatchedPatterns())),
                new Bin("scanDurationMs", event.getScanDurationMs()),
                stringBin("sessionId", event.getSessionId()),
                stringBin("userId", event.getUserId()),
                stringBin("agentId", event.getAgentId()),
                stringBin("scannerVersion", event.getScannerVersion()),
                stringBin("scanType", event.getScanType()));
    }

    public void saveHitlDecision(HitlDecisionRecord decision) {
        Key key = new Key(namespace, AerospikeConfig.SET_HITL_DECISIONS, decision.getDecisionId());

        client.put(createOnlyPolicy, key,
                new Bin("decisionId", decision.getDecisionId()),
                new Bin("timestamp", decision.getTimestamp()),
                new Bin("shouldInterrupt", decision.isShouldInterrupt()),
                new Bin("reason", decision.getReason()),
                new Bin("tier", decision.getTier()),
                new Bin("confidence", decision.getConfidence()),
                decision.getAmount() != null ? new Bin("amount", decision.getAmount().doubleValue()) : Bin.asNull("amount"),
                stringBin("disputeType", decision.getDisputeType()),
                stringBin("actionType", decision.getActionType()),
                stringBin("sessionId", decision.getSessionId()),
                stringBin("agentId", decision.getAgentId()));
    }

    /**
     * Scan the whole decision log. Used for restart-safe escalation statistics.
     */
    public List<HitlDecisionRecord> findAllHitlDecisions() {
        List<HitlDecisionRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_HITL_DECISIONS,
                (key, record) -> {
                    try {
                        HitlDecisionRecord mapped = mapDecision(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read hitl decision record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private HitlDecisionRecord mapDecision(Record record) {
        return HitlDecisionRecord.builder()
                .decisionId(record.getString("decisionId"))
                .timestamp(record.getLong("timestamp"))
                .shouldInterrupt(record.getBoolean("shouldInterrupt"))
                .reason(record.getString("reason"))
                .tier(record.getString("tier"))
                .confidence(record.getDouble("confidence"))
                .amount(record.getValue("amount") != null ? record.getDouble("amount") : null)
                .disputeType(record.getString("disputeType"))
                .actionType(record.getString("actionType"))
                .sessionId(record.getString("sessionId"))
                .agentId(record.getString("agentId"))
                .build();
    }

    private static Bin stringBin(String name, String value) {
        return value != null ? new Bin(name, value) : Bin.asNull(name);
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize list", e);
            return "[]";
        }
    }
}
