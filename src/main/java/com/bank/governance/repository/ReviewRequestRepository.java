package com.bank.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.governance.config.AerospikeConfig;
import com.bank.governance.exception.ReviewAlreadyResolvedException;
import com.bank.governance.exception.ReviewNotFoundException;
import com.bank.governance.model.OversightTier;
import com.bank.governance.model.PagedResponse;
import com.bank.governance.model.ReviewRequest;
import com.bank.governance.model.ReviewStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class ReviewRequestRepository {

    private static final Logger log = LoggerFactory.getLogger(ReviewRequestRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ReviewRequestRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void create(ReviewRequest request) {
        Key key = key(request.getReviewId());

        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        client.put(createOnly, key,
                new Bin("reviewId", request.getReviewId().toString()),
                new Bin("decisionId", request.getDecisionId().toString()),
                new Bin("createdAt", request.getCreatedAt()),
                new Bin("context", serializeContext(request.getContext())),
                new Bin("status", request.getStatus().name()),
                new Bin("tier", request.getTier().name()),
                new Bin("reason", request.getReason()),
                Bin.asNull("reviewedAt"),
                Bin.asNull("approved"),
                Bin.asNull("reviewerId"),
                Bin.asNull("notes"));
    }

    public ReviewRequest findById(UUID reviewId) {
        Record record = client.get(readPolicy, key(reviewId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Move a PENDING review to a terminal status. The write is conditional on the generation read
     * here, so of two concurrent resolutions exactly one succeeds.
     *
     * @return the review as stored after the transition
     * @throws ReviewNotFoundException        if no review has this id
     * @throws ReviewAlreadyResolvedException if the review is not PENDING or another writer won the race
     */
    public ReviewRequest resolve(UUID reviewId, ReviewStatus newStatus, Boolean approved,
                                 String reviewerId, String notes) {
        if (newStatus == ReviewStatus.PENDING) {
            throw new IllegalArgumentException("Cannot resolve a review to PENDING");
        }
        Key key = key(reviewId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            throw new ReviewNotFoundException(reviewId);
        }
        ReviewRequest current = mapRecord(record);
        if (current.getStatus() != ReviewStatus.PENDING) {
            log.debug("Review {} already has status {}, rejecting transition to {}",
                    reviewId, current.getStatus(), newStatus);
            throw new ReviewAlreadyResolvedException(reviewId, current.getStatus());
        }

        WritePolicy conditional = new WritePolicy(writePolicy);
        conditional.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        conditional.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        conditional.generation = record.generation;

        long now = System.currentTimeMillis();
        try {
            client.put(conditional, key,
                    new Bin("status", newStatus.name()),
                    new Bin("reviewedAt", now),
                    approved != null ? new Bin("approved", approved.booleanValue()) : Bin.asNull("approved"),
                    reviewerId != null ? new Bin("reviewerId", reviewerId) : Bin.asNull("reviewerId"),
                    notes != null ? new Bin("notes", notes) : Bin.asNull("notes"));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                ReviewRequest winner = findById(reviewId);
                ReviewStatus winnerStatus = winner != null ? winner.getStatus() : null;
                log.info("Lost resolution race for review {} (now {})", reviewId, winnerStatus);
                throw new ReviewAlreadyResolvedException(reviewId, winnerStatus);
            }
            throw e;
        }

        return current.toBuilder()
                .status(newStatus)
                .reviewedAt(now)
                .approved(approved)
                .reviewerId(reviewerId)
                .notes(notes)
                .build();
    }

    public List<ReviewRequest> findPending() {
        return scan(ReviewStatus.PENDING);
    }

    /**
     * Newest-first page of reviews in the given status, cursor on {@code createdAt}.
     */
    public PagedResponse<ReviewRequest> findByStatus(ReviewStatus status, int limit, Long before) {
        List<ReviewRequest> results = new ArrayList<>();
        for (ReviewRequest request : scan(status)) {
            if (before == null || request.getCreatedAt() < before) {
                results.add(request);
            }
        }
        results.sort(Comparator.comparingLong(ReviewRequest::getCreatedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<ReviewRequest> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getCreatedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    public Map<ReviewStatus, Integer> countByStatus() {
        Map<ReviewStatus, Integer> counts = new EnumMap<>(ReviewStatus.class);
        for (ReviewStatus status : ReviewStatus.values()) {
            counts.put(status, 0);
        }
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_HITL_REVIEWS,
                (key, record) -> {
                    try {
                        ReviewStatus status = ReviewStatus.valueOf(record.getString("status"));
                        synchronized (counts) {
                            counts.merge(status, 1, Integer::sum);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count review record: {}", e.getMessage());
                    }
                });
        return counts;
    }

    private List<ReviewRequest> scan(ReviewStatus status) {
        List<ReviewRequest> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_HITL_REVIEWS,
                (key, record) -> {
                    try {
                        if (status.name().equals(record.getString("status"))) {
                            ReviewRequest mapped = mapRecord(record);
                            synchronized (results) {
                                results.add(mapped);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read review record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(UUID reviewId) {
        return new Key(namespace, AerospikeConfig.SET_HITL_REVIEWS, reviewId.toString());
    }

    private ReviewRequest mapRecord(Record record) {
        return ReviewRequest.builder()
                .reviewId(UUID.fromString(record.getString("reviewId")))
                .decisionId(UUID.fromString(record.getString("decisionId")))
                .createdAt(record.getLong("createdAt"))
                .context(deserializeContext(record.getString("context")))
                .status(ReviewStatus.valueOf(record.getString("status")))
                .tier(OversightTier.valueOf(record.getString("tier")))
                .reason(record.getString("reason"))
                .reviewedAt(record.getValue("reviewedAt") != null ? record.getLong("reviewedAt") : null)
                .approved(record.getValue("approved") != null ? record.getBoolean("approved") : null)
                .reviewerId(record.getString("reviewerId"))
                .notes(record.getString("notes"))
                .build();
    }

    private String serializeContext(Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context != null ? context : Collections.emptyMap());
        } catch (Exception e) {
            throw new IllegalArgumentException("Review context is not JSON-serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> deserializeContext(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize review context", e);
            return new HashMap<>();
        }
    }
}
