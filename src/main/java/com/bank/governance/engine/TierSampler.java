package com.bank.governance.engine;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Deterministic Tier-2 sampling. A decision id always maps to the same point in [0, 1),
 * so re-evaluating a decision never flips its review outcome.
 */
public final class TierSampler {

    private TierSampler() {
    }

    public static boolean isSampled(UUID decisionId, double rate) {
        if (rate <= 0.0) {
            return false;
        }
        if (rate >= 1.0) {
            return true;
        }
        return bucket(decisionId) < rate;
    }

    /**
     * Top 53 bits of SHA-256(decisionId) scaled to [0, 1).
     */
    static double bucket(UUID decisionId) {
        byte[] digest = sha256().digest(decisionId.toString().getBytes(StandardCharsets.UTF_8));
        long bits = ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        return (bits >>> 11) * 0x1.0p-53;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
