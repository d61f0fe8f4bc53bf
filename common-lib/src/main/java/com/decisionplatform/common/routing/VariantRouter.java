package com.decisionplatform.common.routing;

import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.Signal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic experiment routing between Engine A and Engine B.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   hash   = SHA-256("&lt;experimentKey&gt;:&lt;signalId&gt;")
 *   bucket = unsigned(first 16 hex digits) mod 10000
 *   A  if bucket &lt; round(splitA × 10000), else B
 * </pre>
 *
 * <p>Depends only on the signal's identifiers, never on wall clock or process state, so a
 * replayed signal always lands on the same variant. Stateless and thread-safe.
 */
public final class VariantRouter {

    static final int BUCKETS = 10_000;

    private final int thresholdBucket;

    public VariantRouter(double splitA) {
        double clamped = Math.max(0.0, Math.min(1.0, splitA));
        this.thresholdBucket = (int) Math.round(clamped * BUCKETS);
    }

    public EngineVariant assign(Signal signal) {
        return bucket(signal) < thresholdBucket ? EngineVariant.A : EngineVariant.B;
    }

    /** Full hex SHA-256 of the routing key, recorded in the audit trail. */
    public String assignmentHash(Signal signal) {
        return HexFormat.of().formatHex(sha256(routingKey(signal)));
    }

    int bucket(Signal signal) {
        String prefix = assignmentHash(signal).substring(0, 16);
        long value = Long.parseUnsignedLong(prefix, 16);
        return (int) Long.remainderUnsigned(value, BUCKETS);
    }

    static String routingKey(Signal signal) {
        return signal.experimentKey() + ":" + signal.signalId();
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
