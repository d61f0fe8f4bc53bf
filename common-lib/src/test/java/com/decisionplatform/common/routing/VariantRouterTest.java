package com.decisionplatform.common.routing;

import com.decisionplatform.common.model.Direction;
import com.decisionplatform.common.model.EngineVariant;
import com.decisionplatform.common.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariantRouterTest {

    private static final Instant TS = Instant.parse("2024-03-12T14:00:00Z");

    private static Signal signal(String id, String experiment) {
        return Signal.of(id, "SPY", Direction.LONG, "5m", TS, experiment);
    }

    // ── stability ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("assign() — stability")
    class StabilityTests {

        @Test
        @DisplayName("same signal → same variant across router instances")
        void sameSignal_sameVariant() {
            Signal s = signal("sig-1", "exp-1");
            EngineVariant first = new VariantRouter(0.5).assign(s);
            for (int i = 0; i < 50; i++) {
                assertEquals(first, new VariantRouter(0.5).assign(s));
            }
        }

        @Test
        @DisplayName("assignment ignores symbol, direction and timestamp")
        void assignment_dependsOnIdentifiersOnly() {
            VariantRouter router = new VariantRouter(0.5);
            Signal a = Signal.of("sig-7", "SPY", Direction.LONG, "5m", TS, "exp-1");
            Signal b = Signal.of("sig-7", "QQQ", Direction.SHORT, "1h", TS.plusSeconds(3600), "exp-1");
            assertEquals(router.assign(a), router.assign(b));
            assertEquals(router.assignmentHash(a), router.assignmentHash(b));
        }

        @Test
        @DisplayName("hash is 64 hex chars of SHA-256 over experimentKey:signalId")
        void assignmentHash_isSha256Hex() {
            String hash = new VariantRouter(0.5).assignmentHash(signal("sig-1", "exp-1"));
            assertEquals(64, hash.length());
            assertTrue(hash.matches("[0-9a-f]+"));
        }

        @Test
        @DisplayName("missing experimentId routes on signalId alone")
        void missingExperiment_usesSignalId() {
            assertEquals("sig-9:sig-9", VariantRouter.routingKey(signal("sig-9", null)));
        }
    }

    // ── split ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("assign() — split")
    class SplitTests {

        @Test
        @DisplayName("splitA=1.0 → always A, splitA=0.0 → always B")
        void extremes() {
            VariantRouter allA = new VariantRouter(1.0);
            VariantRouter allB = new VariantRouter(0.0);
            for (int i = 0; i < 200; i++) {
                Signal s = signal("sig-" + i, "exp");
                assertEquals(EngineVariant.A, allA.assign(s));
                assertEquals(EngineVariant.B, allB.assign(s));
            }
        }

        @Test
        @DisplayName("out-of-range split is clamped")
        void outOfRange_clamped() {
            Signal s = signal("sig-1", "exp");
            assertEquals(EngineVariant.A, new VariantRouter(7.0).assign(s));
            assertEquals(EngineVariant.B, new VariantRouter(-1.0).assign(s));
        }

        @Test
        @DisplayName("50/50 split lands roughly half on each variant")
        void halfSplit_roughlyBalanced() {
            VariantRouter router = new VariantRouter(0.5);
            Map<EngineVariant, Integer> counts = new EnumMap<>(EngineVariant.class);
            for (int i = 0; i < 2000; i++) {
                counts.merge(router.assign(signal("sig-" + i, "exp-balance")), 1, Integer::sum);
            }
            int a = counts.getOrDefault(EngineVariant.A, 0);
            assertTrue(a > 850 && a < 1150, "A count was " + a);
        }

        @Test
        @DisplayName("bucket is within [0, 10000)")
        void bucket_inRange() {
            VariantRouter router = new VariantRouter(0.5);
            for (int i = 0; i < 500; i++) {
                int bucket = router.bucket(signal("sig-" + i, "exp"));
                assertTrue(bucket >= 0 && bucket < VariantRouter.BUCKETS);
            }
        }
    }
}
