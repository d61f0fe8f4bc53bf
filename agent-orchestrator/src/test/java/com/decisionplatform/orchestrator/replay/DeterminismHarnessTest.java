package com.decisionplatform.orchestrator.replay;

import com.decisionplatform.analysis.engine.ConsensusTrace;
import com.decisionplatform.common.config.DecisionConfig;
import com.decisionplatform.common.exception.DeterminismViolationException;
import com.decisionplatform.common.model.EvaluatorType;
import com.decisionplatform.common.model.MetaDecision;
import com.decisionplatform.common.model.Verdict;
import com.decisionplatform.orchestrator.pipeline.DecisionPipelineFactory;
import com.decisionplatform.orchestrator.pipeline.DecisionPipelineTestSupport;
import com.decisionplatform.orchestrator.pipeline.TerminalStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeterminismHarnessTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final DecisionPipelineFactory factory =
        DecisionPipelineTestSupport.factory(DecisionConfig.builder().splitA(0.5).build());
    private final DeterminismHarness harness = new DeterminismHarness(factory, mapper);

    private static SignalSnapshot snapshot(String signalId, double finalConfidence, List<String> reasons) {
        MetaDecision meta = new MetaDecision(Verdict.APPROVE, finalConfidence, List.of(),
            List.of(EvaluatorType.RISK), 0.7, 0.0);
        return new SignalSnapshot(signalId, null, TerminalStage.ENGINE_REJECTED, null, List.of(), null,
            new ConsensusTrace(List.of(EvaluatorType.RISK), List.of(), meta), null, null, reasons, List.of());
    }

    private static PipelineSnapshot run(int index, SignalSnapshot... signals) {
        return new PipelineSnapshot(index, 42L, List.of(signals));
    }

    // ── synthetic inputs ────────────────────────────────────────────────

    @Nested
    @DisplayName("synthetic input generation")
    class GeneratorTests {

        @Test
        @DisplayName("same seed → identical batches")
        void sameSeed_identical() {
            assertEquals(new SyntheticInputGenerator(7).generate(15), new SyntheticInputGenerator(7).generate(15));
        }

        @Test
        @DisplayName("different seed → different batches")
        void differentSeed_differs() {
            assertNotEquals(new SyntheticInputGenerator(7).generate(15), new SyntheticInputGenerator(8).generate(15));
        }

        @Test
        @DisplayName("batch size below 1 → rejected")
        void emptyBatch_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new SyntheticInputGenerator(1).generate(0));
        }

        @Test
        @DisplayName("signal ids are unique within a batch")
        void signalIds_unique() {
            SyntheticBatch batch = new SyntheticInputGenerator(3).generate(30);
            assertEquals(30, batch.inputs().stream().map(i -> i.signal().signalId()).distinct().count());
        }
    }

    // ── replay ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("replay")
    class ReplayTests {

        @Test
        @DisplayName("two runs over the same frozen batch → passed, zero mismatches")
        void identicalRuns_pass() {
            SyntheticBatch batch = new SyntheticInputGenerator(42).generate(20);
            HarnessReport report = harness.replay(batch, 2);
            assertTrue(report.passed(), () -> report.mismatches().toString());
            assertEquals(2, report.runs());
            assertEquals(20, report.signalsCompared());
            assertTrue(report.mismatches().isEmpty());
            assertDoesNotThrow(report::assertPassed);
        }

        @Test
        @DisplayName("captured snapshots are ordered by signal id and carry audit stages")
        void capture_sortedWithStages() {
            PipelineSnapshot snapshot = harness.capture(new SyntheticInputGenerator(5).generate(10), 0);
            List<String> ids = snapshot.signals().stream().map(SignalSnapshot::signalId).toList();
            assertEquals(ids.stream().sorted().toList(), ids);
            assertTrue(snapshot.signals().stream().allMatch(s -> !s.auditStages().isEmpty()));
        }

        @Test
        @DisplayName("fewer than two runs → rejected")
        void singleRun_rejected() {
            SyntheticBatch batch = new SyntheticInputGenerator(1).generate(3);
            assertThrows(IllegalArgumentException.class, () -> harness.verify(List.of(batch)));
            assertThrows(IllegalArgumentException.class, () -> harness.replay(batch, 1));
        }
    }

    // ── comparison ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("snapshot comparison")
    class CompareTests {

        @Test
        @DisplayName("confidence drift within 1e-4 → tolerated")
        void confidenceWithinTolerance_passes() {
            HarnessReport report = harness.compare(List.of(
                run(0, snapshot("s-1", 0.70000, List.of("a"))),
                run(1, snapshot("s-1", 0.70005, List.of("a")))));
            assertTrue(report.passed());
        }

        @Test
        @DisplayName("confidence drift beyond 1e-4 → mismatch on that leaf")
        void confidenceBeyondTolerance_fails() {
            HarnessReport report = harness.compare(List.of(
                run(0, snapshot("s-1", 0.70, List.of("a"))),
                run(1, snapshot("s-1", 0.71, List.of("a")))));
            assertFalse(report.passed());
            assertEquals(List.of("engineB.meta.finalConfidence"),
                report.mismatches().stream().map(Mismatch::field).toList());
        }

        @Test
        @DisplayName("non-confidence numbers must match exactly")
        void otherNumbers_exact() {
            HarnessReport report = harness.compare(List.of(
                run(0, snapshot("s-1", 0.70, List.of("a"))),
                run(1, snapshot("s-1", 0.70, List.of("b")))));
            assertEquals(1, report.mismatches().size());
            Mismatch m = report.mismatches().get(0);
            assertEquals("reasons[0]", m.field());
            assertEquals("\"a\"", m.expected());
            assertEquals("\"b\"", m.actual());
            assertFalse(DeterminismHarness.isConfidenceField("engineB.meta.approvalScore"));
            assertTrue(DeterminismHarness.isConfidenceField("engineB.outputs[0].confidence"));
        }

        @Test
        @DisplayName("signal present in only one run → mismatch")
        void missingSignal_fails() {
            HarnessReport report = harness.compare(List.of(
                run(0, snapshot("s-1", 0.7, List.of()), snapshot("s-2", 0.7, List.of())),
                run(1, snapshot("s-1", 0.7, List.of()))));
            assertFalse(report.passed());
            Mismatch m = report.mismatches().get(0);
            assertEquals("s-2", m.signalId());
            assertEquals(DeterminismHarness.MISSING, m.actual());
            assertEquals(1, report.signalsCompared());
        }

        @Test
        @DisplayName("failed report → assertPassed throws")
        void failedReport_throws() {
            HarnessReport report = harness.compare(List.of(
                run(0, snapshot("s-1", 0.70, List.of("a"))),
                run(1, snapshot("s-1", 0.90, List.of("a")))));
            DeterminismViolationException e = assertThrows(DeterminismViolationException.class, report::assertPassed);
            assertTrue(e.getMessage().contains("finalConfidence"));
        }
    }
}
