package com.decisionplatform.orchestrator.replay;

import com.decisionplatform.common.audit.InMemoryAuditSink;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.DecisionAudit;
import com.decisionplatform.orchestrator.pipeline.DecisionPipeline;
import com.decisionplatform.orchestrator.pipeline.DecisionPipelineFactory;
import com.decisionplatform.orchestrator.pipeline.PipelineOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Runs frozen batches through freshly assembled pipelines and diffs the captured snapshots.
 *
 * <h3>Comparison</h3>
 * <ol>
 *   <li>Each signal snapshot is converted to a Jackson tree and flattened to leaf paths.</li>
 *   <li>Every run is compared with run 0, signal by signal and leaf by leaf.</li>
 *   <li>Numeric leaves whose field name contains {@code confidence} may differ by at most
 *       {@link #CONFIDENCE_TOLERANCE}; every other leaf must be equal.</li>
 *   <li>A signal or leaf present on only one side is a mismatch.</li>
 * </ol>
 *
 * <p>Blocking API: callers on an event loop must shift it onto a worker scheduler.
 */
@Component
public class DeterminismHarness {

    private static final Logger log = LoggerFactory.getLogger(DeterminismHarness.class);

    public static final double CONFIDENCE_TOLERANCE = 1e-4;
    static final String MISSING = "<missing>";

    private final DecisionPipelineFactory pipelineFactory;
    private final ObjectMapper objectMapper;

    public DeterminismHarness(DecisionPipelineFactory pipelineFactory, ObjectMapper objectMapper) {
        this.pipelineFactory = pipelineFactory;
        this.objectMapper = objectMapper;
    }

    /** Runs {@code batch} through a new pipeline with a fresh audit sink. */
    public PipelineSnapshot capture(SyntheticBatch batch, int runIndex) {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        DecisionPipeline pipeline = pipelineFactory.create(sink);

        List<PipelineOutcome> outcomes = Flux.fromIterable(batch.inputs())
            .flatMap(input -> pipeline.run(input.toRequest()))
            .collectList()
            .block();

        List<SignalSnapshot> signals = new ArrayList<>();
        for (PipelineOutcome outcome : outcomes == null ? List.<PipelineOutcome>of() : outcomes) {
            signals.add(snapshot(outcome, sink));
        }
        signals.sort(Comparator.comparing(SignalSnapshot::signalId));
        log.info("[DeterminismHarness] Run captured. runIndex={} seed={} signals={} auditRecords={}",
            runIndex, batch.seed(), signals.size(), sink.size());
        return new PipelineSnapshot(runIndex, batch.seed(), signals);
    }

    public HarnessReport compare(List<PipelineSnapshot> snapshots) {
        if (snapshots.size() < 2) {
            throw new IllegalArgumentException("at least 2 snapshots required, got " + snapshots.size());
        }
        Map<String, SignalSnapshot> baseline = snapshots.get(0).bySignalId();
        List<Mismatch> mismatches = new ArrayList<>();
        int compared = 0;

        for (int run = 1; run < snapshots.size(); run++) {
            Map<String, SignalSnapshot> current = snapshots.get(run).bySignalId();
            Set<String> ids = new TreeSet<>(baseline.keySet());
            ids.addAll(current.keySet());
            for (String id : ids) {
                SignalSnapshot expected = baseline.get(id);
                SignalSnapshot actual = current.get(id);
                if (expected == null || actual == null) {
                    mismatches.add(new Mismatch(run, id, "<signal>",
                        expected == null ? MISSING : "present", actual == null ? MISSING : "present"));
                    continue;
                }
                compared++;
                diff(run, id, flatten(expected), flatten(actual), mismatches);
            }
        }

        HarnessReport report = new HarnessReport(mismatches.isEmpty(), snapshots.size(), compared, mismatches);
        if (report.passed()) {
            log.info("[DeterminismHarness] Verification passed. runs={} signalsCompared={}",
                report.runs(), report.signalsCompared());
        } else {
            log.warn("[DeterminismHarness] Verification FAILED. runs={} mismatches={} first={}",
                report.runs(), mismatches.size(), mismatches.get(0));
        }
        return report;
    }

    /** Captures one snapshot per batch (run index = list position) and compares them. */
    public HarnessReport verify(List<SyntheticBatch> batches) {
        if (batches == null || batches.size() < 2) {
            throw new IllegalArgumentException("determinism verification needs at least 2 runs");
        }
        List<PipelineSnapshot> snapshots = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            snapshots.add(capture(batches.get(i), i));
        }
        return compare(snapshots);
    }

    /** Replays the same frozen batch {@code runs} times. */
    public HarnessReport replay(SyntheticBatch batch, int runs) {
        return verify(Collections.nCopies(runs, batch));
    }

    private SignalSnapshot snapshot(PipelineOutcome outcome, InMemoryAuditSink sink) {
        List<AuditStage> stages = sink.forSignal(outcome.signalId()).stream()
            .map(DecisionAudit::stage)
            .toList();
        return new SignalSnapshot(
            outcome.signalId(),
            outcome.variant(),
            outcome.terminalStage(),
            outcome.gate() != null ? outcome.gate().status() : null,
            outcome.gate() != null ? outcome.gate().reasons() : List.of(),
            outcome.engineResult() != null ? outcome.engineResult().entryDecision() : null,
            outcome.engineResult() != null ? outcome.engineResult().consensus() : null,
            outcome.sizing(),
            outcome.recommendation(),
            outcome.reasons(),
            stages);
    }

    Map<String, JsonNode> flatten(SignalSnapshot snapshot) {
        Map<String, JsonNode> leaves = new TreeMap<>();
        collect("", objectMapper.valueToTree(snapshot), leaves);
        return leaves;
    }

    private static void collect(String path, JsonNode node, Map<String, JsonNode> leaves) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(path.isEmpty() ? field.getKey() : path + "." + field.getKey(), field.getValue(), leaves);
            }
        } else if (node.isArray()) {
            if (node.isEmpty()) {
                leaves.put(path, node);
            }
            for (int i = 0; i < node.size(); i++) {
                collect(path + "[" + i + "]", node.get(i), leaves);
            }
        } else {
            leaves.put(path, node);
        }
    }

    private static void diff(int run, String signalId, Map<String, JsonNode> expected,
                             Map<String, JsonNode> actual, List<Mismatch> out) {
        Set<String> paths = new TreeSet<>(expected.keySet());
        paths.addAll(actual.keySet());
        for (String path : paths) {
            JsonNode e = expected.get(path);
            JsonNode a = actual.get(path);
            if (e == null || a == null) {
                out.add(new Mismatch(run, signalId, path, render(e), render(a)));
            } else if (!leafEquals(path, e, a)) {
                out.add(new Mismatch(run, signalId, path, render(e), render(a)));
            }
        }
    }

    static boolean leafEquals(String path, JsonNode expected, JsonNode actual) {
        if (expected.isNumber() && actual.isNumber() && isConfidenceField(path)) {
            return Math.abs(expected.asDouble() - actual.asDouble()) <= CONFIDENCE_TOLERANCE;
        }
        return expected.equals(actual);
    }

    static boolean isConfidenceField(String path) {
        String leaf = path.substring(path.lastIndexOf('.') + 1);
        int bracket = leaf.indexOf('[');
        if (bracket >= 0) {
            leaf = leaf.substring(0, bracket);
        }
        return leaf.toLowerCase(Locale.ROOT).contains("confidence");
    }

    private static String render(JsonNode node) {
        return node == null ? MISSING : node.toString();
    }
}
