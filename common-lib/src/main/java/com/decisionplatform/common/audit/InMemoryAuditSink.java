package com.decisionplatform.common.audit;

import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.model.DecisionAudit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * {@link AuditSink} backed by a {@link ConcurrentHashMap}; write-once via {@code putIfAbsent}.
 * Used by the replay harness (one fresh sink per run) and as the default sink in tests.
 */
public class InMemoryAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditSink.class);

    private final ConcurrentMap<Key, DecisionAudit> records = new ConcurrentHashMap<>();

    @Override
    public boolean record(AuditStage stage, String signalId, Object payload) {
        DecisionAudit audit = new DecisionAudit(signalId, stage, payload);
        DecisionAudit existing = records.putIfAbsent(new Key(signalId, stage), audit);
        if (existing != null) {
            log.warn("[AuditSink] Duplicate write rejected. signalId={} stage={}", signalId, stage);
            return false;
        }
        return true;
    }

    public Optional<DecisionAudit> find(String signalId, AuditStage stage) {
        return Optional.ofNullable(records.get(new Key(signalId, stage)));
    }

    /** Records of one signal in stage order. */
    public List<DecisionAudit> forSignal(String signalId) {
        return records.values().stream()
            .filter(a -> a.signalId().equals(signalId))
            .sorted(Comparator.comparing(DecisionAudit::stage))
            .collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }

    private record Key(String signalId, AuditStage stage) {}
}
