package com.decisionplatform.orchestrator.audit;

import com.decisionplatform.common.audit.AuditSink;
import com.decisionplatform.common.model.AuditStage;
import com.decisionplatform.common.trace.SignalMdc;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Application audit sink: one JSON line on the {@code decision.audit} logger per accepted
 * record. The log is the store; in memory only the {@code (signalId, stage)} keys are kept,
 * for the retention window and up to {@code maxKeys}, to reject repeated writes.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger("decision.audit");

    private final Cache<String, Boolean> written;
    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper, Duration retention, long maxKeys) {
        this.objectMapper = objectMapper;
        this.written = Caffeine.newBuilder()
            .expireAfterWrite(retention)
            .maximumSize(maxKeys)
            .build();
    }

    @Override
    public boolean record(AuditStage stage, String signalId, Object payload) {
        if (written.asMap().putIfAbsent(key(stage, signalId), Boolean.TRUE) != null) {
            log.debug("[Audit] Duplicate write rejected. stage={} signalId={}", stage, signalId);
            return false;
        }
        String json = toJson(payload);
        SignalMdc.log(signalId, () ->
            log.info("[Audit] stage={} signalId={} payload={}", stage, signalId, json));
        return true;
    }

    /** Keys currently held for duplicate detection. */
    public long retainedKeys() {
        written.cleanUp();
        return written.estimatedSize();
    }

    private static String key(AuditStage stage, String signalId) {
        return signalId + '|' + stage.name();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Payload not serializable, logging toString. error={}", e.getOriginalMessage());
            return String.valueOf(payload);
        }
    }
}
