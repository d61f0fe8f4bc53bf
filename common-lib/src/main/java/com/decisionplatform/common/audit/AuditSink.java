package com.decisionplatform.common.audit;

import com.decisionplatform.common.model.AuditStage;

/**
 * Append-only observability collaborator. Every decision stage records its verdict here;
 * the core never reads records back.
 *
 * <p>Implementations must be safe for concurrent writers and must keep exactly one record
 * per {@code (signalId, stage)}: the first write wins.
 */
public interface AuditSink {

    /**
     * @return {@code true} if the record was stored, {@code false} if a record for the same
     *         {@code (signalId, stage)} already existed and this write was rejected
     */
    boolean record(AuditStage stage, String signalId, Object payload);
}
