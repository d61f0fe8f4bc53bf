package com.decisionplatform.orchestrator.execution;

import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.common.trace.SignalMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/** Terminal destination for shadow recommendations: a dedicated logger, nothing else. */
@Component
public class ShadowLogSink {

    private static final Logger log = LoggerFactory.getLogger("decision.shadow");

    private final AtomicLong recorded = new AtomicLong();

    public void record(TradeRecommendation rec) {
        recorded.incrementAndGet();
        SignalMdc.log(rec.signalId(), rec.engine(), () ->
            log.info("[Shadow] signalId={} experimentId={} engine={} symbol={} {} {}x{} exp={}",
                rec.signalId(), rec.experimentId(), rec.engine(), rec.symbol(), rec.optionType(),
                rec.quantity(), rec.strike(), rec.expiration()));
    }

    public long recordedCount() {
        return recorded.get();
    }
}
