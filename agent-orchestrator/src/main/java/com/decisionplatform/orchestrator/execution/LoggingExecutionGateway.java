package com.decisionplatform.orchestrator.execution;

import com.decisionplatform.common.model.TradeRecommendation;
import com.decisionplatform.common.trace.SignalMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default gateway when no execution service is configured: records the hand-off in the log. */
public class LoggingExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingExecutionGateway.class);

    @Override
    public void submit(TradeRecommendation rec) {
        SignalMdc.log(rec.signalId(), rec.engine(), () ->
            log.info("[ExecutionGateway] Recommendation accepted. signalId={} engine={} symbol={} {} {}x{} exp={} stop={} target={}",
                rec.signalId(), rec.engine(), rec.symbol(), rec.optionType(), rec.quantity(), rec.strike(),
                rec.expiration(), rec.stopLoss(), rec.takeProfit()));
    }
}
