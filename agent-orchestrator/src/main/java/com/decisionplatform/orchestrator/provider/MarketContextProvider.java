package com.decisionplatform.orchestrator.provider;

import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.Signal;
import reactor.core.publisher.Mono;

/**
 * Read port for market enrichment. Implementations signal unavailability with an error
 * (typically {@link com.decisionplatform.common.exception.DataUnavailableException}) or an
 * empty {@link Mono}; callers apply their own deadline.
 */
public interface MarketContextProvider {

    /** Full enrichment (candles, indicators, session, gamma, flow, intel) as of the signal. */
    Mono<MarketContext> context(Signal signal);

    /** Current price only, used when {@link #context(Signal)} fails. */
    Mono<PriceSnapshot> currentPrice(Signal signal);
}
