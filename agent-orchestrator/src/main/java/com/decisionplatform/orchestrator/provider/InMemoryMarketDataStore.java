package com.decisionplatform.orchestrator.provider;

import com.decisionplatform.common.exception.DataUnavailableException;
import com.decisionplatform.common.model.MarketContext;
import com.decisionplatform.common.model.OpenPosition;
import com.decisionplatform.common.model.Signal;
import com.decisionplatform.common.model.UnifiedBiasState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default provider backing all three read ports with in-process maps. Upstream feeds (or
 * tests) push the latest state in with the {@code put*} methods; reads return the latest
 * value or signal unavailability.
 */
@Component
public class InMemoryMarketDataStore implements MarketContextProvider, BiasStateProvider, OpenPositionsProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDataStore.class);

    private final Map<String, MarketContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, PriceSnapshot> prices = new ConcurrentHashMap<>();
    private final Map<String, UnifiedBiasState> biasStates = new ConcurrentHashMap<>();
    private final AtomicReference<List<OpenPosition>> positions = new AtomicReference<>(List.of());

    public void putContext(MarketContext context) {
        contexts.put(context.symbol().toUpperCase(), context);
        log.debug("[MarketDataStore] Context updated. symbol={}", context.symbol());
    }

    public void putPrice(String symbol, PriceSnapshot price) {
        prices.put(symbol.toUpperCase(), price);
    }

    public void putBiasState(UnifiedBiasState state) {
        biasStates.put(state.symbol().toUpperCase(), state);
    }

    public void replacePositions(List<OpenPosition> snapshot) {
        positions.set(List.copyOf(snapshot));
    }

    @Override
    public Mono<MarketContext> context(Signal signal) {
        return Mono.justOrEmpty(contexts.get(signal.symbol()))
            .switchIfEmpty(Mono.error(new DataUnavailableException("market-context",
                "No context for symbol=" + signal.symbol())));
    }

    @Override
    public Mono<PriceSnapshot> currentPrice(Signal signal) {
        PriceSnapshot explicit = prices.get(signal.symbol());
        if (explicit != null) {
            return Mono.just(explicit);
        }
        MarketContext ctx = contexts.get(signal.symbol());
        if (ctx != null && ctx.currentPrice() > 0) {
            return Mono.just(new PriceSnapshot(ctx.currentPrice(), ctx.sessionContext()));
        }
        return Mono.empty();
    }

    @Override
    public Mono<UnifiedBiasState> biasState(String symbol) {
        return Mono.justOrEmpty(biasStates.get(symbol.toUpperCase()));
    }

    @Override
    public Mono<List<OpenPosition>> openPositions() {
        return Mono.fromSupplier(positions::get);
    }
}
