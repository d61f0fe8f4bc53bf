package com.decisionplatform.common.trace;

import org.slf4j.MDC;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.function.Function;

/**
 * Signal id propagation for log lines.
 *
 * <p>Inside a reactive chain the signal id lives in the Reactor Context, written once where
 * the chain is assembled:
 * <pre>
 *     chain.contextWrite(SignalMdc.signalId(signal.signalId()))
 * </pre>
 * MDC entries are scoped to a single logging call through {@link #log} and removed as soon
 * as it returns, whichever thread the call ran on.
 */
public final class SignalMdc {

    public static final String SIGNAL_ID = "signalId";
    public static final String VARIANT = "variant";

    static final String UNKNOWN = "unknown";

    private SignalMdc() {}

    /** Context writer for {@code contextWrite}; works the same on Mono and Flux. */
    public static Function<Context, Context> signalId(String signalId) {
        return ctx -> ctx.put(SIGNAL_ID, signalId);
    }

    public static String signalIdOf(ContextView ctx) {
        return ctx.getOrDefault(SIGNAL_ID, UNKNOWN);
    }

    public static void log(String signalId, Runnable statement) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(SIGNAL_ID, signalId)) {
            statement.run();
        }
    }

    /** As {@link #log(String, Runnable)}, also tagging the engine variant when one is known. */
    public static void log(String signalId, Object variant, Runnable statement) {
        if (variant == null) {
            log(signalId, statement);
            return;
        }
        try (MDC.MDCCloseable ignoredId = MDC.putCloseable(SIGNAL_ID, signalId);
             MDC.MDCCloseable ignoredVariant = MDC.putCloseable(VARIANT, String.valueOf(variant))) {
            statement.run();
        }
    }
}
