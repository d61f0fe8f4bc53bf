package com.decisionplatform.common.exception;

/**
 * Raised by providers when a required read (bias state, open positions, market context,
 * price) cannot be satisfied. Callers decide whether the failure vetoes or degrades.
 */
public class DataUnavailableException extends RuntimeException {
    private final String source;

    public DataUnavailableException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public DataUnavailableException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
