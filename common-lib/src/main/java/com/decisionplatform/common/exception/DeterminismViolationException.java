package com.decisionplatform.common.exception;

public class DeterminismViolationException extends RuntimeException {

    public DeterminismViolationException(String message) {
        super(message);
    }
}
