package com.decisionplatform.common.exception;

import com.decisionplatform.common.model.EngineVariant;

public class EngineException extends RuntimeException {
    private final EngineVariant engine;
    private final String component;

    public EngineException(EngineVariant engine, String component, String message) {
        super("[" + engine + "/" + component + "] " + message);
        this.engine = engine;
        this.component = component;
    }

    public EngineException(EngineVariant engine, String component, String message, Throwable cause) {
        super("[" + engine + "/" + component + "] " + message, cause);
        this.engine = engine;
        this.component = component;
    }

    public EngineVariant getEngine() {
        return engine;
    }

    public String getComponent() {
        return component;
    }
}
