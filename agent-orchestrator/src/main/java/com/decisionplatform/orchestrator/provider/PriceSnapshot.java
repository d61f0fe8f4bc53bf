package com.decisionplatform.orchestrator.provider;

import com.decisionplatform.common.model.SessionContext;

/** Last traded price plus the session it was observed in; input to the price-anchored fallback. */
public record PriceSnapshot(double price, SessionContext session) {}
