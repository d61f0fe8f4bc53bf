package com.decisionplatform.orchestrator.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.time.Instant;

/**
 * Signal ids already accepted for processing. A signal id is claimed at most once within
 * the retention window; the oldest claims are evicted first once {@code maxSignals} is reached.
 */
public class SignalClaimRegistry {

    private final Cache<String, Instant> claims;

    public SignalClaimRegistry(Duration retention, long maxSignals) {
        this.claims = Caffeine.newBuilder()
            .expireAfterWrite(retention)
            .maximumSize(maxSignals)
            .build();
    }

    /** @return {@code true} for the first caller with this id, {@code false} for every later one */
    public boolean claim(String signalId) {
        return claims.asMap().putIfAbsent(signalId, Instant.now()) == null;
    }

    public boolean claimed(String signalId) {
        return claims.getIfPresent(signalId) != null;
    }

    public long size() {
        claims.cleanUp();
        return claims.estimatedSize();
    }
}
