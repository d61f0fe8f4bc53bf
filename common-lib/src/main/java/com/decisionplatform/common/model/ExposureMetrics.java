package com.decisionplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portfolio figures computed by the exposure guard for one candidate trade.
 *
 * @param netDirectionalExposure  Σ signed quantity (calls positive, puts negative)
 * @param grossExposure           Σ |quantity|
 * @param macroBiasCluster        open positions that oppose the macro class
 * @param allowedNewExposurePct   fraction of normal size the new trade may take
 * @param definedRiskOnly         new trade restricted to defined-risk structures
 * @param maxDirectionalTrades    directional cap in effect for this evaluation
 */
public record ExposureMetrics(
    @JsonProperty("netDirectionalExposure") int netDirectionalExposure,
    @JsonProperty("grossExposure") int grossExposure,
    @JsonProperty("macroBiasCluster") int macroBiasCluster,
    @JsonProperty("allowedNewExposurePct") double allowedNewExposurePct,
    @JsonProperty("definedRiskOnly") boolean definedRiskOnly,
    @JsonProperty("maxDirectionalTrades") int maxDirectionalTrades
) {}
