package com.decisionplatform.common.model;

/**
 * Outcome of the portfolio exposure guard.
 *
 * <ul>
 *   <li>{@link #ALLOW}     — trade permitted at full exposure.</li>
 *   <li>{@link #DOWNGRADE} — trade permitted with reduced new exposure.</li>
 *   <li>{@link #BLOCK}     — trade vetoed.</li>
 * </ul>
 */
public enum ExposureDecision {
    ALLOW,
    DOWNGRADE,
    BLOCK
}
