package com.portfolioengine.domain.model;

/**
 * Stop computed for one tick, in profit-ratio terms (see {@link Position#getStopLevel()}).
 *
 * <p>The candidate fields are kept for the decision log; NaN means the candidate was not
 * applicable this tick.
 */
public record StopLossResult(
        double stopLevel,
        double staticFloor,
        double volatilityCandidate,
        double trailingCandidate,
        double timeDecayCandidate,
        boolean fallbackToStatic) {}
