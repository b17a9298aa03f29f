package com.portfolioengine.domain.model;

/**
 * Top of book for an instrument, as supplied by the order-book collaborator.
 */
public record OrderBookDepth(double bestBid, double bestAsk) {

    /** Relative spread (ask - bid) / mid, or NaN when either side is empty. */
    public double spreadFraction() {
        if (bestBid <= 0 || bestAsk <= 0) {
            return Double.NaN;
        }
        double mid = (bestBid + bestAsk) / 2;
        return (bestAsk - bestBid) / mid;
    }
}
