package com.portfolioengine.domain.model;

/**
 * One rung of a DCA ladder.
 *
 * @param level 1-based position in the ladder, ordered from least to most severe
 * @param triggerProfitRatio unrealized profit ratio at or below which the rung fires (e.g. -0.05)
 * @param sizeMultiplier multiplier applied to the base stake for this rung's order
 */
public record DcaLevel(int level, double triggerProfitRatio, double sizeMultiplier) {}
