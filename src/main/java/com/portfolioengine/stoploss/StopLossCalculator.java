package com.portfolioengine.stoploss;

import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.Position;
import com.portfolioengine.domain.model.StopLossResult;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Computes the protective stop of an open position for the current tick.
 *
 * <p>Candidates, all expressed as profit ratios (larger is tighter):
 * <ul>
 *   <li>static floor: the worst acceptable loss</li>
 *   <li>volatility stop: current price moved against the position by ATR x multiplier</li>
 *   <li>trailing stop: once the best profit seen passes the activation threshold, that profit
 *       minus a distance which shrinks as profit grows</li>
 *   <li>time decay: the static floor scaled down the longer the position is open</li>
 * </ul>
 * The tightest candidate wins, and the result is ratcheted against the position's current
 * stop so it never loosens. Missing ATR, a zero open price or an unusable snapshot price
 * replace the volatility candidate with the static floor.
 *
 * <p>While the position's ladder still has an armed rung, loss-side volatility and time-decay
 * candidates are capped at the deepest armed trigger minus {@code ladderStopBuffer} (never
 * below the static floor). Candidates at or above break-even, trailing included, are not
 * capped.
 *
 * <p>Long and short positions convert the volatility stop price in separate branches.
 */
@Component
public class StopLossCalculator {

    private final StopLossConfig stopLossConfig;

    public StopLossCalculator(StopLossConfig stopLossConfig) {
        this.stopLossConfig = stopLossConfig;
    }

    public StopLossResult calculate(Position position, InstrumentSnapshot snapshot, Instant now) {
        double floor = stopLossConfig.getStaticFloor();
        double openPrice = position.getOpenPrice();
        boolean usablePrice = snapshot != null && snapshot.hasUsablePrice();

        if (openPrice <= 0 || !usablePrice) {
            return ratchet(position, new StopLossResult(floor, floor, Double.NaN, Double.NaN, Double.NaN, true));
        }

        double price = snapshot.getPrice();
        double volatilityCandidate = Double.NaN;
        boolean fallback = stopLossConfig.isVolatilityStopEnabled();
        if (stopLossConfig.isVolatilityStopEnabled()
                && snapshot.has(IndicatorKeys.ATR)
                && snapshot.require(IndicatorKeys.ATR) > 0) {
            volatilityCandidate = volatilityStop(position.getSide(), openPrice, price, snapshot.require(IndicatorKeys.ATR));
            fallback = false;
        }

        double trailingCandidate = trailingStop(position.profitRatio(position.getBestFavorablePrice()));
        double timeDecayCandidate = timeDecayStop(position.timeOpen(now));

        double ladderCap = ladderCap(position, floor);
        volatilityCandidate = capped(volatilityCandidate, ladderCap);
        timeDecayCandidate = capped(timeDecayCandidate, ladderCap);

        double stop = floor;
        stop = tighter(stop, volatilityCandidate);
        stop = tighter(stop, trailingCandidate);
        stop = tighter(stop, timeDecayCandidate);

        return ratchet(
                position,
                new StopLossResult(stop, floor, volatilityCandidate, trailingCandidate, timeDecayCandidate, fallback));
    }

    /**
     * Volatility stop as a profit ratio. A long stop sits below the current price, a short
     * stop above it; both are measured from the open price in the position's favour.
     */
    double volatilityStop(PositionSide side, double openPrice, double price, double atr) {
        double distance = atr * stopLossConfig.getAtrMultiplier();
        if (side == PositionSide.LONG) {
            double stopPrice = price - distance;
            return (stopPrice - openPrice) / openPrice;
        }
        double stopPrice = price + distance;
        return (openPrice - stopPrice) / openPrice;
    }

    double trailingStop(double bestProfit) {
        if (Double.isNaN(bestProfit) || bestProfit <= stopLossConfig.getTrailingActivationProfit()) {
            return Double.NaN;
        }
        double progress = Math.min(bestProfit / stopLossConfig.getTrailingFullProfit(), 1.0);
        double distance = stopLossConfig.getTrailingMaxDistance()
                - (stopLossConfig.getTrailingMaxDistance() - stopLossConfig.getTrailingMinDistance()) * progress;
        return bestProfit - distance;
    }

    double timeDecayStop(Duration timeOpen) {
        if (!stopLossConfig.isTimeDecayEnabled() || stopLossConfig.getTimeDecayHours() <= 0) {
            return Double.NaN;
        }
        double hours = Math.max(0, timeOpen.toMinutes() / 60.0);
        double factor = Math.max(stopLossConfig.getMinTimeDecayFactor(), 1 - hours / stopLossConfig.getTimeDecayHours());
        return stopLossConfig.getStaticFloor() * factor;
    }

    /** Tightest loss-side stop allowed while rungs remain, or NaN when nothing is armed. */
    private double ladderCap(Position position, double floor) {
        return position.getLadder()
                .deepestArmedLevel()
                .map(level -> Math.max(floor, level.triggerProfitRatio() - stopLossConfig.getLadderStopBuffer()))
                .orElse(Double.NaN);
    }

    private static double capped(double candidate, double cap) {
        if (Double.isNaN(candidate) || Double.isNaN(cap) || candidate >= 0) {
            return candidate;
        }
        return Math.min(candidate, cap);
    }

    private static double tighter(double current, double candidate) {
        return Double.isNaN(candidate) ? current : Math.max(current, candidate);
    }

    private static StopLossResult ratchet(Position position, StopLossResult computed) {
        Double previous = position.getStopLevel();
        if (previous == null || computed.stopLevel() >= previous) {
            return computed;
        }
        return new StopLossResult(
                previous,
                computed.staticFloor(),
                computed.volatilityCandidate(),
                computed.trailingCandidate(),
                computed.timeDecayCandidate(),
                computed.fallbackToStatic());
    }
}
