package com.portfolioengine.takeprofit;

import com.portfolioengine.domain.model.Position;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides which take-profit levels an open position reaches on this tick.
 *
 * <p>Every level is taken at most once per position. A gap over several levels takes them
 * together. Like {@link com.portfolioengine.dca.DcaLadderController}, evaluation only reads
 * state; the engine applies the reduction through {@link Position#takeProfit} once the exit
 * is admitted.
 */
@Component
public class TakeProfitController {

    // Remaining shares below this are treated as fully closed
    private static final double EPSILON = 1e-9;

    private final TakeProfitConfig takeProfitConfig;

    public TakeProfitController(TakeProfitConfig takeProfitConfig) {
        this.takeProfitConfig = takeProfitConfig;
    }

    public TakeProfitDecision evaluate(Position position, double profitRatio) {
        if (!takeProfitConfig.isEnabled() || position.isClosed() || Double.isNaN(profitRatio)) {
            return TakeProfitDecision.NONE;
        }
        double remaining = 1 - position.getTakenProfitFraction();
        if (remaining <= EPSILON) {
            return TakeProfitDecision.NONE;
        }

        List<Integer> reached = new ArrayList<>();
        double requested = 0;
        List<TakeProfitConfig.Level> levels = takeProfitConfig.getLevels();
        for (int i = 0; i < levels.size(); i++) {
            int level = i + 1;
            if (profitRatio >= levels.get(i).getProfit() && !position.getTakenProfitLevels().contains(level)) {
                reached.add(level);
                requested += levels.get(i).getExitFraction();
            }
        }
        if (reached.isEmpty()) {
            return TakeProfitDecision.NONE;
        }

        double exitFraction = Math.min(requested, remaining);
        double keepRatio = (remaining - exitFraction) / remaining;
        if (keepRatio <= EPSILON) {
            return new TakeProfitDecision(List.copyOf(reached), remaining, 0);
        }
        return new TakeProfitDecision(List.copyOf(reached), exitFraction, keepRatio);
    }
}
