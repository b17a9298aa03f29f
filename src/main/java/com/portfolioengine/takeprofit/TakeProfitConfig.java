package com.portfolioengine.takeprofit;

import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Multi-level take-profit. Properties prefix: {@code engine.take-profit.*}.
 *
 * <p>Each level closes {@code exitFraction} of the position once its profit ratio reaches
 * {@code profit}. Fractions are shares of the position as it stood before its first
 * take-profit; a level whose fraction reaches what is left closes the position. Levels must
 * be listed with strictly increasing profit.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "engine.take-profit")
public class TakeProfitConfig {

    private boolean enabled = false;

    @NotNull
    private List<Level> levels = new ArrayList<>(List.of(
            new Level(0.02, 0.25), new Level(0.05, 0.50), new Level(0.10, 1.0)));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {
        private double profit;
        private double exitFraction;
    }
}
