package com.portfolioengine.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.portfolioengine.config.EngineConfigValidator;
import com.portfolioengine.config.RiskProfileApplier;
import com.portfolioengine.dca.DcaLadderConfig;
import com.portfolioengine.exception.EngineConfigurationException;
import com.portfolioengine.exception.ErrorCode;
import com.portfolioengine.rebalance.RebalanceConfig;
import com.portfolioengine.regime.RegimeConfig;
import com.portfolioengine.risk.RiskLimits;
import com.portfolioengine.sizing.PositionSizingConfig;
import com.portfolioengine.stoploss.StopLossConfig;
import com.portfolioengine.takeprofit.TakeProfitConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EngineConfigValidator: defaults are valid, and each broken rule is
 * reported in a single fail-fast exception.
 */
class EngineConfigValidatorTest {

    private RiskLimits riskLimits;
    private RegimeConfig regimeConfig;
    private PositionSizingConfig sizingConfig;
    private DcaLadderConfig dcaLadderConfig;
    private StopLossConfig stopLossConfig;
    private RebalanceConfig rebalanceConfig;
    private TakeProfitConfig takeProfitConfig;
    private EngineConfigValidator validator;

    @BeforeEach
    void setUp() {
        riskLimits = RiskLimits.builder()
                .maxTotalRisk(new BigDecimal("0.25"))
                .assumedAdverseMove(new BigDecimal("0.08"))
                .maxOpenPositions(10)
                .build();
        regimeConfig = new RegimeConfig();
        sizingConfig = new PositionSizingConfig();
        dcaLadderConfig = new DcaLadderConfig();
        stopLossConfig = new StopLossConfig();
        rebalanceConfig = new RebalanceConfig();
        takeProfitConfig = new TakeProfitConfig();
        takeProfitConfig.setEnabled(true);
        validator = new EngineConfigValidator(
                mock(RiskProfileApplier.class),
                riskLimits,
                regimeConfig,
                sizingConfig,
                dcaLadderConfig,
                stopLossConfig,
                rebalanceConfig,
                takeProfitConfig);
    }

    @Test
    @DisplayName("Default configuration is valid")
    void defaults_valid() {
        assertThatCode(() -> validator.validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Ladder rung below the static stop floor is rejected")
    void rungBelowFloor_rejected() {
        stopLossConfig.setStaticFloor(-0.10);

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("dca level 3 trigger is at or below the static stop floor");
    }

    @Test
    @DisplayName("Ladder rungs must grow in severity and size")
    void nonMonotonicLadder_rejected() {
        dcaLadderConfig.setLevels(List.of(
                new DcaLadderConfig.Level(-0.05, 1.5), new DcaLadderConfig.Level(-0.03, 1.2)));

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("dca level 2 trigger must be more severe than level 1")
                .hasMessageContaining("dca level 2 multiplier must exceed level 1");
    }

    @Test
    @DisplayName("Positive ladder trigger is rejected")
    void positiveTrigger_rejected() {
        dcaLadderConfig.setLevels(List.of(new DcaLadderConfig.Level(0.02, 1.2)));

        assertThatThrownBy(() -> validator.validate()).hasMessageContaining("trigger must be negative");
    }

    @Test
    @DisplayName("Disabled ladder skips the ladder rules")
    void disabledLadder_skipped() {
        dcaLadderConfig.setEnabled(false);
        dcaLadderConfig.setLevels(List.of(new DcaLadderConfig.Level(0.02, -1)));

        assertThatCode(() -> validator.validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Every problem is collected into one exception")
    void multipleProblems_collected() {
        regimeConfig.setRangeThreshold(30);
        rebalanceConfig.getTargets().put("extra", 0.5);
        riskLimits.setMaxTotalRisk(new BigDecimal("1.5"));

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOfSatisfying(EngineConfigurationException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CONFIGURATION_ERROR);
                    assertThat(e.getMessage())
                            .contains("range-threshold")
                            .contains("rebalance targets")
                            .contains("max-total-risk");
                });
    }

    @Test
    @DisplayName("Daily loss limit must be a fraction and its pause positive")
    void dailyLossLimit_validated() {
        riskLimits.setMaxDailyLoss(new BigDecimal("5"));
        riskLimits.setDailyLossPause(Duration.ZERO);

        assertThatThrownBy(() -> validator.validate())
                .hasMessageContaining("max-daily-loss")
                .hasMessageContaining("daily-loss-pause");
    }

    @Test
    @DisplayName("Take-profit levels need rising profits and fractions within (0, 1]")
    void takeProfitLevels_validated() {
        takeProfitConfig.setLevels(List.of(
                new TakeProfitConfig.Level(0.05, 0.25),
                new TakeProfitConfig.Level(0.03, 1.5)));

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("take-profit level 2 exit-fraction must be within (0, 1]")
                .hasMessageContaining("take-profit level 2 profit must exceed level 1");
    }

    @Test
    @DisplayName("Static floor outside (-1, 0) is rejected")
    void invalidFloor_rejected() {
        dcaLadderConfig.setEnabled(false);
        stopLossConfig.setStaticFloor(0.05);

        assertThatThrownBy(() -> validator.validate()).hasMessageContaining("static-floor");
    }
}
