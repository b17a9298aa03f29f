package com.portfolioengine.unit.regime;

import static org.assertj.core.api.Assertions.assertThat;

import com.portfolioengine.domain.enums.Regime;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.regime.RegimeClassifier;
import com.portfolioengine.regime.RegimeConfig;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RegimeClassifierTest {

    private RegimeClassifier regimeClassifier;

    @BeforeEach
    void setUp() {
        regimeClassifier = new RegimeClassifier(new RegimeConfig());
    }

    private InstrumentSnapshot.InstrumentSnapshotBuilder snapshot(double adx) {
        return InstrumentSnapshot.builder()
                .instrumentId("BTC/USDT")
                .timestamp(Instant.parse("2024-03-01T00:00:00Z"))
                .price(100)
                .indicator(IndicatorKeys.ADX, adx);
    }

    // ==============================
    // CLASSIFICATION
    // ==============================

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("ADX below range threshold is RANGE regardless of direction")
        void lowAdx_range() {
            InstrumentSnapshot snapshot = snapshot(15)
                    .indicator(IndicatorKeys.PLUS_DI, 40.0)
                    .indicator(IndicatorKeys.MINUS_DI, 10.0)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.RANGE);
        }

        @Test
        @DisplayName("Strong ADX with +DI above -DI is UPTREND")
        void strongAdx_plusDiLeads_uptrend() {
            InstrumentSnapshot snapshot = snapshot(32)
                    .indicator(IndicatorKeys.PLUS_DI, 30.0)
                    .indicator(IndicatorKeys.MINUS_DI, 12.0)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.UPTREND);
        }

        @Test
        @DisplayName("Strong ADX with -DI above +DI is DOWNTREND")
        void strongAdx_minusDiLeads_downtrend() {
            InstrumentSnapshot snapshot = snapshot(32)
                    .indicator(IndicatorKeys.PLUS_DI, 10.0)
                    .indicator(IndicatorKeys.MINUS_DI, 28.0)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.DOWNTREND);
        }

        @Test
        @DisplayName("ADX between thresholds is UNCERTAIN")
        void adxBetweenThresholds_uncertain() {
            InstrumentSnapshot snapshot = snapshot(22)
                    .indicator(IndicatorKeys.PLUS_DI, 30.0)
                    .indicator(IndicatorKeys.MINUS_DI, 12.0)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.UNCERTAIN);
        }

        @Test
        @DisplayName("ADX exactly at trend threshold is not a trend")
        void adxAtTrendThreshold_uncertain() {
            InstrumentSnapshot snapshot = snapshot(25)
                    .indicator(IndicatorKeys.PLUS_DI, 30.0)
                    .indicator(IndicatorKeys.MINUS_DI, 12.0)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.UNCERTAIN);
        }

        @Test
        @DisplayName("Equal directional indicators are UNCERTAIN")
        void equalDi_uncertain() {
            InstrumentSnapshot snapshot = snapshot(40)
                    .indicator(IndicatorKeys.PLUS_DI, 20.0)
                    .indicator(IndicatorKeys.MINUS_DI, 20.0)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.UNCERTAIN);
        }
    }

    // ==============================
    // MISSING DATA
    // ==============================

    @Nested
    @DisplayName("Missing Data")
    class MissingData {

        @Test
        @DisplayName("Missing ADX is UNCERTAIN")
        void missingAdx_uncertain() {
            InstrumentSnapshot snapshot = InstrumentSnapshot.builder()
                    .instrumentId("BTC/USDT")
                    .price(100)
                    .build();

            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.UNCERTAIN);
        }

        @Test
        @DisplayName("NaN ADX is treated as missing")
        void nanAdx_uncertain() {
            assertThat(regimeClassifier.classify(snapshot(Double.NaN).build())).isEqualTo(Regime.UNCERTAIN);
        }

        @Test
        @DisplayName("Trend-strength ADX without directional indicators is UNCERTAIN")
        void strongAdxWithoutDi_uncertain() {
            assertThat(regimeClassifier.classify(snapshot(40).build())).isEqualTo(Regime.UNCERTAIN);
        }

        @Test
        @DisplayName("Null snapshot is UNCERTAIN")
        void nullSnapshot_uncertain() {
            assertThat(regimeClassifier.classify(null)).isEqualTo(Regime.UNCERTAIN);
        }
    }

    @Test
    @DisplayName("Identical snapshots always classify identically")
    void deterministic() {
        InstrumentSnapshot snapshot = snapshot(12).build();

        for (int i = 0; i < 10; i++) {
            assertThat(regimeClassifier.classify(snapshot)).isEqualTo(Regime.RANGE);
        }
    }

    @Test
    @DisplayName("Strong downtrend needs both DOWNTREND and the minimum ADX")
    void strongDowntrend() {
        InstrumentSnapshot moderate = snapshot(28)
                .indicator(IndicatorKeys.PLUS_DI, 10.0)
                .indicator(IndicatorKeys.MINUS_DI, 30.0)
                .build();
        InstrumentSnapshot strong = moderate.toBuilder().indicator(IndicatorKeys.ADX, 35.0).build();

        assertThat(regimeClassifier.isStrongDowntrend(moderate, 30)).isFalse();
        assertThat(regimeClassifier.isStrongDowntrend(strong, 30)).isTrue();
    }
}
