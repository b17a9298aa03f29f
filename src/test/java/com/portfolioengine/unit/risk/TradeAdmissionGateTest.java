package com.portfolioengine.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.portfolioengine.domain.enums.ExitReason;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.model.IndicatorKeys;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.OrderBookDepth;
import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.event.RiskEventType;
import com.portfolioengine.event.RiskLevel;
import com.portfolioengine.observability.DecisionLogger;
import com.portfolioengine.risk.AdmissionConfig;
import com.portfolioengine.risk.AdmissionResult;
import com.portfolioengine.risk.AllocationBook;
import com.portfolioengine.risk.DrawdownTracker;
import com.portfolioengine.risk.EmergencyStopConfig;
import com.portfolioengine.risk.EmergencyStopGuard;
import com.portfolioengine.risk.ReservationResult;
import com.portfolioengine.risk.RiskBudgetLedger;
import com.portfolioengine.risk.RiskLimits;
import com.portfolioengine.risk.RiskViolation;
import com.portfolioengine.risk.TradeAdmissionGate;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for TradeAdmissionGate with a real ledger and allocation book.
 */
@ExtendWith(MockitoExtension.class)
class TradeAdmissionGateTest {

    private static final BigDecimal CAPITAL = new BigDecimal("10000");
    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private DecisionLogger decisionLogger;

    private RiskLimits riskLimits;
    private AdmissionConfig admissionConfig;
    private RiskBudgetLedger ledger;
    private AllocationBook allocationBook;
    private DrawdownTracker drawdownTracker;
    private EmergencyStopGuard emergencyStopGuard;
    private TradeAdmissionGate gate;

    @BeforeEach
    void setUp() {
        riskLimits = RiskLimits.builder()
                .maxTotalRisk(new BigDecimal("0.25"))
                .assumedAdverseMove(new BigDecimal("0.08"))
                .maxOpenPositions(10)
                .maxCategoryAllocation(new BigDecimal("0.50"))
                .maxSpread(new BigDecimal("0.005"))
                .maxDrawdown(new BigDecimal("0.20"))
                .build();
        admissionConfig = new AdmissionConfig();
        ledger = new RiskBudgetLedger(riskLimits, Clock.systemUTC());
        ledger.updateTotalCapital(CAPITAL);
        allocationBook = new AllocationBook(ledger);
        drawdownTracker = new DrawdownTracker(riskLimits, eventPublisherHelper, decisionLogger);
        drawdownTracker.observe(CAPITAL, T0);
        emergencyStopGuard = new EmergencyStopGuard(new EmergencyStopConfig(), eventPublisherHelper, decisionLogger);
        gate = new TradeAdmissionGate(
                riskLimits,
                admissionConfig,
                allocationBook,
                ledger,
                drawdownTracker,
                emergencyStopGuard,
                eventPublisherHelper);
    }

    private ReservationResult reserve(String stake, String category) {
        return ledger.reserve(new BigDecimal(stake).multiply(riskLimits.getAssumedAdverseMove()), category);
    }

    // ==============================
    // ENTRIES
    // ==============================

    @Nested
    @DisplayName("Entry Admission")
    class EntryAdmission {

        @Test
        @DisplayName("Entry within every limit is approved")
        void withinLimits_approved() {
            AdmissionResult result = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("500"), reserve("500", "btc"), CAPITAL, new OrderBookDepth(99.9, 100.1));

            assertThat(result.isApproved()).isTrue();
        }

        @Test
        @DisplayName("Eleventh position is rejected at a maximum of ten")
        void eleventhPosition_rejected() {
            for (int i = 0; i < 10; i++) {
                allocationBook.recordOpen("X" + i + "/USDT", i % 2 == 0 ? "alt" : "eth", new BigDecimal("100"));
            }

            AdmissionResult result = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("100"), reserve("100", "btc"), CAPITAL, null);

            assertThat(result.isRejected()).isTrue();
            assertThat(result.hasViolation(RiskViolation.MAX_OPEN_POSITIONS)).isTrue();
            verify(eventPublisherHelper)
                    .publishRiskEvent(any(), eq(RiskEventType.MAX_POSITIONS_REACHED), eq(RiskLevel.WARNING), anyString(), anyMap());
        }

        @Test
        @DisplayName("Ladder orders ignore the open-position count")
        void ladder_ignoresPositionCount() {
            for (int i = 0; i < 10; i++) {
                allocationBook.recordOpen("X" + i + "/USDT", "alt", new BigDecimal("100"));
            }

            AdmissionResult result = gate.admitLadder(
                    "X0/USDT", "alt", new BigDecimal("100"), reserve("100", "alt"), CAPITAL, null);

            assertThat(result.isApproved()).isTrue();
        }

        @Test
        @DisplayName("Category ceiling counts committed stake plus the new order")
        void categoryCeiling_rejected() {
            allocationBook.recordOpen("BTC/USDT", "btc", new BigDecimal("4800"));

            AdmissionResult result = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("300"), reserve("300", "btc"), CAPITAL, null);

            assertThat(result.hasViolation(RiskViolation.CATEGORY_CEILING_EXCEEDED)).isTrue();
        }

        @Test
        @DisplayName("Per-category override replaces the default ceiling")
        void categoryOverride_applies() {
            admissionConfig.getCategoryCeilings().put("alt", new BigDecimal("0.05"));

            AdmissionResult result = gate.admitEntry(
                    "SOL/USDT", "alt", new BigDecimal("600"), reserve("600", "alt"), CAPITAL, null);

            assertThat(result.hasViolation(RiskViolation.CATEGORY_CEILING_EXCEEDED)).isTrue();
        }

        @Test
        @DisplayName("Denied or missing reservation is rejected")
        void deniedReservation_rejected() {
            ReservationResult denied = ReservationResult.insufficientBudget(new BigDecimal("80"), BigDecimal.ZERO);

            assertThat(gate.admitEntry("BTC/USDT", "btc", new BigDecimal("1000"), denied, CAPITAL, null)
                            .hasViolation(RiskViolation.RISK_BUDGET_EXHAUSTED))
                    .isTrue();
            assertThat(gate.admitEntry("BTC/USDT", "btc", new BigDecimal("1000"), null, CAPITAL, null)
                            .hasViolation(RiskViolation.RISK_BUDGET_EXHAUSTED))
                    .isTrue();
        }

        @Test
        @DisplayName("Wide spread is rejected; missing depth skips the check")
        void spreadCheck() {
            OrderBookDepth wide = new OrderBookDepth(99.0, 101.0);

            assertThat(gate.admitEntry("BTC/USDT", "btc", new BigDecimal("100"), reserve("100", "btc"), CAPITAL, wide)
                            .hasViolation(RiskViolation.SPREAD_TOO_WIDE))
                    .isTrue();
            assertThat(gate.admitEntry("BTC/USDT", "btc", new BigDecimal("100"), reserve("100", "btc"), CAPITAL, null)
                            .isApproved())
                    .isTrue();
        }

        @Test
        @DisplayName("Drawdown at the limit refuses new exposure")
        void drawdownBreach_rejected() {
            drawdownTracker.observe(new BigDecimal("7900"), T0.plus(Duration.ofHours(1)));

            AdmissionResult result = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("100"), reserve("100", "btc"), CAPITAL, null);

            assertThat(result.hasViolation(RiskViolation.MAX_DRAWDOWN_BREACHED)).isTrue();
            verify(eventPublisherHelper)
                    .publishRiskEvent(any(), eq(RiskEventType.DRAWDOWN_LIMIT_BREACH), eq(RiskLevel.CRITICAL), anyString(), anyMap());
        }

        @Test
        @DisplayName("All violations are reported together")
        void multipleViolations_aggregated() {
            for (int i = 0; i < 10; i++) {
                allocationBook.recordOpen("X" + i + "/USDT", "btc", new BigDecimal("500"));
            }

            AdmissionResult result = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("500"), null, CAPITAL, new OrderBookDepth(99.0, 101.0));

            assertThat(result.getViolations())
                    .extracting(RiskViolation::getCode)
                    .contains(
                            RiskViolation.MAX_OPEN_POSITIONS,
                            RiskViolation.CATEGORY_CEILING_EXCEEDED,
                            RiskViolation.RISK_BUDGET_EXHAUSTED,
                            RiskViolation.SPREAD_TOO_WIDE);
        }

        @Test
        @DisplayName("No capital is rejected")
        void noCapital_rejected() {
            AdmissionResult result = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("100"), null, BigDecimal.ZERO, null);

            assertThat(result.hasViolation(RiskViolation.NO_CAPITAL)).isTrue();
        }
    }

    // ==============================
    // PORTFOLIO LIMITS
    // ==============================

    @Nested
    @DisplayName("Portfolio Limits")
    class PortfolioLimits {

        @Test
        @DisplayName("Third position in a correlation group is rejected at a maximum of two")
        void correlationGroup_full_rejected() {
            admissionConfig.getCorrelationGroups().put("layer1", List.of("BTC", "ETH", "SOL"));
            admissionConfig.setMaxCorrelatedPositions(2);
            allocationBook.recordOpen("BTC/USDT", "btc", new BigDecimal("500"));
            allocationBook.recordOpen("ETH/USDT", "eth", new BigDecimal("500"));

            AdmissionResult result = gate.admitEntry(
                    "SOL/USDT", "alt", new BigDecimal("500"), reserve("500", "alt"), CAPITAL, null);

            assertThat(result.getViolations())
                    .extracting(RiskViolation::getCode)
                    .containsExactly(RiskViolation.MAX_CORRELATED_POSITIONS);
            verify(eventPublisherHelper)
                    .publishRiskEvent(any(), eq(RiskEventType.POSITION_LIMIT_REACHED), eq(RiskLevel.INFO), anyString(), anyMap());
        }

        @Test
        @DisplayName("Instruments outside a full group and ladder orders inside it are admitted")
        void correlationGroup_otherInstruments_admitted() {
            admissionConfig.getCorrelationGroups().put("layer1", List.of("btc", "eth", "sol"));
            admissionConfig.setMaxCorrelatedPositions(2);
            allocationBook.recordOpen("BTC/USDT", "btc", new BigDecimal("500"));
            allocationBook.recordOpen("ETH/USDT", "eth", new BigDecimal("500"));

            assertThat(gate.admitEntry(
                            "DOGE/USDT", "alt", new BigDecimal("500"), reserve("500", "alt"), CAPITAL, null)
                            .isApproved())
                    .isTrue();
            assertThat(gate.admitLadder(
                            "ETH/USDT", "eth", new BigDecimal("500"), reserve("500", "eth"), CAPITAL, null)
                            .isApproved())
                    .isTrue();
        }

        @Test
        @DisplayName("Asset ceiling sums every quote of the same base asset")
        void assetCeiling_acrossQuotes() {
            admissionConfig.setMaxAssetAllocation(new BigDecimal("0.10"));
            allocationBook.recordOpen("BTC/USDT", "btc", new BigDecimal("600"));
            allocationBook.recordOpen("BTC/EUR", "btc", new BigDecimal("300"));

            AdmissionResult over = gate.admitEntry(
                    "BTC/USDC", "btc", new BigDecimal("200"), reserve("200", "btc"), CAPITAL, null);
            AdmissionResult atCeiling = gate.admitEntry(
                    "BTC/USDC", "btc", new BigDecimal("100"), reserve("100", "btc"), CAPITAL, null);
            AdmissionResult otherAsset = gate.admitEntry(
                    "ETH/USDT", "eth", new BigDecimal("900"), reserve("900", "eth"), CAPITAL, null);

            assertThat(over.hasViolation(RiskViolation.ASSET_ALLOCATION_EXCEEDED)).isTrue();
            assertThat(atCeiling.isApproved()).isTrue();
            assertThat(otherAsset.isApproved()).isTrue();
        }

        @Test
        @DisplayName("Daily loss pause refuses entries and ladder orders but not exits")
        void dailyLossPause_refusesExposure() {
            riskLimits.setMaxDailyLoss(new BigDecimal("0.05"));
            drawdownTracker.observe(new BigDecimal("9400"), T0.plus(Duration.ofHours(1)));

            AdmissionResult entry = gate.admitEntry(
                    "BTC/USDT", "btc", new BigDecimal("100"), reserve("100", "btc"), CAPITAL, null);
            AdmissionResult ladder = gate.admitLadder(
                    "ETH/USDT", "eth", new BigDecimal("100"), reserve("100", "eth"), CAPITAL, null);

            assertThat(entry.getViolations())
                    .extracting(RiskViolation::getCode)
                    .containsExactly(RiskViolation.DAILY_LOSS_PAUSE);
            assertThat(ladder.hasViolation(RiskViolation.DAILY_LOSS_PAUSE)).isTrue();
            assertThat(gate.admitExit(ExitReason.STOP_LOSS, PositionSide.LONG, -0.10, null).isApproved())
                    .isTrue();
        }

        @Test
        @DisplayName("Active emergency stop refuses new exposure")
        void emergencyStop_refusesExposure() {
            emergencyStopGuard.observeBenchmark("BTC/USDT", 100, T0);
            emergencyStopGuard.observeBenchmark("BTC/USDT", 80, T0.plus(Duration.ofMinutes(20)));

            AdmissionResult result = gate.admitEntry(
                    "ETH/USDT", "eth", new BigDecimal("100"), reserve("100", "eth"), CAPITAL, null);

            assertThat(result.getViolations())
                    .extracting(RiskViolation::getCode)
                    .containsExactly(RiskViolation.EMERGENCY_STOP_ACTIVE);
        }
    }

    // ==============================
    // EXITS
    // ==============================

    @Nested
    @DisplayName("Exit Admission")
    class ExitAdmission {

        private final InstrumentSnapshot calm = InstrumentSnapshot.builder()
                .instrumentId("BTC/USDT")
                .price(100)
                .indicator(IndicatorKeys.RSI, 55.0)
                .indicator(IndicatorKeys.BB_WIDTH, 0.05)
                .build();

        @Test
        @DisplayName("Stop-loss and emergency exits always pass")
        void unconditionalExits_pass() {
            assertThat(gate.admitExit(ExitReason.STOP_LOSS, PositionSide.LONG, -0.12, calm).isApproved()).isTrue();
            assertThat(gate.admitExit(ExitReason.EMERGENCY, PositionSide.LONG, 0.0, null).isApproved()).isTrue();
        }

        @Test
        @DisplayName("Signal exit on a barely profitable trade is delayed")
        void thinProfitSignalExit_delayed() {
            AdmissionResult result = gate.admitExit(ExitReason.SIGNAL, PositionSide.LONG, 0.005, calm);

            assertThat(result.hasViolation(RiskViolation.EXIT_DELAYED)).isTrue();
        }

        @Test
        @DisplayName("Take-profit levels pass on a profit below the signal-exit minimum")
        void takeProfitExit_passes() {
            assertThat(gate.admitExit(ExitReason.TAKE_PROFIT, PositionSide.LONG, 0.015, calm).isApproved()).isTrue();
        }

        @Test
        @DisplayName("Signal exit above the minimum profit passes")
        void profitableSignalExit_passes() {
            assertThat(gate.admitExit(ExitReason.SIGNAL, PositionSide.LONG, 0.03, calm).isApproved()).isTrue();
        }

        @Test
        @DisplayName("Overextension lets a thin-profit exit through")
        void overextended_passes() {
            InstrumentSnapshot overbought = calm.toBuilder().indicator(IndicatorKeys.RSI, 85.0).build();
            InstrumentSnapshot oversold = calm.toBuilder().indicator(IndicatorKeys.RSI, 15.0).build();

            assertThat(gate.admitExit(ExitReason.SIGNAL, PositionSide.LONG, 0.001, overbought).isApproved())
                    .isTrue();
            assertThat(gate.admitExit(ExitReason.SIGNAL, PositionSide.SHORT, 0.001, oversold).isApproved())
                    .isTrue();
            assertThat(gate.admitExit(ExitReason.SIGNAL, PositionSide.SHORT, 0.001, overbought).isRejected())
                    .isTrue();
        }

        @Test
        @DisplayName("Rebalance exits follow the bypass policy flag")
        void rebalanceExit_policyFlag() {
            assertThat(gate.admitExit(ExitReason.REBALANCE, PositionSide.LONG, 0.0, calm).isRejected()).isTrue();

            admissionConfig.setRebalanceExitBypassesProfitDelay(true);

            assertThat(gate.admitExit(ExitReason.REBALANCE, PositionSide.LONG, 0.0, calm).isApproved()).isTrue();
        }

        @Test
        @DisplayName("ROI exits are not delayed")
        void roiExit_passes() {
            assertThat(gate.admitExit(ExitReason.ROI, PositionSide.LONG, 0.01, calm).isApproved()).isTrue();
        }
    }
}
