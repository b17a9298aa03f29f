package com.portfolioengine.integration;

import static com.portfolioengine.domain.model.IndicatorKeys.ADX;
import static com.portfolioengine.domain.model.IndicatorKeys.EMA_FAST;
import static com.portfolioengine.domain.model.IndicatorKeys.EMA_SLOW;
import static com.portfolioengine.domain.model.IndicatorKeys.MACD;
import static com.portfolioengine.domain.model.IndicatorKeys.MACD_SIGNAL;
import static com.portfolioengine.domain.model.IndicatorKeys.MINUS_DI;
import static com.portfolioengine.domain.model.IndicatorKeys.PLUS_DI;
import static com.portfolioengine.domain.model.IndicatorKeys.VOLUME_RATIO;
import static com.portfolioengine.domain.model.IndicatorKeys.prev;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.portfolioengine.core.engine.DecisionEngine;
import com.portfolioengine.core.engine.TickDispatcher;
import com.portfolioengine.dca.DcaLadderConfig;
import com.portfolioengine.dca.DcaLadderController;
import com.portfolioengine.domain.enums.DecisionAction;
import com.portfolioengine.domain.enums.ExitReason;
import com.portfolioengine.domain.enums.FillType;
import com.portfolioengine.domain.enums.PositionSide;
import com.portfolioengine.domain.model.Decision;
import com.portfolioengine.domain.model.Fill;
import com.portfolioengine.domain.model.InstrumentSnapshot;
import com.portfolioengine.domain.model.Position;
import com.portfolioengine.event.EventPublisherHelper;
import com.portfolioengine.market.InMemoryMarketDataStore;
import com.portfolioengine.market.InMemoryWallet;
import com.portfolioengine.observability.DecisionLogger;
import com.portfolioengine.observability.EngineMetricsService;
import com.portfolioengine.rebalance.CategoryResolver;
import com.portfolioengine.rebalance.PortfolioRebalancer;
import com.portfolioengine.rebalance.RebalanceConfig;
import com.portfolioengine.rebalance.RebalanceService;
import com.portfolioengine.regime.RegimeClassifier;
import com.portfolioengine.regime.RegimeConfig;
import com.portfolioengine.risk.AdmissionConfig;
import com.portfolioengine.risk.AllocationBook;
import com.portfolioengine.risk.DrawdownTracker;
import com.portfolioengine.risk.EmergencyStopConfig;
import com.portfolioengine.risk.EmergencyStopGuard;
import com.portfolioengine.risk.RiskBudgetLedger;
import com.portfolioengine.risk.RiskLimits;
import com.portfolioengine.risk.RiskViolation;
import com.portfolioengine.risk.TradeAdmissionGate;
import com.portfolioengine.signal.MeanReversionFamily;
import com.portfolioengine.signal.RiskExitFamily;
import com.portfolioengine.signal.RoiConfig;
import com.portfolioengine.signal.RoiTable;
import com.portfolioengine.signal.SignalConfig;
import com.portfolioengine.signal.SignalEvaluator;
import com.portfolioengine.signal.TrendFollowingFamily;
import com.portfolioengine.sizing.PositionSizerFactory;
import com.portfolioengine.sizing.PositionSizingConfig;
import com.portfolioengine.sizing.RiskBudgetedSizingService;
import com.portfolioengine.sizing.impl.RiskBasedSizer;
import com.portfolioengine.sizing.impl.VolatilityScaledSizer;
import com.portfolioengine.stoploss.StopLossCalculator;
import com.portfolioengine.stoploss.StopLossConfig;
import com.portfolioengine.takeprofit.TakeProfitConfig;
import com.portfolioengine.takeprofit.TakeProfitController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-service integration test for the tick and rebalance flows.
 * Wires real TickDispatcher + DecisionEngine + RebalanceService together with a
 * same-thread executor, in-memory market data and wallet, and event publishing mocked,
 * to verify long and short entry-to-exit flows and a rebalance cycle end to end.
 */
@ExtendWith(MockitoExtension.class)
class DecisionFlowIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private Clock clock;
    private RiskBudgetLedger ledger;
    private AllocationBook allocationBook;
    private AdmissionConfig admissionConfig;
    private SignalConfig signalConfig;
    private RebalanceConfig rebalanceConfig;
    private InMemoryMarketDataStore marketDataStore;
    private TickDispatcher tickDispatcher;
    private RebalanceService rebalanceService;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        Clock logClock = Clock.fixed(T0, ZoneOffset.UTC);

        RiskLimits riskLimits = RiskLimits.builder()
                .maxTotalRisk(new BigDecimal("0.25"))
                .assumedAdverseMove(new BigDecimal("0.08"))
                .maxOpenPositions(10)
                .maxCategoryAllocation(new BigDecimal("0.50"))
                .build();
        ledger = new RiskBudgetLedger(riskLimits, logClock);
        allocationBook = new AllocationBook(ledger);
        DecisionLogger decisionLogger = new DecisionLogger(applicationEventPublisher, logClock);
        RegimeClassifier regimeClassifier = new RegimeClassifier(new RegimeConfig());

        signalConfig = new SignalConfig();
        SignalEvaluator signalEvaluator = new SignalEvaluator(
                List.of(
                        new RiskExitFamily(signalConfig),
                        new MeanReversionFamily(signalConfig),
                        new TrendFollowingFamily(signalConfig)),
                signalConfig);

        PositionSizingConfig sizingConfig = new PositionSizingConfig();
        DcaLadderConfig dcaLadderConfig = new DcaLadderConfig();
        VolatilityScaledSizer volatilityScaledSizer = new VolatilityScaledSizer(sizingConfig);
        RiskBudgetedSizingService sizingService = new RiskBudgetedSizingService(
                new PositionSizerFactory(
                        List.of(volatilityScaledSizer, new RiskBasedSizer(sizingConfig, volatilityScaledSizer))),
                sizingConfig,
                dcaLadderConfig,
                ledger,
                riskLimits,
                decisionLogger,
                eventPublisherHelper);

        StopLossConfig stopLossConfig = new StopLossConfig();
        DrawdownTracker drawdownTracker = new DrawdownTracker(riskLimits, eventPublisherHelper, decisionLogger);
        EmergencyStopGuard emergencyStopGuard =
                new EmergencyStopGuard(new EmergencyStopConfig(), eventPublisherHelper, decisionLogger);
        admissionConfig = new AdmissionConfig();
        TradeAdmissionGate gate = new TradeAdmissionGate(
                riskLimits,
                admissionConfig,
                allocationBook,
                ledger,
                drawdownTracker,
                emergencyStopGuard,
                eventPublisherHelper);
        rebalanceConfig = new RebalanceConfig();

        DecisionEngine decisionEngine = new DecisionEngine(
                regimeClassifier,
                signalEvaluator,
                new RoiTable(new RoiConfig()),
                sizingService,
                new DcaLadderController(dcaLadderConfig),
                new TakeProfitController(new TakeProfitConfig()),
                new StopLossCalculator(stopLossConfig),
                stopLossConfig,
                gate,
                ledger,
                allocationBook,
                drawdownTracker,
                emergencyStopGuard,
                new CategoryResolver(rebalanceConfig),
                decisionLogger,
                new EngineMetricsService(new SimpleMeterRegistry(), ledger, allocationBook),
                eventPublisherHelper,
                clock);

        marketDataStore = new InMemoryMarketDataStore();
        InMemoryWallet wallet = new InMemoryWallet(new BigDecimal("10000"));
        tickDispatcher =
                new TickDispatcher(decisionEngine, marketDataStore, marketDataStore, wallet, Runnable::run, clock);
        rebalanceService = new RebalanceService(
                new PortfolioRebalancer(rebalanceConfig, regimeClassifier, decisionLogger),
                rebalanceConfig,
                allocationBook,
                tickDispatcher,
                marketDataStore,
                wallet,
                eventPublisherHelper);
    }

    private void at(Instant instant) {
        when(clock.instant()).thenReturn(instant);
    }

    private InstrumentSnapshot bullishCross(String instrumentId, double price) {
        return InstrumentSnapshot.builder()
                .instrumentId(instrumentId)
                .price(price)
                .indicator(ADX, 32.0)
                .indicator(PLUS_DI, 28.0)
                .indicator(MINUS_DI, 14.0)
                .indicator(prev(MACD), -0.5)
                .indicator(prev(MACD_SIGNAL), 0.0)
                .indicator(MACD, 0.8)
                .indicator(MACD_SIGNAL, 0.2)
                .indicator(EMA_FAST, price * 1.01)
                .indicator(EMA_SLOW, price * 0.98)
                .indicator(VOLUME_RATIO, 1.5)
                .build();
    }

    private InstrumentSnapshot bearishTrendCross(String instrumentId, double price) {
        return InstrumentSnapshot.builder()
                .instrumentId(instrumentId)
                .price(price)
                .indicator(ADX, 32.0)
                .indicator(PLUS_DI, 12.0)
                .indicator(MINUS_DI, 30.0)
                .indicator(prev(MACD), 0.5)
                .indicator(prev(MACD_SIGNAL), 0.2)
                .indicator(MACD, 0.1)
                .indicator(MACD_SIGNAL, 0.3)
                .indicator(EMA_FAST, price * 0.98)
                .indicator(EMA_SLOW, price * 1.01)
                .indicator(VOLUME_RATIO, 1.5)
                .build();
    }

    private InstrumentSnapshot quiet(String instrumentId, double price) {
        return InstrumentSnapshot.builder().instrumentId(instrumentId).price(price).build();
    }

    @Test
    @DisplayName("Entry, ladder and stop exit leave the ledger and allocation book empty")
    void entryLadderStopExit() {
        at(T0);
        Decision entry = tickDispatcher.submit(bullishCross("BTC/USDT", 100)).join().orElseThrow();
        assertThat(entry.getAction()).isEqualTo(DecisionAction.ENTER);
        assertThat(tickDispatcher.getOpenPositions()).hasSize(1);

        // Under the first rung but inside the spacing interval
        at(T0.plus(Duration.ofHours(1)));
        assertThat(tickDispatcher.submit(quiet("BTC/USDT", 95)).join().orElseThrow().getAction())
                .isEqualTo(DecisionAction.HOLD);

        at(T0.plus(Duration.ofHours(5)));
        Decision ladder = tickDispatcher.submit(quiet("BTC/USDT", 95)).join().orElseThrow();
        assertThat(ladder.getAction()).isEqualTo(DecisionAction.LADDER);
        assertThat(ladder.getTag()).isEqualTo("ladder_1");

        Position position = tickDispatcher.getPosition("BTC/USDT").orElseThrow();
        assertThat(position.getFills()).extracting(Fill::type).containsExactly(FillType.INITIAL, FillType.LADDER);
        assertThat(allocationBook.getCommittedStake("btc")).isEqualByComparingTo("2200");
        assertThat(ledger.getReservedRisk()).isEqualByComparingTo("176");

        // Open price is now about 97.2; the -15% stop sits near 82.6
        at(T0.plus(Duration.ofHours(6)));
        Decision exit = tickDispatcher.submit(quiet("BTC/USDT", 80)).join().orElseThrow();
        assertThat(exit.getAction()).isEqualTo(DecisionAction.EXIT);
        assertThat(exit.getExitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(exit.getStake()).isEqualByComparingTo("2200");

        assertThat(tickDispatcher.getOpenPositions()).isEmpty();
        assertThat(tickDispatcher.getLastDecision("BTC/USDT")).contains(exit);
        assertThat(ledger.getReservedRisk()).isEqualByComparingTo("0");
        assertThat(ledger.getActiveReservations()).isEmpty();
        assertThat(allocationBook.getOpenPositionCount()).isZero();
        assertThat(allocationBook.getCommittedStake("btc")).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Short entry, trailing stop tightening and stop exit leave the ledger empty")
    void shortEntryTrailingStopExit() {
        signalConfig.setShortingEnabled(true);

        at(T0);
        Decision entry = tickDispatcher.submit(bearishTrendCross("ETH/USDT", 2000)).join().orElseThrow();
        assertThat(entry.getAction()).isEqualTo(DecisionAction.ENTER);
        assertThat(entry.getSide()).isEqualTo(PositionSide.SHORT);
        assertThat(entry.getTag()).isEqualTo("trend_macd_cross_short");
        assertThat(allocationBook.getCommittedStake("eth")).isEqualByComparingTo("1000");

        // 7% in favour activates the trailing stop at 3.05% profit, i.e. a buy-back at 1939
        at(T0.plus(Duration.ofMinutes(20)));
        assertThat(tickDispatcher.submit(quiet("ETH/USDT", 1860)).join().orElseThrow().getAction())
                .isEqualTo(DecisionAction.HOLD);
        Position position = tickDispatcher.getPosition("ETH/USDT").orElseThrow();
        assertThat(position.getStopLevel()).isCloseTo(0.0305, within(1e-9));
        assertThat(position.getStopPrice()).isCloseTo(1939.0, within(1e-6));

        at(T0.plus(Duration.ofMinutes(30)));
        Decision exit = tickDispatcher.submit(quiet("ETH/USDT", 1950)).join().orElseThrow();
        assertThat(exit.getAction()).isEqualTo(DecisionAction.EXIT);
        assertThat(exit.getExitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(exit.getSide()).isEqualTo(PositionSide.SHORT);

        assertThat(tickDispatcher.getOpenPositions()).isEmpty();
        assertThat(ledger.getReservedRisk()).isEqualByComparingTo("0");
        assertThat(allocationBook.getCommittedStake("eth")).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Ticks for several instruments share the risk budget")
    void submitAll_sharesBudget() {
        at(T0);
        Map<String, Decision> decisions = tickDispatcher.submitAll(List.of(
                bullishCross("BTC/USDT", 100), bullishCross("ETH/USDT", 2000), bullishCross("SOL/USDT", 150)));

        assertThat(decisions).hasSize(3);
        assertThat(decisions.values()).allMatch(Decision::isEnter);
        assertThat(ledger.getReservedRisk()).isEqualByComparingTo("240");
        assertThat(allocationBook.snapshot()).containsOnlyKeys("btc", "eth", "alt");
    }

    @Test
    @DisplayName("Liquidation closes every open position")
    void liquidateAll_closesEverything() {
        at(T0);
        tickDispatcher.submitAll(List.of(bullishCross("BTC/USDT", 100), bullishCross("ETH/USDT", 2000)));

        List<Decision> decisions = tickDispatcher.liquidateAll();

        assertThat(decisions).hasSize(2).allMatch(d -> d.getExitReason() == ExitReason.EMERGENCY);
        assertThat(tickDispatcher.getOpenPositions()).isEmpty();
        assertThat(ledger.getReservedRisk()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Rebalance cycle opens the under-weight category it has market data for")
    void rebalanceCycle_increase() {
        at(T0);
        marketDataStore.putSnapshot(quiet("BTC/USDT", 100));

        List<Decision> decisions = rebalanceService.runCycle();

        // btc is 40% under target; 2500 after the position clamp, 1500 after the per-order ceiling
        assertThat(decisions).singleElement().satisfies(decision -> {
            assertThat(decision.getAction()).isEqualTo(DecisionAction.ENTER);
            assertThat(decision.getTag()).isEqualTo("rebalance");
            assertThat(decision.getStake()).isEqualByComparingTo("1500");
            assertThat(decision.getPosition().getFills().get(0).type()).isEqualTo(FillType.REBALANCE);
        });
        assertThat(allocationBook.getCommittedStake("btc")).isEqualByComparingTo("1500");
        verify(eventPublisherHelper).publishRebalanceCycle(eq(rebalanceService), anyList(), eq(1));
    }

    @Test
    @DisplayName("Over-weight exit on thin profit waits unless the bypass flag is set")
    void rebalanceCycle_decrease() {
        at(T0);
        tickDispatcher.submit(bullishCross("ETH/USDT", 2000)).join();
        rebalanceConfig.getTargets().put("eth", 0.0);
        rebalanceConfig.setThreshold(0.05);

        List<Decision> delayed = rebalanceService.runCycle();

        assertThat(delayed).singleElement().satisfies(decision -> {
            assertThat(decision.getAction()).isEqualTo(DecisionAction.HOLD);
            assertThat(decision.getViolations())
                    .extracting(RiskViolation::getCode)
                    .containsExactly(RiskViolation.EXIT_DELAYED);
        });
        assertThat(tickDispatcher.getOpenPositions()).hasSize(1);

        admissionConfig.setRebalanceExitBypassesProfitDelay(true);
        List<Decision> exited = rebalanceService.runCycle();

        assertThat(exited).singleElement().satisfies(decision -> {
            assertThat(decision.getAction()).isEqualTo(DecisionAction.EXIT);
            assertThat(decision.getExitReason()).isEqualTo(ExitReason.REBALANCE);
        });
        assertThat(tickDispatcher.getOpenPositions()).isEmpty();
        assertThat(allocationBook.getCommittedStake("eth")).isEqualByComparingTo("0");
        verify(eventPublisherHelper).publishRebalanceCycle(any(), anyList(), eq(0));
    }
}
