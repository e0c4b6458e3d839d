package tw.gc.quant.engine.services.backtest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.entities.Bar;
import tw.gc.quant.engine.entities.Trade;
import tw.gc.quant.engine.entities.Trade.TradeSide;
import tw.gc.quant.engine.services.execution.ExecutionCostModel;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.TradeSignal;
import tw.gc.quant.engine.strategy.impl.PairsTradingStrategy;
import tw.gc.quant.engine.strategy.pairs.PairPositionLegs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pairs Backtest Service
 * Replays a {@link PairsTradingStrategy} over two aligned price series.
 *
 * <p>A BUY signal goes long the spread (long A, short {@code hedgeRatio} units of B per unit of
 * A), a SELL goes short the spread. Each position is sized at {@code pairsMaxPositionPct} of cash
 * across both legs and held until the strategy raises an exit signal or flips direction; a flip
 * re-enters on the opposite side straight away. Each round trip is recorded as an entry and an
 * exit trade on the synthetic spread {@code A - hedgeRatio * B}.
 */
@Service
@Slf4j
public class PairsBacktestService {

    public static final String EXIT_MEAN_REVERSION = "mean_reversion";
    public static final String EXIT_STOP = "stop";
    public static final String EXIT_COINTEGRATION_BREAK = "cointegration_break";
    public static final String EXIT_SIGNAL_FLIP = "signal_flip";
    public static final String EXIT_END_OF_DATA = "end_of_data";

    private final QuantProperties.Backtest config;
    private final QuantProperties.Execution executionConfig;

    @Autowired
    public PairsBacktestService(QuantProperties properties) {
        this(properties.getBacktest(), properties.getExecution());
    }

    public PairsBacktestService(QuantProperties.Backtest config, QuantProperties.Execution executionConfig) {
        this.config = Objects.requireNonNull(config, "config");
        this.executionConfig = Objects.requireNonNull(executionConfig, "executionConfig");
        config.validate();
        executionConfig.validate();
    }

    public BacktestReport run(List<Bar> barsA, List<Bar> barsB, PairsTradingStrategy strategy) {
        return run("A", Bar.closes(barsA), "B", Bar.closes(barsB), strategy, ExecutionCostModel.from(executionConfig));
    }

    public BacktestReport run(String symbolA, List<Bar> barsA, String symbolB, List<Bar> barsB,
                              PairsTradingStrategy strategy) {
        return run(symbolA, Bar.closes(barsA), symbolB, Bar.closes(barsB), strategy,
                ExecutionCostModel.from(executionConfig));
    }

    /**
     * Run over two close series, trimmed to their common length.
     *
     * @param costModel execution costs applied to every leg, or null for frictionless fills
     */
    public BacktestReport run(String symbolA, double[] closesA, String symbolB, double[] closesB,
                              PairsTradingStrategy strategy, ExecutionCostModel costModel) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(closesA, "closesA");
        Objects.requireNonNull(closesB, "closesB");
        if (Objects.equals(symbolA, symbolB)) {
            throw new IllegalArgumentException("pair legs must have distinct symbols");
        }
        String pairSymbol = symbolA + "/" + symbolB;
        int n = Math.min(closesA.length, closesB.length);
        int lookback = config.getPairsLookback();
        if (n < lookback) {
            log.warn("⚠️ Skipping pairs backtest of {}: {} data points, need {}", pairSymbol, n, lookback);
            return BacktestReport.error(pairSymbol, String.format("Need at least %d data points, got %d", lookback, n));
        }

        log.info("🚀 Starting pairs backtest of {} ({}) with {} data points", pairSymbol,
                strategy.getHedgeRatioMethod(), n);
        if (costModel != null) {
            costModel.reset();
        }
        strategy.reset();

        double initialBalance = config.getInitialBalance();
        PairRun run = new PairRun(symbolA, symbolB, pairSymbol, new Portfolio(initialBalance), costModel, strategy);
        EquityCurve equityCurve = new EquityCurve(initialBalance);
        int windowSize = Math.max(lookback + 1, strategy.getMinimumHistory());

        for (int i = lookback; i < n; i++) {
            int from = Math.max(0, i + 1 - windowSize);
            double[] windowA = slice(closesA, from, i + 1);
            double[] windowB = slice(closesB, from, i + 1);
            double priceA = closesA[i];
            double priceB = closesB[i];
            TradeSignal signal = strategy.generateSignal(PriceHistory.pair(windowA, windowB));

            if (run.isOpen()) {
                int direction = signal.direction();
                if (signal.isExitSignal()) {
                    run.close(priceA, priceB, i, classifyExit(signal, strategy));
                } else if (direction != 0 && direction == -run.direction) {
                    run.close(priceA, priceB, i, EXIT_SIGNAL_FLIP);
                    if (signal.getConfidence() > config.getMinConfidence()) {
                        run.open(signal, priceA, priceB, i);
                    }
                }
            } else if (signal.isActionable() && signal.getConfidence() > config.getMinConfidence()
                    && signal.getHedgeRatio() != null) {
                run.open(signal, priceA, priceB, i);
            }

            equityCurve.append(run.portfolio.equity(Map.of(symbolA, priceA, symbolB, priceB)));
        }

        if (run.isOpen()) {
            run.close(closesA[n - 1], closesB[n - 1], n - 1, EXIT_END_OF_DATA);
        }

        BacktestReport report = ReportAssembler.assemble(pairSymbol, initialBalance, run.portfolio.getCash(), n,
                run.trades, equityCurve, costModel, config.getRiskFreeRate());
        log.info("✅ Pairs backtest of {} completed: {} trades, return {}%, exits {}", pairSymbol,
                report.totalTrades(), report.totalReturn(), report.exitReasons());
        return report;
    }

    private static String classifyExit(TradeSignal signal, PairsTradingStrategy strategy) {
        Double zScore = signal.getZScore();
        if (zScore == null) {
            return EXIT_COINTEGRATION_BREAK;
        }
        if (Math.abs(zScore) >= strategy.getParameters().getStopZScore()) {
            return EXIT_STOP;
        }
        return EXIT_MEAN_REVERSION;
    }

    private static double[] slice(double[] values, int from, int to) {
        double[] copy = new double[to - from];
        System.arraycopy(values, from, copy, 0, copy.length);
        return copy;
    }

    /**
     * Ledger and open spread position of one run.
     */
    private final class PairRun {
        private final String symbolA;
        private final String symbolB;
        private final String pairSymbol;
        private final Portfolio portfolio;
        private final ExecutionCostModel costModel;
        private final PairsTradingStrategy strategy;
        private final List<Trade> trades = new ArrayList<>();

        private int direction;
        private double hedgeRatio;

        private PairRun(String symbolA, String symbolB, String pairSymbol, Portfolio portfolio,
                        ExecutionCostModel costModel, PairsTradingStrategy strategy) {
            this.symbolA = symbolA;
            this.symbolB = symbolB;
            this.pairSymbol = pairSymbol;
            this.portfolio = portfolio;
            this.costModel = costModel;
            this.strategy = strategy;
        }

        boolean isOpen() {
            return direction != 0;
        }

        void open(TradeSignal signal, double priceA, double priceB, int bar) {
            double notional = portfolio.getCash() * config.getPairsMaxPositionPct();
            Optional<PairPositionLegs> legsOpt = strategy.getPositionLegs(signal.getAction(), signal.getHedgeRatio(),
                    priceA, priceB, notional);
            if (legsOpt.isEmpty()) {
                log.debug("No pair position at bar {}: notional {}", bar, notional);
                return;
            }
            PairPositionLegs legs = legsOpt.get();
            if (legs.legA().quantity() <= 0.0 || legs.legB().quantity() <= 0.0) {
                log.debug("Degenerate pair position at bar {}: hedge ratio {}", bar, signal.getHedgeRatio());
                return;
            }
            Leg a = fill(legs.legA().side(), priceA, legs.legA().quantity());
            Leg b = fill(legs.legB().side(), priceB, legs.legB().quantity());
            portfolio.open(symbolA, legs.legA().signedQuantity(), a.realizedPrice, a.fee, bar);
            portfolio.open(symbolB, legs.legB().signedQuantity(), b.realizedPrice, b.fee, bar);

            direction = signal.direction();
            hedgeRatio = Math.abs(signal.getHedgeRatio());
            trades.add(Trade.builder()
                    .symbol(pairSymbol)
                    .side(direction > 0 ? TradeSide.BUY : TradeSide.SELL)
                    .quantity(legs.legA().quantity())
                    .price(priceA - hedgeRatio * priceB)
                    .realizedPrice(a.realizedPrice - hedgeRatio * b.realizedPrice)
                    .fee(a.fee + b.fee)
                    .barIndex(bar)
                    .build());
            log.debug("Open {} spread {} at bar {} z={} hedge={}", direction > 0 ? "long" : "short", pairSymbol, bar,
                    signal.getZScore(), hedgeRatio);
        }

        void close(double priceA, double priceB, int bar, String exitReason) {
            Portfolio.Position posA = portfolio.getPosition(symbolA).orElseThrow();
            Portfolio.Position posB = portfolio.getPosition(symbolB).orElseThrow();
            Leg a = fill(posA.isLong() ? TradeSide.SELL : TradeSide.BUY, priceA, Math.abs(posA.quantity()));
            Leg b = fill(posB.isLong() ? TradeSide.SELL : TradeSide.BUY, priceB, Math.abs(posB.quantity()));
            double pnl = portfolio.close(symbolA, a.realizedPrice, a.fee) + portfolio.close(symbolB, b.realizedPrice, b.fee);

            trades.add(Trade.builder()
                    .symbol(pairSymbol)
                    .side(direction > 0 ? TradeSide.SELL : TradeSide.BUY)
                    .quantity(Math.abs(posA.quantity()))
                    .price(priceA - hedgeRatio * priceB)
                    .realizedPrice(a.realizedPrice - hedgeRatio * b.realizedPrice)
                    .fee(a.fee + b.fee)
                    .barIndex(bar)
                    .pnl(pnl)
                    .durationBars(bar - posA.entryBar())
                    .exitReason(exitReason)
                    .build());
            log.debug("Close spread {} at bar {}: pnl {} ({})", pairSymbol, bar, pnl, exitReason);
            direction = 0;
            hedgeRatio = 0.0;
        }

        private Leg fill(TradeSide side, double price, double quantity) {
            if (costModel == null) {
                return new Leg(price, 0.0);
            }
            ExecutionCostModel.Fill fill = costModel.execute(side, price, quantity);
            return new Leg(fill.realizedPrice(), fill.commission());
        }
    }

    private record Leg(double realizedPrice, double fee) {
    }
}
