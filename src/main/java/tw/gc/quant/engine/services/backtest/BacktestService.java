package tw.gc.quant.engine.services.backtest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.entities.Bar;
import tw.gc.quant.engine.entities.Trade;
import tw.gc.quant.engine.entities.Trade.TradeSide;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator;
import tw.gc.quant.engine.services.execution.ExecutionCostModel;
import tw.gc.quant.engine.services.positionsizing.PositionSizingRequest;
import tw.gc.quant.engine.services.positionsizing.PositionSizingResult;
import tw.gc.quant.engine.services.positionsizing.PositionSizingService;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.Strategy;
import tw.gc.quant.engine.strategy.TradeSignal;
import tw.gc.quant.engine.strategy.TradeSignal.SignalAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Backtest Service
 * Replays a single-asset strategy bar by bar against historical data.
 *
 * <p>Long-only: a BUY with enough confidence opens a position sized by
 * {@link PositionSizingService}; a SELL or an exit signal closes it. Fills go through a fresh
 * {@link ExecutionCostModel} per run, and any position still open is closed at the last bar.
 */
@Service
@Slf4j
public class BacktestService {

    public static final String EXIT_SELL_SIGNAL = "sell_signal";
    public static final String EXIT_SIGNAL = "exit_signal";
    public static final String EXIT_END_OF_DATA = "end_of_data";

    private final QuantProperties.Backtest config;
    private final QuantProperties.Execution executionConfig;
    private final PositionSizingService positionSizingService;

    @Autowired
    public BacktestService(QuantProperties properties, PositionSizingService positionSizingService) {
        this(properties.getBacktest(), properties.getExecution(), positionSizingService);
    }

    public BacktestService(QuantProperties.Backtest config, QuantProperties.Execution executionConfig,
                           PositionSizingService positionSizingService) {
        this.config = Objects.requireNonNull(config, "config");
        this.executionConfig = Objects.requireNonNull(executionConfig, "executionConfig");
        this.positionSizingService = Objects.requireNonNull(positionSizingService, "positionSizingService");
        config.validate();
        executionConfig.validate();
    }

    /**
     * Run with the configured execution cost model.
     */
    public BacktestReport run(String symbol, List<Bar> bars, Strategy strategy) {
        return run(symbol, bars, strategy, ExecutionCostModel.from(executionConfig));
    }

    /**
     * Run with the given cost model, or frictionless fills when {@code costModel} is null.
     */
    public BacktestReport run(String symbol, List<Bar> bars, Strategy strategy, ExecutionCostModel costModel) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(bars, "bars");
        int lookback = config.getLookback();
        if (bars.size() < lookback) {
            log.warn("⚠️ Skipping backtest of {}: {} bars, need {}", symbol, bars.size(), lookback);
            return BacktestReport.error(symbol,
                    String.format("Need at least %d bars, got %d", lookback, bars.size()));
        }

        log.info("🚀 Starting backtest of {} on {} with {} bars", strategy.getName(), symbol, bars.size());
        if (costModel != null) {
            costModel.reset();
        }
        strategy.reset();

        double initialBalance = config.getInitialBalance();
        Portfolio portfolio = new Portfolio(initialBalance);
        EquityCurve equityCurve = new EquityCurve(initialBalance);
        List<Trade> trades = new ArrayList<>();
        int windowSize = Math.max(lookback + 1, strategy.getMinimumHistory());

        for (int i = lookback; i < bars.size(); i++) {
            List<Bar> window = bars.subList(Math.max(0, i + 1 - windowSize), i + 1);
            double price = bars.get(i).getClose();
            TradeSignal signal = strategy.generateSignal(PriceHistory.ofBars(window));
            double avgVolume = averageVolume(window);

            if (signal.getAction() == SignalAction.BUY && signal.getConfidence() > config.getMinConfidence()
                    && !portfolio.hasPosition(symbol)) {
                openLong(symbol, portfolio, trades, costModel, signal, price, avgVolume, window, i);
            } else if ((signal.getAction() == SignalAction.SELL || signal.isExitSignal())
                    && portfolio.hasPosition(symbol)) {
                String reason = signal.getAction() == SignalAction.SELL ? EXIT_SELL_SIGNAL : EXIT_SIGNAL;
                closeLong(symbol, portfolio, trades, costModel, price, avgVolume, i, reason);
            }

            equityCurve.append(portfolio.equity(symbol, price));
        }

        if (portfolio.hasPosition(symbol)) {
            int last = bars.size() - 1;
            closeLong(symbol, portfolio, trades, costModel, bars.get(last).getClose(), 0.0, last, EXIT_END_OF_DATA);
        }

        BacktestReport report = ReportAssembler.assemble(symbol, initialBalance, portfolio.getCash(), bars.size(),
                trades, equityCurve, costModel, config.getRiskFreeRate());
        log.info("✅ Backtest of {} on {} completed: {} trades, return {}%, Sharpe {}", strategy.getName(), symbol,
                report.totalTrades(), report.totalReturn(), report.sharpeRatio());
        return report;
    }

    /**
     * Run independent backtests in parallel, one fresh strategy per symbol.
     *
     * @param histories       bars per symbol; iteration order is kept in the result
     * @param strategySupplier creates the strategy for each run
     */
    public Map<String, BacktestReport> runMultiple(Map<String, List<Bar>> histories,
                                                   Supplier<? extends Strategy> strategySupplier) {
        Objects.requireNonNull(histories, "histories");
        Objects.requireNonNull(strategySupplier, "strategySupplier");
        if (histories.isEmpty()) {
            return Map.of();
        }

        int threads = Math.min(config.getParallelism(), histories.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<String, CompletableFuture<BacktestReport>> futures = new LinkedHashMap<>();
            for (Map.Entry<String, List<Bar>> entry : histories.entrySet()) {
                String symbol = entry.getKey();
                List<Bar> bars = entry.getValue();
                futures.put(symbol, CompletableFuture
                        .supplyAsync(() -> run(symbol, bars, strategySupplier.get()), executor)
                        .exceptionally(e -> {
                            log.error("❌ Backtest failed for {}: {}", symbol, e.getMessage(), e);
                            return BacktestReport.error(symbol, "Backtest failed: " + e.getMessage());
                        }));
            }
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
            return futures.entrySet().stream()
                    .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().join(),
                            (a, b) -> a, LinkedHashMap::new));
        } finally {
            executor.shutdown();
        }
    }

    private void openLong(String symbol, Portfolio portfolio, List<Trade> trades, ExecutionCostModel costModel,
                          TradeSignal signal, double price, double avgVolume, List<Bar> window, int barIndex) {
        PositionSizingResult sizing = positionSizingService.calculate(PositionSizingRequest.builder()
                .portfolioValue(portfolio.equity(symbol, price))
                .price(price)
                .confidence(signal.getConfidence())
                .build());
        if (!sizing.isTradeable()) {
            log.debug("No position at bar {}: {}", barIndex, sizing.reason());
            return;
        }

        double quantity = sizing.quantity();
        double realizedPrice = price;
        double fee = 0.0;
        if (costModel != null) {
            double volatility = TechnicalIndicatorCalculator.returnVolatility(
                    TechnicalIndicatorCalculator.toList(Bar.closes(window)));
            ExecutionCostModel.Fill fill = costModel.execute(TradeSide.BUY, price, quantity, avgVolume, volatility);
            realizedPrice = fill.realizedPrice();
            fee = fill.commission();
        }
        if (!portfolio.canAfford(quantity * realizedPrice + fee)) {
            log.warn("⚠️ Insufficient cash for {} x {} at bar {}", quantity, symbol, barIndex);
            return;
        }

        portfolio.open(symbol, quantity, realizedPrice, fee, barIndex);
        trades.add(Trade.builder()
                .symbol(symbol)
                .side(TradeSide.BUY)
                .quantity(quantity)
                .price(price)
                .realizedPrice(realizedPrice)
                .fee(fee)
                .barIndex(barIndex)
                .build());
        log.debug("BUY {} x {} @ {} ({})", quantity, symbol, realizedPrice, sizing.method());
    }

    private void closeLong(String symbol, Portfolio portfolio, List<Trade> trades, ExecutionCostModel costModel,
                           double price, double avgVolume, int barIndex, String exitReason) {
        Portfolio.Position position = portfolio.getPosition(symbol).orElseThrow();
        double quantity = position.quantity();
        double realizedPrice = price;
        double fee = 0.0;
        if (costModel != null) {
            ExecutionCostModel.Fill fill = costModel.execute(TradeSide.SELL, price, quantity, avgVolume, 0.0);
            realizedPrice = fill.realizedPrice();
            fee = fill.commission();
        }

        double pnl = portfolio.close(symbol, realizedPrice, fee);
        trades.add(Trade.builder()
                .symbol(symbol)
                .side(TradeSide.SELL)
                .quantity(quantity)
                .price(price)
                .realizedPrice(realizedPrice)
                .fee(fee)
                .barIndex(barIndex)
                .pnl(pnl)
                .durationBars(barIndex - position.entryBar())
                .exitReason(exitReason)
                .build());
        log.debug("SELL {} x {} @ {} pnl {} ({})", quantity, symbol, realizedPrice, pnl, exitReason);
    }

    private static double averageVolume(List<Bar> window) {
        double sum = 0.0;
        for (Bar bar : window) {
            sum += bar.getVolume();
        }
        return window.isEmpty() ? 0.0 : sum / window.size();
    }
}
