package tw.gc.quant.engine.services.backtest;

import tw.gc.quant.engine.entities.Trade;
import tw.gc.quant.engine.services.execution.ExecutionCostModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link BacktestReport} from the ledger of a finished run.
 */
final class ReportAssembler {

    private ReportAssembler() {
        throw new AssertionError("Utility class");
    }

    static BacktestReport assemble(String symbol, double initialBalance, double finalCash, int dataPoints,
                                   List<Trade> trades, EquityCurve equityCurve, ExecutionCostModel costModel,
                                   double riskFreeRate) {
        equityCurve.freeze();
        double[] equity = equityCurve.toArray();

        List<Double> pnls = new ArrayList<>();
        Map<String, Integer> exitReasons = new LinkedHashMap<>();
        int wins = 0;
        double winSum = 0.0;
        double lossSum = 0.0;
        int durationCount = 0;
        double durationSum = 0.0;
        for (Trade trade : trades) {
            if (!trade.isClosing()) {
                continue;
            }
            double pnl = trade.getPnl();
            pnls.add(pnl);
            if (pnl > 0.0) {
                wins++;
                winSum += pnl;
            } else {
                lossSum += pnl;
            }
            if (trade.getDurationBars() != null) {
                durationCount++;
                durationSum += trade.getDurationBars();
            }
            if (trade.getExitReason() != null) {
                exitReasons.merge(trade.getExitReason(), 1, Integer::sum);
            }
        }
        int closed = pnls.size();
        int losses = closed - wins;
        double totalPnl = finalCash - initialBalance;

        return BacktestReport.builder()
                .symbol(symbol)
                .initialBalance(initialBalance)
                .finalBalance(finalCash)
                .dataPoints(dataPoints)
                .totalPnl(totalPnl)
                .totalReturn(totalPnl / initialBalance * 100.0)
                .totalTrades(closed)
                .wins(wins)
                .losses(losses)
                .winRate(closed > 0 ? (double) wins / closed * 100.0 : 0.0)
                .avgWin(wins > 0 ? winSum / wins : 0.0)
                .avgLoss(losses > 0 ? Math.abs(lossSum / losses) : 0.0)
                .sharpeRatio(PerformanceMetricsCalculator.sharpeRatio(equity, riskFreeRate))
                .sortinoRatio(PerformanceMetricsCalculator.sortinoRatio(equity, riskFreeRate))
                .calmarRatio(PerformanceMetricsCalculator.calmarRatio(equity))
                .maxDrawdown(PerformanceMetricsCalculator.maxDrawdown(equity) * 100.0)
                .profitFactor(PerformanceMetricsCalculator.profitFactor(pnls))
                .avgDurationBars(durationCount > 0 ? durationSum / durationCount : 0.0)
                .exitReasons(Collections.unmodifiableMap(exitReasons))
                .executionCosts(costModel != null ? costModel.summary(totalPnl) : null)
                .equityCurve(equityCurve)
                .trades(Collections.unmodifiableList(new ArrayList<>(trades)))
                .build();
    }
}
