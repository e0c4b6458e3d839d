package tw.gc.quant.engine.services.backtest;

import lombok.Builder;
import tw.gc.quant.engine.entities.Trade;
import tw.gc.quant.engine.services.execution.ExecutionCostSummary;

import java.util.List;
import java.util.Map;

/**
 * Result of one backtest run.
 *
 * <p>{@code totalReturn}, {@code winRate} and {@code maxDrawdown} are percentages (5.0 = 5%);
 * P&amp;L and averages are in account currency. A run that could not start carries only
 * {@code symbol} and {@code error}.
 *
 * @param executionCosts null when the run had no execution cost model
 * @param trades         every simulated fill, opening and closing
 */
@Builder
public record BacktestReport(
        String symbol,
        double initialBalance,
        double finalBalance,
        int dataPoints,
        double totalPnl,
        double totalReturn,
        int totalTrades,
        int wins,
        int losses,
        double winRate,
        double avgWin,
        double avgLoss,
        double sharpeRatio,
        double sortinoRatio,
        double calmarRatio,
        double maxDrawdown,
        double profitFactor,
        double avgDurationBars,
        Map<String, Integer> exitReasons,
        ExecutionCostSummary executionCosts,
        EquityCurve equityCurve,
        List<Trade> trades,
        String error
) {

    public static BacktestReport error(String symbol, String error) {
        return BacktestReport.builder()
                .symbol(symbol)
                .exitReasons(Map.of())
                .trades(List.of())
                .error(error)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }
}
