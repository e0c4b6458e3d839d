package tw.gc.quant.engine.services.backtest;

import tw.gc.quant.engine.statistics.TimeSeriesStatistics;

import java.util.List;
import java.util.Objects;

/**
 * Risk-adjusted statistics over an equity curve, assuming daily bars (252 per year).
 *
 * <p>Every ratio is finite except the documented Infinity cases of Sortino, Calmar and profit
 * factor.
 */
public final class PerformanceMetricsCalculator {

    public static final int TRADING_DAYS = 252;
    private static final double ANNUALIZATION = Math.sqrt(TRADING_DAYS);

    private PerformanceMetricsCalculator() {
        throw new AssertionError("Utility class");
    }

    /**
     * Largest peak-to-trough decline as a fraction of the peak.
     */
    public static double maxDrawdown(double[] equity) {
        Objects.requireNonNull(equity, "equity");
        if (equity.length == 0) {
            return 0.0;
        }
        double peak = equity[0];
        double maxDd = 0.0;
        for (double value : equity) {
            if (value > peak) {
                peak = value;
            }
            if (peak > 0.0) {
                maxDd = Math.max(maxDd, (peak - value) / peak);
            }
        }
        return maxDd;
    }

    /**
     * Annualized {@code (mean - rf/252) / stdDev} of bar returns; 0 when the returns have no
     * variance.
     */
    public static double sharpeRatio(double[] equity, double riskFreeRate) {
        double[] returns = TimeSeriesStatistics.simpleReturns(equity);
        if (returns.length == 0) {
            return 0.0;
        }
        double mean = TimeSeriesStatistics.mean(returns);
        double stdDev = TimeSeriesStatistics.populationStdDev(returns);
        if (stdDev < TimeSeriesStatistics.EPSILON) {
            return 0.0;
        }
        return (mean - riskFreeRate / TRADING_DAYS) / stdDev * ANNUALIZATION;
    }

    public static double sharpeRatio(double[] equity) {
        return sharpeRatio(equity, 0.0);
    }

    /**
     * Annualized excess return over downside deviation.
     *
     * <p>Downside deviation is the root mean square shortfall below the daily risk-free target,
     * taken over all returns. A losing curve is divided by the larger of downside deviation and
     * standard deviation, so the result is never below {@link #sharpeRatio(double[], double)}.
     * Infinity when no return falls below the target and the mean is positive.
     */
    public static double sortinoRatio(double[] equity, double riskFreeRate) {
        double[] returns = TimeSeriesStatistics.simpleReturns(equity);
        if (returns.length == 0) {
            return 0.0;
        }
        double target = riskFreeRate / TRADING_DAYS;
        double mean = TimeSeriesStatistics.mean(returns);
        double excess = mean - target;

        double shortfallSquares = 0.0;
        int downsideCount = 0;
        for (double r : returns) {
            if (r < target) {
                shortfallSquares += (r - target) * (r - target);
                downsideCount++;
            }
        }
        if (downsideCount == 0) {
            return excess > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        double downsideDev = Math.sqrt(shortfallSquares / returns.length);
        double denominator = excess < 0.0
                ? Math.max(downsideDev, TimeSeriesStatistics.populationStdDev(returns))
                : downsideDev;
        if (denominator < TimeSeriesStatistics.EPSILON) {
            return excess > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return excess / denominator * ANNUALIZATION;
    }

    public static double sortinoRatio(double[] equity) {
        return sortinoRatio(equity, 0.0);
    }

    /**
     * Annualized total return over max drawdown. Infinity exactly when the curve never draws
     * down and ends higher than it started.
     */
    public static double calmarRatio(double[] equity) {
        Objects.requireNonNull(equity, "equity");
        if (equity.length < 2 || equity[0] == 0.0) {
            return 0.0;
        }
        double totalReturn = (equity[equity.length - 1] - equity[0]) / equity[0];
        double annualizedReturn = totalReturn * ((double) TRADING_DAYS / (equity.length - 1));
        double maxDd = maxDrawdown(equity);
        if (maxDd == 0.0) {
            return annualizedReturn > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return annualizedReturn / maxDd;
    }

    /**
     * Gross profit over gross loss of closed trades; losses include break-even trades.
     *
     * @return Infinity with wins and no losses, 0 with neither
     */
    public static double profitFactor(List<Double> pnls) {
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        for (double pnl : pnls) {
            if (pnl > 0.0) {
                grossProfit += pnl;
            } else {
                grossLoss -= pnl;
            }
        }
        if (grossLoss > 0.0) {
            return grossProfit / grossLoss;
        }
        return grossProfit > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
    }
}
