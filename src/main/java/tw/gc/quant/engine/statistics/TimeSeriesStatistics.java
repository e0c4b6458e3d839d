package tw.gc.quant.engine.statistics;

import java.util.Objects;
import java.util.Optional;

/**
 * Pure statistical routines over price and spread series.
 *
 * <p>Every method is side-effect free. Short or degenerate inputs never throw: they produce
 * {@link Optional#empty()}, a neutral result or zero, as documented per method. Population
 * standard deviation is used throughout.
 */
public final class TimeSeriesStatistics {

    /**
     * Standard deviations below this value are treated as zero.
     */
    public static final double EPSILON = 1e-12;

    static final int ADF_MIN_OBSERVATIONS = 20;
    static final int HALF_LIFE_MIN_OBSERVATIONS = 20;
    static final int HURST_MIN_LAG = 10;
    static final int HURST_LAG_STEP = 2;
    static final int PEARSON_MIN_OBSERVATIONS = 5;

    // MacKinnon critical values, constant and no trend, n ~ 100
    private static final double ADF_CRITICAL_1PCT = -3.51;
    private static final double ADF_CRITICAL_5PCT = -2.89;
    private static final double ADF_CRITICAL_10PCT = -2.58;
    private static final double ADF_CRITICAL_30PCT = -1.95;

    private TimeSeriesStatistics() {
        throw new AssertionError("Utility class");
    }

    /**
     * Ordinary least squares fit of {@code y = alpha + beta * x}.
     *
     * @return empty when fewer than 3 observations, lengths differ, or {@code x} has no variance
     */
    public static Optional<OlsResult> olsRegression(double[] y, double[] x) {
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(x, "x");
        int n = y.length;
        if (n != x.length || n < 3) {
            return Optional.empty();
        }

        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumX2 = 0.0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
        }

        double denom = n * sumX2 - sumX * sumX;
        if (denom == 0.0) {
            return Optional.empty();
        }

        double beta = (n * sumXY - sumX * sumY) / denom;
        double alpha = (sumY - beta * sumX) / n;

        double meanY = sumY / n;
        double[] residuals = new double[n];
        double ssTotal = 0.0;
        double ssResid = 0.0;
        for (int i = 0; i < n; i++) {
            residuals[i] = y[i] - alpha - beta * x[i];
            ssResid += residuals[i] * residuals[i];
            ssTotal += (y[i] - meanY) * (y[i] - meanY);
        }
        double rSquared = ssTotal > 0.0 ? 1.0 - ssResid / ssTotal : 0.0;

        return Optional.of(new OlsResult(alpha, beta, residuals, rSquared));
    }

    /**
     * Single-lag augmented Dickey-Fuller test with a constant.
     *
     * <p>Regresses {@code Δs[t]} on the demeaned lagged level {@code s[t-1]} and maps the
     * t-statistic of the slope to a bucketed p-value. The series is stationary iff
     * {@code p <= 0.05}. The statistic is rounded to two decimals.
     */
    public static AdfResult adfTest(double[] series) {
        Objects.requireNonNull(series, "series");
        int n = series.length;
        if (n < ADF_MIN_OBSERVATIONS) {
            return AdfResult.notTestable();
        }

        int m = n - 1;
        double[] diffs = new double[m];
        double[] lagged = new double[m];
        for (int i = 1; i < n; i++) {
            diffs[i - 1] = series[i] - series[i - 1];
            lagged[i - 1] = series[i - 1];
        }

        double meanDiff = mean(diffs);
        double meanLag = mean(lagged);
        double sumXY = 0.0;
        double sumX2 = 0.0;
        for (int i = 0; i < m; i++) {
            double dx = lagged[i] - meanLag;
            sumXY += dx * (diffs[i] - meanDiff);
            sumX2 += dx * dx;
        }
        if (sumX2 == 0.0) {
            return AdfResult.notTestable();
        }

        double gamma = sumXY / sumX2;
        double sse = 0.0;
        for (int i = 0; i < m; i++) {
            double residual = diffs[i] - meanDiff - gamma * (lagged[i] - meanLag);
            sse += residual * residual;
        }
        double se = Math.sqrt(sse / ((m - 2) * sumX2));
        if (se == 0.0 || Double.isNaN(se)) {
            return AdfResult.notTestable();
        }

        double tStat = gamma / se;
        double pValue = adfPValue(tStat);
        return new AdfResult(round(tStat, 2), pValue, pValue <= 0.05);
    }

    static double adfPValue(double tStat) {
        if (tStat <= ADF_CRITICAL_1PCT) {
            return 0.01;
        }
        if (tStat <= ADF_CRITICAL_5PCT) {
            return 0.05;
        }
        if (tStat <= ADF_CRITICAL_10PCT) {
            return 0.10;
        }
        if (tStat <= ADF_CRITICAL_30PCT) {
            return 0.30;
        }
        return 0.50;
    }

    /**
     * Hurst exponent by rescaled-range analysis of the series' relative changes.
     *
     * <p>Lags run from 10 to {@code maxLag} in steps of 2. For each lag the change series is split
     * into whole chunks and R/S is averaged over chunks with non-zero dispersion. The exponent is
     * the slope of {@code log(R/S)} against {@code log(lag)}.
     *
     * @return empty when the series is shorter than {@code 2 * maxLag}; 0.5 when fewer than two
     * lags are usable or the log-log fit is degenerate
     */
    public static Optional<Double> hurstExponent(double[] series, int maxLag) {
        Objects.requireNonNull(series, "series");
        if (maxLag <= 0) {
            throw new IllegalArgumentException("maxLag must be positive");
        }
        if (series.length < maxLag * 2) {
            return Optional.empty();
        }

        double[] changes = new double[series.length - 1];
        for (int i = 1; i < series.length; i++) {
            double previous = series[i - 1];
            changes[i - 1] = previous == 0.0 ? 0.0 : (series[i] - previous) / Math.abs(previous);
        }

        int maxPoints = (maxLag - HURST_MIN_LAG) / HURST_LAG_STEP + 1;
        double[] logLags = new double[Math.max(maxPoints, 0)];
        double[] logRs = new double[Math.max(maxPoints, 0)];
        int points = 0;
        for (int lag = HURST_MIN_LAG; lag <= maxLag; lag += HURST_LAG_STEP) {
            int chunks = changes.length / lag;
            if (chunks < 1) {
                continue;
            }
            double rsSum = 0.0;
            int validChunks = 0;
            for (int c = 0; c < chunks; c++) {
                double rs = rescaledRange(changes, c * lag, lag);
                if (rs >= 0.0) {
                    rsSum += rs;
                    validChunks++;
                }
            }
            if (validChunks > 0 && rsSum > 0.0) {
                logLags[points] = Math.log(lag);
                logRs[points] = Math.log(rsSum / validChunks);
                points++;
            }
        }

        if (points < 2) {
            return Optional.of(0.5);
        }
        return Optional.of(slope(logLags, logRs, points).orElse(0.5));
    }

    /**
     * R/S of {@code values[from, from + length)}, or -1 when the chunk has no dispersion.
     */
    private static double rescaledRange(double[] values, int from, int length) {
        double sum = 0.0;
        for (int i = from; i < from + length; i++) {
            sum += values[i];
        }
        double chunkMean = sum / length;

        double cumulative = 0.0;
        double maxDev = Double.NEGATIVE_INFINITY;
        double minDev = Double.POSITIVE_INFINITY;
        double variance = 0.0;
        for (int i = from; i < from + length; i++) {
            double deviation = values[i] - chunkMean;
            cumulative += deviation;
            maxDev = Math.max(maxDev, cumulative);
            minDev = Math.min(minDev, cumulative);
            variance += deviation * deviation;
        }
        double stdDev = Math.sqrt(variance / length);
        if (stdDev <= 0.0) {
            return -1.0;
        }
        return (maxDev - minDev) / stdDev;
    }

    private static Optional<Double> slope(double[] x, double[] y, int n) {
        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumX2 = 0.0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
        }
        double denom = n * sumX2 - sumX * sumX;
        if (denom == 0.0) {
            return Optional.empty();
        }
        return Optional.of((n * sumXY - sumX * sumY) / denom);
    }

    /**
     * Ornstein-Uhlenbeck half-life {@code -ln 2 / theta}, where theta is the no-intercept slope of
     * {@code Δs[t]} on {@code s[t-1]}.
     *
     * @return empty when fewer than 20 points, zero lagged energy, or {@code theta >= 0}
     */
    public static Optional<Double> halfLife(double[] spread) {
        Objects.requireNonNull(spread, "spread");
        if (spread.length < HALF_LIFE_MIN_OBSERVATIONS) {
            return Optional.empty();
        }
        double sumXY = 0.0;
        double sumX2 = 0.0;
        for (int i = 1; i < spread.length; i++) {
            double lag = spread[i - 1];
            sumXY += lag * (spread[i] - lag);
            sumX2 += lag * lag;
        }
        if (sumX2 == 0.0) {
            return Optional.empty();
        }
        double theta = sumXY / sumX2;
        if (theta >= 0.0) {
            return Optional.empty();
        }
        return Optional.of(-Math.log(2.0) / theta);
    }

    /**
     * Z-score of the last value against the trailing {@code period} values.
     *
     * @return empty when the series is shorter than {@code period}; 0 when the window is flat
     */
    public static Optional<Double> zScore(double[] series, int period) {
        Objects.requireNonNull(series, "series");
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive");
        }
        if (series.length < period) {
            return Optional.empty();
        }
        int from = series.length - period;
        double windowMean = mean(series, from, series.length);
        double stdDev = populationStdDev(series, from, series.length, windowMean);
        if (stdDev == 0.0) {
            return Optional.of(0.0);
        }
        return Optional.of((series[series.length - 1] - windowMean) / stdDev);
    }

    /**
     * Pearson correlation over the trailing common length of two series.
     *
     * @return 0 when fewer than 5 common points or either side has no variance
     */
    public static double pearsonCorrelation(double[] x, double[] y) {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        int len = Math.min(x.length, y.length);
        if (len < PEARSON_MIN_OBSERVATIONS) {
            return 0.0;
        }
        int offsetX = x.length - len;
        int offsetY = y.length - len;
        double meanX = mean(x, offsetX, x.length);
        double meanY = mean(y, offsetY, y.length);

        double cov = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < len; i++) {
            double dx = x[offsetX + i] - meanX;
            double dy = y[offsetY + i] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        double denom = Math.sqrt(varX * varY);
        if (denom == 0.0) {
            return 0.0;
        }
        return cov / denom;
    }

    /**
     * Period-over-period simple returns; a zero previous value yields a zero return.
     */
    public static double[] simpleReturns(double[] prices) {
        Objects.requireNonNull(prices, "prices");
        if (prices.length < 2) {
            return new double[0];
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = prices[i - 1] == 0.0 ? 0.0 : (prices[i] - prices[i - 1]) / prices[i - 1];
        }
        return returns;
    }

    /**
     * Period-over-period log returns; non-positive prices yield a zero return.
     */
    public static double[] logReturns(double[] prices) {
        Objects.requireNonNull(prices, "prices");
        if (prices.length < 2) {
            return new double[0];
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = prices[i] > 0.0 && prices[i - 1] > 0.0 ? Math.log(prices[i] / prices[i - 1]) : 0.0;
        }
        return returns;
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : mean(values, 0, values.length);
    }

    public static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return populationStdDev(values, 0, values.length, mean(values));
    }

    static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    static double populationStdDev(double[] values, int from, int to, double mean) {
        double variance = 0.0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / (to - from));
    }

    /**
     * Trailing {@code length} values of the series, or a copy of the whole series when shorter.
     */
    public static double[] tail(double[] values, int length) {
        int from = Math.max(0, values.length - length);
        double[] copy = new double[values.length - from];
        System.arraycopy(values, from, copy, 0, copy.length);
        return copy;
    }

    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
