package tw.gc.quant.engine.statistics;

/**
 * Outcome of the single-lag, constant-only augmented Dickey-Fuller test.
 *
 * <p>The p-value is not interpolated: it is one of the buckets 0.01, 0.05, 0.10, 0.30 or 0.50
 * selected by comparing the t-statistic against fixed critical values.
 */
public record AdfResult(double statistic, double pValue, boolean stationary) {

    /**
     * Result reported when the series is too short or degenerate to test.
     */
    public static AdfResult notTestable() {
        return new AdfResult(0.0, 1.0, false);
    }
}
