package tw.gc.quant.engine.strategy.pairs;

/**
 * Spread of a pair, {@code spread[i] = a[i] - hedgeRatio * b[i] - intercept} for the OLS method.
 */
public record SpreadSeries(double[] spread, double hedgeRatio, double intercept, double rSquared, HedgeRatioMethod method) {

    public SpreadSeries {
        spread = spread.clone();
    }

    @Override
    public double[] spread() {
        return spread.clone();
    }

    public int length() {
        return spread.length;
    }

    public double current() {
        return spread[spread.length - 1];
    }
}
