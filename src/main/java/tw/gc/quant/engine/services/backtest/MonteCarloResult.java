package tw.gc.quant.engine.services.backtest;

/**
 * Outcome of a Monte Carlo permutation test on an equity curve.
 *
 * @param pValue            fraction of shuffles whose Sharpe matched or beat the observed one
 * @param percentile        {@code round((1 - pValue) * 100)}
 * @param drawdownPValue    fraction of shuffles whose max drawdown was no worse than the observed one
 * @param error             set when the curve was too short to test; every other field is then 0
 */
public record MonteCarloResult(
        double observedSharpe,
        double pValue,
        int percentile,
        int iterations,
        double medianRandomSharpe,
        double observedMaxDrawdown,
        double drawdownPValue,
        String error
) {

    public static MonteCarloResult error(String error) {
        return new MonteCarloResult(0.0, 0.0, 0, 0, 0.0, 0.0, 0.0, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isSignificant(double alpha) {
        return !hasError() && pValue < alpha;
    }
}
