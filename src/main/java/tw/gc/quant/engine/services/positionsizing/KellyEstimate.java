package tw.gc.quant.engine.services.positionsizing;

/**
 * Kelly inputs estimated from trade history.
 *
 * @param sampleSize trades in the window, or the sum of weights for exponential estimates
 */
public record KellyEstimate(double winRate, double avgWin, double avgLoss, double kellyPct, double sampleSize) {
}
