package tw.gc.quant.engine.statistics;

/**
 * Result of a single-regressor ordinary least squares fit {@code y = alpha + beta * x}.
 *
 * @param alpha     intercept
 * @param beta      slope (the hedge ratio when fitting one price series on another)
 * @param residuals {@code y[i] - alpha - beta * x[i]} for every observation
 * @param rSquared  coefficient of determination, 0 when {@code y} has no variance
 */
public record OlsResult(double alpha, double beta, double[] residuals, double rSquared) {

    public OlsResult {
        residuals = residuals.clone();
    }

    @Override
    public double[] residuals() {
        return residuals.clone();
    }

    public int observations() {
        return residuals.length;
    }
}
