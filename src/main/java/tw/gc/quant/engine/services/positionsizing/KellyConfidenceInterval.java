package tw.gc.quant.engine.services.positionsizing;

/**
 * Bootstrap distribution summary of the fractional Kelly size.
 */
public record KellyConfidenceInterval(double lower, double median, double upper, double spread) {

    public KellyConfidenceInterval {
        if (lower > upper) {
            throw new IllegalArgumentException("lower must not exceed upper");
        }
    }
}
