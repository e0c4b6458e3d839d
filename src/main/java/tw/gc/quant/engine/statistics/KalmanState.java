package tw.gc.quant.engine.statistics;

/**
 * Snapshot of the hedge-ratio filter: current beta estimate and its error covariance.
 */
public record KalmanState(double beta, double covariance) {

    public KalmanState {
        if (covariance < 0.0) {
            throw new IllegalArgumentException("covariance must be non-negative");
        }
    }
}
