package tw.gc.quant.engine.statistics;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scalar Kalman filter tracking a time-varying hedge ratio in {@code y = beta * x + noise}.
 *
 * <p>The hidden state is a random walk with process variance {@code delta / (1 - delta)}.
 * Each call to {@link #update(double, double)} consumes exactly one observation pair. Instances
 * are stateful and not thread-safe: use one filter per pair.
 */
@Slf4j
public class KalmanHedgeRatioFilter {

    public static final double DEFAULT_DELTA = 1e-4;
    public static final double DEFAULT_OBSERVATION_NOISE = 1e-3;
    public static final double DEFAULT_INITIAL_COVARIANCE = 1.0;

    private final double processVariance;
    private final double observationNoise;
    private final double initialCovariance;

    private double beta;
    private double covariance;
    private long observations;

    public KalmanHedgeRatioFilter(double delta, double observationNoise, double initialCovariance) {
        if (delta <= 0.0 || delta >= 1.0) {
            throw new IllegalArgumentException("delta must be in (0, 1)");
        }
        if (observationNoise <= 0.0) {
            throw new IllegalArgumentException("observationNoise must be positive");
        }
        if (initialCovariance <= 0.0) {
            throw new IllegalArgumentException("initialCovariance must be positive");
        }
        this.processVariance = delta / (1.0 - delta);
        this.observationNoise = observationNoise;
        this.initialCovariance = initialCovariance;
        reset();
    }

    public static KalmanHedgeRatioFilter withDefaults() {
        return new KalmanHedgeRatioFilter(DEFAULT_DELTA, DEFAULT_OBSERVATION_NOISE, DEFAULT_INITIAL_COVARIANCE);
    }

    /**
     * Predict then correct with one observation.
     *
     * @param y dependent price (leg A)
     * @param x regressor price (leg B)
     * @return the posterior hedge ratio
     */
    public double update(double y, double x) {
        double predictedCovariance = covariance + processVariance;
        double innovation = y - beta * x;
        double innovationVariance = x * x * predictedCovariance + observationNoise;
        double gain = x * predictedCovariance / innovationVariance;

        beta += gain * innovation;
        covariance = (1.0 - gain * x) * predictedCovariance;
        observations++;
        return beta;
    }

    /**
     * Reset, then replay the filter over two aligned series.
     *
     * @return empty when the series are empty
     */
    public Optional<KalmanFilterResult> filter(double[] seriesA, double[] seriesB) {
        Objects.requireNonNull(seriesA, "seriesA");
        Objects.requireNonNull(seriesB, "seriesB");
        int n = Math.min(seriesA.length, seriesB.length);
        if (n == 0) {
            return Optional.empty();
        }
        double[] a = TimeSeriesStatistics.tail(seriesA, n);
        double[] b = TimeSeriesStatistics.tail(seriesB, n);

        reset();
        List<Double> betas = new ArrayList<>(n);
        List<Double> innovations = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            innovations.add(a[i] - beta * b[i]);
            betas.add(update(a[i], b[i]));
        }
        log.debug("Kalman replay over {} observations, final beta {}", n, beta);
        return Optional.of(new KalmanFilterResult(betas, innovations, beta, getState()));
    }

    public void reset() {
        beta = 0.0;
        covariance = initialCovariance;
        observations = 0;
    }

    public KalmanState getState() {
        return new KalmanState(beta, covariance);
    }

    public double getBeta() {
        return beta;
    }

    public long getObservations() {
        return observations;
    }
}
