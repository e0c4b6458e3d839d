package tw.gc.quant.engine.statistics;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Tail-risk estimators over a sample of periodic returns.
 *
 * <p>Values are expressed as positive loss fractions: a VaR of 0.03 means a 3% loss at the given
 * confidence level. A negative result means even the tail of the sample is a gain. All
 * estimators need at least {@value #MIN_RETURNS} returns.
 */
public final class RiskMeasures {

    public static final int MIN_RETURNS = 10;

    private RiskMeasures() {
        throw new AssertionError("Utility class");
    }

    /**
     * Normal-distribution VaR {@code -(mean - z * stdDev)}.
     *
     * <p>Supported confidence levels are 0.90, 0.95 and 0.99; any other level uses the 95% z-value.
     */
    public static Optional<Double> parametricValueAtRisk(double[] returns, double confidenceLevel) {
        Objects.requireNonNull(returns, "returns");
        if (returns.length < MIN_RETURNS) {
            return Optional.empty();
        }
        double mean = TimeSeriesStatistics.mean(returns);
        double stdDev = TimeSeriesStatistics.populationStdDev(returns);
        return Optional.of(-(mean - zValue(confidenceLevel) * stdDev));
    }

    /**
     * Non-parametric VaR: the negated return at index {@code floor((1 - confidence) * n)} of the
     * ascending sample.
     */
    public static Optional<Double> historicalValueAtRisk(double[] returns, double confidenceLevel) {
        Objects.requireNonNull(returns, "returns");
        validateConfidence(confidenceLevel);
        if (returns.length < MIN_RETURNS) {
            return Optional.empty();
        }
        double[] sorted = sortedCopy(returns);
        return Optional.of(-sorted[tailIndex(sorted.length, confidenceLevel)]);
    }

    /**
     * Expected shortfall: the negated mean of every return at or below the historical VaR
     * quantile. Never smaller than {@link #historicalValueAtRisk(double[], double)} for the same
     * sample and level.
     */
    public static Optional<Double> conditionalValueAtRisk(double[] returns, double confidenceLevel) {
        Objects.requireNonNull(returns, "returns");
        validateConfidence(confidenceLevel);
        if (returns.length < MIN_RETURNS) {
            return Optional.empty();
        }
        double[] sorted = sortedCopy(returns);
        double threshold = sorted[tailIndex(sorted.length, confidenceLevel)];
        double sum = 0.0;
        int count = 0;
        for (double value : sorted) {
            if (value > threshold) {
                break;
            }
            sum += value;
            count++;
        }
        return Optional.of(-(sum / count));
    }

    static double zValue(double confidenceLevel) {
        if (confidenceLevel == 0.90) {
            return 1.282;
        }
        if (confidenceLevel == 0.99) {
            return 2.326;
        }
        return 1.645;
    }

    private static int tailIndex(int size, double confidenceLevel) {
        int index = (int) Math.floor((1.0 - confidenceLevel) * size);
        return Math.min(Math.max(index, 0), size - 1);
    }

    private static double[] sortedCopy(double[] returns) {
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    private static void validateConfidence(double confidenceLevel) {
        if (confidenceLevel <= 0.0 || confidenceLevel >= 1.0) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1)");
        }
    }
}
