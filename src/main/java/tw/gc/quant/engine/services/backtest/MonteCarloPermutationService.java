package tw.gc.quant.engine.services.backtest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.statistics.TimeSeriesStatistics;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Monte Carlo permutation test for backtest significance.
 *
 * <p>Shuffles the bar returns of an equity curve, rebuilds a curve from each shuffle and compares
 * its Sharpe ratio with the observed one. Sharpe does not depend on return order, so the Sharpe
 * p-value only flags a curve whose mean/variance is unusual; the drawdown p-value is sensitive to
 * ordering and shows whether the observed path was luckier than its shuffles.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonteCarloPermutationService {

    public static final int MIN_POINTS = 10;
    private static final double SHARPE_TOLERANCE = 1e-9;

    private final QuantProperties properties;

    public MonteCarloResult permutationTest(EquityCurve equityCurve, Random random) {
        return permutationTest(equityCurve.toArray(), properties.getBacktest().getMonteCarloIterations(), random);
    }

    /**
     * @param equityCurve account values, oldest first
     * @param iterations  number of shuffles
     * @param random      source of the shuffles; seed it for reproducible results
     */
    public MonteCarloResult permutationTest(double[] equityCurve, int iterations, Random random) {
        Objects.requireNonNull(equityCurve, "equityCurve");
        Objects.requireNonNull(random, "random");
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (equityCurve.length < MIN_POINTS) {
            return MonteCarloResult.error("Need at least " + MIN_POINTS + " data points");
        }

        double[] returns = TimeSeriesStatistics.simpleReturns(equityCurve);
        double observedSharpe = PerformanceMetricsCalculator.sharpeRatio(equityCurve);
        double observedDrawdown = PerformanceMetricsCalculator.maxDrawdown(equityCurve);

        double[] sharpes = new double[iterations];
        int sharpeBeats = 0;
        int drawdownBeats = 0;
        double[] shuffled = returns.clone();
        double[] simulated = new double[equityCurve.length];
        for (int iter = 0; iter < iterations; iter++) {
            shuffle(shuffled, random);
            simulated[0] = equityCurve[0];
            for (int i = 0; i < shuffled.length; i++) {
                simulated[i + 1] = simulated[i] * (1.0 + shuffled[i]);
            }
            sharpes[iter] = PerformanceMetricsCalculator.sharpeRatio(simulated);
            if (sharpes[iter] >= observedSharpe - SHARPE_TOLERANCE) {
                sharpeBeats++;
            }
            if (PerformanceMetricsCalculator.maxDrawdown(simulated) <= observedDrawdown) {
                drawdownBeats++;
            }
        }
        Arrays.sort(sharpes);

        double pValue = (double) sharpeBeats / iterations;
        int percentile = (int) Math.round((1.0 - pValue) * 100.0);
        log.debug("Permutation test: observed Sharpe {}, p={}, drawdown p={}", observedSharpe, pValue,
                (double) drawdownBeats / iterations);
        return new MonteCarloResult(observedSharpe, pValue, percentile, iterations, sharpes[iterations / 2],
                observedDrawdown, (double) drawdownBeats / iterations, null);
    }

    /**
     * In-place Fisher-Yates shuffle.
     */
    static void shuffle(double[] values, Random random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
