package tw.gc.quant.engine.testutil;

import tw.gc.quant.engine.entities.Bar;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Test factory for deterministic price series and bars.
 */
public final class PriceSeriesFixtures {

    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 2, 13, 30);
    private static final double DEFAULT_VOLUME = 1_000_000.0;

    private PriceSeriesFixtures() {
        throw new AssertionError("Utility class");
    }

    /**
     * Leg B of the cointegrated fixture: a gentle uptrend with a slow wave.
     */
    public static double[] cointegratedLegB(int n) {
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            b[i] = 50.0 + 0.5 * i + 2.0 * Math.sin(i / 5.0);
        }
        return b;
    }

    /**
     * Spread that flips sign every bar, amplitude between 0.7 and 1.3.
     */
    public static double[] alternatingSpread(int n) {
        double[] spread = new double[n];
        for (int i = 0; i < n; i++) {
            double sign = i % 2 == 0 ? 1.0 : -1.0;
            spread[i] = sign * (1.0 + 0.3 * Math.sin(0.7 * i));
        }
        return spread;
    }

    /**
     * Leg A = 1.5 * B + 10 + alternating spread.
     *
     * @param lastSpread replaces the spread of the final bar, or null to keep the pattern
     * @return {@code {closesA, closesB}}
     */
    public static double[][] cointegratedPair(int n, Double lastSpread) {
        return lastSpread != null ? shockedPair(n, Map.of(n - 1, lastSpread)) : shockedPair(n, Map.of());
    }

    /**
     * The cointegrated pair with the spread replaced at the given bars.
     *
     * @return {@code {closesA, closesB}}
     */
    public static double[][] shockedPair(int n, Map<Integer, Double> spreadShocks) {
        double[] b = cointegratedLegB(n);
        double[] spread = alternatingSpread(n);
        spreadShocks.forEach((bar, value) -> spread[bar] = value);
        double[] a = new double[n];
        for (int i = 0; i < n; i++) {
            a[i] = 1.5 * b[i] + 10.0 + spread[i];
        }
        return new double[][]{a, b};
    }

    /**
     * Random-walk leg A (unit Gaussian steps from 100) and {@code B = (A - spread) / 1.5}, where
     * the spread is an Ornstein-Uhlenbeck process {@code s[t] = (1 - theta) * s[t-1] + sigma * e}.
     *
     * @return {@code {closesA, closesB, spread}}
     */
    public static double[][] ouPair(long seed, int n, double theta, double sigma) {
        Random random = new Random(seed);
        double[] a = new double[n];
        double[] spread = new double[n];
        a[0] = 100.0;
        for (int i = 1; i < n; i++) {
            a[i] = a[i - 1] + random.nextGaussian();
            spread[i] = spread[i - 1] - theta * spread[i - 1] + sigma * random.nextGaussian();
        }
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            b[i] = (a[i] - spread[i]) / 1.5;
        }
        return new double[][]{a, b, spread};
    }

    /**
     * Gaussian random walk with multiplicative steps, floored well above zero.
     */
    public static double[] randomWalk(long seed, int n, double start, double stepPct) {
        Random random = new Random(seed);
        double[] prices = new double[n];
        prices[0] = start;
        for (int i = 1; i < n; i++) {
            prices[i] = Math.max(prices[i - 1] * (1.0 + stepPct * random.nextGaussian()), start * 0.05);
        }
        return prices;
    }

    public static double[] linear(int n, double start, double step) {
        double[] prices = new double[n];
        for (int i = 0; i < n; i++) {
            prices[i] = start + step * i;
        }
        return prices;
    }

    public static double[] constant(int n, double value) {
        double[] prices = new double[n];
        Arrays.fill(prices, value);
        return prices;
    }

    /**
     * Daily bars closing at the given prices, with a 2% range and constant volume.
     */
    public static List<Bar> bars(double... closes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double close = closes[i];
            bars.add(Bar.builder()
                    .timestamp(BASE_TIME.plusDays(i))
                    .open(close)
                    .high(close * 1.01)
                    .low(close * 0.99)
                    .close(close)
                    .volume(DEFAULT_VOLUME)
                    .build());
        }
        return bars;
    }
}
