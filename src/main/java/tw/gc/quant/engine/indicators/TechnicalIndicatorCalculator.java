package tw.gc.quant.engine.indicators;

import tw.gc.quant.engine.entities.Bar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Utility class for calculating technical indicators.
 */
public final class TechnicalIndicatorCalculator {

    private static final int VOLUME_SPIKE_WINDOW = 20;

    private TechnicalIndicatorCalculator() {
        throw new AssertionError("Utility class");
    }

    public static Optional<Double> simpleMovingAverage(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period) {
            return Optional.empty();
        }
        return Optional.of(average(prices.subList(prices.size() - period, prices.size())));
    }

    public static Optional<Double> exponentialMovingAverage(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period) {
            return Optional.empty();
        }
        List<Double> series = calculateEmaSeries(prices, period);
        return Optional.of(series.get(series.size() - 1));
    }

    /**
     * Wilder-smoothed RSI: seeded with the simple average of the first {@code period} changes,
     * then smoothed over the rest of the series.
     */
    public static Optional<Double> relativeStrengthIndex(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period + 1) {
            return Optional.empty();
        }
        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) {
                gainSum += change;
            } else {
                lossSum -= change;
            }
        }
        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;
        for (int i = period + 1; i < prices.size(); i++) {
            double change = prices.get(i) - prices.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
        }
        if (avgLoss == 0.0) {
            return Optional.of(100.0);
        }
        double rs = avgGain / avgLoss;
        return Optional.of(100.0 - (100.0 / (1.0 + rs)));
    }

    public static Optional<MacdResult> macd(List<Double> prices, int fastPeriod, int slowPeriod, int signalPeriod) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(fastPeriod, "fastPeriod");
        validatePositive(slowPeriod, "slowPeriod");
        validatePositive(signalPeriod, "signalPeriod");
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("fastPeriod must be less than slowPeriod");
        }
        if (prices.size() < slowPeriod + signalPeriod) {
            return Optional.empty();
        }

        List<Double> fastEma = calculateEmaSeries(prices, fastPeriod);
        List<Double> slowEma = calculateEmaSeries(prices, slowPeriod);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < prices.size(); i++) {
            Double fast = fastEma.get(i);
            Double slow = slowEma.get(i);
            if (fast != null && slow != null) {
                macdSeries.add(fast - slow);
            }
        }

        Optional<Double> signalOpt = exponentialMovingAverage(macdSeries, signalPeriod);
        if (signalOpt.isEmpty()) {
            return Optional.empty();
        }

        double macdLine = macdSeries.get(macdSeries.size() - 1);
        double signalLine = signalOpt.get();
        return Optional.of(new MacdResult(macdLine, signalLine, macdLine - signalLine));
    }

    public static Optional<BollingerBands> bollingerBands(List<Double> prices, int period, double stdDevMultiplier) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (stdDevMultiplier <= 0.0) {
            throw new IllegalArgumentException("stdDevMultiplier must be positive");
        }
        if (prices.size() < period) {
            return Optional.empty();
        }
        List<Double> window = prices.subList(prices.size() - period, prices.size());
        double mean = average(window);
        double stdDev = standardDeviation(window, mean);
        double upper = mean + stdDevMultiplier * stdDev;
        double lower = mean - stdDevMultiplier * stdDev;
        return Optional.of(new BollingerBands(mean, upper, lower, stdDev));
    }

    /**
     * Whether the last volume exceeds {@code threshold} times the average of the 19 volumes
     * before it.
     */
    public static boolean isVolumeSpike(List<Double> volumes, double threshold) {
        Objects.requireNonNull(volumes, "volumes");
        if (volumes.size() < VOLUME_SPIKE_WINDOW + 1) {
            return false;
        }
        List<Double> recent = volumes.subList(volumes.size() - VOLUME_SPIKE_WINDOW, volumes.size() - 1);
        double avgVolume = average(recent);
        return avgVolume > 0.0 && volumes.get(volumes.size() - 1) > avgVolume * threshold;
    }

    /**
     * Simple average of the last {@code period} true ranges.
     */
    public static Optional<Double> averageTrueRange(List<Bar> bars, int period) {
        Objects.requireNonNull(bars, "bars");
        validatePositive(period, "period");
        if (bars.size() < period + 1) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (int i = bars.size() - period; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            double prevClose = bars.get(i - 1).getClose();
            sum += Math.max(bar.getHigh() - bar.getLow(),
                    Math.max(Math.abs(bar.getHigh() - prevClose), Math.abs(bar.getLow() - prevClose)));
        }
        return Optional.of(sum / period);
    }

    /**
     * Population standard deviation of simple returns; 0 for fewer than two prices.
     */
    public static double returnVolatility(List<Double> prices) {
        Objects.requireNonNull(prices, "prices");
        if (prices.size() < 2) {
            return 0.0;
        }
        List<Double> returns = new ArrayList<>(prices.size() - 1);
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            returns.add(previous == 0.0 ? 0.0 : (prices.get(i) - previous) / previous);
        }
        return standardDeviation(returns, average(returns));
    }

    public static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }

    private static void validatePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static double average(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double standardDeviation(List<Double> values, double mean) {
        double variance = 0.0;
        for (double value : values) {
            double diff = value - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.size());
    }

    private static List<Double> calculateEmaSeries(List<Double> prices, int period) {
        List<Double> emaSeries = new ArrayList<>(Collections.nCopies(prices.size(), null));
        if (prices.size() < period) {
            return emaSeries;
        }
        double k = 2.0 / (period + 1.0);
        double ema = average(prices.subList(0, period));
        emaSeries.set(period - 1, ema);
        for (int i = period; i < prices.size(); i++) {
            ema = (prices.get(i) * k) + (ema * (1.0 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }

    public record BollingerBands(double middle, double upper, double lower, double stdDev) {
        public BollingerBands {
            if (stdDev < 0.0) {
                throw new IllegalArgumentException("stdDev must be non-negative");
            }
        }

        /**
         * Position of {@code price} within the bands: 0 at the lower band, 1 at the upper band,
         * 0.5 when the bands are collapsed.
         */
        public double percentB(double price) {
            double width = upper - lower;
            return width == 0.0 ? 0.5 : (price - lower) / width;
        }
    }

    public record MacdResult(double macdLine, double signalLine, double histogram) {
    }
}
