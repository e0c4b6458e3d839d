package tw.gc.quant.engine.services.positionsizing;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Estimates Kelly inputs from realised trade outcomes.
 *
 * <p>Every estimate is converted into a position fraction through the supplied
 * {@link KellySizer}, so the caller's fraction and caps apply.
 */
@Slf4j
public class KellyEstimator {

    public static final int MIN_TRADES = 10;
    public static final int MIN_BOOTSTRAP_TRADES = 15;
    public static final int DEFAULT_WINDOW = 50;
    public static final double DEFAULT_HALF_LIFE = 20.0;
    public static final int DEFAULT_RESAMPLES = 1000;
    public static final double DEFAULT_ALPHA = 0.05;

    private static final double OPTIMAL_F_STEP = 0.01;

    /**
     * Fractional Kelly from win rate and average win/loss magnitudes.
     */
    @FunctionalInterface
    public interface KellySizer {
        double size(double winRate, double avgWin, double avgLoss);
    }

    private final KellySizer sizer;
    private final double kellyFraction;

    public KellyEstimator(KellySizer sizer, double kellyFraction) {
        this.sizer = Objects.requireNonNull(sizer, "sizer");
        this.kellyFraction = kellyFraction;
    }

    /**
     * Estimate over the last {@code window} trades.
     *
     * @return empty with fewer than 10 trades or when the window has only wins or only losses
     */
    public Optional<KellyEstimate> rollingEstimate(List<TradeOutcome> trades, int window) {
        if (trades == null || trades.size() < MIN_TRADES) {
            return Optional.empty();
        }
        List<TradeOutcome> recent = trades.subList(Math.max(0, trades.size() - window), trades.size());
        int wins = 0;
        double winSum = 0.0;
        double lossSum = 0.0;
        for (TradeOutcome trade : recent) {
            if (trade.isWin()) {
                wins++;
                winSum += trade.pnlPct();
            } else {
                lossSum += trade.pnlPct();
            }
        }
        int losses = recent.size() - wins;
        if (wins == 0 || losses == 0) {
            return Optional.empty();
        }
        double winRate = (double) wins / recent.size();
        double avgWin = winSum / wins;
        double avgLoss = Math.abs(lossSum / losses);
        return Optional.of(new KellyEstimate(winRate, avgWin, avgLoss, sizer.size(winRate, avgWin, avgLoss), recent.size()));
    }

    public Optional<KellyEstimate> rollingEstimate(List<TradeOutcome> trades) {
        return rollingEstimate(trades, DEFAULT_WINDOW);
    }

    /**
     * Estimate with weights {@code exp(-ln2 / halfLife * age)}, age 0 being the latest trade.
     */
    public Optional<KellyEstimate> exponentialEstimate(List<TradeOutcome> trades, double halfLife) {
        if (trades == null || trades.size() < MIN_TRADES) {
            return Optional.empty();
        }
        if (halfLife <= 0) {
            throw new IllegalArgumentException("halfLife must be positive");
        }
        double lambda = Math.log(2.0) / halfLife;
        int n = trades.size();
        double winWeight = 0.0;
        double lossWeight = 0.0;
        double weightedWins = 0.0;
        double weightedLosses = 0.0;
        for (int i = 0; i < n; i++) {
            double weight = Math.exp(-lambda * (n - 1 - i));
            TradeOutcome trade = trades.get(i);
            if (trade.isWin()) {
                winWeight += weight;
                weightedWins += weight * trade.pnlPct();
            } else {
                lossWeight += weight;
                weightedLosses += weight * Math.abs(trade.pnlPct());
            }
        }
        if (winWeight == 0.0 || lossWeight == 0.0) {
            return Optional.empty();
        }
        double totalWeight = winWeight + lossWeight;
        double winRate = winWeight / totalWeight;
        double avgWin = weightedWins / winWeight;
        double avgLoss = weightedLosses / lossWeight;
        return Optional.of(new KellyEstimate(winRate, avgWin, avgLoss, sizer.size(winRate, avgWin, avgLoss), totalWeight));
    }

    public Optional<KellyEstimate> exponentialEstimate(List<TradeOutcome> trades) {
        return exponentialEstimate(trades, DEFAULT_HALF_LIFE);
    }

    /**
     * Bootstrap distribution of the fractional Kelly size. Resamples with only wins or only
     * losses contribute a size of 0.
     *
     * @return empty with fewer than 15 trades
     */
    public Optional<KellyConfidenceInterval> confidenceInterval(List<TradeOutcome> trades, double alpha,
                                                                int resamples, Random random) {
        Objects.requireNonNull(random, "random");
        if (trades == null || trades.size() < MIN_BOOTSTRAP_TRADES) {
            return Optional.empty();
        }
        if (alpha <= 0 || alpha >= 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1)");
        }
        if (resamples <= 0) {
            throw new IllegalArgumentException("resamples must be positive");
        }

        int n = trades.size();
        double[] kellys = new double[resamples];
        for (int b = 0; b < resamples; b++) {
            int wins = 0;
            double winSum = 0.0;
            double lossSum = 0.0;
            for (int i = 0; i < n; i++) {
                TradeOutcome trade = trades.get(random.nextInt(n));
                if (trade.isWin()) {
                    wins++;
                    winSum += trade.pnlPct();
                } else {
                    lossSum += trade.pnlPct();
                }
            }
            int losses = n - wins;
            if (wins == 0 || losses == 0) {
                kellys[b] = 0.0;
                continue;
            }
            kellys[b] = sizer.size((double) wins / n, winSum / wins, Math.abs(lossSum / losses));
        }
        Arrays.sort(kellys);

        int lowerIdx = Math.min((int) Math.floor(alpha / 2 * resamples), resamples - 1);
        int upperIdx = Math.min((int) Math.floor((1 - alpha / 2) * resamples), resamples - 1);
        int medianIdx = Math.min((int) Math.floor(0.5 * resamples), resamples - 1);
        return Optional.of(new KellyConfidenceInterval(
                kellys[lowerIdx], kellys[medianIdx], kellys[upperIdx], kellys[upperIdx] - kellys[lowerIdx]));
    }

    public Optional<KellyConfidenceInterval> confidenceInterval(List<TradeOutcome> trades, Random random) {
        return confidenceInterval(trades, DEFAULT_ALPHA, DEFAULT_RESAMPLES, random);
    }

    /**
     * Grid search f in [0.01, 1.00] maximising {@code Π(1 + f * pnl / |worstLoss|)}; an f that drives
     * any holding-period return to zero or below is skipped.
     *
     * @return empty with fewer than 10 trades, no losing trade, or no f beating a terminal wealth of 1
     */
    public Optional<OptimalFResult> optimalF(List<TradeOutcome> trades) {
        if (trades == null || trades.size() < MIN_TRADES) {
            return Optional.empty();
        }
        double worstLoss = trades.stream().mapToDouble(TradeOutcome::pnlPct).min().orElse(0.0);
        if (worstLoss >= 0.0) {
            return Optional.empty();
        }
        double absWorst = Math.abs(worstLoss);

        double bestF = 0.0;
        double bestTwr = 1.0;
        for (int step = 1; step <= 100; step++) {
            double f = step * OPTIMAL_F_STEP;
            double twr = 1.0;
            boolean valid = true;
            for (TradeOutcome trade : trades) {
                double hpr = 1.0 + f * (trade.pnlPct() / absWorst);
                if (hpr <= 0.0) {
                    valid = false;
                    break;
                }
                twr *= hpr;
            }
            if (valid && twr > bestTwr) {
                bestTwr = twr;
                bestF = f;
            }
        }
        if (bestF == 0.0) {
            return Optional.empty();
        }
        log.debug("Optimal-f {} over {} trades, TWR {}", bestF, trades.size(), bestTwr);
        return Optional.of(new OptimalFResult(bestF, bestTwr, worstLoss, bestF * absWorst * kellyFraction));
    }
}
