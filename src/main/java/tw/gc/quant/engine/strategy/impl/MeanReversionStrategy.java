package tw.gc.quant.engine.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator.BollingerBands;
import tw.gc.quant.engine.statistics.TimeSeriesStatistics;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.Strategy;
import tw.gc.quant.engine.strategy.TradeSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Mean Reversion Strategy
 * Type: Statistical Arbitrage / Mean Reversion
 *
 * Academic Foundation:
 * - Fama &amp; French (1988): "Permanent and Temporary Components of Stock Prices"
 * - Poterba &amp; Summers (1988): "Mean Reversion in Stock Prices"
 *
 * Logic:
 * - Z-score of the last close against its rolling window
 * - Hurst filter: full confidence below 0.5, half between 0.5 and 0.6, no trade above
 * - Bollinger %B outside the bands confirms the entry
 * - Stop when |z| reaches the stop level
 *
 * Risk: Fails in strong trending markets (can keep losing as price trends away)
 */
@Slf4j
public class MeanReversionStrategy implements Strategy {

    public static final String NAME = "mean_reversion";

    private static final int HURST_MAX_LAG = 20;
    private static final int EXTRA_HISTORY = 10;

    private final int zScorePeriod;
    private final double entryZScore;
    private final double exitZScore;
    private final double stopZScore;
    private final int bbPeriod;
    private final double bbStdDev;

    public MeanReversionStrategy() {
        this(20, 2.0, 0.5, 3.5, 20, 2.0);
    }

    public MeanReversionStrategy(int zScorePeriod, double entryZScore, double exitZScore, double stopZScore,
                                 int bbPeriod, double bbStdDev) {
        if (exitZScore >= entryZScore || stopZScore <= entryZScore) {
            throw new IllegalArgumentException("Z-score thresholds must satisfy exit < entry < stop");
        }
        this.zScorePeriod = zScorePeriod;
        this.entryZScore = entryZScore;
        this.exitZScore = exitZScore;
        this.stopZScore = stopZScore;
        this.bbPeriod = bbPeriod;
        this.bbStdDev = bbStdDev;
    }

    @Override
    public TradeSignal generateSignal(PriceHistory history) {
        double[] closes = history.closes();
        if (closes.length < Math.max(zScorePeriod, bbPeriod) + EXTRA_HISTORY) {
            return TradeSignal.hold("Insufficient data");
        }

        double zScore = TimeSeriesStatistics.zScore(closes, zScorePeriod).orElse(0.0);
        Optional<BollingerBands> bands = TechnicalIndicatorCalculator.bollingerBands(
                TechnicalIndicatorCalculator.toList(closes), bbPeriod, bbStdDev);
        Optional<Double> hurst = TimeSeriesStatistics.hurstExponent(closes, HURST_MAX_LAG);

        List<String> reasons = new ArrayList<>();
        boolean meanReverting = hurst.isPresent() && hurst.get() < 0.5;
        boolean borderline = hurst.isPresent() && hurst.get() >= 0.5 && hurst.get() < 0.6;
        if (!meanReverting && !borderline) {
            reasons.add(hurst.map(h -> String.format(Locale.ROOT, "Hurst %.2f >= 0.6: strongly trending, skip MR", h))
                    .orElse("Hurst N/A: skip MR"));
            TradeSignal signal = TradeSignal.hold(reasons.toArray(new String[0]));
            signal.setZScore(zScore);
            return signal;
        }
        double hurstPenalty = meanReverting ? 1.0 : 0.5;

        int direction = 0;
        boolean exitSignal = false;
        if (zScore <= -entryZScore) {
            direction = 1;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f <= -%.1f: oversold, BUY", zScore, entryZScore));
        } else if (zScore >= entryZScore) {
            direction = -1;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f >= %.1f: overbought, SELL", zScore, entryZScore));
        } else if (Math.abs(zScore) <= exitZScore) {
            exitSignal = true;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f near mean: HOLD/EXIT", zScore));
        } else {
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f in no-trade zone", zScore));
        }

        if (Math.abs(zScore) >= stopZScore) {
            direction = 0;
            exitSignal = true;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f hit stop at %.1f: EXIT", zScore, stopZScore));
        }

        if (bands.isPresent()) {
            double percentB = bands.get().percentB(closes[closes.length - 1]);
            if (percentB < 0 && direction > 0) {
                reasons.add("Confirmed: below lower BB");
            }
            if (percentB > 1 && direction < 0) {
                reasons.add("Confirmed: above upper BB");
            }
        }

        double absZ = Math.abs(zScore);
        double rawConfidence = absZ >= entryZScore
                ? Math.min((absZ - entryZScore) / (stopZScore - entryZScore), 0.95)
                : absZ / entryZScore * 0.3;
        double confidence = TimeSeriesStatistics.round(rawConfidence * hurstPenalty, 2);
        reasons.add(String.format(Locale.ROOT, "Hurst: %.2f (%s)", hurst.get(),
                meanReverting ? "mean-reverting" : "borderline, 50% penalty"));

        TradeSignal.SignalAction action = direction > 0 ? TradeSignal.SignalAction.BUY
                : direction < 0 ? TradeSignal.SignalAction.SELL
                : TradeSignal.SignalAction.HOLD;
        return TradeSignal.builder()
                .action(action)
                .confidence(confidence)
                .zScore(zScore)
                .reasons(reasons)
                .exitSignal(exitSignal)
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinimumHistory() {
        return Math.max(Math.max(zScorePeriod, bbPeriod) + EXTRA_HISTORY, HURST_MAX_LAG * 2);
    }
}
