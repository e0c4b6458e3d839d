package tw.gc.quant.engine.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.quant.engine.statistics.TimeSeriesStatistics;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.Strategy;
import tw.gc.quant.engine.strategy.TradeSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Regime-Weighted Ensemble Strategy
 * Type: Meta-Strategy
 *
 * Logic:
 * - Classify the regime from the 20/60-bar volatility ratio and the 30-bar return
 * - Trending regimes weight momentum 70/30, ranging regimes weight mean reversion 70/30
 * - BUY above +0.15 combined strength, SELL below -0.15
 */
@Slf4j
public class EnsembleStrategy implements Strategy {

    public static final String NAME = "ensemble";

    private static final int REGIME_HISTORY = 60;
    private static final int SHORT_VOL_WINDOW = 20;
    private static final int RETURN_WINDOW = 30;
    private static final double ACTION_THRESHOLD = 0.15;

    private final MomentumStrategy momentum;
    private final MeanReversionStrategy meanReversion;

    public EnsembleStrategy() {
        this(new MomentumStrategy(), new MeanReversionStrategy());
    }

    public EnsembleStrategy(MomentumStrategy momentum, MeanReversionStrategy meanReversion) {
        this.momentum = momentum;
        this.meanReversion = meanReversion;
    }

    public enum VolatilityRegime {
        HIGH_VOL_TRENDING(0.7, 0.3),
        TRENDING(0.7, 0.3),
        LOW_VOL_RANGE(0.3, 0.7),
        RANGE_BOUND(0.3, 0.7),
        UNKNOWN(0.5, 0.5);

        private final double momentumWeight;
        private final double meanReversionWeight;

        VolatilityRegime(double momentumWeight, double meanReversionWeight) {
            this.momentumWeight = momentumWeight;
            this.meanReversionWeight = meanReversionWeight;
        }

        public double getMomentumWeight() {
            return momentumWeight;
        }

        public double getMeanReversionWeight() {
            return meanReversionWeight;
        }
    }

    public VolatilityRegime detectRegime(double[] closes) {
        if (closes.length < REGIME_HISTORY + 1) {
            return VolatilityRegime.UNKNOWN;
        }
        double recentVol = TimeSeriesStatistics.populationStdDev(
                TimeSeriesStatistics.simpleReturns(TimeSeriesStatistics.tail(closes, SHORT_VOL_WINDOW + 1)));
        double longVol = TimeSeriesStatistics.populationStdDev(
                TimeSeriesStatistics.simpleReturns(TimeSeriesStatistics.tail(closes, REGIME_HISTORY + 1)));
        double volRatio = recentVol / (longVol > 0 ? longVol : 1.0);

        double reference = closes[closes.length - 1 - RETURN_WINDOW];
        double absReturn = reference > 0 ? Math.abs((closes[closes.length - 1] - reference) / reference) : 0.0;

        if (volRatio > 1.5 && absReturn > 0.15) {
            return VolatilityRegime.HIGH_VOL_TRENDING;
        }
        if (volRatio < 0.8 && absReturn < 0.05) {
            return VolatilityRegime.LOW_VOL_RANGE;
        }
        if (absReturn > 0.10) {
            return VolatilityRegime.TRENDING;
        }
        return VolatilityRegime.RANGE_BOUND;
    }

    @Override
    public TradeSignal generateSignal(PriceHistory history) {
        TradeSignal momSignal = momentum.generateSignal(history);
        TradeSignal mrSignal = meanReversion.generateSignal(history);
        VolatilityRegime regime = detectRegime(history.closes());

        double combined = regime.getMomentumWeight() * momSignal.signedStrength()
                + regime.getMeanReversionWeight() * mrSignal.signedStrength();
        double confidence = regime.getMomentumWeight() * momSignal.getConfidence()
                + regime.getMeanReversionWeight() * mrSignal.getConfidence();

        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(Locale.ROOT, "Regime: %s (mom: %.0f%%, mr: %.0f%%)", regime,
                regime.getMomentumWeight() * 100, regime.getMeanReversionWeight() * 100));
        reasons.add(String.format(Locale.ROOT, "Momentum: %s (%.2f)", momSignal.getAction(), momSignal.getConfidence()));
        reasons.add(String.format(Locale.ROOT, "MeanRev: %s (%.2f)", mrSignal.getAction(), mrSignal.getConfidence()));
        reasons.add(String.format(Locale.ROOT, "Combined: %.3f", combined));

        TradeSignal.SignalAction action = combined > ACTION_THRESHOLD ? TradeSignal.SignalAction.BUY
                : combined < -ACTION_THRESHOLD ? TradeSignal.SignalAction.SELL
                : TradeSignal.SignalAction.HOLD;
        return TradeSignal.builder()
                .action(action)
                .confidence(TimeSeriesStatistics.round(confidence, 2))
                .strength(Math.max(-1.0, Math.min(1.0, combined)))
                .reasons(reasons)
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinimumHistory() {
        return Math.max(momentum.getMinimumHistory(), meanReversion.getMinimumHistory());
    }
}
