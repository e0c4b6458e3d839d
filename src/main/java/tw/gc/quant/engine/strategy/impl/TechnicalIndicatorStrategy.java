package tw.gc.quant.engine.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator.BollingerBands;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator.MacdResult;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.Strategy;
import tw.gc.quant.engine.strategy.TradeSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Technical Indicator Scoring Strategy
 * Type: Technical / Composite
 *
 * Logic:
 * - RSI(14) below 30 scores +2, above 70 scores -2
 * - MACD(12, 26, 9) histogram sign scores +/-1
 * - Close outside Bollinger(20, 2) scores +1 below the lower band, -1 above the upper band
 * - A volume spike (2x the 19-bar average) amplifies a non-zero score by one
 * - BUY at score &ge; 2, SELL at score &le; -2, confidence = |score| / 10
 */
@Slf4j
public class TechnicalIndicatorStrategy implements Strategy {

    public static final String NAME = "technical";

    private static final int RSI_PERIOD = 14;
    private static final int MACD_FAST = 12;
    private static final int MACD_SLOW = 26;
    private static final int MACD_SIGNAL = 9;
    private static final int BB_PERIOD = 20;
    private static final double BB_STD_DEV = 2.0;
    private static final double VOLUME_SPIKE_THRESHOLD = 2.0;
    private static final int ACTION_SCORE = 2;
    private static final double SCORE_SCALE = 10.0;

    @Override
    public TradeSignal generateSignal(PriceHistory history) {
        List<Double> closes = TechnicalIndicatorCalculator.toList(history.closes());
        if (closes.size() < getMinimumHistory()) {
            return TradeSignal.hold("Insufficient data");
        }
        int score = 0;
        List<String> reasons = new ArrayList<>();

        Optional<Double> rsi = TechnicalIndicatorCalculator.relativeStrengthIndex(closes, RSI_PERIOD);
        if (rsi.isPresent()) {
            if (rsi.get() < 30) {
                score += 2;
                reasons.add(String.format(Locale.ROOT, "RSI oversold (%.1f)", rsi.get()));
            } else if (rsi.get() > 70) {
                score -= 2;
                reasons.add(String.format(Locale.ROOT, "RSI overbought (%.1f)", rsi.get()));
            }
        }

        Optional<MacdResult> macd = TechnicalIndicatorCalculator.macd(closes, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
        if (macd.isPresent()) {
            if (macd.get().histogram() > 0) {
                score += 1;
                reasons.add("MACD bullish crossover");
            } else if (macd.get().histogram() < 0) {
                score -= 1;
                reasons.add("MACD bearish crossover");
            }
        }

        Optional<BollingerBands> bands = TechnicalIndicatorCalculator.bollingerBands(closes, BB_PERIOD, BB_STD_DEV);
        if (bands.isPresent()) {
            double price = history.lastClose();
            if (price < bands.get().lower()) {
                score += 1;
                reasons.add("Close below lower Bollinger band");
            } else if (price > bands.get().upper()) {
                score -= 1;
                reasons.add("Close above upper Bollinger band");
            }
        }

        if (!history.candles().isEmpty()
                && TechnicalIndicatorCalculator.isVolumeSpike(TechnicalIndicatorCalculator.toList(history.volumes()), VOLUME_SPIKE_THRESHOLD)
                && score != 0) {
            score += score > 0 ? 1 : -1;
            reasons.add("Volume spike detected");
        }

        TradeSignal.SignalAction action = score >= ACTION_SCORE ? TradeSignal.SignalAction.BUY
                : score <= -ACTION_SCORE ? TradeSignal.SignalAction.SELL
                : TradeSignal.SignalAction.HOLD;
        if (reasons.isEmpty()) {
            reasons.add("No indicator triggered");
        }
        return TradeSignal.builder()
                .action(action)
                .confidence(Math.min(Math.abs(score) / SCORE_SCALE, 1.0))
                .strength(Math.max(-1.0, Math.min(1.0, score / SCORE_SCALE * 2)))
                .reasons(reasons)
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinimumHistory() {
        return MACD_SLOW + MACD_SIGNAL;
    }
}
