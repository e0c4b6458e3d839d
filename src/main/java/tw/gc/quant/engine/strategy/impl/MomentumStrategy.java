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
 * Risk-Managed Time-Series Momentum Strategy
 * Type: Trend Following
 *
 * Academic Foundation:
 * - Moskowitz, Ooi &amp; Pedersen (2012) - 'Time Series Momentum'
 * - Barroso &amp; Santa-Clara (2015) - 'Momentum Has Its Moments'
 *
 * Logic:
 * - Sign of the lookback return gives the direction
 * - Signal scaled by target risk over realized volatility (capped at 2x, then clipped to [-1, 1])
 * - Confidence grows with momentum measured in volatility units
 */
@Slf4j
public class MomentumStrategy implements Strategy {

    public static final String NAME = "momentum";

    private static final double MAX_VOL_SCALE = 2.0;
    private static final double FULL_CONFIDENCE_Z = 3.0;
    private static final double ACTION_THRESHOLD = 0.1;

    private final int lookback;
    private final int volWindow;
    private final double targetRisk;

    public MomentumStrategy() {
        this(30, 20, 0.02);
    }

    public MomentumStrategy(int lookback, int volWindow, double targetRisk) {
        if (lookback <= 0 || volWindow <= 0) {
            throw new IllegalArgumentException("lookback and volWindow must be positive");
        }
        if (targetRisk <= 0) {
            throw new IllegalArgumentException("targetRisk must be positive");
        }
        this.lookback = lookback;
        this.volWindow = volWindow;
        this.targetRisk = targetRisk;
    }

    @Override
    public TradeSignal generateSignal(PriceHistory history) {
        double[] closes = history.closes();
        if (closes.length < getMinimumHistory()) {
            return TradeSignal.hold("Insufficient data");
        }

        double current = closes[closes.length - 1];
        double past = closes[closes.length - 1 - lookback];
        if (past <= 0.0) {
            return TradeSignal.hold("Non-positive reference price");
        }
        double momentum = (current - past) / past;

        double[] window = TimeSeriesStatistics.tail(closes, volWindow + 1);
        double volatility = TimeSeriesStatistics.populationStdDev(TimeSeriesStatistics.simpleReturns(window));

        double volScale = volatility > 0 ? Math.min(targetRisk / volatility, MAX_VOL_SCALE) : 1.0;
        int rawSignal = momentum > 0 ? 1 : momentum < 0 ? -1 : 0;
        double scaledSignal = rawSignal * volScale;
        double confidence = volatility > 0 ? Math.min(Math.abs(momentum) / volatility / FULL_CONFIDENCE_Z, 1.0) : 0.0;

        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(Locale.ROOT, "%s %dd momentum: %.2f%%",
                momentum > 0 ? "Positive" : "Negative", lookback, momentum * 100));
        reasons.add(String.format(Locale.ROOT, "Volatility: %.2f%%, scale: %.2f", volatility * 100, volScale));

        TradeSignal.SignalAction action = scaledSignal > ACTION_THRESHOLD ? TradeSignal.SignalAction.BUY
                : scaledSignal < -ACTION_THRESHOLD ? TradeSignal.SignalAction.SELL
                : TradeSignal.SignalAction.HOLD;

        return TradeSignal.builder()
                .action(action)
                .confidence(TimeSeriesStatistics.round(confidence, 2))
                .strength(Math.max(-1.0, Math.min(1.0, scaledSignal)))
                .reasons(reasons)
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinimumHistory() {
        return lookback + volWindow;
    }
}
