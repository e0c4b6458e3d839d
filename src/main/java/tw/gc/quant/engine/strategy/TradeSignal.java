package tw.gc.quant.engine.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Trade signal returned by strategy evaluation
 * Contains action, confidence, and reasoning
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSignal {

    /**
     * Signal action
     */
    private SignalAction action;

    /**
     * Confidence level (0.0 to 1.0)
     */
    private double confidence;

    /**
     * Spread z-score for pair signals, null otherwise
     */
    private Double zScore;

    /**
     * Hedge ratio for pair signals, null otherwise
     */
    private Double hedgeRatio;

    /**
     * Signed strength in [-1, 1] for strategies that scale their output, null otherwise
     */
    private Double strength;

    /**
     * Human-readable reasons, in evaluation order
     */
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    /**
     * Whether an open position should be flattened
     */
    private boolean exitSignal;

    public enum SignalAction {
        BUY,
        SELL,
        HOLD
    }

    /**
     * +1 for BUY, -1 for SELL, 0 for HOLD.
     */
    public int direction() {
        if (action == SignalAction.BUY) {
            return 1;
        }
        return action == SignalAction.SELL ? -1 : 0;
    }

    /**
     * {@link #getStrength()} when set, otherwise {@link #direction()}.
     */
    public double signedStrength() {
        return strength != null ? strength : direction();
    }

    public boolean isActionable() {
        return action == SignalAction.BUY || action == SignalAction.SELL;
    }

    /**
     * Create a HOLD signal (no action)
     */
    public static TradeSignal hold(String... reasons) {
        return TradeSignal.builder()
                .action(SignalAction.HOLD)
                .confidence(0.0)
                .reasons(new ArrayList<>(List.of(reasons)))
                .exitSignal(false)
                .build();
    }

    /**
     * Create a HOLD signal that also asks to flatten any open position
     */
    public static TradeSignal exit(String... reasons) {
        TradeSignal signal = hold(reasons);
        signal.setExitSignal(true);
        return signal;
    }

    public static TradeSignal buy(double confidence, List<String> reasons) {
        return TradeSignal.builder()
                .action(SignalAction.BUY)
                .confidence(confidence)
                .reasons(new ArrayList<>(reasons))
                .build();
    }

    public static TradeSignal sell(double confidence, List<String> reasons) {
        return TradeSignal.builder()
                .action(SignalAction.SELL)
                .confidence(confidence)
                .reasons(new ArrayList<>(reasons))
                .build();
    }
}
