package tw.gc.quant.engine.services.execution;

import java.util.Locale;

/**
 * Slippage model selected through {@code quant.execution.slippage-model}.
 */
public enum SlippageModelType {
    /** Constant basis points */
    FIXED,
    /** Square-root market impact on order size relative to average volume */
    VOLUME,
    /** Basis points scaled up when volatility exceeds 2% */
    VOLATILITY;

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static SlippageModelType fromName(String name) {
        if (name == null || name.isBlank()) {
            return FIXED;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown slippage model: " + name, e);
        }
    }
}
