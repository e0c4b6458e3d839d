package tw.gc.quant.engine.strategy.pairs;

import java.util.Locale;

/**
 * How the hedge ratio behind a spread is estimated.
 */
public enum HedgeRatioMethod {
    /**
     * Static OLS fit on a trailing window, applied to the whole series.
     */
    OLS,
    /**
     * Time-varying Kalman estimate; the spread is the filter's innovation series.
     */
    KALMAN;

    public static HedgeRatioMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            return OLS;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown hedge ratio method: " + name, e);
        }
    }
}
