package tw.gc.quant.engine.services.positionsizing;

import java.util.Arrays;
import java.util.Optional;

/**
 * Market regime used to pick the Kelly fraction.
 */
public enum KellyRegime {
    /** Aggressive: trending up with calm volatility */
    BULL_LOW_VOL("bull_low_vol", 0.50),
    /** Moderate */
    RANGE_BOUND("range_bound", 0.40),
    /** Conservative: falling market, high volatility */
    BEAR_HIGH_VOL("bear_high_vol", 0.25),
    /** Minimum */
    UNCERTAIN("uncertain", 0.20);

    private final String code;
    private final double kellyFraction;

    KellyRegime(String code, double kellyFraction) {
        this.code = code;
        this.kellyFraction = kellyFraction;
    }

    public String getCode() {
        return code;
    }

    public double getKellyFraction() {
        return kellyFraction;
    }

    public static Optional<KellyRegime> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(regime -> regime.code.equalsIgnoreCase(code) || regime.name().equalsIgnoreCase(code))
                .findFirst();
    }
}
