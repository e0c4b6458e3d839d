package tw.gc.quant.engine.strategy.pairs;

import java.util.List;

/**
 * Full cointegration battery for one pair at one point in time.
 *
 * @param hurstExponent null when the spread is too short for R/S analysis
 * @param halfLifeBars  null when the spread shows no mean reversion
 */
public record CointegrationResult(
        double adfStatistic,
        double adfPValue,
        boolean stationary,
        Double hurstExponent,
        Double halfLifeBars,
        int johansenRank,
        boolean johansenCointegrated,
        double hedgeRatio,
        double rSquared,
        List<String> reasons
) {

    public static final double TRENDING_HURST = 0.6;

    public CointegrationResult {
        reasons = List.copyOf(reasons);
    }

    /**
     * Hurst available and below the trending threshold.
     */
    public boolean isMeanReverting() {
        return hurstExponent != null && hurstExponent < TRENDING_HURST;
    }

    /**
     * Stationary by ADF and not trending by Hurst, the gate the pairs strategy applies.
     */
    public boolean isTradeable() {
        return stationary && isMeanReverting();
    }
}
