package tw.gc.quant.engine.services.positionsizing;

/**
 * Outcome of {@link PositionSizingService#calculate(PositionSizingRequest)}.
 *
 * @param quantity      units to trade; fractional only when one whole unit exceeds the budget
 * @param notionalValue {@code quantity * price}
 * @param method        ordered tag trail of the adjustments applied, e.g. {@code kelly+dd_adjusted+cvar}
 * @param positionPct   final allocation as a percentage of portfolio value (5.0 = 5%)
 * @param reason        explanation for {@code none} and {@code skip} results, otherwise null
 */
public record PositionSizingResult(
        double quantity,
        double notionalValue,
        String method,
        double positionPct,
        String reason
) {

    public static final String METHOD_NONE = "none";
    public static final String METHOD_SKIP = "skip";

    public static PositionSizingResult none(String reason) {
        return new PositionSizingResult(0.0, 0.0, METHOD_NONE, 0.0, reason);
    }

    public static PositionSizingResult skip(String reason) {
        return new PositionSizingResult(0.0, 0.0, METHOD_SKIP, 0.0, reason);
    }

    public boolean isTradeable() {
        return quantity > 0.0;
    }
}
