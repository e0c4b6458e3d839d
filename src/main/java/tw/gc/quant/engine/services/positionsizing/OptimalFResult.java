package tw.gc.quant.engine.services.positionsizing;

/**
 * Ralph Vince optimal-f.
 *
 * @param optimalF       fraction in (0, 1] maximising terminal wealth relative
 * @param terminalWealth product of holding-period returns at {@code optimalF}
 * @param worstLoss      most negative trade return (negative)
 * @param positionPct    {@code optimalF * |worstLoss| * kellyFraction}
 */
public record OptimalFResult(double optimalF, double terminalWealth, double worstLoss, double positionPct) {
}
