package tw.gc.quant.engine.services.positionsizing;

/**
 * Percentage return of one closed trade; non-positive returns count as losses.
 */
public record TradeOutcome(double pnlPct) {

    public boolean isWin() {
        return pnlPct > 0.0;
    }
}
