package tw.gc.quant.engine.services.execution;

/**
 * Execution cost breakdown for one run.
 *
 * @param costPctOfPnl total costs as a percentage of absolute P&amp;L; 0 when P&amp;L is 0
 */
public record ExecutionCostSummary(
        double totalSlippage,
        double totalCommission,
        double totalCosts,
        double costPctOfPnl
) {

    public static ExecutionCostSummary of(double totalSlippage, double totalCommission, double totalPnl) {
        double totalCosts = totalSlippage + totalCommission;
        double costPct = totalPnl != 0.0 ? totalCosts / Math.abs(totalPnl) * 100.0 : 0.0;
        return new ExecutionCostSummary(totalSlippage, totalCommission, totalCosts, costPct);
    }
}
