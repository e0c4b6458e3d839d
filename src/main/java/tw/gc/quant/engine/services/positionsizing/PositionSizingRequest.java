package tw.gc.quant.engine.services.positionsizing;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Inputs to {@link PositionSizingService#calculate(PositionSizingRequest)}.
 *
 * <p>Only {@code portfolioValue}, {@code price} and {@code confidence} are required. Each
 * optional input switches on one adjustment stage.
 */
@Value
@Builder
public class PositionSizingRequest {

    double portfolioValue;
    double price;
    double confidence;

    /** Daily return standard deviation of the asset */
    Double volatility;

    Double winRate;
    Double avgWinReturn;
    Double avgLossReturn;

    KellyRegime regime;

    /** Current portfolio drawdown as a fraction (0.1 = 10%) */
    Double currentDrawdown;

    /** Strategy name, looked up in {@link StrategyKellyProfile} when no explicit stats are given */
    String strategyName;

    List<TradeOutcome> trades;

    /** Periodic returns feeding the VaR / CVaR constraint */
    double[] returns;

    Double maxVaRPct;
    Double maxCVaRPct;

    /** Round-trip cost as a fraction of notional */
    Double transactionCostPct;

    boolean useAdaptiveFraction;
    boolean useExponentialWeighting;

    public boolean hasExplicitStats() {
        return winRate != null && avgWinReturn != null && avgLossReturn != null;
    }
}
