package tw.gc.quant.engine.services.execution;

import lombok.extern.slf4j.Slf4j;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.entities.Trade.TradeSide;

import java.util.Objects;

/**
 * Execution cost model: slippage plus commission.
 *
 * <p>Buys fill above the quoted price and sells below it. Every call to
 * {@link #execute(TradeSide, double, double, double, double)} adds its slippage and commission to
 * running totals, so one instance belongs to one backtest run; {@link #reset()} clears the totals.
 */
@Slf4j
public class ExecutionCostModel {

    private final double slippageBps;
    private final double commissionBps;
    private final SlippageModelType modelType;
    private final SlippageProvider slippageProvider;

    private double totalSlippage;
    private double totalCommission;
    private int fills;

    public ExecutionCostModel(double slippageBps, double commissionBps, SlippageModelType modelType,
                              double marketImpactCoeff) {
        if (slippageBps < 0 || commissionBps < 0 || marketImpactCoeff < 0) {
            throw new IllegalArgumentException("execution costs must be non-negative");
        }
        this.slippageBps = slippageBps;
        this.commissionBps = commissionBps;
        this.modelType = Objects.requireNonNull(modelType, "modelType");
        this.slippageProvider = SlippageProvider.forModel(modelType, slippageBps, marketImpactCoeff);
    }

    public static ExecutionCostModel from(QuantProperties.Execution config) {
        config.validate();
        return new ExecutionCostModel(config.getSlippageBps(), config.getCommissionBps(),
                SlippageModelType.fromName(config.getSlippageModel()), config.getMarketImpactCoeff());
    }

    public static ExecutionCostModel fixed(double slippageBps, double commissionBps) {
        return new ExecutionCostModel(slippageBps, commissionBps, SlippageModelType.FIXED, 0.0);
    }

    /**
     * Simulate one fill.
     *
     * @param avgVolume  average volume for the VOLUME model, 0 when unknown
     * @param volatility recent volatility for the VOLATILITY model, 0 when unknown
     */
    public Fill execute(TradeSide side, double price, double quantity, double avgVolume, double volatility) {
        Objects.requireNonNull(side, "side");
        double rate = slippageProvider.calculateSlippage(
                new SlippageProvider.SlippageContext(side, quantity, price, avgVolume, volatility));
        double direction = side == TradeSide.BUY ? 1.0 : -1.0;
        double slippagePerUnit = price * rate;
        double realizedPrice = price + slippagePerUnit * direction;
        double slippage = slippagePerUnit * Math.abs(quantity);
        double commission = commission(realizedPrice, quantity);

        totalSlippage += slippage;
        totalCommission += commission;
        fills++;
        log.debug("{} {} @ {} -> {} (slippage {}, commission {})", side, quantity, price, realizedPrice,
                slippage, commission);
        return new Fill(realizedPrice, slippage, commission);
    }

    public Fill execute(TradeSide side, double price, double quantity) {
        return execute(side, price, quantity, 0.0, 0.0);
    }

    /**
     * Execution price after slippage, for a zero-size order; does not touch the totals.
     */
    public double executionPrice(TradeSide side, double price) {
        double rate = slippageProvider.calculateSlippage(SlippageProvider.SlippageContext.of(side, 0.0, price));
        return side == TradeSide.BUY ? price * (1.0 + rate) : price * (1.0 - rate);
    }

    private double commission(double price, double quantity) {
        return price * Math.abs(quantity) * (commissionBps / 10_000.0);
    }

    /**
     * {@code (slippageBps + commissionBps) * 2}.
     */
    public double roundTripCostBps() {
        return (slippageBps + commissionBps) * 2.0;
    }

    public ExecutionCostSummary summary(double totalPnl) {
        return ExecutionCostSummary.of(totalSlippage, totalCommission, totalPnl);
    }

    public void reset() {
        totalSlippage = 0.0;
        totalCommission = 0.0;
        fills = 0;
    }

    public double getTotalSlippage() {
        return totalSlippage;
    }

    public double getTotalCommission() {
        return totalCommission;
    }

    public int getFills() {
        return fills;
    }

    public SlippageModelType getModelType() {
        return modelType;
    }

    /**
     * Result of one simulated fill.
     *
     * @param slippage   total slippage cost of the fill, always non-negative
     * @param commission commission charged on the realized notional
     */
    public record Fill(double realizedPrice, double slippage, double commission) {
    }
}
