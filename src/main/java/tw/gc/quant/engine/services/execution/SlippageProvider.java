package tw.gc.quant.engine.services.execution;

import tw.gc.quant.engine.entities.Trade.TradeSide;

/**
 * SlippageProvider - Functional interface for pluggable slippage calculation.
 *
 * <p>Allows {@link ExecutionCostModel} to switch between slippage models:
 * <ul>
 *   <li>{@link #fixed(double)} - Static basis points</li>
 *   <li>{@link #volumeImpact(double, double)} - Square-root market impact</li>
 *   <li>{@link #volatilityScaled(double)} - Basis points widened in volatile markets</li>
 * </ul>
 */
@FunctionalInterface
public interface SlippageProvider {

    /** Reference daily volatility at which volatility-scaled slippage equals the base rate. */
    double REFERENCE_VOLATILITY = 0.02;

    /** Ceiling for square-root impact; keeps a sell fill above zero for any order size. */
    double MAX_IMPACT_RATE = 0.10;

    /**
     * Calculate slippage rate for a trade.
     *
     * @param context the slippage context containing trade details
     * @return slippage as a rate (e.g., 0.001 = 0.1%)
     */
    double calculateSlippage(SlippageContext context);

    /**
     * Create a fixed slippage provider.
     *
     * @param bps slippage in basis points
     * @return a provider that always returns {@code bps / 10000}
     */
    static SlippageProvider fixed(double bps) {
        double rate = bps / 10_000.0;
        return context -> rate;
    }

    /**
     * Create a market-impact provider: {@code coeff * sqrt(quantity / avgVolume)}, capped at
     * {@link #MAX_IMPACT_RATE}.
     *
     * <p>Falls back to the fixed rate when volume or quantity is unknown.
     */
    static SlippageProvider volumeImpact(double impactCoeff, double fallbackBps) {
        SlippageProvider fallback = fixed(fallbackBps);
        SlippageProvider impact = context -> {
            if (context.avgVolume() > 0 && context.quantity() > 0) {
                return impactCoeff * Math.sqrt(context.quantity() / context.avgVolume());
            }
            return fallback.calculateSlippage(context);
        };
        return impact.capped(MAX_IMPACT_RATE);
    }

    /**
     * Create a volatility-scaled provider: {@code bps * max(1, volatility / 0.02)}.
     */
    static SlippageProvider volatilityScaled(double bps) {
        double rate = bps / 10_000.0;
        return context -> rate * Math.max(1.0, context.volatility() / REFERENCE_VOLATILITY);
    }

    static SlippageProvider forModel(SlippageModelType type, double bps, double impactCoeff) {
        return switch (type) {
            case VOLUME -> volumeImpact(impactCoeff, bps);
            case VOLATILITY -> volatilityScaled(bps);
            case FIXED -> fixed(bps);
        };
    }

    /**
     * Create a capped slippage provider that limits maximum slippage.
     *
     * @param maxRate maximum slippage rate allowed
     * @return a provider that caps slippage at the maximum
     */
    default SlippageProvider capped(double maxRate) {
        return context -> Math.min(calculateSlippage(context), maxRate);
    }

    /**
     * Context for slippage calculation.
     *
     * @param avgVolume  average volume over the signal window, 0 when unknown
     * @param volatility recent daily return volatility, 0 when unknown
     */
    record SlippageContext(
            TradeSide side,
            double quantity,
            double price,
            double avgVolume,
            double volatility
    ) {
        public static SlippageContext of(TradeSide side, double quantity, double price) {
            return new SlippageContext(side, quantity, price, 0.0, 0.0);
        }
    }
}
