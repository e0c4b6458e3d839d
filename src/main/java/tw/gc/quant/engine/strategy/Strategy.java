package tw.gc.quant.engine.strategy;

/**
 * A signal generator that the backtest engine can drive bar by bar.
 *
 * <p>Implementations must be deterministic: the same history always yields the same signal.
 * Single-asset strategies read {@link PriceHistory#closes()}; pair strategies also read
 * {@link PriceHistory#pairedCloses()}.
 */
public interface Strategy {

    TradeSignal generateSignal(PriceHistory history);

    String getName();

    /**
     * Minimum number of bars the strategy needs before it can emit anything but HOLD.
     */
    int getMinimumHistory();

    /**
     * Clear any state carried between calls. Stateless strategies need not override.
     */
    default void reset() {
    }
}
