package tw.gc.quant.engine.strategy;

import java.util.List;

/**
 * Abstract Factory for creating trading strategies.
 * Every call returns fresh instances so concurrent backtests never share strategy state.
 */
public interface StrategyFactory {

    /**
     * Create the single-asset strategies the engine ships with.
     * @return List of configured strategies
     */
    List<Strategy> createStrategies();

    /**
     * Create one strategy by its {@link Strategy#getName()}.
     * @throws IllegalArgumentException for an unknown name
     */
    Strategy create(String name);
}
