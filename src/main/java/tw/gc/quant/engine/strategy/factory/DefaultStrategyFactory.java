package tw.gc.quant.engine.strategy.factory;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.strategy.Strategy;
import tw.gc.quant.engine.strategy.StrategyFactory;
import tw.gc.quant.engine.strategy.impl.EnsembleStrategy;
import tw.gc.quant.engine.strategy.impl.MeanReversionStrategy;
import tw.gc.quant.engine.strategy.impl.MomentumStrategy;
import tw.gc.quant.engine.strategy.impl.PairsTradingStrategy;
import tw.gc.quant.engine.strategy.impl.TechnicalIndicatorStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory for the built-in strategies, with pair parameters taken from {@link QuantProperties}.
 */
@Component
@RequiredArgsConstructor
public class DefaultStrategyFactory implements StrategyFactory {

    private final QuantProperties properties;

    @Override
    public List<Strategy> createStrategies() {
        List<Strategy> strategies = new ArrayList<>();
        strategies.add(new MomentumStrategy());
        strategies.add(new MeanReversionStrategy());
        strategies.add(new EnsembleStrategy());
        strategies.add(new TechnicalIndicatorStrategy());
        return strategies;
    }

    @Override
    public Strategy create(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        switch (name) {
            case MomentumStrategy.NAME:
                return new MomentumStrategy();
            case MeanReversionStrategy.NAME:
                return new MeanReversionStrategy();
            case EnsembleStrategy.NAME:
                return new EnsembleStrategy();
            case TechnicalIndicatorStrategy.NAME:
                return new TechnicalIndicatorStrategy();
            case PairsTradingStrategy.NAME:
                return createPairsStrategy();
            default:
                throw new IllegalArgumentException("Unknown strategy: " + name);
        }
    }

    public PairsTradingStrategy createPairsStrategy() {
        return new PairsTradingStrategy(properties.getPairs(), properties.getKalman());
    }
}
