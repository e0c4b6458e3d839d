package tw.gc.quant.engine;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.services.backtest.BacktestService;
import tw.gc.quant.engine.services.backtest.MonteCarloPermutationService;
import tw.gc.quant.engine.services.backtest.PairsBacktestService;
import tw.gc.quant.engine.services.positionsizing.PositionSizingService;
import tw.gc.quant.engine.services.scanner.PairUniverseScanner;
import tw.gc.quant.engine.strategy.factory.DefaultStrategyFactory;
import tw.gc.quant.engine.strategy.pairs.HedgeRatioMethod;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = {
        "quant.pairs.hedge-ratio-method=KALMAN",
        "quant.backtest.monte-carlo-iterations=250"
})
class QuantEngineContextTest {

    @Autowired
    private QuantProperties properties;

    @Autowired
    private PositionSizingService positionSizingService;

    @Autowired
    private BacktestService backtestService;

    @Autowired
    private PairsBacktestService pairsBacktestService;

    @Autowired
    private MonteCarloPermutationService monteCarloPermutationService;

    @Autowired
    private PairUniverseScanner pairUniverseScanner;

    @Autowired
    private DefaultStrategyFactory strategyFactory;

    @Test
    void contextLoads_withEveryEngineService() {
        assertThat(positionSizingService).isNotNull();
        assertThat(backtestService).isNotNull();
        assertThat(pairsBacktestService).isNotNull();
        assertThat(monteCarloPermutationService).isNotNull();
        assertThat(pairUniverseScanner).isNotNull();
    }

    @Test
    void properties_bindFromApplicationYaml() {
        assertThat(properties.getPairs().getZScorePeriod()).isEqualTo(20);
        assertThat(properties.getPairs().getEntryZScore()).isEqualTo(2.0);
        assertThat(properties.getSizing().getKellyFraction()).isEqualTo(0.33);
        assertThat(properties.getExecution().getSlippageModel()).isEqualTo("FIXED");
        assertThat(properties.getBacktest().getInitialBalance()).isEqualTo(100_000.0);
        assertThat(properties.getScanner().getTargetHalfLife()).isEqualTo(10.0);
    }

    @Test
    void properties_overridesReachTheServices() {
        assertThat(properties.getBacktest().getMonteCarloIterations()).isEqualTo(250);
        assertThat(strategyFactory.createPairsStrategy().getHedgeRatioMethod()).isEqualTo(HedgeRatioMethod.KALMAN);
    }
}
