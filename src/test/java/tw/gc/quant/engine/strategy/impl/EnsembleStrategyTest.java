package tw.gc.quant.engine.strategy.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.TradeSignal;
import tw.gc.quant.engine.strategy.impl.EnsembleStrategy.VolatilityRegime;
import tw.gc.quant.engine.testutil.PriceSeriesFixtures;

import static org.junit.jupiter.api.Assertions.*;

class EnsembleStrategyTest {

    private EnsembleStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new EnsembleStrategy();
    }

    @Test
    void detectRegime_shortHistoryIsUnknown() {
        assertEquals(VolatilityRegime.UNKNOWN, strategy.detectRegime(PriceSeriesFixtures.constant(60, 100.0)));
    }

    @Test
    void detectRegime_flatMarketIsLowVolRange() {
        assertEquals(VolatilityRegime.LOW_VOL_RANGE, strategy.detectRegime(PriceSeriesFixtures.constant(61, 100.0)));
    }

    @Test
    void detectRegime_steadyRallyIsTrending() {
        assertEquals(VolatilityRegime.TRENDING, strategy.detectRegime(PriceSeriesFixtures.linear(61, 100.0, 1.0)));
    }

    @Test
    void detectRegime_violentBreakoutIsHighVolTrending() {
        double[] closes = new double[61];
        for (int i = 0; i <= 40; i++) {
            closes[i] = 100.0;
        }
        for (int i = 41; i < closes.length; i++) {
            closes[i] = closes[i - 1] * ((i - 41) % 2 == 0 ? 1.06 : 0.97);
        }
        assertEquals(VolatilityRegime.HIGH_VOL_TRENDING, strategy.detectRegime(closes));
    }

    @Test
    void detectRegime_oscillationIsRangeBound() {
        double[] spread = PriceSeriesFixtures.alternatingSpread(70);
        double[] closes = new double[spread.length];
        for (int i = 0; i < spread.length; i++) {
            closes[i] = 100.0 + spread[i];
        }
        assertEquals(VolatilityRegime.RANGE_BOUND, strategy.detectRegime(closes));
    }

    @Test
    void trendingRally_followsMomentum() {
        TradeSignal signal = strategy.generateSignal(PriceHistory.of(PriceSeriesFixtures.linear(61, 100.0, 1.0)));
        // 0.7 * momentum(+1) + 0.3 * mean reversion skipped(0)
        assertEquals(TradeSignal.SignalAction.BUY, signal.getAction());
        assertEquals(0.7, signal.getStrength(), 1e-9);
        assertEquals(0.7, signal.getConfidence(), 1e-9);
        assertTrue(signal.getReasons().get(0).startsWith("Regime: TRENDING"));
    }

    @Test
    void regimeWeights_sumToOne() {
        for (VolatilityRegime regime : VolatilityRegime.values()) {
            assertEquals(1.0, regime.getMomentumWeight() + regime.getMeanReversionWeight(), 1e-12);
        }
    }

    @Test
    void minimumHistory_coversBothMembers() {
        assertEquals(50, strategy.getMinimumHistory());
        assertEquals("ensemble", strategy.getName());
    }
}
