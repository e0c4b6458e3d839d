package tw.gc.quant.engine.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RiskMeasures")
class RiskMeasuresTest {

    private static final double[] RETURNS = {
            -0.10, -0.05, -0.03, -0.02, -0.01, 0.00, 0.01, 0.02, 0.03, 0.04,
            0.05, 0.01, 0.02, 0.00, -0.01, 0.03, 0.02, 0.01, 0.04, 0.06
    };

    @Nested
    @DisplayName("Historical VaR")
    class HistoricalVaR {

        @Test
        @DisplayName("should read the loss at the tail index")
        void shouldReadTailLoss() {
            // 20 returns: index floor(0.05 * 20) = 1 of the sorted sample
            assertThat(RiskMeasures.historicalValueAtRisk(RETURNS, 0.95)).hasValueSatisfying(
                    var -> assertThat(var).isCloseTo(0.05, within(1e-12)));
            assertThat(RiskMeasures.historicalValueAtRisk(RETURNS, 0.99)).hasValueSatisfying(
                    var -> assertThat(var).isCloseTo(0.10, within(1e-12)));
        }

        @Test
        @DisplayName("should be negative when even the tail is a gain")
        void shouldBeNegativeForAllGains() {
            double[] gains = {0.01, 0.02, 0.03, 0.04, 0.05, 0.06, 0.07, 0.08, 0.09, 0.10};

            assertThat(RiskMeasures.historicalValueAtRisk(gains, 0.95).orElseThrow()).isCloseTo(-0.01, within(1e-12));
        }

        @Test
        @DisplayName("should need at least ten returns")
        void shouldNeedTenReturns() {
            assertThat(RiskMeasures.historicalValueAtRisk(new double[9], 0.95)).isEmpty();
        }

        @Test
        @DisplayName("should reject a confidence level outside (0, 1)")
        void shouldRejectInvalidConfidence() {
            assertThatThrownBy(() -> RiskMeasures.historicalValueAtRisk(RETURNS, 1.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RiskMeasures.conditionalValueAtRisk(RETURNS, 0.0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Conditional VaR")
    class ConditionalVaR {

        @Test
        @DisplayName("should average every return at or below the VaR quantile")
        void shouldAverageTail() {
            assertThat(RiskMeasures.conditionalValueAtRisk(RETURNS, 0.95).orElseThrow())
                    .isCloseTo(0.075, within(1e-12));
        }

        @ParameterizedTest(name = "confidence {0}")
        @ValueSource(doubles = {0.90, 0.95, 0.99})
        @DisplayName("should never be smaller than historical VaR")
        void shouldDominateVaR(double confidence) {
            Random random = new Random(7L);
            double[] returns = new double[250];
            for (int i = 0; i < returns.length; i++) {
                returns[i] = 0.0005 + 0.015 * random.nextGaussian();
            }

            double var = RiskMeasures.historicalValueAtRisk(returns, confidence).orElseThrow();
            double cvar = RiskMeasures.conditionalValueAtRisk(returns, confidence).orElseThrow();

            assertThat(cvar).isGreaterThanOrEqualTo(var);
        }
    }

    @Nested
    @DisplayName("Parametric VaR")
    class ParametricVaR {

        @Test
        @DisplayName("should use mean minus z times standard deviation")
        void shouldUseNormalQuantile() {
            double mean = TimeSeriesStatistics.mean(RETURNS);
            double stdDev = TimeSeriesStatistics.populationStdDev(RETURNS);

            assertThat(RiskMeasures.parametricValueAtRisk(RETURNS, 0.95).orElseThrow())
                    .isCloseTo(-(mean - 1.645 * stdDev), within(1e-12));
            assertThat(RiskMeasures.parametricValueAtRisk(RETURNS, 0.99).orElseThrow())
                    .isCloseTo(-(mean - 2.326 * stdDev), within(1e-12));
        }

        @Test
        @DisplayName("should fall back to the 95% z-value for other levels")
        void shouldFallBackToDefaultZ() {
            assertThat(RiskMeasures.zValue(0.90)).isEqualTo(1.282);
            assertThat(RiskMeasures.zValue(0.975)).isEqualTo(1.645);
        }
    }
}
