package tw.gc.quant.engine.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import tw.gc.quant.engine.testutil.PriceSeriesFixtures;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TimeSeriesStatistics")
class TimeSeriesStatisticsTest {

    @Nested
    @DisplayName("OLS regression")
    class OlsRegression {

        @Test
        @DisplayName("should recover an exact linear relationship")
        void shouldRecoverExactLine() {
            double[] x = {1, 2, 3, 4, 5, 6};
            double[] y = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                y[i] = 3.0 + 2.0 * x[i];
            }

            OlsResult result = TimeSeriesStatistics.olsRegression(y, x).orElseThrow();

            assertThat(result.alpha()).isCloseTo(3.0, within(1e-9));
            assertThat(result.beta()).isCloseTo(2.0, within(1e-9));
            assertThat(result.rSquared()).isCloseTo(1.0, within(1e-9));
            for (double residual : result.residuals()) {
                assertThat(residual).isCloseTo(0.0, within(1e-9));
            }
            assertThat(result.observations()).isEqualTo(6);
        }

        @Test
        @DisplayName("residuals should sum to zero with an intercept")
        void residualsShouldSumToZero() {
            double[][] pair = PriceSeriesFixtures.cointegratedPair(80, null);

            OlsResult result = TimeSeriesStatistics.olsRegression(pair[0], pair[1]).orElseThrow();

            double sum = 0.0;
            for (double residual : result.residuals()) {
                sum += residual;
            }
            assertThat(sum).isCloseTo(0.0, within(1e-6));
            assertThat(result.beta()).isCloseTo(1.5, within(0.05));
        }

        @Test
        @DisplayName("should return empty for degenerate input")
        void shouldReturnEmptyForDegenerateInput() {
            assertThat(TimeSeriesStatistics.olsRegression(new double[]{1, 2}, new double[]{1, 2})).isEmpty();
            assertThat(TimeSeriesStatistics.olsRegression(new double[]{1, 2, 3}, new double[]{1, 2})).isEmpty();
            assertThat(TimeSeriesStatistics.olsRegression(new double[]{1, 2, 3, 4}, new double[]{5, 5, 5, 5})).isEmpty();
        }

        @Test
        @DisplayName("should report zero R-squared when y is flat")
        void shouldReportZeroRSquaredForFlatY() {
            OlsResult result = TimeSeriesStatistics.olsRegression(new double[]{7, 7, 7, 7}, new double[]{1, 2, 3, 4})
                    .orElseThrow();

            assertThat(result.beta()).isCloseTo(0.0, within(1e-12));
            assertThat(result.rSquared()).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("ADF test")
    class AdfTest {

        @Test
        @DisplayName("should flag an alternating spread as stationary at 1%")
        void shouldFlagAlternatingSpreadAsStationary() {
            AdfResult result = TimeSeriesStatistics.adfTest(PriceSeriesFixtures.alternatingSpread(60));

            assertThat(result.stationary()).isTrue();
            assertThat(result.pValue()).isEqualTo(0.01);
            assertThat(result.statistic()).isLessThan(-3.51);
        }

        @Test
        @DisplayName("should not flag a random walk as stationary")
        void shouldNotFlagRandomWalk() {
            AdfResult result = TimeSeriesStatistics.adfTest(PriceSeriesFixtures.randomWalk(42L, 120, 100.0, 0.01));

            assertThat(result.stationary()).isFalse();
            assertThat(result.pValue()).isGreaterThan(0.05);
        }

        @Test
        @DisplayName("should round the statistic to two decimals")
        void shouldRoundStatistic() {
            AdfResult result = TimeSeriesStatistics.adfTest(PriceSeriesFixtures.randomWalk(11L, 120, 100.0, 0.01));

            assertThat(result.statistic() * 100).isCloseTo(Math.rint(result.statistic() * 100), within(1e-6));
        }

        @Test
        @DisplayName("should be not testable below 20 points or for a flat series")
        void shouldBeNotTestableForShortOrFlatSeries() {
            assertThat(TimeSeriesStatistics.adfTest(PriceSeriesFixtures.alternatingSpread(19)))
                    .isEqualTo(AdfResult.notTestable());
            assertThat(TimeSeriesStatistics.adfTest(PriceSeriesFixtures.constant(50, 3.0)))
                    .isEqualTo(AdfResult.notTestable());
            assertThat(AdfResult.notTestable().pValue()).isEqualTo(1.0);
        }

        @ParameterizedTest(name = "t={0} -> p={1}")
        @CsvSource({
                "-4.00, 0.01",
                "-3.51, 0.01",
                "-3.00, 0.05",
                "-2.70, 0.10",
                "-2.00, 0.30",
                "-1.00, 0.50",
                "1.50, 0.50"
        })
        @DisplayName("should bucket p-values by critical value")
        void shouldBucketPValues(double tStat, double expected) {
            assertThat(TimeSeriesStatistics.adfPValue(tStat)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Hurst exponent")
    class HurstExponent {

        @Test
        @DisplayName("should be low for an anti-persistent spread")
        void shouldBeLowForAntiPersistentSpread() {
            Optional<Double> hurst = TimeSeriesStatistics.hurstExponent(PriceSeriesFixtures.alternatingSpread(60), 20);

            assertThat(hurst).isPresent();
            assertThat(hurst.get()).isLessThan(0.5);
        }

        @Test
        @DisplayName("should rank a random walk above an anti-persistent spread")
        void shouldRankRandomWalkAboveSpread() {
            double walk = TimeSeriesStatistics.hurstExponent(PriceSeriesFixtures.randomWalk(42L, 120, 100.0, 0.01), 20)
                    .orElseThrow();
            double spread = TimeSeriesStatistics.hurstExponent(PriceSeriesFixtures.alternatingSpread(120), 20)
                    .orElseThrow();

            assertThat(walk).isGreaterThan(spread);
            assertThat(walk).isGreaterThan(0.5);
        }

        @Test
        @DisplayName("should return empty below twice the max lag")
        void shouldReturnEmptyForShortSeries() {
            assertThat(TimeSeriesStatistics.hurstExponent(PriceSeriesFixtures.alternatingSpread(39), 20)).isEmpty();
        }

        @Test
        @DisplayName("should fall back to 0.5 when no lag has dispersion")
        void shouldFallBackForFlatSeries() {
            assertThat(TimeSeriesStatistics.hurstExponent(PriceSeriesFixtures.constant(60, 10.0), 20)).contains(0.5);
        }

        @Test
        @DisplayName("should reject a non-positive max lag")
        void shouldRejectNonPositiveMaxLag() {
            assertThatThrownBy(() -> TimeSeriesStatistics.hurstExponent(new double[50], 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Half-life")
    class HalfLife {

        @Test
        @DisplayName("should be short for a fast-reverting spread")
        void shouldBeShortForFastRevertingSpread() {
            Optional<Double> halfLife = TimeSeriesStatistics.halfLife(PriceSeriesFixtures.alternatingSpread(60));

            assertThat(halfLife).isPresent();
            assertThat(halfLife.get()).isBetween(0.2, 0.5);
        }

        @Test
        @DisplayName("should return empty for a diverging series")
        void shouldReturnEmptyForDivergingSeries() {
            assertThat(TimeSeriesStatistics.halfLife(PriceSeriesFixtures.linear(40, 1.0, 1.0))).isEmpty();
        }

        @Test
        @DisplayName("should return empty below 20 points or with no energy")
        void shouldReturnEmptyForShortOrZeroSeries() {
            assertThat(TimeSeriesStatistics.halfLife(PriceSeriesFixtures.alternatingSpread(19))).isEmpty();
            assertThat(TimeSeriesStatistics.halfLife(new double[30])).isEmpty();
        }
    }

    @Nested
    @DisplayName("Z-score")
    class ZScore {

        @Test
        @DisplayName("should use the trailing window with population standard deviation")
        void shouldUseTrailingWindow() {
            double[] series = new double[25];
            for (int i = 0; i < 5; i++) {
                series[i] = 1000.0;
            }
            for (int i = 5; i < 25; i++) {
                series[i] = i - 4;
            }

            double z = TimeSeriesStatistics.zScore(series, 20).orElseThrow();

            // window 1..20: mean 10.5, population std sqrt(399 / 12)
            assertThat(z).isCloseTo(9.5 / Math.sqrt(399.0 / 12.0), within(1e-9));
        }

        @Test
        @DisplayName("should be zero for a flat window and empty when too short")
        void shouldHandleFlatAndShortWindows() {
            assertThat(TimeSeriesStatistics.zScore(PriceSeriesFixtures.constant(30, 5.0), 20)).contains(0.0);
            assertThat(TimeSeriesStatistics.zScore(PriceSeriesFixtures.constant(10, 5.0), 20)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Pearson correlation")
    class PearsonCorrelation {

        @Test
        @DisplayName("should be +1 and -1 for perfectly linear series")
        void shouldDetectPerfectLinearity() {
            double[] x = PriceSeriesFixtures.linear(30, 10.0, 0.5);
            double[] up = PriceSeriesFixtures.linear(30, 3.0, 2.0);
            double[] down = PriceSeriesFixtures.linear(30, 100.0, -1.0);

            assertThat(TimeSeriesStatistics.pearsonCorrelation(x, up)).isCloseTo(1.0, within(1e-12));
            assertThat(TimeSeriesStatistics.pearsonCorrelation(x, down)).isCloseTo(-1.0, within(1e-12));
        }

        @Test
        @DisplayName("should align on the trailing common length")
        void shouldAlignOnTrailingLength() {
            double[] longer = {999, -999, 1, 2, 3, 4, 5};
            double[] shorter = {2, 4, 6, 8, 10};

            assertThat(TimeSeriesStatistics.pearsonCorrelation(longer, shorter)).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("should be zero for short or flat input")
        void shouldBeZeroForDegenerateInput() {
            assertThat(TimeSeriesStatistics.pearsonCorrelation(new double[]{1, 2, 3, 4}, new double[]{1, 2, 3, 4}))
                    .isZero();
            assertThat(TimeSeriesStatistics.pearsonCorrelation(PriceSeriesFixtures.constant(10, 1.0),
                    PriceSeriesFixtures.linear(10, 1.0, 1.0))).isZero();
        }
    }

    @Nested
    @DisplayName("Returns and helpers")
    class Helpers {

        @Test
        @DisplayName("should compute simple and log returns")
        void shouldComputeReturns() {
            double[] prices = {100, 110, 99};

            assertThat(TimeSeriesStatistics.simpleReturns(prices)).containsExactly(new double[]{0.10, -0.10}, within(1e-12));
            assertThat(TimeSeriesStatistics.logReturns(prices)[0]).isCloseTo(Math.log(1.1), within(1e-12));
            assertThat(TimeSeriesStatistics.simpleReturns(new double[]{5})).isEmpty();
            assertThat(TimeSeriesStatistics.simpleReturns(new double[]{0, 5})).containsExactly(0.0);
        }

        @Test
        @DisplayName("should take the tail without mutating the source")
        void shouldTakeTail() {
            double[] values = {1, 2, 3, 4};

            double[] tail = TimeSeriesStatistics.tail(values, 2);
            tail[0] = 42;

            assertThat(tail).containsExactly(42, 4);
            assertThat(values).containsExactly(1, 2, 3, 4);
            assertThat(TimeSeriesStatistics.tail(values, 10)).containsExactly(1, 2, 3, 4);
        }

        @Test
        @DisplayName("should round half up and pass through non-finite values")
        void shouldRound() {
            assertThat(TimeSeriesStatistics.round(2.346, 2)).isCloseTo(2.35, within(1e-12));
            assertThat(TimeSeriesStatistics.round(-1.234, 2)).isCloseTo(-1.23, within(1e-12));
            assertThat(TimeSeriesStatistics.round(1.005, 1)).isEqualTo(1.0);
            assertThat(TimeSeriesStatistics.round(Double.POSITIVE_INFINITY, 2)).isInfinite();
        }
    }
}
