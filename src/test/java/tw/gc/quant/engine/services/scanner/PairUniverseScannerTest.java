package tw.gc.quant.engine.services.scanner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.strategy.pairs.CointegrationResult;
import tw.gc.quant.engine.testutil.PriceSeriesFixtures;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PairUniverseScanner")
class PairUniverseScannerTest {

    private static final int BARS = 120;

    private QuantProperties properties;
    private PairUniverseScanner scanner;

    @BeforeEach
    void setUp() {
        properties = new QuantProperties();
        scanner = new PairUniverseScanner(properties);
    }

    /**
     * Two cointegrated legs, a third leg tied to the second, and two unrelated random walks.
     */
    private static Map<String, double[]> universe() {
        double[][] pair = PriceSeriesFixtures.cointegratedPair(BARS, null);
        double[] b = pair[1];
        double[] c = new double[BARS];
        for (int i = 0; i < BARS; i++) {
            double sign = i % 2 == 0 ? 1.0 : -1.0;
            c[i] = 2.0 * b[i] + 5.0 + sign * (2.0 + 0.5 * Math.cos(0.3 * i));
        }
        Map<String, double[]> universe = new LinkedHashMap<>();
        universe.put("2330.TW", pair[0]);
        universe.put("2303.TW", b);
        universe.put("2317.TW", PriceSeriesFixtures.randomWalk(42, BARS, 100.0, 0.01));
        universe.put("2454.TW", PriceSeriesFixtures.randomWalk(1042, BARS, 50.0, 0.01));
        universe.put("3711.TW", c);
        return universe;
    }

    private static CointegrationResult result(double adf, Double hurst, Double halfLife, boolean johansen) {
        return new CointegrationResult(adf, 0.01, true, hurst, halfLife, johansen ? 1 : 0, johansen, 1.5, 0.9,
                List.of());
    }

    @Nested
    @DisplayName("Scan")
    class Scan {

        @Test
        @DisplayName("should rank cointegrated pairs and drop random walks")
        void shouldRankCointegratedPairs() {
            List<PairScanResult> results = scanner.scan(universe());

            assertThat(results).extracting(PairScanResult::pairName)
                    .containsExactly("2330.TW/2303.TW", "2303.TW/3711.TW", "2330.TW/3711.TW");
            assertThat(results).allSatisfy(r -> {
                assertThat(r.score()).isBetween(0.0, 1.0);
                assertThat(r.cointegration().isTradeable()).isTrue();
            });
            assertThat(results.get(0).score()).isCloseTo(0.867, within(0.01));
            assertThat(results.get(0).correlation()).isGreaterThan(0.99);
        }

        @Test
        @DisplayName("should return nothing for a universe of random walks")
        void shouldIgnoreRandomWalks() {
            Map<String, double[]> walks = new LinkedHashMap<>();
            walks.put("2317.TW", PriceSeriesFixtures.randomWalk(42, BARS, 100.0, 0.01));
            walks.put("2454.TW", PriceSeriesFixtures.randomWalk(1042, BARS, 50.0, 0.01));

            assertThat(scanner.scan(walks)).isEmpty();
            assertThat(scanner.scan(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("should cap the number of results")
        void shouldCapResults() {
            assertThat(scanner.scanTop(universe(), 2)).hasSize(2);
            assertThat(scanner.scanTop(universe())).hasSize(3);
            assertThatThrownBy(() -> scanner.scanTop(universe(), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Score")
    class Score {

        @Test
        @DisplayName("should reach 1.0 for a perfect pair")
        void shouldScorePerfectPair() {
            assertThat(scanner.score(result(-10.0, 0.0, 10.0, true))).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("should score only the available components")
        void shouldScorePartialPair() {
            // ADF half way to saturation, everything else missing
            assertThat(scanner.score(result(-2.5, null, null, false))).isCloseTo(0.175, within(1e-12));
        }

        @Test
        @DisplayName("should reward half-lives near the target")
        void shouldPreferTargetHalfLife() {
            double near = scanner.score(result(-5.0, 0.3, 12.0, true));
            double far = scanner.score(result(-5.0, 0.3, 40.0, true));

            assertThat(near).isGreaterThan(far);
        }
    }
}
