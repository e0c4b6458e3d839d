package tw.gc.quant.engine.services.execution;

import org.junit.jupiter.api.*;
import tw.gc.quant.engine.entities.Trade.TradeSide;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for SlippageProvider functional interface.
 */
@DisplayName("SlippageProvider Tests")
class SlippageProviderTest {

    private static SlippageProvider.SlippageContext context(double quantity, double avgVolume, double volatility) {
        return new SlippageProvider.SlippageContext(TradeSide.BUY, quantity, 100.0, avgVolume, volatility);
    }

    // ==================== Fixed Provider Tests ====================

    @Nested
    @DisplayName("Fixed Slippage Provider Tests")
    class FixedProviderTests {

        @Test
        @DisplayName("should convert basis points to a rate")
        void shouldConvertBps() {
            SlippageProvider provider = SlippageProvider.fixed(10.0);

            assertThat(provider.calculateSlippage(context(100, 1_000_000, 0.01))).isCloseTo(0.001, within(1e-15));
        }

        @Test
        @DisplayName("should ignore context for fixed rate")
        void shouldIgnoreContext() {
            SlippageProvider provider = SlippageProvider.fixed(5.0);

            assertThat(provider.calculateSlippage(context(100, 1_000, 0.0)))
                    .isEqualTo(provider.calculateSlippage(context(50_000, 10_000_000, 0.08)));
        }
    }

    // ==================== Volume Impact Tests ====================

    @Nested
    @DisplayName("Volume Impact Provider Tests")
    class VolumeImpactTests {

        @Test
        @DisplayName("should apply square-root impact")
        void shouldApplySquareRootImpact() {
            SlippageProvider provider = SlippageProvider.volumeImpact(0.1, 5.0);

            // 0.1 * sqrt(10_000 / 1_000_000)
            assertThat(provider.calculateSlippage(context(10_000, 1_000_000, 0.0))).isCloseTo(0.01, within(1e-12));
        }

        @Test
        @DisplayName("should cap impact for orders larger than average volume")
        void shouldCapImpactForHugeOrders() {
            SlippageProvider provider = SlippageProvider.volumeImpact(0.1, 5.0);

            // uncapped: 0.1 * sqrt(200) > 1.4
            assertThat(provider.calculateSlippage(context(200, 1, 0.0))).isEqualTo(SlippageProvider.MAX_IMPACT_RATE);
            assertThat(provider.calculateSlippage(context(1_000_000, 1_000_000, 0.0)))
                    .isEqualTo(SlippageProvider.MAX_IMPACT_RATE);
        }

        @Test
        @DisplayName("should fall back to fixed rate without volume")
        void shouldFallBackWithoutVolume() {
            SlippageProvider provider = SlippageProvider.volumeImpact(0.1, 5.0);

            assertThat(provider.calculateSlippage(context(10_000, 0.0, 0.0))).isCloseTo(0.0005, within(1e-15));
            assertThat(provider.calculateSlippage(context(0.0, 1_000_000, 0.0))).isCloseTo(0.0005, within(1e-15));
        }
    }

    // ==================== Volatility Scaled Tests ====================

    @Nested
    @DisplayName("Volatility Scaled Provider Tests")
    class VolatilityScaledTests {

        @Test
        @DisplayName("should widen slippage above reference volatility")
        void shouldWidenInVolatileMarkets() {
            SlippageProvider provider = SlippageProvider.volatilityScaled(5.0);

            assertThat(provider.calculateSlippage(context(100, 0, 0.04))).isCloseTo(0.001, within(1e-12));
        }

        @Test
        @DisplayName("should never go below the base rate")
        void shouldKeepBaseRateInCalmMarkets() {
            SlippageProvider provider = SlippageProvider.volatilityScaled(5.0);

            assertThat(provider.calculateSlippage(context(100, 0, 0.01))).isCloseTo(0.0005, within(1e-15));
            assertThat(provider.calculateSlippage(context(100, 0, 0.0))).isCloseTo(0.0005, within(1e-15));
        }
    }

    // ==================== Capped Provider Tests ====================

    @Nested
    @DisplayName("Capped Provider Tests")
    class CappedProviderTests {

        @Test
        @DisplayName("should cap slippage at maximum")
        void shouldCapSlippageAtMaximum() {
            SlippageProvider capped = SlippageProvider.volumeImpact(0.1, 5.0).capped(0.005);

            assertThat(capped.calculateSlippage(context(10_000, 1_000_000, 0.0))).isEqualTo(0.005);
            assertThat(capped.calculateSlippage(context(10_000, 0.0, 0.0))).isCloseTo(0.0005, within(1e-15));
        }
    }

    // ==================== Model Selection Tests ====================

    @Nested
    @DisplayName("Model Selection Tests")
    class ModelSelectionTests {

        @Test
        @DisplayName("should build the provider for each model type")
        void shouldBuildProviderForModel() {
            SlippageProvider.SlippageContext ctx = context(10_000, 1_000_000, 0.04);

            assertThat(SlippageProvider.forModel(SlippageModelType.FIXED, 5.0, 0.1).calculateSlippage(ctx))
                    .isCloseTo(0.0005, within(1e-15));
            assertThat(SlippageProvider.forModel(SlippageModelType.VOLUME, 5.0, 0.1).calculateSlippage(ctx))
                    .isCloseTo(0.01, within(1e-12));
            assertThat(SlippageProvider.forModel(SlippageModelType.VOLATILITY, 5.0, 0.1).calculateSlippage(ctx))
                    .isCloseTo(0.001, within(1e-12));
        }

        @Test
        @DisplayName("should parse model names")
        void shouldParseModelNames() {
            assertThat(SlippageModelType.fromName(null)).isEqualTo(SlippageModelType.FIXED);
            assertThat(SlippageModelType.fromName(" ")).isEqualTo(SlippageModelType.FIXED);
            assertThat(SlippageModelType.fromName("volume")).isEqualTo(SlippageModelType.VOLUME);
            assertThatThrownBy(() -> SlippageModelType.fromName("quadratic"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown slippage model: quadratic");
        }
    }
}
