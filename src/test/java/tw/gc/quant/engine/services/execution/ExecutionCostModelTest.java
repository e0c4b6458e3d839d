package tw.gc.quant.engine.services.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.entities.Trade.TradeSide;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExecutionCostModel")
class ExecutionCostModelTest {

    private ExecutionCostModel model;

    @BeforeEach
    void setUp() {
        model = ExecutionCostModel.fixed(10.0, 10.0);
    }

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("should fill buys above and sells below the quote")
        void shouldApplySlippageAgainstTheTrader() {
            assertThat(model.executionPrice(TradeSide.BUY, 100.0)).isCloseTo(100.10, within(1e-9));
            assertThat(model.executionPrice(TradeSide.SELL, 100.0)).isCloseTo(99.90, within(1e-9));
            assertThat(model.getFills()).isZero();
        }

        @Test
        @DisplayName("should charge commission on the realized notional")
        void shouldChargeCommission() {
            ExecutionCostModel.Fill buy = model.execute(TradeSide.BUY, 100.0, 10);

            assertThat(buy.realizedPrice()).isCloseTo(100.10, within(1e-9));
            assertThat(buy.slippage()).isCloseTo(1.0, within(1e-9));
            assertThat(buy.commission()).isCloseTo(1.001, within(1e-9));
        }

        @Test
        @DisplayName("should count slippage as a cost for short quantities too")
        void shouldUseAbsoluteQuantity() {
            ExecutionCostModel.Fill sell = model.execute(TradeSide.SELL, 100.0, -10);

            assertThat(sell.slippage()).isCloseTo(1.0, within(1e-9));
            assertThat(sell.commission()).isCloseTo(0.999, within(1e-9));
        }

        @Test
        @DisplayName("should use the volume model when configured")
        void shouldUseVolumeModel() {
            ExecutionCostModel volume = new ExecutionCostModel(5.0, 0.0, SlippageModelType.VOLUME, 0.1);

            ExecutionCostModel.Fill fill = volume.execute(TradeSide.BUY, 100.0, 10_000, 1_000_000, 0.0);

            assertThat(fill.realizedPrice()).isCloseTo(101.0, within(1e-9));
            assertThat(fill.commission()).isZero();
        }

        @Test
        @DisplayName("should keep a huge volume-model sell above zero")
        void shouldKeepHugeSellPositive() {
            ExecutionCostModel volume = new ExecutionCostModel(5.0, 0.0, SlippageModelType.VOLUME, 0.5);

            // 0.5 * sqrt(40_000 / 100) = 10 without the cap
            ExecutionCostModel.Fill fill = volume.execute(TradeSide.SELL, 100.0, 40_000, 100, 0.0);

            assertThat(fill.realizedPrice()).isCloseTo(90.0, within(1e-9));
            assertThat(fill.slippage()).isCloseTo(10.0 * 40_000, within(1e-6));
        }
    }

    @Nested
    @DisplayName("Totals")
    class Totals {

        @Test
        @DisplayName("should accumulate costs across fills")
        void shouldAccumulate() {
            model.execute(TradeSide.BUY, 100.0, 10);
            model.execute(TradeSide.SELL, 100.0, 10);

            assertThat(model.getFills()).isEqualTo(2);
            assertThat(model.getTotalSlippage()).isCloseTo(2.0, within(1e-9));
            assertThat(model.getTotalCommission()).isCloseTo(2.0, within(1e-9));

            ExecutionCostSummary summary = model.summary(40.0);
            assertThat(summary.totalCosts()).isCloseTo(4.0, within(1e-9));
            assertThat(summary.costPctOfPnl()).isCloseTo(10.0, within(1e-6));
        }

        @Test
        @DisplayName("should report zero cost share without P&L")
        void shouldHandleZeroPnl() {
            model.execute(TradeSide.BUY, 100.0, 10);

            assertThat(model.summary(0.0).costPctOfPnl()).isZero();
        }

        @Test
        @DisplayName("should clear totals on reset")
        void shouldReset() {
            model.execute(TradeSide.BUY, 100.0, 10);
            model.reset();

            assertThat(model.getFills()).isZero();
            assertThat(model.getTotalSlippage()).isZero();
            assertThat(model.getTotalCommission()).isZero();
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("should double one-way costs for a round trip")
        void shouldComputeRoundTrip() {
            assertThat(ExecutionCostModel.fixed(5.0, 10.0).roundTripCostBps()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("should build from execution properties")
        void shouldBuildFromProperties() {
            QuantProperties.Execution config = new QuantProperties.Execution();
            config.setSlippageModel("volatility");

            ExecutionCostModel fromConfig = ExecutionCostModel.from(config);

            assertThat(fromConfig.getModelType()).isEqualTo(SlippageModelType.VOLATILITY);
            assertThat(fromConfig.roundTripCostBps()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("should reject negative costs")
        void shouldRejectNegativeCosts() {
            assertThatThrownBy(() -> ExecutionCostModel.fixed(-1.0, 10.0))
                    .isInstanceOf(IllegalArgumentException.class);
            QuantProperties.Execution config = new QuantProperties.Execution();
            config.setCommissionBps(-5.0);
            assertThatThrownBy(() -> ExecutionCostModel.from(config))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
