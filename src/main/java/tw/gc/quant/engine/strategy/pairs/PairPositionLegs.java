package tw.gc.quant.engine.strategy.pairs;

import tw.gc.quant.engine.entities.Trade.TradeSide;

/**
 * The two orders that open a hedged spread position.
 */
public record PairPositionLegs(Leg legA, Leg legB) {

    public record Leg(TradeSide side, double quantity) {
        public Leg {
            if (quantity < 0.0) {
                throw new IllegalArgumentException("quantity must be non-negative");
            }
        }

        /**
         * Quantity signed by side: positive for BUY, negative for SELL.
         */
        public double signedQuantity() {
            return side == TradeSide.BUY ? quantity : -quantity;
        }
    }
}
