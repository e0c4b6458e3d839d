package tw.gc.quant.engine.entities;

import lombok.Builder;
import lombok.Value;

/**
 * Trade - one simulated fill recorded by a backtest.
 *
 * <p>{@code price} is the quoted bar price, {@code realizedPrice} the price after slippage.
 * {@code pnl}, {@code durationBars} and {@code exitReason} are only set on fills that close a
 * position; P&amp;L is net of the entry and exit commissions.
 */
@Value
@Builder
public class Trade {

    String symbol;
    TradeSide side;
    double quantity;
    double price;
    double realizedPrice;
    double fee;
    int barIndex;
    Double pnl;
    Integer durationBars;
    String exitReason;

    public boolean isClosing() {
        return pnl != null;
    }

    public enum TradeSide {
        BUY,
        SELL
    }
}
