package tw.gc.quant.engine.services.backtest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Cash and open positions of a single backtest run.
 *
 * <p>Quantities are signed: positive for long, negative for short. Opening a long pays cash and
 * opening a short receives the sale proceeds, so {@link #equity(Map)} is always cash plus the
 * signed market value of the open positions. Not thread-safe; each run owns its own instance.
 */
public class Portfolio {

    private double cash;
    private final Map<String, Position> positions = new LinkedHashMap<>();

    public Portfolio(double initialCash) {
        if (initialCash <= 0) {
            throw new IllegalArgumentException("initialCash must be positive");
        }
        this.cash = initialCash;
    }

    /**
     * Open a position.
     *
     * @param signedQuantity positive to buy, negative to sell short
     * @param fee            commission paid on entry
     * @throws IllegalStateException when {@code symbol} already has an open position
     */
    public Position open(String symbol, double signedQuantity, double price, double fee, int barIndex) {
        Objects.requireNonNull(symbol, "symbol");
        if (signedQuantity == 0.0) {
            throw new IllegalArgumentException("quantity must be non-zero");
        }
        if (positions.containsKey(symbol)) {
            throw new IllegalStateException("Position already open for " + symbol);
        }
        cash -= signedQuantity * price + fee;
        Position position = new Position(symbol, signedQuantity, price, fee, barIndex);
        positions.put(symbol, position);
        return position;
    }

    /**
     * Close the whole position in {@code symbol}.
     *
     * @return realized P&amp;L net of the entry and exit fees
     * @throws IllegalStateException when there is no open position
     */
    public double close(String symbol, double price, double fee) {
        Position position = positions.remove(symbol);
        if (position == null) {
            throw new IllegalStateException("No open position for " + symbol);
        }
        cash += position.quantity() * price - fee;
        return position.unrealizedPnl(price) - position.entryFee() - fee;
    }

    public boolean canAfford(double cost) {
        return cost <= cash;
    }

    /**
     * Cash plus signed market value; a position without a price in {@code prices} is valued at
     * its entry price.
     */
    public double equity(Map<String, Double> prices) {
        double value = cash;
        for (Position position : positions.values()) {
            Double price = prices.get(position.symbol());
            value += position.quantity() * (price != null ? price : position.avgPrice());
        }
        return value;
    }

    public double equity(String symbol, double price) {
        return equity(Map.of(symbol, price));
    }

    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public boolean hasPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    public boolean isFlat() {
        return positions.isEmpty();
    }

    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public double getCash() {
        return cash;
    }

    /**
     * One open position.
     *
     * @param quantity signed quantity
     * @param avgPrice realized entry price
     */
    public record Position(String symbol, double quantity, double avgPrice, double entryFee, int entryBar) {

        public boolean isLong() {
            return quantity > 0;
        }

        public double unrealizedPnl(double price) {
            return (price - avgPrice) * quantity;
        }
    }
}
