package tw.gc.quant.engine.services.backtest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioTest {

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio(100_000.0);
    }

    @Test
    void openLong_paysCashAndFee() {
        portfolio.open("2330.TW", 10, 100.0, 1.0, 5);

        assertEquals(98_999.0, portfolio.getCash(), 1e-9);
        assertEquals(100_099.0, portfolio.equity("2330.TW", 110.0), 1e-9);
        assertTrue(portfolio.getPosition("2330.TW").orElseThrow().isLong());
    }

    @Test
    void closeLong_returnsPnlNetOfFees() {
        portfolio.open("2330.TW", 10, 100.0, 1.0, 5);

        double pnl = portfolio.close("2330.TW", 110.0, 1.0);

        assertEquals(98.0, pnl, 1e-9);
        assertEquals(100_098.0, portfolio.getCash(), 1e-9);
        assertTrue(portfolio.isFlat());
    }

    @Test
    void openShort_receivesProceeds() {
        portfolio.open("2454.TW", -10, 100.0, 0.0, 0);

        assertEquals(101_000.0, portfolio.getCash(), 1e-9);
        assertEquals(100_100.0, portfolio.equity("2454.TW", 90.0), 1e-9);
        assertEquals(100.0, portfolio.close("2454.TW", 90.0, 0.0), 1e-9);
    }

    @Test
    void equity_valuesMissingPriceAtEntry() {
        portfolio.open("A", 10, 100.0, 0.0, 0);
        portfolio.open("B", -5, 50.0, 0.0, 0);

        assertEquals(100_000.0, portfolio.equity(Map.of()), 1e-9);
        assertEquals(100_000.0 + 10 * 5.0, portfolio.equity(Map.of("A", 105.0)), 1e-9);
    }

    @Test
    void openTwice_throws() {
        portfolio.open("A", 10, 100.0, 0.0, 0);
        assertThrows(IllegalStateException.class, () -> portfolio.open("A", 5, 101.0, 0.0, 1));
    }

    @Test
    void closeWithoutPosition_throws() {
        assertThrows(IllegalStateException.class, () -> portfolio.close("A", 100.0, 0.0));
    }

    @Test
    void invalidArguments_throw() {
        assertThrows(IllegalArgumentException.class, () -> new Portfolio(0.0));
        assertThrows(IllegalArgumentException.class, () -> portfolio.open("A", 0.0, 100.0, 0.0, 0));
    }

    @Test
    void canAfford_comparesWithCash() {
        assertTrue(portfolio.canAfford(100_000.0));
        assertFalse(portfolio.canAfford(100_000.01));
    }
}
