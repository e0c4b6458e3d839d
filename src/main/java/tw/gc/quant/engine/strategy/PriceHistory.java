package tw.gc.quant.engine.strategy;

import tw.gc.quant.engine.entities.Bar;

import java.util.List;
import java.util.Objects;

/**
 * Price window handed to a {@link Strategy}.
 *
 * @param closes       closes of the traded asset (leg A for pairs), oldest first
 * @param candles      full bars of the traded asset, empty when only closes are known
 * @param pairedCloses closes of leg B for pair strategies, {@code null} otherwise
 */
public record PriceHistory(double[] closes, List<Bar> candles, double[] pairedCloses) {

    public PriceHistory {
        Objects.requireNonNull(closes, "closes");
        candles = candles == null ? List.of() : List.copyOf(candles);
    }

    public static PriceHistory of(double[] closes) {
        return new PriceHistory(closes, List.of(), null);
    }

    public static PriceHistory ofBars(List<Bar> bars) {
        return new PriceHistory(Bar.closes(bars), bars, null);
    }

    public static PriceHistory pair(double[] closesA, double[] closesB) {
        Objects.requireNonNull(closesB, "closesB");
        return new PriceHistory(closesA, List.of(), closesB);
    }

    public boolean isPair() {
        return pairedCloses != null;
    }

    public int size() {
        return closes.length;
    }

    public double lastClose() {
        return closes[closes.length - 1];
    }

    public double[] volumes() {
        double[] volumes = new double[candles.size()];
        for (int i = 0; i < candles.size(); i++) {
            volumes[i] = candles.get(i).getVolume();
        }
        return volumes;
    }
}
