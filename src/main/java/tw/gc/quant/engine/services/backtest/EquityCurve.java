package tw.gc.quant.engine.services.backtest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Account value sampled once per processed bar, seeded with the starting balance.
 *
 * <p>Append-only while the run is in progress; {@link #freeze()} makes it read-only.
 */
public class EquityCurve {

    private final List<Double> values = new ArrayList<>();
    private boolean frozen;

    public EquityCurve(double seed) {
        values.add(seed);
    }

    public static EquityCurve of(double... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("equity curve needs a seed value");
        }
        EquityCurve curve = new EquityCurve(values[0]);
        for (int i = 1; i < values.length; i++) {
            curve.append(values[i]);
        }
        return curve.freeze();
    }

    /**
     * @throws IllegalStateException once the curve is frozen
     */
    public void append(double equity) {
        if (frozen) {
            throw new IllegalStateException("Equity curve is frozen");
        }
        values.add(equity);
    }

    public EquityCurve freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return values.size();
    }

    public double first() {
        return values.get(0);
    }

    public double last() {
        return values.get(values.size() - 1);
    }

    public List<Double> getValues() {
        return Collections.unmodifiableList(values);
    }

    public double[] toArray() {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
