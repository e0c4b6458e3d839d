package tw.gc.quant.engine.entities;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Bar - one OHLCV candle, the only market input of the engines.
 *
 * <p>Sequences of bars are expected in ascending time order. {@code volume} may be zero when the
 * feed does not carry it.
 */
@Value
@Builder
public class Bar {

    LocalDateTime timestamp;
    double open;
    double high;
    double low;
    double close;
    double volume;

    /**
     * A flat bar where open, high, low and close are all {@code close}.
     */
    public static Bar ofClose(LocalDateTime timestamp, double close) {
        return new Bar(timestamp, close, close, close, close, 0.0);
    }

    public static double[] closes(List<Bar> bars) {
        double[] closes = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            closes[i] = bars.get(i).getClose();
        }
        return closes;
    }
}
