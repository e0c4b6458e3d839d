package tw.gc.quant.engine.services.positionsizing;

import java.util.Objects;

/**
 * One position considered for portfolio-level Kelly scaling.
 */
public record PositionCandidate(String name, double kellyPct, double[] returns) {

    public PositionCandidate {
        Objects.requireNonNull(name, "name");
        returns = returns == null ? new double[0] : returns.clone();
    }

    @Override
    public double[] returns() {
        return returns.clone();
    }
}
