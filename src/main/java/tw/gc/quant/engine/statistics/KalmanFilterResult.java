package tw.gc.quant.engine.statistics;

import java.util.List;

/**
 * Full replay of the hedge-ratio filter over a pair of series.
 *
 * @param betas       posterior beta after each observation
 * @param innovations prediction error {@code y - betaPrior * x} at each observation
 * @param finalBeta   last posterior beta
 * @param finalState  filter state after the last observation
 */
public record KalmanFilterResult(List<Double> betas, List<Double> innovations, double finalBeta, KalmanState finalState) {

    public KalmanFilterResult {
        betas = List.copyOf(betas);
        innovations = List.copyOf(innovations);
    }
}
