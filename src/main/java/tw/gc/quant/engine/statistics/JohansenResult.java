package tw.gc.quant.engine.statistics;

import java.util.List;

/**
 * Two-variable Johansen cointegration test outcome.
 *
 * @param rank                number of cointegrating relations accepted by the trace test at 5% (0, 1 or 2)
 * @param maxEigenRank        the same count from the maximum-eigenvalue test
 * @param traceStatistics     trace statistics for H0: r = 0 and H0: r &le; 1
 * @param maxEigenStatistics  maximum-eigenvalue statistics for the same hypotheses
 * @param eigenvalues         eigenvalues in descending order
 * @param cointegrated        {@code rank >= 1}
 * @param reason              explanation when the test could not be run, otherwise {@code null}
 */
public record JohansenResult(
        int rank,
        int maxEigenRank,
        List<Double> traceStatistics,
        List<Double> maxEigenStatistics,
        List<Double> eigenvalues,
        boolean cointegrated,
        String reason
) {

    public JohansenResult {
        if (rank < 0 || rank > 2 || maxEigenRank < 0 || maxEigenRank > 2) {
            throw new IllegalArgumentException("rank must be between 0 and 2");
        }
        traceStatistics = List.copyOf(traceStatistics);
        maxEigenStatistics = List.copyOf(maxEigenStatistics);
        eigenvalues = List.copyOf(eigenvalues);
    }

    public static JohansenResult notTestable(String reason) {
        return new JohansenResult(0, 0, List.of(0.0, 0.0), List.of(0.0, 0.0), List.of(0.0, 0.0), false, reason);
    }

    public boolean isTestable() {
        return reason == null;
    }

    /**
     * Whether the trace and max-eigenvalue tests accept the same rank.
     */
    public boolean testsAgree() {
        return rank == maxEigenRank;
    }
}
