package tw.gc.quant.engine.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.quant.engine.statistics.TimeSeriesStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation Tracker for scaling concurrent Kelly sizes.
 *
 * <p>Correlated positions behave like one larger position. The portfolio Kelly adjustment
 * shrinks every candidate by {@code 1 / sqrt(1 + (n - 1) * avg|rho|)}, so uncorrelated
 * candidates keep their size and perfectly correlated ones share a single Kelly budget.
 *
 * <p>Key thresholds:
 * <ul>
 *   <li>High correlation warning: &gt; 0.7</li>
 *   <li>Critical correlation: &gt; 0.85</li>
 * </ul>
 */
@Service
@Slf4j
public class CorrelationTracker {

    /**
     * High correlation threshold (warning).
     */
    private static final double HIGH_CORRELATION_THRESHOLD = 0.7;

    /**
     * Critical correlation threshold.
     */
    private static final double CRITICAL_CORRELATION_THRESHOLD = 0.85;

    private static final double MODERATE_CORRELATION_THRESHOLD = 0.3;

    /**
     * Correlation level classification.
     */
    public enum CorrelationLevel {
        NEGATIVE,    // < 0
        LOW,         // 0 - 0.3
        MODERATE,    // 0.3 - 0.7
        HIGH,        // 0.7 - 0.85
        CRITICAL     // > 0.85
    }

    /**
     * Pearson correlation of two return series over their common tail.
     *
     * @return 0 with fewer than 5 aligned observations or a constant series
     */
    public double calculateCorrelation(double[] returns1, double[] returns2) {
        if (returns1 == null || returns2 == null) {
            return 0.0;
        }
        return TimeSeriesStatistics.pearsonCorrelation(returns1, returns2);
    }

    public CorrelationLevel classify(double correlation) {
        if (correlation < 0) {
            return CorrelationLevel.NEGATIVE;
        }
        if (correlation > CRITICAL_CORRELATION_THRESHOLD) {
            return CorrelationLevel.CRITICAL;
        }
        if (correlation > HIGH_CORRELATION_THRESHOLD) {
            return CorrelationLevel.HIGH;
        }
        if (correlation > MODERATE_CORRELATION_THRESHOLD) {
            return CorrelationLevel.MODERATE;
        }
        return CorrelationLevel.LOW;
    }

    /**
     * Scale each candidate's Kelly size for the average absolute pairwise correlation.
     *
     * @param candidates names, Kelly sizes and return histories, in order
     * @return adjusted Kelly size per candidate name, preserving input order
     */
    public Map<String, Double> portfolioKelly(List<PositionCandidate> candidates) {
        Map<String, Double> adjusted = new LinkedHashMap<>();
        if (candidates == null || candidates.isEmpty()) {
            return adjusted;
        }
        if (candidates.size() == 1) {
            PositionCandidate only = candidates.get(0);
            adjusted.put(only.name(), only.kellyPct());
            return adjusted;
        }

        int n = candidates.size();
        double sumAbs = 0.0;
        int pairs = 0;
        List<String> highlyCorrelated = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                PositionCandidate a = candidates.get(i);
                PositionCandidate b = candidates.get(j);
                double rho = calculateCorrelation(a.returns(), b.returns());
                sumAbs += Math.abs(rho);
                pairs++;
                CorrelationLevel level = classify(Math.abs(rho));
                if (level == CorrelationLevel.HIGH || level == CorrelationLevel.CRITICAL) {
                    highlyCorrelated.add(String.format("%s/%s (%.2f)", a.name(), b.name(), rho));
                }
            }
        }
        double avgAbs = sumAbs / pairs;
        double factor = 1.0 / Math.sqrt(1.0 + (n - 1) * avgAbs);

        if (!highlyCorrelated.isEmpty()) {
            log.warn("⚠️ Highly correlated candidates: {}", highlyCorrelated);
        }
        log.debug("📊 Portfolio Kelly: {} candidates, avg |rho|={}, factor={}", n, avgAbs, factor);

        for (PositionCandidate candidate : candidates) {
            adjusted.put(candidate.name(), candidate.kellyPct() * factor);
        }
        return adjusted;
    }
}
