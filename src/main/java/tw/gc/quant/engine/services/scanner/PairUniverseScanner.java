package tw.gc.quant.engine.services.scanner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.statistics.TimeSeriesStatistics;
import tw.gc.quant.engine.strategy.impl.PairsTradingStrategy;
import tw.gc.quant.engine.strategy.pairs.CointegrationResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pair Universe Scanner
 * Runs the pairs cointegration battery over every symbol pair of a universe and ranks the
 * tradeable ones.
 *
 * <p>Price correlation is a cheap pre-filter; only pairs passing it get the ADF, Hurst,
 * half-life and Johansen tests. A pair qualifies when its spread is ADF-stationary and not
 * trending. Score weights:
 * <ul>
 *   <li>ADF strength: 0.35</li>
 *   <li>Hurst quality: 0.25</li>
 *   <li>Half-life close to the target: 0.20</li>
 *   <li>Johansen cointegration bonus: 0.20</li>
 * </ul>
 */
@Service
@Slf4j
public class PairUniverseScanner {

    static final double ADF_WEIGHT = 0.35;
    static final double HURST_WEIGHT = 0.25;
    static final double HALF_LIFE_WEIGHT = 0.20;
    static final double JOHANSEN_WEIGHT = 0.20;

    /** ADF statistic at which the ADF component saturates */
    private static final double ADF_FULL_SCORE_STATISTIC = -5.0;

    private final PairsTradingStrategy strategy;
    private final QuantProperties.Scanner config;

    @Autowired
    public PairUniverseScanner(QuantProperties properties) {
        this(new PairsTradingStrategy(properties.getPairs(), properties.getKalman()), properties.getScanner());
    }

    public PairUniverseScanner(PairsTradingStrategy strategy, QuantProperties.Scanner config) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Scan all pairs, best first. Pair order follows the universe's iteration order, so the
     * first symbol of a result is leg A (the dependent series).
     */
    public List<PairScanResult> scan(Map<String, double[]> universe) {
        Objects.requireNonNull(universe, "universe");
        List<Map.Entry<String, double[]>> symbols = new ArrayList<>(universe.entrySet());
        List<PairScanResult> results = new ArrayList<>();
        int tested = 0;

        for (int i = 0; i < symbols.size(); i++) {
            for (int j = i + 1; j < symbols.size(); j++) {
                String symbolA = symbols.get(i).getKey();
                String symbolB = symbols.get(j).getKey();
                double[] closesA = symbols.get(i).getValue();
                double[] closesB = symbols.get(j).getValue();

                double correlation = TimeSeriesStatistics.pearsonCorrelation(closesA, closesB);
                if (Math.abs(correlation) < config.getMinCorrelation()) {
                    continue;
                }
                tested++;
                Optional<CointegrationResult> evaluation = strategy.evaluateCointegration(closesA, closesB);
                if (evaluation.isEmpty() || !evaluation.get().isTradeable()) {
                    continue;
                }
                CointegrationResult cointegration = evaluation.get();
                results.add(new PairScanResult(symbolA, symbolB, correlation, score(cointegration), cointegration));
            }
        }

        results.sort(Comparator.comparingDouble(PairScanResult::score).reversed());
        log.info("🔍 Pair scan: {} symbols, {} pairs past correlation filter, {} qualified",
                symbols.size(), tested, results.size());
        return results;
    }

    public List<PairScanResult> scanTop(Map<String, double[]> universe, int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        List<PairScanResult> results = scan(universe);
        return results.size() > maxResults ? List.copyOf(results.subList(0, maxResults)) : results;
    }

    public List<PairScanResult> scanTop(Map<String, double[]> universe) {
        return scanTop(universe, config.getMaxResults());
    }

    /**
     * Composite score in [0, 1].
     */
    double score(CointegrationResult result) {
        double adfScore = clamp(result.adfStatistic() / ADF_FULL_SCORE_STATISTIC);
        double hurstScore = result.hurstExponent() == null
                ? 0.0
                : clamp((CointegrationResult.TRENDING_HURST - result.hurstExponent()) / CointegrationResult.TRENDING_HURST);
        double halfLifeScore = 0.0;
        if (result.halfLifeBars() != null) {
            double target = config.getTargetHalfLife();
            halfLifeScore = 1.0 / (1.0 + Math.abs(result.halfLifeBars() - target) / target);
        }
        double johansenScore = result.johansenCointegrated() ? 1.0 : 0.0;
        return ADF_WEIGHT * adfScore + HURST_WEIGHT * hurstScore
                + HALF_LIFE_WEIGHT * halfLifeScore + JOHANSEN_WEIGHT * johansenScore;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(value, 1.0));
    }
}
