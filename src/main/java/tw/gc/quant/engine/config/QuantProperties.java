package tw.gc.quant.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.quant.engine.services.execution.SlippageModelType;
import tw.gc.quant.engine.strategy.pairs.HedgeRatioMethod;

/**
 * Tunable parameters for the cointegration, sizing and backtest engines.
 *
 * <p>Bound from the {@code quant.*} namespace. Defaults below match {@code application.yml};
 * {@link #validate()} rejects inconsistent values at startup.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quant")
public class QuantProperties {

    private Pairs pairs = new Pairs();
    private Kalman kalman = new Kalman();
    private Sizing sizing = new Sizing();
    private Execution execution = new Execution();
    private Backtest backtest = new Backtest();
    private Scanner scanner = new Scanner();

    @Data
    public static class Pairs {
        private int hedgeRatioLookback = 60;
        private int zScorePeriod = 20;
        private double entryZScore = 2.0;
        private double exitZScore = 0.5;
        private double stopZScore = 3.5;
        private int minDataPoints = 60;
        private int hurstMaxLag = 20;
        /**
         * OLS (static, trailing window) or KALMAN (time-varying, innovation spread).
         */
        private String hedgeRatioMethod = "OLS";

        public void validate() {
            if (exitZScore < 0 || exitZScore >= entryZScore) {
                throw new IllegalArgumentException("pairs.exitZScore must be in [0, entryZScore)");
            }
            if (stopZScore <= entryZScore) {
                throw new IllegalArgumentException("pairs.stopZScore must exceed entryZScore");
            }
            if (minDataPoints < 3 || hedgeRatioLookback < 3 || zScorePeriod < 2) {
                throw new IllegalArgumentException("pairs windows are too short");
            }
            if (hurstMaxLag < 10) {
                throw new IllegalArgumentException("pairs.hurstMaxLag must be at least 10");
            }
            HedgeRatioMethod.fromName(hedgeRatioMethod);
        }
    }

    @Data
    public static class Kalman {
        private double delta = 1e-4;
        private double observationNoise = 1e-3;
        private double initialCovariance = 1.0;

        public void validate() {
            if (delta <= 0 || delta >= 1) {
                throw new IllegalArgumentException("kalman.delta must be in (0, 1)");
            }
            if (observationNoise <= 0) {
                throw new IllegalArgumentException("kalman.observationNoise must be positive");
            }
            if (initialCovariance <= 0) {
                throw new IllegalArgumentException("kalman.initialCovariance must be positive");
            }
        }
    }

    @Data
    public static class Sizing {
        private double maxPositionPct = 0.10;
        private double maxYoloPct = 0.25;
        private double yoloThreshold = 0.85;
        private double kellyFraction = 0.33;
        private double minPositionValue = 100.0;
        private double maxDrawdownScale = 0.50;
        private double drawdownThreshold = 0.15;
        private double targetDailyRisk = 0.02;

        public void validate() {
            if (maxPositionPct <= 0 || maxPositionPct > 1) {
                throw new IllegalArgumentException("sizing.maxPositionPct must be in (0, 1]");
            }
            if (maxYoloPct < maxPositionPct || maxYoloPct > 1) {
                throw new IllegalArgumentException("sizing.maxYoloPct must be in [maxPositionPct, 1]");
            }
            if (kellyFraction <= 0 || kellyFraction > 1) {
                throw new IllegalArgumentException("sizing.kellyFraction must be in (0, 1]");
            }
            if (drawdownThreshold <= 0) {
                throw new IllegalArgumentException("sizing.drawdownThreshold must be positive");
            }
            if (maxDrawdownScale < 0 || maxDrawdownScale > 1) {
                throw new IllegalArgumentException("sizing.maxDrawdownScale must be in [0, 1]");
            }
            if (minPositionValue < 0) {
                throw new IllegalArgumentException("sizing.minPositionValue must be non-negative");
            }
            if (targetDailyRisk <= 0) {
                throw new IllegalArgumentException("sizing.targetDailyRisk must be positive");
            }
        }
    }

    @Data
    public static class Execution {
        private double slippageBps = 5.0;
        private double commissionBps = 10.0;
        private double marketImpactCoeff = 0.1;
        /**
         * FIXED, VOLUME or VOLATILITY.
         */
        private String slippageModel = "FIXED";

        public void validate() {
            if (slippageBps < 0 || commissionBps < 0 || marketImpactCoeff < 0) {
                throw new IllegalArgumentException("execution costs must be non-negative");
            }
            SlippageModelType.fromName(slippageModel);
        }
    }

    @Data
    public static class Backtest {
        private double initialBalance = 100_000.0;
        private int lookback = 30;
        private int pairsLookback = 60;
        private double pairsMaxPositionPct = 0.10;
        private double minConfidence = 0.1;
        private double riskFreeRate = 0.0;
        private int monteCarloIterations = 1000;
        private int parallelism = 4;

        public void validate() {
            if (initialBalance <= 0) {
                throw new IllegalArgumentException("backtest.initialBalance must be positive");
            }
            if (lookback < 2 || pairsLookback < 2) {
                throw new IllegalArgumentException("backtest lookbacks must be at least 2");
            }
            if (pairsMaxPositionPct <= 0 || pairsMaxPositionPct > 1) {
                throw new IllegalArgumentException("backtest.pairsMaxPositionPct must be in (0, 1]");
            }
            if (monteCarloIterations <= 0 || parallelism <= 0) {
                throw new IllegalArgumentException("backtest.monteCarloIterations and parallelism must be positive");
            }
        }
    }

    @Data
    public static class Scanner {
        private double minCorrelation = 0.5;
        private int maxResults = 10;
        private double targetHalfLife = 10.0;
    }

    @PostConstruct
    public void validate() {
        pairs.validate();
        kalman.validate();
        sizing.validate();
        execution.validate();
        backtest.validate();
        if (scanner.getMinCorrelation() < 0 || scanner.getMinCorrelation() > 1) {
            throw new IllegalArgumentException("scanner.minCorrelation must be in [0, 1]");
        }
        if (scanner.getMaxResults() <= 0) {
            throw new IllegalArgumentException("scanner.maxResults must be positive");
        }
        if (scanner.getTargetHalfLife() <= 0) {
            throw new IllegalArgumentException("scanner.targetHalfLife must be positive");
        }
    }
}
