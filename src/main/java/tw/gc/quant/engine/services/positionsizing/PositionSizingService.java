package tw.gc.quant.engine.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.entities.Bar;
import tw.gc.quant.engine.indicators.TechnicalIndicatorCalculator;
import tw.gc.quant.engine.statistics.RiskMeasures;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Position Sizing Service implementing the fractional Kelly family.
 *
 * <p>Supported adjustments:
 * <ul>
 *   <li><b>Kelly Criterion</b>: f* = (p*b - q) / b, scaled by the configured fraction</li>
 *   <li><b>Regime Kelly</b>: fraction picked from {@link KellyRegime}</li>
 *   <li><b>Drawdown scaling</b>: linear shrink down to {@code maxDrawdownScale}</li>
 *   <li><b>VaR / CVaR caps</b>: position tail loss kept under a budget</li>
 *   <li><b>Cost drag</b>: Kelly reduced by round-trip cost over average win</li>
 * </ul>
 *
 * <p>Every Kelly result is non-negative and capped at {@code maxYoloPct}.
 */
@Service
@Slf4j
public class PositionSizingService {

    public static final double DEFAULT_MAX_VAR_PCT = 0.02;
    public static final double DEFAULT_MAX_CVAR_PCT = 0.03;
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
    public static final int DEFAULT_ATR_PERIOD = 14;

    private static final double FALLBACK_AVG_WIN = 0.05;
    private static final double MIN_ADAPTIVE_FRACTION = 0.20;
    private static final double MAX_ADAPTIVE_FRACTION = 0.50;
    private static final double FRACTIONAL_QUANTITY_SCALE = 1e8;

    private final QuantProperties.Sizing sizing;
    private final CorrelationTracker correlationTracker;
    private final KellyEstimator kellyEstimator;

    @Autowired
    public PositionSizingService(QuantProperties properties, CorrelationTracker correlationTracker) {
        this(properties.getSizing(), correlationTracker);
    }

    public PositionSizingService(QuantProperties.Sizing sizing, CorrelationTracker correlationTracker) {
        this.sizing = Objects.requireNonNull(sizing, "sizing");
        this.correlationTracker = Objects.requireNonNull(correlationTracker, "correlationTracker");
        sizing.validate();
        this.kellyEstimator = new KellyEstimator(this::kellySize, sizing.getKellyFraction());
    }

    /**
     * Fractional Kelly: {@code clamp(((w * avgWin - (1 - w) * avgLoss) / avgWin) * fraction, 0, maxYoloPct)}.
     *
     * @param avgLoss average losing return as a positive number
     */
    public double kellySize(double winRate, double avgWin, double avgLoss) {
        if (avgLoss == 0.0 || avgWin == 0.0) {
            return 0.0;
        }
        return clampKelly(fullKelly(winRate, avgWin, avgLoss) * sizing.getKellyFraction());
    }

    /**
     * Kelly with the fraction taken from the regime; a null regime uses the configured fraction.
     */
    public double regimeAdjustedKelly(double winRate, double avgWin, double avgLoss, KellyRegime regime) {
        if (avgLoss == 0.0 || avgWin == 0.0) {
            return 0.0;
        }
        double fullKelly = fullKelly(winRate, avgWin, avgLoss);
        if (fullKelly <= 0.0) {
            return 0.0;
        }
        return clampKelly(fullKelly * fractionFor(regime));
    }

    /**
     * Linear scaling from full size at no drawdown to {@code maxDrawdownScale} at the threshold.
     */
    public double drawdownAdjustedKelly(double kellyPct, double currentDrawdown) {
        if (currentDrawdown <= 0.0 || kellyPct <= 0.0) {
            return kellyPct;
        }
        double ddRatio = Math.min(currentDrawdown / sizing.getDrawdownThreshold(), 1.0);
        double scale = 1.0 - ddRatio * (1.0 - sizing.getMaxDrawdownScale());
        return kellyPct * scale;
    }

    /**
     * Kelly fraction in [0.20, 0.50] growing with the number of observed trades.
     */
    public double adaptiveKellyFraction(int sampleSize, KellyRegime regime) {
        double sampleConfidence;
        if (sampleSize < 20) {
            sampleConfidence = 0.60;
        } else if (sampleSize < 50) {
            sampleConfidence = 0.60 + 0.30 * ((sampleSize - 20) / 30.0);
        } else if (sampleSize < 100) {
            sampleConfidence = 0.90 + 0.10 * ((sampleSize - 50) / 50.0);
        } else {
            sampleConfidence = 1.0;
        }
        double fraction = fractionFor(regime) * sampleConfidence;
        return Math.max(MIN_ADAPTIVE_FRACTION, Math.min(fraction, MAX_ADAPTIVE_FRACTION));
    }

    /**
     * Cap the position so that {@code kellyPct * historicalVaR} stays within {@code maxVaRPct}.
     */
    public double varConstrainedKelly(double kellyPct, double[] returns, double maxVaRPct, double confidenceLevel) {
        validateRiskCap(maxVaRPct, "maxVaRPct");
        if (kellyPct <= 0.0) {
            return 0.0;
        }
        if (returns == null || returns.length < RiskMeasures.MIN_RETURNS) {
            return kellyPct;
        }
        return capByTailRisk(kellyPct, RiskMeasures.historicalValueAtRisk(returns, confidenceLevel), maxVaRPct);
    }

    public double varConstrainedKelly(double kellyPct, double[] returns) {
        return varConstrainedKelly(kellyPct, returns, DEFAULT_MAX_VAR_PCT, DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * Cap the position so that {@code kellyPct * CVaR} stays within {@code maxCVaRPct}.
     */
    public double cvarConstrainedKelly(double kellyPct, double[] returns, double maxCVaRPct, double confidenceLevel) {
        validateRiskCap(maxCVaRPct, "maxCVaRPct");
        if (kellyPct <= 0.0) {
            return 0.0;
        }
        if (returns == null || returns.length < RiskMeasures.MIN_RETURNS) {
            return kellyPct;
        }
        return capByTailRisk(kellyPct, RiskMeasures.conditionalValueAtRisk(returns, confidenceLevel), maxCVaRPct);
    }

    public double cvarConstrainedKelly(double kellyPct, double[] returns) {
        return cvarConstrainedKelly(kellyPct, returns, DEFAULT_MAX_CVAR_PCT, DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * {@code max(0, kelly - roundTripCost / avgWin)}.
     */
    public double costAdjustedKelly(double kellyPct, double roundTripCostPct, double avgWin) {
        if (kellyPct <= 0.0 || avgWin <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, kellyPct - roundTripCostPct / avgWin);
    }

    /**
     * Kelly for a named strategy: the rolling estimate from at least 10 trades when it shows an
     * edge, otherwise the strategy's prior win rate and reward/risk.
     *
     * @return 0 for an unknown strategy without usable history
     */
    public double strategyKellySize(String strategyName, KellyRegime regime, List<TradeOutcome> trades) {
        if (trades != null && trades.size() >= KellyEstimator.MIN_TRADES) {
            Optional<KellyEstimate> estimate = kellyEstimator.rollingEstimate(trades);
            if (estimate.isPresent() && estimate.get().kellyPct() > 0.0) {
                KellyEstimate e = estimate.get();
                return regime != null
                        ? regimeAdjustedKelly(e.winRate(), e.avgWin(), e.avgLoss(), regime)
                        : e.kellyPct();
            }
        }

        Optional<StrategyKellyProfile> profile = StrategyKellyProfile.forStrategy(strategyName);
        if (profile.isEmpty()) {
            log.debug("No Kelly profile for strategy {}", strategyName);
            return 0.0;
        }
        double winRate = profile.get().getWinRate();
        double avgWin = profile.get().getRewardRisk();
        double avgLoss = 1.0;
        return regime != null
                ? regimeAdjustedKelly(winRate, avgWin, avgLoss, regime)
                : kellySize(winRate, avgWin, avgLoss);
    }

    /**
     * Population standard deviation of simple returns; 0 with fewer than two closes.
     */
    public double calculateVolatility(double[] closes) {
        Objects.requireNonNull(closes, "closes");
        return TechnicalIndicatorCalculator.returnVolatility(TechnicalIndicatorCalculator.toList(closes));
    }

    public Optional<Double> calculateAtr(List<Bar> bars, int period) {
        return TechnicalIndicatorCalculator.averageTrueRange(bars, period);
    }

    public Optional<Double> calculateAtr(List<Bar> bars) {
        return calculateAtr(bars, DEFAULT_ATR_PERIOD);
    }

    /**
     * Inverse-volatility weights summing to 1; entries with non-positive volatility are dropped.
     */
    public Map<String, Double> riskParityWeights(Map<String, Double> volatilities) {
        Map<String, Double> weights = new LinkedHashMap<>();
        if (volatilities == null) {
            return weights;
        }
        double totalInverse = 0.0;
        for (Double vol : volatilities.values()) {
            if (vol != null && vol > 0.0) {
                totalInverse += 1.0 / vol;
            }
        }
        if (totalInverse == 0.0) {
            return weights;
        }
        for (Map.Entry<String, Double> entry : volatilities.entrySet()) {
            Double vol = entry.getValue();
            if (vol != null && vol > 0.0) {
                weights.put(entry.getKey(), (1.0 / vol) / totalInverse);
            }
        }
        return weights;
    }

    public Map<String, Double> portfolioKelly(List<PositionCandidate> candidates) {
        return correlationTracker.portfolioKelly(candidates);
    }

    public KellyEstimator getKellyEstimator() {
        return kellyEstimator;
    }

    /**
     * Size one order.
     *
     * <p>The base estimate comes from the strategy's trade history or profile when no explicit
     * statistics are given, otherwise from the explicit win rate and averages. Adaptive fraction,
     * drawdown, CVaR (or VaR) and cost adjustments follow in that order and each appends a tag to
     * {@link PositionSizingResult#method()}. Without a Kelly edge the size falls back to a
     * confidence-scaled {@code standard} or {@code yolo} allocation. Volatility scaling and the
     * {@code maxYoloPct} clamp always apply last.
     */
    public PositionSizingResult calculate(PositionSizingRequest request) {
        Objects.requireNonNull(request, "request");
        double confidence = request.getConfidence();
        if (request.getPortfolioValue() <= 0.0 || request.getPrice() <= 0.0 || confidence <= 0.0) {
            return PositionSizingResult.none("Invalid inputs");
        }

        KellyRegime regime = request.getRegime();
        List<TradeOutcome> trades = request.getTrades();
        double positionPct = 0.0;
        String method = null;

        if (request.getStrategyName() != null && request.getWinRate() == null) {
            double kellyPct = 0.0;
            if (request.isUseExponentialWeighting() && trades != null && trades.size() >= KellyEstimator.MIN_TRADES) {
                Optional<KellyEstimate> estimate = kellyEstimator.exponentialEstimate(trades);
                if (estimate.isPresent() && estimate.get().kellyPct() > 0.0) {
                    kellyPct = estimate.get().kellyPct();
                    method = "kelly+exp_weighted";
                }
            }
            if (method == null) {
                kellyPct = strategyKellySize(request.getStrategyName(), regime, trades);
                if (kellyPct > 0.0) {
                    method = regime != null ? "kelly+regime" : "kelly+strategy";
                }
            }
            if (method != null && request.isUseAdaptiveFraction() && trades != null) {
                double adaptiveFraction = adaptiveKellyFraction(trades.size(), regime);
                double appliedFraction = method.equals("kelly+regime") ? fractionFor(regime) : sizing.getKellyFraction();
                kellyPct = (kellyPct / appliedFraction) * adaptiveFraction;
                method += "+adaptive";
            }
            if (method != null) {
                positionPct = kellyPct * confidence;
            }
        }

        if (method == null && request.hasExplicitStats()) {
            double kellyPct;
            String kellyMethod;
            if (regime != null) {
                kellyPct = regimeAdjustedKelly(request.getWinRate(), request.getAvgWinReturn(),
                        request.getAvgLossReturn(), regime);
                kellyMethod = "kelly+regime";
            } else {
                kellyPct = kellySize(request.getWinRate(), request.getAvgWinReturn(), request.getAvgLossReturn());
                kellyMethod = "kelly";
            }
            if (kellyPct > 0.0) {
                method = kellyMethod;
                if (request.isUseAdaptiveFraction() && trades != null) {
                    double adaptiveFraction = adaptiveKellyFraction(trades.size(), regime);
                    kellyPct = (kellyPct / fractionFor(regime)) * adaptiveFraction;
                    method += "+adaptive";
                }
                positionPct = kellyPct * confidence;
            }
        }

        if (method != null) {
            Double drawdown = request.getCurrentDrawdown();
            if (drawdown != null && drawdown > 0.0) {
                positionPct = drawdownAdjustedKelly(positionPct, drawdown);
                method += "+dd_adjusted";
            }

            double[] returns = request.getReturns();
            if (returns != null && returns.length >= RiskMeasures.MIN_RETURNS) {
                if (request.getMaxCVaRPct() != null) {
                    positionPct = cvarConstrainedKelly(positionPct, returns, request.getMaxCVaRPct(),
                            DEFAULT_CONFIDENCE_LEVEL);
                    method += "+cvar";
                } else if (request.getMaxVaRPct() != null) {
                    positionPct = varConstrainedKelly(positionPct, returns, request.getMaxVaRPct(),
                            DEFAULT_CONFIDENCE_LEVEL);
                    method += "+var";
                }
            }

            Double cost = request.getTransactionCostPct();
            if (cost != null && cost > 0.0) {
                Double avgWin = request.getAvgWinReturn();
                double effectiveAvgWin = avgWin != null && avgWin != 0.0 ? avgWin : FALLBACK_AVG_WIN;
                positionPct = costAdjustedKelly(positionPct, cost, effectiveAvgWin);
                method += "+cost_adj";
            }
        }

        if (method == null) {
            boolean yolo = confidence >= sizing.getYoloThreshold();
            double basePct = yolo ? sizing.getMaxYoloPct() : sizing.getMaxPositionPct();
            positionPct = basePct * confidence;
            method = yolo ? "yolo" : "standard";
        }

        Double volatility = request.getVolatility();
        if (volatility != null && volatility > 0.0) {
            positionPct *= Math.min(sizing.getTargetDailyRisk() / volatility, 1.0);
            method += "+vol_adjusted";
        }

        positionPct = Math.max(0.0, Math.min(positionPct, sizing.getMaxYoloPct()));
        double value = request.getPortfolioValue() * positionPct;

        if (value < sizing.getMinPositionValue()) {
            log.debug("Skipping {} sized position worth {}", method, value);
            return PositionSizingResult.skip(String.format(Locale.ROOT,
                    "Position value $%.2f below minimum $%.2f", value, sizing.getMinPositionValue()));
        }

        double price = request.getPrice();
        double quantity = Math.floor(value / price);
        if (quantity == 0.0) {
            quantity = Math.round((value / price) * FRACTIONAL_QUANTITY_SCALE) / FRACTIONAL_QUANTITY_SCALE;
        }

        log.debug("📊 Sized {} units at {} via {} ({}% of portfolio)", quantity, price, method, positionPct * 100.0);
        return new PositionSizingResult(quantity, quantity * price, method, positionPct * 100.0, null);
    }

    private static double fullKelly(double winRate, double avgWin, double avgLoss) {
        return (winRate * avgWin - (1.0 - winRate) * avgLoss) / avgWin;
    }

    private double fractionFor(KellyRegime regime) {
        return regime != null ? regime.getKellyFraction() : sizing.getKellyFraction();
    }

    private double clampKelly(double kelly) {
        return Math.max(0.0, Math.min(kelly, sizing.getMaxYoloPct()));
    }

    private static double capByTailRisk(double kellyPct, Optional<Double> tailRisk, double cap) {
        if (tailRisk.isEmpty() || tailRisk.get() <= 0.0) {
            return kellyPct;
        }
        double risk = tailRisk.get();
        return kellyPct * risk > cap ? cap / risk : kellyPct;
    }

    private static void validateRiskCap(double cap, String name) {
        if (cap <= 0.0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
