package tw.gc.quant.engine.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.quant.engine.config.QuantProperties;
import tw.gc.quant.engine.entities.Trade.TradeSide;
import tw.gc.quant.engine.statistics.AdfResult;
import tw.gc.quant.engine.statistics.JohansenCointegration;
import tw.gc.quant.engine.statistics.JohansenResult;
import tw.gc.quant.engine.statistics.KalmanFilterResult;
import tw.gc.quant.engine.statistics.KalmanHedgeRatioFilter;
import tw.gc.quant.engine.statistics.OlsResult;
import tw.gc.quant.engine.statistics.TimeSeriesStatistics;
import tw.gc.quant.engine.strategy.PriceHistory;
import tw.gc.quant.engine.strategy.Strategy;
import tw.gc.quant.engine.strategy.TradeSignal;
import tw.gc.quant.engine.strategy.pairs.CointegrationResult;
import tw.gc.quant.engine.strategy.pairs.HedgeRatioMethod;
import tw.gc.quant.engine.strategy.pairs.PairPositionLegs;
import tw.gc.quant.engine.strategy.pairs.SpreadSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cointegrated Pairs Trading Strategy
 * Type: Statistical Arbitrage / Market Neutral
 *
 * Academic Foundation:
 * - Engle &amp; Granger (1987) - 'Co-Integration and Error Correction'
 * - Gatev, Goetzmann &amp; Rouwenhorst (2006) - 'Pairs Trading: Performance of a Relative-Value Arbitrage Rule'
 *
 * Logic:
 * - Estimate the hedge ratio of A on B and build the spread
 * - Gate on ADF stationarity and a non-trending Hurst exponent
 * - Long the spread (buy A, sell B) when z &le; -entry, short it when z &ge; entry
 * - Exit near the mean, stop out when |z| reaches the stop level
 *
 * Risk: the relationship can break down; the stop and the re-tested gate flatten the position.
 */
@Slf4j
public class PairsTradingStrategy implements Strategy {

    public static final String NAME = "pairs_trading";

    static final double BORDERLINE_HURST = 0.5;
    static final double BORDERLINE_PENALTY = 0.5;
    static final double MAX_CONFIDENCE = 0.95;
    static final double NO_TRADE_CONFIDENCE_SCALE = 0.3;
    static final int KALMAN_BURN_IN = 10;

    private final QuantProperties.Pairs parameters;
    private final QuantProperties.Kalman kalmanParameters;
    private final HedgeRatioMethod hedgeRatioMethod;

    public PairsTradingStrategy() {
        this(new QuantProperties.Pairs(), new QuantProperties.Kalman());
    }

    public PairsTradingStrategy(QuantProperties.Pairs parameters, QuantProperties.Kalman kalmanParameters) {
        parameters.validate();
        kalmanParameters.validate();
        this.parameters = parameters;
        this.kalmanParameters = kalmanParameters;
        this.hedgeRatioMethod = HedgeRatioMethod.fromName(parameters.getHedgeRatioMethod());
    }

    @Override
    public TradeSignal generateSignal(PriceHistory history) {
        if (history == null || !history.isPair()) {
            return TradeSignal.hold("Missing price data");
        }
        return generateSignal(history.closes(), history.pairedCloses());
    }

    /**
     * Evaluate the pair at the last bar of the two aligned series.
     */
    public TradeSignal generateSignal(double[] closesA, double[] closesB) {
        if (closesA == null || closesB == null) {
            return TradeSignal.hold("Missing price data");
        }
        int minLen = Math.min(closesA.length, closesB.length);
        if (minLen < parameters.getMinDataPoints()) {
            return TradeSignal.hold("Insufficient data");
        }

        Optional<SpreadSeries> spreadOpt = computeSpread(closesA, closesB);
        if (spreadOpt.isEmpty()) {
            return TradeSignal.hold("OLS regression failed");
        }
        SpreadSeries spreadSeries = spreadOpt.get();
        double[] spread = spreadSeries.spread();
        double hedgeRatio = spreadSeries.hedgeRatio();

        AdfResult adf = TimeSeriesStatistics.adfTest(spread);
        if (!adf.stationary()) {
            TradeSignal signal = TradeSignal.exit(String.format(Locale.ROOT,
                    "ADF stat=%.2f, p=%.2f: spread NOT stationary, skip", adf.statistic(), adf.pValue()));
            signal.setHedgeRatio(hedgeRatio);
            return signal;
        }
        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(Locale.ROOT, "ADF stat=%.2f, p=%.2f: spread IS stationary", adf.statistic(), adf.pValue()));

        Optional<Double> hurstOpt = TimeSeriesStatistics.hurstExponent(spread, parameters.getHurstMaxLag());
        if (hurstOpt.isEmpty() || hurstOpt.get() >= CointegrationResult.TRENDING_HURST) {
            reasons.add(hurstOpt
                    .map(h -> String.format(Locale.ROOT, "Hurst %.2f >= %.1f: spread trending, skip", h, CointegrationResult.TRENDING_HURST))
                    .orElse("Hurst N/A: spread too short, skip"));
            TradeSignal signal = TradeSignal.exit(reasons.toArray(new String[0]));
            signal.setHedgeRatio(hedgeRatio);
            return signal;
        }
        double hurst = hurstOpt.get();
        boolean meanReverting = hurst < BORDERLINE_HURST;
        double hurstPenalty = meanReverting ? 1.0 : BORDERLINE_PENALTY;

        Optional<Double> zOpt = TimeSeriesStatistics.zScore(spread, parameters.getZScorePeriod());
        if (zOpt.isEmpty()) {
            reasons.add("Z-score computation failed");
            return TradeSignal.hold(reasons.toArray(new String[0]));
        }
        double zScore = zOpt.get();
        Optional<Double> halfLife = TimeSeriesStatistics.halfLife(spread);

        double absZ = Math.abs(zScore);
        if (absZ >= parameters.getStopZScore()) {
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f hit stop at %.1f: EXIT", zScore, parameters.getStopZScore()));
            TradeSignal signal = TradeSignal.exit(reasons.toArray(new String[0]));
            signal.setZScore(zScore);
            signal.setHedgeRatio(hedgeRatio);
            return signal;
        }

        TradeSignal.SignalAction action = TradeSignal.SignalAction.HOLD;
        boolean exitSignal = false;
        if (zScore <= -parameters.getEntryZScore()) {
            action = TradeSignal.SignalAction.BUY;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f <= -%.1f: spread oversold, BUY spread", zScore, parameters.getEntryZScore()));
        } else if (zScore >= parameters.getEntryZScore()) {
            action = TradeSignal.SignalAction.SELL;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f >= %.1f: spread overbought, SELL spread", zScore, parameters.getEntryZScore()));
        } else if (absZ <= parameters.getExitZScore()) {
            exitSignal = true;
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f near mean: EXIT/HOLD", zScore));
        } else {
            reasons.add(String.format(Locale.ROOT, "Z-score %.2f in no-trade zone", zScore));
        }

        double rawConfidence = absZ >= parameters.getEntryZScore()
                ? Math.min((absZ - parameters.getEntryZScore()) / (parameters.getStopZScore() - parameters.getEntryZScore()), MAX_CONFIDENCE)
                : absZ / parameters.getEntryZScore() * NO_TRADE_CONFIDENCE_SCALE;
        double confidence = TimeSeriesStatistics.round(rawConfidence * hurstPenalty, 2);

        reasons.add(String.format(Locale.ROOT, "Hurst: %.2f (%s)", hurst, meanReverting ? "mean-reverting" : "borderline"));
        reasons.add(String.format(Locale.ROOT, "Hedge ratio: %.4f, R²: %.3f", hedgeRatio, spreadSeries.rSquared()));
        halfLife.ifPresent(hl -> reasons.add(String.format(Locale.ROOT, "Half-life: %.1f bars", hl)));

        log.debug("Pair signal {} z={} confidence={} hedge={}", action, zScore, confidence, hedgeRatio);
        return TradeSignal.builder()
                .action(action)
                .confidence(confidence)
                .zScore(zScore)
                .hedgeRatio(hedgeRatio)
                .reasons(reasons)
                .exitSignal(exitSignal)
                .build();
    }

    /**
     * Build the spread over the aligned tail of both series.
     *
     * <p>With OLS the hedge ratio is fit on the trailing {@code hedgeRatioLookback} bars and
     * applied to the entire series. With KALMAN the spread is the filter's innovation series after
     * a short burn-in.
     *
     * @return empty when fewer than {@code minDataPoints} aligned bars or the fit is degenerate
     */
    public Optional<SpreadSeries> computeSpread(double[] closesA, double[] closesB) {
        int n = Math.min(closesA.length, closesB.length);
        if (n < parameters.getMinDataPoints()) {
            return Optional.empty();
        }
        double[] a = TimeSeriesStatistics.tail(closesA, n);
        double[] b = TimeSeriesStatistics.tail(closesB, n);
        return hedgeRatioMethod == HedgeRatioMethod.KALMAN ? kalmanSpread(a, b) : olsSpread(a, b);
    }

    private Optional<SpreadSeries> olsSpread(double[] a, double[] b) {
        int lookback = Math.min(parameters.getHedgeRatioLookback(), a.length);
        Optional<OlsResult> olsOpt = TimeSeriesStatistics.olsRegression(
                TimeSeriesStatistics.tail(a, lookback), TimeSeriesStatistics.tail(b, lookback));
        if (olsOpt.isEmpty()) {
            return Optional.empty();
        }
        OlsResult ols = olsOpt.get();
        double[] spread = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            spread[i] = a[i] - ols.beta() * b[i] - ols.alpha();
        }
        return Optional.of(new SpreadSeries(spread, ols.beta(), ols.alpha(), ols.rSquared(), HedgeRatioMethod.OLS));
    }

    private Optional<SpreadSeries> kalmanSpread(double[] a, double[] b) {
        KalmanHedgeRatioFilter filter = newKalmanFilter();
        Optional<KalmanFilterResult> resultOpt = filter.filter(a, b);
        if (resultOpt.isEmpty() || a.length <= KALMAN_BURN_IN) {
            return Optional.empty();
        }
        KalmanFilterResult result = resultOpt.get();
        List<Double> innovations = result.innovations();
        double[] spread = new double[innovations.size() - KALMAN_BURN_IN];
        for (int i = 0; i < spread.length; i++) {
            spread[i] = innovations.get(i + KALMAN_BURN_IN);
        }

        double meanA = TimeSeriesStatistics.mean(a);
        double ssTotal = 0.0;
        double ssResid = 0.0;
        for (int i = KALMAN_BURN_IN; i < a.length; i++) {
            ssTotal += (a[i] - meanA) * (a[i] - meanA);
            ssResid += innovations.get(i) * innovations.get(i);
        }
        double rSquared = ssTotal > 0.0 ? Math.max(0.0, 1.0 - ssResid / ssTotal) : 0.0;
        return Optional.of(new SpreadSeries(spread, result.finalBeta(), 0.0, rSquared, HedgeRatioMethod.KALMAN));
    }

    /**
     * Run the whole test battery on a pair: spread, ADF, Hurst, half-life and Johansen.
     *
     * @return empty when the spread cannot be built
     */
    public Optional<CointegrationResult> evaluateCointegration(double[] closesA, double[] closesB) {
        Optional<SpreadSeries> spreadOpt = computeSpread(closesA, closesB);
        if (spreadOpt.isEmpty()) {
            return Optional.empty();
        }
        SpreadSeries spreadSeries = spreadOpt.get();
        double[] spread = spreadSeries.spread();

        AdfResult adf = TimeSeriesStatistics.adfTest(spread);
        Double hurst = TimeSeriesStatistics.hurstExponent(spread, parameters.getHurstMaxLag()).orElse(null);
        Double halfLife = TimeSeriesStatistics.halfLife(spread).orElse(null);
        JohansenResult johansen = JohansenCointegration.test(closesA, closesB);

        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(Locale.ROOT, "ADF stat=%.2f, p=%.2f", adf.statistic(), adf.pValue()));
        reasons.add(hurst == null ? "Hurst N/A" : String.format(Locale.ROOT, "Hurst %.2f", hurst));
        reasons.add(halfLife == null ? "Half-life N/A: not mean-reverting" : String.format(Locale.ROOT, "Half-life %.1f bars", halfLife));
        reasons.add(johansen.isTestable()
                ? String.format(Locale.ROOT, "Johansen rank %d (max-eigen %d), trace %.2f", johansen.rank(),
                        johansen.maxEigenRank(), johansen.traceStatistics().get(0))
                : "Johansen: " + johansen.reason());

        return Optional.of(new CointegrationResult(
                adf.statistic(),
                adf.pValue(),
                adf.stationary(),
                hurst,
                halfLife,
                johansen.rank(),
                johansen.cointegrated(),
                spreadSeries.hedgeRatio(),
                spreadSeries.rSquared(),
                reasons
        ));
    }

    /**
     * Orders for a hedged spread position worth {@code notional} across both legs.
     *
     * <p>Long spread buys {@code qtyA} of A and sells {@code qtyA * |hedgeRatio|} of B; short
     * spread is the mirror image.
     *
     * @return empty for HOLD, non-positive prices or non-positive notional
     */
    public Optional<PairPositionLegs> getPositionLegs(TradeSignal.SignalAction action, double hedgeRatio,
                                                      double priceA, double priceB, double notional) {
        if (action == null || action == TradeSignal.SignalAction.HOLD) {
            return Optional.empty();
        }
        if (priceA <= 0.0 || priceB <= 0.0 || notional <= 0.0) {
            return Optional.empty();
        }
        double absHedge = Math.abs(hedgeRatio);
        double qtyA = notional / (priceA + absHedge * priceB);
        double qtyB = qtyA * absHedge;
        boolean longSpread = action == TradeSignal.SignalAction.BUY;
        return Optional.of(new PairPositionLegs(
                new PairPositionLegs.Leg(longSpread ? TradeSide.BUY : TradeSide.SELL, qtyA),
                new PairPositionLegs.Leg(longSpread ? TradeSide.SELL : TradeSide.BUY, qtyB)
        ));
    }

    KalmanHedgeRatioFilter newKalmanFilter() {
        return new KalmanHedgeRatioFilter(kalmanParameters.getDelta(), kalmanParameters.getObservationNoise(),
                kalmanParameters.getInitialCovariance());
    }

    public HedgeRatioMethod getHedgeRatioMethod() {
        return hedgeRatioMethod;
    }

    public QuantProperties.Pairs getParameters() {
        return parameters;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinimumHistory() {
        return parameters.getMinDataPoints();
    }
}
