package tw.gc.quant.engine.services.scanner;

import tw.gc.quant.engine.strategy.pairs.CointegrationResult;

/**
 * One qualifying pair from a universe scan.
 *
 * @param score composite ranking score in [0, 1]; higher is better
 */
public record PairScanResult(
        String symbolA,
        String symbolB,
        double correlation,
        double score,
        CointegrationResult cointegration
) {

    public String pairName() {
        return symbolA + "/" + symbolB;
    }
}
