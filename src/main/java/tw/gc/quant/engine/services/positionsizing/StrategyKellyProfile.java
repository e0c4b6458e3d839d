package tw.gc.quant.engine.services.positionsizing;

import java.util.Arrays;
import java.util.Optional;

/**
 * Prior win rate and reward/risk per strategy, used when no trade history is available.
 */
public enum StrategyKellyProfile {
    MEAN_REVERSION("mean_reversion", 0.62, 1.2),
    MOMENTUM("momentum", 0.55, 2.0),
    PAIRS_TRADING("pairs_trading", 0.55, 1.5),
    SENTIMENT_MOMENTUM("sentiment_momentum", 0.58, 1.3);

    private final String strategyName;
    private final double winRate;
    private final double rewardRisk;

    StrategyKellyProfile(String strategyName, double winRate, double rewardRisk) {
        this.strategyName = strategyName;
        this.winRate = winRate;
        this.rewardRisk = rewardRisk;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public double getWinRate() {
        return winRate;
    }

    public double getRewardRisk() {
        return rewardRisk;
    }

    public static Optional<StrategyKellyProfile> forStrategy(String strategyName) {
        if (strategyName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(profile -> profile.strategyName.equals(strategyName))
                .findFirst();
    }
}
