package com.marketloop.strategy.btc;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Zero-drift lognormal estimate of P(spot above strike at resolution).
 *
 * <p>{@code d = ln(S/K) / (sigma_daily * sqrt(hours / 24))}, {@code P = N(d)}, clipped to
 * [0.05, 0.95] so the model never claims certainty.
 */
public final class BtcProbabilityModel {

    public static final double DEFAULT_DAILY_VOLATILITY = 0.03;
    static final double MIN_PROBABILITY = 0.05;
    static final double MAX_PROBABILITY = 0.95;

    // Stateless after construction, safe to share
    private static final NormalDistribution NORM = new NormalDistribution();

    private final double dailyVolatility;

    public BtcProbabilityModel() {
        this(DEFAULT_DAILY_VOLATILITY);
    }

    public BtcProbabilityModel(double dailyVolatility) {
        this.dailyVolatility = dailyVolatility;
    }

    public double probabilityAbove(double spot, double strike, double hoursToResolution) {
        if (hoursToResolution <= 0 || spot <= 0 || strike <= 0) {
            return 0.5;
        }
        double sigma = dailyVolatility * Math.sqrt(hoursToResolution / 24.0);
        if (sigma < 1e-9) {
            return spot > strike ? 1.0 : 0.0;
        }
        double probability = NORM.cumulativeProbability(Math.log(spot / strike) / sigma);
        return Math.max(MIN_PROBABILITY, Math.min(MAX_PROBABILITY, probability));
    }
}
