package com.seqdecision.server.ai.solver;

/**
 * Per-observation sampling cost and the two misclassification losses.
 */
public class DecisionLosses {
    private final double samplingCost;
    private final double lossAccept0;
    private final double lossAccept1;

    /**
     * @param samplingCost c, paid for every observation drawn
     * @param lossAccept0  L0, paid when hypothesis 0 is accepted but f1 is true
     * @param lossAccept1  L1, paid when hypothesis 1 is accepted but f0 is true
     */
    public DecisionLosses(double samplingCost, double lossAccept0, double lossAccept1) {
        requireFiniteNonNegative("samplingCost", samplingCost);
        requireFiniteNonNegative("lossAccept0", lossAccept0);
        requireFiniteNonNegative("lossAccept1", lossAccept1);
        this.samplingCost = samplingCost;
        this.lossAccept0 = lossAccept0;
        this.lossAccept1 = lossAccept1;
    }

    private static void requireFiniteNonNegative(String name, double v) {
        if (Double.isNaN(v) || Double.isInfinite(v) || v < 0) {
            throw new IllegalArgumentException(name + " must be finite and >= 0, got " + v);
        }
    }

    public double getSamplingCost() {
        return samplingCost;
    }

    public double getLossAccept0() {
        return lossAccept0;
    }

    public double getLossAccept1() {
        return lossAccept1;
    }

    /** Expected loss of accepting hypothesis 0 now: (1-p)*L0. */
    public double acceptF0(double p) {
        return (1.0 - p) * lossAccept0;
    }

    /** Expected loss of accepting hypothesis 1 now: p*L1. */
    public double acceptF1(double p) {
        return p * lossAccept1;
    }

    public DecisionLosses withSamplingCost(double c) {
        return new DecisionLosses(c, lossAccept0, lossAccept1);
    }

    @Override
    public String toString() {
        return "DecisionLosses{c=" + samplingCost + ", L0=" + lossAccept0 + ", L1=" + lossAccept1 + '}';
    }
}
