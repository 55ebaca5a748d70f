package com.seqdecision.server.ai.analysis;

public class CostSweepRow {
    private final double samplingCost;
    private final double beta;
    private final double alpha;
    private final double meanStoppingTime;
    private final double fractionCorrect;
    private final int iterations;

    public CostSweepRow(double samplingCost, double beta, double alpha, double meanStoppingTime,
            double fractionCorrect, int iterations) {
        this.samplingCost = samplingCost;
        this.beta = beta;
        this.alpha = alpha;
        this.meanStoppingTime = meanStoppingTime;
        this.fractionCorrect = fractionCorrect;
        this.iterations = iterations;
    }

    public double getSamplingCost() {
        return samplingCost;
    }

    public double getBeta() {
        return beta;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getMeanStoppingTime() {
        return meanStoppingTime;
    }

    public double getFractionCorrect() {
        return fractionCorrect;
    }

    public int getIterations() {
        return iterations;
    }
}
