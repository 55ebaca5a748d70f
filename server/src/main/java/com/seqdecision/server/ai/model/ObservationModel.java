package com.seqdecision.server.ai.model;

import com.seqdecision.server.ai.Hypothesis;
import com.seqdecision.util.MathUtil;

import java.util.Arrays;

/**
 * Two probability mass functions f0 and f1 over a shared finite support.
 *
 * Raw weights are normalized, floored at {@link #MIN_PROBABILITY} and
 * renormalized, so the likelihood ratio f0[k] / f1[k] is finite at every
 * support point. Instances are immutable.
 */
public class ObservationModel {

    public static final double MIN_PROBABILITY = 1e-8;

    private final double[] support;
    private final double[] f0;
    private final double[] f1;

    public ObservationModel(double[] weights0, double[] weights1) {
        this(weights0, weights1, null);
    }

    public ObservationModel(double[] weights0, double[] weights1, double[] support) {
        validateWeights("f0", weights0);
        validateWeights("f1", weights1);
        if (weights0.length != weights1.length) {
            throw new IllegalArgumentException("f0 and f1 must share a support: lengths " + weights0.length
                    + " and " + weights1.length);
        }
        int k = weights0.length;

        if (support == null) {
            this.support = k == 1 ? new double[] { 0.0 } : MathUtil.linspace(0.0, 1.0, k);
        } else {
            if (support.length != k) {
                throw new IllegalArgumentException("Support has " + support.length + " values but weights have " + k);
            }
            for (int i = 1; i < support.length; i++) {
                if (!(support[i] > support[i - 1])) {
                    throw new IllegalArgumentException("Support values must be strictly increasing");
                }
            }
            this.support = support.clone();
        }

        this.f0 = toPmf(weights0);
        this.f1 = toPmf(weights1);
    }

    private static void validateWeights(String name, double[] weights) {
        if (weights == null || weights.length == 0) {
            throw new IllegalArgumentException(name + " weights must be non-empty");
        }
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            double w = weights[i];
            if (Double.isNaN(w) || Double.isInfinite(w)) {
                throw new IllegalArgumentException(name + " weight at index " + i + " is not finite");
            }
            if (w < 0) {
                throw new IllegalArgumentException(name + " weight at index " + i + " is negative: " + w);
            }
            sum += w;
        }
        if (sum <= 0) {
            throw new IllegalArgumentException(name + " weights are all zero");
        }
    }

    private static double[] toPmf(double[] weights) {
        double[] pmf = MathUtil.normalize(weights);
        for (int i = 0; i < pmf.length; i++) {
            if (pmf[i] < MIN_PROBABILITY) {
                pmf[i] = MIN_PROBABILITY;
            }
        }
        return MathUtil.normalize(pmf);
    }

    public int size() {
        return f0.length;
    }

    public double[] getSupport() {
        return support.clone();
    }

    public double[] getF0() {
        return f0.clone();
    }

    public double[] getF1() {
        return f1.clone();
    }

    public double[] pmf(Hypothesis hypothesis) {
        return hypothesis == Hypothesis.F0 ? getF0() : getF1();
    }

    public double f0(int k) {
        return f0[k];
    }

    public double f1(int k) {
        return f1[k];
    }

    /**
     * Marginal pmf of the next observation when hypothesis 0 has probability p:
     * p*f0 + (1-p)*f1.
     */
    public double[] mixture(double p) {
        double[] mix = new double[f0.length];
        for (int k = 0; k < mix.length; k++) {
            mix[k] = p * f0[k] + (1.0 - p) * f1[k];
        }
        return mix;
    }

    @Override
    public String toString() {
        return "ObservationModel{k=" + f0.length + ", support=[" + support[0] + ", " + support[support.length - 1]
                + "], f0=" + Arrays.toString(Arrays.copyOf(f0, Math.min(3, f0.length))) + "...}";
    }
}
