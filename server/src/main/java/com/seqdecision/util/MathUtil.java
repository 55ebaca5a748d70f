package com.seqdecision.util;

public class MathUtil {

    /**
     * Computes the maximum absolute difference between two arrays.
     */
    public static double maxAbsDelta(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Arrays must have same length");
        }
        double maxDelta = 0.0;
        for (int i = 0; i < a.length; i++) {
            double delta = Math.abs(a[i] - b[i]);
            if (delta > maxDelta) {
                maxDelta = delta;
            }
        }
        return maxDelta;
    }

    /**
     * Divides every entry by the array sum. The caller guarantees a positive sum.
     */
    public static double[] normalize(double[] weights) {
        double sum = 0.0;
        for (double w : weights) {
            sum += w;
        }
        double[] out = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            out[i] = weights[i] / sum;
        }
        return out;
    }

    /**
     * Running sum of a pmf. The last entry is forced to exactly 1.0 so an
     * inverse-CDF lookup can never fall off the end.
     */
    public static double[] cumulativeSum(double[] pmf) {
        double[] cdf = new double[pmf.length];
        double acc = 0.0;
        for (int i = 0; i < pmf.length; i++) {
            acc += pmf[i];
            cdf[i] = acc;
        }
        cdf[cdf.length - 1] = 1.0;
        return cdf;
    }

    /**
     * n evenly spaced points from start to end, both endpoints included exactly.
     */
    public static double[] linspace(double start, double end, int n) {
        if (n < 2) {
            throw new IllegalArgumentException("linspace needs at least 2 points, got " + n);
        }
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = start + (end - start) * i / (n - 1);
        }
        out[n - 1] = end;
        return out;
    }

    public static double clip(double x, double lo, double hi) {
        return Math.max(lo, Math.min(hi, x));
    }

    public static double sum(double[] x) {
        double s = 0.0;
        for (double v : x) {
            s += v;
        }
        return s;
    }
}
