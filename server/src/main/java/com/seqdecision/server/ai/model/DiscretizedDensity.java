package com.seqdecision.server.ai.model;

import com.seqdecision.util.MathUtil;
import org.apache.commons.math3.distribution.BetaDistribution;

/**
 * Raw observation weights obtained by evaluating a continuous density on an
 * evenly spaced support over [0, 1].
 */
public class DiscretizedDensity {

    public static double[] beta(double a, double b, int supportSize) {
        if (a < 1.0 || b < 1.0) {
            throw new IllegalArgumentException("Beta shape parameters must be >= 1, got a=" + a + ", b=" + b);
        }
        BetaDistribution dist = new BetaDistribution(a, b);
        double[] xs = MathUtil.linspace(0.0, 1.0, supportSize);
        double[] weights = new double[supportSize];
        for (int i = 0; i < supportSize; i++) {
            weights[i] = density(dist, a, b, xs[i]);
        }
        return weights;
    }

    // BetaDistribution.density returns 0 at x=0 and x=1 even when the shape
    // parameter on that side is 1; there the density is b (resp. a).
    private static double density(BetaDistribution dist, double a, double b, double x) {
        if (x == 0.0) {
            return a == 1.0 ? b : 0.0;
        }
        if (x == 1.0) {
            return b == 1.0 ? a : 0.0;
        }
        return dist.density(x);
    }

    public static ObservationModel betaPair(double a0, double b0, double a1, double b1, int supportSize) {
        return new ObservationModel(beta(a0, b0, supportSize), beta(a1, b1, supportSize),
                MathUtil.linspace(0.0, 1.0, supportSize));
    }

    private DiscretizedDensity() {
    }
}
