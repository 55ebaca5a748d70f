package com.seqdecision.server.ai.simulation;

import com.seqdecision.util.MathUtil;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Inverse-CDF sampling of a support index from a discrete pmf.
 */
public class ObservationSampler {
    private final double[] cdf;

    public ObservationSampler(double[] pmf) {
        if (pmf == null || pmf.length == 0) {
            throw new IllegalArgumentException("pmf must be non-empty");
        }
        this.cdf = MathUtil.cumulativeSum(pmf);
    }

    /**
     * Smallest index k with u < cdf[k].
     *
     * @param u uniform draw in [0, 1)
     */
    public int sample(double u) {
        if (u < 0 || u >= 1) {
            throw new IllegalArgumentException("Uniform draw must be in [0, 1), got: " + u);
        }
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u < cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    public int sample(RandomGenerator rng) {
        return sample(rng.nextDouble());
    }

    public int size() {
        return cdf.length;
    }
}
