package com.seqdecision.server.ai.model;

import com.seqdecision.util.MathUtil;

/**
 * Posterior belief in hypothesis 0 after one observation:
 * p' = p*f0[k] / (p*f0[k] + (1-p)*f1[k]), clipped to [0, 1].
 */
public class BayesUpdater {

    private final ObservationModel model;

    public BayesUpdater(ObservationModel model) {
        this.model = model;
    }

    public double update(double p, int k) {
        double num = p * model.f0(k);
        double den = num + (1.0 - p) * model.f1(k);
        return MathUtil.clip(num / den, 0.0, 1.0);
    }

    /**
     * Posterior for every support index at once, aligned with
     * {@link ObservationModel#mixture(double)}.
     */
    public double[] updateAll(double p) {
        double[] out = new double[model.size()];
        for (int k = 0; k < out.length; k++) {
            out[k] = update(p, k);
        }
        return out;
    }

    public ObservationModel getModel() {
        return model;
    }
}
