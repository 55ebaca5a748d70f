package com.seqdecision.server.ai.solver;

import com.seqdecision.server.ai.model.BeliefGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the cutoffs off a converged value function.
 *
 * beta is the last grid point of the run starting at p=0 where J equals the
 * accept-1 loss p*L1; alpha is the last grid point of the run starting at
 * p=1 where J equals the accept-0 loss (1-p)*L0. Equality is judged within
 * {@code tieTolerance}.
 */
public class PolicyExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PolicyExtractor.class);

    public static final double DEFAULT_TIE_TOLERANCE = 1e-10;

    private final BeliefGrid grid;
    private final DecisionLosses losses;
    private final double tieTolerance;

    public PolicyExtractor(BeliefGrid grid, DecisionLosses losses) {
        this(grid, losses, DEFAULT_TIE_TOLERANCE);
    }

    public PolicyExtractor(BeliefGrid grid, DecisionLosses losses, double tieTolerance) {
        this.grid = grid;
        this.losses = losses;
        this.tieTolerance = tieTolerance;
    }

    public Cutoffs extract(double[] values) {
        int m = grid.size();
        if (values.length != m) {
            throw new IllegalArgumentException("Expected " + m + " values, got " + values.length);
        }

        int betaIdx = 0;
        while (betaIdx + 1 < m && losses.acceptF1(grid.get(betaIdx + 1)) - values[betaIdx + 1] <= tieTolerance) {
            betaIdx++;
        }

        int alphaIdx = m - 1;
        while (alphaIdx - 1 >= 0 && values[alphaIdx - 1] - losses.acceptF0(grid.get(alphaIdx - 1)) >= -tieTolerance) {
            alphaIdx--;
        }

        Cutoffs cutoffs = new Cutoffs(grid.get(betaIdx), grid.get(alphaIdx), grid.first(), grid.last());
        if (cutoffs.isDegenerate()) {
            logger.warn("Degenerate policy: no interior belief triggers a decision ({})", cutoffs);
        } else {
            logger.debug("Extracted {}", cutoffs);
        }
        return cutoffs;
    }
}
