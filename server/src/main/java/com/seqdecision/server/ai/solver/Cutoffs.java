package com.seqdecision.server.ai.solver;

import com.seqdecision.server.ai.simulation.SimulationState;

/**
 * Two-threshold stopping rule: accept hypothesis 1 below beta, accept
 * hypothesis 0 above alpha, keep sampling in between.
 */
public class Cutoffs {
    private final double beta;
    private final double alpha;
    private final double gridLow;
    private final double gridHigh;

    public Cutoffs(double beta, double alpha, double gridLow, double gridHigh) {
        if (beta > alpha) {
            throw new IllegalStateException("Cutoffs out of order: beta=" + beta + " > alpha=" + alpha);
        }
        this.beta = beta;
        this.alpha = alpha;
        this.gridLow = gridLow;
        this.gridHigh = gridHigh;
    }

    public double getBeta() {
        return beta;
    }

    public double getAlpha() {
        return alpha;
    }

    public double width() {
        return alpha - beta;
    }

    /**
     * True when the cutoffs sit on the grid edges, i.e. no interior belief
     * ever triggers a decision.
     */
    public boolean isDegenerate() {
        return beta <= gridLow && alpha >= gridHigh;
    }

    public SimulationState decide(double p) {
        if (p < beta) {
            return SimulationState.ACCEPT_1;
        }
        if (p > alpha) {
            return SimulationState.ACCEPT_0;
        }
        return SimulationState.CONTINUE;
    }

    @Override
    public String toString() {
        return String.format("Cutoffs{beta=%.4f, alpha=%.4f}", beta, alpha);
    }
}
