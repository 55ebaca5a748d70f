package com.seqdecision.server.ai.simulation;

import com.seqdecision.server.ai.solver.Cutoffs;

/**
 * The cutoffs sit on the grid edges, so the policy would sample forever.
 */
public class DegeneratePolicyException extends RuntimeException {
    private final Cutoffs cutoffs;

    public DegeneratePolicyException(Cutoffs cutoffs) {
        super("Policy never decides: " + cutoffs);
        this.cutoffs = cutoffs;
    }

    public Cutoffs getCutoffs() {
        return cutoffs;
    }
}
