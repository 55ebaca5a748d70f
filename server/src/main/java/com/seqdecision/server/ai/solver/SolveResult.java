package com.seqdecision.server.ai.solver;

/**
 * Outcome of a value iteration run. When {@code converged} is false the
 * values are the last sweep's array, not a fixed point.
 */
public class SolveResult {
    private final double[] values;
    private final int iterations;
    private final double residual;
    private final double[] residualTrace;
    private final boolean converged;

    public SolveResult(double[] values, int iterations, double residual, double[] residualTrace, boolean converged) {
        this.values = values;
        this.iterations = iterations;
        this.residual = residual;
        this.residualTrace = residualTrace;
        this.converged = converged;
    }

    public double[] getValues() {
        return values.clone();
    }

    public int getIterations() {
        return iterations;
    }

    public double getResidual() {
        return residual;
    }

    /** Max absolute change of each sweep, in order. */
    public double[] getResidualTrace() {
        return residualTrace.clone();
    }

    public boolean isConverged() {
        return converged;
    }

    @Override
    public String toString() {
        return "SolveResult{" +
                "iterations=" + iterations +
                ", residual=" + String.format("%.3e", residual) +
                ", converged=" + converged +
                '}';
    }
}
