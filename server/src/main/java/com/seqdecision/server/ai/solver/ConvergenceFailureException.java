package com.seqdecision.server.ai.solver;

/**
 * Raised when value iteration exhausts its sweep budget before the residual
 * drops below tolerance. The partial result is attached so the caller can
 * decide whether to accept it or re-run.
 */
public class ConvergenceFailureException extends RuntimeException {
    private final SolveResult partialResult;
    private final double tolerance;

    public ConvergenceFailureException(SolveResult partialResult, double tolerance) {
        super(String.format("Value iteration did not converge after %d sweeps: residual %.3e > tolerance %.3e",
                partialResult.getIterations(), partialResult.getResidual(), tolerance));
        this.partialResult = partialResult;
        this.tolerance = tolerance;
    }

    public SolveResult getPartialResult() {
        return partialResult;
    }

    public double getTolerance() {
        return tolerance;
    }
}
