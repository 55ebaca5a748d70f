package com.seqdecision.server.ai;

import com.seqdecision.server.ai.simulation.FailurePolicy;
import com.seqdecision.server.ai.simulation.Simulator;
import com.seqdecision.server.ai.solver.PolicyExtractor;
import com.seqdecision.server.ai.solver.ValueSolver;

/**
 * Numerical knobs for solving and simulating. None of them change the
 * fixed point beyond tolerance.
 */
public class ModelSettings {
    public double tolerance = ValueSolver.DEFAULT_TOLERANCE;
    public int maxIterations = ValueSolver.DEFAULT_MAX_ITERATIONS;
    public boolean parallelSolve = false;
    public int logEveryN = 50;
    public double tieTolerance = PolicyExtractor.DEFAULT_TIE_TOLERANCE;

    public int maxDraws = Simulator.DEFAULT_MAX_DRAWS;
    public long seed = 12345L;
    public boolean parallelRuns = false;
    public FailurePolicy failurePolicy = FailurePolicy.ABORT;

    public ModelSettings() {
    }

    public static ModelSettings defaults() {
        return new ModelSettings();
    }

    public ModelSettings copy() {
        ModelSettings s = new ModelSettings();
        s.tolerance = this.tolerance;
        s.maxIterations = this.maxIterations;
        s.parallelSolve = this.parallelSolve;
        s.logEveryN = this.logEveryN;
        s.tieTolerance = this.tieTolerance;
        s.maxDraws = this.maxDraws;
        s.seed = this.seed;
        s.parallelRuns = this.parallelRuns;
        s.failurePolicy = this.failurePolicy;
        return s;
    }
}
