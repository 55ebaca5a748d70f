package com.seqdecision.server.ai.solver;

import com.seqdecision.server.ai.model.BayesUpdater;
import com.seqdecision.server.ai.model.BeliefGrid;
import com.seqdecision.server.ai.model.ObservationModel;
import com.seqdecision.util.MathUtil;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Value iteration for the stopping problem
 *
 * J(p) = min( (1-p)*L0, p*L1, c + sum_k mix(p)[k] * J(p'_k) )
 *
 * over a belief grid. J is evaluated off-grid by linear interpolation.
 * Each sweep reads only the previous array and replaces it as a whole
 * (Jacobi update), so grid points can be updated in any order or in
 * parallel.
 */
public class ValueSolver {

    private static final Logger logger = LoggerFactory.getLogger(ValueSolver.class);

    public static final double DEFAULT_TOLERANCE = 1e-7;
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    private final BeliefGrid grid;
    private final DecisionLosses losses;
    private final double tolerance;
    private final int maxIterations;
    private final boolean parallel;
    private final int logEveryN;

    // mix(p) and p'_k do not depend on J, so they are fixed per grid point
    private final double[][] mixtures;
    private final double[][] posteriors;
    private final double[] acceptF0;
    private final double[] acceptF1;

    public ValueSolver(ObservationModel model, BeliefGrid grid, DecisionLosses losses) {
        this(model, grid, losses, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS, false, 50);
    }

    public ValueSolver(ObservationModel model, BeliefGrid grid, DecisionLosses losses, double tolerance,
            int maxIterations, boolean parallel, int logEveryN) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        this.grid = grid;
        this.losses = losses;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.parallel = parallel;
        this.logEveryN = logEveryN;

        BayesUpdater updater = new BayesUpdater(model);
        int m = grid.size();
        this.mixtures = new double[m][];
        this.posteriors = new double[m][];
        this.acceptF0 = new double[m];
        this.acceptF1 = new double[m];
        for (int i = 0; i < m; i++) {
            double p = grid.get(i);
            mixtures[i] = model.mixture(p);
            posteriors[i] = updater.updateAll(p);
            acceptF0[i] = losses.acceptF0(p);
            acceptF1[i] = losses.acceptF1(p);
        }

        if (losses.getSamplingCost() == 0.0) {
            logger.warn("Sampling cost is zero; the Bellman operator is not guaranteed to contract");
        }
    }

    public SolveResult solve() {
        return solve(new double[grid.size()]);
    }

    /**
     * Iterates from {@code initial} until the max absolute change of a sweep
     * falls below tolerance.
     *
     * @throws ConvergenceFailureException if the sweep budget runs out first
     */
    public SolveResult solve(double[] initial) {
        if (initial.length != grid.size()) {
            throw new IllegalArgumentException(
                    "Initial value array has " + initial.length + " entries, grid has " + grid.size());
        }
        logger.info("Solving value function: m={}, {}, tol={}, maxIters={}, parallel={}",
                grid.size(), losses, tolerance, maxIterations, parallel);
        long start = System.currentTimeMillis();

        double[] current = initial.clone();
        double[] trace = new double[maxIterations];
        double residual = Double.POSITIVE_INFINITY;

        for (int iter = 1; iter <= maxIterations; iter++) {
            double[] next = applyBellman(current);
            residual = MathUtil.maxAbsDelta(next, current);
            trace[iter - 1] = residual;
            current = next;

            if (residual < tolerance) {
                logger.info("Value iteration converged in {} sweeps ({} ms), residual={}",
                        iter, System.currentTimeMillis() - start, residual);
                return new SolveResult(current, iter, residual, Arrays.copyOf(trace, iter), true);
            }
            if (logEveryN > 0 && iter % logEveryN == 0) {
                logger.debug("Sweep {}: residual={}", iter, residual);
            }
        }

        logger.warn("Value iteration stopped at maxIters={} with residual={}", maxIterations, residual);
        throw new ConvergenceFailureException(
                new SolveResult(current, maxIterations, residual, trace, false), tolerance);
    }

    /**
     * One synchronous application of the Bellman operator.
     */
    public double[] applyBellman(double[] values) {
        UnivariateFunction interp = grid.interpolant(values);
        double[] out = new double[values.length];
        if (parallel) {
            IntStream.range(0, out.length).parallel().forEach(i -> out[i] = pointValue(i, interp));
        } else {
            for (int i = 0; i < out.length; i++) {
                out[i] = pointValue(i, interp);
            }
        }
        return out;
    }

    private double pointValue(int i, UnivariateFunction interp) {
        double cont = continuationValue(i, interp);
        return Math.min(Math.min(acceptF0[i], acceptF1[i]), cont);
    }

    private double continuationValue(int i, UnivariateFunction interp) {
        double[] mix = mixtures[i];
        double[] post = posteriors[i];
        double expected = 0.0;
        for (int k = 0; k < mix.length; k++) {
            expected += mix[k] * interp.value(post[k]);
        }
        return losses.getSamplingCost() + expected;
    }

    /**
     * Expected loss of drawing one more observation at grid point i and then
     * following {@code values}.
     */
    public double continuationValue(int i, double[] values) {
        return continuationValue(i, grid.interpolant(values));
    }

    public BeliefGrid getGrid() {
        return grid;
    }

    public DecisionLosses getLosses() {
        return losses;
    }

    public double getTolerance() {
        return tolerance;
    }
}
