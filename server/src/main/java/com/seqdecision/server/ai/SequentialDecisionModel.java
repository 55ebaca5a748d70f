package com.seqdecision.server.ai;

import com.seqdecision.server.ai.model.BayesUpdater;
import com.seqdecision.server.ai.model.BeliefGrid;
import com.seqdecision.server.ai.model.ObservationModel;
import com.seqdecision.server.ai.simulation.SimulationOutcome;
import com.seqdecision.server.ai.simulation.Simulator;
import com.seqdecision.server.ai.simulation.StatisticsAggregator;
import com.seqdecision.server.ai.simulation.StoppingDistribution;
import com.seqdecision.server.ai.solver.Cutoffs;
import com.seqdecision.server.ai.solver.DecisionLosses;
import com.seqdecision.server.ai.solver.PolicyExtractor;
import com.seqdecision.server.ai.solver.SolveResult;
import com.seqdecision.server.ai.solver.ValueSolver;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential test between two discrete distributions: solves the optimal
 * stopping problem once, then simulates the resulting cutoff rule.
 *
 * The solved state (value function, cutoffs) is written under this
 * instance's monitor and read-only afterwards. {@link #simulate} and
 * {@link #stoppingDistribution} solve on demand.
 */
public class SequentialDecisionModel {

    private static final Logger logger = LoggerFactory.getLogger(SequentialDecisionModel.class);

    private final ObservationModel observationModel;
    private final BeliefGrid grid;
    private final DecisionLosses losses;
    private final ModelSettings settings;
    private final BayesUpdater updater;
    private final RandomGenerator rng;

    private boolean solved = false;
    private double[] values;
    private Cutoffs cutoffs;
    private SolveResult lastSolveResult;

    public SequentialDecisionModel(double samplingCost, double lossAccept0, double lossAccept1,
            double[] weights0, double[] weights1, int gridSize) {
        this(new DecisionLosses(samplingCost, lossAccept0, lossAccept1), new ObservationModel(weights0, weights1),
                gridSize, ModelSettings.defaults());
    }

    public SequentialDecisionModel(DecisionLosses losses, ObservationModel observationModel, int gridSize,
            ModelSettings settings) {
        if (!(losses.getSamplingCost() > 0)) {
            throw new IllegalArgumentException("Sampling cost must be > 0, got " + losses.getSamplingCost());
        }
        if (losses.getLossAccept0() == 0 && losses.getLossAccept1() == 0) {
            throw new IllegalArgumentException("At least one misclassification loss must be positive");
        }
        this.losses = losses;
        this.observationModel = observationModel;
        this.grid = BeliefGrid.uniform(gridSize);
        this.settings = settings != null ? settings.copy() : ModelSettings.defaults();
        this.updater = new BayesUpdater(observationModel);
        this.rng = new Well19937c(this.settings.seed);
    }

    /**
     * Same distributions, grid and settings with a different sampling cost.
     * The copy starts unsolved.
     */
    public SequentialDecisionModel withSamplingCost(double c) {
        return new SequentialDecisionModel(losses.withSamplingCost(c), observationModel, grid.size(), settings);
    }

    public synchronized double[] solve() {
        return solve(new double[grid.size()]);
    }

    /**
     * Runs value iteration from {@code initial}. On convergence failure
     * nothing is installed: an unsolved model stays unsolved, a solved one
     * keeps its previous solution. The exception carries the partial array;
     * see {@link #adoptValues}.
     */
    public synchronized double[] solve(double[] initial) {
        SolveResult result = newSolver().solve(initial);
        install(result.getValues(), result);
        return result.getValues();
    }

    /**
     * Installs a caller-accepted value array, typically the partial result
     * of a convergence failure.
     */
    public synchronized void adoptValues(double[] accepted) {
        if (accepted.length != grid.size()) {
            throw new IllegalArgumentException("Expected " + grid.size() + " values, got " + accepted.length);
        }
        logger.warn("Adopting externally supplied value function without a converged solve");
        install(accepted.clone(), null);
    }

    private void install(double[] newValues, SolveResult result) {
        this.values = newValues;
        this.cutoffs = new PolicyExtractor(grid, losses, settings.tieTolerance).extract(newValues);
        this.lastSolveResult = result;
        this.solved = true;
        logger.info("Policy for {}: {}", losses, cutoffs);
    }

    private ValueSolver newSolver() {
        return new ValueSolver(observationModel, grid, losses, settings.tolerance, settings.maxIterations,
                settings.parallelSolve, settings.logEveryN);
    }

    public synchronized boolean isSolved() {
        return solved;
    }

    public synchronized double[] valueFunction() {
        requireSolved();
        return values.clone();
    }

    public synchronized Cutoffs cutoffs() {
        requireSolved();
        return cutoffs;
    }

    /**
     * Null until a converged solve, and after {@link #adoptValues}.
     */
    public synchronized SolveResult lastSolveResult() {
        return lastSolveResult;
    }

    private void requireSolved() {
        if (!solved) {
            throw new IllegalStateException("Model has not been solved yet; call solve() first");
        }
    }

    private synchronized Cutoffs ensureSolved() {
        if (!solved) {
            logger.info("No value function present, solving before simulation");
            solve();
        }
        return cutoffs;
    }

    public Simulator simulator() {
        return new Simulator(updater, ensureSolved(), settings.maxDraws);
    }

    public SimulationOutcome simulate(Hypothesis truth) {
        return simulate(truth, Simulator.DEFAULT_PRIOR);
    }

    public SimulationOutcome simulate(Hypothesis truth, double prior) {
        Simulator simulator = simulator();
        synchronized (rng) {
            return simulator.run(truth, prior, rng);
        }
    }

    public SimulationOutcome simulateWithPath(Hypothesis truth, double prior) {
        Simulator simulator = simulator();
        synchronized (rng) {
            return simulator.runWithPath(truth, prior, rng);
        }
    }

    public StoppingDistribution stoppingDistribution(int nRuns, Hypothesis truth) {
        return stoppingDistribution(nRuns, truth, Simulator.DEFAULT_PRIOR);
    }

    /**
     * Each call takes a fresh base seed from the model's generator, so
     * repeated batches differ while a freshly built model repeats its first
     * batch.
     */
    public StoppingDistribution stoppingDistribution(int nRuns, Hypothesis truth, double prior) {
        Simulator simulator = simulator();
        long baseSeed;
        synchronized (rng) {
            baseSeed = rng.nextLong();
        }
        return aggregate(simulator, nRuns, truth, prior, baseSeed);
    }

    /**
     * Batch whose run i is seeded with {@code seed + i}; the same seed always
     * gives the same batch.
     */
    public StoppingDistribution stoppingDistribution(int nRuns, Hypothesis truth, double prior, long seed) {
        return aggregate(simulator(), nRuns, truth, prior, seed);
    }

    private StoppingDistribution aggregate(Simulator simulator, int nRuns, Hypothesis truth, double prior,
            long seed) {
        StatisticsAggregator aggregator = new StatisticsAggregator(simulator, seed, settings.parallelRuns,
                settings.failurePolicy);
        return aggregator.run(nRuns, truth, prior);
    }

    public ObservationModel getObservationModel() {
        return observationModel;
    }

    public BeliefGrid getGrid() {
        return grid;
    }

    public DecisionLosses getLosses() {
        return losses;
    }

    public ModelSettings getSettings() {
        return settings.copy();
    }
}
