package com.seqdecision.server.ai.simulation;

import com.seqdecision.server.ai.Hypothesis;
import com.seqdecision.server.ai.model.BayesUpdater;
import com.seqdecision.server.ai.model.ObservationModel;
import com.seqdecision.server.ai.solver.Cutoffs;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the belief process under a fixed cutoff rule until it leaves the
 * continuation region. Stateless between runs; the random source is passed
 * in per run.
 */
public class Simulator {

    private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

    public static final int DEFAULT_MAX_DRAWS = 10_000;
    public static final double DEFAULT_PRIOR = 0.5;

    private final BayesUpdater updater;
    private final Cutoffs cutoffs;
    private final int maxDraws;
    private final ObservationSampler samplerF0;
    private final ObservationSampler samplerF1;

    public Simulator(BayesUpdater updater, Cutoffs cutoffs) {
        this(updater, cutoffs, DEFAULT_MAX_DRAWS);
    }

    public Simulator(BayesUpdater updater, Cutoffs cutoffs, int maxDraws) {
        if (maxDraws < 1) {
            throw new IllegalArgumentException("maxDraws must be >= 1");
        }
        this.updater = updater;
        this.cutoffs = cutoffs;
        this.maxDraws = maxDraws;
        ObservationModel model = updater.getModel();
        this.samplerF0 = new ObservationSampler(model.getF0());
        this.samplerF1 = new ObservationSampler(model.getF1());
    }

    public SimulationOutcome run(Hypothesis truth, double prior, RandomGenerator rng) {
        return run(truth, prior, rng, false);
    }

    public SimulationOutcome runWithPath(Hypothesis truth, double prior, RandomGenerator rng) {
        return run(truth, prior, rng, true);
    }

    private SimulationOutcome run(Hypothesis truth, double prior, RandomGenerator rng, boolean recordPath) {
        if (Double.isNaN(prior) || prior < 0 || prior > 1) {
            throw new IllegalArgumentException("Prior belief must be in [0, 1], got " + prior);
        }
        requireDecisive();

        ObservationSampler sampler = truth == Hypothesis.F0 ? samplerF0 : samplerF1;
        List<Double> path = recordPath ? new ArrayList<>() : null;

        SimulationState state = SimulationState.CONTINUE;
        double belief = prior;
        int draws = 0;

        while (state == SimulationState.CONTINUE) {
            if (draws >= maxDraws) {
                throw new StoppingTimeExceededException(draws, belief);
            }
            int k = sampler.sample(rng);
            draws++;
            belief = updater.update(belief, k);
            state = cutoffs.decide(belief);
            if (path != null) {
                path.add(belief);
            }
            if (logger.isTraceEnabled()) {
                logger.trace("draw {}: k={} belief={} state={}", draws, k, belief, state);
            }
        }

        return new SimulationOutcome(state.toDecision(), belief, draws, path);
    }

    public void requireDecisive() {
        if (cutoffs.isDegenerate()) {
            throw new DegeneratePolicyException(cutoffs);
        }
    }

    public Cutoffs getCutoffs() {
        return cutoffs;
    }

    public int getMaxDraws() {
        return maxDraws;
    }
}
