package com.seqdecision.server.ai.simulation;

import com.seqdecision.server.ai.Hypothesis;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * Repeats the simulator and collects stopping times and correctness.
 *
 * Run i draws from its own generator seeded with {@code seed + i}, so the
 * collected series do not depend on whether runs execute in parallel.
 */
public class StatisticsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsAggregator.class);

    private final Simulator simulator;
    private final long seed;
    private final boolean parallel;
    private final FailurePolicy failurePolicy;

    public StatisticsAggregator(Simulator simulator, long seed) {
        this(simulator, seed, false, FailurePolicy.ABORT);
    }

    public StatisticsAggregator(Simulator simulator, long seed, boolean parallel, FailurePolicy failurePolicy) {
        this.simulator = simulator;
        this.seed = seed;
        this.parallel = parallel;
        this.failurePolicy = failurePolicy != null ? failurePolicy : FailurePolicy.ABORT;
    }

    public StoppingDistribution run(int nRuns, Hypothesis truth) {
        return run(nRuns, truth, Simulator.DEFAULT_PRIOR);
    }

    public StoppingDistribution run(int nRuns, Hypothesis truth, double prior) {
        if (nRuns < 1) {
            throw new IllegalArgumentException("nRuns must be >= 1, got " + nRuns);
        }
        // a degenerate policy fails every run; never let SKIP hide it
        simulator.requireDecisive();

        long start = System.currentTimeMillis();
        IntStream runs = IntStream.range(0, nRuns);
        if (parallel) {
            runs = runs.parallel();
        }
        SimulationOutcome[] outcomes = runs.mapToObj(i -> runOne(i, truth, prior))
                .toArray(SimulationOutcome[]::new);

        int kept = 0;
        for (SimulationOutcome o : outcomes) {
            if (o != null) {
                kept++;
            }
        }
        int[] drawCounts = new int[kept];
        boolean[] correct = new boolean[kept];
        int j = 0;
        for (SimulationOutcome o : outcomes) {
            if (o != null) {
                drawCounts[j] = o.getDraws();
                correct[j] = o.isCorrectFor(truth);
                j++;
            }
        }

        int skipped = nRuns - kept;
        if (skipped > 0) {
            logger.warn("{} of {} runs failed and were skipped", skipped, nRuns);
        }
        StoppingDistribution dist = new StoppingDistribution(truth, drawCounts, correct, skipped);
        logger.info("Simulated {} runs under {} in {} ms: meanDraws={}, fractionCorrect={}",
                nRuns, truth, System.currentTimeMillis() - start,
                String.format("%.3f", dist.meanStoppingTime()), String.format("%.3f", dist.fractionCorrect()));
        return dist;
    }

    private SimulationOutcome runOne(int i, Hypothesis truth, double prior) {
        RandomGenerator rng = new Well19937c(seed + i);
        try {
            return simulator.run(truth, prior, rng);
        } catch (StoppingTimeExceededException e) {
            if (failurePolicy == FailurePolicy.SKIP) {
                logger.debug("Run {} skipped: {}", i, e.getMessage());
                return null;
            }
            throw e;
        }
    }
}
