package com.seqdecision.server.service;

import com.seqdecision.server.ai.Hypothesis;
import com.seqdecision.server.ai.SequentialDecisionModel;
import com.seqdecision.server.ai.analysis.CostSweep;
import com.seqdecision.server.ai.analysis.CostSweepRow;
import com.seqdecision.server.ai.simulation.SimulationOutcome;
import com.seqdecision.server.ai.simulation.StoppingDistribution;
import com.seqdecision.server.ai.solver.ConvergenceFailureException;
import com.seqdecision.server.config.DecisionConfig;
import com.seqdecision.server.config.DecisionConfigLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

@Service
public class SequentialDecisionService {

    private static final Logger logger = LoggerFactory.getLogger(SequentialDecisionService.class);

    private volatile DecisionConfig.ConfigRoot config;
    private volatile SequentialDecisionModel model;
    private volatile boolean isReady = false;

    public boolean isReady() {
        return isReady;
    }

    public SequentialDecisionModel getModel() {
        return model;
    }

    public DecisionConfig.ConfigRoot getConfig() {
        return config;
    }

    @PostConstruct
    public void init() {
        new Thread(() -> {
            try {
                initializeNow();
            } catch (Exception e) {
                logger.error("Failed to initialize sequential decision model", e);
            }
        }, "decision-model-init").start();
    }

    /**
     * Loads the configuration, builds the model and solves it on the calling
     * thread.
     */
    public void initializeNow() throws IOException {
        logger.info("Initializing Sequential Decision Service...");
        DecisionConfig.ConfigRoot loaded = DecisionConfigLoader.load();
        SequentialDecisionModel built = DecisionConfigLoader.buildModel(loaded);
        logger.info("Model: {}, grid={}, {}", built.getLosses(), built.getGrid().size(),
                built.getObservationModel());

        try {
            built.solve();
        } catch (ConvergenceFailureException e) {
            logger.error("Value function did not converge; service stays unavailable: {}", e.getMessage());
            throw e;
        }
        if (built.cutoffs().isDegenerate()) {
            logger.warn("Configured parameters give a policy that never decides; simulations will be refused");
        }

        this.config = loaded;
        this.model = built;
        isReady = true;
        logger.info("Sequential decision model is ready: {}", built.cutoffs());

        if (loaded.sweep != null && Boolean.TRUE.equals(loaded.sweep.enabled)) {
            runConfiguredSweep(loaded.sweep);
        }
    }

    private void runConfiguredSweep(DecisionConfig.SweepConfig sweep) {
        if (sweep.costs == null || sweep.costs.isEmpty()) {
            logger.warn("Cost sweep enabled but no costs configured, skipping");
            return;
        }
        double[] costs = sweep.costs.stream().mapToDouble(Double::doubleValue).toArray();
        int runs = sweep.runs != null ? sweep.runs : DecisionConfigLoader.DEFAULT_RUNS;
        Hypothesis truth = parseHypothesis(sweep.trueDistribution, Hypothesis.F0);

        try {
            List<CostSweepRow> rows = costSweep(costs, runs, truth);
            if (Boolean.TRUE.equals(sweep.printCsv)) {
                System.out.println("\n=== SAMPLING COST SWEEP (truth=" + truth + ") ===");
                System.out.print(CostSweep.toCsv(rows));
            }
            logger.info("Cost sweep complete: {} costs", rows.size());
        } catch (RuntimeException e) {
            logger.error("Cost sweep failed", e);
        }
    }

    public SimulationOutcome simulate(Hypothesis truth, Double prior) {
        double p0 = prior != null ? prior : DecisionConfigLoader.prior(config);
        return model.simulate(truth, p0);
    }

    public StoppingDistribution stoppingDistribution(Integer runs, Hypothesis truth, Double prior) {
        return stoppingDistribution(runs, truth, prior, null);
    }

    /**
     * A null seed gives a new batch on every call; a fixed seed repeats it.
     */
    public StoppingDistribution stoppingDistribution(Integer runs, Hypothesis truth, Double prior, Long seed) {
        int n = runs != null ? runs : DecisionConfigLoader.runs(config);
        double p0 = prior != null ? prior : DecisionConfigLoader.prior(config);
        if (seed != null) {
            return model.stoppingDistribution(n, truth, p0, seed);
        }
        return model.stoppingDistribution(n, truth, p0);
    }

    public List<CostSweepRow> costSweep(double[] costs, int runs, Hypothesis truth) {
        return CostSweep.run(model, costs, runs, truth);
    }

    /**
     * Accepts "F0"/"F1" or "0"/"1"; null or blank gives the fallback.
     */
    public static Hypothesis parseHypothesis(String value, Hypothesis fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        String v = value.trim().toUpperCase();
        switch (v) {
            case "F0":
            case "0":
                return Hypothesis.F0;
            case "F1":
            case "1":
                return Hypothesis.F1;
            default:
                throw new IllegalArgumentException("Unknown distribution '" + value + "', expected F0 or F1");
        }
    }
}
