package com.seqdecision.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seqdecision.server.ai.ModelSettings;
import com.seqdecision.server.ai.SequentialDecisionModel;
import com.seqdecision.server.ai.model.DiscretizedDensity;
import com.seqdecision.server.ai.model.ObservationModel;
import com.seqdecision.server.ai.simulation.FailurePolicy;
import com.seqdecision.server.ai.simulation.Simulator;
import com.seqdecision.server.ai.solver.DecisionLosses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class DecisionConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(DecisionConfigLoader.class);

    public static final String CONFIG_PROPERTY = "decision.config";
    public static final String DEFAULT_RESOURCE = "/decision_config.json";

    public static final double DEFAULT_SAMPLING_COST = 0.5;
    public static final double DEFAULT_LOSS = 5.0;
    public static final int DEFAULT_GRID_SIZE = 251;
    public static final int DEFAULT_SUPPORT_SIZE = 50;
    public static final int DEFAULT_RUNS = 1000;

    /**
     * Loads the file named by the {@code decision.config} system property,
     * otherwise the classpath default.
     */
    public static DecisionConfig.ConfigRoot load() throws IOException {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isEmpty()) {
            logger.info("Loading decision config from {}", override);
            return new ObjectMapper().readValue(new File(override), DecisionConfig.ConfigRoot.class);
        }
        try (InputStream is = DecisionConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using built-in defaults", DEFAULT_RESOURCE);
                return new DecisionConfig.ConfigRoot();
            }
            return load(is);
        }
    }

    public static DecisionConfig.ConfigRoot load(InputStream jsonStream) throws IOException {
        return new ObjectMapper().readValue(jsonStream, DecisionConfig.ConfigRoot.class);
    }

    public static SequentialDecisionModel buildModel(DecisionConfig.ConfigRoot config) {
        DecisionConfig.ModelConfig mc = config.model != null ? config.model : new DecisionConfig.ModelConfig();
        double c = mc.samplingCost != null ? mc.samplingCost : DEFAULT_SAMPLING_COST;
        double l0 = mc.lossAccept0 != null ? mc.lossAccept0 : DEFAULT_LOSS;
        double l1 = mc.lossAccept1 != null ? mc.lossAccept1 : DEFAULT_LOSS;
        int m = mc.gridSize != null ? mc.gridSize : DEFAULT_GRID_SIZE;

        ObservationModel observations = buildObservationModel(config.distributions);
        return new SequentialDecisionModel(new DecisionLosses(c, l0, l1), observations, m, buildSettings(config));
    }

    public static ObservationModel buildObservationModel(DecisionConfig.DistributionsConfig dc) {
        DecisionConfig.DistributionsConfig d = dc != null ? dc : new DecisionConfig.DistributionsConfig();
        int k = d.supportSize != null ? d.supportSize : DEFAULT_SUPPORT_SIZE;
        // default pair: two unimodal Beta densities leaning to opposite ends
        double[] w0 = weightsFor("f0", d.f0, k, 2.0, 5.0);
        double[] w1 = weightsFor("f1", d.f1, k, 5.0, 2.0);
        return new ObservationModel(w0, w1);
    }

    private static double[] weightsFor(String name, DecisionConfig.DistributionConfig dc, int k,
            double defaultA, double defaultB) {
        if (dc == null) {
            return DiscretizedDensity.beta(defaultA, defaultB, k);
        }
        if (dc.weights != null) {
            if (dc.betaA != null || dc.betaB != null) {
                logger.warn("{}: both weights and beta parameters given, using weights", name);
            }
            return dc.weights;
        }
        double a = dc.betaA != null ? dc.betaA : defaultA;
        double b = dc.betaB != null ? dc.betaB : defaultB;
        return DiscretizedDensity.beta(a, b, k);
    }

    public static ModelSettings buildSettings(DecisionConfig.ConfigRoot config) {
        ModelSettings s = ModelSettings.defaults();
        if (config.solver != null) {
            DecisionConfig.SolverConfig sc = config.solver;
            if (sc.tolerance != null)
                s.tolerance = sc.tolerance;
            if (sc.maxIterations != null)
                s.maxIterations = sc.maxIterations;
            if (sc.parallel != null)
                s.parallelSolve = sc.parallel;
            if (sc.logEveryN != null)
                s.logEveryN = sc.logEveryN;
            if (sc.tieTolerance != null)
                s.tieTolerance = sc.tieTolerance;
        }
        if (config.simulation != null) {
            DecisionConfig.SimulationConfig sim = config.simulation;
            if (sim.maxDraws != null)
                s.maxDraws = sim.maxDraws;
            if (sim.seed != null)
                s.seed = sim.seed;
            if (sim.parallel != null)
                s.parallelRuns = sim.parallel;
            if (sim.failurePolicy != null) {
                try {
                    s.failurePolicy = FailurePolicy.valueOf(sim.failurePolicy.trim().toUpperCase());
                } catch (IllegalArgumentException e) {
                    logger.warn("Unknown failurePolicy '{}', defaulting to ABORT", sim.failurePolicy);
                    s.failurePolicy = FailurePolicy.ABORT;
                }
            }
        }
        return s;
    }

    public static double prior(DecisionConfig.ConfigRoot config) {
        return config.simulation != null && config.simulation.prior != null ? config.simulation.prior
                : Simulator.DEFAULT_PRIOR;
    }

    public static int runs(DecisionConfig.ConfigRoot config) {
        return config.simulation != null && config.simulation.runs != null ? config.simulation.runs
                : DEFAULT_RUNS;
    }

    private DecisionConfigLoader() {
    }
}
