package com.seqdecision.server.config;

import java.util.List;

/**
 * Jackson binding for decision_config.json. Missing fields stay null and
 * fall back to defaults where they are read.
 */
public class DecisionConfig {

    public static class ModelConfig {
        public Double samplingCost;
        public Double lossAccept0;
        public Double lossAccept1;
        public Integer gridSize;
    }

    public static class DistributionConfig {
        // either raw weights or Beta shape parameters
        public double[] weights;
        public Double betaA;
        public Double betaB;
    }

    public static class DistributionsConfig {
        public Integer supportSize;
        public DistributionConfig f0;
        public DistributionConfig f1;
    }

    public static class SolverConfig {
        public Double tolerance;
        public Integer maxIterations;
        public Boolean parallel;
        public Integer logEveryN;
        public Double tieTolerance;
    }

    public static class SimulationConfig {
        public Double prior;
        public Integer maxDraws;
        public Long seed;
        public Integer runs;
        public Boolean parallel;
        public String failurePolicy;
    }

    public static class SweepConfig {
        public Boolean enabled;
        public List<Double> costs;
        public Integer runs;
        public String trueDistribution;
        public Boolean printCsv;
    }

    public static class ConfigRoot {
        public ModelConfig model;
        public DistributionsConfig distributions;
        public SolverConfig solver;
        public SimulationConfig simulation;
        public SweepConfig sweep;
    }
}
