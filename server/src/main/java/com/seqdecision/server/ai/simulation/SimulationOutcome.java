package com.seqdecision.server.ai.simulation;

import com.seqdecision.server.ai.Hypothesis;

import java.util.List;

public class SimulationOutcome {
    private final Hypothesis decision;
    private final double finalBelief;
    private final int draws;
    private final List<Double> beliefPath;

    public SimulationOutcome(Hypothesis decision, double finalBelief, int draws) {
        this(decision, finalBelief, draws, null);
    }

    public SimulationOutcome(Hypothesis decision, double finalBelief, int draws, List<Double> beliefPath) {
        this.decision = decision;
        this.finalBelief = finalBelief;
        this.draws = draws;
        this.beliefPath = beliefPath;
    }

    public Hypothesis getDecision() {
        return decision;
    }

    public double getFinalBelief() {
        return finalBelief;
    }

    public int getDraws() {
        return draws;
    }

    /**
     * Beliefs after each draw, or null when the path was not recorded.
     */
    public List<Double> getBeliefPath() {
        return beliefPath;
    }

    public boolean isCorrectFor(Hypothesis truth) {
        return decision == truth;
    }

    @Override
    public String toString() {
        return "SimulationOutcome{" +
                "decision=" + decision +
                ", finalBelief=" + String.format("%.4f", finalBelief) +
                ", draws=" + draws +
                '}';
    }
}
