package com.seqdecision.server.ai.simulation;

public class StoppingTimeExceededException extends RuntimeException {
    private final int draws;
    private final double belief;

    public StoppingTimeExceededException(int draws, double belief) {
        super(String.format("No decision after %d draws (belief=%.6f)", draws, belief));
        this.draws = draws;
        this.belief = belief;
    }

    public int getDraws() {
        return draws;
    }

    public double getBelief() {
        return belief;
    }
}
