package com.seqdecision.server.ai.simulation;

import com.seqdecision.server.ai.Hypothesis;

public enum SimulationState {
    CONTINUE,
    ACCEPT_0,
    ACCEPT_1;

    public boolean isTerminal() {
        return this != CONTINUE;
    }

    public Hypothesis toDecision() {
        switch (this) {
            case ACCEPT_0:
                return Hypothesis.F0;
            case ACCEPT_1:
                return Hypothesis.F1;
            default:
                throw new IllegalStateException("CONTINUE is not a decision");
        }
    }
}
