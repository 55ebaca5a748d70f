package com.seqdecision.server.ai;

/**
 * The two competing data-generating distributions.
 */
public enum Hypothesis {
    F0(0),
    F1(1);

    private final int index;

    Hypothesis(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public static Hypothesis fromIndex(int index) {
        switch (index) {
            case 0:
                return F0;
            case 1:
                return F1;
            default:
                throw new IllegalArgumentException("Hypothesis index must be 0 or 1, got " + index);
        }
    }
}
