package com.seqdecision.server.ai.simulation;

import com.seqdecision.server.ai.Hypothesis;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Draw counts and correctness of a batch of simulated runs.
 */
public class StoppingDistribution {
    private final Hypothesis truth;
    private final int[] drawCounts;
    private final boolean[] correctness;
    private final int skippedRuns;
    private final DescriptiveStatistics drawStats = new DescriptiveStatistics();
    private final DescriptiveStatistics correctStats = new DescriptiveStatistics();

    public StoppingDistribution(Hypothesis truth, int[] drawCounts, boolean[] correctness, int skippedRuns) {
        if (drawCounts.length != correctness.length) {
            throw new IllegalArgumentException("drawCounts and correctness must have equal length");
        }
        this.truth = truth;
        this.drawCounts = drawCounts;
        this.correctness = correctness;
        this.skippedRuns = skippedRuns;
        for (int i = 0; i < drawCounts.length; i++) {
            drawStats.addValue(drawCounts[i]);
            correctStats.addValue(correctness[i] ? 1.0 : 0.0);
        }
    }

    public Hypothesis getTruth() {
        return truth;
    }

    public int[] getDrawCounts() {
        return drawCounts.clone();
    }

    public boolean[] getCorrectness() {
        return correctness.clone();
    }

    public int getSkippedRuns() {
        return skippedRuns;
    }

    public int size() {
        return drawCounts.length;
    }

    /** NaN when no run completed. */
    public double meanStoppingTime() {
        return drawStats.getMean();
    }

    /** NaN when no run completed. */
    public double fractionCorrect() {
        return correctStats.getMean();
    }

    public Summary summary() {
        return new Summary(drawStats.getN(), drawStats.getMean(), drawStats.getStandardDeviation(),
                drawStats.getMin(), drawStats.getMax(), drawStats.getPercentile(50), fractionCorrect());
    }

    /** Draw count to number of runs, ascending by draw count. */
    public SortedMap<Integer, Integer> histogram() {
        SortedMap<Integer, Integer> hist = new TreeMap<>();
        for (int d : drawCounts) {
            hist.merge(d, 1, Integer::sum);
        }
        return hist;
    }

    public static class Summary {
        private final long runs;
        private final double meanDraws;
        private final double stdDraws;
        private final double minDraws;
        private final double maxDraws;
        private final double medianDraws;
        private final double fractionCorrect;

        public Summary(long runs, double meanDraws, double stdDraws, double minDraws, double maxDraws,
                double medianDraws, double fractionCorrect) {
            this.runs = runs;
            this.meanDraws = meanDraws;
            this.stdDraws = stdDraws;
            this.minDraws = minDraws;
            this.maxDraws = maxDraws;
            this.medianDraws = medianDraws;
            this.fractionCorrect = fractionCorrect;
        }

        public long getRuns() {
            return runs;
        }

        public double getMeanDraws() {
            return meanDraws;
        }

        public double getStdDraws() {
            return stdDraws;
        }

        public double getMinDraws() {
            return minDraws;
        }

        public double getMaxDraws() {
            return maxDraws;
        }

        public double getMedianDraws() {
            return medianDraws;
        }

        public double getFractionCorrect() {
            return fractionCorrect;
        }

        @Override
        public String toString() {
            return String.format("Summary{runs=%d, meanDraws=%.3f, std=%.3f, min=%.0f, max=%.0f, median=%.1f, "
                    + "fractionCorrect=%.3f}", runs, meanDraws, stdDraws, minDraws, maxDraws, medianDraws,
                    fractionCorrect);
        }
    }
}
