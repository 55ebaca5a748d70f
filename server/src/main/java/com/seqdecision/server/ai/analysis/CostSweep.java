package com.seqdecision.server.ai.analysis;

import com.seqdecision.server.ai.Hypothesis;
import com.seqdecision.server.ai.SequentialDecisionModel;
import com.seqdecision.server.ai.simulation.Simulator;
import com.seqdecision.server.ai.simulation.StoppingDistribution;
import com.seqdecision.server.ai.solver.Cutoffs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Re-solves a model over a range of sampling costs and records how the
 * cutoffs and the simulated stopping time respond.
 */
public class CostSweep {

    private static final Logger logger = LoggerFactory.getLogger(CostSweep.class);

    public static final String CSV_HEADER = "samplingCost,beta,alpha,meanStoppingTime,fractionCorrect,iterations";

    public static List<CostSweepRow> run(SequentialDecisionModel baseModel, double[] costs, int nRuns,
            Hypothesis truth) {
        if (costs == null || costs.length == 0) {
            throw new IllegalArgumentException("Cost sweep needs at least one sampling cost");
        }
        List<CostSweepRow> rows = new ArrayList<>();
        for (double c : costs) {
            SequentialDecisionModel model = baseModel.withSamplingCost(c);
            model.solve();
            Cutoffs cutoffs = model.cutoffs();
            // same run seeds at every cost, so rows differ only through the policy
            StoppingDistribution dist = model.stoppingDistribution(nRuns, truth, Simulator.DEFAULT_PRIOR,
                    model.getSettings().seed);
            int iterations = model.lastSolveResult() != null ? model.lastSolveResult().getIterations() : 0;

            CostSweepRow row = new CostSweepRow(c, cutoffs.getBeta(), cutoffs.getAlpha(),
                    dist.meanStoppingTime(), dist.fractionCorrect(), iterations);
            logger.info("c={} beta={} alpha={} meanDraws={} fractionCorrect={}", c, cutoffs.getBeta(),
                    cutoffs.getAlpha(), String.format("%.3f", row.getMeanStoppingTime()),
                    String.format("%.3f", row.getFractionCorrect()));
            rows.add(row);
        }
        return rows;
    }

    public static String toCsv(List<CostSweepRow> rows) {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        for (CostSweepRow r : rows) {
            sb.append(String.format(Locale.ROOT, "%.4f,%.4f,%.4f,%.4f,%.4f,%d\n",
                    r.getSamplingCost(), r.getBeta(), r.getAlpha(), r.getMeanStoppingTime(),
                    r.getFractionCorrect(), r.getIterations()));
        }
        return sb.toString();
    }

    private CostSweep() {
    }
}
