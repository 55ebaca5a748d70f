package com.seqdecision.server.ai.solver;

import com.seqdecision.server.ai.model.BeliefGrid;
import com.seqdecision.server.ai.model.DiscretizedDensity;
import com.seqdecision.server.ai.model.ObservationModel;
import com.seqdecision.util.MathUtil;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueSolverTest {

    private static ObservationModel observations;
    private static BeliefGrid grid;
    private static DecisionLosses losses;
    private static ValueSolver solver;
    private static SolveResult result;

    @BeforeAll
    static void solveOnce() {
        // two unimodal densities over a 50-point support, L0 = L1 = 5, c = 0.5, m = 251
        observations = DiscretizedDensity.betaPair(2, 5, 5, 2, 50);
        grid = BeliefGrid.uniform(251);
        losses = new DecisionLosses(0.5, 5.0, 5.0);
        solver = new ValueSolver(observations, grid, losses, 1e-7, 1000, false, 50);
        result = solver.solve();
    }

    @Test
    public void testConvergesWithinBudget() {
        assertTrue(result.isConverged());
        assertTrue(result.getIterations() < 1000, "took " + result.getIterations() + " sweeps");
        assertTrue(result.getResidual() < 1e-7);
        assertEquals(result.getIterations(), result.getResidualTrace().length);
    }

    @Test
    public void testValueIsDominatedByImmediateDecisions() {
        double[] j = result.getValues();
        for (int i = 0; i < grid.size(); i++) {
            double p = grid.get(i);
            assertTrue(j[i] <= losses.acceptF0(p) + 1e-12, "J > (1-p)L0 at p=" + p);
            assertTrue(j[i] <= losses.acceptF1(p) + 1e-12, "J > pL1 at p=" + p);
            assertTrue(j[i] >= 0.0);
        }
    }

    @Test
    public void testMaximumIsBoundedByHalfTheLoss() {
        double max = 0.0;
        for (double v : result.getValues()) {
            max = Math.max(max, v);
        }
        assertTrue(max <= 0.5 * Math.min(5.0, 5.0) + 1e-12);
        assertTrue(max > 0.0);
    }

    @Test
    public void testTwoThresholdShape() {
        double[] j = result.getValues();
        Cutoffs cutoffs = new PolicyExtractor(grid, losses).extract(j);

        assertTrue(cutoffs.getBeta() > 0.0);
        assertTrue(cutoffs.getBeta() < 0.5);
        assertTrue(cutoffs.getAlpha() > 0.5);
        assertTrue(cutoffs.getAlpha() < 1.0);

        for (int i = 0; i < grid.size(); i++) {
            double p = grid.get(i);
            if (p <= cutoffs.getBeta()) {
                assertEquals(losses.acceptF1(p), j[i], 1e-9, "accept-1 region at p=" + p);
            } else if (p >= cutoffs.getAlpha()) {
                assertEquals(losses.acceptF0(p), j[i], 1e-9, "accept-0 region at p=" + p);
            } else {
                double immediate = Math.min(losses.acceptF0(p), losses.acceptF1(p));
                assertTrue(j[i] < immediate, "continuation region at p=" + p);
                assertEquals(solver.continuationValue(i, j), j[i], 1e-6);
            }
        }
    }

    @Test
    public void testSolvingFromFixedPointIsIdempotent() {
        double[] j = result.getValues();
        SolveResult again = solver.solve(j);
        assertTrue(again.isConverged());
        assertEquals(1, again.getIterations());
        assertTrue(MathUtil.maxAbsDelta(j, again.getValues()) < 1e-7);
    }

    @Test
    public void testResidualTraceIsNonIncreasing() {
        double[] trace = result.getResidualTrace();
        for (int i = 1; i < trace.length; i++) {
            assertTrue(trace[i] <= trace[i - 1] + 1e-12, "residual grew at sweep " + (i + 1));
        }
    }

    @Test
    public void testParallelSweepMatchesSequential() {
        ValueSolver parallel = new ValueSolver(observations, grid, losses, 1e-7, 1000, true, 0);
        SolveResult parallelResult = parallel.solve();
        assertEquals(result.getIterations(), parallelResult.getIterations());
        assertArrayEquals(result.getValues(), parallelResult.getValues(), 0.0);
    }

    @Test
    public void testExhaustedBudgetIsReportedNotAccepted() {
        ValueSolver shortBudget = new ValueSolver(observations, grid, losses, 1e-7, 3, false, 0);
        ConvergenceFailureException e = assertThrows(ConvergenceFailureException.class, shortBudget::solve);

        SolveResult partial = e.getPartialResult();
        assertFalse(partial.isConverged());
        assertEquals(3, partial.getIterations());
        assertEquals(3, partial.getResidualTrace().length);
        assertTrue(partial.getResidual() >= 1e-7);
        assertEquals(grid.size(), partial.getValues().length);
        assertEquals(1e-7, e.getTolerance());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> solver.solve(new double[3]));
        assertThrows(IllegalArgumentException.class,
                () -> new ValueSolver(observations, grid, losses, 0.0, 10, false, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new ValueSolver(observations, grid, losses, 1e-7, 0, false, 0));
        assertThrows(IllegalArgumentException.class, () -> new DecisionLosses(-1.0, 5.0, 5.0));
        assertThrows(IllegalArgumentException.class, () -> new DecisionLosses(0.5, Double.NaN, 5.0));
    }
}
