package com.seqdecision.server.ai;

import com.seqdecision.server.ai.model.DiscretizedDensity;
import com.seqdecision.server.ai.simulation.SimulationOutcome;
import com.seqdecision.server.ai.simulation.StoppingDistribution;
import com.seqdecision.server.ai.solver.ConvergenceFailureException;
import com.seqdecision.server.ai.solver.Cutoffs;
import com.seqdecision.server.ai.solver.DecisionLosses;
import com.seqdecision.util.MathUtil;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SequentialDecisionModelTest {

    private static final double[] W0 = DiscretizedDensity.beta(2, 5, 50);
    private static final double[] W1 = DiscretizedDensity.beta(5, 2, 50);

    private static SequentialDecisionModel newModel(double c) {
        return new SequentialDecisionModel(c, 5.0, 5.0, W0, W1, 251);
    }

    @Test
    public void testCutoffsRequireSolve() {
        SequentialDecisionModel model = newModel(0.5);
        assertFalse(model.isSolved());
        assertThrows(IllegalStateException.class, model::cutoffs);
        assertThrows(IllegalStateException.class, model::valueFunction);
        assertNull(model.lastSolveResult());

        double[] values = model.solve();
        assertTrue(model.isSolved());
        assertEquals(251, values.length);
        assertArrayEquals(values, model.valueFunction(), 0.0);
        assertTrue(model.lastSolveResult().isConverged());
    }

    @Test
    public void testSimulateSolvesOnDemand() {
        SequentialDecisionModel model = newModel(0.5);
        SimulationOutcome outcome = model.simulate(Hypothesis.F0);
        assertTrue(model.isSolved());
        assertTrue(outcome.getDraws() >= 1);
        assertNotNull(outcome.getDecision());
    }

    @Test
    public void testResolvingFromConvergedArrayIsIdempotent() {
        SequentialDecisionModel model = newModel(0.5);
        double[] first = model.solve();
        double[] second = model.solve(first);
        assertTrue(MathUtil.maxAbsDelta(first, second) < model.getSettings().tolerance);
        assertEquals(1, model.lastSolveResult().getIterations());
    }

    @Test
    public void testHigherSamplingCostNarrowsContinuationRegion() {
        SequentialDecisionModel cheap = newModel(0.5);
        SequentialDecisionModel dear = cheap.withSamplingCost(1.0);
        assertFalse(dear.isSolved());
        assertEquals(1.0, dear.getLosses().getSamplingCost());

        cheap.solve();
        dear.solve();
        Cutoffs c1 = cheap.cutoffs();
        Cutoffs c2 = dear.cutoffs();

        assertTrue(0 < c1.getBeta() && c1.getBeta() < 0.5 && 0.5 < c1.getAlpha() && c1.getAlpha() < 1);
        assertTrue(c2.getBeta() > c1.getBeta(), c1 + " -> " + c2);
        assertTrue(c2.getAlpha() < c1.getAlpha(), c1 + " -> " + c2);

        double cheapMean = cheap.stoppingDistribution(2000, Hypothesis.F0, 0.5, 99L).meanStoppingTime();
        double dearMean = dear.stoppingDistribution(2000, Hypothesis.F0, 0.5, 99L).meanStoppingTime();
        assertTrue(dearMean <= cheapMean, "mean draws " + cheapMean + " -> " + dearMean);
    }

    @Test
    public void testStoppingDistributionUnderAlternative() {
        StoppingDistribution dist = newModel(0.5).stoppingDistribution(1000, Hypothesis.F1);
        assertEquals(1000, dist.size());
        assertTrue(dist.fractionCorrect() >= 0.5);
        assertTrue(dist.meanStoppingTime() >= 1.0);
    }

    @Test
    public void testConvergenceFailureLeavesModelUnsolvedUntilAdopted() {
        ModelSettings settings = ModelSettings.defaults();
        settings.maxIterations = 2;
        SequentialDecisionModel model = new SequentialDecisionModel(new DecisionLosses(0.5, 5.0, 5.0),
                DiscretizedDensity.betaPair(2, 5, 5, 2, 50), 101, settings);

        ConvergenceFailureException e = assertThrows(ConvergenceFailureException.class, model::solve);
        assertFalse(model.isSolved());

        model.adoptValues(e.getPartialResult().getValues());
        assertTrue(model.isSolved());
        assertNull(model.lastSolveResult());
        assertNotNull(model.cutoffs());
        assertThrows(IllegalArgumentException.class, () -> model.adoptValues(new double[5]));
    }

    @Test
    public void testRepeatedBatchesDifferUnlessSeeded() {
        SequentialDecisionModel model = newModel(0.5);
        StoppingDistribution first = model.stoppingDistribution(300, Hypothesis.F0);
        StoppingDistribution second = model.stoppingDistribution(300, Hypothesis.F0);
        assertFalse(Arrays.equals(first.getDrawCounts(), second.getDrawCounts()));

        StoppingDistribution seededA = model.stoppingDistribution(300, Hypothesis.F0, 0.5, 42L);
        StoppingDistribution seededB = model.stoppingDistribution(300, Hypothesis.F0, 0.5, 42L);
        assertArrayEquals(seededA.getDrawCounts(), seededB.getDrawCounts());
        assertArrayEquals(seededA.getCorrectness(), seededB.getCorrectness());

        // a freshly built model repeats its own first batch
        StoppingDistribution rebuilt = newModel(0.5).stoppingDistribution(300, Hypothesis.F0);
        assertArrayEquals(first.getDrawCounts(), rebuilt.getDrawCounts());
    }

    @Test
    public void testFailedResolveKeepsPreviousSolution() {
        ModelSettings settings = ModelSettings.defaults();
        settings.maxIterations = 2;
        SequentialDecisionModel model = new SequentialDecisionModel(new DecisionLosses(0.5, 5.0, 5.0),
                DiscretizedDensity.betaPair(2, 5, 5, 2, 50), 101, settings);
        SequentialDecisionModel reference = new SequentialDecisionModel(new DecisionLosses(0.5, 5.0, 5.0),
                DiscretizedDensity.betaPair(2, 5, 5, 2, 50), 101, ModelSettings.defaults());
        double[] converged = reference.solve();

        // two sweeps from the fixed point converge at once
        model.solve(converged);
        Cutoffs before = model.cutoffs();
        double[] valuesBefore = model.valueFunction();

        assertThrows(ConvergenceFailureException.class, model::solve);
        assertTrue(model.isSolved());
        assertArrayEquals(valuesBefore, model.valueFunction(), 0.0);
        assertEquals(before.getBeta(), model.cutoffs().getBeta());
        assertEquals(before.getAlpha(), model.cutoffs().getAlpha());
    }

    @Test
    public void testConstructionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SequentialDecisionModel(0.0, 5, 5, W0, W1, 251));
        assertThrows(IllegalArgumentException.class, () -> new SequentialDecisionModel(0.5, -1, 5, W0, W1, 251));
        assertThrows(IllegalArgumentException.class, () -> new SequentialDecisionModel(0.5, 0, 0, W0, W1, 251));
        assertThrows(IllegalArgumentException.class, () -> new SequentialDecisionModel(0.5, 5, 5, W0, W1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new SequentialDecisionModel(0.5, 5, 5, W0, new double[] { 1, 2 }, 251));
    }

    @Test
    public void testHypothesisIndex() {
        assertEquals(Hypothesis.F0, Hypothesis.fromIndex(0));
        assertEquals(Hypothesis.F1, Hypothesis.fromIndex(1));
        assertEquals(1, Hypothesis.F1.getIndex());
        assertThrows(IllegalArgumentException.class, () -> Hypothesis.fromIndex(2));
    }
}
