package com.seqdecision.server.config;

import com.seqdecision.server.ai.ModelSettings;
import com.seqdecision.server.ai.SequentialDecisionModel;
import com.seqdecision.server.ai.simulation.FailurePolicy;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DecisionConfigLoaderTest {

    @Test
    public void testDefaultConfigParsing() throws Exception {
        InputStream is = getClass().getResourceAsStream("/decision_config.json");
        assertNotNull(is, "decision_config.json not found on classpath");

        DecisionConfig.ConfigRoot config = DecisionConfigLoader.load(is);
        assertEquals(0.5, config.model.samplingCost, 1e-12);
        assertEquals(251, config.model.gridSize);
        assertEquals(50, config.distributions.supportSize);
        assertEquals(2.0, config.distributions.f0.betaA, 1e-12);
        assertEquals(1000, config.solver.maxIterations);

        SequentialDecisionModel model = DecisionConfigLoader.buildModel(config);
        assertEquals(251, model.getGrid().size());
        assertEquals(50, model.getObservationModel().size());
        assertEquals(5.0, model.getLosses().getLossAccept0(), 1e-12);
    }

    @Test
    public void testRawWeightsAndSettingsOverrides() throws Exception {
        String json = "{"
                + "\"model\": {\"samplingCost\": 0.25, \"gridSize\": 11},"
                + "\"distributions\": {\"f0\": {\"weights\": [3, 1]}, \"f1\": {\"weights\": [1, 3]}},"
                + "\"solver\": {\"tolerance\": 1e-6, \"parallel\": true},"
                + "\"simulation\": {\"seed\": 7, \"failurePolicy\": \"skip\", \"maxDraws\": 99}"
                + "}";
        DecisionConfig.ConfigRoot config = DecisionConfigLoader
                .load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        SequentialDecisionModel model = DecisionConfigLoader.buildModel(config);
        assertEquals(2, model.getObservationModel().size());
        assertEquals(0.75, model.getObservationModel().f0(0), 1e-7);
        assertEquals(11, model.getGrid().size());
        assertEquals(DecisionConfigLoader.DEFAULT_LOSS, model.getLosses().getLossAccept1(), 1e-12);

        ModelSettings settings = model.getSettings();
        assertEquals(1e-6, settings.tolerance, 1e-18);
        assertTrue(settings.parallelSolve);
        assertEquals(7L, settings.seed);
        assertEquals(99, settings.maxDraws);
        assertEquals(FailurePolicy.SKIP, settings.failurePolicy);
    }

    @Test
    public void testMissingSectionsFallBackToDefaults() {
        DecisionConfig.ConfigRoot empty = new DecisionConfig.ConfigRoot();
        SequentialDecisionModel model = DecisionConfigLoader.buildModel(empty);
        assertEquals(DecisionConfigLoader.DEFAULT_GRID_SIZE, model.getGrid().size());
        assertEquals(DecisionConfigLoader.DEFAULT_SUPPORT_SIZE, model.getObservationModel().size());
        assertEquals(DecisionConfigLoader.DEFAULT_SAMPLING_COST, model.getLosses().getSamplingCost(), 1e-12);
        assertEquals(0.5, DecisionConfigLoader.prior(empty), 1e-12);
        assertEquals(DecisionConfigLoader.DEFAULT_RUNS, DecisionConfigLoader.runs(empty));

        empty.simulation = new DecisionConfig.SimulationConfig();
        empty.simulation.failurePolicy = "bogus";
        assertEquals(FailurePolicy.ABORT, DecisionConfigLoader.buildSettings(empty).failurePolicy);
    }

    @Test
    public void testInvalidWeightsAreRejected() throws Exception {
        String json = "{\"distributions\": {\"f0\": {\"weights\": [0, 0]}, \"f1\": {\"weights\": [1, 1]}}}";
        DecisionConfig.ConfigRoot config = DecisionConfigLoader
                .load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertThrows(IllegalArgumentException.class, () -> DecisionConfigLoader.buildModel(config));
    }
}
