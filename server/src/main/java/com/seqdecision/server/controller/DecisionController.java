package com.seqdecision.server.controller;

import com.seqdecision.server.ai.Hypothesis;
import com.seqdecision.server.ai.SequentialDecisionModel;
import com.seqdecision.server.ai.analysis.CostSweepRow;
import com.seqdecision.server.ai.simulation.DegeneratePolicyException;
import com.seqdecision.server.ai.simulation.SimulationOutcome;
import com.seqdecision.server.ai.simulation.StoppingDistribution;
import com.seqdecision.server.ai.simulation.StoppingTimeExceededException;
import com.seqdecision.server.ai.solver.ConvergenceFailureException;
import com.seqdecision.server.ai.solver.Cutoffs;
import com.seqdecision.server.ai.solver.SolveResult;
import com.seqdecision.server.service.SequentialDecisionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.SortedMap;

@RestController
public class DecisionController {

    private static final Logger logger = LoggerFactory.getLogger(DecisionController.class);
    private static final int MAX_RUNS = 100_000;

    private final SequentialDecisionService decisionService;

    public DecisionController(SequentialDecisionService decisionService) {
        this.decisionService = decisionService;
    }

    public static class SimulationRequest {
        public String trueDistribution;
        public Double prior;
    }

    public static class StoppingDistributionRequest {
        public Integer runs;
        public String trueDistribution;
        public Double prior;
        public Long seed;
    }

    public static class CostSweepRequest {
        public double[] costs;
        public Integer runs;
        public String trueDistribution;
    }

    public static class PolicyResponse {
        public double beta;
        public double alpha;
        public boolean degenerate;
        public double[] grid;
        public double[] values;
        public Integer iterations;
        public Double residual;
    }

    public static class StoppingDistributionResponse {
        public Hypothesis trueDistribution;
        public StoppingDistribution.Summary summary;
        public SortedMap<Integer, Integer> histogram;
        public int skippedRuns;
        public int[] drawCounts;
        public boolean[] correctness;
    }

    @GetMapping("/policy")
    public ResponseEntity<?> policy() {
        if (!decisionService.isReady()) {
            return notReady();
        }
        SequentialDecisionModel model = decisionService.getModel();
        Cutoffs cutoffs = model.cutoffs();
        SolveResult solve = model.lastSolveResult();

        PolicyResponse response = new PolicyResponse();
        response.beta = cutoffs.getBeta();
        response.alpha = cutoffs.getAlpha();
        response.degenerate = cutoffs.isDegenerate();
        response.grid = model.getGrid().getPoints();
        response.values = model.valueFunction();
        response.iterations = solve != null ? solve.getIterations() : null;
        response.residual = solve != null ? solve.getResidual() : null;
        return ResponseEntity.ok(response);
    }

    @PostMapping("/simulate")
    public ResponseEntity<?> simulate(@RequestBody SimulationRequest request) {
        if (!decisionService.isReady()) {
            return notReady();
        }
        try {
            Hypothesis truth = SequentialDecisionService.parseHypothesis(request.trueDistribution, Hypothesis.F0);
            SimulationOutcome outcome = decisionService.simulate(truth, request.prior);
            logger.info("Simulated single run under {}: {}", truth, outcome);
            return ResponseEntity.ok(outcome);
        } catch (IllegalArgumentException | DegeneratePolicyException | StoppingTimeExceededException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/stopping-distribution")
    public ResponseEntity<?> stoppingDistribution(@RequestBody StoppingDistributionRequest request) {
        if (!decisionService.isReady()) {
            return notReady();
        }
        if (request.runs != null && (request.runs < 1 || request.runs > MAX_RUNS)) {
            return ResponseEntity.badRequest().body("runs must be between 1 and " + MAX_RUNS);
        }
        try {
            Hypothesis truth = SequentialDecisionService.parseHypothesis(request.trueDistribution, Hypothesis.F0);
            StoppingDistribution dist = decisionService.stoppingDistribution(request.runs, truth, request.prior,
                    request.seed);

            StoppingDistributionResponse response = new StoppingDistributionResponse();
            response.trueDistribution = truth;
            response.summary = dist.summary();
            response.histogram = dist.histogram();
            response.skippedRuns = dist.getSkippedRuns();
            response.drawCounts = dist.getDrawCounts();
            response.correctness = dist.getCorrectness();
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException | DegeneratePolicyException | StoppingTimeExceededException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/cost-sweep")
    public ResponseEntity<?> costSweep(@RequestBody CostSweepRequest request) {
        if (!decisionService.isReady()) {
            return notReady();
        }
        if (request.costs == null || request.costs.length == 0) {
            return ResponseEntity.badRequest().body("costs must be a non-empty array");
        }
        int runs = request.runs != null ? request.runs : 500;
        if (runs < 1 || runs > MAX_RUNS) {
            return ResponseEntity.badRequest().body("runs must be between 1 and " + MAX_RUNS);
        }
        try {
            Hypothesis truth = SequentialDecisionService.parseHypothesis(request.trueDistribution, Hypothesis.F0);
            List<CostSweepRow> rows = decisionService.costSweep(request.costs, runs, truth);
            return ResponseEntity.ok(rows);
        } catch (IllegalArgumentException | DegeneratePolicyException | StoppingTimeExceededException
                | ConvergenceFailureException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    private ResponseEntity<?> notReady() {
        return ResponseEntity.status(503).body("Model is still solving, please try again later.");
    }
}
