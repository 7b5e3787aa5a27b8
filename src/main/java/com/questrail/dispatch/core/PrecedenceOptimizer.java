package com.questrail.dispatch.core;

import com.questrail.dispatch.api.DispatchOptimizer;
import com.questrail.dispatch.api.OptimizationOutcome;
import com.questrail.dispatch.config.OptimizerConfig;
import com.questrail.dispatch.config.PrecedencePolicy;
import com.questrail.dispatch.conflict.ConflictDetector;
import com.questrail.dispatch.conflict.SameSectionConflictDetector;
import com.questrail.dispatch.decision.DecisionExtractor;
import com.questrail.dispatch.decision.DegradedFallback;
import com.questrail.dispatch.metrics.MetricsCalculator;
import com.questrail.dispatch.metrics.OptimizationMetrics;
import com.questrail.dispatch.model.Decision;
import com.questrail.dispatch.model.OptimizationResult;
import com.questrail.dispatch.model.SystemState;
import com.questrail.dispatch.model.Train;
import com.questrail.dispatch.observability.GuardedObservabilitySink;
import com.questrail.dispatch.observability.NullObservabilitySink;
import com.questrail.dispatch.observability.OptimizationCompletedEvent;
import com.questrail.dispatch.observability.OptimizationErrorEvent;
import com.questrail.dispatch.observability.OptimizerObservabilitySink;
import com.questrail.dispatch.observability.SolveOutcomeEvent;
import com.questrail.dispatch.observability.StageTransitionEvent;
import com.questrail.dispatch.solver.HeuristicPrecedenceOrdering;
import com.questrail.dispatch.solver.PrecedenceModel;
import com.questrail.dispatch.solver.PrecedenceOrder;
import com.questrail.dispatch.solver.PrecedenceSolver;
import com.questrail.dispatch.solver.SolveOutcome;
import com.questrail.dispatch.solver.cpsat.CpSatPrecedenceSolver;
import com.questrail.dispatch.time.MonotonicClock;
import com.questrail.dispatch.time.SystemMonotonicClock;
import com.questrail.dispatch.time.SystemWallClock;
import com.questrail.dispatch.time.WallClock;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * PrecedenceOptimizer
 * =============================================================================
 * Composition root and orchestrator for one precedence decision pass.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   SystemState
 *     -> FILTERING   eligible trains (running/delayed, holding a section)
 *     -> SOLVING     PrecedenceModel -> PrecedenceSolver, heuristic on NoSolution
 *     -> EXTRACTING  PrecedenceOrder -> Decisions
 *     -> SCORING     Decisions -> metrics -> OptimizationResult
 *     -> DONE
 * </pre>
 *
 * <h2>Failure handling</h2>
 * Each stage returns a {@link StageResult}. A {@link StageResult.Failed} at
 * any stage ends the pass in {@link OptimizerStage#FALLBACK_DONE} with the
 * {@link DegradedFallback} result. A wall or monotonic clock that throws
 * before the pass starts degrades the pass the same way; the failure is
 * reported with stage {@link OptimizerStage#IDLE}. Sink failures are logged
 * and ignored by {@link GuardedObservabilitySink}. {@link #optimize(SystemState)}
 * does not throw for a non-null snapshot.
 *
 * <h2>Threading</h2>
 * All collaborators are immutable or stateless and every solve is
 * request-scoped, so one instance may serve concurrent callers.
 */
public final class PrecedenceOptimizer implements DispatchOptimizer
{
    private final OptimizerConfig config;
    private final ConflictDetector conflictDetector;
    private final PrecedenceSolver solver;
    private final DecisionExtractor extractor;
    private final MetricsCalculator metrics;
    private final DegradedFallback fallback;
    private final OptimizerObservabilitySink observabilitySink;
    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;

    private PrecedenceOptimizer(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.conflictDetector = Objects.requireNonNull(b.conflictDetector, "conflictDetector");
        this.solver = b.solver != null ? b.solver : new CpSatPrecedenceSolver(config);
        this.observabilitySink = new GuardedObservabilitySink(
                Objects.requireNonNull(b.observabilitySink, "observabilitySink"));
        this.monotonicClock = Objects.requireNonNull(b.monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");

        PrecedencePolicy policy = config.policy();
        this.extractor = new DecisionExtractor(policy);
        this.metrics = new MetricsCalculator(policy);
        this.fallback = new DegradedFallback(policy);
    }

    /**
     * Optimizer with the CP-SAT solver, same-section conflicts and no observability.
     */
    public static PrecedenceOptimizer create(OptimizerConfig config) {
        return builder().withConfig(config).build();
    }

    public OptimizerConfig config() {
        return config;
    }

    @Override
    public OptimizationResult optimize(SystemState state) {
        Objects.requireNonNull(state, "state");

        StageResult<Instant> stamped = StageResult.attempt(OptimizerStage.IDLE, wallClock::now);
        if (stamped instanceof StageResult.Failed<Instant> failed) {
            return degrade(state, failed, new Pass(SystemWallClock.INSTANCE.now()));
        }
        final Pass pass = new Pass(((StageResult.Ok<Instant>) stamped).value());
        final Instant createdAt = pass.createdAt;

        StageResult<Long> started = StageResult.attempt(OptimizerStage.IDLE, monotonicClock::nowNanos);
        if (started instanceof StageResult.Failed<Long> failed) {
            return degrade(state, failed, pass);
        }
        final long startNanos = ((StageResult.Ok<Long>) started).value();

        // ---------------------------------------------------------------
        // Filtering
        // ---------------------------------------------------------------
        pass.advance(OptimizerStage.FILTERING);
        StageResult<List<Train>> filtered = StageResult.attempt(OptimizerStage.FILTERING, state::eligibleTrains);
        if (filtered instanceof StageResult.Failed<List<Train>> failed) {
            return degrade(state, failed, pass);
        }

        final List<Train> eligible = ((StageResult.Ok<List<Train>>) filtered).value();
        if (eligible.isEmpty()) {
            pass.advance(OptimizerStage.DONE);
            return complete(OptimizationResult.empty(createdAt), pass);
        }

        // ---------------------------------------------------------------
        // Solving
        // ---------------------------------------------------------------
        pass.advance(OptimizerStage.SOLVING);
        StageResult<PrecedenceOrder> ordered =
                StageResult.attempt(OptimizerStage.SOLVING, () -> order(eligible, state, pass));
        if (ordered instanceof StageResult.Failed<PrecedenceOrder> failed) {
            return degrade(state, failed, pass);
        }

        // ---------------------------------------------------------------
        // Extracting
        // ---------------------------------------------------------------
        pass.advance(OptimizerStage.EXTRACTING);
        StageResult<List<Decision>> extracted = ordered.then(OptimizerStage.EXTRACTING,
                order -> extractor.extract(order, state.timestamp(), createdAt));
        if (extracted instanceof StageResult.Failed<List<Decision>> failed) {
            return degrade(state, failed, pass);
        }

        // ---------------------------------------------------------------
        // Scoring
        // ---------------------------------------------------------------
        final OptimizationOutcome outcome =
                ((StageResult.Ok<PrecedenceOrder>) ordered).value().basis() == PrecedenceOrder.Basis.SOLVED
                        ? OptimizationOutcome.SOLVED
                        : OptimizationOutcome.HEURISTIC;

        pass.advance(OptimizerStage.SCORING);
        StageResult<OptimizationResult> scored = extracted.then(OptimizerStage.SCORING,
                decisions -> score(decisions, state, outcome, startNanos, createdAt));
        if (scored instanceof StageResult.Failed<OptimizationResult> failed) {
            return degrade(state, failed, pass);
        }

        pass.advance(OptimizerStage.DONE);
        return complete(((StageResult.Ok<OptimizationResult>) scored).value(), pass);
    }

    // ---------------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------------

    private PrecedenceOrder order(List<Train> eligible, SystemState state, Pass pass) {
        PrecedenceModel model = PrecedenceModel.build(eligible, state, conflictDetector, config.policy());
        SolveOutcome outcome = solver.solve(model);

        if (outcome instanceof SolveOutcome.Solved solved) {
            observabilitySink.onSolveOutcome(solveEvent(model, outcome, SolvePath.CP, pass));
            return solved.order();
        }

        observabilitySink.onSolveOutcome(solveEvent(model, outcome, SolvePath.HEURISTIC, pass));
        return HeuristicPrecedenceOrdering.order(eligible);
    }

    private OptimizationResult score(List<Decision> decisions,
                                     SystemState state,
                                     OptimizationOutcome outcome,
                                     long startNanos,
                                     Instant createdAt) {
        OptimizationMetrics m = metrics.score(decisions, state.trains().size());
        double elapsedSeconds = Math.max(0L, monotonicClock.nowNanos() - startNanos) / 1_000_000_000.0;

        return new OptimizationResult(
                decisions,
                m.delayReductionMinutes(),
                m.throughputImprovement(),
                m.confidence(),
                elapsedSeconds,
                outcome,
                createdAt);
    }

    private OptimizationResult degrade(SystemState state, StageResult.Failed<?> failure, Pass pass) {
        Throwable cause = failure.cause();
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        observabilitySink.onError(new OptimizationErrorEvent(pass.createdAt, failure.stage(), message, cause));

        pass.advance(OptimizerStage.FALLBACK_DONE);
        return complete(fallback.resultFor(state, pass.createdAt), pass);
    }

    private OptimizationResult complete(OptimizationResult result, Pass pass) {
        observabilitySink.onCompleted(new OptimizationCompletedEvent(
                pass.createdAt,
                result.outcome(),
                result.decisions().size(),
                result.totalDelayReductionMinutes(),
                result.confidenceScore(),
                result.computationTimeSeconds()));
        return result;
    }

    private SolveOutcomeEvent solveEvent(PrecedenceModel model, SolveOutcome outcome, SolvePath path, Pass pass) {
        return new SolveOutcomeEvent(
                pass.createdAt,
                model.size(),
                model.exclusivePairs().size(),
                model.forcedPairs().size(),
                model.overCapacitySections().size(),
                outcome.solverStatus(),
                path,
                outcome.solveSeconds());
    }

    /**
     * Stage cursor for a single pass. Every event of the pass carries the
     * pass timestamp; the wall clock is read once per pass.
     */
    private final class Pass {
        private final Instant createdAt;
        private OptimizerStage current = OptimizerStage.IDLE;

        Pass(Instant createdAt) {
            this.createdAt = createdAt;
        }

        void advance(OptimizerStage next) {
            observabilitySink.onStageTransition(new StageTransitionEvent(createdAt, current, next));
            current = next;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OptimizerConfig config = OptimizerConfig.defaults();
        private ConflictDetector conflictDetector = SameSectionConflictDetector.INSTANCE;
        private PrecedenceSolver solver;
        private OptimizerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(OptimizerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withConflictDetector(ConflictDetector detector) {
            this.conflictDetector = detector;
            return this;
        }

        /**
         * Overrides the solver. Defaults to {@link CpSatPrecedenceSolver} built
         * from the configured time limit.
         */
        public Builder withSolver(PrecedenceSolver solver) {
            this.solver = solver;
            return this;
        }

        public Builder withObservabilitySink(OptimizerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public PrecedenceOptimizer build() {
            return new PrecedenceOptimizer(this);
        }
    }
}
