package com.curation.integrity.check;

import com.curation.integrity.audit.AuditService;
import com.curation.integrity.logging.LogContext;
import com.curation.integrity.metrics.MetricsService;
import com.curation.integrity.metrics.NoOpMetricsService;
import com.curation.integrity.similarity.RecordSimilarityScorer;
import com.curation.integrity.state.RecordStateMachine;
import com.curation.integrity.state.StateTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs every registered consistency check over a snapshot pair and aggregates the
 * failures into one {@link CheckResult}.
 *
 * <p>Failures are accumulated, never fail-fast: a check that throws contributes an
 * {@link FailureKind#INTERNAL_ERROR} failure and the remaining checks still run. The
 * only exception is strict mode, where an illegal status transition aborts the run
 * with a {@link StateTransitionException}.</p>
 *
 * <p>Failures are ordered by check registration order, then by discovery order
 * within a check, whether or not the checks run in parallel.</p>
 */
public class ConsistencyChecker {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    static final String CHECKER_ACTOR = "consistency-checker";

    private final List<ConsistencyCheck> checks;
    private final CheckerSettings settings;
    private final RecordSimilarityScorer similarityScorer;
    private final RecordStateMachine stateMachine;
    private final SourceResolver sourceResolver;
    private final MetricsService metrics;
    private final AuditService auditService;

    private ConsistencyChecker(Builder builder) {
        this.checks = List.copyOf(builder.checks);
        this.settings = builder.settings;
        this.similarityScorer = builder.similarityScorer;
        this.stateMachine = builder.stateMachine;
        this.sourceResolver = builder.sourceResolver;
        this.metrics = builder.metrics;
        this.auditService = builder.auditService;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A checker with all built-in checks and default settings.
     */
    public static ConsistencyChecker defaults() {
        return builder().withBuiltInChecks().build();
    }

    /**
     * The built-in checks, in execution order.
     */
    public static List<ConsistencyCheck> builtInChecks() {
        return List.of(
                new SourceStructureCheck(),
                new DuplicateIdCheck(),
                new IdImmutabilityCheck(),
                new OriginIntegrityCheck(),
                new ProvenanceIntegrityCheck(),
                new StatusTransitionCheck(),
                new ScreenCriteriaCheck()
        );
    }

    public List<ConsistencyCheck> getChecks() {
        return checks;
    }

    public CheckerSettings getSettings() {
        return settings;
    }

    /**
     * Runs all checks over the pair. The records are never modified.
     *
     * @throws StateTransitionException in strict mode, on the first illegal status transition
     */
    public CheckResult check(SnapshotPair pair) {
        Objects.requireNonNull(pair, "pair is required");
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forCheck(runId)) {
            CheckContext context = new CheckContext(pair, settings, similarityScorer, stateMachine, sourceResolver);
            log.info("check.started checks={} prior={} current={} parallel={} strict={}",
                    checks.size(), pair.prior().size(), pair.current().size(),
                    settings.isParallel(), settings.isStrict());

            List<List<CheckFailure>> perCheck = settings.isParallel() && checks.size() > 1
                    ? runParallel(context)
                    : runSequential(context);

            List<CheckFailure> failures = new ArrayList<>();
            perCheck.forEach(failures::addAll);
            CheckResult result = CheckResult.of(failures);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("runId", runId);
            details.put("status", result.status().name());
            details.put("failures", failures.size());
            auditService.recordCheckRun(CHECKER_ACTOR, details);

            log.info("check.completed status={} failures={}", result.status(), failures.size());
            return result;
        }
    }

    private List<List<CheckFailure>> runSequential(CheckContext context) {
        List<List<CheckFailure>> results = new ArrayList<>();
        for (ConsistencyCheck check : checks) {
            results.add(runCheck(check, context));
        }
        return results;
    }

    private List<List<CheckFailure>> runParallel(CheckContext context) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.getThreads(), checks.size()));
        try {
            List<CompletableFuture<List<CheckFailure>>> futures = new ArrayList<>();
            for (ConsistencyCheck check : checks) {
                futures.add(CompletableFuture.supplyAsync(() -> runCheck(check, context), executor));
            }
            List<List<CheckFailure>> results = new ArrayList<>();
            for (CompletableFuture<List<CheckFailure>> future : futures) {
                try {
                    results.add(future.join());
                } catch (CompletionException e) {
                    if (e.getCause() instanceof RuntimeException cause) {
                        throw cause;
                    }
                    throw e;
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private List<CheckFailure> runCheck(ConsistencyCheck check, CheckContext context) {
        long start = System.nanoTime();
        List<CheckFailure> failures;
        try {
            failures = List.copyOf(check.run(context));
        } catch (StateTransitionException e) {
            if (settings.isStrict()) {
                log.warn("check.aborted name={} error={}", check.getName(), e.getMessage());
                throw e;
            }
            failures = List.of(internalError(check, e));
        } catch (RuntimeException e) {
            log.error("check.error name={} error={}", check.getName(), e.getMessage(), e);
            failures = List.of(internalError(check, e));
        } finally {
            metrics.recordCheckDuration(check.getName(), Duration.ofNanos(System.nanoTime() - start));
        }
        for (CheckFailure failure : failures) {
            metrics.incrementCheckFailure(failure.kind());
        }
        log.debug("check.completed name={} failures={}", check.getName(), failures.size());
        return failures;
    }

    private static CheckFailure internalError(ConsistencyCheck check, RuntimeException e) {
        return CheckFailure.of(FailureKind.INTERNAL_ERROR,
                "Check " + check.getName() + " failed: " + e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    public static class Builder {
        private final List<ConsistencyCheck> checks = new ArrayList<>();
        private CheckerSettings settings = CheckerSettings.defaults();
        private RecordSimilarityScorer similarityScorer = new RecordSimilarityScorer();
        private RecordStateMachine stateMachine;
        private SourceResolver sourceResolver = SourceResolver.ALL_RESOLVABLE;
        private MetricsService metrics = NoOpMetricsService.INSTANCE;
        private AuditService auditService;

        public Builder check(ConsistencyCheck check) {
            this.checks.add(Objects.requireNonNull(check, "check is required"));
            return this;
        }

        public Builder withBuiltInChecks() {
            this.checks.addAll(builtInChecks());
            return this;
        }

        public Builder settings(CheckerSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings are required");
            return this;
        }

        public Builder similarityScorer(RecordSimilarityScorer similarityScorer) {
            this.similarityScorer = Objects.requireNonNull(similarityScorer, "similarityScorer is required");
            return this;
        }

        public Builder stateMachine(RecordStateMachine stateMachine) {
            this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine is required");
            return this;
        }

        public Builder sourceResolver(SourceResolver sourceResolver) {
            this.sourceResolver = Objects.requireNonNull(sourceResolver, "sourceResolver is required");
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = Objects.requireNonNull(auditService, "auditService is required");
            return this;
        }

        public ConsistencyChecker build() {
            if (auditService == null) {
                auditService = stateMachine != null ? stateMachine.getAuditService() : new AuditService();
            }
            if (stateMachine == null) {
                stateMachine = new RecordStateMachine(auditService);
            }
            return new ConsistencyChecker(this);
        }
    }
}
