package com.foreman.core.execution;

import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.concurrency.RunningFeature;
import com.foreman.core.error.ErrorClassifier;
import com.foreman.core.error.ErrorInfo;
import com.foreman.core.error.ErrorType;
import com.foreman.core.error.FeatureNotFoundException;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.feature.FeatureStore;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PartitionKey;
import com.foreman.core.model.PlanStatus;
import com.foreman.core.scheduler.FailureTracker;
import com.foreman.core.worktree.WorktreeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static com.foreman.core.events.AutoModeEvent.payload;

/**
 * Feature execution lifecycle: registers the feature as running, runs the pipeline on the
 * execution pool and maps the outcome to a feature status, events and failure tracking.
 * <p>
 * Registration happens on the caller's thread so the scheduler sees the new running count
 * immediately. Nothing is thrown back to the caller once the pipeline has been submitted.
 */
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    private final EventBus eventBus;
    private final ConcurrencyManager concurrencyManager;
    private final WorktreeResolver worktreeResolver;
    private final FeatureStore featureStore;
    private final PipelineOrchestrator orchestrator;
    private final PlanApprovalService planApprovalService;
    private final FailureTracker failureTracker;
    private final Consumer<PartitionKey> executionStateRefresher;
    private final ExecutorService executor;
    private final ForemanMetrics metrics;
    private final Clock clock;

    public ExecutionService(EventBus eventBus,
                            ConcurrencyManager concurrencyManager,
                            WorktreeResolver worktreeResolver,
                            FeatureStore featureStore,
                            PipelineOrchestrator orchestrator,
                            PlanApprovalService planApprovalService,
                            FailureTracker failureTracker,
                            Consumer<PartitionKey> executionStateRefresher,
                            ExecutorService executor,
                            ForemanMetrics metrics,
                            Clock clock) {
        this.eventBus = eventBus;
        this.concurrencyManager = concurrencyManager;
        this.worktreeResolver = worktreeResolver;
        this.featureStore = featureStore;
        this.orchestrator = orchestrator;
        this.planApprovalService = planApprovalService;
        this.failureTracker = failureTracker;
        this.executionStateRefresher = executionStateRefresher;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CompletableFuture<PipelineResult> executeFeature(String projectPath, String featureId,
                                                            boolean useWorktrees, boolean isAutoMode) {
        return executeFeature(projectPath, featureId, useWorktrees, isAutoMode, ExecutionOptions.DEFAULT);
    }

    /**
     * Registers the feature as running and submits its pipeline.
     *
     * @return a future completed with the pipeline outcome; it never completes exceptionally
     *         for pipeline failures
     * @throws FeatureNotFoundException if the feature does not exist
     * @throws IllegalStateException    if the feature is already running
     */
    public CompletableFuture<PipelineResult> executeFeature(String projectPath, String featureId,
                                                            boolean useWorktrees, boolean isAutoMode,
                                                            ExecutionOptions options) {
        Feature feature = featureStore.load(projectPath, featureId)
                .orElseThrow(() -> new FeatureNotFoundException(featureId));
        RunningFeature entry = concurrencyManager.acquire(featureId, projectPath, feature.branchName(),
                isAutoMode, options.allowReuse());

        var result = new CompletableFuture<PipelineResult>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(runFeature(projectPath, featureId, useWorktrees, isAutoMode, options, entry));
                } catch (Error e) {
                    result.completeExceptionally(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            concurrencyManager.release(entry);
            throw e;
        }
        return result;
    }

    private PipelineResult runFeature(String projectPath, String featureId, boolean useWorktrees,
                                      boolean isAutoMode, ExecutionOptions options, RunningFeature entry) {
        Instant started = clock.instant();
        MdcContext.setFeature(projectPath, entry.branchName(), featureId);
        Feature feature = null;
        PipelineResult result;
        try {
            if (!entry.bindWorker(Thread.currentThread())) {
                return recordOutcome(onInterrupted(projectPath, featureId, null, entry), started);
            }
            if (isAutoMode) {
                refreshExecutionState(entry.partitionKey());
            }

            feature = featureStore.load(projectPath, featureId)
                    .orElseThrow(() -> new FeatureNotFoundException(featureId));

            String continuationPrompt = options.continuationPrompt();
            if (continuationPrompt == null) {
                continuationPrompt = resolveContinuation(projectPath, feature);
            }

            Path workDir = resolveWorkDir(projectPath, feature, useWorktrees);
            if (!workDir.equals(Path.of(projectPath))) {
                entry.setWorktreePath(workDir);
            }

            feature = featureStore.save(projectPath, feature
                    .withStatus(FeatureStatus.IN_PROGRESS)
                    .withStartedAt(started)
                    .withError(null));

            var featureInfo = new LinkedHashMap<String, Object>();
            featureInfo.put("id", featureId);
            featureInfo.put("title", feature.title() != null ? feature.title() : "Loading...");
            featureInfo.put("description", feature.description() != null ? feature.description() : "Feature is starting");
            emit(AutoModeEvent.AUTO_MODE_FEATURE_START, projectPath, feature.branchName(), featureId,
                    payload("message", "Starting feature " + feature.displayTitle(), "feature", featureInfo));
            log.info("Feature {} started in {}", featureId, workDir);

            result = orchestrator.executePipeline(new PipelineContext(projectPath, feature, workDir, entry,
                    continuationPrompt));

            if (result.isSuccess()) {
                onSuccess(projectPath, feature, entry, result, started);
            } else {
                onRejected(projectPath, feature, result);
            }
        } catch (Exception e) {
            ErrorInfo errorInfo = ErrorClassifier.classify(e);
            if (errorInfo.isAbort() || entry.isCancelled()) {
                result = onInterrupted(projectPath, featureId, feature, entry);
            } else {
                log.error("Feature {} failed: {}", featureId, errorInfo.message(), e);
                result = onFailure(projectPath, featureId, feature, entry, errorInfo);
            }
        } finally {
            entry.unbindWorker();
            // An interrupt aimed at this feature must not leak into the next task on this pool thread
            Thread.interrupted();
            concurrencyManager.release(entry);
            if (isAutoMode) {
                refreshExecutionState(entry.partitionKey());
            }
            MdcContext.clear();
        }

        return recordOutcome(result, started);
    }

    private PipelineResult recordOutcome(PipelineResult result, Instant started) {
        metrics.recordFeatureExecution(result.outcome().name().toLowerCase(Locale.ROOT),
                Duration.between(started, clock.instant()).toMillis());
        return result;
    }

    /**
     * Chooses the continuation prompt for a run without one: an approved plan wins, then any
     * context left by an earlier run.
     */
    private String resolveContinuation(String projectPath, Feature feature) {
        if (feature.planSpec() != null && feature.planSpec().status() == PlanStatus.APPROVED) {
            log.info("Feature {} has an approved plan, continuing with it", feature.id());
            return PromptBuilder.continuationAfterApproval(feature, feature.planSpec().content(),
                    feature.planSpec().feedback());
        }
        Optional<String> previous = featureStore.readAgentOutput(projectPath, feature.id())
                .filter(output -> !output.isBlank());
        if (previous.isPresent()) {
            log.info("Feature {} has previous agent context, resuming", feature.id());
            return PromptBuilder.continuationFromContext(feature, previous.get());
        }
        return null;
    }

    private Path resolveWorkDir(String projectPath, Feature feature, boolean useWorktrees) {
        Path workDir = Path.of(projectPath);
        if (useWorktrees && feature.branchName() != null) {
            Optional<Path> worktree = worktreeResolver.findWorktreePath(projectPath, feature.branchName());
            if (worktree.isPresent()) {
                log.info("Using worktree for branch \"{}\": {}", feature.branchName(), worktree.get());
                workDir = worktree.get();
            } else {
                log.warn("No worktree found for branch \"{}\", running in project directory", feature.branchName());
            }
        }
        if (!Files.isDirectory(workDir)) {
            throw new IllegalStateException("Working directory does not exist: " + workDir);
        }
        return workDir.toAbsolutePath().normalize();
    }

    private void onSuccess(String projectPath, Feature feature, RunningFeature entry,
                           PipelineResult result, Instant started) {
        PartitionKey key = entry.partitionKey();
        failureTracker.recordSuccess(key.projectPath(), key.branchName());

        long elapsedSeconds = Math.round(Duration.between(started, clock.instant()).toMillis() / 1000.0);
        String message = "Feature completed in " + elapsedSeconds + "s";
        if (result.outcome() == PipelineResult.Outcome.SUCCEEDED) {
            message += " - auto-verified";
        }
        var data = payload(
                "message", message,
                "featureName", feature.title(),
                "passes", true,
                "model", entry.model(),
                "provider", entry.provider());
        emit(AutoModeEvent.AUTO_MODE_FEATURE_COMPLETE, projectPath, feature.branchName(), feature.id(), data);
        log.info("Feature {} completed in {}s", feature.id(), elapsedSeconds);
    }

    private void onRejected(String projectPath, Feature feature, PipelineResult result) {
        String message = result.error() != null ? result.error().message() : "Feature did not complete";
        emit(AutoModeEvent.AUTO_MODE_FEATURE_COMPLETE, projectPath, feature.branchName(), feature.id(),
                payload("message", message, "featureName", feature.title(), "passes", false));
        log.info("Feature {} returned to backlog: {}", feature.id(), message);
    }

    private PipelineResult onInterrupted(String projectPath, String featureId, Feature feature, RunningFeature entry) {
        try {
            featureStore.updateStatus(projectPath, featureId, FeatureStatus.INTERRUPTED);
        } catch (RuntimeException e) {
            log.warn("Could not mark feature {} interrupted: {}", featureId, e.getMessage());
        }
        emit(AutoModeEvent.AUTO_MODE_FEATURE_COMPLETE, projectPath, entry.branchName(), featureId, payload(
                "message", "Feature stopped by user",
                "featureName", feature != null ? feature.title() : null,
                "passes", false));
        log.info("Feature {} stopped", featureId);
        return PipelineResult.cancelled(ErrorInfo.of(ErrorType.ABORT, "Feature stopped by user"));
    }

    private PipelineResult onFailure(String projectPath, String featureId, Feature feature,
                                     RunningFeature entry, ErrorInfo errorInfo) {
        try {
            Feature current = featureStore.load(projectPath, featureId).orElse(null);
            if (current != null) {
                featureStore.save(projectPath, current.withStatus(FeatureStatus.BACKLOG).withError(errorInfo.message()));
            }
        } catch (RuntimeException e) {
            log.warn("Could not return feature {} to backlog: {}", featureId, e.getMessage());
        }

        emit(AutoModeEvent.AUTO_MODE_ERROR, projectPath, entry.branchName(), featureId, payload(
                "message", errorInfo.message(),
                "error", errorInfo.message(),
                "errorType", errorInfo.type().value(),
                "featureName", feature != null ? feature.title() : null));

        PartitionKey key = entry.partitionKey();
        if (errorInfo.countsTowardBreaker()
                && failureTracker.trackFailureAndCheckPause(key.projectPath(), key.branchName(), errorInfo)) {
            failureTracker.signalShouldPause(key.projectPath(), key.branchName(), errorInfo);
        }
        return PipelineResult.failed(errorInfo);
    }

    /**
     * Stops a running feature: cancels a pending plan approval, interrupts its worker and
     * frees its registry slot immediately.
     *
     * @return false if the feature was not running
     */
    public boolean stopFeature(String featureId) {
        Optional<RunningFeature> running = concurrencyManager.getRunningFeature(featureId);
        if (running.isEmpty()) {
            return false;
        }
        RunningFeature entry = running.get();
        planApprovalService.cancelApproval(entry.projectPath(), featureId);
        entry.cancel();
        concurrencyManager.release(featureId, true);
        log.info("Stop requested for feature {}", featureId);
        return true;
    }

    private void refreshExecutionState(PartitionKey key) {
        try {
            executionStateRefresher.accept(key);
        } catch (RuntimeException e) {
            log.warn("Failed to save execution state for {}: {}", key, e.getMessage());
        }
    }

    private void emit(String type, String projectPath, String branchName, String featureId, Map<String, Object> payload) {
        eventBus.publish(AutoModeEvent.of(type, projectPath, branchName, featureId, payload));
    }
}
