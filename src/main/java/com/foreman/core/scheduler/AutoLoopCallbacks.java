package com.foreman.core.scheduler;

import com.foreman.core.model.Feature;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Collaborators the {@link AutoLoopCoordinator} calls back into.
 * <p>
 * The all-features loader is optional; without it dependency checks are bypassed.
 */
public record AutoLoopCallbacks(
    PendingFeatureLoader pendingFeatureLoader,
    Optional<AllFeaturesLoader> allFeaturesLoader,
    FeatureExecutor featureExecutor,
    FeatureFinishedPredicate featureFinished,
    FeatureRunningPredicate featureRunning,
    ExecutionStateSaver executionStateSaver,
    ExecutionStateClearer executionStateClearer,
    StuckFeatureResetter stuckFeatureResetter
) {

    public AutoLoopCallbacks {
        Objects.requireNonNull(pendingFeatureLoader, "pendingFeatureLoader");
        Objects.requireNonNull(featureExecutor, "featureExecutor");
        allFeaturesLoader = allFeaturesLoader == null ? Optional.empty() : allFeaturesLoader;
        featureFinished = featureFinished == null ? feature -> feature.status().isTerminalSuccess() : featureFinished;
        featureRunning = featureRunning == null ? featureId -> false : featureRunning;
        executionStateSaver = executionStateSaver == null ? (path, branch, max) -> { } : executionStateSaver;
        executionStateClearer = executionStateClearer == null ? (path, branch) -> { } : executionStateClearer;
        stuckFeatureResetter = stuckFeatureResetter == null ? path -> { } : stuckFeatureResetter;
    }

    /** Loads the pending (backlog or ready) features of one partition, in store order. */
    @FunctionalInterface
    public interface PendingFeatureLoader {
        List<Feature> loadPending(String projectPath, String branchName) throws Exception;
    }

    @FunctionalInterface
    public interface AllFeaturesLoader {
        List<Feature> loadAll(String projectPath) throws Exception;
    }

    /**
     * Starts a feature. Implementations register the feature as running before returning
     * and complete the future when execution ends; the loop never waits on it.
     */
    @FunctionalInterface
    public interface FeatureExecutor {
        CompletableFuture<?> execute(String projectPath, String featureId, boolean useWorktrees, boolean isAutoMode);
    }

    @FunctionalInterface
    public interface FeatureFinishedPredicate {
        boolean isFinished(Feature feature);
    }

    @FunctionalInterface
    public interface FeatureRunningPredicate {
        boolean isRunning(String featureId);
    }

    @FunctionalInterface
    public interface ExecutionStateSaver {
        void save(String projectPath, String branchName, int maxConcurrency);
    }

    @FunctionalInterface
    public interface ExecutionStateClearer {
        void clear(String projectPath, String branchName);
    }

    @FunctionalInterface
    public interface StuckFeatureResetter {
        void reset(String projectPath);
    }
}
