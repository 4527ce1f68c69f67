package com.foreman.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.concurrency.RunningFeature;
import com.foreman.core.error.AutoLoopAlreadyRunningException;
import com.foreman.core.error.ErrorClassifier;
import com.foreman.core.error.ErrorInfo;
import com.foreman.core.error.FeatureNotFoundException;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.execution.ApprovalResult;
import com.foreman.core.execution.ExecutionOptions;
import com.foreman.core.execution.ExecutionService;
import com.foreman.core.execution.PipelineOrchestrator;
import com.foreman.core.execution.PipelineResult;
import com.foreman.core.execution.PlanApprovalService;
import com.foreman.core.execution.PromptBuilder;
import com.foreman.core.feature.FeatureStore;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.AutoModeConfig;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PartitionKey;
import com.foreman.core.model.PlanSpec;
import com.foreman.core.recovery.RecoveryService;
import com.foreman.core.scheduler.AutoLoopCallbacks;
import com.foreman.core.scheduler.AutoLoopCoordinator;
import com.foreman.core.scheduler.FailureTracker;
import com.foreman.core.settings.AutoModeProperties;
import com.foreman.core.settings.SettingsProvider;
import com.foreman.core.worktree.WorktreeResolver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static com.foreman.core.events.AutoModeEvent.payload;

/**
 * Entry point for auto mode: owns the scheduler, the execution lifecycle and recovery for
 * every project served by this process.
 * <p>
 * Errors escaping an operation are classified, published as {@code auto_mode_error} unless
 * they are aborts, and rethrown. Caller mistakes (unknown feature, duplicate start, bad
 * arguments) are rethrown without an event.
 */
@Service
public class AutoModeService {

    private static final Logger log = LoggerFactory.getLogger(AutoModeService.class);

    private final EventBus eventBus;
    private final ConcurrencyManager concurrencyManager;
    private final WorktreeResolver worktreeResolver;
    private final FeatureStore featureStore;
    private final PlanApprovalService planApprovalService;
    private final AutoModeProperties properties;

    private final ExecutionService executionService;
    private final RecoveryService recoveryService;
    private final AutoLoopCoordinator coordinator;

    public AutoModeService(EventBus eventBus,
                           ConcurrencyManager concurrencyManager,
                           WorktreeResolver worktreeResolver,
                           FeatureStore featureStore,
                           PipelineOrchestrator orchestrator,
                           PlanApprovalService planApprovalService,
                           Optional<SettingsProvider> settingsProvider,
                           AutoModeProperties properties,
                           ForemanMetrics metrics,
                           ObjectMapper objectMapper,
                           Clock clock,
                           @Qualifier("featureExecutor") ExecutorService featureExecutor) {
        this.eventBus = eventBus;
        this.concurrencyManager = concurrencyManager;
        this.worktreeResolver = worktreeResolver;
        this.featureStore = featureStore;
        this.planApprovalService = planApprovalService;
        this.properties = properties;

        this.executionService = new ExecutionService(eventBus, concurrencyManager, worktreeResolver, featureStore,
                orchestrator, planApprovalService, new CoordinatorFailureTracker(), this::refreshExecutionState,
                featureExecutor, metrics, clock);
        this.recoveryService = new RecoveryService(featureStore, executionService, concurrencyManager, eventBus,
                objectMapper, properties.getDataDir(), metrics, clock);

        var callbacks = new AutoLoopCallbacks(
                this::loadPendingFeatures,
                Optional.<AutoLoopCallbacks.AllFeaturesLoader>of(featureStore::loadAll),
                executionService::executeFeature,
                feature -> feature.status().isTerminalSuccess(),
                concurrencyManager::isRunning,
                recoveryService::saveExecutionStateForProject,
                recoveryService::clearExecutionState,
                this::resetStuckFeatures);
        this.coordinator = new AutoLoopCoordinator(eventBus, concurrencyManager, settingsProvider, callbacks,
                properties.getAutoMode(), metrics, clock);

        metrics.registerRunningFeaturesGauge(concurrencyManager::getRunningCount);
    }

    // --- Auto loop ---

    public int startAutoLoop(String projectPath, String branchName, Integer maxConcurrency) {
        requireProjectPath(projectPath);
        return guarded(projectPath, branchName, null,
                () -> coordinator.startAutoLoop(projectPath, branchName, maxConcurrency));
    }

    public int stopAutoLoop(String projectPath, String branchName) {
        requireProjectPath(projectPath);
        return guarded(projectPath, branchName, null, () -> coordinator.stopAutoLoop(projectPath, branchName));
    }

    public boolean isAutoLoopRunning(String projectPath, String branchName) {
        return coordinator.isAutoLoopRunning(projectPath, branchName);
    }

    public Optional<AutoModeConfig> getAutoLoopConfig(String projectPath, String branchName) {
        return coordinator.getAutoLoopConfig(projectPath, branchName);
    }

    public List<String> getActiveAutoLoopProjects() {
        return coordinator.getActiveProjects();
    }

    public List<PartitionKey> getActiveAutoLoopWorktrees() {
        return coordinator.getActiveWorktrees();
    }

    /**
     * The partition a project and branch map to; the primary branch maps to the main worktree.
     */
    public PartitionKey resolvePartition(String projectPath, String branchName) {
        return concurrencyManager.partitionKey(projectPath, branchName);
    }

    // --- Features ---

    public CompletableFuture<PipelineResult> executeFeature(String projectPath, String featureId,
                                                            boolean useWorktrees, boolean isAutoMode) {
        requireProjectPath(projectPath);
        return guarded(projectPath, null, featureId,
                () -> executionService.executeFeature(projectPath, featureId, useWorktrees, isAutoMode));
    }

    public boolean stopFeature(String featureId) {
        return executionService.stopFeature(featureId);
    }

    public Optional<CompletableFuture<PipelineResult>> resumeFeature(String projectPath, String featureId,
                                                                     boolean useWorktrees) {
        requireProjectPath(projectPath);
        return guarded(projectPath, null, featureId,
                () -> recoveryService.resumeFeature(projectPath, featureId, useWorktrees));
    }

    public boolean contextExists(String projectPath, String featureId) {
        return recoveryService.contextExists(projectPath, featureId);
    }

    public List<String> resumeInterruptedFeatures(String projectPath) {
        requireProjectPath(projectPath);
        return guarded(projectPath, null, null, () -> recoveryService.resumeInterruptedFeatures(
                projectPath, properties.getAutoMode().isUseWorktrees()));
    }

    // --- Plan approval ---

    /**
     * Resolves a pending plan approval. When the waiting execution is gone (e.g. after a
     * restart) the decision is applied to the stored feature and an approved plan is executed
     * as a continuation.
     */
    public ApprovalResult resolvePlanApproval(String projectPath, String featureId, boolean approved,
                                              String editedPlan, String feedback) {
        requireProjectPath(projectPath);
        return guarded(projectPath, null, featureId, () -> {
            ApprovalResult result = planApprovalService.resolveApproval(projectPath, featureId, approved,
                    editedPlan, feedback);
            if (!result.needsRecovery()) {
                return result;
            }
            Feature feature = featureStore.load(projectPath, featureId)
                    .orElseThrow(() -> new FeatureNotFoundException(featureId));
            PlanSpec plan = feature.planSpec();
            if (!approved) {
                featureStore.save(projectPath, feature.withPlanSpec(plan.rejected(feedback))
                        .withStatus(FeatureStatus.BACKLOG));
                eventBus.publish(AutoModeEvent.of(AutoModeEvent.PLAN_REJECTED, projectPath, feature.branchName(),
                        featureId, payload("message", "Plan rejected", "feedback", feedback != null ? feedback : "")));
                return result;
            }
            PlanSpec approvedPlan = plan.approved(editedPlan, feedback);
            Feature updated = featureStore.save(projectPath, feature.withPlanSpec(approvedPlan));
            eventBus.publish(AutoModeEvent.of(AutoModeEvent.PLAN_APPROVED, projectPath, feature.branchName(),
                    featureId, payload("message", "Plan approved")));
            log.info("Restarting feature {} with approved plan", featureId);
            executionService.executeFeature(projectPath, featureId, properties.getAutoMode().isUseWorktrees(), false,
                    ExecutionOptions.continuation(
                            PromptBuilder.continuationAfterApproval(updated, approvedPlan.content(), feedback)));
            return result;
        });
    }

    public boolean hasPendingApproval(String projectPath, String featureId) {
        return planApprovalService.hasPendingApproval(projectPath, featureId);
    }

    public void cancelPlanApproval(String projectPath, String featureId) {
        planApprovalService.cancelApproval(projectPath, featureId);
    }

    // --- Status ---

    public AutoModeStatus getStatus() {
        List<String> running = concurrencyManager.getAllRunning().stream().map(RunningFeature::featureId).toList();
        return new AutoModeStatus(!running.isEmpty(), running.size(), running,
                coordinator.getActiveProjects(), coordinator.getActiveWorktrees());
    }

    public ProjectStatus getStatusForProject(String projectPath, String branchName) {
        requireProjectPath(projectPath);
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        int maxConcurrency = coordinator.getAutoLoopConfig(projectPath, branchName)
                .map(AutoModeConfig::maxConcurrency)
                .orElseGet(() -> coordinator.resolveMaxConcurrency(projectPath, branchName, null));
        List<String> running = concurrencyManager.getRunningFeaturesForWorktree(projectPath, branchName);
        return new ProjectStatus(key.projectPath(), key.branchName(),
                coordinator.isAutoLoopRunning(projectPath, branchName), running.size(), running, maxConcurrency);
    }

    public List<RunningAgentInfo> getRunningAgents() {
        var agents = new ArrayList<RunningAgentInfo>();
        for (RunningFeature entry : concurrencyManager.getAllRunning()) {
            Optional<Feature> feature = Optional.empty();
            try {
                feature = featureStore.load(entry.projectPath(), entry.featureId());
            } catch (RuntimeException e) {
                log.debug("Could not load feature {} for running agents: {}", entry.featureId(), e.getMessage());
            }
            Path fileName = Path.of(entry.projectPath()).getFileName();
            agents.add(new RunningAgentInfo(
                    entry.featureId(),
                    entry.projectPath(),
                    fileName != null ? fileName.toString() : entry.projectPath(),
                    entry.branchName(),
                    entry.isAutoMode(),
                    entry.model(),
                    entry.provider(),
                    entry.startTime(),
                    feature.map(Feature::displayTitle).orElse(null),
                    feature.map(Feature::description).orElse(null)));
        }
        return agents;
    }

    /**
     * Whether the partition of the given feature can take one more agent. An unknown feature
     * is treated as belonging to the main worktree.
     */
    public WorktreeCapacity checkWorktreeCapacity(String projectPath, String featureId) {
        requireProjectPath(projectPath);
        String branchName = featureStore.load(projectPath, featureId).map(Feature::branchName).orElse(null);
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        int maxAgents = coordinator.resolveMaxConcurrency(projectPath, key.branchName(), null);
        int currentAgents = concurrencyManager.getRunningCountForWorktree(projectPath, key.branchName());
        return new WorktreeCapacity(currentAgents < maxAgents, currentAgents, maxAgents, key.branchName());
    }

    // --- Maintenance ---

    /**
     * Features assigned to a branch that no longer exists in the repository.
     */
    public List<Feature> detectOrphanedFeatures(String projectPath) {
        requireProjectPath(projectPath);
        String primary = worktreeResolver.getPrimaryBranch(projectPath);
        var orphaned = new ArrayList<Feature>();
        for (Feature feature : featureStore.loadAll(projectPath)) {
            String branch = feature.branchName();
            if (branch == null || branch.isBlank() || branch.equals(primary)) {
                continue;
            }
            if (!worktreeResolver.branchExists(projectPath, branch)) {
                orphaned.add(feature);
            }
        }
        if (!orphaned.isEmpty()) {
            log.info("Found {} orphaned feature(s) in {}", orphaned.size(), projectPath);
        }
        return orphaned;
    }

    /**
     * Marks every running feature as interrupted, e.g. before the process exits.
     *
     * @return number of features marked
     */
    public int markAllRunningFeaturesInterrupted(String reason) {
        int marked = 0;
        for (RunningFeature entry : concurrencyManager.getAllRunning()) {
            try {
                featureStore.updateStatus(entry.projectPath(), entry.featureId(), FeatureStatus.INTERRUPTED);
                marked++;
            } catch (RuntimeException e) {
                log.warn("Failed to mark feature {} as interrupted: {}", entry.featureId(), e.getMessage());
            }
        }
        if (marked > 0) {
            log.info("Marked {} running feature(s) as interrupted: {}", marked, reason);
        }
        return marked;
    }

    // --- Lifecycle ---

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        var recovery = properties.getRecovery();
        if (!recovery.isResumeOnStartup() || recovery.getProjects().isEmpty()) {
            return;
        }
        log.info("Recovering {} project(s)", recovery.getProjects().size());
        for (String projectPath : recovery.getProjects()) {
            try {
                recoveryService.resumeInterruptedFeatures(projectPath, properties.getAutoMode().isUseWorktrees());
            } catch (RuntimeException e) {
                log.warn("Failed to resume interrupted features in {}: {}", projectPath, e.getMessage(), e);
            }
        }
        int restored = recoveryService.restoreAutoLoops(recovery.getProjects(), coordinator::startAutoLoop);
        log.info("Restored {} auto loop(s)", restored);
    }

    @PreDestroy
    public void shutdown() {
        markAllRunningFeaturesInterrupted("server shutting down");
        coordinator.shutdown();
    }

    AutoLoopCoordinator coordinator() {
        return coordinator;
    }

    // --- Callbacks ---

    private List<Feature> loadPendingFeatures(String projectPath, String branchName) {
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        return featureStore.loadAll(projectPath).stream()
                .filter(f -> f.status().isPending())
                .filter(f -> concurrencyManager.partitionKey(projectPath, f.branchName()).equals(key))
                .toList();
    }

    /**
     * Features left {@code in_progress} by a crashed run go back to the backlog so the loop
     * picks them up again.
     */
    private void resetStuckFeatures(String projectPath) {
        for (Feature feature : featureStore.loadAll(projectPath)) {
            if (feature.status() == FeatureStatus.IN_PROGRESS && !concurrencyManager.isRunning(feature.id())) {
                featureStore.updateStatus(projectPath, feature.id(), FeatureStatus.BACKLOG);
                log.info("Reset stuck feature {} to backlog", feature.id());
            }
        }
    }

    private void refreshExecutionState(PartitionKey key) {
        coordinator.getAutoLoopConfig(key.projectPath(), key.branchName()).ifPresent(config ->
                recoveryService.saveExecutionStateForProject(key.projectPath(), key.branchName(),
                        config.maxConcurrency()));
    }

    // --- Error boundary ---

    private <T> T guarded(String projectPath, String branchName, String featureId, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (AutoLoopAlreadyRunningException | FeatureNotFoundException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            ErrorInfo errorInfo = ErrorClassifier.classify(e);
            if (!errorInfo.isAbort()) {
                log.error("Auto mode operation failed for {}: {}", projectPath, e.getMessage(), e);
                eventBus.publish(AutoModeEvent.of(AutoModeEvent.AUTO_MODE_ERROR, projectPath, branchName, featureId,
                        payload("message", errorInfo.message(),
                                "error", errorInfo.message(),
                                "errorType", errorInfo.type().value())));
            }
            throw e;
        }
    }

    private static void requireProjectPath(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            throw new IllegalArgumentException("projectPath is required");
        }
    }

    /**
     * Routes completion signals to the coordinator, which is created after the execution service.
     */
    private class CoordinatorFailureTracker implements FailureTracker {

        @Override
        public boolean trackFailureAndCheckPause(String projectPath, String branchName, ErrorInfo errorInfo) {
            return coordinator.trackFailureAndCheckPause(projectPath, branchName, errorInfo);
        }

        @Override
        public void signalShouldPause(String projectPath, String branchName, ErrorInfo errorInfo) {
            coordinator.signalShouldPause(projectPath, branchName, errorInfo);
        }

        @Override
        public void recordSuccess(String projectPath, String branchName) {
            coordinator.recordSuccess(projectPath, branchName);
        }
    }
}
