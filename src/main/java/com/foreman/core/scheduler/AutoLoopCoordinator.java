package com.foreman.core.scheduler;

import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.error.AutoLoopAlreadyRunningException;
import com.foreman.core.error.ErrorInfo;
import com.foreman.core.error.ErrorType;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.AutoModeConfig;
import com.foreman.core.model.Feature;
import com.foreman.core.model.PartitionKey;
import com.foreman.core.settings.AutoModeProperties;
import com.foreman.core.settings.GlobalSettings;
import com.foreman.core.settings.SettingsProvider;
import com.foreman.core.settings.WorktreeAutoModeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.foreman.core.events.AutoModeEvent.payload;

/**
 * Runs one scheduling loop per partition (project plus branch).
 * <p>
 * Each loop polls pending features, filters out finished, running and dependency-blocked
 * ones, and dispatches the most urgent eligible features until the partition's concurrency
 * limit is reached. Dispatch is fire-and-forget: outcomes come back through the
 * {@link FailureTracker} methods, which drive the consecutive-failure circuit breaker.
 */
public class AutoLoopCoordinator implements FailureTracker {

    private static final Logger log = LoggerFactory.getLogger(AutoLoopCoordinator.class);

    private static final int DEFAULT_MAX_CONCURRENCY = 1;

    private final EventBus eventBus;
    private final ConcurrencyManager concurrencyManager;
    private final Optional<SettingsProvider> settingsProvider;
    private final AutoLoopCallbacks callbacks;
    private final AutoModeProperties.AutoMode config;
    private final ForemanMetrics metrics;
    private final FeatureSelector selector = new FeatureSelector();
    private final Clock clock;

    private final ConcurrentHashMap<PartitionKey, ProjectAutoLoopState> loops = new ConcurrentHashMap<>();

    public AutoLoopCoordinator(EventBus eventBus,
                               ConcurrencyManager concurrencyManager,
                               Optional<SettingsProvider> settingsProvider,
                               AutoLoopCallbacks callbacks,
                               AutoModeProperties.AutoMode config,
                               ForemanMetrics metrics,
                               Clock clock) {
        this.eventBus = eventBus;
        this.concurrencyManager = concurrencyManager;
        this.settingsProvider = settingsProvider;
        this.callbacks = callbacks;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    // --- Lifecycle ---

    /**
     * Starts the auto loop for a partition.
     *
     * @param maxConcurrency requested concurrency, or null to resolve it from settings
     * @return the effective concurrency
     * @throws AutoLoopAlreadyRunningException if the partition already has a loop
     */
    public int startAutoLoop(String projectPath, String branchName, Integer maxConcurrency) {
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        int resolved = resolveMaxConcurrency(projectPath, branchName, maxConcurrency);
        var loopConfig = new AutoModeConfig(resolved, config.isUseWorktrees(), key.projectPath(), key.branchName());
        var state = new ProjectAutoLoopState(key, loopConfig);

        if (loops.putIfAbsent(key, state) != null) {
            throw new AutoLoopAlreadyRunningException("Auto mode is already running for "
                    + key.describeWorktree() + " in project: " + key.projectPath());
        }

        try {
            callbacks.stuckFeatureResetter().reset(key.projectPath());
        } catch (RuntimeException e) {
            log.warn("Failed to reset stuck features for {}: {}", key.projectPath(), e.getMessage(), e);
        }

        try {
            callbacks.executionStateSaver().save(key.projectPath(), key.branchName(), resolved);
        } catch (RuntimeException e) {
            log.warn("Failed to save execution state for {}: {}", key, e.getMessage(), e);
        }

        if (callbacks.allFeaturesLoader().isEmpty()) {
            log.warn("No all-features loader configured for {}; dependency checks are bypassed", key);
        }

        emit(AutoModeEvent.AUTO_MODE_STARTED, key, null, payload(
                "message", "Auto mode started with max " + resolved + " concurrent features",
                "maxConcurrency", resolved));
        log.info("Auto mode started for {} in {} (maxConcurrency={})",
                key.describeWorktree(), key.projectPath(), resolved);

        Thread thread = new Thread(() -> runLoop(state), "auto-loop-" + key.displayName());
        thread.setDaemon(true);
        state.attachThread(thread);
        thread.start();
        return resolved;
    }

    /**
     * Stops the loop for a partition and clears its persisted execution state.
     * Features already dispatched keep running.
     *
     * @return number of features running in the partition at stop time, 0 if no loop was running
     */
    public int stopAutoLoop(String projectPath, String branchName) {
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        ProjectAutoLoopState state = loops.remove(key);
        if (state == null) {
            return 0;
        }
        state.stop();
        int runningCount = concurrencyManager.getRunningCountForWorktree(key.projectPath(), key.branchName());

        try {
            callbacks.executionStateClearer().clear(key.projectPath(), key.branchName());
        } catch (RuntimeException e) {
            log.warn("Failed to clear execution state for {}: {}", key, e.getMessage(), e);
        }

        emit(AutoModeEvent.AUTO_MODE_STOPPED, key, null, payload("message", "Auto mode stopped"));
        log.info("Auto mode stopped for {} in {} ({} features still running)",
                key.describeWorktree(), key.projectPath(), runningCount);
        return runningCount;
    }

    /**
     * Stops every loop without clearing persisted state so loops are restored on the next start.
     */
    public void shutdown() {
        var states = new ArrayList<>(loops.values());
        loops.clear();
        for (ProjectAutoLoopState state : states) {
            state.stop();
        }
        for (ProjectAutoLoopState state : states) {
            Thread thread = state.thread();
            if (thread == null) {
                continue;
            }
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (!states.isEmpty()) {
            log.info("Shut down {} auto loop(s)", states.size());
        }
    }

    // --- Control loop ---

    private void runLoop(ProjectAutoLoopState state) {
        MdcContext.setPartition(state.key());
        log.debug("Auto loop thread started");
        try {
            while (state.isRunning() && !state.isPaused()) {
                try {
                    tick(state);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.error("Auto loop iteration failed: {}", e.getMessage(), e);
                    emitError(state.key(), null, e.getMessage());
                    try {
                        state.sleep(config.getErrorBackoff());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            log.debug("Auto loop thread exited");
            MdcContext.clear();
        }
    }

    /**
     * One scheduling pass. Always ends with a cancellable sleep.
     */
    void tick(ProjectAutoLoopState state) throws InterruptedException {
        PartitionKey key = state.key();
        int maxConcurrency = state.config().maxConcurrency();

        List<Feature> pending;
        List<Feature> allFeatures = null;
        try {
            pending = callbacks.pendingFeatureLoader().loadPending(key.projectPath(), key.branchName());
            if (callbacks.allFeaturesLoader().isPresent()) {
                allFeatures = callbacks.allFeaturesLoader().get().loadAll(key.projectPath());
            }
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Failed to load features for {}: {}", key, e.getMessage(), e);
            emitError(key, null, "Failed to load features: " + e.getMessage());
            state.sleep(config.getErrorBackoff());
            return;
        }

        if (state.isPaused() || !state.isRunning()) {
            return;
        }

        int runningCount = concurrencyManager.getRunningCountForWorktree(key.projectPath(), key.branchName());
        if (runningCount >= maxConcurrency) {
            log.debug("At capacity ({}/{}), waiting", runningCount, maxConcurrency);
            state.sleep(config.getCapacityWait());
            return;
        }

        List<Feature> eligible = selector.selectEligible(pending, allFeatures,
                callbacks.featureFinished(), callbacks.featureRunning());

        if (eligible.isEmpty()) {
            if (runningCount == 0) {
                emit(AutoModeEvent.AUTO_MODE_IDLE, key, null,
                        payload("message", "No pending features - auto mode idle"));
                metrics.recordIdle();
                log.debug("No pending features, idle");
            }
            state.sleep(config.getPollInterval());
            return;
        }

        int dispatched = 0;
        for (Feature feature : eligible) {
            if (!state.isRunning() || state.isPaused()) {
                break;
            }
            int current = concurrencyManager.getRunningCountForWorktree(key.projectPath(), key.branchName());
            if (Math.max(current, runningCount + dispatched) >= maxConcurrency) {
                break;
            }
            if (callbacks.featureRunning().isRunning(feature.id())) {
                continue;
            }
            try {
                log.info("Dispatching feature {} (priority {})", feature.id(), feature.effectivePriority());
                callbacks.featureExecutor().execute(key.projectPath(), feature.id(),
                        state.config().useWorktrees(), true);
                dispatched++;
                metrics.recordDispatch(true);
            } catch (RuntimeException e) {
                log.error("Failed to dispatch feature {}: {}", feature.id(), e.getMessage(), e);
                metrics.recordDispatch(false);
                emitError(key, feature.id(), e.getMessage());
            }
        }

        state.sleep(config.getPollInterval());
    }

    // --- Circuit breaker ---

    @Override
    public boolean trackFailureAndCheckPause(String projectPath, String branchName, ErrorInfo errorInfo) {
        ProjectAutoLoopState state = loops.get(concurrencyManager.partitionKey(projectPath, branchName));
        if (state == null) {
            return false;
        }
        if (errorInfo.isQuotaOrRateLimit()) {
            log.warn("{} error for {}, pausing immediately", errorInfo.type().value(), state.key());
            return true;
        }
        int failures = state.recordFailure();
        log.debug("Consecutive failures for {}: {}/{}", state.key(), failures, config.getFailureThreshold());
        return failures >= config.getFailureThreshold();
    }

    @Override
    public void signalShouldPause(String projectPath, String branchName, ErrorInfo errorInfo) {
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        ProjectAutoLoopState state = loops.get(key);
        if (state == null) {
            return;
        }
        state.setPaused(true);
        int failureCount = state.consecutiveFailures();
        String message = errorInfo.isQuotaOrRateLimit()
                ? "Auto mode paused: usage limit or rate limit reached. Resume once the limit resets."
                : "Auto mode paused: " + failureCount + " consecutive failures. Last error: " + errorInfo.message();

        metrics.recordBreakerPause(errorInfo.type().value());
        emit(AutoModeEvent.AUTO_MODE_PAUSED_FAILURES, key, null, payload(
                "message", message,
                "errorType", errorInfo.type().value(),
                "failureCount", failureCount,
                "lastError", errorInfo.message()));
        log.warn("Pausing auto mode for {}: {}", key, message);

        stopAutoLoop(key.projectPath(), key.branchName());
    }

    @Override
    public void recordSuccess(String projectPath, String branchName) {
        ProjectAutoLoopState state = loops.get(concurrencyManager.partitionKey(projectPath, branchName));
        if (state != null) {
            state.resetFailures();
        }
    }

    /**
     * Clears the failure counter and paused flag without stopping the loop.
     */
    public void resetFailureTracking(String projectPath, String branchName) {
        ProjectAutoLoopState state = loops.get(concurrencyManager.partitionKey(projectPath, branchName));
        if (state != null) {
            state.resetFailures();
            state.setPaused(false);
        }
    }

    // --- Queries ---

    public boolean isAutoLoopRunning(String projectPath, String branchName) {
        ProjectAutoLoopState state = loops.get(concurrencyManager.partitionKey(projectPath, branchName));
        return state != null && state.isRunning();
    }

    public Optional<AutoModeConfig> getAutoLoopConfig(String projectPath, String branchName) {
        ProjectAutoLoopState state = loops.get(concurrencyManager.partitionKey(projectPath, branchName));
        return Optional.ofNullable(state).map(ProjectAutoLoopState::config);
    }

    public List<String> getActiveProjects() {
        var projects = new LinkedHashSet<String>();
        for (PartitionKey key : loops.keySet()) {
            projects.add(key.projectPath());
        }
        return List.copyOf(projects);
    }

    public List<PartitionKey> getActiveWorktrees() {
        return List.copyOf(loops.keySet());
    }

    public int getRunningCountForWorktree(String projectPath, String branchName) {
        return concurrencyManager.getRunningCountForWorktree(projectPath, branchName);
    }

    /**
     * Resolves the concurrency for a partition: the explicit value, else the per-worktree
     * override, else the global setting, else 1. The result is clamped to
     * {@code [1, maxSystemConcurrency]}.
     */
    public int resolveMaxConcurrency(String projectPath, String branchName, Integer provided) {
        if (provided != null) {
            return clamp(provided);
        }
        GlobalSettings settings = loadSettings();
        if (settings == null) {
            return DEFAULT_MAX_CONCURRENCY;
        }
        PartitionKey key = concurrencyManager.partitionKey(projectPath, branchName);
        WorktreeAutoModeSettings override = settings.autoModeByWorktree().get(key);
        if (override == null && branchName != null) {
            override = settings.autoModeByWorktree().get(PartitionKey.of(projectPath, branchName));
        }
        if (override != null && override.maxConcurrency() != null) {
            return clamp(override.maxConcurrency());
        }
        if (settings.maxConcurrency() != null) {
            return clamp(settings.maxConcurrency());
        }
        return DEFAULT_MAX_CONCURRENCY;
    }

    private GlobalSettings loadSettings() {
        if (settingsProvider.isEmpty()) {
            return null;
        }
        try {
            return settingsProvider.get().getGlobalSettings();
        } catch (RuntimeException e) {
            log.warn("Failed to load settings, using default concurrency: {}", e.getMessage());
            return null;
        }
    }

    private int clamp(int value) {
        return Math.max(1, Math.min(value, config.getMaxSystemConcurrency()));
    }

    // --- Events ---

    private void emitError(PartitionKey key, String featureId, String message) {
        emit(AutoModeEvent.AUTO_MODE_ERROR, key, featureId, payload(
                "message", message != null ? message : "Unknown error",
                "errorType", ErrorType.UNKNOWN.value()));
    }

    private void emit(String type, PartitionKey key, String featureId, Map<String, Object> payload) {
        eventBus.publish(new AutoModeEvent(type, key.projectPath(), key.branchName(), featureId,
                payload, clock.instant()));
    }

}
