package com.foreman.core.recovery;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.error.AutoLoopAlreadyRunningException;
import com.foreman.core.error.FeatureNotFoundException;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.execution.ExecutionOptions;
import com.foreman.core.execution.ExecutionService;
import com.foreman.core.execution.PipelineResult;
import com.foreman.core.execution.PromptBuilder;
import com.foreman.core.feature.FeatureStore;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.ExecutionState;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PartitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persists per-partition scheduling configuration and brings work back after a restart.
 * <p>
 * Execution state lives in {@code <project>/<dataDir>/execution-state.json} as a list of
 * {@link ExecutionState} records, one per partition. Persistence failures are logged and never
 * propagate: losing the file only means loops are not restored automatically.
 */
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    static final String STATE_FILE = "execution-state.json";

    private static final TypeReference<List<ExecutionState>> STATE_LIST = new TypeReference<>() {};

    /**
     * Starts an auto loop; used to restore saved loops.
     */
    @FunctionalInterface
    public interface LoopStarter {
        int start(String projectPath, String branchName, Integer maxConcurrency);
    }

    private final FeatureStore featureStore;
    private final ExecutionService executionService;
    private final ConcurrencyManager concurrencyManager;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final String dataDir;
    private final ForemanMetrics metrics;
    private final Clock clock;

    public RecoveryService(FeatureStore featureStore,
                           ExecutionService executionService,
                           ConcurrencyManager concurrencyManager,
                           EventBus eventBus,
                           ObjectMapper objectMapper,
                           String dataDir,
                           ForemanMetrics metrics,
                           Clock clock) {
        this.featureStore = featureStore;
        this.executionService = executionService;
        this.concurrencyManager = concurrencyManager;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
        this.metrics = metrics;
        this.clock = clock;
    }

    // --- Execution state ---

    public synchronized void saveExecutionStateForProject(String projectPath, String branchName, int maxConcurrency) {
        var key = PartitionKey.of(projectPath, branchName);
        var states = new ArrayList<>(loadExecutionStates(projectPath));
        states.removeIf(s -> s.partitionKey().equals(key));
        states.add(new ExecutionState(projectPath, key.branchName(), maxConcurrency, clock.instant()));
        writeStates(projectPath, states);
        log.debug("Saved execution state for {} (maxConcurrency={})", key, maxConcurrency);
    }

    public synchronized void clearExecutionState(String projectPath, String branchName) {
        var key = PartitionKey.of(projectPath, branchName);
        var states = new ArrayList<>(loadExecutionStates(projectPath));
        if (!states.removeIf(s -> s.partitionKey().equals(key))) {
            return;
        }
        if (states.isEmpty()) {
            try {
                Files.deleteIfExists(stateFile(projectPath));
            } catch (IOException e) {
                log.warn("Failed to delete execution state for {}: {}", projectPath, e.getMessage());
            }
        } else {
            writeStates(projectPath, states);
        }
        log.debug("Cleared execution state for {}", key);
    }

    public List<ExecutionState> loadExecutionStates(String projectPath) {
        Path file = stateFile(projectPath);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            List<ExecutionState> states = objectMapper.readValue(file.toFile(), STATE_LIST);
            return states == null ? List.of() : states.stream().filter(Objects::nonNull).toList();
        } catch (IOException e) {
            log.warn("Failed to read execution state {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private void writeStates(String projectPath, List<ExecutionState> states) {
        Path file = stateFile(projectPath);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(STATE_FILE + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), states);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to write execution state for {}: {}", projectPath, e.getMessage());
        }
    }

    Path stateFile(String projectPath) {
        return Path.of(projectPath).resolve(dataDir).resolve(STATE_FILE);
    }

    // --- Resume ---

    /**
     * Whether an earlier run left agent output for the feature.
     */
    public boolean contextExists(String projectPath, String featureId) {
        try {
            return featureStore.readAgentOutput(projectPath, featureId)
                    .map(output -> !output.isBlank())
                    .orElse(false);
        } catch (RuntimeException e) {
            log.debug("Could not read agent output for {}: {}", featureId, e.getMessage());
            return false;
        }
    }

    /**
     * Restarts a feature, continuing from its previous agent output when there is any.
     *
     * @return the execution future, or empty when the feature is already running
     * @throws FeatureNotFoundException if the feature does not exist
     */
    public Optional<CompletableFuture<PipelineResult>> resumeFeature(String projectPath, String featureId,
                                                                     boolean useWorktrees) {
        Feature feature = featureStore.load(projectPath, featureId)
                .orElseThrow(() -> new FeatureNotFoundException(featureId));
        if (concurrencyManager.isRunning(featureId)) {
            log.info("Feature {} is already running, not resuming", featureId);
            return Optional.empty();
        }
        if (contextExists(projectPath, featureId)) {
            String previous = featureStore.readAgentOutput(projectPath, featureId).orElse("");
            log.info("Resuming feature {} with previous context", featureId);
            return Optional.of(executionService.executeFeature(projectPath, featureId, useWorktrees, false,
                    ExecutionOptions.continuation(PromptBuilder.continuationFromContext(feature, previous))));
        }
        log.info("No previous context for feature {}, starting fresh", featureId);
        return Optional.of(executionService.executeFeature(projectPath, featureId, useWorktrees, false));
    }

    /**
     * Re-enqueues features left in progress or interrupted by a previous process.
     *
     * @return ids of the features that were resumed
     */
    public List<String> resumeInterruptedFeatures(String projectPath, boolean useWorktrees) {
        var candidates = new ArrayList<Feature>();
        for (Feature feature : featureStore.loadAll(projectPath)) {
            boolean interrupted = feature.status() == FeatureStatus.IN_PROGRESS
                    || feature.status() == FeatureStatus.INTERRUPTED;
            if (interrupted && !concurrencyManager.isRunning(feature.id())) {
                candidates.add(feature);
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        var ids = new ArrayList<String>();
        for (Feature feature : candidates) {
            if (feature.status() == FeatureStatus.IN_PROGRESS) {
                featureStore.updateStatus(projectPath, feature.id(), FeatureStatus.INTERRUPTED);
            }
            ids.add(feature.id());
        }

        eventBus.publish(AutoModeEvent.of(AutoModeEvent.AUTO_MODE_RESUMING_FEATURES, projectPath, null, null, Map.of(
                "message", "Resuming " + ids.size() + " interrupted feature(s)",
                "featureIds", List.copyOf(ids))));
        log.info("Resuming {} interrupted feature(s) in {}: {}", ids.size(), projectPath, ids);

        var resumed = new ArrayList<String>();
        for (String featureId : ids) {
            try {
                if (resumeFeature(projectPath, featureId, useWorktrees).isPresent()) {
                    resumed.add(featureId);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to resume feature {}: {}", featureId, e.getMessage(), e);
            }
        }
        metrics.recordRecoveredFeatures(resumed.size());
        return resumed;
    }

    /**
     * Starts the loops recorded in each project's execution state.
     *
     * @return number of loops started
     */
    public int restoreAutoLoops(List<String> projectPaths, LoopStarter starter) {
        int restored = 0;
        for (String projectPath : projectPaths) {
            for (ExecutionState state : loadExecutionStates(projectPath)) {
                try {
                    starter.start(state.projectPath(), state.branchName(), state.maxConcurrency());
                    restored++;
                    log.info("Restored auto loop for {}", state.partitionKey());
                } catch (AutoLoopAlreadyRunningException e) {
                    log.debug("Auto loop for {} already running", state.partitionKey());
                } catch (RuntimeException e) {
                    log.warn("Failed to restore auto loop for {}: {}", state.partitionKey(), e.getMessage(), e);
                }
            }
        }
        return restored;
    }
}
