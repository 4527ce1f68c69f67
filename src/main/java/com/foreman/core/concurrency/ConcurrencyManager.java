package com.foreman.core.concurrency;

import com.foreman.core.model.PartitionKey;
import com.foreman.core.worktree.WorktreeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of running features, keyed by feature id and grouped by partition.
 * <p>
 * A feature id appears at most once across all partitions. Compound operations
 * (acquire, release) are synchronized; reads go straight to the concurrent map.
 */
public class ConcurrencyManager {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyManager.class);

    private final ConcurrentHashMap<String, RunningFeature> runningFeatures = new ConcurrentHashMap<>();
    private final WorktreeResolver worktreeResolver;
    private final Clock clock;

    public ConcurrencyManager(WorktreeResolver worktreeResolver) {
        this(worktreeResolver, Clock.systemUTC());
    }

    public ConcurrencyManager(WorktreeResolver worktreeResolver, Clock clock) {
        this.worktreeResolver = worktreeResolver;
        this.clock = clock;
    }

    public boolean isRunning(String featureId) {
        return runningFeatures.containsKey(featureId);
    }

    /**
     * Registers a running feature.
     *
     * @param allowReuse when true and the feature is already registered, the existing entry is
     *                   returned with one more lease instead of failing
     * @throws IllegalStateException if the feature is already running and reuse is not allowed
     */
    public synchronized RunningFeature acquire(String featureId, String projectPath, String branchName,
                                               boolean isAutoMode, boolean allowReuse) {
        RunningFeature existing = runningFeatures.get(featureId);
        if (existing != null) {
            if (!allowReuse) {
                throw new IllegalStateException("Feature " + featureId + " is already running");
            }
            existing.leaseCount++;
            log.debug("Reusing running entry for {} (leases={})", featureId, existing.leaseCount);
            return existing;
        }
        var entry = new RunningFeature(featureId, partitionKey(projectPath, branchName), isAutoMode, clock.instant());
        runningFeatures.put(featureId, entry);
        log.debug("Acquired {} in {}", featureId, entry.partitionKey());
        return entry;
    }

    public void release(String featureId) {
        release(featureId, false);
    }

    /**
     * Releases one lease of a running feature; the entry is removed when the last lease is
     * released or when {@code force} is set. Unknown ids are ignored.
     */
    public synchronized void release(String featureId, boolean force) {
        RunningFeature entry = runningFeatures.get(featureId);
        if (entry == null) {
            return;
        }
        if (!force && entry.leaseCount > 1) {
            entry.leaseCount--;
            log.debug("Released lease for {} (leases={})", featureId, entry.leaseCount);
            return;
        }
        runningFeatures.remove(featureId);
        log.debug("Released {} from {}", featureId, entry.partitionKey());
    }

    /**
     * Releases one lease of {@code entry}, but only while it is still the registered entry for
     * its feature. A worker whose entry was force-released and replaced by a new run must not
     * remove the new run's entry.
     */
    public synchronized void release(RunningFeature entry) {
        if (runningFeatures.get(entry.featureId()) == entry) {
            release(entry.featureId(), false);
        }
    }

    public Optional<RunningFeature> getRunningFeature(String featureId) {
        return Optional.ofNullable(runningFeatures.get(featureId));
    }

    public int getRunningCountForWorktree(String projectPath, String branchName) {
        return getRunningFeaturesForWorktree(projectPath, branchName).size();
    }

    public List<String> getRunningFeaturesForWorktree(String projectPath, String branchName) {
        PartitionKey key = partitionKey(projectPath, branchName);
        var result = new ArrayList<String>();
        for (RunningFeature entry : runningFeatures.values()) {
            if (entry.partitionKey().equals(key)) {
                result.add(entry.featureId());
            }
        }
        return result;
    }

    public List<RunningFeature> getAllRunning() {
        return List.copyOf(runningFeatures.values());
    }

    public int getRunningCount() {
        return runningFeatures.size();
    }

    /**
     * Builds the partition key for a branch, treating the project's primary branch as main.
     */
    public PartitionKey partitionKey(String projectPath, String branchName) {
        if (branchName == null || branchName.isBlank()) {
            return PartitionKey.main(projectPath);
        }
        return PartitionKey.normalized(projectPath, branchName, worktreeResolver.getPrimaryBranch(projectPath));
    }
}
