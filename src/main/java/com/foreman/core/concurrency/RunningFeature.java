package com.foreman.core.concurrency;

import com.foreman.core.model.PartitionKey;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Registry entry for a feature that is currently executing.
 * <p>
 * Owns the feature's cancellation signal: {@link #cancel()} marks the entry cancelled and
 * interrupts the bound worker thread, if any.
 */
public final class RunningFeature {

    private final String featureId;
    private final PartitionKey partitionKey;
    private final boolean autoMode;
    private final Instant startTime;

    private volatile String model;
    private volatile String provider;
    private volatile Path worktreePath;

    private boolean cancelled;
    private Thread worker;

    /** Guarded by the owning {@link ConcurrencyManager}. */
    int leaseCount = 1;

    RunningFeature(String featureId, PartitionKey partitionKey, boolean autoMode, Instant startTime) {
        this.featureId = featureId;
        this.partitionKey = partitionKey;
        this.autoMode = autoMode;
        this.startTime = startTime;
    }

    public String featureId() {
        return featureId;
    }

    public PartitionKey partitionKey() {
        return partitionKey;
    }

    public String projectPath() {
        return partitionKey.projectPath();
    }

    public String branchName() {
        return partitionKey.branchName();
    }

    public boolean isAutoMode() {
        return autoMode;
    }

    public Instant startTime() {
        return startTime;
    }

    public String model() {
        return model;
    }

    public String provider() {
        return provider;
    }

    public Path worktreePath() {
        return worktreePath;
    }

    public void setModel(String model, String provider) {
        this.model = model;
        this.provider = provider;
    }

    public void setWorktreePath(Path worktreePath) {
        this.worktreePath = worktreePath;
    }

    /**
     * Binds the thread that executes this feature. Returns false when the feature was
     * cancelled before the worker started, in which case the worker must not proceed.
     */
    public synchronized boolean bindWorker(Thread thread) {
        if (cancelled) {
            return false;
        }
        this.worker = thread;
        return true;
    }

    public synchronized void unbindWorker() {
        this.worker = null;
    }

    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (worker != null) {
            worker.interrupt();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }
}
