package com.foreman.core.scheduler;

import com.foreman.core.model.AutoModeConfig;
import com.foreman.core.model.PartitionKey;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Mutable state of one running auto loop. Created on start and discarded on stop.
 */
class ProjectAutoLoopState {

    private final PartitionKey key;
    private final AutoModeConfig config;
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile boolean paused;
    private Thread thread;

    private int consecutiveFailures;

    ProjectAutoLoopState(PartitionKey key, AutoModeConfig config) {
        this.key = key;
        this.config = config;
    }

    PartitionKey key() {
        return key;
    }

    AutoModeConfig config() {
        return config;
    }

    boolean isRunning() {
        return running;
    }

    boolean isPaused() {
        return paused;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    void stop() {
        running = false;
        stopLatch.countDown();
    }

    /**
     * Sleeps for {@code duration} or until the loop is stopped.
     *
     * @return true if the loop was stopped while waiting
     */
    boolean sleep(Duration duration) throws InterruptedException {
        return stopLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void attachThread(Thread thread) {
        this.thread = thread;
    }

    synchronized Thread thread() {
        return thread;
    }

    synchronized int recordFailure() {
        return ++consecutiveFailures;
    }

    synchronized void resetFailures() {
        consecutiveFailures = 0;
    }

    synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }
}
