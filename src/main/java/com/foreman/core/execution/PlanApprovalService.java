package com.foreman.core.execution;

import com.foreman.core.feature.FeatureStore;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PlanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Holds pending plan approvals. An execution waiting for approval blocks on the future
 * returned by {@link #waitForApproval}; a reviewer completes it with {@link #resolveApproval}.
 */
public class PlanApprovalService {

    private static final Logger log = LoggerFactory.getLogger(PlanApprovalService.class);

    private record ApprovalKey(String projectPath, String featureId) {}

    private final ConcurrentHashMap<ApprovalKey, CompletableFuture<PlanDecision>> pending = new ConcurrentHashMap<>();
    private final FeatureStore featureStore;
    private final Duration timeout;

    public PlanApprovalService(FeatureStore featureStore, Duration timeout) {
        this.featureStore = featureStore;
        this.timeout = timeout;
    }

    /**
     * Registers a waiter for the feature's plan decision. The future completes exceptionally
     * with a {@link java.util.concurrent.TimeoutException} when nobody decides in time and with a
     * {@link CancellationException} when the approval is cancelled.
     */
    public CompletableFuture<PlanDecision> waitForApproval(String projectPath, String featureId) {
        var key = new ApprovalKey(projectPath, featureId);
        var future = new CompletableFuture<PlanDecision>();
        CompletableFuture<PlanDecision> previous = pending.put(key, future);
        if (previous != null) {
            previous.completeExceptionally(new CancellationException("Superseded by a newer approval request"));
        }
        future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((decision, error) -> pending.remove(key, future));
        log.info("Waiting for plan approval of {}", featureId);
        return future;
    }

    public ApprovalResult resolveApproval(String projectPath, String featureId, boolean approved,
                                          String editedPlan, String feedback) {
        var key = new ApprovalKey(projectPath, featureId);
        CompletableFuture<PlanDecision> future = pending.remove(key);
        if (future != null && future.complete(new PlanDecision(approved, editedPlan, feedback))) {
            log.info("Plan for {} {}", featureId, approved ? "approved" : "rejected");
            return ApprovalResult.resolved();
        }

        // No live waiter, e.g. after a restart. Recoverable when the feature is still awaiting approval.
        var feature = featureStore.load(projectPath, featureId);
        if (feature.isPresent()
                && feature.get().status() == FeatureStatus.WAITING_APPROVAL
                && feature.get().planSpec() != null
                && feature.get().planSpec().status() == PlanStatus.GENERATED) {
            log.info("No pending approval for {}, recovering from persisted plan", featureId);
            return ApprovalResult.recovery();
        }
        return ApprovalResult.failed("No pending approval for feature " + featureId);
    }

    public boolean hasPendingApproval(String projectPath, String featureId) {
        return pending.containsKey(new ApprovalKey(projectPath, featureId));
    }

    public boolean hasPendingApproval(String featureId) {
        return pending.keySet().stream().anyMatch(k -> k.featureId().equals(featureId));
    }

    public void cancelApproval(String projectPath, String featureId) {
        CompletableFuture<PlanDecision> future = pending.remove(new ApprovalKey(projectPath, featureId));
        if (future != null) {
            future.completeExceptionally(new CancellationException("Plan approval cancelled"));
            log.info("Cancelled plan approval for {}", featureId);
        }
    }
}
