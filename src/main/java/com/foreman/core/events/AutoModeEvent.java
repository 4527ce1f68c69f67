package com.foreman.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted by the execution engine, used for SSE streaming and CLI watch mode.
 *
 * @param eventType   event type, e.g. "auto_mode_started" or "auto_mode_feature_complete"
 * @param projectPath the project this event belongs to
 * @param branchName  branch of the partition, null for the main worktree
 * @param featureId   the feature this event relates to (nullable for loop-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record AutoModeEvent(
    String eventType,
    String projectPath,
    String branchName,
    String featureId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String AUTO_MODE_STARTED = "auto_mode_started";
    public static final String AUTO_MODE_STOPPED = "auto_mode_stopped";
    public static final String AUTO_MODE_IDLE = "auto_mode_idle";
    public static final String AUTO_MODE_PAUSED_FAILURES = "auto_mode_paused_failures";
    public static final String AUTO_MODE_ERROR = "auto_mode_error";
    public static final String AUTO_MODE_FEATURE_START = "auto_mode_feature_start";
    public static final String AUTO_MODE_FEATURE_COMPLETE = "auto_mode_feature_complete";
    public static final String AUTO_MODE_PROGRESS = "auto_mode_progress";
    public static final String AUTO_MODE_RESUMING_FEATURES = "auto_mode_resuming_features";
    public static final String PLAN_APPROVAL_REQUIRED = "plan_approval_required";
    public static final String PLAN_APPROVED = "plan_approved";
    public static final String PLAN_REJECTED = "plan_rejected";

    public AutoModeEvent {
        payload = payload == null ? Map.of() : payload;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AutoModeEvent of(String eventType, String projectPath, String branchName,
                                   String featureId, Map<String, Object> payload) {
        return new AutoModeEvent(eventType, projectPath, branchName, featureId, payload, Instant.now());
    }

    /**
     * Builds an ordered payload from alternating keys and values. Null values are kept.
     */
    public static Map<String, Object> payload(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    /** Convenience accessor for the "message" payload entry. */
    public String message() {
        Object message = payload.get("message");
        return message != null ? message.toString() : null;
    }
}
