package com.foreman.dispatch.api;

import com.foreman.core.engine.AutoModeService;
import com.foreman.core.engine.AutoModeStatus;
import com.foreman.core.engine.ProjectStatus;
import com.foreman.core.engine.RunningAgentInfo;
import com.foreman.core.engine.WorktreeCapacity;
import com.foreman.core.execution.ApprovalResult;
import com.foreman.core.model.Feature;
import com.foreman.core.settings.AutoModeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for auto mode: loop lifecycle, single-feature execution, plan approval
 * and the event stream.
 */
@RestController
@RequestMapping("/api/v1/auto-mode")
public class AutoModeController {

    private static final Logger log = LoggerFactory.getLogger(AutoModeController.class);

    private final AutoModeService autoModeService;
    private final SseStreamingService sseStreamingService;
    private final AutoModeProperties properties;

    public AutoModeController(AutoModeService autoModeService,
                              SseStreamingService sseStreamingService,
                              AutoModeProperties properties) {
        this.autoModeService = autoModeService;
        this.sseStreamingService = sseStreamingService;
        this.properties = properties;
    }

    /**
     * POST /api/v1/auto-mode/start: Start the loop for a project worktree.
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody AutoModeRequest request) {
        int maxConcurrency = autoModeService.startAutoLoop(request.projectPath(), request.branchName(),
                request.maxConcurrency());
        log.info("Started auto mode for {} via API", request.projectPath());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("projectPath", request.projectPath());
        body.put("branchName", request.branchName());
        body.put("maxConcurrency", maxConcurrency);
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/auto-mode/stop: Stop the loop. Running features finish on their own.
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop(@RequestBody AutoModeRequest request) {
        int runningCount = autoModeService.stopAutoLoop(request.projectPath(), request.branchName());
        return ResponseEntity.ok(Map.of("success", true, "runningFeaturesCount", runningCount));
    }

    @GetMapping("/status")
    public ProjectStatus status(@RequestParam String projectPath,
                                @RequestParam(required = false) String branchName) {
        return autoModeService.getStatusForProject(projectPath, branchName);
    }

    @GetMapping("/status/global")
    public AutoModeStatus globalStatus() {
        return autoModeService.getStatus();
    }

    @GetMapping("/running-agents")
    public List<RunningAgentInfo> runningAgents() {
        return autoModeService.getRunningAgents();
    }

    /**
     * POST /api/v1/auto-mode/features/{id}/run: Run one feature outside the loop.
     * Returns once the feature is registered; execution continues in the background.
     */
    @PostMapping("/features/{featureId}/run")
    public ResponseEntity<Map<String, Object>> runFeature(@PathVariable String featureId,
                                                          @RequestBody FeatureRunRequest request) {
        autoModeService.executeFeature(request.projectPath(), featureId, useWorktrees(request), false);
        return ResponseEntity.accepted().body(Map.of("success", true, "featureId", featureId));
    }

    @PostMapping("/features/{featureId}/stop")
    public ResponseEntity<Map<String, Object>> stopFeature(@PathVariable String featureId) {
        boolean stopped = autoModeService.stopFeature(featureId);
        return ResponseEntity.ok(Map.of("success", true, "stopped", stopped));
    }

    @PostMapping("/features/{featureId}/resume")
    public ResponseEntity<Map<String, Object>> resumeFeature(@PathVariable String featureId,
                                                             @RequestBody FeatureRunRequest request) {
        boolean started = autoModeService.resumeFeature(request.projectPath(), featureId, useWorktrees(request))
                .isPresent();
        return ResponseEntity.accepted().body(Map.of("success", true, "featureId", featureId, "started", started));
    }

    @PostMapping("/features/{featureId}/approve-plan")
    public ResponseEntity<Map<String, Object>> approvePlan(@PathVariable String featureId,
                                                           @RequestBody PlanApprovalRequest request) {
        ApprovalResult result = autoModeService.resolvePlanApproval(request.projectPath(), featureId,
                request.approved(), request.editedPlan(), request.feedback());
        if (!result.success()) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "error", result.error()));
        }
        return ResponseEntity.ok(Map.of("success", true, "approved", request.approved(),
                "recovered", result.needsRecovery()));
    }

    @GetMapping("/capacity")
    public WorktreeCapacity capacity(@RequestParam String projectPath, @RequestParam String featureId) {
        return autoModeService.checkWorktreeCapacity(projectPath, featureId);
    }

    @PostMapping("/resume-interrupted")
    public ResponseEntity<Map<String, Object>> resumeInterrupted(@RequestBody ProjectRequest request) {
        List<String> resumed = autoModeService.resumeInterruptedFeatures(request.projectPath());
        return ResponseEntity.ok(Map.of("success", true, "resumedFeatures", resumed));
    }

    @GetMapping("/orphaned-features")
    public List<Feature> orphanedFeatures(@RequestParam String projectPath) {
        return autoModeService.detectOrphanedFeatures(projectPath);
    }

    /**
     * GET /api/v1/auto-mode/events: SSE stream of auto mode events, for one project or all.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(required = false) String projectPath) {
        return sseStreamingService.createEmitter(projectPath);
    }

    private boolean useWorktrees(FeatureRunRequest request) {
        return request.useWorktrees() != null ? request.useWorktrees() : properties.getAutoMode().isUseWorktrees();
    }
}
