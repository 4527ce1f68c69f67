package com.foreman.core.health;

import com.foreman.core.engine.AutoModeService;
import com.foreman.core.settings.AutoModeProperties;
import com.foreman.core.worktree.GitCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GitCli gitCli;
    private final AutoModeProperties properties;
    private final AutoModeService autoModeService;

    public HealthCheckService(GitCli gitCli,
                              AutoModeProperties properties,
                              @Autowired(required = false) AutoModeService autoModeService) {
        this.gitCli = gitCli;
        this.properties = properties;
        this.autoModeService = autoModeService;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkAgent());
        results.add(checkScheduler());
        return results;
    }

    HealthStatus checkGit() {
        try {
            GitCli.GitResult result = gitCli.runGitOutput(Path.of(".").toAbsolutePath(), "--version");
            if (result.succeeded()) {
                return new HealthStatus("git", HealthStatus.Status.UP, result.output().trim(), Map.of());
            }
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "git exited with code " + result.exitCode(), Map.of());
        } catch (RuntimeException e) {
            log.warn("Git health check failed: {}", e.getMessage());
            return new HealthStatus("git", HealthStatus.Status.DOWN, "Git error: " + e.getMessage(), Map.of());
        }
    }

    /**
     * Looks up the agent executable on the PATH. A missing agent degrades the service:
     * the scheduler still runs, but every feature will fail.
     */
    HealthStatus checkAgent() {
        List<String> command = properties.getAgent().getCommand();
        if (command == null || command.isEmpty()) {
            return new HealthStatus("agent", HealthStatus.Status.DOWN, "No agent command configured", Map.of());
        }
        String executable = command.get(0);
        if (findExecutable(executable)) {
            return new HealthStatus("agent", HealthStatus.Status.UP,
                    "Agent executable found: " + executable, Map.of("command", executable));
        }
        return new HealthStatus("agent", HealthStatus.Status.DEGRADED,
                "Agent executable not found on PATH: " + executable, Map.of("command", executable));
    }

    HealthStatus checkScheduler() {
        if (autoModeService == null) {
            return new HealthStatus("scheduler", HealthStatus.Status.DOWN, "Auto mode not available", Map.of());
        }
        var status = autoModeService.getStatus();
        return new HealthStatus("scheduler", HealthStatus.Status.UP,
                status.activeWorktrees().size() + " active loop(s), " + status.runningCount() + " running feature(s)",
                Map.of("activeLoops", String.valueOf(status.activeWorktrees().size()),
                        "runningFeatures", String.valueOf(status.runningCount())));
    }

    private static boolean findExecutable(String executable) {
        Path direct = Path.of(executable);
        if (direct.isAbsolute()) {
            return Files.isExecutable(direct);
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir).resolve(executable))) {
                return true;
            }
        }
        return false;
    }
}
