package com.foreman.core.settings;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "foreman")
public class AutoModeProperties {

    /** Directory under each project where features, agent output and execution state live. */
    private String dataDir = ".foreman";
    private AutoMode autoMode = new AutoMode();
    private Pipeline pipeline = new Pipeline();
    private Agent agent = new Agent();
    private Recovery recovery = new Recovery();

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public AutoMode getAutoMode() { return autoMode; }
    public void setAutoMode(AutoMode autoMode) { this.autoMode = autoMode; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }

    public static class AutoMode {
        private int maxConcurrency = 1;
        private int maxSystemConcurrency = 10;
        private int failureThreshold = 3;
        private boolean useWorktrees = true;
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration capacityWait = Duration.ofSeconds(5);
        private Duration errorBackoff = Duration.ofSeconds(5);
        private List<WorktreeOverride> worktrees = new ArrayList<>();

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public int getMaxSystemConcurrency() { return maxSystemConcurrency; }
        public void setMaxSystemConcurrency(int maxSystemConcurrency) { this.maxSystemConcurrency = maxSystemConcurrency; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public boolean isUseWorktrees() { return useWorktrees; }
        public void setUseWorktrees(boolean useWorktrees) { this.useWorktrees = useWorktrees; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getCapacityWait() { return capacityWait; }
        public void setCapacityWait(Duration capacityWait) { this.capacityWait = capacityWait; }
        public Duration getErrorBackoff() { return errorBackoff; }
        public void setErrorBackoff(Duration errorBackoff) { this.errorBackoff = errorBackoff; }
        public List<WorktreeOverride> getWorktrees() { return worktrees; }
        public void setWorktrees(List<WorktreeOverride> worktrees) { this.worktrees = worktrees; }
    }

    /**
     * Per-worktree concurrency override. A missing branch name targets the main worktree.
     */
    public static class WorktreeOverride {
        private String projectPath;
        private String branchName;
        private Integer maxConcurrency;

        public String getProjectPath() { return projectPath; }
        public void setProjectPath(String projectPath) { this.projectPath = projectPath; }
        public String getBranchName() { return branchName; }
        public void setBranchName(String branchName) { this.branchName = branchName; }
        public Integer getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(Integer maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class Pipeline {
        private String defaultModel = "claude-sonnet-4-5";
        private Map<String, String> modelAliases = new LinkedHashMap<>(Map.of(
                "sonnet", "claude-sonnet-4-5",
                "opus", "claude-opus-4-1",
                "haiku", "claude-haiku-4-5"));
        private List<String> verificationCommands = new ArrayList<>();
        private int maxVerificationAttempts = 2;
        private Duration verificationTimeout = Duration.ofMinutes(15);
        private boolean autoCommit = true;
        private Duration planApprovalTimeout = Duration.ofHours(24);

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public Map<String, String> getModelAliases() { return modelAliases; }
        public void setModelAliases(Map<String, String> modelAliases) { this.modelAliases = modelAliases; }
        public List<String> getVerificationCommands() { return verificationCommands; }
        public void setVerificationCommands(List<String> verificationCommands) { this.verificationCommands = verificationCommands; }
        public int getMaxVerificationAttempts() { return maxVerificationAttempts; }
        public void setMaxVerificationAttempts(int maxVerificationAttempts) { this.maxVerificationAttempts = maxVerificationAttempts; }
        public Duration getVerificationTimeout() { return verificationTimeout; }
        public void setVerificationTimeout(Duration verificationTimeout) { this.verificationTimeout = verificationTimeout; }
        public boolean isAutoCommit() { return autoCommit; }
        public void setAutoCommit(boolean autoCommit) { this.autoCommit = autoCommit; }
        public Duration getPlanApprovalTimeout() { return planApprovalTimeout; }
        public void setPlanApprovalTimeout(Duration planApprovalTimeout) { this.planApprovalTimeout = planApprovalTimeout; }
    }

    public static class Agent {
        /**
         * Agent command line. The tokens {@code {model}} and {@code {provider}} are substituted;
         * the prompt is written to the process's stdin.
         */
        private List<String> command = new ArrayList<>(List.of("claude", "-p", "--model", "{model}"));
        private Duration timeout = Duration.ofMinutes(60);
        private int outputTailLines = 40;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getOutputTailLines() { return outputTailLines; }
        public void setOutputTailLines(int outputTailLines) { this.outputTailLines = outputTailLines; }
    }

    public static class Recovery {
        private boolean resumeOnStartup = false;
        private List<String> projects = new ArrayList<>();

        public boolean isResumeOnStartup() { return resumeOnStartup; }
        public void setResumeOnStartup(boolean resumeOnStartup) { this.resumeOnStartup = resumeOnStartup; }
        public List<String> getProjects() { return projects; }
        public void setProjects(List<String> projects) { this.projects = projects; }
    }
}
