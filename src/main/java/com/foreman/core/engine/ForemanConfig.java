package com.foreman.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.events.EventBus;
import com.foreman.core.execution.AgentRunner;
import com.foreman.core.execution.CommitService;
import com.foreman.core.execution.GitCommitService;
import com.foreman.core.execution.ModelResolver;
import com.foreman.core.execution.PipelineOrchestrator;
import com.foreman.core.execution.PlanApprovalService;
import com.foreman.core.execution.ProcessAgentRunner;
import com.foreman.core.execution.ShellVerificationRunner;
import com.foreman.core.execution.VerificationRunner;
import com.foreman.core.feature.FeatureStore;
import com.foreman.core.feature.FileFeatureStore;
import com.foreman.core.settings.AutoModeProperties;
import com.foreman.core.worktree.GitCli;
import com.foreman.core.worktree.GitWorktreeResolver;
import com.foreman.core.worktree.WorktreeResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ForemanConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GitCli gitCli() {
        return new GitCli();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorktreeResolver worktreeResolver(GitCli gitCli) {
        return new GitWorktreeResolver(gitCli);
    }

    @Bean
    public ConcurrencyManager concurrencyManager(WorktreeResolver worktreeResolver, Clock clock) {
        return new ConcurrencyManager(worktreeResolver, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FeatureStore featureStore(ObjectMapper objectMapper, AutoModeProperties properties, Clock clock) {
        return new FileFeatureStore(objectMapper, properties.getDataDir(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentRunner agentRunner(AutoModeProperties properties) {
        return new ProcessAgentRunner(properties.getAgent());
    }

    @Bean
    @ConditionalOnMissingBean
    public VerificationRunner verificationRunner(AutoModeProperties properties) {
        return new ShellVerificationRunner(properties.getPipeline().getVerificationTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public CommitService commitService(GitCli gitCli) {
        return new GitCommitService(gitCli);
    }

    @Bean
    public PlanApprovalService planApprovalService(FeatureStore featureStore, AutoModeProperties properties) {
        return new PlanApprovalService(featureStore, properties.getPipeline().getPlanApprovalTimeout());
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(FeatureStore featureStore,
                                                     AgentRunner agentRunner,
                                                     VerificationRunner verificationRunner,
                                                     CommitService commitService,
                                                     ModelResolver modelResolver,
                                                     PlanApprovalService planApprovalService,
                                                     EventBus eventBus,
                                                     AutoModeProperties properties) {
        return new PipelineOrchestrator(featureStore, agentRunner, verificationRunner, commitService,
                modelResolver, planApprovalService, eventBus, properties.getPipeline());
    }

    /**
     * Pool that runs feature pipelines. Each pipeline blocks on an agent process for minutes,
     * so threads are created on demand; the scheduler bounds how many run at once.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService featureExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "feature-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
