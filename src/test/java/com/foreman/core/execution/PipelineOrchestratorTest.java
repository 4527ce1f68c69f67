package com.foreman.core.execution;

import com.foreman.core.TestFixtures;
import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.concurrency.RunningFeature;
import com.foreman.core.error.ErrorType;
import com.foreman.core.error.VerificationFailedException;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.feature.FileFeatureStore;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PlanStatus;
import com.foreman.core.settings.AutoModeProperties;
import com.foreman.core.worktree.WorktreeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PipelineOrchestratorTest {

    @TempDir
    Path projectDir;

    private String project;
    private FileFeatureStore featureStore;
    private AgentRunner agentRunner;
    private VerificationRunner verificationRunner;
    private CommitService commitService;
    private PlanApprovalService planApprovalService;
    private EventBus eventBus;
    private AutoModeProperties properties;
    private ConcurrencyManager concurrencyManager;
    private PipelineOrchestrator orchestrator;
    private final List<AutoModeEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        project = projectDir.toString();
        featureStore = new FileFeatureStore(TestFixtures.objectMapper(), ".foreman", TestFixtures.fixedClock());
        agentRunner = mock(AgentRunner.class);
        verificationRunner = mock(VerificationRunner.class);
        commitService = mock(CommitService.class);
        planApprovalService = new PlanApprovalService(featureStore, Duration.ofMinutes(1));
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        properties = new AutoModeProperties();
        concurrencyManager = new ConcurrencyManager(mock(WorktreeResolver.class));
        orchestrator = new PipelineOrchestrator(featureStore, agentRunner, verificationRunner, commitService,
                new ModelResolver(properties), planApprovalService, eventBus, properties.getPipeline());

        when(agentRunner.run(any())).thenAnswer(invocation -> {
            AgentRequest request = invocation.getArgument(0);
            request.outputListener().accept("working on " + request.featureId());
            return new AgentResult(0, request.planningMode()
                    ? "<plan>1. add the form</plan>"
                    : "<summary>Implemented it</summary>");
        });
        when(commitService.commit(any(), anyString())).thenReturn(true);
    }

    private PipelineContext context(Feature feature, String continuation) {
        RunningFeature running = concurrencyManager.acquire(feature.id(), project, null, true, false);
        return new PipelineContext(project, feature, projectDir, running, continuation);
    }

    private Feature stored(Feature feature) {
        return featureStore.save(project, new Feature(feature.id(), "Login form", "Add a login form",
                feature.status(), null, List.of(), null, feature.model(), feature.skipTests(),
                feature.requirePlanApproval(), null, null, null, null, null));
    }

    @Nested
    @DisplayName("plain run")
    class PlainRun {

        @Test
        @DisplayName("runs the agent, commits and marks the feature verified")
        void verified() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS).withModel("opus"));
            PipelineContext context = context(feature, null);

            PipelineResult result = orchestrator.executePipeline(context);

            assertEquals(PipelineResult.succeeded("Implemented it"), result);
            Feature saved = featureStore.load(project, "F-1").orElseThrow();
            assertEquals(FeatureStatus.VERIFIED, saved.status());
            assertEquals("Implemented it", saved.summary());
            assertEquals("claude-opus-4-1", context.runningFeature().model());
            assertEquals("claude", context.runningFeature().provider());
            verify(commitService).commit(eq(projectDir), contains("Feature: F-1"));
            verifyNoInteractions(verificationRunner);
            assertTrue(featureStore.readAgentOutput(project, "F-1").orElseThrow().contains("working on F-1"));
            assertTrue(events.stream().anyMatch(e -> AutoModeEvent.AUTO_MODE_PROGRESS.equals(e.eventType())
                    && "working on F-1".equals(e.payload().get("content"))));
        }

        @Test
        @DisplayName("skipTests ends in waiting_approval without verification")
        void skipTests() throws Exception {
            properties.getPipeline().setVerificationCommands(List.of("mvn test"));
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS).withSkipTests(true));

            PipelineResult result = orchestrator.executePipeline(context(feature, null));

            assertEquals(PipelineResult.Outcome.NEEDS_APPROVAL, result.outcome());
            assertEquals(FeatureStatus.WAITING_APPROVAL, featureStore.load(project, "F-1").orElseThrow().status());
            verifyNoInteractions(verificationRunner);
        }

        @Test
        @DisplayName("a continuation prompt replaces the feature prompt")
        void continuation() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));

            orchestrator.executePipeline(context(feature, "Continue where you stopped"));

            var captor = ArgumentCaptor.forClass(AgentRequest.class);
            verify(agentRunner).run(captor.capture());
            assertEquals("Continue where you stopped", captor.getValue().prompt());
        }

        @Test
        @DisplayName("the summary comes from the last run, not from output of earlier runs")
        void summaryFromLastRun() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.INTERRUPTED));
            featureStore.appendAgentOutput(project, "F-1", "<summary>Old attempt</summary>\n");
            doAnswer(invocation -> new AgentResult(0, "Checked the form.\n\nFinished the login form."))
                    .when(agentRunner).run(any());

            PipelineResult result = orchestrator.executePipeline(context(feature, "Continue where you stopped"));

            assertEquals(PipelineResult.succeeded("Finished the login form."), result);
            assertEquals("Finished the login form.", featureStore.load(project, "F-1").orElseThrow().summary());
        }

        @Test
        @DisplayName("falls back to the stored output when the last run printed nothing")
        void summaryFallsBackToStoredOutput() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));
            featureStore.appendAgentOutput(project, "F-1", "<summary>Earlier work</summary>\n");
            doAnswer(invocation -> new AgentResult(0, "")).when(agentRunner).run(any());

            PipelineResult result = orchestrator.executePipeline(context(feature, null));

            assertEquals("Earlier work", result.summary());
        }

        @Test
        void autoCommitDisabled() throws Exception {
            properties.getPipeline().setAutoCommit(false);
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));

            orchestrator.executePipeline(context(feature, null));

            verifyNoInteractions(commitService);
        }

        @Test
        @DisplayName("a cancelled feature never reaches the agent")
        void cancelled() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));
            PipelineContext context = context(feature, null);
            context.runningFeature().cancel();

            assertThrows(CancellationException.class, () -> orchestrator.executePipeline(context));
            verify(agentRunner, never()).run(any());
        }
    }

    @Nested
    @DisplayName("verification")
    class Verification {

        @BeforeEach
        void commands() {
            properties.getPipeline().setVerificationCommands(List.of("mvn -q test"));
        }

        @Test
        @DisplayName("a failed check is handed back to the agent and retried")
        void fixAttempt() throws Exception {
            when(verificationRunner.run(any(), anyList()))
                    .thenReturn(new VerificationResult(false, "mvn -q test", "1 test failed"))
                    .thenReturn(VerificationResult.success("ok"));
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));

            PipelineResult result = orchestrator.executePipeline(context(feature, null));

            assertTrue(result.isSuccess());
            var captor = ArgumentCaptor.forClass(AgentRequest.class);
            verify(agentRunner, times(2)).run(captor.capture());
            assertTrue(captor.getAllValues().get(1).prompt().contains("1 test failed"));
        }

        @Test
        @DisplayName("the fix run's summary wins over the first run's")
        void summaryFromFixRun() throws Exception {
            when(verificationRunner.run(any(), anyList()))
                    .thenReturn(new VerificationResult(false, "mvn -q test", "1 test failed"))
                    .thenReturn(VerificationResult.success("ok"));
            doAnswer(invocation -> {
                AgentRequest request = invocation.getArgument(0);
                return new AgentResult(0, request.prompt().contains("1 test failed")
                        ? "<summary>Fixed the failing test</summary>"
                        : "<summary>Implemented it</summary>");
            }).when(agentRunner).run(any());
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));

            PipelineResult result = orchestrator.executePipeline(context(feature, null));

            assertEquals("Fixed the failing test", result.summary());
        }

        @Test
        @DisplayName("gives up after the configured fix attempts")
        void exhausted() throws Exception {
            when(verificationRunner.run(any(), anyList()))
                    .thenReturn(new VerificationResult(false, "mvn -q test", "still red"));
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS));
            PipelineContext context = context(feature, null);

            var error = assertThrows(VerificationFailedException.class, () -> orchestrator.executePipeline(context));

            assertTrue(error.getMessage().contains("mvn -q test"));
            verify(agentRunner, times(3)).run(any());
            verify(verificationRunner, times(3)).run(any(), anyList());
            verifyNoInteractions(commitService);
        }
    }

    @Nested
    @DisplayName("plan approval")
    class PlanApproval {

        private CompletableFuture<PipelineResult> runAsync(Feature feature, CountDownLatch planReady) {
            eventBus.subscribe(project, e -> {
                if (AutoModeEvent.PLAN_APPROVAL_REQUIRED.equals(e.eventType())) {
                    planReady.countDown();
                }
            });
            PipelineContext context = context(feature, null);
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return orchestrator.executePipeline(context);
                } catch (InterruptedException e) {
                    throw new IllegalStateException(e);
                }
            });
        }

        @Test
        @DisplayName("approved plan is implemented with the edited content")
        void approved() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS).withRequirePlanApproval(true));
            var planReady = new CountDownLatch(1);

            CompletableFuture<PipelineResult> run = runAsync(feature, planReady);
            assertTrue(planReady.await(5, TimeUnit.SECONDS));

            Feature waiting = featureStore.load(project, "F-1").orElseThrow();
            assertEquals(FeatureStatus.WAITING_APPROVAL, waiting.status());
            assertEquals("1. add the form", waiting.planSpec().content());

            assertTrue(planApprovalService.resolveApproval(project, "F-1", true, "1. add the better form", null)
                    .success());
            PipelineResult result = run.get(5, TimeUnit.SECONDS);

            assertTrue(result.isSuccess());
            Feature done = featureStore.load(project, "F-1").orElseThrow();
            assertEquals(PlanStatus.APPROVED, done.planSpec().status());
            assertEquals("1. add the better form", done.planSpec().content());
            var captor = ArgumentCaptor.forClass(AgentRequest.class);
            verify(agentRunner, times(2)).run(captor.capture());
            assertTrue(captor.getAllValues().get(0).planningMode());
            assertTrue(captor.getAllValues().get(1).prompt().contains("1. add the better form"));
            assertTrue(events.stream().anyMatch(e -> AutoModeEvent.PLAN_APPROVED.equals(e.eventType())));
        }

        @Test
        @DisplayName("rejected plan fails the run and returns the feature to backlog")
        void rejected() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS).withRequirePlanApproval(true));
            var planReady = new CountDownLatch(1);

            CompletableFuture<PipelineResult> run = runAsync(feature, planReady);
            assertTrue(planReady.await(5, TimeUnit.SECONDS));
            planApprovalService.resolveApproval(project, "F-1", false, null, "too broad");
            PipelineResult result = run.get(5, TimeUnit.SECONDS);

            assertEquals(PipelineResult.Outcome.FAILED, result.outcome());
            assertEquals(ErrorType.CANCELLATION, result.error().type());
            Feature saved = featureStore.load(project, "F-1").orElseThrow();
            assertEquals(FeatureStatus.BACKLOG, saved.status());
            assertEquals(PlanStatus.REJECTED, saved.planSpec().status());
            assertEquals("too broad", saved.planSpec().feedback());
            verify(agentRunner, times(1)).run(any());
        }

        @Test
        @DisplayName("a cancelled approval aborts the run as a cancellation")
        void cancelledWhileWaiting() throws Exception {
            Feature feature = stored(Feature.of("F-1", FeatureStatus.IN_PROGRESS).withRequirePlanApproval(true));
            var planReady = new CountDownLatch(1);

            CompletableFuture<PipelineResult> run = runAsync(feature, planReady);
            assertTrue(planReady.await(5, TimeUnit.SECONDS));
            planApprovalService.cancelApproval(project, "F-1");

            var error = assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
            assertInstanceOf(CancellationException.class, error.getCause());
            verify(agentRunner, times(1)).run(any());
        }
    }
}
