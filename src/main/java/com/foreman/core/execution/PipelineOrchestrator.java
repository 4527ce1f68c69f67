package com.foreman.core.execution;

import com.foreman.core.error.ErrorInfo;
import com.foreman.core.error.ErrorType;
import com.foreman.core.error.VerificationFailedException;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.feature.FeatureStore;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PlanSpec;
import com.foreman.core.model.PlanStatus;
import com.foreman.core.settings.AutoModeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static com.foreman.core.events.AutoModeEvent.payload;

/**
 * Drives one feature through model resolution, optional plan approval, the agent run,
 * verification, commit and the final status update.
 * <p>
 * Failures are thrown; the caller classifies them. Cancellation surfaces as
 * {@link CancellationException} or {@link InterruptedException}.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final FeatureStore featureStore;
    private final AgentRunner agentRunner;
    private final VerificationRunner verificationRunner;
    private final CommitService commitService;
    private final ModelResolver modelResolver;
    private final PlanApprovalService planApprovalService;
    private final EventBus eventBus;
    private final AutoModeProperties.Pipeline config;

    public PipelineOrchestrator(FeatureStore featureStore,
                                AgentRunner agentRunner,
                                VerificationRunner verificationRunner,
                                CommitService commitService,
                                ModelResolver modelResolver,
                                PlanApprovalService planApprovalService,
                                EventBus eventBus,
                                AutoModeProperties.Pipeline config) {
        this.featureStore = featureStore;
        this.agentRunner = agentRunner;
        this.verificationRunner = verificationRunner;
        this.commitService = commitService;
        this.modelResolver = modelResolver;
        this.planApprovalService = planApprovalService;
        this.eventBus = eventBus;
        this.config = config;
    }

    public PipelineResult executePipeline(PipelineContext context) throws InterruptedException {
        Feature feature = context.feature();
        ResolvedModel model = modelResolver.resolve(feature.model());
        context.runningFeature().setModel(model.model(), model.provider());
        log.info("Executing feature {} with {} ({})", feature.id(), model.model(), model.provider());

        String prompt = context.continuationPrompt();
        if (prompt == null) {
            if (feature.requirePlanApproval() && !isApproved(feature.planSpec())) {
                PlanDecision decision = obtainPlanApproval(context, model);
                if (!decision.approved()) {
                    return PipelineResult.failed(ErrorInfo.of(ErrorType.CANCELLATION, "Plan rejected"));
                }
                feature = featureStore.load(context.projectPath(), feature.id()).orElse(feature);
                prompt = PromptBuilder.continuationAfterApproval(feature, feature.planSpec().content(),
                        decision.feedback());
            } else {
                prompt = PromptBuilder.featurePrompt(feature);
            }
        }

        checkCancelled(context);
        AgentResult lastRun = runAgent(context, prompt, model, false);

        if (!feature.skipTests() && !config.getVerificationCommands().isEmpty()) {
            lastRun = verify(context, feature, model, lastRun);
        }

        if (config.isAutoCommit()) {
            checkCancelled(context);
            commit(context, feature);
        }

        FeatureStatus finalStatus = feature.skipTests() ? FeatureStatus.WAITING_APPROVAL : FeatureStatus.VERIFIED;
        String summary = summaryOf(context, lastRun);
        Feature latest = featureStore.load(context.projectPath(), feature.id()).orElse(feature);
        featureStore.save(context.projectPath(), latest.withStatus(finalStatus).withSummary(summary).withError(null));
        log.info("Feature {} finished with status {}", feature.id(), finalStatus.value());

        return feature.skipTests() ? PipelineResult.needsApproval(summary) : PipelineResult.succeeded(summary);
    }

    private PlanDecision obtainPlanApproval(PipelineContext context, ResolvedModel model) throws InterruptedException {
        Feature feature = context.feature();
        String projectPath = context.projectPath();

        emitProgress(context, "Generating implementation plan");
        AgentResult planning = runAgent(context, PromptBuilder.planningPrompt(feature), model, true);
        String planContent = OutputParser.extractPlan(planning.output());

        // Register the waiter before announcing the plan so an immediate decision is not lost
        CompletableFuture<PlanDecision> waiter = planApprovalService.waitForApproval(projectPath, feature.id());
        Feature latest = featureStore.load(projectPath, feature.id()).orElse(feature);
        featureStore.save(projectPath, latest.withPlanSpec(PlanSpec.generated(planContent))
                .withStatus(FeatureStatus.WAITING_APPROVAL));
        emit(AutoModeEvent.PLAN_APPROVAL_REQUIRED, context, payload(
                "message", "Plan ready for review",
                "planContent", planContent));

        PlanDecision decision;
        try {
            decision = waiter.get();
        } catch (InterruptedException e) {
            planApprovalService.cancelApproval(projectPath, feature.id());
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new IllegalStateException("Plan approval timed out for feature " + feature.id());
            }
            throw new IllegalStateException("Plan approval failed: " + e.getCause().getMessage(), e.getCause());
        }

        latest = featureStore.load(projectPath, feature.id()).orElse(latest);
        PlanSpec plan = latest.planSpec() != null ? latest.planSpec() : PlanSpec.generated(planContent);
        if (decision.approved()) {
            featureStore.save(projectPath, latest
                    .withPlanSpec(plan.approved(decision.editedPlan(), decision.feedback()))
                    .withStatus(FeatureStatus.IN_PROGRESS));
            emit(AutoModeEvent.PLAN_APPROVED, context, payload("message", "Plan approved"));
        } else {
            featureStore.save(projectPath, latest
                    .withPlanSpec(plan.rejected(decision.feedback()))
                    .withStatus(FeatureStatus.BACKLOG));
            emit(AutoModeEvent.PLAN_REJECTED, context, payload(
                    "message", "Plan rejected",
                    "feedback", decision.feedback() != null ? decision.feedback() : ""));
        }
        return decision;
    }

    /**
     * Runs the verification commands, asking the agent to fix failures.
     *
     * @return the result of the last agent run, which is {@code lastRun} when no fix was needed
     */
    private AgentResult verify(PipelineContext context, Feature feature, ResolvedModel model,
                               AgentResult lastRun) throws InterruptedException {
        int maxAttempts = config.getMaxVerificationAttempts();
        for (int attempt = 0; ; attempt++) {
            checkCancelled(context);
            emitProgress(context, "Running verification");
            VerificationResult result = verificationRunner.run(context.workDir(), config.getVerificationCommands());
            if (result.passed()) {
                log.info("Verification passed for {}", feature.id());
                return lastRun;
            }
            if (attempt >= maxAttempts) {
                throw new VerificationFailedException("Verification failed after " + maxAttempts
                        + " fix attempts: " + result.failedCommand());
            }
            emitProgress(context, "Verification failed (" + result.failedCommand()
                    + "), asking agent to fix (attempt " + (attempt + 1) + "/" + maxAttempts + ")");
            lastRun = runAgent(context, PromptBuilder.fixVerification(feature, result, attempt + 1, maxAttempts),
                    model, false);
        }
    }

    // The stored output spans earlier runs, so it is only read when the last run has no summary
    private String summaryOf(PipelineContext context, AgentResult lastRun) {
        String summary = lastRun != null ? OutputParser.extractSummary(lastRun.output()) : null;
        if (summary != null) {
            return summary;
        }
        return featureStore.readAgentOutput(context.projectPath(), context.feature().id())
                .map(OutputParser::extractSummary)
                .orElse(null);
    }

    private void commit(PipelineContext context, Feature feature) {
        String message = "feat: " + feature.displayTitle() + "\n\nFeature: " + feature.id();
        boolean committed = commitService.commit(context.workDir(), message);
        if (committed) {
            emitProgress(context, "Committed changes");
        }
    }

    private AgentResult runAgent(PipelineContext context, String prompt, ResolvedModel model,
                                 boolean planningMode) throws InterruptedException {
        String projectPath = context.projectPath();
        String featureId = context.feature().id();
        featureStore.appendAgentOutput(projectPath, featureId,
                "\n\n---\n## " + (planningMode ? "Planning" : "Agent run") + " (" + model.model() + ")\n\n");
        var request = new AgentRequest(featureId, context.workDir(), prompt, model.model(), model.provider(),
                planningMode, line -> {
                    featureStore.appendAgentOutput(projectPath, featureId, line + "\n");
                    emit(AutoModeEvent.AUTO_MODE_PROGRESS, context, payload("content", line));
                });
        return agentRunner.run(request);
    }

    private static boolean isApproved(PlanSpec planSpec) {
        return planSpec != null && planSpec.status() == PlanStatus.APPROVED;
    }

    private static void checkCancelled(PipelineContext context) {
        if (context.runningFeature().isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Feature execution aborted");
        }
    }

    private void emitProgress(PipelineContext context, String message) {
        emit(AutoModeEvent.AUTO_MODE_PROGRESS, context, payload("content", message));
    }

    private void emit(String type, PipelineContext context, Map<String, Object> payload) {
        eventBus.publish(AutoModeEvent.of(type, context.projectPath(), context.feature().branchName(),
                context.feature().id(), payload));
    }

}
