package com.foreman.core.scheduler;

import com.foreman.core.concurrency.ConcurrencyManager;
import com.foreman.core.error.AutoLoopAlreadyRunningException;
import com.foreman.core.error.ErrorInfo;
import com.foreman.core.error.ErrorType;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.AutoModeConfig;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import com.foreman.core.model.PartitionKey;
import com.foreman.core.settings.AutoModeProperties;
import com.foreman.core.settings.GlobalSettings;
import com.foreman.core.settings.SettingsProvider;
import com.foreman.core.settings.WorktreeAutoModeSettings;
import com.foreman.core.worktree.WorktreeResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AutoLoopCoordinatorTest {

    private static final String PROJECT = "/work/app";

    private WorktreeResolver worktreeResolver;
    private ConcurrencyManager concurrencyManager;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private AutoModeProperties.AutoMode config;
    private final List<AutoModeEvent> events = new CopyOnWriteArrayList<>();

    private final List<Feature> pending = new CopyOnWriteArrayList<>();
    private List<Feature> allFeatures;
    private final List<String> dispatched = new CopyOnWriteArrayList<>();
    private final List<String> savedStates = new CopyOnWriteArrayList<>();
    private final List<String> clearedStates = new CopyOnWriteArrayList<>();
    private final List<String> resetProjects = new CopyOnWriteArrayList<>();
    private RuntimeException dispatchFailure;
    private Optional<SettingsProvider> settingsProvider = Optional.empty();

    private AutoLoopCoordinator coordinator;

    @BeforeEach
    void setUp() {
        worktreeResolver = mock(WorktreeResolver.class);
        concurrencyManager = new ConcurrencyManager(worktreeResolver);
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        config = new AutoModeProperties.AutoMode();
        config.setPollInterval(Duration.ofMillis(20));
        config.setCapacityWait(Duration.ofMillis(20));
        config.setErrorBackoff(Duration.ofMillis(20));
        coordinator = newCoordinator(true);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private AutoLoopCoordinator newCoordinator(boolean withAllFeatures) {
        AutoLoopCallbacks.AllFeaturesLoader loadAll = path -> allFeatures != null ? allFeatures : List.copyOf(pending);
        var callbacks = new AutoLoopCallbacks(
                (path, branch) -> List.copyOf(pending),
                withAllFeatures ? Optional.of(loadAll) : Optional.empty(),
                (path, featureId, useWorktrees, isAutoMode) -> {
                    if (dispatchFailure != null && featureId.equals(dispatchFailure.getMessage())) {
                        throw dispatchFailure;
                    }
                    concurrencyManager.acquire(featureId, path, null, isAutoMode, false);
                    dispatched.add(featureId);
                    return new CompletableFuture<Void>();
                },
                null,
                concurrencyManager::isRunning,
                (path, branch, max) -> savedStates.add(path + "|" + branch + "|" + max),
                (path, branch) -> clearedStates.add(path + "|" + branch),
                resetProjects::add);
        return new AutoLoopCoordinator(eventBus, concurrencyManager, settingsProvider, callbacks, config,
                new ForemanMetrics(registry), Clock.systemUTC());
    }

    private static Feature feature(String id, int priority) {
        return Feature.of(id, FeatureStatus.BACKLOG).withPriority(priority);
    }

    private ProjectAutoLoopState state(int maxConcurrency) {
        return new ProjectAutoLoopState(PartitionKey.main(PROJECT),
                new AutoModeConfig(maxConcurrency, false, PROJECT, null));
    }

    private List<AutoModeEvent> eventsOfType(String type) {
        return events.stream().filter(e -> type.equals(e.eventType())).toList();
    }

    private CountDownLatch awaitEvent(String type) {
        var latch = new CountDownLatch(1);
        eventBus.subscribeAll(e -> {
            if (type.equals(e.eventType())) {
                latch.countDown();
            }
        });
        return latch;
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start resets stuck features, saves state and announces the loop")
        void start() {
            int max = coordinator.startAutoLoop(PROJECT, null, 3);

            assertEquals(3, max);
            assertTrue(coordinator.isAutoLoopRunning(PROJECT, null));
            assertEquals(List.of(PROJECT), resetProjects);
            assertEquals(List.of(PROJECT + "|null|3"), savedStates);
            AutoModeEvent started = eventsOfType(AutoModeEvent.AUTO_MODE_STARTED).get(0);
            assertEquals(3, started.payload().get("maxConcurrency"));
            assertEquals(new AutoModeConfig(3, true, PROJECT, null),
                    coordinator.getAutoLoopConfig(PROJECT, null).orElseThrow());
        }

        @Test
        void duplicateStartIsRejected() {
            coordinator.startAutoLoop(PROJECT, null, 1);

            var error = assertThrows(AutoLoopAlreadyRunningException.class,
                    () -> coordinator.startAutoLoop(PROJECT, null, 2));
            assertTrue(error.getMessage().contains("main worktree"));
            assertEquals(1, eventsOfType(AutoModeEvent.AUTO_MODE_STARTED).size());
        }

        @Test
        @DisplayName("the primary branch is the main worktree")
        void primaryBranchIsMain() {
            when(worktreeResolver.getPrimaryBranch(PROJECT)).thenReturn("main");
            coordinator.startAutoLoop(PROJECT, "main", 1);

            assertTrue(coordinator.isAutoLoopRunning(PROJECT, null));
            assertThrows(AutoLoopAlreadyRunningException.class, () -> coordinator.startAutoLoop(PROJECT, null, 1));
        }

        @Test
        @DisplayName("branches of one project run independent loops")
        void branchesAreIndependent() {
            coordinator.startAutoLoop(PROJECT, null, 1);
            coordinator.startAutoLoop(PROJECT, "feature/login", 1);

            assertEquals(List.of(PROJECT), coordinator.getActiveProjects());
            assertEquals(2, coordinator.getActiveWorktrees().size());

            coordinator.stopAutoLoop(PROJECT, "feature/login");
            assertTrue(coordinator.isAutoLoopRunning(PROJECT, null));
            assertFalse(coordinator.isAutoLoopRunning(PROJECT, "feature/login"));
        }

        @Test
        void stopWithoutStartReturnsZero() {
            assertEquals(0, coordinator.stopAutoLoop(PROJECT, null));
            assertTrue(events.isEmpty());
            assertTrue(clearedStates.isEmpty());
        }

        @Test
        @DisplayName("stop reports running features and clears persisted state")
        void stop() {
            coordinator.startAutoLoop(PROJECT, null, 2);
            concurrencyManager.acquire("F-9", PROJECT, null, true, false);

            assertEquals(1, coordinator.stopAutoLoop(PROJECT, null));
            assertFalse(coordinator.isAutoLoopRunning(PROJECT, null));
            assertEquals(List.of(PROJECT + "|null"), clearedStates);
            assertEquals(1, eventsOfType(AutoModeEvent.AUTO_MODE_STOPPED).size());
            assertTrue(concurrencyManager.isRunning("F-9"));
        }

        @Test
        @DisplayName("stop wakes the loop thread out of its poll sleep")
        void stopInterruptsSleep() throws Exception {
            config.setPollInterval(Duration.ofSeconds(30));
            CountDownLatch idle = awaitEvent(AutoModeEvent.AUTO_MODE_IDLE);
            coordinator.startAutoLoop(PROJECT, null, 1);
            assertTrue(idle.await(5, TimeUnit.SECONDS));
            Thread loopThread = Thread.getAllStackTraces().keySet().stream()
                    .filter(t -> t.getName().equals("auto-loop-" + PartitionKey.main(PROJECT).displayName()))
                    .findFirst()
                    .orElseThrow();

            long started = System.nanoTime();
            coordinator.stopAutoLoop(PROJECT, null);
            loopThread.join(TimeUnit.SECONDS.toMillis(5));

            assertFalse(loopThread.isAlive());
            assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(5));
        }

        @Test
        @DisplayName("shutdown stops loops but keeps persisted state")
        void shutdownKeepsState() {
            coordinator.startAutoLoop(PROJECT, null, 1);

            coordinator.shutdown();

            assertTrue(coordinator.getActiveWorktrees().isEmpty());
            assertTrue(clearedStates.isEmpty());
            assertTrue(eventsOfType(AutoModeEvent.AUTO_MODE_STOPPED).isEmpty());
        }

        @Test
        @DisplayName("a running loop dispatches pending work")
        void loopDispatches() throws Exception {
            pending.add(feature("F-1", 2));
            CountDownLatch idle = awaitEvent(AutoModeEvent.AUTO_MODE_IDLE);

            coordinator.startAutoLoop(PROJECT, null, 1);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (dispatched.isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(List.of("F-1"), dispatched);
            assertFalse(idle.await(100, TimeUnit.MILLISECONDS), "no idle while a feature runs");
        }
    }

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        @DisplayName("dispatches the most urgent features up to the concurrency limit")
        void priorityAndCapacity() throws Exception {
            pending.addAll(List.of(feature("F-a", 3), feature("F-b", 1), feature("F-c", 2)));

            coordinator.tick(state(2));

            assertEquals(List.of("F-b", "F-c"), dispatched);
            assertEquals(2.0, registry.get("foreman.scheduler.dispatches").tag("success", "true").counter().count());
        }

        @Test
        @DisplayName("waits when the partition is at capacity")
        void atCapacity() throws Exception {
            pending.add(feature("F-1", 1));
            concurrencyManager.acquire("F-0", PROJECT, null, true, false);

            coordinator.tick(state(1));

            assertTrue(dispatched.isEmpty());
            assertTrue(eventsOfType(AutoModeEvent.AUTO_MODE_IDLE).isEmpty());
        }

        @Test
        @DisplayName("features running elsewhere do not count against the partition")
        void otherPartitionDoesNotCount() throws Exception {
            pending.add(feature("F-1", 1));
            concurrencyManager.acquire("F-0", PROJECT, "feature/other", true, false);

            coordinator.tick(state(1));

            assertEquals(List.of("F-1"), dispatched);
        }

        @Test
        @DisplayName("emits idle only when nothing is pending or running")
        void idle() throws Exception {
            coordinator.tick(state(1));
            assertEquals(1, eventsOfType(AutoModeEvent.AUTO_MODE_IDLE).size());
            assertEquals(1.0, registry.get("foreman.scheduler.idle").counter().count());

            concurrencyManager.acquire("F-0", PROJECT, null, true, false);
            coordinator.tick(state(2));
            assertEquals(1, eventsOfType(AutoModeEvent.AUTO_MODE_IDLE).size());
        }

        @Test
        @DisplayName("skips features whose dependencies are unfinished")
        void dependencies() throws Exception {
            Feature blocked = feature("F-2", 1).withDependencies(List.of("F-1"));
            pending.add(blocked);
            allFeatures = List.of(Feature.of("F-1", FeatureStatus.IN_PROGRESS), blocked);

            coordinator.tick(state(2));
            assertTrue(dispatched.isEmpty());

            allFeatures = List.of(Feature.of("F-1", FeatureStatus.VERIFIED), blocked);
            coordinator.tick(state(2));
            assertEquals(List.of("F-2"), dispatched);
        }

        @Test
        @DisplayName("without an all-features loader dependencies are not checked")
        void dependencyBypass() throws Exception {
            coordinator = newCoordinator(false);
            pending.add(feature("F-2", 1).withDependencies(List.of("F-1")));

            coordinator.tick(state(1));

            assertEquals(List.of("F-2"), dispatched);
        }

        @Test
        @DisplayName("a dispatch failure is reported and the next feature still runs")
        void dispatchFailure() throws Exception {
            pending.addAll(List.of(feature("F-1", 1), feature("F-2", 2)));
            dispatchFailure = new IllegalStateException("F-1");

            coordinator.tick(state(2));

            assertEquals(List.of("F-2"), dispatched);
            AutoModeEvent error = eventsOfType(AutoModeEvent.AUTO_MODE_ERROR).get(0);
            assertEquals("F-1", error.featureId());
            assertEquals(1.0, registry.get("foreman.scheduler.dispatches").tag("success", "false").counter().count());
        }

        @Test
        void loaderFailureIsReported() throws Exception {
            var callbacks = new AutoLoopCallbacks((path, branch) -> {
                throw new IllegalStateException("disk gone");
            }, Optional.empty(), (path, id, wt, auto) -> new CompletableFuture<Void>(),
                    null, null, null, null, null);
            coordinator = new AutoLoopCoordinator(eventBus, concurrencyManager, Optional.empty(), callbacks, config,
                    new ForemanMetrics(registry), Clock.systemUTC());

            coordinator.tick(state(1));

            assertEquals("Failed to load features: disk gone",
                    eventsOfType(AutoModeEvent.AUTO_MODE_ERROR).get(0).message());
        }
    }

    @Nested
    @DisplayName("circuit breaker")
    class Breaker {

        private final ErrorInfo agentError = ErrorInfo.of(ErrorType.AGENT_ERROR, "exit 1");

        @Test
        void noLoopNoPause() {
            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
        }

        @Test
        @DisplayName("the third consecutive failure pauses")
        void threshold() {
            coordinator.startAutoLoop(PROJECT, null, 1);

            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
            assertTrue(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
        }

        @Test
        @DisplayName("a success resets the counter")
        void successResets() {
            coordinator.startAutoLoop(PROJECT, null, 1);
            coordinator.trackFailureAndCheckPause(PROJECT, null, agentError);
            coordinator.trackFailureAndCheckPause(PROJECT, null, agentError);

            coordinator.recordSuccess(PROJECT, null);

            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
        }

        @Test
        @DisplayName("quota and rate limit errors pause immediately")
        void quotaPausesImmediately() {
            coordinator.startAutoLoop(PROJECT, null, 1);

            assertTrue(coordinator.trackFailureAndCheckPause(PROJECT, null,
                    ErrorInfo.of(ErrorType.QUOTA_EXHAUSTED, "usage limit reached")));
        }

        @Test
        @DisplayName("quota and rate limit errors do not count toward the threshold")
        void quotaNotCounted() {
            coordinator.startAutoLoop(PROJECT, null, 1);

            assertTrue(coordinator.trackFailureAndCheckPause(PROJECT, null,
                    ErrorInfo.of(ErrorType.QUOTA_EXHAUSTED, "usage limit reached")));
            assertTrue(coordinator.trackFailureAndCheckPause(PROJECT, null,
                    ErrorInfo.of(ErrorType.RATE_LIMIT, "429 too many requests")));
            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, null, agentError));
        }

        @Test
        @DisplayName("failures are counted per partition")
        void perPartition() {
            coordinator.startAutoLoop(PROJECT, null, 1);
            coordinator.startAutoLoop(PROJECT, "feature/login", 1);
            coordinator.trackFailureAndCheckPause(PROJECT, null, agentError);
            coordinator.trackFailureAndCheckPause(PROJECT, null, agentError);

            assertFalse(coordinator.trackFailureAndCheckPause(PROJECT, "feature/login", agentError));
        }

        @Test
        @DisplayName("pausing emits paused_failures and stops the loop")
        void pause() {
            coordinator.startAutoLoop(PROJECT, null, 1);
            for (int i = 0; i < 3; i++) {
                coordinator.trackFailureAndCheckPause(PROJECT, null, agentError);
            }

            coordinator.signalShouldPause(PROJECT, null, agentError);

            assertFalse(coordinator.isAutoLoopRunning(PROJECT, null));
            AutoModeEvent paused = eventsOfType(AutoModeEvent.AUTO_MODE_PAUSED_FAILURES).get(0);
            assertEquals(3, paused.payload().get("failureCount"));
            assertEquals("agent_error", paused.payload().get("errorType"));
            assertEquals(1, eventsOfType(AutoModeEvent.AUTO_MODE_STOPPED).size());
            assertEquals(1.0, registry.get("foreman.scheduler.breaker_pauses")
                    .tag("error_type", "agent_error").counter().count());
        }

        @Test
        void rateLimitPauseMessage() {
            coordinator.startAutoLoop(PROJECT, null, 1);

            coordinator.signalShouldPause(PROJECT, null, ErrorInfo.of(ErrorType.RATE_LIMIT, "429"));

            assertTrue(eventsOfType(AutoModeEvent.AUTO_MODE_PAUSED_FAILURES).get(0).message()
                    .contains("rate limit"));
        }
    }

    @Nested
    @DisplayName("resolveMaxConcurrency")
    class ResolveMaxConcurrency {

        private AutoLoopCoordinator withSettings(GlobalSettings settings) {
            settingsProvider = Optional.of(() -> settings);
            return newCoordinator(true);
        }

        @Test
        void explicitValueIsClamped() {
            assertEquals(1, coordinator.resolveMaxConcurrency(PROJECT, null, 0));
            assertEquals(10, coordinator.resolveMaxConcurrency(PROJECT, null, 50));
            assertEquals(4, coordinator.resolveMaxConcurrency(PROJECT, null, 4));
        }

        @Test
        void defaultsToOne() {
            assertEquals(1, coordinator.resolveMaxConcurrency(PROJECT, null, null));
        }

        @Test
        @DisplayName("worktree override beats the global value")
        void worktreeOverride() {
            var settings = new GlobalSettings(3, Map.of(
                    PartitionKey.of(PROJECT, "feature/login"), new WorktreeAutoModeSettings(5)));
            AutoLoopCoordinator configured = withSettings(settings);

            assertEquals(5, configured.resolveMaxConcurrency(PROJECT, "feature/login", null));
            assertEquals(3, configured.resolveMaxConcurrency(PROJECT, null, null));
        }

        @Test
        void failingSettingsFallBackToDefault() {
            settingsProvider = Optional.of(() -> {
                throw new IllegalStateException("unreadable");
            });
            assertEquals(1, newCoordinator(true).resolveMaxConcurrency(PROJECT, null, null));
        }
    }
}
