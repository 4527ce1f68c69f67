package com.foreman.dispatch.cli;

import com.foreman.core.engine.AutoModeService;
import com.foreman.core.error.AutoLoopAlreadyRunningException;
import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import com.foreman.core.model.PartitionKey;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CLI command: foreman auto &lt;projectPath&gt;
 * <p>
 * Runs the auto loop in the foreground and prints its events. Without {@code --until-idle}
 * the command runs until the loop pauses on failures or the process is interrupted.
 */
@Command(name = "auto", mixinStandardHelpOptions = true, description = "Run auto mode for a project")
@Component
public class AutoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project directory")
    private String projectPath;

    @Option(names = {"--branch", "-b"}, description = "Worktree branch (default: main worktree)")
    private String branchName;

    @Option(names = {"--max-concurrency", "-c"}, description = "Concurrent features (default: from settings)")
    private Integer maxConcurrency;

    @Option(names = "--until-idle", description = "Stop once no pending feature is left")
    private boolean untilIdle;

    private final AutoModeService autoModeService;
    private final EventBus eventBus;

    public AutoCommand(AutoModeService autoModeService, EventBus eventBus) {
        this.autoModeService = autoModeService;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path project = Path.of(projectPath).toAbsolutePath().normalize();
        if (!Files.isDirectory(project)) {
            ConsoleOutput.error("Not a directory: " + project);
            return 2;
        }
        String path = project.toString();

        PartitionKey partition = autoModeService.resolvePartition(path, branchName);
        var done = new CountDownLatch(1);
        var endEvent = new AtomicReference<AutoModeEvent>();
        EventBus.Subscription subscription = eventBus.subscribe(path, event -> {
            ConsoleOutput.event(event);
            if (!PartitionKey.of(event.projectPath(), event.branchName()).equals(partition)) {
                return;
            }
            boolean finished = AutoModeEvent.AUTO_MODE_STOPPED.equals(event.eventType())
                    || AutoModeEvent.AUTO_MODE_PAUSED_FAILURES.equals(event.eventType())
                    || (untilIdle && AutoModeEvent.AUTO_MODE_IDLE.equals(event.eventType()));
            if (finished && endEvent.compareAndSet(null, event)) {
                done.countDown();
            }
        });

        try {
            autoModeService.startAutoLoop(path, branchName, maxConcurrency);
            done.await();
        } catch (AutoLoopAlreadyRunningException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.warn("Interrupted");
        } finally {
            if (autoModeService.isAutoLoopRunning(path, branchName)) {
                autoModeService.stopAutoLoop(path, branchName);
            }
            subscription.unsubscribe();
        }

        AutoModeEvent end = endEvent.get();
        if (end != null && AutoModeEvent.AUTO_MODE_PAUSED_FAILURES.equals(end.eventType())) {
            ConsoleOutput.error("Auto mode paused: " + end.message());
            return 1;
        }
        ConsoleOutput.success("Auto mode finished");
        return 0;
    }
}
