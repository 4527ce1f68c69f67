package com.foreman.dispatch.cli;

import com.foreman.core.engine.AutoModeService;
import com.foreman.core.feature.FeatureStore;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CLI command: foreman features &lt;projectPath&gt;
 * <p>
 * Lists the features of a project with their status and priority.
 */
@Command(name = "features", mixinStandardHelpOptions = true, description = "List the features of a project")
@Component
public class FeaturesCommand implements Runnable {

    @Parameters(index = "0", description = "Project directory")
    private String projectPath;

    @Option(names = {"--status", "-s"}, description = "Only features with this status (e.g. backlog, verified)")
    private String status;

    @Option(names = "--orphaned", description = "Only features whose branch no longer exists")
    private boolean orphaned;

    private final FeatureStore featureStore;
    private final AutoModeService autoModeService;

    public FeaturesCommand(FeatureStore featureStore, AutoModeService autoModeService) {
        this.featureStore = featureStore;
        this.autoModeService = autoModeService;
    }

    @Override
    public void run() {
        String path = Path.of(projectPath).toAbsolutePath().normalize().toString();

        FeatureStatus filter = null;
        if (status != null) {
            try {
                filter = FeatureStatus.fromValue(status);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Unknown status: " + status);
                return;
            }
        }

        List<Feature> features = orphaned ? autoModeService.detectOrphanedFeatures(path) : featureStore.loadAll(path);
        Set<String> running = autoModeService.getStatus().runningFeatures().stream().collect(Collectors.toSet());

        int shown = 0;
        for (Feature feature : features) {
            if (filter != null && feature.status() != filter) {
                continue;
            }
            ConsoleOutput.feature(feature);
            if (running.contains(feature.id())) {
                ConsoleOutput.info("  running");
            }
            shown++;
        }
        if (shown == 0) {
            ConsoleOutput.info("No features found in " + path);
        }
    }
}
