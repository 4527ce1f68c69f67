package com.foreman.core.feature;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.error.FeatureNotFoundException;
import com.foreman.core.error.FeatureStoreException;
import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link FeatureStore} that keeps each feature in
 * {@code <project>/<dataDir>/features/<id>/feature.json} next to its {@code agent-output.md}.
 * <p>
 * Writes go through a temp file and an atomic move so readers never see a partial document.
 */
public class FileFeatureStore implements FeatureStore {

    private static final Logger log = LoggerFactory.getLogger(FileFeatureStore.class);

    static final String FEATURE_FILE = "feature.json";
    static final String AGENT_OUTPUT_FILE = "agent-output.md";

    private final ObjectMapper objectMapper;
    private final String dataDir;
    private final Clock clock;

    public FileFeatureStore(ObjectMapper objectMapper, String dataDir, Clock clock) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
        this.clock = clock;
    }

    public Path featuresDir(String projectPath) {
        return Path.of(projectPath).resolve(dataDir).resolve("features");
    }

    public Path featureDir(String projectPath, String featureId) {
        return featuresDir(projectPath).resolve(featureId);
    }

    @Override
    public Optional<Feature> load(String projectPath, String featureId) {
        Path file = featureDir(projectPath, featureId).resolve(FEATURE_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public List<Feature> loadAll(String projectPath) {
        Path dir = featuresDir(projectPath);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        var features = new ArrayList<Feature>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.sorted().toList()) {
                Path file = child.resolve(FEATURE_FILE);
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    features.add(read(file));
                } catch (FeatureStoreException e) {
                    log.warn("Skipping unreadable feature file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to list features in " + dir, e);
        }
        features.sort(Comparator.comparing(Feature::id));
        return features;
    }

    @Override
    public synchronized Feature save(String projectPath, Feature feature) {
        Feature stamped = feature.withUpdatedAt(clock.instant());
        Path dir = featureDir(projectPath, feature.id());
        Path target = dir.resolve(FEATURE_FILE);
        try {
            Files.createDirectories(dir);
            Path tmp = dir.resolve(FEATURE_FILE + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), stamped);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to write feature " + feature.id(), e);
        }
        log.debug("Saved feature {} with status {}", feature.id(), stamped.status().value());
        return stamped;
    }

    @Override
    public synchronized Feature updateStatus(String projectPath, String featureId, FeatureStatus status) {
        Feature feature = load(projectPath, featureId)
                .orElseThrow(() -> new FeatureNotFoundException(featureId));
        return save(projectPath, feature.withStatus(status));
    }

    @Override
    public synchronized void appendAgentOutput(String projectPath, String featureId, String text) {
        Path dir = featureDir(projectPath, featureId);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(AGENT_OUTPUT_FILE), text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to append agent output for " + featureId, e);
        }
    }

    @Override
    public Optional<String> readAgentOutput(String projectPath, String featureId) {
        Path file = featureDir(projectPath, featureId).resolve(AGENT_OUTPUT_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to read agent output for " + featureId, e);
        }
    }

    private Feature read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Feature.class);
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to read " + file, e);
        }
    }
}
