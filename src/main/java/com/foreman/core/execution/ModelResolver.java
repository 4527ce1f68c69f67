package com.foreman.core.execution;

import com.foreman.core.settings.AutoModeProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves a feature's model alias to a model id and derives the provider from it.
 */
@Component
public class ModelResolver {

    private final AutoModeProperties properties;

    public ModelResolver(AutoModeProperties properties) {
        this.properties = properties;
    }

    public ResolvedModel resolve(String requested) {
        var pipeline = properties.getPipeline();
        String model;
        if (requested == null || requested.isBlank()) {
            model = pipeline.getDefaultModel();
        } else {
            String alias = requested.trim().toLowerCase(Locale.ROOT);
            model = pipeline.getModelAliases().getOrDefault(alias, requested.trim());
        }
        return new ResolvedModel(model, providerFor(model));
    }

    static String providerFor(String model) {
        String id = model.toLowerCase(Locale.ROOT);
        if (id.startsWith("claude-")) {
            return "claude";
        }
        if (id.startsWith("gpt-") || id.matches("o\\d.*")) {
            return "codex";
        }
        if (id.startsWith("gemini-")) {
            return "gemini";
        }
        return "opencode";
    }
}
