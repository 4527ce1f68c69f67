package com.foreman.core.execution;

import com.foreman.core.settings.AutoModeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ModelResolverTest {

    private AutoModeProperties properties;
    private ModelResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new AutoModeProperties();
        resolver = new ModelResolver(properties);
    }

    @Test
    @DisplayName("null or blank falls back to the default model")
    void defaultModel() {
        assertEquals(new ResolvedModel("claude-sonnet-4-5", "claude"), resolver.resolve(null));
        assertEquals(new ResolvedModel("claude-sonnet-4-5", "claude"), resolver.resolve("  "));
    }

    @Test
    @DisplayName("aliases are case-insensitive")
    void alias() {
        assertEquals("claude-opus-4-1", resolver.resolve("Opus").model());
    }

    @Test
    void unknownIdPassesThrough() {
        properties.getPipeline().setDefaultModel("gpt-5");
        assertEquals(new ResolvedModel("gemini-2.5-pro", "gemini"), resolver.resolve("gemini-2.5-pro"));
        assertEquals(new ResolvedModel("gpt-5", "codex"), resolver.resolve(null));
    }

    @ParameterizedTest
    @CsvSource({
            "claude-haiku-4-5, claude",
            "gpt-4o, codex",
            "o3-mini, codex",
            "gemini-2.0-flash, gemini",
            "qwen3-coder, opencode",
            "opus-local, opencode"
    })
    void providerForModel(String model, String provider) {
        assertEquals(provider, ModelResolver.providerFor(model));
    }
}
