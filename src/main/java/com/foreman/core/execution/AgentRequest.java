package com.foreman.core.execution;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * One agent invocation.
 *
 * @param featureId      feature being worked on
 * @param workDir        directory the agent runs in
 * @param prompt         full prompt, written to the agent's stdin
 * @param model          resolved model id
 * @param provider       provider derived from the model id
 * @param planningMode   true when the agent should only produce a plan
 * @param outputListener receives each output line as it is produced
 */
public record AgentRequest(
    String featureId,
    Path workDir,
    String prompt,
    String model,
    String provider,
    boolean planningMode,
    Consumer<String> outputListener
) {}
