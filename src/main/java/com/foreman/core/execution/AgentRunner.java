package com.foreman.core.execution;

/**
 * Runs an AI coding agent to completion.
 * <p>
 * Implementations throw {@link com.foreman.core.error.AgentExecutionException} when the agent
 * fails and must react to thread interruption by terminating the agent and throwing
 * {@link InterruptedException}.
 */
@FunctionalInterface
public interface AgentRunner {

    AgentResult run(AgentRequest request) throws InterruptedException;
}
