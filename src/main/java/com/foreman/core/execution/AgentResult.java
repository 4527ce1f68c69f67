package com.foreman.core.execution;

public record AgentResult(int exitCode, String output) {}
