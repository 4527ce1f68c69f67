package com.foreman.core.execution;

public record ResolvedModel(String model, String provider) {}
