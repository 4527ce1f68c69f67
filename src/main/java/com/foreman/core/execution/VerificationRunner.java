package com.foreman.core.execution;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs verification commands (build, tests, lint) in a work directory.
 */
@FunctionalInterface
public interface VerificationRunner {

    VerificationResult run(Path workDir, List<String> commands) throws InterruptedException;
}
