package com.foreman.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs each verification command through {@code sh -c}, stopping at the first failure.
 */
public class ShellVerificationRunner implements VerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellVerificationRunner.class);

    private final Duration timeout;

    public ShellVerificationRunner(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public VerificationResult run(Path workDir, List<String> commands) throws InterruptedException {
        var combined = new StringBuilder();
        for (String command : commands) {
            log.info("Verifying with: {}", command);
            combined.append("$ ").append(command).append('\n');
            Process process;
            try {
                process = new ProcessBuilder("sh", "-c", command)
                        .directory(workDir.toFile())
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.PIPE)
                        .start();
            } catch (IOException e) {
                combined.append(e.getMessage()).append('\n');
                return new VerificationResult(false, command, combined.toString());
            }

            Thread reader = new Thread(() -> {
                try {
                    String text = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                    synchronized (combined) {
                        combined.append(text);
                    }
                } catch (IOException e) {
                    log.debug("Verification output stream closed: {}", e.getMessage());
                }
            }, "verify-output");
            reader.setDaemon(true);
            reader.start();

            try {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    reader.join(1000);
                    synchronized (combined) {
                        combined.append("\nTimed out after ").append(timeout.toSeconds()).append("s\n");
                        return new VerificationResult(false, command, combined.toString());
                    }
                }
                reader.join(5000);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.info("Verification command failed with exit code {}: {}", exitCode, command);
                synchronized (combined) {
                    return new VerificationResult(false, command, combined.toString());
                }
            }
        }
        synchronized (combined) {
            return VerificationResult.success(combined.toString());
        }
    }
}
