package com.foreman.core.worktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thin wrapper around the {@code git} CLI via {@link ProcessBuilder}.
 */
public class GitCli {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    /**
     * Result of a captured git invocation.
     */
    public record GitResult(int exitCode, String output) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /**
     * Runs a git command and returns the exit code. Output is drained to the debug log.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "add", "-A")
     * @return process exit code
     */
    public int runGit(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", command);

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }

            return process.waitFor();
        } catch (IOException e) {
            log.error("Git command failed: {}", command, e);
            throw new IllegalStateException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Git command aborted: " + String.join(" ", command), e);
        }
    }

    /**
     * Runs a git command and captures stdout. Stderr is discarded.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments
     * @return exit code and captured stdout
     */
    public GitResult runGitOutput(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", command);

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("Git command exited with code {}: {}", exitCode, command);
            }
            return new GitResult(exitCode, output);
        } catch (IOException e) {
            log.error("Git command failed: {}", command, e);
            throw new IllegalStateException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Git command aborted: " + String.join(" ", command), e);
        }
    }

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }
}
