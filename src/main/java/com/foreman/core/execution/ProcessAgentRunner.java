package com.foreman.core.execution;

import com.foreman.core.error.AgentExecutionException;
import com.foreman.core.settings.AutoModeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link AgentRunner} that launches the configured agent CLI as a child process.
 * <p>
 * The prompt goes to stdin; stdout and stderr are merged and streamed line by line to the
 * request's listener. Interrupting the calling thread kills the process.
 */
public class ProcessAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentRunner.class);

    private final AutoModeProperties.Agent config;

    public ProcessAgentRunner(AutoModeProperties.Agent config) {
        this.config = config;
    }

    @Override
    public AgentResult run(AgentRequest request) throws InterruptedException {
        List<String> command = buildCommand(request);
        log.info("Starting agent for {} with model {} in {}", request.featureId(), request.model(), request.workDir());

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(request.workDir().toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new AgentExecutionException("Failed to start agent: " + e.getMessage(), e);
        }

        var output = new StringBuilder();
        Deque<String> tail = new ArrayDeque<>();
        Thread reader = new Thread(() -> drain(process, request, output, tail), "agent-output-" + request.featureId());
        reader.setDaemon(true);
        reader.start();

        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(request.prompt().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Could not write prompt to agent stdin: {}", e.getMessage());
        }

        try {
            boolean finished = process.waitFor(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(1000);
                throw new AgentExecutionException("Agent timed out after " + config.getTimeout().toMinutes()
                        + " minutes", -1, tailOf(tail));
            }
            reader.join(5000);
        } catch (InterruptedException e) {
            log.info("Agent for {} interrupted, terminating process", request.featureId());
            process.destroyForcibly();
            throw e;
        }

        int exitCode = process.exitValue();
        String fullOutput;
        synchronized (output) {
            fullOutput = output.toString();
        }
        if (exitCode != 0) {
            String lastLines = tailOf(tail);
            throw new AgentExecutionException("Agent exited with code " + exitCode + ": " + lastLines,
                    exitCode, lastLines);
        }
        log.info("Agent for {} finished ({} chars of output)", request.featureId(), fullOutput.length());
        return new AgentResult(exitCode, fullOutput);
    }

    List<String> buildCommand(AgentRequest request) {
        var command = new ArrayList<String>();
        for (String token : config.getCommand()) {
            command.add(token
                    .replace("{model}", request.model())
                    .replace("{provider}", request.provider()));
        }
        return command;
    }

    private void drain(Process process, AgentRequest request, StringBuilder output, Deque<String> tail) {
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (output) {
                    output.append(line).append('\n');
                }
                synchronized (tail) {
                    tail.addLast(line);
                    while (tail.size() > config.getOutputTailLines()) {
                        tail.removeFirst();
                    }
                }
                if (request.outputListener() != null) {
                    request.outputListener().accept(line);
                }
            }
        } catch (IOException e) {
            // Stream closes when the process is killed
            log.debug("Agent output stream closed for {}: {}", request.featureId(), e.getMessage());
        }
    }

    private static String tailOf(Deque<String> tail) {
        synchronized (tail) {
            return String.join("\n", tail);
        }
    }
}
