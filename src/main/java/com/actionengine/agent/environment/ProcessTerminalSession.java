package com.actionengine.agent.environment;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs scripts through a shell in a working directory dedicated to one
 * thread. Output (stdout and stderr merged) is capped at {@code maxOutputChars}.
 */
@Slf4j
public class ProcessTerminalSession implements TerminalSession {

    private final String shell;
    private final Path workingDirectory;
    private final int maxOutputChars;
    private final ExecutorService outputReader;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public ProcessTerminalSession(String shell, Path workingDirectory, int maxOutputChars) {
        this.shell = shell;
        this.workingDirectory = workingDirectory;
        this.maxOutputChars = maxOutputChars;
        try {
            Files.createDirectories(workingDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create terminal working directory " + workingDirectory, e);
        }
        this.outputReader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "terminal-output-" + workingDirectory.getFileName());
            t.setDaemon(true);
            return t;
        });
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    @Override
    public TerminalOutput execute(String script, int timeoutSeconds) {
        if (closed) {
            throw new IllegalStateException("Terminal session is closed");
        }
        ProcessBuilder pb = new ProcessBuilder(shell, "-c", script)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true);
        pb.environment().put("PWD", workingDirectory.toString());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start shell " + shell, e);
        }
        running.add(process);
        try {
            Future<String> output = outputReader.submit(() -> readOutput(process));

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.warn("Script timed out after {}s in {}", timeoutSeconds, workingDirectory);
                return new TerminalOutput(-1, collect(output), true);
            }
            return new TerminalOutput(process.exitValue(), collect(output), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for script", e);
        } finally {
            running.remove(process);
        }
    }

    private String readOutput(Process process) throws IOException {
        StringBuilder sb = new StringBuilder();
        boolean truncated = false;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (sb.length() < maxOutputChars) {
                    sb.append(line).append('\n');
                } else {
                    truncated = true;
                }
                line = reader.readLine();
            }
        }
        if (sb.length() > maxOutputChars) {
            sb.setLength(maxOutputChars);
            truncated = true;
        }
        if (truncated) {
            sb.append("\n[Output truncated...]");
        }
        return sb.toString();
    }

    private String collect(Future<String> output) throws InterruptedException {
        try {
            return output.get(2, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            output.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            return "[Output read failed: " + e.getCause().getMessage() + "]";
        }
    }

    @Override
    public void close() {
        closed = true;
        running.forEach(Process::destroyForcibly);
        running.clear();
        outputReader.shutdownNow();
        log.debug("Terminal session closed: {}", workingDirectory);
    }
}
