package com.actionengine.agent.tool.impl;

import com.actionengine.agent.config.ToolProperties;
import com.actionengine.agent.environment.TerminalOutput;
import com.actionengine.agent.environment.TerminalSession;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.exception.ToolExecutionException;
import com.actionengine.agent.tool.AgentTool;
import com.actionengine.agent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs a shell script in the calling thread's terminal session.
 *
 * The session's working directory is private to the thread. Calls to this
 * tool go through human approval by default.
 */
@Component
@Slf4j
public class TerminalTool implements AgentTool {

    public static final String NAME = "terminal";
    public static final String SCRIPT_ARG = "script";

    private final ToolProperties toolProperties;

    public TerminalTool(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                Execute a shell command in your terminal and return its combined stdout/stderr.
                Use it to inspect, create, move or delete files, run programs and check results.
                Commands run non-interactively; avoid commands that wait for input.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        SCRIPT_ARG, Map.of(
                                "type", "string",
                                "description", "The shell command to execute, e.g. 'ls -la'"
                        ),
                        "timeout_seconds", Map.of(
                                "type", "integer",
                                "description", "Optional timeout. Default: "
                                        + toolProperties.getTerminal().getDefaultTimeoutSeconds()
                        )
                ),
                "required", List.of(SCRIPT_ARG)
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ThreadEnvironment environment) {
        Object rawScript = arguments.get(SCRIPT_ARG);
        if (rawScript != null && !(rawScript instanceof String)) {
            return ToolResult.failure("'script' must be a string, got " + rawScript.getClass().getSimpleName());
        }
        String script = (String) rawScript;
        if (script == null || script.isBlank()) {
            return ToolResult.failure("'script' is required");
        }

        try {
            TerminalSession terminal = environment.terminalSession()
                    .orElseThrow(() -> new ToolExecutionException("Terminal is disabled for this thread"));
            TerminalOutput result = terminal.execute(script, timeout(arguments));
            log.info("Script finished [thread={}, exitCode={}, timedOut={}]",
                    environment.getThreadId(), result.exitCode(), result.timedOut());

            if (result.timedOut()) {
                return ToolResult.failure("Command timed out after " + timeout(arguments) + " seconds\n"
                        + result.output());
            }
            String output = result.output().isEmpty() ? "(no output)" : result.output();
            if (result.exitCode() != 0) {
                return ToolResult.failure("Exit code: " + result.exitCode() + "\n" + output);
            }
            return ToolResult.success(output);
        } catch (ToolExecutionException e) {
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Terminal execution failed [thread={}]", environment.getThreadId(), e);
            return ToolResult.failure("Terminal execution failed: " + e.getMessage());
        }
    }

    private int timeout(Map<String, Object> arguments) {
        ToolProperties.Terminal props = toolProperties.getTerminal();
        if (arguments.get("timeout_seconds") instanceof Number n && n.intValue() > 0) {
            return Math.min(n.intValue(), props.getMaxTimeoutSeconds());
        }
        return props.getDefaultTimeoutSeconds();
    }
}
