package com.actionengine.agent.tool.impl;

import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.tool.AgentTool;
import com.actionengine.agent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Signals that the task is finished, successfully or not. The executor ends
 * the workflow after running it.
 */
@Component
@Slf4j
public class TerminateTool implements AgentTool {

    public static final String NAME = "terminate";

    private static final List<String> STATUSES = List.of("success", "failure");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                End the interaction. Use status 'success' when the task has been completed,
                or 'failure' when it cannot be completed (missing file, repeated errors, refused approval).
                Always explain why in 'reason'.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "status", Map.of(
                                "type", "string",
                                "enum", STATUSES,
                                "description", "The completion status"
                        ),
                        "reason", Map.of(
                                "type", "string",
                                "description", "Explanation for terminating"
                        )
                ),
                "required", List.of("status", "reason")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ThreadEnvironment environment) {
        String status = String.valueOf(arguments.get("status")).toLowerCase();
        String reason = arguments.get("reason") != null ? arguments.get("reason").toString() : "";

        if (!STATUSES.contains(status)) {
            return ToolResult.failure("Invalid status. Must be one of: " + STATUSES);
        }
        if (reason.isBlank()) {
            return ToolResult.failure("Reason is required: explain why the flow is terminating");
        }

        log.info("Terminate requested [thread={}, status={}, reason={}]",
                environment != null ? environment.getThreadId() : null, status, reason);
        return ToolResult.builder()
                .output("Flow terminated - " + status.toUpperCase() + "\nReason: " + reason)
                .system("status=" + status + ",reason=" + reason)
                .build();
    }
}
