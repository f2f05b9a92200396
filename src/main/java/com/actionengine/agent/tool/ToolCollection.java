package com.actionengine.agent.tool;

import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.exception.ConfigurationException;
import com.actionengine.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name-indexed set of tools, shared by every thread.
 *
 * Spring injects every {@link AgentTool} bean into the application-wide
 * collection; nodes narrow it with {@link #subset(Collection)} to the tools
 * they expose to the model.
 *
 * {@link #execute} never throws: unknown tools, missing arguments and tool
 * failures all come back as {@link ToolResult#failure(String)} so the
 * workflow always continues and the model can decide what to do next.
 */
@Component
@Slf4j
public class ToolCollection {

    private final Map<String, AgentTool> tools;

    public ToolCollection(List<AgentTool> toolBeans) {
        Map<String, AgentTool> indexed = new LinkedHashMap<>();
        for (AgentTool tool : toolBeans) {
            if (indexed.putIfAbsent(tool.getName(), tool) != null) {
                throw new ConfigurationException("Duplicate tool name: " + tool.getName());
            }
        }
        this.tools = Collections.unmodifiableMap(indexed);
    }

    public ToolCollection subset(Collection<String> names) {
        List<AgentTool> selected = names.stream()
                .map(name -> {
                    AgentTool tool = tools.get(name);
                    if (tool == null) {
                        throw new ConfigurationException("Unknown tool '" + name + "'. Available: " + tools.keySet());
                    }
                    return tool;
                })
                .toList();
        return new ToolCollection(selected);
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(ToolDefinition::from).toList();
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public Collection<String> names() {
        return tools.keySet();
    }

    /**
     * Checks that the call names a known tool and carries every required
     * argument.
     *
     * @return the problem description, empty when the call is valid
     */
    public Optional<String> validate(ToolCall call) {
        AgentTool tool = tools.get(call.getToolName());
        if (tool == null) {
            return Optional.of(String.format("Unknown tool '%s'. Available tools: %s",
                    call.getToolName(), tools.keySet()));
        }
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();
        List<String> missing = ToolDefinition.from(tool).requiredArguments().stream()
                .filter(name -> args.get(name) == null)
                .toList();
        if (!missing.isEmpty()) {
            return Optional.of(String.format("Tool '%s' is missing required argument(s): %s",
                    call.getToolName(), missing));
        }
        return Optional.empty();
    }

    public ToolResult execute(ToolCall call, ThreadEnvironment environment) {
        Optional<String> problem = validate(call);
        if (problem.isPresent()) {
            log.warn(problem.get());
            return ToolResult.failure(problem.get());
        }

        log.info("Executing tool: [{}] with args: {}", call.getToolName(), call.getArguments());
        try {
            ToolResult result = tools.get(call.getToolName()).execute(call.getArguments(), environment);
            if (result == null) {
                return ToolResult.failure("Tool returned no result");
            }
            log.debug("Tool [{}] returned: {}", call.getToolName(), result);
            return result;
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", call.getToolName(), e);
            return ToolResult.failure("Tool execution failed: " + e.getMessage());
        }
    }

    public int size() {
        return tools.size();
    }
}
