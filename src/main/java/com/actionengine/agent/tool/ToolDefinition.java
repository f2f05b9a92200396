package com.actionengine.agent.tool;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model.
 * Decouples the wire format from the AgentTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /** Names listed under the schema's "required" key */
    @SuppressWarnings("unchecked")
    public List<String> requiredArguments() {
        if (inputSchema == null) return List.of();
        Object required = inputSchema.get("required");
        return required instanceof List<?> list ? (List<String>) list : List.of();
    }

    /**
     * OpenAI-compatible function format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
