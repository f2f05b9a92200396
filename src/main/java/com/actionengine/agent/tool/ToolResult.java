package com.actionengine.agent.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observation produced by a tool. Exactly one of {@code output} or
 * {@code error} is normally set; {@code system} carries a machine-readable
 * note (for example the terminate status) that is not shown to the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    private String output;
    private String error;
    private String system;

    public static ToolResult success(String output) {
        return ToolResult.builder().output(output).build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder().error(error).build();
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Text fed back to the model as the tool message content */
    public String observation() {
        return error != null ? "ERROR: " + error : (output != null ? output : "");
    }
}
