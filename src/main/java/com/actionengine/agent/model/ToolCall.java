package com.actionengine.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A tool invocation requested by the model. Pure data: the id is the key used
 * to match resume decisions against the pending approval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** ID assigned by the model provider, or generated when the provider omits it */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;

    public String stringArgument(String key) {
        if (arguments == null) return null;
        Object value = arguments.get(key);
        return value != null ? value.toString() : null;
    }
}
