package com.actionengine.agent.model;

import com.actionengine.agent.environment.EnvironmentConfig;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
public class TaskRequest {

    @NotBlank(message = "task must not be blank")
    private String task;

    /**
     * Optional: if provided, the task runs on this thread and reuses its warm
     * environment. If null, a new thread is created.
     */
    private String threadId;

    /** Optional per-thread environment overrides (model, browser window, ...) */
    private EnvironmentConfig config;

    /** Free-form caller metadata copied into every checkpoint of the run */
    private Map<String, Object> metadata;
}
