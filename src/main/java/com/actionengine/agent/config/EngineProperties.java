package com.actionengine.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Workflow engine settings, bound from application.yml under "engine".
 */
@Component
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    /** Node executions allowed per run before it is ended with an error */
    private int maxSteps = 100;

    /** Node that receives failed runs; blank means a failure terminates the run */
    private String errorNode = "";

    /** Conversation messages kept in model prompts after pruning */
    private int messageWindow = 15;

    private ToolCallRetry toolCallRetry = new ToolCallRetry();
    private Approval approval = new Approval();
    private Checkpoint checkpoint = new Checkpoint();
    private Environment environment = new Environment();

    @Data
    public static class ToolCallRetry {
        private int maxAttempts = 3;
    }

    @Data
    public static class Approval {
        private List<String> requiredTools = new ArrayList<>(List.of("terminal"));
    }

    @Data
    public static class Checkpoint {
        /** redis or memory */
        private String store = "redis";
        private int ttlMinutes = 1440;
    }

    @Data
    public static class Environment {
        private int idleTtlMinutes = 30;
        private long evictionIntervalMs = 60000;
    }
}
