package com.actionengine.agent.environment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-thread environment settings supplied with a task. Null model settings
 * fall back to the application-wide provider configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentConfig {

    // LLM settings
    private String llmProvider;
    private String llmModel;
    private Double llmTemperature;

    // Browser settings
    @Builder.Default
    private boolean useBrowser = true;
    @Builder.Default
    private boolean headless = true;
    @Builder.Default
    private boolean keepBrowserOpen = true;
    @Builder.Default
    private int windowWidth = 1280;
    @Builder.Default
    private int windowHeight = 720;

    // Terminal settings
    @Builder.Default
    private boolean useTerminal = true;

    public static EnvironmentConfig defaults() {
        return EnvironmentConfig.builder().build();
    }
}
