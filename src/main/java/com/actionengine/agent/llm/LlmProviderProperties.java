package com.actionengine.agent.llm;

import lombok.Data;

/**
 * Holds config for a single LLM provider.
 * Populated from application.yml for openai / groq / gemini.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;

    /** Copy with the thread's model and temperature applied where given */
    public LlmProviderProperties withOverrides(String modelOverride, Double temperatureOverride) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(apiKey);
        p.setBaseUrl(baseUrl);
        p.setMaxTokens(maxTokens);
        p.setModel(modelOverride != null && !modelOverride.isBlank() ? modelOverride : model);
        p.setTemperature(temperatureOverride != null ? temperatureOverride : temperature);
        return p;
    }
}
