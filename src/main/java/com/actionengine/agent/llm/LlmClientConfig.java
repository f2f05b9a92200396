package com.actionengine.agent.llm;

import com.actionengine.agent.resilience.ResilientLlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Builds per-thread model clients. The provider defaults to {@code llm.provider}
 * and can be overridden per thread through its environment config; every
 * client is wrapped in {@link ResilientLlmClient}.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    static final String RESILIENCE_INSTANCE = "llmClient";

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    // Gemini
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url}") private String geminiBaseUrl;
    @Value("${gemini.model}")    private String geminiModel;
    @Value("${gemini.max-tokens}") private int geminiMaxTokens;
    @Value("${gemini.temperature}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Default LLM Provider : {}", provider.toUpperCase());
        log.info("  Model                : {}", providerProps(provider).getModel());
        logKey(provider);
        log.info("================================================================");
    }

    @Bean
    public ModelClientFactory modelClientFactory(
            ObjectMapper objectMapper,
            @Qualifier("llmRestClientBuilder") RestClient.Builder builder,
            RetryRegistry retryRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry) {

        return config -> {
            String selected = config.getLlmProvider() != null && !config.getLlmProvider().isBlank()
                    ? config.getLlmProvider().toLowerCase()
                    : provider.toLowerCase();
            LlmProviderProperties props = providerProps(selected)
                    .withOverrides(config.getLlmModel(), config.getLlmTemperature());
            log.debug("Creating model client [provider={}, model={}]", selected, props.getModel());

            LlmClient raw = new GenericLlmClient(props, objectMapper, selected, builder.clone());
            return new ResilientLlmClient(raw,
                    retryRegistry.retry(RESILIENCE_INSTANCE),
                    circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE));
        };
    }

    // ─── Props builders ───────────────────────────────────────────────────────

    private LlmProviderProperties providerProps(String name) {
        LlmProviderProperties p = new LlmProviderProperties();
        switch (name.toLowerCase()) {
            case "openai" -> {
                p.setApiKey(openAiKey); p.setBaseUrl(openAiBaseUrl); p.setModel(openAiModel);
                p.setMaxTokens(openAiMaxTokens); p.setTemperature(openAiTemp);
            }
            case "gemini" -> {
                p.setApiKey(geminiKey); p.setBaseUrl(geminiBaseUrl); p.setModel(geminiModel);
                p.setMaxTokens(geminiMaxTokens); p.setTemperature(geminiTemp);
            }
            default -> {
                p.setApiKey(groqKey); p.setBaseUrl(groqBaseUrl); p.setModel(groqModel);
                p.setMaxTokens(groqMaxTokens); p.setTemperature(groqTemp);
            }
        }
        return p;
    }

    private void logKey(String name) {
        String key = providerProps(name).getApiKey();
        String envVar = name.toUpperCase() + "_API_KEY";
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name.toUpperCase(), envVar);
        } else {
            log.info("  Key                  : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
