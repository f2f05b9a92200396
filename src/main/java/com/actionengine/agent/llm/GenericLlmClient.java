package com.actionengine.agent.llm;

import com.actionengine.agent.exception.AgentException;
import com.actionengine.agent.exception.ContentPolicyException;
import com.actionengine.agent.exception.ModelUnavailableException;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible chat completions client for Groq, OpenAI and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                              |
 * |--------------------------|-----------------------------------------------------|
 * | 400/403 content policy   | ContentPolicyException (never retried)              |
 * | 400 tool_use_failed      | Recover the calls from failed_generation            |
 * | 401 invalid_api_key      | AgentException (not retried, not a CB failure)      |
 * | 429 rate limit           | ModelUnavailableException (retried)                 |
 * | other 4xx                | AgentException                                      |
 * | 5xx server error         | ModelUnavailableException (retried, CB failure)     |
 * | network error            | ModelUnavailableException (retried, CB failure)     |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    // Groq sometimes emits tool calls as XML instead of JSON, with or without
    // parens around the arguments:
    //   <function=terminal({"script": "ls"})</function>
    //   <function=terminal{"script": "ls"}></function>
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages to {} [model={}, tools={}]",
                messages.size(), providerName, props.getModel(), tools.size());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new ModelUnavailableException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (GroqToolUseFailedException e) {
            return recoverFromGroqToolUseFailure(e.getErrorBody());
        } catch (ResourceAccessException e) {
            throw new ModelUnavailableException(providerName + " unreachable: " + e.getMessage(), e);
        }
    }

    private void handle4xxError(String body, int statusCode) {
        if (isContentPolicyViolation(body)) {
            throw new ContentPolicyException(providerName + " refused the request on content policy grounds");
        }

        if (body.contains("model_decommissioned")) {
            log.error("Model {} is decommissioned by {}; configure another model", props.getModel(), providerName);
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned");
        }

        // Handled by recoverFromGroqToolUseFailure, not counted as a failure
        if (body.contains("tool_use_failed")) {
            throw new GroqToolUseFailedException(body);
        }

        if (statusCode == 401) {
            throw new AgentException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new ModelUnavailableException(providerName + " rate limit exceeded");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private static boolean isContentPolicyViolation(String body) {
        return body.contains("content_policy") || body.contains("content_filter");
    }

    /**
     * Groq's tool_use_failed error carries the broken generation in
     * "failed_generation". Every XML call found there is turned into a
     * regular tool call; anything unparseable yields a response without
     * tool calls, which the retry policy treats as a retryable miss.
     */
    @SuppressWarnings("unchecked")
    private LlmResponse recoverFromGroqToolUseFailure(String errorBody) {
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error = (Map<String, Object>) errorMap.get("error");
            String failedGeneration = error != null ? (String) error.get("failed_generation") : null;

            if (failedGeneration == null || failedGeneration.isBlank()) {
                log.warn("Groq tool_use_failed with no failed_generation, cannot recover");
                return LlmResponse.builder().build();
            }

            List<ToolCall> recovered = new ArrayList<>();
            Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
            while (matcher.find()) {
                Map<String, Object> args = objectMapper.readValue(matcher.group(2), new TypeReference<>() {});
                recovered.add(ToolCall.builder()
                        .id("groq-recovered-" + UUID.randomUUID().toString().substring(0, 8))
                        .toolName(matcher.group(1))
                        .arguments(args)
                        .build());
            }
            log.info("Recovered {} Groq tool call(s) from failed_generation", recovered.size());
            return LlmResponse.builder().toolCalls(recovered).build();

        } catch (JsonProcessingException | ClassCastException e) {
            log.error("Failed to recover from Groq tool_use_failed: {}", e.getMessage());
            return LlmResponse.builder().build();
        }
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        } else if (msg.getRole() == Message.Role.assistant) {
            // An assistant turn that made tool calls must echo them so the
            // provider can correlate the following tool results.
            m.put("content", msg.getContent());
            if (msg.getToolCalls() != null && !msg.getToolCalls().isEmpty()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    tc.getArguments() != null ? tc.getArguments() : Map.of()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }
        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response != null
                ? (List<Map<String, Object>>) response.get("choices") : null;
        if (choices == null || choices.isEmpty()) {
            throw new ModelUnavailableException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        String finishReason = (String) choice.get("finish_reason");
        log.debug("{} finish_reason: {}", providerName, finishReason);

        if ("content_filter".equals(finishReason)) {
            throw new ContentPolicyException(providerName + " filtered the completion on content policy grounds");
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        Object rawCalls = message != null ? message.get("tool_calls") : null;
        if (rawCalls instanceof List<?> calls) {
            for (Object raw : calls) {
                ToolCall parsed = parseToolCall((Map<String, Object>) raw);
                if (parsed != null) {
                    toolCalls.add(parsed);
                }
            }
        }

        return LlmResponse.builder()
                .content(message != null ? (String) message.get("content") : null)
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    /** Null when the arguments are not valid JSON; the call is then dropped */
    @SuppressWarnings("unchecked")
    private ToolCall parseToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        if (function == null) return null;

        Object rawArgs = function.get("arguments");
        Map<String, Object> args;
        try {
            args = rawArgs instanceof String json && !json.isBlank()
                    ? objectMapper.readValue(json, new TypeReference<>() {})
                    : new HashMap<>();
        } catch (JsonProcessingException e) {
            log.warn("Dropping tool call [{}] with malformed arguments: {}", function.get("name"), rawArgs);
            return null;
        }

        String id = (String) raw.get("id");
        return ToolCall.builder()
                .id(id != null && !id.isBlank() ? id : "call_" + UUID.randomUUID().toString().substring(0, 12))
                .toolName((String) function.get("name"))
                .arguments(args)
                .build();
    }

    private static class GroqToolUseFailedException extends RuntimeException {
        private final String errorBody;

        GroqToolUseFailedException(String errorBody) {
            super("Groq tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
