package com.actionengine.agent.resilience;

import com.actionengine.agent.exception.ModelUnavailableException;
import com.actionengine.agent.llm.LlmClient;
import com.actionengine.agent.model.LlmResponse;
import com.actionengine.agent.model.Message;
import com.actionengine.agent.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decorator that adds retry and circuit breaking around a provider client.
 *
 * Model clients are built per thread, so the decoration is programmatic:
 * the {@code llmClient} instances come from the resilience4j registries and
 * are shared by every thread, which keeps one circuit per provider pool.
 *
 * Retry config (application.yml):
 * - 3 attempts, exponential backoff from 2s
 * - retries ModelUnavailableException only; content policy errors are ignored
 *
 * Circuit breaker config:
 * - opens after a 50% failure rate over a window of 10 calls
 * - waits 30s before letting probe calls through
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientLlmClient(LlmClient delegate, Retry retry, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Supplier<LlmResponse> call = () -> delegate.chat(messages, tools);
        Supplier<LlmResponse> decorated =
                Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, call));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.error("LLM circuit breaker is OPEN, rejecting call: {}", e.getMessage());
            throw new ModelUnavailableException("Model circuit breaker is open", e);
        }
    }
}
