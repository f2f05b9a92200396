package com.actionengine.agent.checkpoint;

import com.actionengine.agent.config.EngineProperties;
import com.actionengine.agent.environment.EnvironmentManager;
import com.actionengine.agent.exception.AgentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed checkpoint store.
 *
 * - Key pattern: agent:thread:{threadId}:checkpoint
 * - One JSON document per thread, overwritten on every step
 * - TTL reset on every write, so abandoned threads expire on their own
 *
 * Unknown JSON properties are ignored and missing ones take their defaults,
 * so checkpoints written by older versions still load.
 */
@Component
@ConditionalOnProperty(name = "engine.checkpoint.store", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisCheckpointStore extends AbstractCheckpointStore {

    private static final String KEY_PREFIX = "agent:thread:";
    private static final String KEY_SUFFIX = ":checkpoint";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisCheckpointStore(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper,
                                EngineProperties engineProperties,
                                EnvironmentManager environmentManager) {
        super(environmentManager);
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.ttl = Duration.ofMinutes(engineProperties.getCheckpoint().getTtlMinutes());
    }

    @Override
    protected Optional<Checkpoint> read(String threadId) {
        String json = redisTemplate.opsForValue().get(buildKey(threadId));
        if (json == null) {
            log.debug("No checkpoint found for thread: {}", threadId);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Checkpoint.class));
        } catch (JsonProcessingException e) {
            throw new AgentException("Corrupt checkpoint for thread " + threadId, e);
        }
    }

    @Override
    protected void write(String threadId, Checkpoint checkpoint) {
        try {
            String json = objectMapper.writeValueAsString(checkpoint);
            redisTemplate.opsForValue().set(buildKey(threadId), json, ttl);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to serialize checkpoint for thread " + threadId, e);
        }
    }

    @Override
    protected void remove(String threadId) {
        redisTemplate.delete(buildKey(threadId));
    }

    static String buildKey(String threadId) {
        return KEY_PREFIX + threadId + KEY_SUFFIX;
    }
}
