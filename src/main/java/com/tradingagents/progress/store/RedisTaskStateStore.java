package com.tradingagents.progress.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.progress.dto.TaskState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Task states as JSON strings under {@code progress:task:{analysisId}}, refreshed TTL on each save.
 */
@Slf4j
public class RedisTaskStateStore implements TaskStateStore {

    static final String KEY_PREFIX = "progress:task:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisTaskStateStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public void save(TaskState state) {
        try {
            String json = objectMapper.writeValueAsString(state);
            redisTemplate.opsForValue().set(buildKey(state.getAnalysisId()), json, ttl);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize task state: analysis={}", state.getAnalysisId(), e);
        } catch (Exception e) {
            log.warn("Failed to save task state to Redis: analysis={}, error={}",
                    state.getAnalysisId(), e.getMessage());
        }
    }

    @Override
    public Optional<TaskState> load(String analysisId) {
        try {
            String json = redisTemplate.opsForValue().get(buildKey(analysisId));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, TaskState.class));
        } catch (JsonProcessingException e) {
            log.warn("Corrupt task state in Redis: analysis={}, error={}", analysisId, e.getOriginalMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Failed to load task state from Redis: analysis={}, error={}", analysisId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String analysisId) {
        try {
            redisTemplate.delete(buildKey(analysisId));
        } catch (Exception e) {
            log.warn("Failed to delete task state from Redis: analysis={}, error={}", analysisId, e.getMessage());
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    private String buildKey(String analysisId) {
        return KEY_PREFIX + analysisId;
    }
}
