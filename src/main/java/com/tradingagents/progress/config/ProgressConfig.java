package com.tradingagents.progress.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.progress.bus.BusEngineFactory;
import com.tradingagents.progress.bus.BusEngineType;
import com.tradingagents.progress.bus.MessageBusEngine;
import com.tradingagents.progress.service.EqualWeightingPolicy;
import com.tradingagents.progress.service.PhaseWeightingPolicy;
import com.tradingagents.progress.service.ProgressWeightingPolicy;
import com.tradingagents.progress.store.FileTaskStateStore;
import com.tradingagents.progress.store.InMemoryTaskStateStore;
import com.tradingagents.progress.store.RedisTaskStateStore;
import com.tradingagents.progress.store.TaskStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Backends picked once at startup from configuration.
 */
@Slf4j
@Configuration
public class ProgressConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MessageBusEngine messageBusEngine(BusEngineFactory factory,
                                             @Value("${bus.engine:memory}") String engine) {
        return factory.create(BusEngineType.fromConfig(engine));
    }

    @Bean
    public TaskStateStore taskStateStore(@Value("${progress.store.type:memory}") String type,
                                         @Value("${progress.store.file-path:./progress-state}") String filePath,
                                         @Value("${progress.store.redis-ttl-hours:72}") long ttlHours,
                                         ObjectMapper objectMapper,
                                         ObjectProvider<StringRedisTemplate> redisTemplate) {
        TaskStateStore store = switch (type.toLowerCase()) {
            case "memory" -> new InMemoryTaskStateStore();
            case "file" -> new FileTaskStateStore(objectMapper, Path.of(filePath));
            case "redis" -> new RedisTaskStateStore(redisTemplate.getObject(), objectMapper,
                    Duration.ofHours(ttlHours));
            default -> throw new IllegalArgumentException("Unsupported task state store: " + type);
        };
        log.info("Task state store: {}", store.name());
        return store;
    }

    @Bean
    public ProgressWeightingPolicy progressWeightingPolicy(
            @Value("${progress.weighting.type:equal}") String type,
            @Value("${progress.weighting.phase-weights:}") String phaseWeights) {
        ProgressWeightingPolicy policy = switch (type.toLowerCase()) {
            case "equal" -> new EqualWeightingPolicy();
            case "phase" -> PhaseWeightingPolicy.fromConfig(phaseWeights);
            default -> throw new IllegalArgumentException("Unsupported progress weighting: " + type);
        };
        log.info("Progress weighting: {}", policy.name());
        return policy;
    }
}
