package com.tradingagents.progress.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the one bus engine used by this process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BusEngineFactory {

    private final ObjectMapper objectMapper;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final ObjectProvider<RedisConnectionFactory> connectionFactory;

    @Value("${bus.redis.stream.group:progress-relay}")
    private String streamGroup;

    @Value("${bus.redis.stream.consumer:relay-1}")
    private String streamConsumer;

    @Value("${bus.redis.stream.max-length:10000}")
    private long streamMaxLength;

    @Value("${bus.redis.stream.poll-timeout-ms:1000}")
    private long streamPollTimeoutMs;

    public MessageBusEngine create(BusEngineType type) {
        log.info("Creating message bus engine: {}", type.configName());
        EnvelopeCodec codec = new EnvelopeCodec(objectMapper);
        return switch (type) {
            case MEMORY -> new InMemoryBusEngine();
            case REDIS_PUBSUB -> new RedisPubSubBusEngine(redisTemplate.getObject(),
                    connectionFactory.getObject(), codec);
            case REDIS_STREAM -> new RedisStreamBusEngine(redisTemplate.getObject(),
                    connectionFactory.getObject(), codec, streamGroup, streamConsumer,
                    streamMaxLength, Duration.ofMillis(streamPollTimeoutMs));
        };
    }
}
