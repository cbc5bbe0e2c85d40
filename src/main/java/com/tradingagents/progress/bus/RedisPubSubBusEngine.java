package com.tradingagents.progress.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.Topics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

/**
 * Best-effort engine on Redis pub/sub.
 * <p>
 * Subscriptions are remembered across disconnects and re-registered on {@link #connect()}.
 * Messages published while this process is not listening are lost.
 */
@Slf4j
public class RedisPubSubBusEngine implements MessageBusEngine {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final EnvelopeCodec codec;

    // topic filter -> callbacks
    private final Map<String, List<EnvelopeCallback>> subscriptions = new ConcurrentHashMap<>();

    // topic filter -> listener registered with the container
    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();

    private volatile boolean connected;
    private boolean containerInitialized;

    public RedisPubSubBusEngine(StringRedisTemplate redisTemplate, RedisConnectionFactory connectionFactory,
                                EnvelopeCodec codec) {
        this(redisTemplate, newListenerContainer(connectionFactory), codec);
    }

    RedisPubSubBusEngine(StringRedisTemplate redisTemplate, RedisMessageListenerContainer listenerContainer,
                         EnvelopeCodec codec) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.codec = codec;
    }

    private static RedisMessageListenerContainer newListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        // One dispatch thread keeps messages of a topic in publish order
        container.setTaskExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "bus-pubsub-dispatch");
            thread.setDaemon(true);
            return thread;
        }));
        return container;
    }

    @Override
    public synchronized boolean connect() {
        if (connected) {
            return true;
        }
        try {
            redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);

            if (!containerInitialized) {
                listenerContainer.afterPropertiesSet();
                containerInitialized = true;
            }
            listeners.forEach((filter, listener) -> listenerContainer.addMessageListener(listener, topicOf(filter)));
            listenerContainer.start();

            connected = true;
            log.info("Redis pub/sub bus connected: subscriptions={}", listeners.size());
            return true;
        } catch (Exception e) {
            log.warn("Redis pub/sub connect failed: {}", e.getMessage());
            connected = false;
            return false;
        }
    }

    @Override
    public synchronized void disconnect() {
        if (!connected && !listenerContainer.isRunning()) {
            return;
        }
        try {
            listeners.values().forEach(listenerContainer::removeMessageListener);
            listenerContainer.stop();
        } catch (Exception e) {
            log.warn("Redis pub/sub disconnect failed: {}", e.getMessage());
        } finally {
            connected = false;
        }
        log.info("Redis pub/sub bus disconnected");
    }

    @Override
    public boolean publish(String topic, Envelope envelope) {
        if (!connected) {
            log.warn("Publish on disconnected Redis pub/sub bus dropped: topic={}", topic);
            return false;
        }
        try {
            redisTemplate.convertAndSend(topic, codec.encode(envelope));
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to encode envelope: topic={}", topic, e);
            return false;
        } catch (Exception e) {
            log.warn("Redis publish failed: topic={}, error={}", topic, e.getMessage());
            connected = false;
            return false;
        }
    }

    @Override
    public boolean subscribe(String topicFilter, EnvelopeCallback callback) {
        try {
            subscriptions.computeIfAbsent(topicFilter, f -> new CopyOnWriteArrayList<>()).add(callback);
            listeners.computeIfAbsent(topicFilter, filter -> {
                MessageListener listener = (message, pattern) -> dispatch(filter,
                        new String(message.getChannel(), StandardCharsets.UTF_8),
                        new String(message.getBody(), StandardCharsets.UTF_8));
                if (connected) {
                    listenerContainer.addMessageListener(listener, topicOf(filter));
                }
                return listener;
            });
            log.debug("Subscribed: filter={}", topicFilter);
            return true;
        } catch (Exception e) {
            log.warn("Redis subscribe failed: filter={}, error={}", topicFilter, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean unsubscribe(String topicFilter) {
        List<EnvelopeCallback> removed = subscriptions.remove(topicFilter);
        MessageListener listener = listeners.remove(topicFilter);
        if (listener != null && connected) {
            try {
                listenerContainer.removeMessageListener(listener);
            } catch (Exception e) {
                log.warn("Redis unsubscribe failed: filter={}, error={}", topicFilter, e.getMessage());
                return false;
            }
        }
        return removed != null;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public BusEngineType type() {
        return BusEngineType.REDIS_PUBSUB;
    }

    void dispatch(String topicFilter, String channel, String body) {
        if (!TopicMatcher.matches(topicFilter, channel)) {
            return;
        }
        List<EnvelopeCallback> callbacks = subscriptions.get(topicFilter);
        if (callbacks == null || callbacks.isEmpty()) {
            return;
        }

        Envelope envelope;
        try {
            envelope = codec.decode(body);
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable message: channel={}, error={}", channel, e.getOriginalMessage());
            return;
        }

        for (EnvelopeCallback callback : callbacks) {
            try {
                callback.onMessage(channel, envelope);
            } catch (Exception e) {
                log.error("Subscriber failed: channel={}", channel, e);
            }
        }
    }

    private static Topic topicOf(String topicFilter) {
        return Topics.isWildcard(topicFilter)
                ? new PatternTopic(TopicMatcher.toRedisPattern(topicFilter))
                : new ChannelTopic(topicFilter);
    }
}
