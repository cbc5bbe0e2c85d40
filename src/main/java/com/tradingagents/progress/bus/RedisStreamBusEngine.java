package com.tradingagents.progress.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.stream.StreamMessageListenerContainer;
import org.springframework.data.redis.stream.StreamMessageListenerContainer.StreamMessageListenerContainerOptions;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * At-least-once engine on Redis Streams.
 * <p>
 * Every message kind has its own stream ({@code bus:stream:task/progress}, ...) holding
 * the topic and the encoded envelope. This process reads all streams through its consumer
 * group and acknowledges an entry only after every matching callback returned normally,
 * so failed or unprocessed entries stay pending and are replayed on the next connect.
 * Callbacks must therefore tolerate duplicates.
 */
@Slf4j
public class RedisStreamBusEngine implements MessageBusEngine {

    static final String STREAM_PREFIX = "bus:stream:";
    static final String FIELD_TOPIC = "topic";
    static final String FIELD_ENVELOPE = "envelope";

    private static final int REPLAY_BATCH = 100;

    private final StringRedisTemplate redisTemplate;
    private final RedisConnectionFactory connectionFactory;
    private final EnvelopeCodec codec;
    private final String group;
    private final String consumerName;
    private final long maxLength;
    private final Duration pollTimeout;

    // topic filter -> callbacks
    private final Map<String, List<EnvelopeCallback>> subscriptions = new ConcurrentHashMap<>();

    private StreamMessageListenerContainer<String, MapRecord<String, String, String>> container;
    private volatile boolean connected;

    public RedisStreamBusEngine(StringRedisTemplate redisTemplate, RedisConnectionFactory connectionFactory,
                                EnvelopeCodec codec, String group, String consumerName,
                                long maxLength, Duration pollTimeout) {
        this.redisTemplate = redisTemplate;
        this.connectionFactory = connectionFactory;
        this.codec = codec;
        this.group = group;
        this.consumerName = consumerName;
        this.maxLength = maxLength;
        this.pollTimeout = pollTimeout;
    }

    static String streamKey(MessageKind kind) {
        return STREAM_PREFIX + kind.topicBase();
    }

    static String streamKeyForTopic(String topic) {
        return STREAM_PREFIX + TopicMatcher.baseOf(topic);
    }

    @Override
    public synchronized boolean connect() {
        if (connected) {
            return true;
        }
        try {
            redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            for (MessageKind kind : MessageKind.values()) {
                ensureGroup(streamKey(kind));
            }
            int replayed = replayPending();

            container = createContainer();
            Consumer consumer = Consumer.from(group, consumerName);
            for (MessageKind kind : MessageKind.values()) {
                container.receive(consumer, StreamOffset.create(streamKey(kind), ReadOffset.lastConsumed()),
                        record -> handleRecord(record.getStream(), record.getId(), record.getValue()));
            }
            container.start();

            connected = true;
            log.info("Redis stream bus connected: group={}, consumer={}, replayed={}",
                    group, consumerName, replayed);
            return true;
        } catch (Exception e) {
            log.warn("Redis stream connect failed: {}", e.getMessage());
            stopContainer();
            return false;
        }
    }

    @Override
    public synchronized void disconnect() {
        if (!connected && container == null) {
            return;
        }
        stopContainer();
        connected = false;
        log.info("Redis stream bus disconnected");
    }

    @Override
    public boolean publish(String topic, Envelope envelope) {
        if (!connected) {
            log.warn("Publish on disconnected Redis stream bus dropped: topic={}", topic);
            return false;
        }
        String key = streamKeyForTopic(topic);
        try {
            MapRecord<String, String, String> record = StreamRecords
                    .string(Map.of(FIELD_TOPIC, topic, FIELD_ENVELOPE, codec.encode(envelope)))
                    .withStreamKey(key);
            RecordId id = redisTemplate.opsForStream().add(record);
            redisTemplate.opsForStream().trim(key, maxLength, true);
            log.debug("Appended: stream={}, id={}", key, id);
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to encode envelope: topic={}", topic, e);
            return false;
        } catch (Exception e) {
            log.warn("Redis stream append failed: topic={}, error={}", topic, e.getMessage());
            connected = false;
            return false;
        }
    }

    @Override
    public boolean subscribe(String topicFilter, EnvelopeCallback callback) {
        subscriptions.computeIfAbsent(topicFilter, f -> new CopyOnWriteArrayList<>()).add(callback);
        log.debug("Subscribed: filter={}", topicFilter);
        return true;
    }

    @Override
    public boolean unsubscribe(String topicFilter) {
        return subscriptions.remove(topicFilter) != null;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public BusEngineType type() {
        return BusEngineType.REDIS_STREAM;
    }

    protected StreamMessageListenerContainer<String, MapRecord<String, String, String>> createContainer() {
        StreamMessageListenerContainerOptions<String, MapRecord<String, String, String>> options =
                StreamMessageListenerContainerOptions.builder()
                        .pollTimeout(pollTimeout)
                        .errorHandler(t -> log.warn("Stream poll failed: {}", t.getMessage()))
                        .build();
        return StreamMessageListenerContainer.create(connectionFactory, options);
    }

    /**
     * Deliver one stream entry to the matching callbacks.
     *
     * @return true if the entry was acknowledged
     */
    boolean handleRecord(String streamKey, RecordId recordId, Map<?, ?> fields) {
        Object topic = fields.get(FIELD_TOPIC);
        Object body = fields.get(FIELD_ENVELOPE);
        if (topic == null || body == null) {
            log.warn("Acknowledging malformed stream entry: stream={}, id={}", streamKey, recordId);
            acknowledge(streamKey, recordId);
            return true;
        }

        Envelope envelope;
        try {
            envelope = codec.decode(body.toString());
        } catch (JsonProcessingException e) {
            // Redelivery cannot fix a broken body
            log.warn("Acknowledging undecodable stream entry: stream={}, id={}, error={}",
                    streamKey, recordId, e.getOriginalMessage());
            acknowledge(streamKey, recordId);
            return true;
        }

        boolean delivered = true;
        for (Map.Entry<String, List<EnvelopeCallback>> entry : subscriptions.entrySet()) {
            if (!TopicMatcher.matches(entry.getKey(), topic.toString())) {
                continue;
            }
            for (EnvelopeCallback callback : entry.getValue()) {
                try {
                    callback.onMessage(topic.toString(), envelope);
                } catch (Exception e) {
                    log.error("Subscriber failed, entry left pending: stream={}, id={}", streamKey, recordId, e);
                    delivered = false;
                }
            }
        }

        if (delivered) {
            acknowledge(streamKey, recordId);
        }
        return delivered;
    }

    // Page through this consumer's pending entries, oldest first
    private int replayPending() {
        int replayed = 0;
        Consumer consumer = Consumer.from(group, consumerName);
        for (MessageKind kind : MessageKind.values()) {
            String key = streamKey(kind);
            String offset = "0";
            while (true) {
                List<MapRecord<String, Object, Object>> pending = redisTemplate.<Object, Object>opsForStream()
                        .read(consumer, StreamReadOptions.empty().count(REPLAY_BATCH),
                                StreamOffset.create(key, ReadOffset.from(offset)));
                if (pending == null || pending.isEmpty()) {
                    break;
                }
                for (MapRecord<String, Object, Object> record : pending) {
                    handleRecord(key, record.getId(), record.getValue());
                    replayed++;
                }
                String last = pending.get(pending.size() - 1).getId().getValue();
                if (last.equals(offset)) {
                    break;
                }
                offset = last;
            }
        }
        return replayed;
    }

    private void ensureGroup(String key) {
        try {
            redisTemplate.execute((RedisCallback<String>) connection -> connection.streamCommands()
                    .xGroupCreate(key.getBytes(StandardCharsets.UTF_8), group, ReadOffset.from("0"), true));
            log.info("Consumer group created: stream={}, group={}", key, group);
        } catch (Exception e) {
            if (!isBusyGroup(e)) {
                throw e;
            }
            log.debug("Consumer group already present: stream={}, group={}", key, group);
        }
    }

    private static boolean isBusyGroup(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("BUSYGROUP")) {
                return true;
            }
        }
        return false;
    }

    private void acknowledge(String streamKey, RecordId recordId) {
        try {
            redisTemplate.opsForStream().acknowledge(streamKey, group, recordId);
        } catch (Exception e) {
            log.warn("Stream ack failed: stream={}, id={}, error={}", streamKey, recordId, e.getMessage());
        }
    }

    private void stopContainer() {
        if (container != null) {
            try {
                container.stop();
            } catch (Exception e) {
                log.warn("Stream listener stop failed: {}", e.getMessage());
            }
            container = null;
        }
    }
}
