package com.tradingagents.progress.bus;

import com.tradingagents.progress.message.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local engine. Callbacks run on the publishing thread, in subscription order.
 */
@Slf4j
public class InMemoryBusEngine implements MessageBusEngine {

    private final Object lock = new Object();

    // topic filter -> callbacks
    private final Map<String, List<EnvelopeCallback>> subscriptions = new LinkedHashMap<>();

    private volatile boolean connected;

    @Override
    public boolean connect() {
        if (!connected) {
            connected = true;
            log.info("In-memory message bus connected");
        }
        return true;
    }

    @Override
    public void disconnect() {
        if (connected) {
            connected = false;
            log.info("In-memory message bus disconnected");
        }
    }

    @Override
    public boolean publish(String topic, Envelope envelope) {
        if (!connected) {
            log.warn("Publish on disconnected in-memory bus dropped: topic={}", topic);
            return false;
        }

        // Snapshot so callbacks may subscribe or publish without deadlocking
        List<EnvelopeCallback> targets = new ArrayList<>();
        synchronized (lock) {
            subscriptions.forEach((filter, callbacks) -> {
                if (TopicMatcher.matches(filter, topic)) {
                    targets.addAll(callbacks);
                }
            });
        }

        for (EnvelopeCallback callback : targets) {
            try {
                callback.onMessage(topic, envelope);
            } catch (Exception e) {
                log.error("Subscriber failed: topic={}", topic, e);
            }
        }
        log.debug("Published: topic={}, subscribers={}", topic, targets.size());
        return true;
    }

    @Override
    public boolean subscribe(String topicFilter, EnvelopeCallback callback) {
        synchronized (lock) {
            subscriptions.computeIfAbsent(topicFilter, f -> new ArrayList<>()).add(callback);
        }
        log.debug("Subscribed: filter={}", topicFilter);
        return true;
    }

    @Override
    public boolean unsubscribe(String topicFilter) {
        List<EnvelopeCallback> removed;
        synchronized (lock) {
            removed = subscriptions.remove(topicFilter);
        }
        return removed != null;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public BusEngineType type() {
        return BusEngineType.MEMORY;
    }

    int subscriptionCount() {
        synchronized (lock) {
            return subscriptions.values().stream().mapToInt(List::size).sum();
        }
    }
}
