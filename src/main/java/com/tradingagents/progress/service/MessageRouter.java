package com.tradingagents.progress.service;

import com.tradingagents.progress.bus.BusEngineType;
import com.tradingagents.progress.bus.MessageBusEngine;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.Topics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed layer over the bus engine. Outbound envelopes are built and validated here;
 * inbound envelopes reach a handler only if their type is the kind it subscribed for.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageRouter {

    private final MessageBusEngine engine;
    private final Clock clock;

    // topic filter -> routes; one engine subscription per filter
    private final Map<String, List<Subscription>> routes = new HashMap<>();

    public record Subscription(MessageKind kind, String topicFilter, Consumer<Envelope> handler) {
    }

    @PostConstruct
    public void initialize() {
        if (engine.connect()) {
            log.info("Message router ready: engine={}", engine.type().configName());
        } else {
            log.warn("Message bus not reachable at startup: engine={}. Progress publishing degrades to logged failures",
                    engine.type().configName());
        }
    }

    @PreDestroy
    public void shutdown() {
        engine.disconnect();
    }

    /**
     * Build an envelope for {@code kind} and publish it on the topic of {@code payload.analysis_id}.
     *
     * @return false if the transport did not take the message
     * @throws com.tradingagents.progress.message.SchemaViolationException if the payload is malformed
     */
    public boolean publish(MessageKind kind, Map<String, Object> payload) {
        Envelope envelope = Envelope.build(kind, payload, clock);
        String topic = Topics.topicFor(kind, envelope.analysisId());
        boolean published = engine.publish(topic, envelope);
        log.debug("Publish {}: topic={}", published ? "ok" : "failed", topic);
        return published;
    }

    /**
     * Route envelopes of {@code kind} to {@code handler}.
     *
     * @param topicFilter a job topic, a wildcard filter, or null for every job
     */
    public Optional<Subscription> subscribe(MessageKind kind, Consumer<Envelope> handler, String topicFilter) {
        String filter = topicFilter != null ? topicFilter : Topics.wildcardFor(kind);
        Subscription subscription = new Subscription(kind, filter, handler);

        synchronized (routes) {
            List<Subscription> existing = routes.get(filter);
            if (existing != null) {
                existing.add(subscription);
                return Optional.of(subscription);
            }
            List<Subscription> created = new CopyOnWriteArrayList<>();
            created.add(subscription);
            if (!engine.subscribe(filter, (topic, envelope) -> dispatch(filter, topic, envelope))) {
                log.warn("Subscription rejected by bus: kind={}, filter={}", kind.wireName(), filter);
                return Optional.empty();
            }
            routes.put(filter, created);
        }
        return Optional.of(subscription);
    }

    public boolean unsubscribe(Subscription subscription) {
        synchronized (routes) {
            List<Subscription> list = routes.get(subscription.topicFilter());
            if (list == null || !list.remove(subscription)) {
                return false;
            }
            if (list.isEmpty()) {
                routes.remove(subscription.topicFilter());
                engine.unsubscribe(subscription.topicFilter());
            }
            return true;
        }
    }

    /** Drop every route under the filter */
    public boolean unsubscribe(String topicFilter) {
        synchronized (routes) {
            if (routes.remove(topicFilter) == null) {
                return false;
            }
            return engine.unsubscribe(topicFilter);
        }
    }

    public boolean isConnected() {
        return engine.isConnected();
    }

    public boolean reconnect() {
        return engine.connect();
    }

    public BusEngineType engineType() {
        return engine.type();
    }

    public int routeCount() {
        synchronized (routes) {
            return routes.values().stream().mapToInt(List::size).sum();
        }
    }

    private void dispatch(String filter, String topic, Envelope envelope) {
        List<Subscription> targets;
        synchronized (routes) {
            targets = routes.get(filter);
        }
        if (targets == null) {
            return;
        }
        for (Subscription subscription : targets) {
            if (envelope.type() != subscription.kind()) {
                log.warn("Dropping {} envelope on topic {}: route expects {}",
                        envelope.type().wireName(), topic, subscription.kind().wireName());
                continue;
            }
            subscription.handler().accept(envelope);
        }
    }
}
