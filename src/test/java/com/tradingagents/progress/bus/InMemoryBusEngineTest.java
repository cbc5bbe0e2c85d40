package com.tradingagents.progress.bus;

import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBusEngineTest {

    private InMemoryBusEngine engine;

    @BeforeEach
    void setUp() {
        engine = new InMemoryBusEngine();
        engine.connect();
    }

    private static Envelope envelope(String analysisId) {
        return new Envelope(MessageKind.TASK_STATUS, 1.0, Map.of(
                "analysis_id", analysisId, "status", "running", "message", "", "timestamp", 1.0));
    }

    @Test
    @DisplayName("같은 토픽의 모든 구독자가 메시지를 받아야 함")
    void everySubscriberReceives() {
        // Given
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        engine.subscribe("task/status/a1", (topic, env) -> first.add(env.analysisId()));
        engine.subscribe("task/status/*", (topic, env) -> second.add(topic));

        // When
        boolean published = engine.publish("task/status/a1", envelope("a1"));

        // Then
        assertTrue(published);
        assertEquals(List.of("a1"), first);
        assertEquals(List.of("task/status/a1"), second);
    }

    @Test
    @DisplayName("다른 작업의 메시지는 전달되지 않아야 함")
    void otherJobsAreNotDelivered() {
        List<Envelope> received = new ArrayList<>();
        engine.subscribe("task/status/a1", (topic, env) -> received.add(env));

        engine.publish("task/status/a2", envelope("a2"));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("구독자 예외가 다른 구독자 전달을 막지 않아야 함")
    void failingSubscriberIsIsolated() {
        // Given
        List<Envelope> received = new ArrayList<>();
        engine.subscribe("task/status/a1", (topic, env) -> {
            throw new IllegalStateException("boom");
        });
        engine.subscribe("task/status/a1", (topic, env) -> received.add(env));

        // When
        boolean published = engine.publish("task/status/a1", envelope("a1"));

        // Then
        assertTrue(published);
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("연결이 끊긴 상태에서는 publish 가 false 를 반환해야 함")
    void publishWhileDisconnected() {
        List<Envelope> received = new ArrayList<>();
        engine.subscribe("task/status/a1", (topic, env) -> received.add(env));
        engine.disconnect();

        assertFalse(engine.publish("task/status/a1", envelope("a1")));
        assertFalse(engine.isConnected());
        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("unsubscribe 후에는 전달되지 않아야 함")
    void unsubscribeStopsDelivery() {
        List<Envelope> received = new ArrayList<>();
        engine.subscribe("task/status/a1", (topic, env) -> received.add(env));

        assertTrue(engine.unsubscribe("task/status/a1"));
        assertFalse(engine.unsubscribe("task/status/a1"));
        engine.publish("task/status/a1", envelope("a1"));

        assertTrue(received.isEmpty());
        assertEquals(0, engine.subscriptionCount());
    }
}
