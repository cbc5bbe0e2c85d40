package com.tradingagents.progress.service;

import com.tradingagents.progress.TestClock;
import com.tradingagents.progress.bus.EnvelopeCallback;
import com.tradingagents.progress.bus.InMemoryBusEngine;
import com.tradingagents.progress.bus.MessageBusEngine;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.SchemaViolationException;
import com.tradingagents.progress.message.Topics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MessageRouterTest {

    private TestClock clock;
    private InMemoryBusEngine engine;
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        engine = new InMemoryBusEngine();
        router = new MessageRouter(engine, clock);
        router.initialize();
    }

    private static Map<String, Object> startPayload(String analysisId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("analysis_id", analysisId);
        payload.put("module_name", "market_analyst");
        payload.put("event", "start");
        return payload;
    }

    @Test
    @DisplayName("publish 는 타임스탬프가 찍힌 envelope 을 작업 토픽으로 전달해야 함")
    void publishRoutesToJobTopic() {
        // Given
        List<Envelope> received = new ArrayList<>();
        router.subscribe(MessageKind.MODULE_START, received::add, Topics.topicFor(MessageKind.MODULE_START, "a1"));

        // When
        boolean published = router.publish(MessageKind.MODULE_START, startPayload("a1"));
        router.publish(MessageKind.MODULE_START, startPayload("a2"));

        // Then
        assertTrue(published);
        assertEquals(1, received.size());
        assertEquals(clock.millis() / 1000.0, received.get(0).timestamp(), 0.0001);
        assertEquals("market_analyst", received.get(0).stringField("module_name"));
    }

    @Test
    @DisplayName("필터 없이 구독하면 모든 작업의 메시지를 받아야 함")
    void nullFilterSubscribesToEveryJob() {
        List<String> ids = new ArrayList<>();
        Optional<MessageRouter.Subscription> subscription =
                router.subscribe(MessageKind.MODULE_START, env -> ids.add(env.analysisId()), null);

        router.publish(MessageKind.MODULE_START, startPayload("a1"));
        router.publish(MessageKind.MODULE_START, startPayload("a2"));

        assertTrue(subscription.isPresent());
        assertEquals("module/start/*", subscription.get().topicFilter());
        assertEquals(List.of("a1", "a2"), ids);
    }

    @Test
    @DisplayName("스키마 위반은 전송 전에 예외로 드러나야 함")
    void schemaViolationNeverReachesTransport() {
        // Given
        MessageBusEngine mockEngine = mock(MessageBusEngine.class);
        MessageRouter strict = new MessageRouter(mockEngine, clock);
        Map<String, Object> payload = startPayload("a1");
        payload.remove("module_name");

        // When / Then
        assertThrows(SchemaViolationException.class, () -> strict.publish(MessageKind.MODULE_START, payload));
        verify(mockEngine, never()).publish(anyString(), any(Envelope.class));
    }

    @Test
    @DisplayName("구독한 kind 와 다른 envelope 은 핸들러에 전달되지 않아야 함")
    void mismatchedKindIsDropped() {
        // Given
        List<Envelope> received = new ArrayList<>();
        router.subscribe(MessageKind.MODULE_START, received::add, "module/#");

        // When - an error envelope arrives on a topic the filter covers
        Map<String, Object> error = startPayload("a1");
        error.put("event", "error");
        error.put("error_message", "boom");
        router.publish(MessageKind.MODULE_ERROR, error);

        // Then
        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("같은 필터의 구독은 엔진에 한 번만 등록되어야 함")
    void oneEngineSubscriptionPerFilter() {
        // Given
        MessageBusEngine mockEngine = mock(MessageBusEngine.class);
        when(mockEngine.subscribe(anyString(), any(EnvelopeCallback.class))).thenReturn(true);
        when(mockEngine.unsubscribe(anyString())).thenReturn(true);
        MessageRouter shared = new MessageRouter(mockEngine, clock);

        // When
        MessageRouter.Subscription first =
                shared.subscribe(MessageKind.TASK_STATUS, env -> { }, null).orElseThrow();
        MessageRouter.Subscription second =
                shared.subscribe(MessageKind.TASK_STATUS, env -> { }, null).orElseThrow();

        // Then
        verify(mockEngine, times(1)).subscribe(eq("task/status/*"), any(EnvelopeCallback.class));
        assertEquals(2, shared.routeCount());

        assertTrue(shared.unsubscribe(first));
        verify(mockEngine, never()).unsubscribe(anyString());
        assertTrue(shared.unsubscribe(second));
        verify(mockEngine).unsubscribe("task/status/*");
        assertEquals(0, shared.routeCount());
    }

    @Test
    @DisplayName("엔진이 구독을 거부하면 빈 결과를 반환해야 함")
    void rejectedSubscription() {
        MessageBusEngine mockEngine = mock(MessageBusEngine.class);
        when(mockEngine.subscribe(anyString(), any(EnvelopeCallback.class))).thenReturn(false);
        MessageRouter rejecting = new MessageRouter(mockEngine, clock);

        assertTrue(rejecting.subscribe(MessageKind.TASK_STATUS, env -> { }, null).isEmpty());
        assertEquals(0, rejecting.routeCount());
    }

    @Test
    @DisplayName("연결이 끊긴 버스로의 publish 는 false 를 반환해야 함")
    void publishOnDisconnectedBus() {
        router.shutdown();

        assertFalse(router.isConnected());
        assertFalse(router.publish(MessageKind.MODULE_START, startPayload("a1")));
        assertTrue(router.reconnect());
    }
}
