package com.tradingagents.progress.service;

import com.tradingagents.progress.TestClock;
import com.tradingagents.progress.bus.InMemoryBusEngine;
import com.tradingagents.progress.dto.TaskProgress;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.SchemaViolationException;
import com.tradingagents.progress.message.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskMessageProducerTest {

    private TestClock clock;
    private TaskMessageProducer producer;
    private final List<Envelope> received = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        MessageRouter router = new MessageRouter(new InMemoryBusEngine(), clock);
        router.initialize();
        producer = new TaskMessageProducer(router, clock);
        for (MessageKind kind : MessageKind.values()) {
            router.subscribe(kind, received::add, null);
        }
    }

    @Test
    @DisplayName("module.complete 는 duration 과 event 필드를 포함해야 함")
    void moduleCompletePayload() {
        // When
        boolean published = producer.publishModuleComplete("a1", "news_analyst", "AAPL", 3.25);

        // Then
        assertTrue(published);
        Envelope envelope = received.get(0);
        assertEquals(MessageKind.MODULE_COMPLETE, envelope.type());
        assertEquals("complete", envelope.stringField("event"));
        assertEquals(3.25, envelope.numberField("duration"));
        assertEquals("AAPL", envelope.stringField("stock_symbol"));
    }

    @Test
    @DisplayName("stock_symbol 이 없으면 payload 에서 생략되어야 함")
    void missingSymbolIsOmitted() {
        producer.publishModuleStart("a1", "trader", null);

        assertFalse(received.get(0).payload().containsKey("stock_symbol"));
    }

    @Test
    @DisplayName("확장 필드는 payload 에 병합되어야 함")
    void extensionsAreMerged() {
        producer.publishModuleError("a1", "trader", "AAPL", "timeout", Map.of("recoverable", true, "attempt", 2));

        Envelope envelope = received.get(0);
        assertTrue(envelope.flag("recoverable"));
        assertEquals(2, envelope.payload().get("attempt"));
        assertEquals("timeout", envelope.stringField("error_message"));
    }

    @Test
    @DisplayName("필수 필드를 덮어쓰는 확장은 거부되어야 함")
    void shadowingExtensionIsRejected() {
        assertThrows(SchemaViolationException.class,
                () -> producer.publishStatus("a1", TaskStatus.RUNNING, "go", Map.of("status", "done")));
        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("task.status 는 현재 시각을 timestamp 로 담아야 함")
    void statusCarriesTimestamp() {
        producer.publishStatus("a1", TaskStatus.PAUSED, "Analysis paused");

        Envelope envelope = received.get(0);
        assertEquals("paused", envelope.stringField("status"));
        assertEquals(clock.millis() / 1000.0, envelope.numberField("timestamp"), 0.0001);
    }

    @Test
    @DisplayName("task.progress 는 모든 필수 필드와 status 를 포함해야 함")
    void progressPayload() {
        TaskProgress progress = TaskProgress.builder()
                .analysisId("a1")
                .status(TaskStatus.RUNNING)
                .currentStep(3)
                .totalSteps(12)
                .progressPercentage(16.67)
                .currentStepName("Market analyst")
                .elapsedTime(42.0)
                .remainingTime(100.0)
                .build();

        producer.publishProgress(progress);

        Map<String, Object> payload = received.get(0).payload();
        assertEquals(3, payload.get("current_step"));
        assertEquals(12, payload.get("total_steps"));
        assertEquals("", payload.get("current_step_description"));
        assertEquals("", payload.get("last_message"));
        assertEquals("running", payload.get("status"));
    }
}
