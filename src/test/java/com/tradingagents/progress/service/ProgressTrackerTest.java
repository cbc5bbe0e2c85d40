package com.tradingagents.progress.service;

import com.tradingagents.progress.TestClock;
import com.tradingagents.progress.bus.InMemoryBusEngine;
import com.tradingagents.progress.dto.ControlResult;
import com.tradingagents.progress.dto.PlannedStep;
import com.tradingagents.progress.dto.StepEvent;
import com.tradingagents.progress.dto.StepRecord;
import com.tradingagents.progress.dto.StepStatus;
import com.tradingagents.progress.dto.TaskProgress;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.TaskStatus;
import com.tradingagents.progress.store.InMemoryTaskStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private static final String ANALYSIS = "analysis_20250101_001";

    private TestClock clock;
    private TaskMessageProducer producer;
    private InMemoryTaskStateStore store;
    private TrackerRegistry registry;
    private ProgressTracker tracker;
    private final List<Envelope> statusEvents = new CopyOnWriteArrayList<>();
    private final List<Envelope> progressEvents = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        MessageRouter router = new MessageRouter(new InMemoryBusEngine(), clock);
        router.initialize();
        producer = new TaskMessageProducer(router, clock);
        store = new InMemoryTaskStateStore();
        registry = new TrackerRegistry(router, producer, store, new EqualWeightingPolicy(), clock);

        router.subscribe(MessageKind.TASK_STATUS, statusEvents::add, null);
        router.subscribe(MessageKind.TASK_PROGRESS, progressEvents::add, null);

        tracker = registry.register(ANALYSIS, threeSteps());
    }

    private static List<PlannedStep> threeSteps() {
        return List.of(
                step(1, "market_analyst", "analyst"),
                step(2, "news_analyst", "analyst"),
                step(3, "trader", "trading"));
    }

    private static PlannedStep step(int index, String name, String phase) {
        return PlannedStep.builder()
                .index(index)
                .name(name)
                .displayName(name.replace('_', ' '))
                .description("Run " + name)
                .phase(phase)
                .build();
    }

    private void start(String module) {
        producer.publishModuleStart(ANALYSIS, module, "AAPL");
    }

    private void complete(String module, double duration) {
        producer.publishModuleComplete(ANALYSIS, module, "AAPL", duration);
    }

    @Test
    @DisplayName("첫 module.start 수신 시 단계와 작업이 running 이 되어야 함")
    void firstStartRunsStepAndTask() {
        // When
        start("market_analyst");

        // Then
        StepRecord current = tracker.currentStep().orElseThrow();
        assertEquals(1, current.getIndex());
        assertEquals(StepStatus.RUNNING, current.getStatus());
        assertEquals(TaskStatus.RUNNING, tracker.status());
    }

    @Test
    @DisplayName("단계 완료 후 진행률이 오르고 경과 시간은 보고된 duration 이상이어야 함")
    void completionRaisesProgressAndElapsed() {
        // Given
        start("market_analyst");
        double before = tracker.progress().getProgressPercentage();

        // When
        complete("market_analyst", 5.0);
        start("news_analyst");

        // Then
        TaskProgress progress = tracker.progress();
        assertTrue(progress.getProgressPercentage() > before);
        assertEquals(33.33, progress.getProgressPercentage(), 0.01);
        assertTrue(progress.getElapsedTime() >= 5.0);
        assertEquals(2, progress.getCurrentStep());
    }

    @Test
    @DisplayName("pause 후 resume 하면 running 으로 돌아오고 단계 기록은 변하지 않아야 함")
    void pauseResumeKeepsRecords() {
        // Given
        start("market_analyst");
        List<StepRecord> before = tracker.history();

        // When
        ControlResult paused = tracker.pause();
        clock.advanceSeconds(30);
        ControlResult resumed = tracker.resume();

        // Then
        assertTrue(paused.accepted());
        assertTrue(resumed.accepted());
        assertEquals(TaskStatus.RUNNING, tracker.status());
        assertEquals(before, tracker.history());
    }

    @Test
    @DisplayName("module.error 수신 시 단계와 작업이 failed 가 되어야 함")
    void moduleErrorFailsTask() {
        // Given
        start("market_analyst");

        // When
        producer.publishModuleError(ANALYSIS, "market_analyst", "AAPL", "timeout");

        // Then
        assertEquals(TaskStatus.FAILED, tracker.status());
        StepRecord step = tracker.history().get(0);
        assertEquals(StepStatus.FAILED, step.getStatus());
        assertEquals("timeout", step.getErrorMessage());
    }

    @Test
    @DisplayName("recoverable 오류는 단계만 실패시키고 작업은 계속되어야 함")
    void recoverableErrorKeepsTaskRunning() {
        // Given
        start("market_analyst");

        // When
        producer.publishModuleError(ANALYSIS, "market_analyst", "AAPL", "rate limited", Map.of("recoverable", true));

        // Then
        assertEquals(TaskStatus.RUNNING, tracker.status());
        assertEquals(StepStatus.FAILED, tracker.history().get(0).getStatus());
    }

    @Test
    @DisplayName("stop 이후의 module 이벤트는 무시되어야 함")
    void eventsAfterStopAreIgnored() {
        // Given
        start("market_analyst");
        tracker.stop();

        // When
        start("news_analyst");

        // Then
        assertEquals(TaskStatus.STOPPED, tracker.status());
        assertEquals(StepStatus.PENDING, tracker.history().get(1).getStatus());
    }

    @Test
    @DisplayName("중복 module.start 는 start_time 과 경과 시간을 바꾸지 않아야 함")
    void duplicateStartIsNoOp() {
        // Given
        start("market_analyst");
        clock.advanceSeconds(3);
        StepRecord first = tracker.currentStep().orElseThrow();
        double elapsedBefore = tracker.progress().getElapsedTime();

        // When
        start("market_analyst");

        // Then
        StepRecord replayed = tracker.currentStep().orElseThrow();
        assertEquals(first.getStartTime(), replayed.getStartTime());
        assertEquals(1, replayed.getEvents().size());
        assertEquals(elapsedBefore, tracker.progress().getElapsedTime(), 0.001);
    }

    @Test
    @DisplayName("완료된 단계에 대한 start 는 기록을 다시 열지 않아야 함")
    void startAfterCompleteIsIgnored() {
        // Given
        start("market_analyst");
        complete("market_analyst", 1.0);

        // When
        start("market_analyst");

        // Then
        StepRecord step = tracker.history().get(0);
        assertEquals(StepStatus.COMPLETED, step.getStatus());
        assertEquals(2, step.getEvents().size());
    }

    @Test
    @DisplayName("history 는 계획된 단계 수만큼 항목을 반환해야 함")
    void historyHasOneEntryPerPlannedStep() {
        // Given
        List<PlannedStep> plan = List.of(
                step(1, "a", "analyst"), step(2, "b", "analyst"), step(3, "c", "analyst"),
                step(4, "d", "analyst"), step(5, "e", "analyst"));
        ProgressTracker five = registry.register("analysis_five", plan);

        // When
        producer.publishModuleComplete("analysis_five", "b", null, 1.0);
        producer.publishModuleComplete("analysis_five", "d", null, 1.0);

        // Then
        List<StepRecord> history = five.history();
        assertEquals(5, history.size());
        assertEquals(List.of(StepStatus.PENDING, StepStatus.COMPLETED, StepStatus.PENDING,
                        StepStatus.COMPLETED, StepStatus.PENDING),
                history.stream().map(StepRecord::getStatus).toList());
        for (int i = 0; i < 5; i++) {
            assertEquals(i + 1, history.get(i).getIndex());
        }
    }

    @Test
    @DisplayName("stop 은 running/paused 에서만 가능하고 두 번째 stop 은 no-op 이어야 함")
    void stopLegality() {
        // Given
        start("market_analyst");
        tracker.pause();

        // When
        ControlResult first = tracker.stop();
        ControlResult second = tracker.stop();

        // Then
        assertTrue(first.accepted());
        assertTrue(second.accepted());
        assertEquals(TaskStatus.STOPPED, second.status());
        assertFalse(tracker.resume().accepted());
        assertFalse(tracker.pause().accepted());
        assertEquals(TaskStatus.STOPPED, tracker.status());
    }

    @Test
    @DisplayName("pending 상태에서도 stop 할 수 있어야 함")
    void stopFromPending() {
        // When
        ControlResult result = tracker.stop();

        // Then
        assertTrue(result.accepted());
        assertEquals(TaskStatus.STOPPED, tracker.status());
        assertFalse(tracker.pause().accepted());

        start("market_analyst");
        assertEquals(TaskStatus.STOPPED, tracker.status());
        assertEquals(StepStatus.PENDING, tracker.history().get(0).getStatus());
    }

    @Test
    @DisplayName("완료되거나 실패한 작업은 stop 할 수 없어야 함")
    void stopRejectedAfterCompletionOrFailure() {
        // Given
        start("market_analyst");
        complete("market_analyst", 1.0);
        start("news_analyst");
        complete("news_analyst", 1.0);
        start("trader");
        complete("trader", 1.0);

        ProgressTracker failing = registry.register("analysis_failing", threeSteps());
        failing.markFailed("pipeline crashed");

        // When
        ControlResult completedStop = tracker.stop();
        ControlResult failedStop = failing.stop();

        // Then
        assertEquals(TaskStatus.COMPLETED, tracker.status());
        assertFalse(completedStop.accepted());
        assertEquals(TaskStatus.COMPLETED, completedStop.status());
        assertFalse(failedStop.accepted());
        assertEquals(TaskStatus.FAILED, failing.status());
        assertEquals(100.0, tracker.progress().getProgressPercentage());
        assertEquals(0.0, tracker.progress().getRemainingTime());
    }

    @Test
    @DisplayName("잘못된 전이는 거부되고 상태는 그대로여야 함")
    void illegalTransitionsAreRejected() {
        // pending
        assertFalse(tracker.pause().accepted());
        assertFalse(tracker.resume().accepted());

        // running
        start("market_analyst");
        ControlResult resume = tracker.resume();
        assertFalse(resume.accepted());
        assertEquals(TaskStatus.RUNNING, resume.status());
        assertNotNull(resume.message());
        assertEquals(TaskStatus.RUNNING, tracker.status());
    }

    @Test
    @DisplayName("일시정지 구간은 경과 시간에서 제외되어야 함")
    void pausedIntervalIsExcludedFromElapsed() {
        // Given
        start("market_analyst");
        clock.advanceSeconds(10);

        // When
        tracker.pause();
        clock.advanceSeconds(100);
        tracker.resume();
        clock.advanceSeconds(5);

        // Then
        assertEquals(15.0, tracker.progress().getElapsedTime(), 0.01);
        assertEquals(15.0, tracker.currentStep().orElseThrow().getElapsedTime(), 0.01);
    }

    @Test
    @DisplayName("일시정지를 포함한 보고 duration 은 경과 시간을 늘리지 않아야 함")
    void reportedDurationSpanningPauseIsNotCounted() {
        // Given
        start("market_analyst");
        clock.advanceSeconds(10);
        tracker.pause();
        clock.advanceSeconds(100);
        tracker.resume();
        double elapsedBeforeComplete = tracker.progress().getElapsedTime();

        // When
        complete("market_analyst", 110.0);

        // Then
        assertEquals(10.0, elapsedBeforeComplete, 0.01);
        assertEquals(10.0, tracker.progress().getElapsedTime(), 0.01);
        assertEquals(10.0, tracker.history().get(0).getElapsedTime(), 0.01);
    }

    @Test
    @DisplayName("남은 시간은 완료 단계 평균으로 추정하고 완료 단계가 없으면 0 이어야 함")
    void remainingTimeExtrapolatesCompletedSteps() {
        // Given
        start("market_analyst");
        clock.advanceSeconds(10);
        assertEquals(0.0, tracker.progress().getRemainingTime());

        // When
        complete("market_analyst", 10.0);

        // Then
        assertEquals(20.0, tracker.progress().getRemainingTime(), 0.01);
    }

    @Test
    @DisplayName("일시정지 중 마지막 단계가 완료되면 resume 시 completed 가 되어야 함")
    void completionWhilePausedAppliesOnResume() {
        // Given
        start("trader");
        tracker.pause();

        // When
        complete("trader", 2.0);

        // Then
        assertEquals(TaskStatus.PAUSED, tracker.status());
        ControlResult resumed = tracker.resume();
        assertTrue(resumed.accepted());
        assertEquals(TaskStatus.COMPLETED, resumed.status());
        assertEquals(TaskStatus.COMPLETED, tracker.status());
    }

    @Test
    @DisplayName("반복되는 토론 단계는 라운드 순서대로 매핑되어야 함")
    void repeatedModulesMapToRounds() {
        // Given
        List<PlannedStep> plan = List.of(
                PlannedStep.builder().index(1).name("bull_researcher").round(1).role("bull").build(),
                PlannedStep.builder().index(2).name("bull_researcher").round(2).role("bull").build(),
                PlannedStep.builder().index(3).name("research_manager").build());
        ProgressTracker debate = registry.register("analysis_debate", plan);

        // When
        producer.publishModuleStart("analysis_debate", "bull_researcher", null);
        producer.publishModuleComplete("analysis_debate", "bull_researcher", null, 1.0);
        producer.publishModuleStart("analysis_debate", "bull_researcher", null);

        // Then
        List<StepRecord> history = debate.history();
        assertEquals(StepStatus.COMPLETED, history.get(0).getStatus());
        assertEquals(StepStatus.RUNNING, history.get(1).getStatus());
        assertEquals(2, debate.currentStep().orElseThrow().getIndex());
    }

    @Test
    @DisplayName("도구 호출 시간은 단계 경과 시간에 누적되고 순서가 어긋나도 기록되어야 함")
    void toolCallsAccumulate() {
        // Given
        start("market_analyst");

        // When
        registry.recordToolCall(ANALYSIS, "market_analyst", "get_stock_data", 4.0);
        registry.recordToolCall(ANALYSIS, "news_analyst", "get_news", 2.0);
        start("news_analyst");

        // Then
        List<StepRecord> history = tracker.history();
        StepRecord market = history.get(0);
        assertEquals(4.0, market.getToolTime(), 0.001);
        assertTrue(market.getElapsedTime() >= 4.0);
        assertTrue(market.getEvents().stream().anyMatch(e -> e.getType() == StepEvent.Type.TOOL_CALLING));

        StepRecord news = history.get(1);
        assertEquals(StepStatus.RUNNING, news.getStatus());
        assertEquals(2.0, news.getToolTime(), 0.001);
    }

    @Test
    @DisplayName("알 수 없는 모듈 이벤트는 무시되어야 함")
    void unknownModuleIsIgnored() {
        // When
        start("unplanned_module");

        // Then
        assertEquals(TaskStatus.PENDING, tracker.status());
        assertTrue(tracker.currentStep().isEmpty());
    }

    @Test
    @DisplayName("작업 상태가 바뀔 때마다 task.status 와 task.progress 가 발행되어야 함")
    void transitionsAreBroadcast() {
        // When
        start("market_analyst");
        tracker.pause();

        // Then
        List<String> statuses = statusEvents.stream().map(e -> e.stringField("status")).toList();
        assertEquals(List.of("pending", "running", "paused"), statuses);
        assertEquals(3, progressEvents.size());
        assertEquals(1, ((Number) progressEvents.get(1).payload().get("current_step")).intValue());
    }

    @Test
    @DisplayName("동시에 갱신되어도 task.progress 는 스냅샷 순서대로 발행되어야 함")
    void concurrentUpdatesPublishProgressInOrder() throws Exception {
        // Given
        start("market_analyst");
        progressEvents.clear();
        ExecutorService executor = Executors.newFixedThreadPool(4);

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(executor.submit(() -> {
                for (int call = 0; call < 50; call++) {
                    tracker.recordToolCall("market_analyst", "get_quotes", 1.0, null);
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertFalse(progressEvents.isEmpty());
        double previous = 0.0;
        for (Envelope envelope : progressEvents) {
            double elapsed = envelope.numberField("elapsed_time");
            assertTrue(elapsed >= previous, "elapsed_time went back from " + previous + " to " + elapsed);
            previous = elapsed;
        }
        assertEquals(200.0, previous, 0.01);
    }

    @Test
    @DisplayName("저장된 상태만으로 동일한 history 를 재구성할 수 있어야 함")
    void restoresFromPersistedState() {
        // Given
        start("market_analyst");
        clock.advanceSeconds(4);
        complete("market_analyst", 4.0);
        start("news_analyst");
        tracker.pause();
        List<StepRecord> expected = tracker.history();

        // When
        MessageRouter freshRouter = new MessageRouter(new InMemoryBusEngine(), clock);
        freshRouter.initialize();
        TrackerRegistry restarted = new TrackerRegistry(freshRouter, new TaskMessageProducer(freshRouter, clock),
                store, new EqualWeightingPolicy(), clock);
        ProgressTracker restored = restarted.lookup(ANALYSIS).orElseThrow();

        // Then
        assertEquals(TaskStatus.PAUSED, restored.status());
        assertEquals(expected, restored.history());
        assertEquals(tracker.progress(), restored.progress());
        assertTrue(restored.resume().accepted());
    }

    @Test
    @DisplayName("일시정지된 작업은 resume 될 때까지 대기해야 함")
    void awaitIfPausedBlocksUntilResume() throws Exception {
        // Given
        start("market_analyst");
        tracker.pause();

        // When
        CompletableFuture<TaskStatus> waiting = CompletableFuture.supplyAsync(
                () -> tracker.awaitIfPaused(Duration.ofSeconds(5)));
        Thread.sleep(50);
        tracker.resume();

        // Then
        assertEquals(TaskStatus.RUNNING, waiting.get(2, TimeUnit.SECONDS));
        tracker.pause();
        assertEquals(TaskStatus.PAUSED, tracker.awaitIfPaused(Duration.ofMillis(20)));
    }

    @Test
    @DisplayName("빈 계획은 등록할 수 없어야 함")
    void emptyPlanIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("analysis_empty", List.of()));
        assertThrows(IllegalArgumentException.class, () -> registry.register("bad/id", threeSteps()));
    }
}
