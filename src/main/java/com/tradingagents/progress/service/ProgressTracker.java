package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.ControlResult;
import com.tradingagents.progress.dto.PauseInterval;
import com.tradingagents.progress.dto.PlannedStep;
import com.tradingagents.progress.dto.StepEvent;
import com.tradingagents.progress.dto.StepRecord;
import com.tradingagents.progress.dto.StepStatus;
import com.tradingagents.progress.dto.TaskProgress;
import com.tradingagents.progress.dto.TaskState;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.ModuleEvent;
import com.tradingagents.progress.message.SchemaViolationException;
import com.tradingagents.progress.message.TaskStatus;
import com.tradingagents.progress.message.Topics;
import com.tradingagents.progress.store.TaskStateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * State machine of one analysis job.
 * <p>
 * Task: {@code pending -> running <-> paused -> completed | failed | stopped}.
 * Step: {@code pending -> running -> completed | failed}.
 * <p>
 * Module events arrive from the bus, control calls from operators. All mutations take the
 * write lock, persist the full state and then broadcast progress outside the lock, in snapshot
 * order. Queries take the read lock and return copies.
 */
@Slf4j
public class ProgressTracker {

    private final String analysisId;
    private final List<PlannedStep> plannedSteps;
    private final Map<Integer, PlannedStep> plannedByIndex = new LinkedHashMap<>();
    private final TaskMessageProducer producer;
    private final TaskStateStore stateStore;
    private final ProgressWeightingPolicy weightingPolicy;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Condition pauseLifted = lock.writeLock().newCondition();

    // step index -> record, guarded by lock
    private final Map<Integer, StepRecord> records = new TreeMap<>();
    private final List<PauseInterval> pauses = new ArrayList<>();

    // Snapshots are numbered under the lock and published in that order
    private final AtomicLong snapshotSequence = new AtomicLong();
    private final Object publishLock = new Object();
    private long publishedSequence;

    private TaskStatus status;
    private TaskStatus pendingOutcome;
    private double createdAt;
    private Double startedAt;
    private Double endedAt;
    private int currentStepIndex;
    private String lastMessage;
    private String errorMessage;

    private ProgressTracker(String analysisId, List<PlannedStep> plannedSteps, TaskMessageProducer producer,
                            TaskStateStore stateStore, ProgressWeightingPolicy weightingPolicy, Clock clock) {
        Topics.requireValidAnalysisId(analysisId);
        this.analysisId = analysisId;
        this.plannedSteps = normalizePlan(plannedSteps);
        this.plannedSteps.forEach(step -> plannedByIndex.put(step.getIndex(), step));
        this.producer = producer;
        this.stateStore = stateStore;
        this.weightingPolicy = weightingPolicy;
        this.clock = clock;
    }

    /**
     * New job in {@code pending}. The plan is copied and may not be changed afterwards.
     *
     * @throws IllegalArgumentException for an invalid id, an empty plan or duplicate step indexes
     */
    public static ProgressTracker create(String analysisId, List<PlannedStep> plannedSteps,
                                         TaskMessageProducer producer, TaskStateStore stateStore,
                                         ProgressWeightingPolicy weightingPolicy, Clock clock) {
        ProgressTracker tracker = new ProgressTracker(analysisId, plannedSteps, producer, stateStore,
                weightingPolicy, clock);
        tracker.lock.writeLock().lock();
        try {
            tracker.status = TaskStatus.PENDING;
            tracker.createdAt = tracker.now();
            tracker.lastMessage = "Analysis queued";
            tracker.persist();
        } finally {
            tracker.lock.writeLock().unlock();
        }
        return tracker;
    }

    /**
     * Rebuild a tracker from persisted state, e.g. after a restart.
     */
    public static ProgressTracker restore(TaskState state, TaskMessageProducer producer, TaskStateStore stateStore,
                                          ProgressWeightingPolicy weightingPolicy, Clock clock) {
        ProgressTracker tracker = new ProgressTracker(state.getAnalysisId(), state.getPlannedSteps(), producer,
                stateStore, weightingPolicy, clock);
        tracker.lock.writeLock().lock();
        try {
            tracker.status = state.getStatus() != null ? state.getStatus() : TaskStatus.PENDING;
            tracker.pendingOutcome = state.getPendingOutcome();
            tracker.createdAt = state.getCreatedAt();
            tracker.startedAt = state.getStartedAt();
            tracker.endedAt = state.getEndedAt();
            tracker.currentStepIndex = state.getCurrentStepIndex();
            tracker.lastMessage = state.getLastMessage();
            tracker.errorMessage = state.getErrorMessage();
            if (state.getPauses() != null) {
                state.getPauses().forEach(p -> tracker.pauses.add(new PauseInterval(p.getStartedAt(), p.getEndedAt())));
            }
            if (state.getStepRecords() != null) {
                for (StepRecord record : state.getStepRecords()) {
                    if (tracker.plannedByIndex.containsKey(record.getIndex())) {
                        tracker.records.put(record.getIndex(), record.copy());
                    } else {
                        log.warn("Dropping persisted record for unplanned step: analysis={}, step={}",
                                state.getAnalysisId(), record.getIndex());
                    }
                }
            }
        } finally {
            tracker.lock.writeLock().unlock();
        }
        log.info("Tracker restored: analysis={}, status={}, records={}",
                tracker.analysisId, tracker.status.wireName(), tracker.records.size());
        return tracker;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    // ------------------------------------------------------------------
    // Inbound module events
    // ------------------------------------------------------------------

    /**
     * Apply a module.start, module.complete or module.error envelope.
     * Events for a terminal task, duplicates and unknown modules are logged and ignored.
     */
    public void onModuleEvent(Envelope envelope) {
        if (!envelope.type().isModuleEvent()) {
            log.warn("Not a module event: analysis={}, type={}", analysisId, envelope.type().wireName());
            return;
        }
        if (!analysisId.equals(envelope.analysisId())) {
            log.warn("Event for analysis {} delivered to tracker {}", envelope.analysisId(), analysisId);
            return;
        }
        ModuleEvent event = ModuleEvent.forKind(envelope.type());
        String moduleName = envelope.stringField("module_name");

        Outbound outbound;
        lock.writeLock().lock();
        try {
            if (status.isTerminal()) {
                log.info("Ignoring module.{} for {} task: analysis={}, module={}",
                        event.wireName(), status.wireName(), analysisId, moduleName);
                return;
            }
            Integer index = resolveStep(moduleName, envelope.payload().get("step_index"), event != ModuleEvent.START);
            if (index == null) {
                log.warn("Module not in plan, event ignored: analysis={}, module={}", analysisId, moduleName);
                return;
            }

            TaskStatus before = status;
            boolean changed = switch (event) {
                case START -> applyStart(index);
                case COMPLETE -> applyComplete(index, envelope.numberField("duration"));
                case ERROR -> applyError(index, envelope.stringField("error_message"), envelope.flag("recoverable"));
            };
            if (!changed) {
                return;
            }
            persist();
            outbound = outbound(before);
        } finally {
            lock.writeLock().unlock();
        }
        broadcast(outbound);
    }

    /**
     * Record a tool invocation inside a step. Tool calls may arrive out of order; they only add
     * to the step's tool time and never change a step's status.
     */
    public void recordToolCall(String moduleName, String toolName, double durationSeconds, Integer stepIndex) {
        Outbound outbound;
        lock.writeLock().lock();
        try {
            if (status.isTerminal()) {
                log.debug("Ignoring tool call for {} task: analysis={}", status.wireName(), analysisId);
                return;
            }
            Integer index = resolveStep(moduleName, stepIndex, true);
            if (index == null) {
                log.warn("Tool call for module not in plan ignored: analysis={}, module={}", analysisId, moduleName);
                return;
            }
            StepRecord record = records.computeIfAbsent(index, i -> StepRecord.placeholder(plannedByIndex.get(i)));
            double duration = Math.max(0.0, durationSeconds);
            double now = now();

            record.getEvents().add(StepEvent.builder()
                    .type(StepEvent.Type.TOOL_CALLING)
                    .timestamp(now)
                    .toolName(toolName)
                    .duration(duration)
                    .message("Tool " + toolName + " finished")
                    .build());
            record.setToolTime(record.getToolTime() + duration);
            if (record.isTerminal()) {
                log.debug("Late tool call on {} step: analysis={}, step={}",
                        record.getStatus().wireName(), analysisId, index);
                record.setElapsedTime(Math.max(record.getElapsedTime(), record.getToolTime()));
            }
            lastMessage = String.format("%s: tool %s finished in %.1fs", record.getDisplayName(), toolName, duration);

            persist();
            outbound = outbound(status);
        } finally {
            lock.writeLock().unlock();
        }
        broadcast(outbound);
    }

    private boolean applyStart(int index) {
        StepRecord record = records.get(index);
        if (record != null && record.getStatus() != StepStatus.PENDING) {
            if (record.isTerminal()) {
                log.warn("Start after {} ignored: analysis={}, step={}",
                        record.getStatus().wireName(), analysisId, index);
            } else {
                log.debug("Duplicate start ignored: analysis={}, step={}", analysisId, index);
            }
            return false;
        }

        double now = now();
        if (record == null) {
            record = StepRecord.placeholder(plannedByIndex.get(index));
            records.put(index, record);
        }
        record.setStatus(StepStatus.RUNNING);
        record.setStartTime(now);
        record.getEvents().add(StepEvent.builder()
                .type(StepEvent.Type.START)
                .timestamp(now)
                .message("Started " + record.getDisplayName())
                .build());

        currentStepIndex = index;
        lastMessage = "Started " + record.getDisplayName();
        if (status == TaskStatus.PENDING) {
            status = TaskStatus.RUNNING;
            startedAt = now;
        }
        log.info("Step started: analysis={}, step={}, name={}", analysisId, index, record.getName());
        return true;
    }

    private boolean applyComplete(int index, Double duration) {
        StepRecord record = records.get(index);
        if (record != null && record.isTerminal()) {
            log.debug("Duplicate completion ignored: analysis={}, step={}", analysisId, index);
            return false;
        }

        double now = now();
        record = openRecord(index, now, duration);
        record.setStatus(StepStatus.COMPLETED);
        record.setEndTime(now);
        record.setReportedDuration(duration);
        record.getEvents().add(StepEvent.builder()
                .type(StepEvent.Type.COMPLETE)
                .timestamp(now)
                .duration(duration)
                .message("Completed " + record.getDisplayName())
                .build());
        record.setElapsedTime(stepElapsed(record, now));

        currentStepIndex = index;
        lastMessage = "Completed " + record.getDisplayName();
        log.info("Step completed: analysis={}, step={}, elapsed={}s", analysisId, index,
                String.format("%.2f", record.getElapsedTime()));

        if (index == lastPlannedIndex()) {
            conclude(TaskStatus.COMPLETED, "Analysis completed");
        }
        return true;
    }

    private boolean applyError(int index, String error, boolean recoverable) {
        StepRecord record = records.get(index);
        if (record != null && record.isTerminal()) {
            log.debug("Error for finished step ignored: analysis={}, step={}", analysisId, index);
            return false;
        }

        double now = now();
        record = openRecord(index, now, null);
        record.setStatus(StepStatus.FAILED);
        record.setEndTime(now);
        record.setErrorMessage(error);
        record.setFatal(!recoverable);
        record.getEvents().add(StepEvent.builder()
                .type(StepEvent.Type.ERROR)
                .timestamp(now)
                .message(error)
                .build());
        record.setElapsedTime(stepElapsed(record, now));

        currentStepIndex = index;
        lastMessage = record.getDisplayName() + " failed: " + error;
        log.warn("Step failed: analysis={}, step={}, recoverable={}, error={}", analysisId, index, recoverable, error);

        if (!recoverable) {
            errorMessage = error;
            conclude(TaskStatus.FAILED, lastMessage);
        }
        return true;
    }

    // Record for a terminal event; opens it when no start was seen
    private StepRecord openRecord(int index, double now, Double duration) {
        StepRecord record = records.get(index);
        if (record == null) {
            record = StepRecord.placeholder(plannedByIndex.get(index));
            records.put(index, record);
        }
        if (record.getStartTime() == null) {
            record.setStartTime(now - (duration != null ? Math.max(0.0, duration) : 0.0));
        }
        if (status == TaskStatus.PENDING) {
            status = TaskStatus.RUNNING;
            startedAt = record.getStartTime();
        }
        return record;
    }

    // Outcomes reached while paused take effect on resume
    private void conclude(TaskStatus outcome, String message) {
        if (status == TaskStatus.PAUSED) {
            if (pendingOutcome != TaskStatus.FAILED) {
                pendingOutcome = outcome;
            }
            log.info("Outcome {} deferred until resume: analysis={}", outcome.wireName(), analysisId);
            return;
        }
        finish(outcome, message);
    }

    private void finish(TaskStatus outcome, String message) {
        double now = now();
        closeOpenPause(now);
        status = outcome;
        endedAt = now;
        pendingOutcome = null;
        lastMessage = message;
        pauseLifted.signalAll();
        log.info("Analysis {}: analysis={}", outcome.wireName(), analysisId);
    }

    // ------------------------------------------------------------------
    // Control operations
    // ------------------------------------------------------------------

    public ControlResult pause() {
        Outbound outbound;
        lock.writeLock().lock();
        try {
            if (status != TaskStatus.RUNNING) {
                return ControlResult.rejected(status, "Cannot pause a " + status.wireName() + " analysis");
            }
            TaskStatus before = status;
            pauses.add(new PauseInterval(now(), null));
            status = TaskStatus.PAUSED;
            lastMessage = "Analysis paused";
            persist();
            outbound = outbound(before);
        } finally {
            lock.writeLock().unlock();
        }
        broadcast(outbound);
        log.info("Analysis paused: analysis={}", analysisId);
        return ControlResult.accepted(TaskStatus.PAUSED, "Analysis paused");
    }

    public ControlResult resume() {
        Outbound outbound;
        TaskStatus result;
        lock.writeLock().lock();
        try {
            if (status != TaskStatus.PAUSED) {
                return ControlResult.rejected(status, "Cannot resume a " + status.wireName() + " analysis");
            }
            TaskStatus before = status;
            closeOpenPause(now());
            status = TaskStatus.RUNNING;
            lastMessage = "Analysis resumed";
            if (pendingOutcome != null) {
                finish(pendingOutcome, pendingOutcome == TaskStatus.FAILED
                        ? "Analysis failed: " + errorMessage
                        : "Analysis completed");
            }
            pauseLifted.signalAll();
            result = status;
            persist();
            outbound = outbound(before);
        } finally {
            lock.writeLock().unlock();
        }
        broadcast(outbound);
        log.info("Analysis resumed: analysis={}, status={}", analysisId, result.wireName());
        return ControlResult.accepted(result, "Analysis resumed");
    }

    /**
     * Terminal and idempotent: a second stop is accepted without effect.
     * Rejected once the analysis completed or failed.
     */
    public ControlResult stop() {
        Outbound outbound;
        lock.writeLock().lock();
        try {
            if (status == TaskStatus.STOPPED) {
                return ControlResult.accepted(status, "Analysis already stopped");
            }
            if (status.isTerminal()) {
                return ControlResult.rejected(status, "Cannot stop a " + status.wireName() + " analysis");
            }
            TaskStatus before = status;
            finish(TaskStatus.STOPPED, "Analysis stopped");
            persist();
            outbound = outbound(before);
        } finally {
            lock.writeLock().unlock();
        }
        broadcast(outbound);
        return ControlResult.accepted(TaskStatus.STOPPED, "Analysis stopped");
    }

    /**
     * Non-recoverable failure signalled by the pipeline itself, outside any module event.
     */
    public ControlResult markFailed(String error) {
        Outbound outbound;
        lock.writeLock().lock();
        try {
            if (status.isTerminal()) {
                return ControlResult.rejected(status, "Cannot fail a " + status.wireName() + " analysis");
            }
            TaskStatus before = status;
            errorMessage = error;
            finish(TaskStatus.FAILED, "Analysis failed: " + error);
            persist();
            outbound = outbound(before);
        } finally {
            lock.writeLock().unlock();
        }
        broadcast(outbound);
        return ControlResult.accepted(TaskStatus.FAILED, "Analysis failed: " + error);
    }

    /**
     * Block the calling pipeline thread while the analysis is paused.
     *
     * @return the status after waiting; still {@code paused} if the timeout elapsed
     */
    public TaskStatus awaitIfPaused(Duration timeout) {
        lock.writeLock().lock();
        try {
            long nanos = timeout.toNanos();
            while (status == TaskStatus.PAUSED && nanos > 0) {
                nanos = pauseLifted.awaitNanos(nanos);
            }
            return status;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for resume: analysis={}", analysisId);
            return status;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public TaskStatus status() {
        lock.readLock().lock();
        try {
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Step most recently started or finished; empty before the first step */
    public Optional<StepRecord> currentStep() {
        lock.readLock().lock();
        try {
            if (currentStepIndex == 0) {
                return Optional.empty();
            }
            return Optional.of(view(currentStepIndex, effectiveNow()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * One entry per planned step, in plan order. Steps never reached appear as pending placeholders.
     */
    public List<StepRecord> history() {
        lock.readLock().lock();
        try {
            double now = effectiveNow();
            List<StepRecord> history = new ArrayList<>(plannedSteps.size());
            for (PlannedStep step : plannedSteps) {
                history.add(view(step.getIndex(), now));
            }
            return history;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PlannedStep> plannedSteps() {
        List<PlannedStep> copies = new ArrayList<>(plannedSteps.size());
        plannedSteps.forEach(step -> copies.add(step.toBuilder().build()));
        return copies;
    }

    public TaskProgress progress() {
        lock.readLock().lock();
        try {
            return buildProgress();
        } finally {
            lock.readLock().unlock();
        }
    }

    public TaskState snapshot() {
        lock.readLock().lock();
        try {
            return buildState();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isTerminal() {
        return status().isTerminal();
    }

    /** End time in epoch seconds, null while the analysis is not terminal */
    public Double endedAt() {
        lock.readLock().lock();
        try {
            return endedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Publish the current status and progress, e.g. right after registration */
    public void announce() {
        TaskStatus current;
        TaskProgress progress;
        String message;
        long sequence;
        lock.readLock().lock();
        try {
            current = status;
            sequence = snapshotSequence.incrementAndGet();
            progress = buildProgress();
            message = lastMessage;
        } finally {
            lock.readLock().unlock();
        }
        broadcast(new Outbound(sequence, progress, current, message));
    }

    // ------------------------------------------------------------------
    // Derived metrics (callers hold the lock)
    // ------------------------------------------------------------------

    private TaskProgress buildProgress() {
        double now = effectiveNow();
        PlannedStep current = currentStepIndex > 0 ? plannedByIndex.get(currentStepIndex) : null;
        return TaskProgress.builder()
                .analysisId(analysisId)
                .status(status)
                .currentStep(currentStepIndex)
                .totalSteps(plannedSteps.size())
                .progressPercentage(round(progressPercentage()))
                .currentStepName(current != null ? current.getDisplayName() : "")
                .currentStepDescription(current != null && current.getDescription() != null
                        ? current.getDescription() : "")
                .elapsedTime(round(elapsedTime(now)))
                .remainingTime(round(remainingTime(now)))
                .lastMessage(lastMessage)
                .build();
    }

    private double progressPercentage() {
        if (status == TaskStatus.COMPLETED) {
            return 100.0;
        }
        Set<Integer> completed = new HashSet<>();
        records.forEach((index, record) -> {
            if (record.getStatus() == StepStatus.COMPLETED) {
                completed.add(index);
            }
        });
        double percentage = weightingPolicy.progressPercentage(plannedSteps, completed);
        return Math.max(0.0, Math.min(100.0, percentage));
    }

    // Wall time since start minus pauses, never less than the summed step times
    private double elapsedTime(double now) {
        if (startedAt == null) {
            return 0.0;
        }
        double wall = Math.max(0.0, now - startedAt - pausedWithin(startedAt, now));
        double steps = 0.0;
        for (StepRecord record : records.values()) {
            steps += record.isTerminal() ? record.getElapsedTime() : stepElapsed(record, now);
        }
        return Math.max(wall, steps);
    }

    private double remainingTime(double now) {
        if (status == TaskStatus.COMPLETED) {
            return 0.0;
        }
        int completedCount = 0;
        int finishedCount = 0;
        double completedElapsed = 0.0;
        for (StepRecord record : records.values()) {
            if (record.getStatus() == StepStatus.COMPLETED) {
                completedCount++;
                completedElapsed += record.getElapsedTime();
            }
            if (record.isTerminal()) {
                finishedCount++;
            }
        }
        if (completedCount == 0) {
            return 0.0;
        }
        int remainingSteps = Math.max(0, plannedSteps.size() - finishedCount);
        return completedElapsed / completedCount * remainingSteps;
    }

    private double stepElapsed(StepRecord record, double now) {
        double measured = 0.0;
        double paused = 0.0;
        if (record.getStartTime() != null) {
            double end = record.getEndTime() != null ? record.getEndTime() : now;
            paused = pausedWithin(record.getStartTime(), end);
            measured = Math.max(0.0, end - record.getStartTime() - paused);
        }
        // Reported durations are wall time on the pipeline side and include any pause
        double reported = record.getReportedDuration() != null
                ? Math.max(0.0, record.getReportedDuration() - paused) : 0.0;
        return Math.max(measured, Math.max(reported, record.getToolTime()));
    }

    private double pausedWithin(double from, double to) {
        double paused = 0.0;
        for (PauseInterval pause : pauses) {
            paused += pause.overlap(from, to);
        }
        return paused;
    }

    private StepRecord view(int index, double now) {
        StepRecord record = records.get(index);
        if (record == null) {
            return StepRecord.placeholder(plannedByIndex.get(index));
        }
        StepRecord copy = record.copy();
        if (copy.getStatus() == StepStatus.RUNNING) {
            copy.setElapsedTime(round(stepElapsed(record, now)));
        }
        return copy;
    }

    /**
     * Planned index for a module. An explicit {@code step_index} wins when it names the same module.
     * Otherwise modules planned more than once (debate rounds) resolve to the running occurrence
     * for terminal events, then to the first occurrence not yet finished.
     */
    private Integer resolveStep(String moduleName, Object stepIndexHint, boolean preferRunning) {
        if (stepIndexHint instanceof Number number) {
            PlannedStep hinted = plannedByIndex.get(number.intValue());
            if (hinted != null && (moduleName == null || hinted.getName().equals(moduleName))) {
                return hinted.getIndex();
            }
            log.warn("step_index {} does not match module {}: analysis={}", stepIndexHint, moduleName, analysisId);
        }
        if (moduleName == null) {
            return null;
        }

        Integer firstOpen = null;
        Integer last = null;
        for (PlannedStep step : plannedSteps) {
            if (!step.getName().equals(moduleName)) {
                continue;
            }
            StepRecord record = records.get(step.getIndex());
            if (preferRunning && record != null && record.getStatus() == StepStatus.RUNNING) {
                return step.getIndex();
            }
            if (firstOpen == null && (record == null || !record.isTerminal())) {
                firstOpen = step.getIndex();
            }
            last = step.getIndex();
        }
        return firstOpen != null ? firstOpen : last;
    }

    private int lastPlannedIndex() {
        return plannedSteps.get(plannedSteps.size() - 1).getIndex();
    }

    private void closeOpenPause(double now) {
        for (PauseInterval pause : pauses) {
            if (pause.isOpen()) {
                pause.setEndedAt(now);
            }
        }
    }

    // Terminal tasks freeze their clocks at the end time
    private double effectiveNow() {
        return endedAt != null ? endedAt : now();
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    // ------------------------------------------------------------------
    // Persistence and broadcast
    // ------------------------------------------------------------------

    private TaskState buildState() {
        List<StepRecord> recordCopies = new ArrayList<>();
        records.values().forEach(record -> recordCopies.add(record.copy()));
        List<PauseInterval> pauseCopies = new ArrayList<>();
        pauses.forEach(p -> pauseCopies.add(new PauseInterval(p.getStartedAt(), p.getEndedAt())));

        return TaskState.builder()
                .analysisId(analysisId)
                .status(status)
                .pendingOutcome(pendingOutcome)
                .plannedSteps(plannedSteps())
                .stepRecords(recordCopies)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .endedAt(endedAt)
                .pauses(pauseCopies)
                .currentStepIndex(currentStepIndex)
                .lastMessage(lastMessage)
                .errorMessage(errorMessage)
                .updatedAt(now())
                .build();
    }

    private void persist() {
        try {
            stateStore.save(buildState());
        } catch (RuntimeException e) {
            log.warn("Task state not persisted: analysis={}, error={}", analysisId, e.getMessage());
        }
    }

    private Outbound outbound(TaskStatus before) {
        return new Outbound(snapshotSequence.incrementAndGet(), buildProgress(),
                status != before ? status : null, lastMessage);
    }

    private void broadcast(Outbound outbound) {
        synchronized (publishLock) {
            try {
                if (outbound.statusChange() != null) {
                    producer.publishStatus(analysisId, outbound.statusChange(), outbound.statusMessage());
                }
                if (outbound.sequence() < publishedSequence) {
                    log.debug("Stale progress snapshot skipped: analysis={}, sequence={}", analysisId, outbound.sequence());
                    return;
                }
                publishedSequence = outbound.sequence();
                producer.publishProgress(outbound.progress());
            } catch (SchemaViolationException e) {
                log.error("Progress broadcast rejected: analysis={}", analysisId, e);
            }
        }
    }

    private record Outbound(long sequence, TaskProgress progress, TaskStatus statusChange, String statusMessage) {
    }

    private static List<PlannedStep> normalizePlan(List<PlannedStep> plannedSteps) {
        if (plannedSteps == null || plannedSteps.isEmpty()) {
            throw new IllegalArgumentException("Planned step list must not be empty");
        }
        List<PlannedStep> copies = new ArrayList<>(plannedSteps.size());
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < plannedSteps.size(); i++) {
            PlannedStep step = plannedSteps.get(i).toBuilder().build();
            if (step.getIndex() <= 0) {
                step.setIndex(i + 1);
            }
            if (step.getName() == null || step.getName().isBlank()) {
                throw new IllegalArgumentException("Planned step " + step.getIndex() + " has no name");
            }
            if (step.getDisplayName() == null) {
                step.setDisplayName(step.getName());
            }
            if (!seen.add(step.getIndex())) {
                throw new IllegalArgumentException("Duplicate planned step index: " + step.getIndex());
            }
            copies.add(step);
        }
        copies.sort((a, b) -> Integer.compare(a.getIndex(), b.getIndex()));
        return Collections.unmodifiableList(copies);
    }
}
