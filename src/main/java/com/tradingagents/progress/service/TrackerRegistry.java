package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.ControlResult;
import com.tradingagents.progress.dto.PlannedStep;
import com.tradingagents.progress.dto.TaskState;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.TaskStatus;
import com.tradingagents.progress.message.Topics;
import com.tradingagents.progress.store.TaskStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Binds analysis ids to live trackers and subscribes each tracker to its job's module topics.
 * A lookup miss is a normal outcome: the job is unknown to this process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackerRegistry {

    private static final List<MessageKind> MODULE_KINDS =
            List.of(MessageKind.MODULE_START, MessageKind.MODULE_COMPLETE, MessageKind.MODULE_ERROR);

    private final MessageRouter router;
    private final TaskMessageProducer producer;
    private final TaskStateStore stateStore;
    private final ProgressWeightingPolicy weightingPolicy;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    // analysisId -> entry, guarded by lock
    private final Map<String, Entry> trackers = new HashMap<>();

    private record Entry(ProgressTracker tracker, List<MessageRouter.Subscription> subscriptions) {
    }

    /**
     * Create and subscribe a tracker. Registering an id twice returns the existing tracker.
     *
     * @throws IllegalArgumentException for an invalid id or plan
     */
    public ProgressTracker register(String analysisId, List<PlannedStep> plannedSteps) {
        ProgressTracker tracker;
        lock.lock();
        try {
            Entry existing = trackers.get(analysisId);
            if (existing != null) {
                log.info("Tracker already registered: analysis={}", analysisId);
                return existing.tracker();
            }
            tracker = ProgressTracker.create(analysisId, plannedSteps, producer, stateStore, weightingPolicy, clock);
            attach(tracker);
        } finally {
            lock.unlock();
        }
        tracker.announce();
        return tracker;
    }

    public Optional<ProgressTracker> find(String analysisId) {
        lock.lock();
        try {
            Entry entry = trackers.get(analysisId);
            return entry != null ? Optional.of(entry.tracker()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live tracker, or one rebuilt from the state store if this process has none.
     * A rebuilt tracker of a finished job stays out of the registry and has no subscriptions.
     */
    public Optional<ProgressTracker> lookup(String analysisId) {
        Optional<ProgressTracker> live = find(analysisId);
        return live.isPresent() ? live : restore(analysisId);
    }

    public Optional<ProgressTracker> restore(String analysisId) {
        if (!Topics.isValidAnalysisId(analysisId)) {
            return Optional.empty();
        }
        lock.lock();
        try {
            Entry existing = trackers.get(analysisId);
            if (existing != null) {
                return Optional.of(existing.tracker());
            }
            Optional<TaskState> state = stateStore.load(analysisId);
            if (state.isEmpty()) {
                return Optional.empty();
            }
            ProgressTracker tracker = ProgressTracker.restore(state.get(), producer, stateStore, weightingPolicy, clock);
            if (tracker.isTerminal()) {
                // Finished jobs take no more events, so they are served detached
                return Optional.of(tracker);
            }
            attach(tracker);
            return Optional.of(tracker);
        } catch (IllegalArgumentException e) {
            log.warn("Persisted state unusable: analysis={}, error={}", analysisId, e.getMessage());
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the tracker and its subscriptions. Persisted state is kept unless {@code purge} is set.
     */
    public boolean unregister(String analysisId, boolean purge) {
        Entry entry;
        lock.lock();
        try {
            entry = trackers.remove(analysisId);
        } finally {
            lock.unlock();
        }
        if (purge) {
            stateStore.delete(analysisId);
        }
        if (entry == null) {
            return false;
        }
        entry.subscriptions().forEach(router::unsubscribe);
        log.info("Tracker unregistered: analysis={}, purge={}", analysisId, purge);
        return true;
    }

    public boolean unregister(String analysisId) {
        return unregister(analysisId, false);
    }

    public Optional<ControlResult> pause(String analysisId) {
        return control(analysisId, ProgressTracker::pause);
    }

    public Optional<ControlResult> resume(String analysisId) {
        return control(analysisId, ProgressTracker::resume);
    }

    public Optional<ControlResult> stop(String analysisId) {
        return control(analysisId, ProgressTracker::stop);
    }

    public Optional<ControlResult> markFailed(String analysisId, String error) {
        return control(analysisId, tracker -> tracker.markFailed(error));
    }

    public boolean recordToolCall(String analysisId, String moduleName, String toolName, double durationSeconds) {
        Optional<ProgressTracker> tracker = find(analysisId);
        tracker.ifPresentOrElse(
                t -> t.recordToolCall(moduleName, toolName, durationSeconds, null),
                () -> log.debug("Tool call for unknown analysis ignored: analysis={}", analysisId));
        return tracker.isPresent();
    }

    /**
     * Evict trackers that ended more than {@code retention} ago, together with their stored state.
     *
     * @return number of trackers evicted
     */
    public int cleanupFinished(Duration retention) {
        double cutoff = clock.millis() / 1000.0 - retention.toSeconds();
        List<String> expired = new ArrayList<>();
        lock.lock();
        try {
            trackers.forEach((id, entry) -> {
                Double endedAt = entry.tracker().endedAt();
                if (entry.tracker().isTerminal() && endedAt != null && endedAt < cutoff) {
                    expired.add(id);
                }
            });
        } finally {
            lock.unlock();
        }
        expired.forEach(id -> unregister(id, true));
        return expired.size();
    }

    public Stats getStats() {
        List<ProgressTracker> snapshot = new ArrayList<>();
        lock.lock();
        try {
            trackers.values().forEach(entry -> snapshot.add(entry.tracker()));
        } finally {
            lock.unlock();
        }
        int running = 0;
        int paused = 0;
        int finished = 0;
        for (ProgressTracker tracker : snapshot) {
            TaskStatus status = tracker.status();
            if (status == TaskStatus.RUNNING) {
                running++;
            } else if (status == TaskStatus.PAUSED) {
                paused++;
            } else if (status.isTerminal()) {
                finished++;
            }
        }
        return new Stats(snapshot.size(), running, paused, finished);
    }

    public record Stats(int totalTrackers, int running, int paused, int finished) {}

    private Optional<ControlResult> control(String analysisId, Function<ProgressTracker, ControlResult> action) {
        return lookup(analysisId).map(tracker -> {
            ControlResult result = action.apply(tracker);
            if (!result.accepted()) {
                log.warn("Control rejected: analysis={}, status={}, reason={}",
                        analysisId, result.status().wireName(), result.message());
            }
            return result;
        });
    }

    // Caller holds lock
    private void attach(ProgressTracker tracker) {
        List<MessageRouter.Subscription> subscriptions = new ArrayList<>();
        for (MessageKind kind : MODULE_KINDS) {
            router.subscribe(kind, tracker::onModuleEvent, Topics.topicFor(kind, tracker.getAnalysisId()))
                    .ifPresentOrElse(subscriptions::add,
                            () -> log.warn("Tracker not subscribed: analysis={}, kind={}",
                                    tracker.getAnalysisId(), kind.wireName()));
        }
        trackers.put(tracker.getAnalysisId(), new Entry(tracker, subscriptions));
        log.info("Tracker registered: analysis={}, steps={}, subscriptions={}",
                tracker.getAnalysisId(), tracker.plannedSteps().size(), subscriptions.size());
    }
}
