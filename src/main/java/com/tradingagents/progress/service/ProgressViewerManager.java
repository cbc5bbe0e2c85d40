package com.tradingagents.progress.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.progress.dto.TaskProgress;
import com.tradingagents.progress.dto.ViewerMessage;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.Topics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans task.progress and task.status envelopes out to dashboard WebSocket connections.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressViewerManager {

    private final ObjectMapper objectMapper;
    private final MessageRouter router;
    private final TrackerRegistry trackerRegistry;
    private final Clock clock;

    // analysisId -> viewer connections
    private final Map<String, Set<WebSocketSession>> viewers = new ConcurrentHashMap<>();

    private final List<MessageRouter.Subscription> subscriptions = new ArrayList<>();

    @PostConstruct
    public void subscribe() {
        router.subscribe(MessageKind.TASK_PROGRESS, this::forward, null).ifPresent(subscriptions::add);
        router.subscribe(MessageKind.TASK_STATUS, this::forward, null).ifPresent(subscriptions::add);
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(router::unsubscribe);
        subscriptions.clear();
    }

    /**
     * Register a viewer connection
     */
    public boolean registerViewer(String analysisId, WebSocketSession session) {
        if (!Topics.isValidAnalysisId(analysisId)) {
            log.warn("Viewer {} asked for invalid analysis id '{}'", session.getId(), analysisId);
            return false;
        }
        viewers.computeIfAbsent(analysisId, id -> ConcurrentHashMap.newKeySet()).add(session);
        log.info("Viewer registered: analysis={}, viewerId={}", analysisId, session.getId());
        return true;
    }

    public void unregisterViewer(String analysisId, WebSocketSession session) {
        Set<WebSocketSession> set = viewers.get(analysisId);
        if (set != null) {
            set.remove(session);
            viewers.computeIfPresent(analysisId, (id, s) -> s.isEmpty() ? null : s);
        }
        log.info("Viewer unregistered: analysis={}, viewerId={}", analysisId, session.getId());
    }

    /**
     * Broadcast message to all viewers of an analysis
     */
    public void broadcastToViewers(String analysisId, String jsonPayload) {
        Set<WebSocketSession> set = viewers.get(analysisId);
        if (set == null) {
            return;
        }

        set.removeIf(viewer -> !viewer.isOpen());
        set.forEach(viewer -> send(viewer, jsonPayload));
    }

    /**
     * Send current status and progress to a new viewer
     */
    public void sendSnapshot(String analysisId, WebSocketSession viewer) {
        Optional<ProgressTracker> tracker = trackerRegistry.lookup(analysisId);
        try {
            if (tracker.isEmpty()) {
                send(viewer, objectMapper.writeValueAsString(ViewerMessage.builder()
                        .type("error")
                        .analysisId(analysisId)
                        .message("Analysis not found")
                        .build()));
                return;
            }

            TaskProgress progress = tracker.get().progress();
            double now = Envelope.epochSeconds(clock);
            Envelope status = Envelope.build(MessageKind.TASK_STATUS,
                    TaskMessageProducer.statusPayload(analysisId, progress.getStatus(), progress.getLastMessage(), now),
                    clock);
            Envelope progressEnvelope = Envelope.build(MessageKind.TASK_PROGRESS,
                    TaskMessageProducer.progressPayload(progress), clock);

            send(viewer, objectMapper.writeValueAsString(status));
            send(viewer, objectMapper.writeValueAsString(progressEnvelope));
            log.info("Sent snapshot to viewer: analysis={}, status={}", analysisId, progress.getStatus().wireName());
        } catch (Exception e) {
            log.error("Failed to send snapshot: analysis={}", analysisId, e);
        }
    }

    /**
     * Handle disconnect
     */
    public void handleDisconnect(WebSocketSession session) {
        viewers.values().forEach(set -> set.remove(session));
        viewers.entrySet().removeIf(entry -> entry.getValue().isEmpty());
    }

    public ViewerStats getStats() {
        int totalViewers = viewers.values().stream()
                .mapToInt(Set::size)
                .sum();
        return new ViewerStats(viewers.size(), totalViewers);
    }

    public record ViewerStats(int watchedAnalyses, int totalViewers) {}

    void forward(Envelope envelope) {
        String analysisId = envelope.analysisId();
        Set<WebSocketSession> set = viewers.get(analysisId);
        if (set == null || set.isEmpty()) {
            return;
        }
        try {
            broadcastToViewers(analysisId, objectMapper.writeValueAsString(envelope));
        } catch (IOException e) {
            log.error("Failed to encode {} for viewers: analysis={}", envelope.type().wireName(), analysisId, e);
        }
    }

    private void send(WebSocketSession viewer, String json) {
        try {
            synchronized (viewer) {
                if (viewer.isOpen()) {
                    viewer.sendMessage(new TextMessage(json));
                }
            }
        } catch (IOException e) {
            log.error("Failed to send to viewer {}", viewer.getId(), e);
        }
    }
}
