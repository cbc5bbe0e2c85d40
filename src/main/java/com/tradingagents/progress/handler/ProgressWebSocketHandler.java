package com.tradingagents.progress.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.progress.dto.ViewerMessage;
import com.tradingagents.progress.service.ProgressViewerManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Dashboard connections. Clients pick the analyses they watch; progress arrives as bus envelopes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final ProgressViewerManager viewerManager;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("Progress WebSocket connected: id={}, remote={}",
                session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage textMessage) {
        try {
            ViewerMessage message = objectMapper.readValue(textMessage.getPayload(), ViewerMessage.class);
            log.debug("Received viewer message: type={}, analysis={}", message.getType(), message.getAnalysisId());

            if (message.getType() == null) {
                log.warn("Viewer message without type: session={}", session.getId());
                return;
            }
            switch (message.getType()) {
                case "watchAnalysis" -> handleWatch(session, message);
                case "unwatchAnalysis" -> viewerManager.unregisterViewer(message.getAnalysisId(), session);
                default -> log.warn("Unknown viewer message type: {}", message.getType());
            }
        } catch (Exception e) {
            log.error("Failed to handle viewer message", e);
        }
    }

    private void handleWatch(WebSocketSession session, ViewerMessage message) throws IOException {
        String analysisId = message.getAnalysisId();
        if (!viewerManager.registerViewer(analysisId, session)) {
            reply(session, ViewerMessage.builder()
                    .type("error")
                    .analysisId(analysisId)
                    .message("Invalid analysis id")
                    .build());
            return;
        }
        reply(session, ViewerMessage.builder()
                .type("watching")
                .analysisId(analysisId)
                .build());
        viewerManager.sendSnapshot(analysisId, session);
    }

    private void reply(WebSocketSession session, ViewerMessage message) throws IOException {
        String json = objectMapper.writeValueAsString(message);
        synchronized (session) {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(json));
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Progress WebSocket disconnected: id={}, status={}", session.getId(), status);
        viewerManager.handleDisconnect(session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Progress WebSocket transport error: id={}", session.getId(), exception);
    }
}
