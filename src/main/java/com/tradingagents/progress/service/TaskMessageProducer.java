package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.TaskProgress;
import com.tradingagents.progress.message.Envelope;
import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.ModuleEvent;
import com.tradingagents.progress.message.PayloadSchema;
import com.tradingagents.progress.message.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One method per message kind. Each assembles the required payload, merges the optional
 * extension fields and hands a single envelope to the router. Delivery to subscribers
 * may be asynchronous depending on the bus.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskMessageProducer {

    private final MessageRouter router;
    private final Clock clock;

    public boolean publishProgress(TaskProgress progress) {
        return publishProgress(progress, Map.of());
    }

    public boolean publishProgress(TaskProgress progress, Map<String, ?> extensions) {
        return send(MessageKind.TASK_PROGRESS, progressPayload(progress), extensions);
    }

    public boolean publishStatus(String analysisId, TaskStatus status, String message) {
        return publishStatus(analysisId, status, message, Map.of());
    }

    public boolean publishStatus(String analysisId, TaskStatus status, String message, Map<String, ?> extensions) {
        return send(MessageKind.TASK_STATUS, statusPayload(analysisId, status, message, Envelope.epochSeconds(clock)),
                extensions);
    }

    public boolean publishModuleStart(String analysisId, String moduleName, String stockSymbol) {
        return publishModuleStart(analysisId, moduleName, stockSymbol, Map.of());
    }

    public boolean publishModuleStart(String analysisId, String moduleName, String stockSymbol,
                                      Map<String, ?> extensions) {
        return send(MessageKind.MODULE_START, modulePayload(analysisId, moduleName, ModuleEvent.START, stockSymbol),
                extensions);
    }

    public boolean publishModuleComplete(String analysisId, String moduleName, String stockSymbol, double duration) {
        return publishModuleComplete(analysisId, moduleName, stockSymbol, duration, Map.of());
    }

    public boolean publishModuleComplete(String analysisId, String moduleName, String stockSymbol, double duration,
                                         Map<String, ?> extensions) {
        Map<String, Object> payload = modulePayload(analysisId, moduleName, ModuleEvent.COMPLETE, stockSymbol);
        payload.put("duration", duration);
        return send(MessageKind.MODULE_COMPLETE, payload, extensions);
    }

    public boolean publishModuleError(String analysisId, String moduleName, String stockSymbol, String errorMessage) {
        return publishModuleError(analysisId, moduleName, stockSymbol, errorMessage, Map.of());
    }

    public boolean publishModuleError(String analysisId, String moduleName, String stockSymbol, String errorMessage,
                                      Map<String, ?> extensions) {
        Map<String, Object> payload = modulePayload(analysisId, moduleName, ModuleEvent.ERROR, stockSymbol);
        payload.put("error_message", errorMessage != null ? errorMessage : "");
        return send(MessageKind.MODULE_ERROR, payload, extensions);
    }

    public static Map<String, Object> progressPayload(TaskProgress progress) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadSchema.ANALYSIS_ID, progress.getAnalysisId());
        payload.put("current_step", progress.getCurrentStep());
        payload.put("total_steps", progress.getTotalSteps());
        payload.put("progress_percentage", progress.getProgressPercentage());
        payload.put("current_step_name", nullToEmpty(progress.getCurrentStepName()));
        payload.put("current_step_description", nullToEmpty(progress.getCurrentStepDescription()));
        payload.put("elapsed_time", progress.getElapsedTime());
        payload.put("remaining_time", progress.getRemainingTime());
        payload.put("last_message", nullToEmpty(progress.getLastMessage()));
        if (progress.getStatus() != null) {
            payload.put("status", progress.getStatus().wireName());
        }
        return payload;
    }

    public static Map<String, Object> statusPayload(String analysisId, TaskStatus status, String message,
                                                    double timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadSchema.ANALYSIS_ID, analysisId);
        payload.put("status", status.wireName());
        payload.put("message", nullToEmpty(message));
        payload.put("timestamp", timestamp);
        return payload;
    }

    private static Map<String, Object> modulePayload(String analysisId, String moduleName, ModuleEvent event,
                                                     String stockSymbol) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadSchema.ANALYSIS_ID, analysisId);
        payload.put("module_name", moduleName);
        payload.put("event", event.wireName());
        if (stockSymbol != null) {
            payload.put(PayloadSchema.STOCK_SYMBOL, stockSymbol);
        }
        return payload;
    }

    private boolean send(MessageKind kind, Map<String, Object> payload, Map<String, ?> extensions) {
        boolean published = router.publish(kind, PayloadSchema.withExtensions(kind, payload, extensions));
        if (!published) {
            log.debug("{} not delivered: analysis={}", kind.wireName(), payload.get(PayloadSchema.ANALYSIS_ID));
        }
        return published;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
