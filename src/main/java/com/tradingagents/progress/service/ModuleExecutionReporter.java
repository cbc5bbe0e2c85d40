package com.tradingagents.progress.service;

import com.tradingagents.progress.message.MessageKind;
import com.tradingagents.progress.message.PayloadSchema;
import com.tradingagents.progress.message.SchemaViolationException;
import com.tradingagents.progress.message.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Pipeline-side helper that reports module lifecycle events around a module call.
 * <p>
 * Before running, the call waits while the analysis is paused and refuses to run once it
 * is stopped. Reporting failures are logged and never change the module's own outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModuleExecutionReporter {

    private final TaskMessageProducer producer;
    private final TrackerRegistry trackerRegistry;

    @Value("${progress.pause.max-wait-seconds:3600}")
    private long maxPauseWaitSeconds = 3600;

    /**
     * Run {@code module}, publishing module.start before and module.complete or module.error after it.
     * A failure of the module is reported and rethrown unchanged.
     *
     * @throws TaskStoppedException if the analysis is stopped before the module starts
     */
    public <T> T run(String analysisId, String moduleName, String stockSymbol, Callable<T> module) throws Exception {
        return run(analysisId, moduleName, stockSymbol, Map.of(), module);
    }

    public <T> T run(String analysisId, String moduleName, String stockSymbol, Map<String, ?> extensions,
                     Callable<T> module) throws Exception {
        Map<String, ?> reported = checkedExtensions(analysisId, moduleName, extensions);
        checkpoint(analysisId, moduleName);

        report(MessageKind.MODULE_START, analysisId,
                () -> producer.publishModuleStart(analysisId, moduleName, stockSymbol, reported));
        long startNanos = System.nanoTime();
        T result;
        try {
            result = module.call();
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            report(MessageKind.MODULE_ERROR, analysisId,
                    () -> producer.publishModuleError(analysisId, moduleName, stockSymbol, message, reported));
            log.warn("Module failed: analysis={}, module={}, error={}", analysisId, moduleName, message);
            throw e;
        }
        double duration = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        report(MessageKind.MODULE_COMPLETE, analysisId,
                () -> producer.publishModuleComplete(analysisId, moduleName, stockSymbol, duration, reported));
        log.debug("Module finished: analysis={}, module={}, duration={}s", analysisId, moduleName, duration);
        return result;
    }

    /**
     * Report a tool invocation inside the running module.
     */
    public void reportToolCall(String analysisId, String moduleName, String toolName, Duration duration) {
        trackerRegistry.recordToolCall(analysisId, moduleName, toolName, duration.toMillis() / 1000.0);
    }

    // Extensions invalid for any module event are dropped for the whole run
    private Map<String, ?> checkedExtensions(String analysisId, String moduleName, Map<String, ?> extensions) {
        try {
            PayloadSchema.validateExtensions(MessageKind.MODULE_START, extensions);
            PayloadSchema.validateExtensions(MessageKind.MODULE_COMPLETE, extensions);
            PayloadSchema.validateExtensions(MessageKind.MODULE_ERROR, extensions);
            return extensions;
        } catch (SchemaViolationException e) {
            log.error("Dropping module event extensions: analysis={}, module={}, error={}",
                    analysisId, moduleName, e.getMessage());
            return Map.of();
        }
    }

    private void report(MessageKind kind, String analysisId, Runnable publish) {
        try {
            publish.run();
        } catch (SchemaViolationException e) {
            log.error("{} not reported: analysis={}, error={}", kind.wireName(), analysisId, e.getMessage());
        }
    }

    // Wait out a pause, refuse to run after stop
    private void checkpoint(String analysisId, String moduleName) {
        Optional<ProgressTracker> tracker = trackerRegistry.find(analysisId);
        if (tracker.isEmpty()) {
            return;
        }
        TaskStatus status = tracker.get().awaitIfPaused(Duration.ofSeconds(maxPauseWaitSeconds));
        if (status == TaskStatus.PAUSED) {
            log.warn("Still paused after {}s, running module anyway: analysis={}, module={}",
                    maxPauseWaitSeconds, analysisId, moduleName);
        }
        if (status == TaskStatus.STOPPED) {
            throw new TaskStoppedException(analysisId, moduleName);
        }
    }
}
