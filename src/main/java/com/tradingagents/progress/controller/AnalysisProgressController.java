package com.tradingagents.progress.controller;

import com.tradingagents.progress.dto.AnalysisRegistration;
import com.tradingagents.progress.dto.ControlResult;
import com.tradingagents.progress.dto.PlannedStep;
import com.tradingagents.progress.dto.StepRecord;
import com.tradingagents.progress.service.MessageRouter;
import com.tradingagents.progress.service.PlannedStepCatalog;
import com.tradingagents.progress.service.ProgressTracker;
import com.tradingagents.progress.service.ProgressViewerManager;
import com.tradingagents.progress.service.TrackerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Query and control API for analysis progress.
 * Unknown analyses answer 404, rejected transitions 409.
 */
@Slf4j
@RestController
@RequestMapping("/api/analyses")
@RequiredArgsConstructor
public class AnalysisProgressController {

    private final TrackerRegistry trackerRegistry;
    private final PlannedStepCatalog plannedStepCatalog;
    private final ProgressViewerManager viewerManager;
    private final MessageRouter router;

    /**
     * Register an analysis before it runs.
     * Uses the explicit steps if given, otherwise generates the standard plan.
     */
    @PostMapping
    public ResponseEntity<?> register(@RequestBody AnalysisRegistration request) {
        String analysisId = request.getAnalysisId() != null && !request.getAnalysisId().isBlank()
                ? request.getAnalysisId()
                : "analysis_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);

        List<PlannedStep> steps = request.getSteps() != null && !request.getSteps().isEmpty()
                ? request.getSteps()
                : plannedStepCatalog.plan(request.getAnalysts(), request.getResearchDepth(),
                        request.getMaxDebateRounds());
        try {
            ProgressTracker tracker = trackerRegistry.register(analysisId, steps);
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "analysisId", tracker.getAnalysisId(),
                    "status", tracker.status(),
                    "totalSteps", tracker.plannedSteps().size()
            ));
        } catch (IllegalArgumentException e) {
            log.warn("Registration rejected: analysis={}, error={}", analysisId, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{analysisId}/status")
    public ResponseEntity<?> status(@PathVariable String analysisId) {
        return withTracker(analysisId, tracker -> ResponseEntity.ok(Map.of(
                "analysisId", analysisId,
                "status", tracker.status()
        )));
    }

    @GetMapping("/{analysisId}/current-step")
    public ResponseEntity<?> currentStep(@PathVariable String analysisId) {
        return withTracker(analysisId, tracker -> {
            Optional<StepRecord> step = tracker.currentStep();
            return step.<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.noContent().build());
        });
    }

    @GetMapping("/{analysisId}/history")
    public ResponseEntity<?> history(@PathVariable String analysisId) {
        return withTracker(analysisId, tracker -> ResponseEntity.ok(tracker.history()));
    }

    @GetMapping("/{analysisId}/planned-steps")
    public ResponseEntity<?> plannedSteps(@PathVariable String analysisId) {
        return withTracker(analysisId, tracker -> ResponseEntity.ok(tracker.plannedSteps()));
    }

    @GetMapping("/{analysisId}/progress")
    public ResponseEntity<?> progress(@PathVariable String analysisId) {
        return withTracker(analysisId, tracker -> ResponseEntity.ok(tracker.progress()));
    }

    @PostMapping("/{analysisId}/pause")
    public ResponseEntity<?> pause(@PathVariable String analysisId) {
        return control(analysisId, trackerRegistry.pause(analysisId));
    }

    @PostMapping("/{analysisId}/resume")
    public ResponseEntity<?> resume(@PathVariable String analysisId) {
        return control(analysisId, trackerRegistry.resume(analysisId));
    }

    @PostMapping("/{analysisId}/stop")
    public ResponseEntity<?> stop(@PathVariable String analysisId) {
        return control(analysisId, trackerRegistry.stop(analysisId));
    }

    /**
     * Non-recoverable failure reported by the pipeline.
     * Body: {"error": "..."}
     */
    @PostMapping("/{analysisId}/fail")
    public ResponseEntity<?> fail(@PathVariable String analysisId,
                                  @RequestBody(required = false) Map<String, String> body) {
        String error = body != null && body.get("error") != null ? body.get("error") : "Pipeline failure";
        return control(analysisId, trackerRegistry.markFailed(analysisId, error));
    }

    @DeleteMapping("/{analysisId}")
    public ResponseEntity<?> unregister(@PathVariable String analysisId,
                                        @RequestParam(defaultValue = "false") boolean purge) {
        if (!trackerRegistry.unregister(analysisId, purge)) {
            return notFound(analysisId);
        }
        return ResponseEntity.ok(Map.of("analysisId", analysisId, "unregistered", true));
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        TrackerRegistry.Stats stats = trackerRegistry.getStats();
        ProgressViewerManager.ViewerStats viewerStats = viewerManager.getStats();
        return Map.of(
                "trackers", stats,
                "viewers", viewerStats,
                "busEngine", router.engineType().configName(),
                "busConnected", router.isConnected()
        );
    }

    private ResponseEntity<?> withTracker(String analysisId, Function<ProgressTracker, ResponseEntity<?>> action) {
        return trackerRegistry.lookup(analysisId)
                .<ResponseEntity<?>>map(action)
                .orElseGet(() -> notFound(analysisId));
    }

    private ResponseEntity<?> control(String analysisId, Optional<ControlResult> result) {
        if (result.isEmpty()) {
            return notFound(analysisId);
        }
        ControlResult controlResult = result.get();
        return controlResult.accepted()
                ? ResponseEntity.ok(controlResult)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(controlResult);
    }

    private ResponseEntity<?> notFound(String analysisId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Analysis not found: " + analysisId));
    }
}
