package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradingagents.progress.message.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a tracker needs to be rebuilt after a restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskState {
    private String analysisId;
    private TaskStatus status;
    private TaskStatus pendingOutcome;      // completed/failed reached while paused, applied on resume

    @Builder.Default
    private List<PlannedStep> plannedSteps = new ArrayList<>();

    @Builder.Default
    private List<StepRecord> stepRecords = new ArrayList<>();

    private double createdAt;
    private Double startedAt;
    private Double endedAt;

    @Builder.Default
    private List<PauseInterval> pauses = new ArrayList<>();

    private int currentStepIndex;
    private String lastMessage;
    private String errorMessage;
    private double updatedAt;
}
