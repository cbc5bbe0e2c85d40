package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Execution record of one planned step. Carries the planned attributes as well,
 * so a history entry is self-describing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepRecord {
    private int index;
    private String name;
    private String displayName;
    private String description;
    private String phase;
    private Integer round;
    private String role;

    private StepStatus status;
    private Double startTime;           // epoch seconds
    private Double endTime;
    private double elapsedTime;         // seconds, paused intervals excluded
    private double toolTime;            // sum of tool_calling durations
    private Double reportedDuration;    // duration carried by module.complete
    private String errorMessage;
    private boolean fatal;              // error that fails the task

    @Builder.Default
    private List<StepEvent> events = new ArrayList<>();

    public static StepRecord placeholder(PlannedStep step) {
        return StepRecord.builder()
                .index(step.getIndex())
                .name(step.getName())
                .displayName(step.getDisplayName())
                .description(step.getDescription())
                .phase(step.getPhase())
                .round(step.getRound())
                .role(step.getRole())
                .status(StepStatus.PENDING)
                .build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public StepRecord copy() {
        List<StepEvent> eventCopies = new ArrayList<>();
        if (events != null) {
            events.forEach(e -> eventCopies.add(e.toBuilder().build()));
        }
        return toBuilder().events(eventCopies).build();
    }
}
