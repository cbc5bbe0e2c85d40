package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradingagents.progress.message.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskProgress {
    private String analysisId;
    private TaskStatus status;
    private int currentStep;                // 0 before the first step starts
    private int totalSteps;
    private double progressPercentage;
    private String currentStepName;
    private String currentStepDescription;
    private double elapsedTime;
    private double remainingTime;
    private String lastMessage;
}
