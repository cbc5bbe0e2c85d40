package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.PlannedStep;

import java.util.List;
import java.util.Set;

/**
 * Turns the set of completed steps into a progress percentage.
 */
public interface ProgressWeightingPolicy {

    /**
     * @param plannedSteps       the full plan, never empty
     * @param completedIndexes   indexes of steps whose record is completed
     * @return percentage in [0, 100]
     */
    double progressPercentage(List<PlannedStep> plannedSteps, Set<Integer> completedIndexes);

    String name();
}
