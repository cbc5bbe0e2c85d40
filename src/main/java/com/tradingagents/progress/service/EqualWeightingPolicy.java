package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.PlannedStep;

import java.util.List;
import java.util.Set;

/**
 * Every planned step counts the same.
 */
public class EqualWeightingPolicy implements ProgressWeightingPolicy {

    @Override
    public double progressPercentage(List<PlannedStep> plannedSteps, Set<Integer> completedIndexes) {
        if (plannedSteps.isEmpty()) {
            return 0.0;
        }
        long completed = plannedSteps.stream()
                .filter(step -> completedIndexes.contains(step.getIndex()))
                .count();
        return Math.min(100.0, completed * 100.0 / plannedSteps.size());
    }

    @Override
    public String name() {
        return "equal";
    }
}
