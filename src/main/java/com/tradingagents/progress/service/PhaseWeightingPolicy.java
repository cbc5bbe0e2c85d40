package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.PlannedStep;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Each step weighs as much as its phase. Analyst and debate steps usually dominate
 * the run time, so they move the bar further than bookkeeping steps.
 */
@Slf4j
public class PhaseWeightingPolicy implements ProgressWeightingPolicy {

    static final double DEFAULT_WEIGHT = 1.0;

    private final Map<String, Double> phaseWeights;

    public PhaseWeightingPolicy(Map<String, Double> phaseWeights) {
        this.phaseWeights = Collections.unmodifiableMap(new HashMap<>(phaseWeights));
    }

    /**
     * Parse "phase=weight,phase=weight". Malformed or negative entries are skipped.
     */
    public static PhaseWeightingPolicy fromConfig(String config) {
        Map<String, Double> weights = new HashMap<>();
        if (config != null && !config.isBlank()) {
            for (String pair : config.split(",")) {
                String[] parts = pair.split("=");
                if (parts.length != 2) {
                    log.warn("Ignoring malformed phase weight: '{}'", pair);
                    continue;
                }
                try {
                    double weight = Double.parseDouble(parts[1].trim());
                    if (weight < 0) {
                        log.warn("Ignoring negative phase weight: '{}'", pair);
                        continue;
                    }
                    weights.put(parts[0].trim(), weight);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring malformed phase weight: '{}'", pair);
                }
            }
        }
        return new PhaseWeightingPolicy(weights);
    }

    @Override
    public double progressPercentage(List<PlannedStep> plannedSteps, Set<Integer> completedIndexes) {
        double total = 0.0;
        double done = 0.0;
        for (PlannedStep step : plannedSteps) {
            double weight = weightOf(step.getPhase());
            total += weight;
            if (completedIndexes.contains(step.getIndex())) {
                done += weight;
            }
        }
        if (total <= 0.0) {
            return 0.0;
        }
        return Math.min(100.0, done * 100.0 / total);
    }

    double weightOf(String phase) {
        if (phase == null) {
            return DEFAULT_WEIGHT;
        }
        return phaseWeights.getOrDefault(phase, DEFAULT_WEIGHT);
    }

    @Override
    public String name() {
        return "phase";
    }
}
