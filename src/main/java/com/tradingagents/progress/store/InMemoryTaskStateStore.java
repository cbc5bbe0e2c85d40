package com.tradingagents.progress.store;

import com.tradingagents.progress.dto.TaskState;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps states for the lifetime of the process only.
 */
public class InMemoryTaskStateStore implements TaskStateStore {

    private final Map<String, TaskState> states = new ConcurrentHashMap<>();

    @Override
    public void save(TaskState state) {
        states.put(state.getAnalysisId(), state);
    }

    @Override
    public Optional<TaskState> load(String analysisId) {
        return Optional.ofNullable(states.get(analysisId));
    }

    @Override
    public void delete(String analysisId) {
        states.remove(analysisId);
    }

    @Override
    public String name() {
        return "memory";
    }
}
