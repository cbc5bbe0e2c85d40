package com.tradingagents.progress.store;

import com.tradingagents.progress.dto.TaskState;

import java.util.Optional;

/**
 * Persistence of tracker state. Implementations log storage failures instead of throwing,
 * so a broken store never stops a job; the tracker keeps working from memory.
 */
public interface TaskStateStore {

    void save(TaskState state);

    Optional<TaskState> load(String analysisId);

    void delete(String analysisId);

    String name();
}
