package com.tradingagents.progress.dto;

import com.tradingagents.progress.message.TaskStatus;

/**
 * Outcome of pause/resume/stop. A rejected call leaves the task unchanged.
 */
public record ControlResult(boolean accepted, TaskStatus status, String message) {

    public static ControlResult accepted(TaskStatus status, String message) {
        return new ControlResult(true, status, message);
    }

    public static ControlResult rejected(TaskStatus status, String message) {
        return new ControlResult(false, status, message);
    }
}
