package com.tradingagents.progress.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of message kinds carried on the bus.
 * STEP_UPDATE is reserved and has no producer yet.
 */
public enum MessageKind {

    TASK_PROGRESS("task.progress"),
    TASK_STATUS("task.status"),
    MODULE_START("module.start"),
    MODULE_COMPLETE("module.complete"),
    MODULE_ERROR("module.error"),
    STEP_UPDATE("step.update");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Topic prefix, e.g. "task/progress" */
    public String topicBase() {
        return wireName.replace('.', '/');
    }

    public boolean isModuleEvent() {
        return this == MODULE_START || this == MODULE_COMPLETE || this == MODULE_ERROR;
    }

    @JsonCreator
    public static MessageKind fromWire(String value) {
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown message kind: " + value);
    }
}
