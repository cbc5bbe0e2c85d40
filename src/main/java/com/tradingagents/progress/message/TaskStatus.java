package com.tradingagents.progress.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {

    PENDING("pending"),
    RUNNING("running"),
    PAUSED("paused"),
    STOPPED("stopped"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        for (TaskStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    public static boolean isKnown(String value) {
        for (TaskStatus status : values()) {
            if (status.wireName.equals(value)) {
                return true;
            }
        }
        return false;
    }
}
