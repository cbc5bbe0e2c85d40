package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {

    PENDING, RUNNING, COMPLETED, FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static StepStatus fromWire(String value) {
        return valueOf(value.toUpperCase());
    }
}
