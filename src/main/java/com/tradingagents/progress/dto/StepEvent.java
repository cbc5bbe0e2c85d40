package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepEvent {
    private Type type;
    private double timestamp;       // epoch seconds
    private String message;
    private Double duration;        // seconds, for tool_calling and complete
    private String toolName;        // tool_calling only

    public enum Type {
        START, TOOL_CALLING, COMPLETE, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Type fromWire(String value) {
            return valueOf(value.toUpperCase());
        }
    }
}
