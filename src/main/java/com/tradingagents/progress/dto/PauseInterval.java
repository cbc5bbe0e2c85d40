package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PauseInterval {
    private double startedAt;
    private Double endedAt;         // null while the pause lasts

    @JsonIgnore
    public boolean isOpen() {
        return endedAt == null;
    }

    /** Seconds of this pause that fall inside [from, to] */
    public double overlap(double from, double to) {
        double end = endedAt != null ? Math.min(endedAt, to) : to;
        return Math.max(0.0, end - Math.max(startedAt, from));
    }
}
