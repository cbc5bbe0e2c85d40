package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the plan the pipeline supplies before it starts. Immutable once registered.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlannedStep {
    private int index;              // 1-based position in the plan
    private String name;            // module name reported by the pipeline, e.g. market_analyst
    private String displayName;
    private String description;
    private String phase;           // preparation, analyst, debate, trading, risk_assessment, post_processing
    private Integer round;          // debate round, if any
    private String role;            // debate role, if any
}
