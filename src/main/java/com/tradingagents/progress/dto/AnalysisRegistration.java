package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Job registration. Either an explicit plan or the analyst selection to generate one from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisRegistration {
    private String analysisId;
    private List<PlannedStep> steps;
    private List<String> analysts;          // market, fundamentals, news, social, ...
    private Integer researchDepth;          // 1 quick, 2 standard, 3 deep
    private Integer maxDebateRounds;
}
