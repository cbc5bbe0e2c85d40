package com.tradingagents.progress.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Control frames exchanged with dashboard connections on /ws/progress.
 * Progress itself is pushed as bus envelopes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ViewerMessage {
    private String type;        // watchAnalysis, unwatchAnalysis, watching, error
    private String analysisId;
    private String message;
}
