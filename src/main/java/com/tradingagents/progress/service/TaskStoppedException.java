package com.tradingagents.progress.service;

/**
 * Thrown to the pipeline when it tries to run a module of a stopped analysis.
 */
public class TaskStoppedException extends RuntimeException {

    private final String analysisId;

    public TaskStoppedException(String analysisId, String moduleName) {
        super("Analysis " + analysisId + " was stopped before module " + moduleName);
        this.analysisId = analysisId;
    }

    public String getAnalysisId() {
        return analysisId;
    }
}
