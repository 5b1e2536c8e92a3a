package com.impact.apidiff.service;

import com.impact.apidiff.api.model.AnalysisReport;

/**
 * Receives the finished report of a run. Formatting and destination are up to the implementation.
 */
public interface ReportSink {

    void publish(AnalysisReport report);
}
