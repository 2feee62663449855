package com.hardware.cdc.core;

import java.util.List;

import com.hardware.cdc.analysis.AnalysisReport;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a completed analysis run.
 */
@Value
@Builder
public class AnalysisResult {
    AnalysisReport report;
    String renderedReport;
    int filesParsed;
    int modulesAnalyzed;
    int registersAnalyzed;
    List<String> warnings;
}
