package com.hardware.cdc.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.hardware.cdc.report.ReportFormat;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run the analysis. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    List<Path> inputFiles;
    ReportFormat format;
    Path outputFile;
}
