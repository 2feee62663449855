package com.hardware.cdc.core.context;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import com.hardware.cdc.report.ReportFormat;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved settings for one analysis run.
 */
@Value
@Builder
public class AnalyzerConfig {
    @Singular
    List<Path> inputFiles;

    @Builder.Default
    ReportFormat format = ReportFormat.TEXT;

    /**
     * Where to write the report; {@code null} means the caller prints it.
     */
    Path outputFile;

    @Singular
    Set<String> disabledRules;
}
