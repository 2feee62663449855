package com.hardware.cdc.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.core.AnalysisResult;
import com.hardware.cdc.core.context.AnalyzerConfig;

/**
 * Responsible only for logging the run summary of the analyzer.
 * The report itself goes to standard output or the output file.
 */
public class AnalysisResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultsPrinter.class);

    public void printBanner(AnalyzerConfig config) {
        log.info("=================================================");
        log.info("CDC Analyzer");
        log.info("=================================================");
        log.info("Input Files: {}", config.getInputFiles().size());
        for (Path file : config.getInputFiles()) {
            log.debug("  {}", file);
        }
        log.info("Report Format: {}", config.getFormat().id());
        log.info("Output: {}", config.getOutputFile() != null ? config.getOutputFile().toAbsolutePath() : "stdout");
        if (!config.getDisabledRules().isEmpty()) {
            log.info("Disabled Rules: {}", String.join(", ", config.getDisabledRules()));
        }
        log.info("=================================================");
    }

    public void printSummary(AnalysisResult result) {
        long violations = result.getReport().violations().size();

        log.info("=================================================");
        log.info(violations == 0 ? "ANALYSIS PASSED" : "ANALYSIS FOUND VIOLATIONS");
        log.info("=================================================");
        log.info("Files Parsed: {}", result.getFilesParsed());
        log.info("Modules Analyzed: {}", result.getModulesAnalyzed());
        log.info("Registers Analyzed: {}", result.getRegistersAnalyzed());
        log.info("Clock Domains: {}", result.getReport().getClockDomains().size());
        log.info("Crossings: {}", result.getReport().getCrossings().size());
        log.info("Violations: {}", violations);
        if (!result.getWarnings().isEmpty()) {
            log.info("Warnings: {}", result.getWarnings().size());
        }
        log.info("=================================================");
    }

    public void printFailure(String summary, List<String> problems) {
        log.error("Analysis failed: {}", summary);
        for (String problem : problems) {
            log.error("  {}", problem);
        }
    }
}
