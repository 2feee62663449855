package com.hardware.cdc.report;

import com.hardware.cdc.analysis.AnalysisReport;

/**
 * Entry point for turning an {@link AnalysisReport} into text.
 */
public class ReportFormatter {

    private final TextReportRenderer textRenderer;
    private final JsonReportRenderer jsonRenderer;

    public ReportFormatter() {
        this(new TextReportRenderer(), new JsonReportRenderer());
    }

    public ReportFormatter(TextReportRenderer textRenderer, JsonReportRenderer jsonRenderer) {
        this.textRenderer = textRenderer;
        this.jsonRenderer = jsonRenderer;
    }

    public String format(AnalysisReport report, String format) {
        ReportFormat resolved = ReportFormat.fromId(format)
                .orElseThrow(() -> new IllegalArgumentException("unsupported report format: " + format));
        return format(report, resolved);
    }

    public String format(AnalysisReport report, ReportFormat format) {
        return switch (format) {
            case TEXT -> textRenderer.render(report);
            case JSON -> jsonRenderer.render(report);
        };
    }
}
