package com.hardware.cdc.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hardware.cdc.analysis.AnalysisReport;
import com.hardware.cdc.analysis.ClockDomain;
import com.hardware.cdc.analysis.Crossing;
import com.hardware.cdc.report.exception.ReportRenderingException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the human readable report from {@code /templates/report.ftl}.
 *
 * A crossing shows {@code OK} when it is safe or its rule is disabled, and a
 * missing domain shows as {@code comb}.
 */
public class TextReportRenderer {

    private static final String TEMPLATE = "report.ftl";

    private final Configuration freemarkerConfig;

    public TextReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(AnalysisReport report) {
        Map<String, Object> model = new HashMap<>();
        model.put("domains", domainModel(report));
        model.put("crossings", crossingModel(report));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString().stripTrailing();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render text report: " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> domainModel(AnalysisReport report) {
        List<Map<String, Object>> domains = new ArrayList<>();
        for (ClockDomain domain : report.getClockDomains()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("name", domain.getName());
            entry.put("registers", new ArrayList<>(domain.getRegisters()));
            domains.add(entry);
        }
        return domains;
    }

    private List<Map<String, Object>> crossingModel(AnalysisReport report) {
        List<Map<String, Object>> crossings = new ArrayList<>();
        for (Crossing crossing : report.getCrossings()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("module", crossing.getModule());
            entry.put("register", crossing.getRegister());
            entry.put("signal", crossing.getSignal());
            entry.put("source", crossing.getSourceDomain() != null ? crossing.getSourceDomain() : "comb");
            entry.put("target", crossing.getTargetDomain() != null ? crossing.getTargetDomain() : "comb");
            entry.put("status", report.isReported(crossing) ? "VIOLATION" : "OK");
            entry.put("reason", crossing.getReason().getLabel());
            crossings.add(entry);
        }
        return crossings;
    }
}
