package com.hardware.cdc.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.hardware.cdc.analysis.AnalysisReport;
import com.hardware.cdc.analysis.ClockDomain;
import com.hardware.cdc.analysis.Crossing;

/**
 * Renders the machine readable report. Keys are sorted at every level and
 * missing domains are written as {@code null}.
 */
public class JsonReportRenderer {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    public String render(AnalysisReport report) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("clock_domains", clockDomains(report));
        payload.put("crossings", crossings(report));
        payload.put("disabled_rules", new ArrayList<>(report.getDisabledRules()));
        return gson.toJson(payload);
    }

    private Map<String, List<String>> clockDomains(AnalysisReport report) {
        Map<String, List<String>> domains = new TreeMap<>();
        for (ClockDomain domain : report.getClockDomains()) {
            domains.put(domain.getName(), new ArrayList<>(domain.getRegisters()));
        }
        return domains;
    }

    private List<Map<String, Object>> crossings(AnalysisReport report) {
        List<Map<String, Object>> crossings = new ArrayList<>();
        for (Crossing crossing : report.getCrossings()) {
            Map<String, Object> entry = new TreeMap<>();
            entry.put("module", crossing.getModule());
            entry.put("reason", crossing.getReason().getLabel());
            entry.put("register", crossing.getRegister());
            entry.put("rule", crossing.getRule());
            entry.put("safe", crossing.isSafe());
            entry.put("signal", crossing.getSignal());
            entry.put("source_domain", crossing.getSourceDomain());
            entry.put("target_domain", crossing.getTargetDomain());
            crossings.add(entry);
        }
        return crossings;
    }
}
