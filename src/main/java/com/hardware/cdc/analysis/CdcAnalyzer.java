package com.hardware.cdc.analysis;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.design.DesignGraph;

/**
 * Runs clock domain derivation and crossing classification over a design.
 */
public class CdcAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(CdcAnalyzer.class);

    private final ClockDomainDeriver domainDeriver;
    private final CrossingClassifier crossingClassifier;

    public CdcAnalyzer() {
        this(new ClockDomainDeriver(), new CrossingClassifier());
    }

    public CdcAnalyzer(ClockDomainDeriver domainDeriver, CrossingClassifier crossingClassifier) {
        this.domainDeriver = domainDeriver;
        this.crossingClassifier = crossingClassifier;
    }

    public AnalysisReport analyze(DesignGraph graph) {
        return analyze(graph, List.of());
    }

    /**
     * Rule ids that match no rule are accepted and simply never match.
     */
    public AnalysisReport analyze(DesignGraph graph, Collection<String> disabledRules) {
        Objects.requireNonNull(graph, "graph");

        List<ClockDomain> domains = domainDeriver.derive(graph);
        List<Crossing> crossings = crossingClassifier.classify(graph);
        AnalysisReport report = new AnalysisReport(domains, crossings, disabledRules);

        for (String rule : report.getDisabledRules()) {
            if (AnalysisRule.fromId(rule).isEmpty()) {
                log.debug("Disabled rule '{}' matches no known rule", rule);
            }
        }
        log.info("Analysis found {} clock domains, {} crossings, {} violations",
                domains.size(), crossings.size(), report.violations().size());
        return report;
    }
}
