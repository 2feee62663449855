package com.hardware.cdc.report;

import com.hardware.cdc.analysis.AnalysisReport;
import com.hardware.cdc.analysis.AnalysisRule;
import com.hardware.cdc.analysis.ClockDomain;
import com.hardware.cdc.analysis.Crossing;
import com.hardware.cdc.analysis.CrossingReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TextReportRenderer.
 */
class TextReportRendererTest {

    private final TextReportRenderer renderer = new TextReportRenderer();

    @Test
    void testRenderDomainsAndCrossings() {
        AnalysisReport report = new AnalysisReport(
                List.of(new ClockDomain("clk_a", new TreeSet<>(List.of("src_q"))),
                        new ClockDomain("clk_b", new TreeSet<>(List.of("stage1", "stage2")))),
                List.of(crossing("src_q", "d", null, "clk_a", false, CrossingReason.COMBINATIONAL_PATH),
                        crossing("stage1", "src_q", "clk_a", "clk_b", true, CrossingReason.TWO_STAGE_SYNCHRONIZER)),
                List.of());

        assertThat(renderer.render(report)).isEqualTo("""
                Clock Domains:
                  clk_a: src_q
                  clk_b: stage1, stage2

                Crossings:
                  - top.src_q <= d (comb->clk_a): VIOLATION [combinational path]
                  - top.stage1 <= src_q (clk_a->clk_b): OK [two-stage synchronizer]""");
    }

    @Test
    void testDisabledRuleShowsOk() {
        AnalysisReport report = new AnalysisReport(
                List.of(),
                List.of(crossing("y", "q", "clk", null, false, CrossingReason.ASYNC_SOURCE)),
                List.of(AnalysisRule.UNSAFE_CROSSING.getId()));

        assertThat(renderer.render(report))
                .contains("  - top.y <= q (clk->comb): OK [async source]");
    }

    @Test
    void testRenderEmptyReport() {
        AnalysisReport report = new AnalysisReport(List.of(), List.of(), List.of());

        assertThat(renderer.render(report)).isEqualTo("""
                Clock Domains:
                  (none detected)

                Crossings:
                  (none detected)""");
    }

    static Crossing crossing(String register, String signal, String source, String target,
                             boolean safe, CrossingReason reason) {
        return Crossing.builder()
                .module("top")
                .register(register)
                .signal(signal)
                .sourceDomain(source)
                .targetDomain(target)
                .safe(safe)
                .reason(reason)
                .rule(AnalysisRule.UNSAFE_CROSSING.getId())
                .build();
    }
}
