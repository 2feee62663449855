package com.hardware.cdc.analysis;

import com.hardware.cdc.ast.SourceNode;
import com.hardware.cdc.core.context.ToolDiagnostics;
import com.hardware.cdc.design.DesignGraph;
import com.hardware.cdc.design.DesignGraphBuilder;
import com.hardware.cdc.parser.VerilogParser;
import com.hardware.cdc.parser.VerilogTokenizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CrossingClassifier.
 */
class CrossingClassifierTest {

    private final CrossingClassifier classifier = new CrossingClassifier();

    @Test
    void testInputPortIntoClockedRegister() {
        List<Crossing> crossings = classify("""
                module m(input clk, input d, output reg q);
                    always @(posedge clk) q <= d;
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getModule()).isEqualTo("m");
            assertThat(crossing.getSignal()).isEqualTo("d");
            assertThat(crossing.getRegister()).isEqualTo("q");
            assertThat(crossing.getSourceDomain()).isNull();
            assertThat(crossing.getTargetDomain()).isEqualTo("clk");
            assertThat(crossing.isSafe()).isFalse();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.COMBINATIONAL_PATH);
            assertThat(crossing.getRule()).isEqualTo("unsafe_crossing");
        });
    }

    @Test
    void testSameDomainDriversAreNotCrossings() {
        List<Crossing> crossings = classify("""
                module m;
                    reg a, b;
                    always @(posedge clk) begin
                        a <= b;
                        b <= a;
                    end
                endmodule
                """);

        assertThat(crossings).isEmpty();
    }

    @Test
    void testUnclockedToUnclockedIsNotACrossing() {
        assertThat(classify("module m; reg y; always @* y = a; endmodule")).isEmpty();
    }

    @Test
    void testClockedSourceWithoutSynchronizer() {
        List<Crossing> crossings = classify("""
                module m;
                    reg data, captured;
                    always @(posedge clk_a) data <= data;
                    always @(posedge clk_b) captured <= data;
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getRegister()).isEqualTo("captured");
            assertThat(crossing.getSourceDomain()).isEqualTo("clk_a");
            assertThat(crossing.getTargetDomain()).isEqualTo("clk_b");
            assertThat(crossing.isSafe()).isFalse();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.ASYNC_SOURCE);
        });
    }

    @Test
    void testTwoStageSynchronizerMarksFirstStageSafe() {
        List<Crossing> crossings = classify("""
                module m;
                    reg src_q, stage1, stage2;
                    always @(posedge clk_a) src_q <= src_q;
                    always @(posedge clk_b) begin
                        stage1 <= src_q;
                        stage2 <= stage1;
                    end
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getRegister()).isEqualTo("stage1");
            assertThat(crossing.getSignal()).isEqualTo("src_q");
            assertThat(crossing.isSafe()).isTrue();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.TWO_STAGE_SYNCHRONIZER);
        });
    }

    @Test
    void testSecondStageOnAnotherClockIsNotASynchronizer() {
        List<Crossing> crossings = classify("""
                module m;
                    reg src_q, stage1, stage2;
                    always @(posedge clk_a) src_q <= src_q;
                    always @(posedge clk_b) stage1 <= src_q;
                    always @(posedge clk_c) stage2 <= stage1;
                endmodule
                """);

        assertThat(crossings).extracting(Crossing::getRegister, Crossing::isSafe, Crossing::getReason)
                .containsExactly(
                        tuple("stage1", false, CrossingReason.ASYNC_SOURCE),
                        tuple("stage2", false, CrossingReason.ASYNC_SOURCE));
    }

    @Test
    void testSecondStageWithExtraDriverIsNotASynchronizer() {
        List<Crossing> crossings = classify("""
                module m;
                    reg src_q, stage1, stage2;
                    always @(posedge clk_a) src_q <= src_q;
                    always @(posedge clk_b) begin
                        stage1 <= src_q;
                        stage2 <= stage1 & enable;
                    end
                endmodule
                """);

        assertThat(crossings).filteredOn(crossing -> crossing.getRegister().equals("stage1"))
                .singleElement()
                .satisfies(crossing -> {
                    assertThat(crossing.isSafe()).isFalse();
                    assertThat(crossing.getReason()).isEqualTo(CrossingReason.ASYNC_SOURCE);
                });
    }

    @Test
    void testSingleBitStageOfWiderRegisterCountsAsSecondStage() {
        List<Crossing> crossings = classify("""
                module m;
                    reg src_q, stage1, other;
                    reg [1:0] r;
                    always @(posedge clk_a) src_q <= src_q;
                    always @(posedge clk_b) begin
                        other <= other;
                        stage1 <= src_q;
                        r <= {other, stage1};
                    end
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getRegister()).isEqualTo("stage1");
            assertThat(crossing.isSafe()).isTrue();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.TWO_STAGE_SYNCHRONIZER);
        });
    }

    @Test
    void testVectorSynchronizerPerBit() {
        List<Crossing> crossings = classify("""
                module m(input clk_dst, input rst_n, input async_in);
                    reg [1:0] sync;
                    always @(posedge clk_dst or negedge rst_n)
                        if (!rst_n) sync <= 2'b00;
                        else sync <= {sync[0], async_in};
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getRegister()).isEqualTo("sync[0]");
            assertThat(crossing.getSignal()).isEqualTo("async_in");
            assertThat(crossing.getSourceDomain()).isNull();
            assertThat(crossing.getTargetDomain()).isEqualTo("clk_dst");
            assertThat(crossing.isSafe()).isTrue();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.TWO_STAGE_SYNCHRONIZER);
        });
    }

    @Test
    void testClockedSourceIntoUnclockedRegister() {
        List<Crossing> crossings = classify("""
                module m;
                    reg q, y;
                    always @(posedge clk) q <= q;
                    always @* y = q;
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getRegister()).isEqualTo("y");
            assertThat(crossing.getSourceDomain()).isEqualTo("clk");
            assertThat(crossing.getTargetDomain()).isNull();
            assertThat(crossing.isSafe()).isFalse();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.ASYNC_SOURCE);
        });
    }

    @Test
    void testBitSelectResolvesToRegister() {
        List<Crossing> crossings = classify("""
                module m;
                    reg [1:0] r;
                    reg q;
                    always @(posedge clk_a) r <= r;
                    always @(posedge clk_b) q <= r[1];
                endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getSignal()).isEqualTo("r[1]");
            assertThat(crossing.getSourceDomain()).isEqualTo("clk_a");
        });
    }

    @Test
    void testSourcesResolveInsideOwningModuleOnly() {
        List<Crossing> crossings = classify("""
                module a; reg x; always @(posedge clk_a) x <= x; endmodule
                module b; reg y; always @(posedge clk_b) y <= x; endmodule
                """);

        assertThat(crossings).singleElement().satisfies(crossing -> {
            assertThat(crossing.getModule()).isEqualTo("b");
            assertThat(crossing.getSourceDomain()).isNull();
            assertThat(crossing.getReason()).isEqualTo(CrossingReason.COMBINATIONAL_PATH);
        });
    }

    @Test
    void testCrossingsFollowDeclarationAndSignalOrder() {
        List<Crossing> crossings = classify("""
                module m;
                    reg second, first;
                    always @(posedge clk) begin
                        first <= z | a | m;
                        second <= b;
                    end
                endmodule
                """);

        assertThat(crossings).extracting(Crossing::getRegister, Crossing::getSignal)
                .containsExactly(
                        tuple("second", "b"),
                        tuple("first", "a"),
                        tuple("first", "m"),
                        tuple("first", "z"));
    }

    @Test
    void testClassificationIsDeterministic() {
        String source = """
                module m;
                    reg [1:0] sync;
                    reg a, b;
                    always @(posedge clk_a) a <= x ^ y;
                    always @(posedge clk_b) begin
                        sync <= {sync[0], a};
                        b <= a | sync[1];
                    end
                endmodule
                """;

        assertThat(classify(source)).isEqualTo(classify(source));
    }

    private List<Crossing> classify(String source) {
        return classifier.classify(build(source));
    }

    static DesignGraph build(String source) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        SourceNode tree = new SourceNode(new VerilogParser(new VerilogTokenizer(source, "test.v").tokenize(), "test.v")
                .parse(diagnostics));
        assertThat(diagnostics.getErrors()).isEmpty();
        return new DesignGraphBuilder().build(tree, diagnostics);
    }
}
