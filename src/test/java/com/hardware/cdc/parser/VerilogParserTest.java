package com.hardware.cdc.parser;

import com.hardware.cdc.ast.AlwaysNode;
import com.hardware.cdc.ast.AssignmentNode;
import com.hardware.cdc.ast.BinaryOpNode;
import com.hardware.cdc.ast.BlockNode;
import com.hardware.cdc.ast.CaseNode;
import com.hardware.cdc.ast.ConcatNode;
import com.hardware.cdc.ast.ContinuousAssignNode;
import com.hardware.cdc.ast.EdgeType;
import com.hardware.cdc.ast.IdentifierNode;
import com.hardware.cdc.ast.IfNode;
import com.hardware.cdc.ast.IndexNode;
import com.hardware.cdc.ast.InstanceNode;
import com.hardware.cdc.ast.ModuleDefNode;
import com.hardware.cdc.ast.NetDeclNode;
import com.hardware.cdc.ast.ParameterNode;
import com.hardware.cdc.ast.PartSelectNode;
import com.hardware.cdc.ast.PortDeclNode;
import com.hardware.cdc.ast.PortDirection;
import com.hardware.cdc.ast.PortNode;
import com.hardware.cdc.ast.RegDeclNode;
import com.hardware.cdc.ast.ReplicationNode;
import com.hardware.cdc.ast.SensNode;
import com.hardware.cdc.ast.SyntaxNode;
import com.hardware.cdc.core.context.ToolDiagnostics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VerilogParser.
 */
class VerilogParserTest {

    @Test
    void testParseAnsiHeader() {
        String source = """
                module top #(parameter WIDTH = 8) (
                    input wire clk,
                    input [3:0] a, b,
                    output reg [3:0] q
                );
                endmodule
                """;

        ModuleDefNode module = parseSingle(source);

        assertThat(module.getName()).isEqualTo("top");
        assertThat(module.getSourceFile()).isEqualTo("test.v");
        assertThat(module.getPorts()).extracting(PortNode::getName).containsExactly("clk", "a", "b", "q");

        assertThat(itemsOfType(module, ParameterNode.class)).singleElement()
                .satisfies(parameter -> {
                    assertThat(parameter.getName()).isEqualTo("WIDTH");
                    assertThat(parameter.isLocal()).isFalse();
                });

        List<PortDeclNode> portDecls = itemsOfType(module, PortDeclNode.class);
        assertThat(portDecls).extracting(PortDeclNode::getName).containsExactly("clk", "a", "b", "q");
        assertThat(portDecls.get(2).getDirection()).isEqualTo(PortDirection.INPUT);
        assertThat(portDecls.get(2).getWidth()).isNotNull();
        assertThat(portDecls.get(3).getDirection()).isEqualTo(PortDirection.OUTPUT);

        assertThat(itemsOfType(module, RegDeclNode.class)).extracting(RegDeclNode::getName).containsExactly("q");
        assertThat(itemsOfType(module, NetDeclNode.class)).extracting(NetDeclNode::getName).containsExactly("clk");
    }

    @Test
    void testParseNonAnsiHeader() {
        String source = """
                module m(clk, d, q);
                    input clk;
                    input d;
                    output q;
                    reg q;
                    always @(posedge clk) q <= d;
                endmodule
                """;

        ModuleDefNode module = parseSingle(source);

        assertThat(module.getPorts()).extracting(PortNode::getName).containsExactly("clk", "d", "q");
        assertThat(itemsOfType(module, PortDeclNode.class)).hasSize(3);
        assertThat(itemsOfType(module, RegDeclNode.class)).extracting(RegDeclNode::getName).containsExactly("q");
        assertThat(itemsOfType(module, AlwaysNode.class)).hasSize(1);
    }

    @Test
    void testParseSensitivityLists() {
        String source = """
                module m;
                    always @(posedge clk or negedge rst_n) q <= d;
                    always @* y = a;
                    always @(*) y = a;
                    always @(a, b) y = a & b;
                endmodule
                """;

        List<AlwaysNode> blocks = itemsOfType(parseSingle(source), AlwaysNode.class);

        assertThat(blocks).hasSize(4);
        assertThat(blocks.get(0).getSensList().getEntries()).extracting(SensNode::getType)
                .containsExactly(EdgeType.POSEDGE, EdgeType.NEGEDGE);
        assertThat(((IdentifierNode) blocks.get(0).getSensList().getEntries().get(1).getSignal()).getName())
                .isEqualTo("rst_n");
        assertThat(blocks.get(1).getSensList().getEntries()).extracting(SensNode::getType)
                .containsExactly(EdgeType.ALL);
        assertThat(blocks.get(2).getSensList().getEntries()).extracting(SensNode::getType)
                .containsExactly(EdgeType.ALL);
        assertThat(blocks.get(3).getSensList().getEntries()).extracting(SensNode::getType)
                .containsExactly(EdgeType.LEVEL, EdgeType.LEVEL);
    }

    @Test
    void testParseStatements() {
        String source = """
                module m;
                    always @(posedge clk) begin : update
                        if (rst)
                            q <= 1'b0;
                        else begin
                            case (sel)
                                2'b00, 2'b01: q <= a;
                                default: q = b;
                            endcase
                        end
                    end
                endmodule
                """;

        AlwaysNode always = itemsOfType(parseSingle(source), AlwaysNode.class).get(0);

        BlockNode block = (BlockNode) always.getStatement();
        assertThat(block.getLabel()).isEqualTo("update");
        IfNode ifNode = (IfNode) block.getStatements().get(0);
        AssignmentNode reset = (AssignmentNode) ifNode.getThenStatement();
        assertThat(reset.isBlocking()).isFalse();

        CaseNode caseNode = (CaseNode) ((BlockNode) ifNode.getElseStatement()).getStatements().get(0);
        assertThat(caseNode.getKind()).isEqualTo("case");
        assertThat(caseNode.getItems()).hasSize(2);
        assertThat(caseNode.getItems().get(0).getLabels()).hasSize(2);
        assertThat(caseNode.getItems().get(1).isDefault()).isTrue();
        assertThat(((AssignmentNode) caseNode.getItems().get(1).getStatement()).isBlocking()).isTrue();
    }

    @Test
    void testBinaryOperatorPrecedence() {
        ModuleDefNode module = parseSingle("module m; assign y = a + b * c | d; endmodule");

        ContinuousAssignNode assign = itemsOfType(module, ContinuousAssignNode.class).get(0);
        BinaryOpNode or = (BinaryOpNode) assign.getRight();
        assertThat(or.getOperator()).isEqualTo("|");
        BinaryOpNode plus = (BinaryOpNode) or.getLeft();
        assertThat(plus.getOperator()).isEqualTo("+");
        assertThat(((BinaryOpNode) plus.getRight()).getOperator()).isEqualTo("*");
    }

    @Test
    void testConcatenationAndReplication() {
        ModuleDefNode module = parseSingle("module m; assign y = {a, {b, c}}; assign z = {4{a}}; endmodule");

        List<ContinuousAssignNode> assigns = itemsOfType(module, ContinuousAssignNode.class);
        ConcatNode concat = (ConcatNode) assigns.get(0).getRight();
        assertThat(concat.getElements()).hasSize(2);
        assertThat(concat.flatten()).hasSize(3);

        ReplicationNode replication = (ReplicationNode) assigns.get(1).getRight();
        assertThat(replication.getValue().getElements()).hasSize(1);
    }

    @Test
    void testSelects() {
        ModuleDefNode module = parseSingle("""
                module m;
                    assign a = q[3];
                    assign b = q[7:4];
                    assign c = q[i +: 2];
                endmodule
                """);

        List<ContinuousAssignNode> assigns = itemsOfType(module, ContinuousAssignNode.class);
        assertThat(assigns.get(0).getRight()).isInstanceOf(IndexNode.class);
        assertThat(((PartSelectNode) assigns.get(1).getRight()).getKind()).isEqualTo(PartSelectNode.Kind.RANGE);
        assertThat(((PartSelectNode) assigns.get(2).getRight()).getKind()).isEqualTo(PartSelectNode.Kind.INDEXED_UP);
    }

    @Test
    void testParseInstance() {
        ModuleDefNode module = parseSingle("""
                module top;
                    sub #(.W(8)) u0 (.clk(clk), .d(), .*);
                    sub u1 (clk, , q);
                endmodule
                """);

        List<InstanceNode> instances = itemsOfType(module, InstanceNode.class);
        assertThat(instances).extracting(InstanceNode::getInstanceName).containsExactly("u0", "u1");

        InstanceNode u0 = instances.get(0);
        assertThat(u0.getModuleName()).isEqualTo("sub");
        assertThat(u0.getParameterOverrides()).hasSize(1);
        assertThat(u0.getConnections()).hasSize(3);
        assertThat(u0.getConnections().get(0).isNamed()).isTrue();
        assertThat(u0.getConnections().get(1).getExpression()).isNull();
        assertThat(u0.getConnections().get(2).getPortName()).isEqualTo("*");

        assertThat(instances.get(1).getConnections()).hasSize(3);
        assertThat(instances.get(1).getConnections().get(1).getExpression()).isNull();
    }

    @Test
    void testNetDeclarationWithInitializer() {
        ModuleDefNode module = parseSingle("module m; wire [1:0] w = a & b; endmodule");

        assertThat(itemsOfType(module, NetDeclNode.class)).singleElement()
                .satisfies(net -> assertThat(net.getKind()).isEqualTo("wire"));
        assertThat(itemsOfType(module, ContinuousAssignNode.class)).hasSize(1);
    }

    @Test
    void testMemoryDeclarationKeepsElementWidth() {
        ModuleDefNode module = parseSingle("module m; reg [7:0] mem [0:15], r; endmodule");

        assertThat(itemsOfType(module, RegDeclNode.class)).extracting(RegDeclNode::getName)
                .containsExactly("mem", "r");
        assertThat(itemsOfType(module, RegDeclNode.class)).allMatch(reg -> reg.getWidth() != null);
    }

    @Test
    void testUnsupportedConstructsAreSkippedWithWarning() {
        String source = """
                module m;
                    integer i;
                    function [7:0] inc;
                        input [7:0] v;
                        inc = v + 1;
                    endfunction
                    reg r;
                    initial $display("start");
                endmodule
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        List<ModuleDefNode> modules = parse(source, diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getWarnings()).hasSize(3);
        assertThat(diagnostics.getWarnings().get(0)).contains("integer");
        assertThat(diagnostics.getWarnings().get(1)).contains("function");
        assertThat(diagnostics.getWarnings().get(2)).isEqualTo("test.v:8: skipping system task $display");
        assertThat(itemsOfType(modules.get(0), RegDeclNode.class)).extracting(RegDeclNode::getName)
                .containsExactly("r");
    }

    @Test
    void testSystemTaskInsideAlwaysIsSkippedWithWarning() {
        String source = """
                module m;
                    always @(posedge clk) begin
                        $display("q=%b", q);
                        q <= d;
                    end
                endmodule
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        List<ModuleDefNode> modules = parse(source, diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.getWarnings()).containsExactly("test.v:3: skipping system task $display");
        BlockNode block = (BlockNode) itemsOfType(modules.get(0), AlwaysNode.class).get(0).getStatement();
        assertThat(block.getStatements()).hasSize(2);
        assertThat(block.getStatements().get(1)).isInstanceOf(AssignmentNode.class);
    }

    @Test
    void testSyntaxErrorRecoversAtNextItem() {
        String source = """
                module m(input clk, input d);
                    reg q;
                    always @(posedge clk)
                        q <= ;
                    reg r;
                endmodule
                """;
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        List<ModuleDefNode> modules = parse(source, diagnostics);

        assertThat(diagnostics.getErrors()).singleElement().asString().startsWith("test.v:4:");
        assertThat(modules).hasSize(1);
        assertThat(itemsOfType(modules.get(0), RegDeclNode.class)).extracting(RegDeclNode::getName)
                .containsExactly("q", "r");
    }

    @Test
    void testMissingEndmoduleIsAnError() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        List<ModuleDefNode> modules = parse("module m; reg r;", diagnostics);

        assertThat(modules).isEmpty();
        assertThat(diagnostics.getErrors()).singleElement().asString().contains("missing endmodule");
    }

    @Test
    void testMultipleModules() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        List<ModuleDefNode> modules = parse("module a; endmodule\nmodule b; endmodule", diagnostics);

        assertThat(modules).extracting(ModuleDefNode::getName).containsExactly("a", "b");
        assertThat(modules.get(1).getLine()).isEqualTo(2);
    }

    private ModuleDefNode parseSingle(String source) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        List<ModuleDefNode> modules = parse(source, diagnostics);
        assertThat(diagnostics.getErrors()).isEmpty();
        assertThat(modules).hasSize(1);
        return modules.get(0);
    }

    private List<ModuleDefNode> parse(String source, ToolDiagnostics diagnostics) {
        List<VerilogToken> tokens = new VerilogTokenizer(source, "test.v").tokenize();
        return new VerilogParser(tokens, "test.v").parse(diagnostics);
    }

    private <T extends SyntaxNode> List<T> itemsOfType(ModuleDefNode module, Class<T> type) {
        return module.getItems().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
