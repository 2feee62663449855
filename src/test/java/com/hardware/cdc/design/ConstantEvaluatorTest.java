package com.hardware.cdc.design;

import com.hardware.cdc.ast.BinaryOpNode;
import com.hardware.cdc.ast.IdentifierNode;
import com.hardware.cdc.ast.IntConstNode;
import com.hardware.cdc.ast.WidthNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class ConstantEvaluatorTest {

    private final ConstantEvaluator evaluator = new ConstantEvaluator();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "8'hFF    | 255",
        "4'b1010  | 10",
        "8'o17    | 15",
        "4'd9     | 9",
        "4'sd3    | 3",
        "'b1      | 1",
        "'1       | 1",
        "8'h      | 0",
        "12       | 12",
        "007      | 7",
        "1_000    | 1000",
        "0x1F     | 31",
        "16'hFF_FF | 65535"
    })
    void testParseLiteral(String literal, int expected) {
        assertThat(evaluator.parseLiteral(literal)).hasValue(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"4'b1x0z", "8'hzz", "'", "abc", "99999999999", "4'b102"})
    void testUnknownLiterals(String literal) {
        assertThat(evaluator.parseLiteral(literal)).isEmpty();
    }

    @Test
    void testOnlyLiteralNodesAreConstant() {
        assertThat(evaluator.evaluate(new IntConstNode("3", 1))).hasValue(3);
        assertThat(evaluator.evaluate(new IdentifierNode("WIDTH", 1))).isEmpty();
        assertThat(evaluator.evaluate(new BinaryOpNode("-", new IdentifierNode("WIDTH", 1),
                new IntConstNode("1", 1), 1))).isEmpty();
        assertThat(evaluator.evaluate(null)).isEmpty();
    }

    @Test
    void testBitIndicesFollowDeclarationOrder() {
        assertThat(evaluator.bitIndices(width("3", "0"))).hasValueSatisfying(
                bits -> assertThat(bits).containsExactly(3, 2, 1, 0));
        assertThat(evaluator.bitIndices(width("0", "3"))).hasValueSatisfying(
                bits -> assertThat(bits).containsExactly(0, 1, 2, 3));
        assertThat(evaluator.bitIndices(width("5", "5"))).hasValueSatisfying(
                bits -> assertThat(bits).containsExactly(5));
        assertThat(evaluator.bitIndices(width("2'd3", "0"))).hasValueSatisfying(
                bits -> assertThat(bits).containsExactly(3, 2, 1, 0));
    }

    @Test
    void testBitIndicesUnknownWithoutConstantBounds() {
        WidthNode parameterized = new WidthNode(
                new BinaryOpNode("-", new IdentifierNode("W", 1), new IntConstNode("1", 1), 1),
                new IntConstNode("0", 1), 1);

        assertThat(evaluator.bitIndices(parameterized)).isEmpty();
        assertThat(evaluator.bitIndices(width("7", "x"))).isEmpty();
        assertThat(evaluator.bitIndices(null)).isEmpty();
    }

    @Test
    void testOversizedWidthIsUnknown() {
        assertThat(evaluator.bitIndices(width("2147483647", "0"))).isEmpty();
        assertThat(evaluator.bitIndices(width("0", "2147483647"))).isEmpty();
        assertThat(evaluator.bitIndices(width("1048576", "0"))).isEmpty();
        assertThat(evaluator.bitIndices(width("1048575", "0"))).hasValueSatisfying(
                bits -> assertThat(bits).hasSize(1 << 20));
    }

    private WidthNode width(String msb, String lsb) {
        return new WidthNode(new IntConstNode(msb, 1), new IntConstNode(lsb, 1), 1);
    }
}
