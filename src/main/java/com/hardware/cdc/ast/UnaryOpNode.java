package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class UnaryOpNode extends SyntaxNode {
    private final String operator;
    private final SyntaxNode operand;

    public UnaryOpNode(String operator, SyntaxNode operand, int line) {
        super(line);
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(operand);
    }
}
