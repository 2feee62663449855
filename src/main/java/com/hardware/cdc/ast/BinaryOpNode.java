package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class BinaryOpNode extends SyntaxNode {
    private final String operator;
    private final SyntaxNode left;
    private final SyntaxNode right;

    public BinaryOpNode(String operator, SyntaxNode left, SyntaxNode right, int line) {
        super(line);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(left, right);
    }
}
