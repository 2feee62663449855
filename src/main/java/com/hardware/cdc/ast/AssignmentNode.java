package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A procedural assignment, blocking ({@code =}) or non-blocking ({@code <=}).
 */
@Getter
@ToString
public class AssignmentNode extends SyntaxNode {
    private final SyntaxNode left;
    private final SyntaxNode right;
    private final boolean blocking;

    public AssignmentNode(SyntaxNode left, SyntaxNode right, boolean blocking, int line) {
        super(line);
        this.left = left;
        this.right = right;
        this.blocking = blocking;
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
