package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * An {@code assign lhs = rhs;} statement or a net declaration assignment.
 */
@Getter
@ToString
public class ContinuousAssignNode extends SyntaxNode {
    private final SyntaxNode left;
    private final SyntaxNode right;

    public ContinuousAssignNode(SyntaxNode left, SyntaxNode right, int line) {
        super(line);
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
