package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A conditional expression {@code cond ? whenTrue : whenFalse}.
 */
@Getter
@ToString
public class TernaryNode extends SyntaxNode {
    private final SyntaxNode condition;
    private final SyntaxNode whenTrue;
    private final SyntaxNode whenFalse;

    public TernaryNode(SyntaxNode condition, SyntaxNode whenTrue, SyntaxNode whenFalse, int line) {
        super(line);
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(condition, whenTrue, whenFalse);
    }
}
