package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class IfNode extends SyntaxNode {
    private final SyntaxNode condition;
    private final SyntaxNode thenStatement;
    private final SyntaxNode elseStatement;

    public IfNode(SyntaxNode condition, SyntaxNode thenStatement, SyntaxNode elseStatement, int line) {
        super(line);
        this.condition = condition;
        this.thenStatement = thenStatement;
        this.elseStatement = elseStatement;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(condition, thenStatement, elseStatement);
    }
}
