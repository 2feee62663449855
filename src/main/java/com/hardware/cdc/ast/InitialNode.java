package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class InitialNode extends SyntaxNode {
    private final SyntaxNode statement;

    public InitialNode(SyntaxNode statement, int line) {
        super(line);
        this.statement = statement;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(statement);
    }
}
