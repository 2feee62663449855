package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * An {@code always} block with its event control.
 */
@Getter
@ToString
public class AlwaysNode extends SyntaxNode {
    private final SensListNode sensList;
    private final SyntaxNode statement;

    public AlwaysNode(SensListNode sensList, SyntaxNode statement, int line) {
        super(line);
        this.sensList = sensList;
        this.statement = statement;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(sensList, statement);
    }
}
