package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A signal reference. Hierarchical references keep their dotted form as the name.
 */
@Getter
@ToString
public class IdentifierNode extends SyntaxNode {
    private final String name;

    public IdentifierNode(String name, int line) {
        super(line);
        this.name = name;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
