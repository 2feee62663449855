package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A name listed in a module header port list.
 */
@Getter
@ToString
public class PortNode extends SyntaxNode {
    private final String name;

    public PortNode(String name, int line) {
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
