package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * The entries of an {@code @(...)} event control, in source order.
 */
@Getter
@ToString
public class SensListNode extends SyntaxNode {
    private final List<SensNode> entries;

    public SensListNode(List<SensNode> entries, int line) {
        super(line);
        this.entries = entries != null ? List.copyOf(entries) : List.of();
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return List.copyOf(entries);
    }
}
