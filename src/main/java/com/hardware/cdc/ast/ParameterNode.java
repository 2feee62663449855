package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A {@code parameter} or {@code localparam} binding.
 */
@Getter
@ToString
public class ParameterNode extends SyntaxNode {
    private final String name;
    private final SyntaxNode value;
    private final boolean local;

    public ParameterNode(String name, SyntaxNode value, boolean local, int line) {
        super(line);
        this.name = name;
        this.value = value;
        this.local = local;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(value);
    }
}
