package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * An {@code input}, {@code output} or {@code inout} declaration of a single name.
 */
@Getter
@ToString
public class PortDeclNode extends SyntaxNode {
    private final PortDirection direction;
    private final String name;
    private final WidthNode width;

    public PortDeclNode(PortDirection direction, String name, WidthNode width, int line) {
        super(line);
        this.direction = direction;
        this.name = name;
        this.width = width;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(width);
    }
}
