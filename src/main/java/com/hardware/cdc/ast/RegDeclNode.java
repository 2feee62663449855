package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A {@code reg} declaration of a single name. The width is {@code null} for
 * scalar registers.
 */
@Getter
@ToString
public class RegDeclNode extends SyntaxNode {
    private final String name;
    private final WidthNode width;
    private final boolean signed;

    public RegDeclNode(String name, WidthNode width, boolean signed, int line) {
        super(line);
        this.name = name;
        this.width = width;
        this.signed = signed;
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
