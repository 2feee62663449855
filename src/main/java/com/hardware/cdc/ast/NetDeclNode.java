package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A net declaration ({@code wire}, {@code tri}, {@code wand}, ...) of a single name.
 */
@Getter
@ToString
public class NetDeclNode extends SyntaxNode {
    private final String name;
    private final String kind;
    private final WidthNode width;

    public NetDeclNode(String name, String kind, WidthNode width, int line) {
        super(line);
        this.name = name;
        this.kind = kind;
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
