package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A packed range {@code [msb:lsb]}.
 */
@Getter
@ToString
public class WidthNode extends SyntaxNode {
    private final SyntaxNode msb;
    private final SyntaxNode lsb;

    public WidthNode(SyntaxNode msb, SyntaxNode lsb, int line) {
        super(line);
        this.msb = msb;
        this.lsb = lsb;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(msb, lsb);
    }
}
