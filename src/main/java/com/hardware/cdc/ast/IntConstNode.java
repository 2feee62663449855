package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * An integer literal kept in its source text form, e.g. {@code 8'hFF} or {@code 12}.
 */
@Getter
@ToString
public class IntConstNode extends SyntaxNode {
    private final String text;

    public IntConstNode(String text, int line) {
        super(line);
        this.text = text;
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
