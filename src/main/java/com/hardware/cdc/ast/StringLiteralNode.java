package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class StringLiteralNode extends SyntaxNode {
    private final String value;

    public StringLiteralNode(String value, int line) {
        super(line);
        this.value = value;
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
