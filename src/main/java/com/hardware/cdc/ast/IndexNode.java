package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A single bit or element select {@code target[index]}.
 */
@Getter
@ToString
public class IndexNode extends SyntaxNode {
    private final SyntaxNode target;
    private final SyntaxNode index;

    public IndexNode(SyntaxNode target, SyntaxNode index, int line) {
        super(line);
        this.target = target;
        this.index = index;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(target, index);
    }
}
