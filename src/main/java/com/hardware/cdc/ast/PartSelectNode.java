package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A part select. For {@link Kind#RANGE} the bounds are msb and lsb; for the
 * indexed forms they are the base and the width.
 */
@Getter
@ToString
public class PartSelectNode extends SyntaxNode {

    public enum Kind {
        RANGE,
        INDEXED_UP,
        INDEXED_DOWN
    }

    private final SyntaxNode target;
    private final SyntaxNode first;
    private final SyntaxNode second;
    private final Kind kind;

    public PartSelectNode(SyntaxNode target, SyntaxNode first, SyntaxNode second, Kind kind, int line) {
        super(line);
        this.target = target;
        this.first = first;
        this.second = second;
        this.kind = kind;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(target, first, second);
    }
}
