package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * One sensitivity entry. The signal is {@code null} for {@link EdgeType#ALL}.
 */
@Getter
@ToString
public class SensNode extends SyntaxNode {
    private final EdgeType type;
    private final SyntaxNode signal;

    public SensNode(EdgeType type, SyntaxNode signal, int line) {
        super(line);
        this.type = type;
        this.signal = signal;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(signal);
    }
}
