package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * One connection in an instance port list or parameter override list.
 * {@code portName} is {@code null} for positional connections and
 * {@code expression} is {@code null} for explicitly unconnected ports.
 */
@Getter
@ToString
public class PortConnectionNode extends SyntaxNode {
    private final String portName;
    private final SyntaxNode expression;

    public PortConnectionNode(String portName, SyntaxNode expression, int line) {
        super(line);
        this.portName = portName;
        this.expression = expression;
    }

    public boolean isNamed() {
        return portName != null;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(expression);
    }
}
