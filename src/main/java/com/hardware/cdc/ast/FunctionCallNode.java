package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A user function or system function call, e.g. {@code $clog2(DEPTH)}. The
 * callee name is not a signal reference; only the arguments are.
 */
@Getter
@ToString
public class FunctionCallNode extends SyntaxNode {
    private final String name;
    private final List<SyntaxNode> arguments;

    public FunctionCallNode(String name, List<SyntaxNode> arguments, int line) {
        super(line);
        this.name = name;
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return arguments;
    }
}
