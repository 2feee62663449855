package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ForNode extends SyntaxNode {
    private final AssignmentNode init;
    private final SyntaxNode condition;
    private final AssignmentNode step;
    private final SyntaxNode body;

    public ForNode(AssignmentNode init, SyntaxNode condition, AssignmentNode step, SyntaxNode body, int line) {
        super(line);
        this.init = init;
        this.condition = condition;
        this.step = step;
        this.body = body;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(init, condition, step, body);
    }
}
