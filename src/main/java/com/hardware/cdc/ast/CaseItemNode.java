package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * One arm of a case statement. An empty label list marks the {@code default} arm.
 */
@Getter
@ToString
public class CaseItemNode extends SyntaxNode {
    private final List<SyntaxNode> labels;
    private final SyntaxNode statement;

    public CaseItemNode(List<SyntaxNode> labels, SyntaxNode statement, int line) {
        super(line);
        this.labels = labels != null ? List.copyOf(labels) : List.of();
        this.statement = statement;
    }

    public boolean isDefault() {
        return labels.isEmpty();
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return concat(labels, nonNull(statement));
    }
}
