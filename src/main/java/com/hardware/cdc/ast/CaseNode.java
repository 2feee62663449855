package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A {@code case}, {@code casex} or {@code casez} statement.
 */
@Getter
@ToString
public class CaseNode extends SyntaxNode {
    private final String kind;
    private final SyntaxNode selector;
    private final List<CaseItemNode> items;

    public CaseNode(String kind, SyntaxNode selector, List<CaseItemNode> items, int line) {
        super(line);
        this.kind = kind;
        this.selector = selector;
        this.items = items != null ? List.copyOf(items) : List.of();
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return concat(nonNull(selector), items);
    }
}
