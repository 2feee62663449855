package com.hardware.cdc.ast;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A concatenation {@code {a, b, c}}, elements in source (MSB first) order.
 */
@Getter
@ToString
public class ConcatNode extends SyntaxNode {
    private final List<SyntaxNode> elements;

    public ConcatNode(List<SyntaxNode> elements, int line) {
        super(line);
        this.elements = elements != null ? List.copyOf(elements) : List.of();
    }

    /**
     * Elements with nested concatenations expanded in place. Replications are
     * kept as single elements.
     */
    public List<SyntaxNode> flatten() {
        List<SyntaxNode> flat = new ArrayList<>();
        for (SyntaxNode element : elements) {
            if (element instanceof ConcatNode nested) {
                flat.addAll(nested.flatten());
            } else {
                flat.add(element);
            }
        }
        return flat;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return elements;
    }
}
