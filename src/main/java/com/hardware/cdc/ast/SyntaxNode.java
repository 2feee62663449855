package com.hardware.cdc.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import lombok.Getter;

/**
 * Base class for all Verilog syntax tree nodes.
 */
@Getter
public abstract class SyntaxNode {
    private final int line;

    protected SyntaxNode(int line) {
        this.line = line;
    }

    public abstract <C> void accept(SyntaxNodeVisitor<C> visitor, C context);

    /**
     * Direct children in source order. Absent optional parts are not included.
     */
    public abstract List<SyntaxNode> children();

    protected static List<SyntaxNode> nonNull(SyntaxNode... nodes) {
        List<SyntaxNode> result = new ArrayList<>(nodes.length);
        for (SyntaxNode node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    protected static List<SyntaxNode> concat(List<SyntaxNode> head, Collection<? extends SyntaxNode> tail) {
        List<SyntaxNode> result = new ArrayList<>(head);
        result.addAll(tail);
        return result;
    }
}
