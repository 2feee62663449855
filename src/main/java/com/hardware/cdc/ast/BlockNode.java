package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A {@code begin ... end} block. An empty block also stands for the null statement.
 */
@Getter
@ToString
public class BlockNode extends SyntaxNode {
    private final String label;
    private final List<SyntaxNode> statements;

    public BlockNode(String label, List<SyntaxNode> statements, int line) {
        super(line);
        this.label = label;
        this.statements = statements != null ? List.copyOf(statements) : List.of();
    }

    public static BlockNode empty(int line) {
        return new BlockNode(null, List.of(), line);
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return statements;
    }
}
