package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A replication {@code {count{value}}}.
 */
@Getter
@ToString
public class ReplicationNode extends SyntaxNode {
    private final SyntaxNode count;
    private final ConcatNode value;

    public ReplicationNode(SyntaxNode count, ConcatNode value, int line) {
        super(line);
        this.count = count;
        this.value = value;
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return nonNull(count, value);
    }
}
