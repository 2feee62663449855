package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * Root of a parsed design: the module definitions of one or more source files.
 */
@Getter
@ToString
public class SourceNode extends SyntaxNode {
    private final List<ModuleDefNode> modules;

    public SourceNode(List<ModuleDefNode> modules) {
        super(0);
        this.modules = List.copyOf(modules);
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return List.copyOf(modules);
    }
}
