package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A {@code module ... endmodule} definition.
 */
@Getter
@ToString
public class ModuleDefNode extends SyntaxNode {
    private final String name;
    private final String sourceFile;
    private final List<PortNode> ports;
    private final List<SyntaxNode> items;

    public ModuleDefNode(String name, String sourceFile, List<PortNode> ports, List<SyntaxNode> items, int line) {
        super(line);
        this.name = name;
        this.sourceFile = sourceFile;
        this.ports = ports != null ? List.copyOf(ports) : List.of();
        this.items = items != null ? List.copyOf(items) : List.of();
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return concat(List.copyOf(ports), items);
    }
}
