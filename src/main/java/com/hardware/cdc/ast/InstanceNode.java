package com.hardware.cdc.ast;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A submodule instantiation. One node is produced per instance name.
 */
@Getter
@ToString
public class InstanceNode extends SyntaxNode {
    private final String moduleName;
    private final String instanceName;
    private final List<PortConnectionNode> parameterOverrides;
    private final List<PortConnectionNode> connections;

    public InstanceNode(String moduleName, String instanceName, List<PortConnectionNode> parameterOverrides,
                        List<PortConnectionNode> connections, int line) {
        super(line);
        this.moduleName = moduleName;
        this.instanceName = instanceName;
        this.parameterOverrides = parameterOverrides != null ? List.copyOf(parameterOverrides) : List.of();
        this.connections = connections != null ? List.copyOf(connections) : List.of();
    }

    @Override
    public <C> void accept(SyntaxNodeVisitor<C> visitor, C context) {
        visitor.visit(this, context);
    }

    @Override
    public List<SyntaxNode> children() {
        return concat(List.copyOf(parameterOverrides), connections);
    }
}
