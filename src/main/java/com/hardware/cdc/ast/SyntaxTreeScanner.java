package com.hardware.cdc.ast;

/**
 * Depth-first walker that visits every child of every node, passing the
 * context through unchanged. Subclasses override the node kinds they care
 * about and call {@link #scanChildren} to keep descending.
 *
 * @param <C> the traversal context type
 */
public abstract class SyntaxTreeScanner<C> implements SyntaxNodeVisitor<C> {

    public void scan(SyntaxNode node, C context) {
        if (node != null) {
            node.accept(this, context);
        }
    }

    protected void scanChildren(SyntaxNode node, C context) {
        for (SyntaxNode child : node.children()) {
            child.accept(this, context);
        }
    }

    @Override
    public void visit(SourceNode source, C context) {
        scanChildren(source, context);
    }

    @Override
    public void visit(ModuleDefNode module, C context) {
        scanChildren(module, context);
    }

    @Override
    public void visit(PortNode port, C context) {
        scanChildren(port, context);
    }

    @Override
    public void visit(PortDeclNode portDecl, C context) {
        scanChildren(portDecl, context);
    }

    @Override
    public void visit(RegDeclNode regDecl, C context) {
        scanChildren(regDecl, context);
    }

    @Override
    public void visit(NetDeclNode netDecl, C context) {
        scanChildren(netDecl, context);
    }

    @Override
    public void visit(ParameterNode parameter, C context) {
        scanChildren(parameter, context);
    }

    @Override
    public void visit(WidthNode width, C context) {
        scanChildren(width, context);
    }

    @Override
    public void visit(InstanceNode instance, C context) {
        scanChildren(instance, context);
    }

    @Override
    public void visit(PortConnectionNode connection, C context) {
        scanChildren(connection, context);
    }

    @Override
    public void visit(ContinuousAssignNode assign, C context) {
        scanChildren(assign, context);
    }

    @Override
    public void visit(AlwaysNode always, C context) {
        scanChildren(always, context);
    }

    @Override
    public void visit(SensListNode sensList, C context) {
        scanChildren(sensList, context);
    }

    @Override
    public void visit(SensNode sens, C context) {
        scanChildren(sens, context);
    }

    @Override
    public void visit(InitialNode initial, C context) {
        scanChildren(initial, context);
    }

    @Override
    public void visit(BlockNode block, C context) {
        scanChildren(block, context);
    }

    @Override
    public void visit(IfNode ifNode, C context) {
        scanChildren(ifNode, context);
    }

    @Override
    public void visit(CaseNode caseNode, C context) {
        scanChildren(caseNode, context);
    }

    @Override
    public void visit(CaseItemNode caseItem, C context) {
        scanChildren(caseItem, context);
    }

    @Override
    public void visit(ForNode forNode, C context) {
        scanChildren(forNode, context);
    }

    @Override
    public void visit(AssignmentNode assignment, C context) {
        scanChildren(assignment, context);
    }

    @Override
    public void visit(IdentifierNode identifier, C context) {
        scanChildren(identifier, context);
    }

    @Override
    public void visit(IntConstNode intConst, C context) {
        scanChildren(intConst, context);
    }

    @Override
    public void visit(StringLiteralNode literal, C context) {
        scanChildren(literal, context);
    }

    @Override
    public void visit(IndexNode index, C context) {
        scanChildren(index, context);
    }

    @Override
    public void visit(PartSelectNode partSelect, C context) {
        scanChildren(partSelect, context);
    }

    @Override
    public void visit(ConcatNode concat, C context) {
        scanChildren(concat, context);
    }

    @Override
    public void visit(ReplicationNode replication, C context) {
        scanChildren(replication, context);
    }

    @Override
    public void visit(UnaryOpNode unary, C context) {
        scanChildren(unary, context);
    }

    @Override
    public void visit(BinaryOpNode binary, C context) {
        scanChildren(binary, context);
    }

    @Override
    public void visit(TernaryNode ternary, C context) {
        scanChildren(ternary, context);
    }

    @Override
    public void visit(FunctionCallNode call, C context) {
        scanChildren(call, context);
    }
}
