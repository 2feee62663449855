package com.hardware.cdc.ast;

/**
 * Visitor over the Verilog syntax tree. The context value is threaded through
 * the traversal instead of being kept in visitor fields.
 *
 * @param <C> the traversal context type
 */
public interface SyntaxNodeVisitor<C> {
    void visit(SourceNode source, C context);
    void visit(ModuleDefNode module, C context);
    void visit(PortNode port, C context);
    void visit(PortDeclNode portDecl, C context);
    void visit(RegDeclNode regDecl, C context);
    void visit(NetDeclNode netDecl, C context);
    void visit(ParameterNode parameter, C context);
    void visit(WidthNode width, C context);
    void visit(InstanceNode instance, C context);
    void visit(PortConnectionNode connection, C context);
    void visit(ContinuousAssignNode assign, C context);
    void visit(AlwaysNode always, C context);
    void visit(SensListNode sensList, C context);
    void visit(SensNode sens, C context);
    void visit(InitialNode initial, C context);
    void visit(BlockNode block, C context);
    void visit(IfNode ifNode, C context);
    void visit(CaseNode caseNode, C context);
    void visit(CaseItemNode caseItem, C context);
    void visit(ForNode forNode, C context);
    void visit(AssignmentNode assignment, C context);
    void visit(IdentifierNode identifier, C context);
    void visit(IntConstNode intConst, C context);
    void visit(StringLiteralNode literal, C context);
    void visit(IndexNode index, C context);
    void visit(PartSelectNode partSelect, C context);
    void visit(ConcatNode concat, C context);
    void visit(ReplicationNode replication, C context);
    void visit(UnaryOpNode unary, C context);
    void visit(BinaryOpNode binary, C context);
    void visit(TernaryNode ternary, C context);
    void visit(FunctionCallNode call, C context);
}
