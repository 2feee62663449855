package com.hardware.cdc.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.ast.AlwaysNode;
import com.hardware.cdc.ast.AssignmentNode;
import com.hardware.cdc.ast.BinaryOpNode;
import com.hardware.cdc.ast.BlockNode;
import com.hardware.cdc.ast.CaseItemNode;
import com.hardware.cdc.ast.CaseNode;
import com.hardware.cdc.ast.ConcatNode;
import com.hardware.cdc.ast.ContinuousAssignNode;
import com.hardware.cdc.ast.EdgeType;
import com.hardware.cdc.ast.ForNode;
import com.hardware.cdc.ast.FunctionCallNode;
import com.hardware.cdc.ast.IdentifierNode;
import com.hardware.cdc.ast.IfNode;
import com.hardware.cdc.ast.IndexNode;
import com.hardware.cdc.ast.InitialNode;
import com.hardware.cdc.ast.InstanceNode;
import com.hardware.cdc.ast.IntConstNode;
import com.hardware.cdc.ast.ModuleDefNode;
import com.hardware.cdc.ast.NetDeclNode;
import com.hardware.cdc.ast.ParameterNode;
import com.hardware.cdc.ast.PartSelectNode;
import com.hardware.cdc.ast.PortConnectionNode;
import com.hardware.cdc.ast.PortDeclNode;
import com.hardware.cdc.ast.PortDirection;
import com.hardware.cdc.ast.PortNode;
import com.hardware.cdc.ast.RegDeclNode;
import com.hardware.cdc.ast.ReplicationNode;
import com.hardware.cdc.ast.SensListNode;
import com.hardware.cdc.ast.SensNode;
import com.hardware.cdc.ast.StringLiteralNode;
import com.hardware.cdc.ast.SyntaxNode;
import com.hardware.cdc.ast.TernaryNode;
import com.hardware.cdc.ast.UnaryOpNode;
import com.hardware.cdc.ast.WidthNode;
import com.hardware.cdc.core.context.ToolDiagnostics;
import com.hardware.cdc.parser.VerilogToken.TokenType;
import com.hardware.cdc.parser.exception.ParseException;

/**
 * Parser for Verilog source files.
 * Converts tokens into module definition syntax trees.
 *
 * Parsing only:
 * - Builds the syntax tree
 * - Skips constructs outside the supported subset with a warning
 * - Reports syntax errors per module item and resumes at the next ';'
 *
 * It does NOT resolve registers, clocks or drivers.
 */
public class VerilogParser {
    private static final Logger log = LoggerFactory.getLogger(VerilogParser.class);

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1),
            Map.entry("&&", 2),
            Map.entry("|", 3),
            Map.entry("~|", 3),
            Map.entry("^", 4),
            Map.entry("~^", 4),
            Map.entry("^~", 4),
            Map.entry("&", 5),
            Map.entry("~&", 5),
            Map.entry("==", 6),
            Map.entry("!=", 6),
            Map.entry("===", 6),
            Map.entry("!==", 6),
            Map.entry("<", 7),
            Map.entry("<=", 7),
            Map.entry(">", 7),
            Map.entry(">=", 7),
            Map.entry("<<", 8),
            Map.entry(">>", 8),
            Map.entry("<<<", 8),
            Map.entry(">>>", 8),
            Map.entry("+", 9),
            Map.entry("-", 9),
            Map.entry("*", 10),
            Map.entry("/", 10),
            Map.entry("%", 10),
            Map.entry("**", 11)
    );

    private static final Set<String> UNARY_OPERATORS = Set.of(
            "+", "-", "!", "~", "&", "~&", "|", "~|", "^", "~^", "^~"
    );

    private final List<VerilogToken> tokens;
    private final String fileName;
    private int pos = 0;
    private ToolDiagnostics diagnostics = new ToolDiagnostics();

    public VerilogParser(List<VerilogToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    public List<ModuleDefNode> parse(ToolDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        List<ModuleDefNode> modules = new ArrayList<>();

        while (!isAtEnd()) {
            if (check(TokenType.MODULE) || check(TokenType.MACROMODULE)) {
                try {
                    modules.add(parseModule(diagnostics));
                } catch (ParseException e) {
                    diagnostics.getErrors().add(e.getMessage());
                    skipPast(TokenType.ENDMODULE);
                }
                continue;
            }

            VerilogToken stray = advance();
            diagnostics.getWarnings().add(location(stray) + "ignoring text outside of a module starting at '"
                    + stray.getValue() + "'");
            while (!isAtEnd() && !check(TokenType.MODULE) && !check(TokenType.MACROMODULE)) {
                advance();
            }
        }

        return modules;
    }

    // ---------------------------------------------------------------- modules

    private ModuleDefNode parseModule(ToolDiagnostics diagnostics) {
        VerilogToken start = advance();
        String name = expectIdentifier("module name");

        List<PortNode> ports = new ArrayList<>();
        List<SyntaxNode> items = new ArrayList<>();

        if (check(TokenType.HASH)) {
            advance();
            expect(TokenType.LPAREN);
            parseParameterPortList(items);
        }
        if (check(TokenType.LPAREN)) {
            advance();
            parsePortList(ports, items);
        }
        expect(TokenType.SEMICOLON);

        while (!check(TokenType.ENDMODULE)) {
            if (isAtEnd()) {
                throw error("missing endmodule for module " + name);
            }
            int itemStart = pos;
            try {
                parseModuleItem(items, diagnostics);
            } catch (ParseException e) {
                diagnostics.getErrors().add(e.getMessage());
                log.debug("Recovering after syntax error in module {}: {}", name, e.getMessage());
                if (pos == itemStart) {
                    advance();
                }
                skipToSemicolon();
            }
        }
        expect(TokenType.ENDMODULE);

        log.debug("Parsed module {} with {} items at line {}", name, items.size(), start.getLine());
        return new ModuleDefNode(name, fileName, ports, items, start.getLine());
    }

    private void parseParameterPortList(List<SyntaxNode> items) {
        boolean local = false;
        while (true) {
            if (check(TokenType.PARAMETER) || check(TokenType.LOCALPARAM)) {
                local = advance().getType() == TokenType.LOCALPARAM;
            }
            skipParameterType();
            VerilogToken nameToken = peek();
            String name = expectIdentifier("parameter name");
            expect(TokenType.EQUALS);
            SyntaxNode value = parseExpression();
            items.add(new ParameterNode(name, value, local, nameToken.getLine()));

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.RPAREN);
            return;
        }
    }

    private void parsePortList(List<PortNode> ports, List<SyntaxNode> items) {
        if (check(TokenType.RPAREN)) {
            advance();
            return;
        }

        if (peek().isPortDirection()) {
            parseAnsiPortList(ports, items);
            return;
        }

        while (true) {
            if (check(TokenType.DOT)) {
                // Explicit port expression: .name(expr)
                advance();
                VerilogToken nameToken = peek();
                ports.add(new PortNode(expectIdentifier("port name"), nameToken.getLine()));
                expect(TokenType.LPAREN);
                skipBalanced(TokenType.LPAREN, TokenType.RPAREN);
            } else {
                VerilogToken nameToken = peek();
                ports.add(new PortNode(expectIdentifier("port name"), nameToken.getLine()));
            }

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.RPAREN);
            return;
        }
    }

    private void parseAnsiPortList(List<PortNode> ports, List<SyntaxNode> items) {
        PortDirection direction = null;
        Declarator declarator = null;

        while (true) {
            if (peek().isPortDirection()) {
                direction = PortDirection.fromVerilog(advance().getValue());
                declarator = parseDeclarator();
            } else if (direction == null) {
                throw error("Expected port direction but found '" + peek().getValue() + "'");
            }

            VerilogToken nameToken = peek();
            String name = expectIdentifier("port name");
            ports.add(new PortNode(name, nameToken.getLine()));
            addPortDeclarations(items, direction, declarator, name, nameToken.getLine());

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.RPAREN);
            return;
        }
    }

    private void parseModuleItem(List<SyntaxNode> items, ToolDiagnostics diagnostics) {
        VerilogToken token = peek();

        switch (token.getType()) {
            case INPUT, OUTPUT, INOUT -> parsePortDeclaration(items);
            case REG, LOGIC -> parseRegDeclaration(items);
            case WIRE, TRI, TRI0, TRI1, WAND, WOR, UWIRE, SUPPLY0, SUPPLY1 -> parseNetDeclaration(items);
            case PARAMETER, LOCALPARAM -> parseParameterDeclaration(items);
            case ASSIGN -> parseContinuousAssign(items);
            case ALWAYS, ALWAYS_FF, ALWAYS_COMB, ALWAYS_LATCH -> items.add(parseAlways());
            case INITIAL -> {
                advance();
                items.add(new InitialNode(parseStatement(), token.getLine()));
            }
            case INTEGER, REAL, GENVAR, DEFPARAM -> {
                diagnostics.getWarnings().add(location(token) + "skipping unsupported " + token.getValue()
                        + " declaration");
                skipToSemicolon();
            }
            case GENERATE -> skipConstruct(TokenType.ENDGENERATE, diagnostics);
            case FUNCTION -> skipConstruct(TokenType.ENDFUNCTION, diagnostics);
            case TASK -> skipConstruct(TokenType.ENDTASK, diagnostics);
            case SPECIFY -> skipConstruct(TokenType.ENDSPECIFY, diagnostics);
            case SEMICOLON -> advance();
            case IDENTIFIER, OR -> parseInstantiation(items);
            default -> throw error("Unexpected '" + token.getValue() + "' in module body");
        }
    }

    private void parsePortDeclaration(List<SyntaxNode> items) {
        PortDirection direction = PortDirection.fromVerilog(advance().getValue());
        Declarator declarator = parseDeclarator();

        while (true) {
            VerilogToken nameToken = peek();
            String name = expectIdentifier("port name");
            addPortDeclarations(items, direction, declarator, name, nameToken.getLine());
            if (check(TokenType.EQUALS)) {
                advance();
                parseExpression();
            }

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.SEMICOLON);
            return;
        }
    }

    private void addPortDeclarations(List<SyntaxNode> items, PortDirection direction, Declarator declarator,
                                     String name, int line) {
        items.add(new PortDeclNode(direction, name, declarator.width, line));
        if (declarator.register) {
            items.add(new RegDeclNode(name, declarator.width, declarator.signed, line));
        } else if (declarator.netKind != null) {
            items.add(new NetDeclNode(name, declarator.netKind, declarator.width, line));
        }
    }

    private void parseRegDeclaration(List<SyntaxNode> items) {
        advance();
        boolean signed = acceptType(TokenType.SIGNED);
        WidthNode width = check(TokenType.LBRACKET) ? parseRange() : null;

        while (true) {
            VerilogToken nameToken = peek();
            String name = expectIdentifier("register name");
            while (check(TokenType.LBRACKET)) {
                // Unpacked dimensions of a memory; the element width is what matters here.
                parseRange();
                log.debug("Register {} declared as a memory at line {}", name, nameToken.getLine());
            }
            if (check(TokenType.EQUALS)) {
                advance();
                parseExpression();
            }
            items.add(new RegDeclNode(name, width, signed, nameToken.getLine()));

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.SEMICOLON);
            return;
        }
    }

    private void parseNetDeclaration(List<SyntaxNode> items) {
        String kind = advance().getValue();
        acceptType(TokenType.SIGNED);
        WidthNode width = check(TokenType.LBRACKET) ? parseRange() : null;
        if (check(TokenType.HASH)) {
            skipDelay();
        }

        while (true) {
            VerilogToken nameToken = peek();
            String name = expectIdentifier("net name");
            while (check(TokenType.LBRACKET)) {
                parseRange();
            }
            items.add(new NetDeclNode(name, kind, width, nameToken.getLine()));
            if (check(TokenType.EQUALS)) {
                advance();
                SyntaxNode value = parseExpression();
                items.add(new ContinuousAssignNode(new IdentifierNode(name, nameToken.getLine()), value,
                        nameToken.getLine()));
            }

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.SEMICOLON);
            return;
        }
    }

    private void parseParameterDeclaration(List<SyntaxNode> items) {
        boolean local = advance().getType() == TokenType.LOCALPARAM;
        skipParameterType();

        while (true) {
            VerilogToken nameToken = peek();
            String name = expectIdentifier("parameter name");
            expect(TokenType.EQUALS);
            items.add(new ParameterNode(name, parseExpression(), local, nameToken.getLine()));

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.SEMICOLON);
            return;
        }
    }

    private void parseContinuousAssign(List<SyntaxNode> items) {
        advance();
        if (check(TokenType.HASH)) {
            skipDelay();
        }

        while (true) {
            int line = peek().getLine();
            SyntaxNode left = parseLvalue();
            expect(TokenType.EQUALS);
            SyntaxNode right = parseExpression();
            items.add(new ContinuousAssignNode(left, right, line));

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.SEMICOLON);
            return;
        }
    }

    private AlwaysNode parseAlways() {
        VerilogToken keyword = advance();
        SensListNode sensList;
        if (check(TokenType.AT)) {
            sensList = parseEventControl();
        } else if (keyword.getType() == TokenType.ALWAYS_COMB || keyword.getType() == TokenType.ALWAYS_LATCH) {
            sensList = new SensListNode(List.of(new SensNode(EdgeType.ALL, null, keyword.getLine())),
                    keyword.getLine());
        } else {
            sensList = new SensListNode(List.of(), keyword.getLine());
        }
        SyntaxNode statement = parseStatement();
        return new AlwaysNode(sensList, statement, keyword.getLine());
    }

    private SensListNode parseEventControl() {
        VerilogToken at = expect(TokenType.AT);
        int line = at.getLine();

        if (checkOperator("*")) {
            advance();
            return new SensListNode(List.of(new SensNode(EdgeType.ALL, null, line)), line);
        }
        if (check(TokenType.IDENTIFIER)) {
            VerilogToken signal = advance();
            return new SensListNode(List.of(new SensNode(EdgeType.LEVEL,
                    new IdentifierNode(signal.getValue(), signal.getLine()), line)), line);
        }

        expect(TokenType.LPAREN);
        if (checkOperator("*")) {
            advance();
            expect(TokenType.RPAREN);
            return new SensListNode(List.of(new SensNode(EdgeType.ALL, null, line)), line);
        }

        List<SensNode> entries = new ArrayList<>();
        while (true) {
            EdgeType type = EdgeType.LEVEL;
            if (check(TokenType.POSEDGE)) {
                advance();
                type = EdgeType.POSEDGE;
            } else if (check(TokenType.NEGEDGE)) {
                advance();
                type = EdgeType.NEGEDGE;
            }
            int entryLine = peek().getLine();
            entries.add(new SensNode(type, parseExpression(), entryLine));

            if (check(TokenType.OR) || check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.RPAREN);
            return new SensListNode(entries, line);
        }
    }

    private void parseInstantiation(List<SyntaxNode> items) {
        VerilogToken moduleToken = advance();
        List<PortConnectionNode> parameters = List.of();
        if (check(TokenType.HASH)) {
            advance();
            if (check(TokenType.LPAREN)) {
                advance();
                parameters = parseConnections();
            } else {
                // Gate delay such as "and #2 g1 (...)"
                advance();
            }
        }

        while (true) {
            VerilogToken nameToken = peek();
            String instanceName = check(TokenType.IDENTIFIER) ? advance().getValue() : "";
            if (check(TokenType.LBRACKET)) {
                parseRange();
            }
            expect(TokenType.LPAREN);
            List<PortConnectionNode> connections = parseConnections();
            items.add(new InstanceNode(moduleToken.getValue(), instanceName, parameters, connections,
                    nameToken.getLine()));
            log.debug("Parsed instance {} of {} at line {}", instanceName, moduleToken.getValue(), nameToken.getLine());

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.SEMICOLON);
            return;
        }
    }

    private List<PortConnectionNode> parseConnections() {
        List<PortConnectionNode> connections = new ArrayList<>();
        if (check(TokenType.RPAREN)) {
            advance();
            return connections;
        }

        while (true) {
            int line = peek().getLine();
            if (check(TokenType.DOT)) {
                advance();
                if (checkOperator("*")) {
                    advance();
                    connections.add(new PortConnectionNode("*", null, line));
                } else {
                    String portName = expectIdentifier("port name");
                    expect(TokenType.LPAREN);
                    SyntaxNode expression = check(TokenType.RPAREN) ? null : parseExpression();
                    expect(TokenType.RPAREN);
                    connections.add(new PortConnectionNode(portName, expression, line));
                }
            } else if (check(TokenType.COMMA) || check(TokenType.RPAREN)) {
                connections.add(new PortConnectionNode(null, null, line));
            } else {
                connections.add(new PortConnectionNode(null, parseExpression(), line));
            }

            if (check(TokenType.COMMA)) {
                advance();
                continue;
            }
            expect(TokenType.RPAREN);
            return connections;
        }
    }

    // ------------------------------------------------------------- statements

    private SyntaxNode parseStatement() {
        VerilogToken token = peek();

        switch (token.getType()) {
            case BEGIN:
                return parseBlock();
            case IF:
                return parseIf();
            case CASE:
            case CASEX:
            case CASEZ:
                return parseCase();
            case FOR:
                return parseFor();
            case SEMICOLON:
                advance();
                return BlockNode.empty(token.getLine());
            case HASH:
                skipDelay();
                return parseStatement();
            case AT:
                parseEventControl();
                return parseStatement();
            case SYSTEM_IDENTIFIER:
                advance();
                if (check(TokenType.LPAREN)) {
                    advance();
                    skipBalanced(TokenType.LPAREN, TokenType.RPAREN);
                }
                expect(TokenType.SEMICOLON);
                diagnostics.getWarnings().add(location(token) + "skipping system task " + token.getValue());
                return BlockNode.empty(token.getLine());
            case REG:
            case INTEGER:
            case REAL:
            case LOGIC:
                // Block-local declaration
                skipToSemicolon();
                return BlockNode.empty(token.getLine());
            default:
                break;
        }

        if (token.getType() == TokenType.IDENTIFIER) {
            switch (token.getValue()) {
                case "forever":
                    advance();
                    return parseStatement();
                case "repeat":
                case "while":
                case "wait": {
                    advance();
                    expect(TokenType.LPAREN);
                    SyntaxNode condition = parseExpression();
                    expect(TokenType.RPAREN);
                    SyntaxNode body = parseStatement();
                    return new BlockNode(null, List.of(condition, body), token.getLine());
                }
                case "disable":
                    skipToSemicolon();
                    return BlockNode.empty(token.getLine());
                default:
                    break;
            }
        }

        AssignmentNode assignment = parseAssignment();
        expect(TokenType.SEMICOLON);
        return assignment;
    }

    private BlockNode parseBlock() {
        VerilogToken begin = expect(TokenType.BEGIN);
        String label = null;
        if (check(TokenType.COLON)) {
            advance();
            label = expectIdentifier("block label");
        }

        List<SyntaxNode> statements = new ArrayList<>();
        while (!check(TokenType.END)) {
            if (isAtEnd()) {
                throw error("missing end for block starting at line " + begin.getLine());
            }
            statements.add(parseStatement());
        }
        expect(TokenType.END);
        if (check(TokenType.COLON)) {
            advance();
            expectIdentifier("block label");
        }
        return new BlockNode(label, statements, begin.getLine());
    }

    private IfNode parseIf() {
        VerilogToken keyword = expect(TokenType.IF);
        expect(TokenType.LPAREN);
        SyntaxNode condition = parseExpression();
        expect(TokenType.RPAREN);
        SyntaxNode thenStatement = parseStatement();
        SyntaxNode elseStatement = null;
        if (check(TokenType.ELSE)) {
            advance();
            elseStatement = parseStatement();
        }
        return new IfNode(condition, thenStatement, elseStatement, keyword.getLine());
    }

    private CaseNode parseCase() {
        VerilogToken keyword = advance();
        expect(TokenType.LPAREN);
        SyntaxNode selector = parseExpression();
        expect(TokenType.RPAREN);

        List<CaseItemNode> items = new ArrayList<>();
        while (!check(TokenType.ENDCASE)) {
            if (isAtEnd()) {
                throw error("missing endcase for case starting at line " + keyword.getLine());
            }
            int line = peek().getLine();
            List<SyntaxNode> labels = new ArrayList<>();
            if (check(TokenType.DEFAULT)) {
                advance();
                acceptType(TokenType.COLON);
            } else {
                labels.add(parseExpression());
                while (check(TokenType.COMMA)) {
                    advance();
                    labels.add(parseExpression());
                }
                expect(TokenType.COLON);
            }
            items.add(new CaseItemNode(labels, parseStatement(), line));
        }
        expect(TokenType.ENDCASE);
        return new CaseNode(keyword.getValue(), selector, items, keyword.getLine());
    }

    private ForNode parseFor() {
        VerilogToken keyword = expect(TokenType.FOR);
        expect(TokenType.LPAREN);
        if (check(TokenType.INTEGER) || check(TokenType.GENVAR)) {
            advance();
        }
        AssignmentNode init = parseAssignment();
        expect(TokenType.SEMICOLON);
        SyntaxNode condition = parseExpression();
        expect(TokenType.SEMICOLON);
        AssignmentNode step = parseAssignment();
        expect(TokenType.RPAREN);
        SyntaxNode body = parseStatement();
        return new ForNode(init, condition, step, body, keyword.getLine());
    }

    private AssignmentNode parseAssignment() {
        int line = peek().getLine();
        SyntaxNode left = parseLvalue();

        boolean blocking;
        if (checkOperator("<=")) {
            blocking = false;
        } else if (check(TokenType.EQUALS)) {
            blocking = true;
        } else {
            throw error("Expected '=' or '<=' but found '" + peek().getValue() + "'");
        }
        advance();

        if (check(TokenType.HASH)) {
            skipDelay();
        } else if (check(TokenType.AT)) {
            parseEventControl();
        }
        SyntaxNode right = parseExpression();
        return new AssignmentNode(left, right, blocking, line);
    }

    private SyntaxNode parseLvalue() {
        if (check(TokenType.LBRACE)) {
            VerilogToken brace = advance();
            List<SyntaxNode> elements = new ArrayList<>();
            elements.add(parseLvalue());
            while (check(TokenType.COMMA)) {
                advance();
                elements.add(parseLvalue());
            }
            expect(TokenType.RBRACE);
            return new ConcatNode(elements, brace.getLine());
        }

        VerilogToken nameToken = peek();
        String name = parseHierarchicalName();
        return parseSelects(new IdentifierNode(name, nameToken.getLine()));
    }

    // ------------------------------------------------------------ expressions

    private SyntaxNode parseExpression() {
        SyntaxNode condition = parseBinary(1);
        if (check(TokenType.QUESTION)) {
            VerilogToken question = advance();
            SyntaxNode whenTrue = parseExpression();
            expect(TokenType.COLON);
            SyntaxNode whenFalse = parseExpression();
            return new TernaryNode(condition, whenTrue, whenFalse, question.getLine());
        }
        return condition;
    }

    private SyntaxNode parseBinary(int minPrecedence) {
        SyntaxNode left = parseUnary();

        while (check(TokenType.OPERATOR)) {
            Integer precedence = BINARY_PRECEDENCE.get(peek().getValue());
            if (precedence == null || precedence < minPrecedence) {
                break;
            }
            VerilogToken operator = advance();
            SyntaxNode right = parseBinary(precedence + 1);
            left = new BinaryOpNode(operator.getValue(), left, right, operator.getLine());
        }
        return left;
    }

    private SyntaxNode parseUnary() {
        if (check(TokenType.OPERATOR) && UNARY_OPERATORS.contains(peek().getValue())) {
            VerilogToken operator = advance();
            return new UnaryOpNode(operator.getValue(), parseUnary(), operator.getLine());
        }
        return parsePrimary();
    }

    private SyntaxNode parsePrimary() {
        VerilogToken token = peek();

        switch (token.getType()) {
            case NUMBER -> {
                advance();
                return new IntConstNode(token.getValue(), token.getLine());
            }
            case STRING_LITERAL -> {
                advance();
                return new StringLiteralNode(token.getValue(), token.getLine());
            }
            case SYSTEM_IDENTIFIER -> {
                advance();
                List<SyntaxNode> arguments = check(TokenType.LPAREN) ? parseArguments() : List.of();
                return new FunctionCallNode(token.getValue(), arguments, token.getLine());
            }
            case IDENTIFIER -> {
                String name = parseHierarchicalName();
                if (check(TokenType.LPAREN)) {
                    return new FunctionCallNode(name, parseArguments(), token.getLine());
                }
                return parseSelects(new IdentifierNode(name, token.getLine()));
            }
            case LPAREN -> {
                advance();
                SyntaxNode inner = parseExpression();
                if (check(TokenType.COLON)) {
                    // min:typ:max, keep the typical value
                    advance();
                    inner = parseExpression();
                    expect(TokenType.COLON);
                    parseExpression();
                }
                expect(TokenType.RPAREN);
                return inner;
            }
            case LBRACE -> {
                return parseConcatenation();
            }
            default -> throw error("Expected expression but found '" + token.getValue() + "'");
        }
    }

    private SyntaxNode parseConcatenation() {
        VerilogToken brace = expect(TokenType.LBRACE);
        if (check(TokenType.RBRACE)) {
            advance();
            return new ConcatNode(List.of(), brace.getLine());
        }

        SyntaxNode first = parseExpression();
        if (check(TokenType.LBRACE)) {
            SyntaxNode replicated = parseConcatenation();
            expect(TokenType.RBRACE);
            ConcatNode value = replicated instanceof ConcatNode concat
                    ? concat
                    : new ConcatNode(List.of(replicated), brace.getLine());
            return new ReplicationNode(first, value, brace.getLine());
        }

        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (check(TokenType.COMMA)) {
            advance();
            elements.add(parseExpression());
        }
        expect(TokenType.RBRACE);
        return new ConcatNode(elements, brace.getLine());
    }

    private List<SyntaxNode> parseArguments() {
        expect(TokenType.LPAREN);
        List<SyntaxNode> arguments = new ArrayList<>();
        if (check(TokenType.RPAREN)) {
            advance();
            return arguments;
        }
        arguments.add(parseExpression());
        while (check(TokenType.COMMA)) {
            advance();
            arguments.add(parseExpression());
        }
        expect(TokenType.RPAREN);
        return arguments;
    }

    private SyntaxNode parseSelects(SyntaxNode target) {
        SyntaxNode node = target;
        while (check(TokenType.LBRACKET)) {
            VerilogToken bracket = advance();
            SyntaxNode first = parseExpression();
            if (check(TokenType.COLON)) {
                advance();
                SyntaxNode second = parseExpression();
                expect(TokenType.RBRACKET);
                node = new PartSelectNode(node, first, second, PartSelectNode.Kind.RANGE, bracket.getLine());
            } else if (checkOperator("+:") || checkOperator("-:")) {
                PartSelectNode.Kind kind = advance().getValue().equals("+:")
                        ? PartSelectNode.Kind.INDEXED_UP
                        : PartSelectNode.Kind.INDEXED_DOWN;
                SyntaxNode second = parseExpression();
                expect(TokenType.RBRACKET);
                node = new PartSelectNode(node, first, second, kind, bracket.getLine());
            } else {
                expect(TokenType.RBRACKET);
                node = new IndexNode(node, first, bracket.getLine());
            }
        }
        return node;
    }

    private WidthNode parseRange() {
        VerilogToken bracket = expect(TokenType.LBRACKET);
        SyntaxNode msb = parseExpression();
        expect(TokenType.COLON);
        SyntaxNode lsb = parseExpression();
        expect(TokenType.RBRACKET);
        return new WidthNode(msb, lsb, bracket.getLine());
    }

    private String parseHierarchicalName() {
        StringBuilder name = new StringBuilder(expectIdentifier("identifier"));
        while (check(TokenType.DOT) && peekAhead(1).getType() == TokenType.IDENTIFIER) {
            advance();
            name.append('.').append(advance().getValue());
        }
        return name.toString();
    }

    /**
     * Optional net type, {@code reg}, {@code signed} and range following a port direction.
     */
    private Declarator parseDeclarator() {
        Declarator declarator = new Declarator();
        if (peek().isNetType()) {
            declarator.netKind = advance().getValue();
        } else if (check(TokenType.REG) || check(TokenType.LOGIC)) {
            advance();
            declarator.register = true;
        }
        declarator.signed = acceptType(TokenType.SIGNED);
        if (check(TokenType.LBRACKET)) {
            declarator.width = parseRange();
        }
        return declarator;
    }

    private static final class Declarator {
        private String netKind;
        private boolean register;
        private boolean signed;
        private WidthNode width;
    }

    // ---------------------------------------------------------------- helpers

    private void skipParameterType() {
        while (check(TokenType.SIGNED) || check(TokenType.INTEGER) || check(TokenType.REAL)) {
            advance();
        }
        if (check(TokenType.LBRACKET)) {
            parseRange();
        }
    }

    private void skipDelay() {
        expect(TokenType.HASH);
        if (check(TokenType.LPAREN)) {
            advance();
            skipBalanced(TokenType.LPAREN, TokenType.RPAREN);
        } else if (!isAtEnd()) {
            advance();
        }
    }

    /**
     * Skips to the token closing an already consumed opening token.
     */
    private void skipBalanced(TokenType open, TokenType close) {
        int depth = 1;
        while (!isAtEnd()) {
            VerilogToken token = advance();
            if (token.getType() == open) {
                depth++;
            } else if (token.getType() == close && --depth == 0) {
                return;
            }
        }
        throw error("Unbalanced '" + open + "'");
    }

    private void skipConstruct(TokenType endType, ToolDiagnostics diagnostics) {
        VerilogToken start = advance();
        diagnostics.getWarnings().add(location(start) + "skipping unsupported " + start.getValue() + " block");
        skipPast(endType);
    }

    private void skipPast(TokenType type) {
        while (!isAtEnd() && !check(type)) {
            advance();
        }
        if (check(type)) {
            advance();
        }
    }

    private void skipToSemicolon() {
        while (!isAtEnd() && !check(TokenType.SEMICOLON) && !check(TokenType.ENDMODULE)) {
            advance();
        }
        if (check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private boolean acceptType(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private VerilogToken peek() {
        return tokens.get(pos);
    }

    private VerilogToken peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private VerilogToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private boolean checkOperator(String operator) {
        return peek().isOperator(operator);
    }

    private VerilogToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private VerilogToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + type + " but found '" + peek().getValue() + "'");
    }

    private String expectIdentifier(String what) {
        if (check(TokenType.IDENTIFIER)) {
            return advance().getValue();
        }
        throw error("Expected " + what + " but found '" + peek().getValue() + "'");
    }

    private ParseException error(String message) {
        return new ParseException(message, fileName, peek().getLine());
    }

    private String location(VerilogToken token) {
        return fileName + ":" + token.getLine() + ": ";
    }
}
