package com.hardware.cdc.parser;

import com.hardware.cdc.parser.VerilogToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tokenizer for Verilog source files.
 */
public class VerilogTokenizer {
    private static final Logger log = LoggerFactory.getLogger(VerilogTokenizer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("module", TokenType.MODULE),
        Map.entry("macromodule", TokenType.MACROMODULE),
        Map.entry("endmodule", TokenType.ENDMODULE),
        Map.entry("input", TokenType.INPUT),
        Map.entry("output", TokenType.OUTPUT),
        Map.entry("inout", TokenType.INOUT),
        Map.entry("reg", TokenType.REG),
        Map.entry("wire", TokenType.WIRE),
        Map.entry("tri", TokenType.TRI),
        Map.entry("tri0", TokenType.TRI0),
        Map.entry("tri1", TokenType.TRI1),
        Map.entry("wand", TokenType.WAND),
        Map.entry("wor", TokenType.WOR),
        Map.entry("uwire", TokenType.UWIRE),
        Map.entry("supply0", TokenType.SUPPLY0),
        Map.entry("supply1", TokenType.SUPPLY1),
        Map.entry("logic", TokenType.LOGIC),
        Map.entry("signed", TokenType.SIGNED),
        Map.entry("integer", TokenType.INTEGER),
        Map.entry("real", TokenType.REAL),
        Map.entry("genvar", TokenType.GENVAR),
        Map.entry("parameter", TokenType.PARAMETER),
        Map.entry("localparam", TokenType.LOCALPARAM),
        Map.entry("defparam", TokenType.DEFPARAM),
        Map.entry("assign", TokenType.ASSIGN),
        Map.entry("always", TokenType.ALWAYS),
        Map.entry("always_ff", TokenType.ALWAYS_FF),
        Map.entry("always_comb", TokenType.ALWAYS_COMB),
        Map.entry("always_latch", TokenType.ALWAYS_LATCH),
        Map.entry("initial", TokenType.INITIAL),
        Map.entry("begin", TokenType.BEGIN),
        Map.entry("end", TokenType.END),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("case", TokenType.CASE),
        Map.entry("casex", TokenType.CASEX),
        Map.entry("casez", TokenType.CASEZ),
        Map.entry("endcase", TokenType.ENDCASE),
        Map.entry("default", TokenType.DEFAULT),
        Map.entry("for", TokenType.FOR),
        Map.entry("posedge", TokenType.POSEDGE),
        Map.entry("negedge", TokenType.NEGEDGE),
        Map.entry("or", TokenType.OR),
        Map.entry("generate", TokenType.GENERATE),
        Map.entry("endgenerate", TokenType.ENDGENERATE),
        Map.entry("function", TokenType.FUNCTION),
        Map.entry("endfunction", TokenType.ENDFUNCTION),
        Map.entry("task", TokenType.TASK),
        Map.entry("endtask", TokenType.ENDTASK),
        Map.entry("specify", TokenType.SPECIFY),
        Map.entry("endspecify", TokenType.ENDSPECIFY)
    );

    // Longest operators first so that "<<<" wins over "<<" and "<".
    private static final List<String> OPERATORS = List.of(
        "<<<", ">>>", "===", "!==",
        "**", "<<", ">>", "==", "!=", "<=", ">=", "&&", "||",
        "~&", "~|", "~^", "^~", "+:", "-:",
        "+", "-", "*", "/", "%", "&", "|", "^", "~", "!", "<", ">"
    );

    // Directives that consume the rest of their line. Any other back-tick name is a macro use.
    private static final Set<String> LINE_DIRECTIVES = Set.of(
        "define", "undef", "include", "timescale", "ifdef", "ifndef", "elsif", "else", "endif",
        "default_nettype", "resetall", "celldefine", "endcelldefine", "line", "pragma",
        "unconnected_drive", "nounconnected_drive"
    );

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public VerilogTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file.
     */
    public List<VerilogToken> tokenize() {
        List<VerilogToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                break;
            }

            VerilogToken token = nextToken();
            if (token != null && token.getType() != TokenType.UNKNOWN) {
                tokens.add(token);
            } else if (token != null) {
                log.debug("{}:{}:{} skipping unexpected character '{}'",
                        fileName, token.getLine(), token.getColumn(), token.getValue());
            }
        }

        tokens.add(new VerilogToken(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                column++;
                pos++;
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        pos += 2;
        column += 2;
        while (pos < source.length()) {
            if (source.charAt(pos) == '*' && peekChar(1) == '/') {
                pos += 2;
                column += 2;
                return;
            }
            advanceChar();
        }
        log.warn("{}:{}: unterminated block comment", fileName, line);
    }

    private VerilogToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case '(': return single(TokenType.LPAREN, startLine, startCol);
            case ')': return single(TokenType.RPAREN, startLine, startCol);
            case '[': return single(TokenType.LBRACKET, startLine, startCol);
            case ']': return single(TokenType.RBRACKET, startLine, startCol);
            case '{': return single(TokenType.LBRACE, startLine, startCol);
            case '}': return single(TokenType.RBRACE, startLine, startCol);
            case ';': return single(TokenType.SEMICOLON, startLine, startCol);
            case ',': return single(TokenType.COMMA, startLine, startCol);
            case '.': return single(TokenType.DOT, startLine, startCol);
            case ':': return single(TokenType.COLON, startLine, startCol);
            case '#': return single(TokenType.HASH, startLine, startCol);
            case '@': return single(TokenType.AT, startLine, startCol);
            case '?': return single(TokenType.QUESTION, startLine, startCol);
            default: break;
        }

        if (c == '"') {
            return readStringLiteral(startLine, startCol);
        }

        if (c == '`') {
            return readDirective(startLine, startCol);
        }

        if (Character.isDigit(c)) {
            return readNumber(startLine, startCol);
        }

        if (c == '\'' && isBaseStart(peekChar(1))) {
            return readBasedNumber(new StringBuilder(), startLine, startCol);
        }

        if (c == '$' && isIdentifierPart(peekChar(1))) {
            return readSystemIdentifier(startLine, startCol);
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword(startLine, startCol);
        }

        if (c == '\\') {
            return readEscapedIdentifier(startLine, startCol);
        }

        // "==" must not be split into two assignments, so operators are tried before '='.
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                column += op.length();
                return new VerilogToken(TokenType.OPERATOR, op, startLine, startCol);
            }
        }

        if (c == '=') {
            return single(TokenType.EQUALS, startLine, startCol);
        }

        // Unknown character, skip it
        pos++;
        column++;
        return new VerilogToken(TokenType.UNKNOWN, String.valueOf(c), startLine, startCol);
    }

    private VerilogToken single(TokenType type, int startLine, int startCol) {
        String value = String.valueOf(source.charAt(pos));
        pos++;
        column++;
        return new VerilogToken(type, value, startLine, startCol);
    }

    private VerilogToken readStringLiteral(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote
        column++;

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\\' && pos + 1 < source.length()) {
                sb.append(c).append(source.charAt(pos + 1));
                pos += 2;
                column += 2;
            } else if (c == '"') {
                pos++;
                column++;
                break;
            } else if (c == '\n') {
                break; // Unterminated string
            } else {
                sb.append(c);
                pos++;
                column++;
            }
        }

        return new VerilogToken(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
    }

    private VerilogToken readDirective(int startLine, int startCol) {
        pos++; // Skip back-tick
        column++;
        StringBuilder name = new StringBuilder();
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            name.append(source.charAt(pos));
            pos++;
            column++;
        }

        if (!LINE_DIRECTIVES.contains(name.toString())) {
            // Macro use: the value is unknown here, keep it as an opaque identifier.
            return new VerilogToken(TokenType.IDENTIFIER, "`" + name, startLine, startCol);
        }

        log.debug("{}:{}: skipping directive `{}", fileName, startLine, name);
        while (pos < source.length() && source.charAt(pos) != '\n') {
            if (source.charAt(pos) == '\\' && peekChar(1) == '\n') {
                // Continued macro body
                pos += 2;
                line++;
                column = 1;
                continue;
            }
            pos++;
            column++;
        }
        return null;
    }

    private VerilogToken readNumber(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        if (source.charAt(pos) == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
            sb.append(source, pos, pos + 2);
            pos += 2;
            column += 2;
            while (pos < source.length() && (isHexDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                sb.append(source.charAt(pos));
                pos++;
                column++;
            }
            return new VerilogToken(TokenType.NUMBER, sb.toString(), startLine, startCol);
        }

        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }

        // Size and base may be separated by whitespace: 8 'hFF
        int lookahead = pos;
        while (lookahead < source.length() && (source.charAt(lookahead) == ' ' || source.charAt(lookahead) == '\t')) {
            lookahead++;
        }
        if (lookahead < source.length() && source.charAt(lookahead) == '\''
                && lookahead + 1 < source.length() && isBaseStart(source.charAt(lookahead + 1))) {
            column += lookahead - pos;
            pos = lookahead;
            return readBasedNumber(sb, startLine, startCol);
        }

        if (pos < source.length() && source.charAt(pos) == '.' && Character.isDigit(peekChar(1))) {
            sb.append('.');
            pos++;
            column++;
            while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                sb.append(source.charAt(pos));
                pos++;
                column++;
            }
        }

        return new VerilogToken(TokenType.NUMBER, sb.toString(), startLine, startCol);
    }

    private VerilogToken readBasedNumber(StringBuilder sb, int startLine, int startCol) {
        sb.append('\'');
        pos++;
        column++;
        if (pos < source.length() && (source.charAt(pos) == 's' || source.charAt(pos) == 'S')) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }
        if (pos < source.length() && "bBoOdDhH".indexOf(source.charAt(pos)) >= 0) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
            while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
                pos++;
                column++;
            }
        }
        while (pos < source.length() && isBasedDigit(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }
        return new VerilogToken(TokenType.NUMBER, sb.toString(), startLine, startCol);
    }

    private VerilogToken readSystemIdentifier(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder("$");
        pos++;
        column++;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }
        return new VerilogToken(TokenType.SYSTEM_IDENTIFIER, sb.toString(), startLine, startCol);
    }

    private VerilogToken readIdentifierOrKeyword(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }

        String value = sb.toString();

        // Verilog keywords are case-sensitive and lower case
        TokenType keywordType = KEYWORDS.get(value);
        if (keywordType != null) {
            return new VerilogToken(keywordType, value, startLine, startCol);
        }

        return new VerilogToken(TokenType.IDENTIFIER, value, startLine, startCol);
    }

    private VerilogToken readEscapedIdentifier(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        pos++; // Skip backslash
        column++;
        while (pos < source.length() && !Character.isWhitespace(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            pos++;
            column++;
        }
        return new VerilogToken(TokenType.IDENTIFIER, sb.toString(), startLine, startCol);
    }

    private void advanceChar() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isBaseStart(char c) {
        return "sSbBoOdDhH01xXzZ".indexOf(c) >= 0 && c != '\0';
    }

    private static boolean isBasedDigit(char c) {
        return isHexDigit(c) || "xXzZ?_".indexOf(c) >= 0;
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
