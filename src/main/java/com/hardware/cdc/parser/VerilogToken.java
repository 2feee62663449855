package com.hardware.cdc.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the Verilog tokenizer.
 */
@Data
@AllArgsConstructor
public class VerilogToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        MODULE,
        MACROMODULE,
        ENDMODULE,
        INPUT,
        OUTPUT,
        INOUT,
        REG,
        WIRE,
        TRI,
        TRI0,
        TRI1,
        WAND,
        WOR,
        UWIRE,
        SUPPLY0,
        SUPPLY1,
        LOGIC,
        SIGNED,
        INTEGER,
        REAL,
        GENVAR,
        PARAMETER,
        LOCALPARAM,
        DEFPARAM,
        ASSIGN,
        ALWAYS,
        ALWAYS_FF,
        ALWAYS_COMB,
        ALWAYS_LATCH,
        INITIAL,
        BEGIN,
        END,
        IF,
        ELSE,
        CASE,
        CASEX,
        CASEZ,
        ENDCASE,
        DEFAULT,
        FOR,
        POSEDGE,
        NEGEDGE,
        OR,
        GENERATE,
        ENDGENERATE,
        FUNCTION,
        ENDFUNCTION,
        TASK,
        ENDTASK,
        SPECIFY,
        ENDSPECIFY,
        IDENTIFIER,
        SYSTEM_IDENTIFIER,
        NUMBER,
        STRING_LITERAL,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        SEMICOLON,
        COMMA,
        DOT,
        COLON,
        HASH,
        AT,
        QUESTION,
        EQUALS,
        OPERATOR,
        EOF,
        UNKNOWN
    }

    public boolean isNetType() {
        return type == TokenType.WIRE || type == TokenType.TRI ||
               type == TokenType.TRI0 || type == TokenType.TRI1 ||
               type == TokenType.WAND || type == TokenType.WOR ||
               type == TokenType.UWIRE || type == TokenType.SUPPLY0 ||
               type == TokenType.SUPPLY1;
    }

    public boolean isPortDirection() {
        return type == TokenType.INPUT || type == TokenType.OUTPUT || type == TokenType.INOUT;
    }

    public boolean isAlwaysKeyword() {
        return type == TokenType.ALWAYS || type == TokenType.ALWAYS_FF ||
               type == TokenType.ALWAYS_COMB || type == TokenType.ALWAYS_LATCH;
    }

    public boolean isOperator(String text) {
        return type == TokenType.OPERATOR && value.equals(text);
    }
}
