package com.hardware.cdc.parser.exception;

import lombok.Getter;

/**
 * Syntax error in a Verilog source file.
 */
@Getter
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final int line;

    public ParseException(String message, String fileName, int line) {
        super(fileName + ":" + line + ": " + message);
        this.fileName = fileName;
        this.line = line;
    }
}
