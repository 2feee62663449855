package com.hardware.cdc.ast;

/**
 * Direction of a port declaration.
 */
public enum PortDirection {
    INPUT,
    OUTPUT,
    INOUT;

    public static PortDirection fromVerilog(String keyword) {
        String normalized = keyword.toLowerCase().trim();
        return switch (normalized) {
            case "input" -> INPUT;
            case "output" -> OUTPUT;
            case "inout" -> INOUT;
            default -> throw new IllegalArgumentException("Not a port direction: " + keyword);
        };
    }
}
