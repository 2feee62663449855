package com.hardware.cdc.ast;

/**
 * Kind of a sensitivity list entry.
 */
public enum EdgeType {
    /**
     * Rising edge ({@code posedge}).
     */
    POSEDGE,

    /**
     * Falling edge ({@code negedge}).
     */
    NEGEDGE,

    /**
     * Any change of the signal.
     */
    LEVEL,

    /**
     * Implicit sensitivity ({@code @*} or {@code @(*)}).
     */
    ALL;

    public boolean isEdge() {
        return this == POSEDGE || this == NEGEDGE;
    }
}
