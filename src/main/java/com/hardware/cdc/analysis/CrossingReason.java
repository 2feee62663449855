package com.hardware.cdc.analysis;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a crossing was classified the way it was.
 */
@Getter
@RequiredArgsConstructor
public enum CrossingReason {
    /**
     * The source has no clock: a port, a net or an unclocked register.
     */
    COMBINATIONAL_PATH("combinational path"),

    /**
     * The source is clocked by a different clock than the target.
     */
    ASYNC_SOURCE("async source"),

    /**
     * The target is followed by a second register on its own clock that it
     * alone drives.
     */
    TWO_STAGE_SYNCHRONIZER("two-stage synchronizer");

    private final String label;

    @Override
    public String toString() {
        return label;
    }
}
