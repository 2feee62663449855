package com.hardware.cdc.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * One signal feeding one register stage from a different clock domain.
 *
 * {@code register} is the stage written: the register name, or
 * {@code name[index]} for a single bit. A {@code null} domain means the side
 * has no clock.
 */
@Value
@Builder
public class Crossing {
    String module;
    String signal;
    String register;
    String sourceDomain;
    String targetDomain;
    boolean safe;
    CrossingReason reason;
    String rule;
}
