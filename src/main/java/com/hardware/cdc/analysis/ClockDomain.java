package com.hardware.cdc.analysis;

import java.util.SortedSet;

import lombok.Value;

/**
 * A clock signal and the names of the registers it clocks.
 */
@Value
public class ClockDomain {
    String name;
    SortedSet<String> registers;
}
