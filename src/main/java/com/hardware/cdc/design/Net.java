package com.hardware.cdc.design;

import lombok.Value;

/**
 * A declared net of a module. Only the name and kind are tracked.
 */
@Value
public class Net {
    String name;
    String kind;
}
