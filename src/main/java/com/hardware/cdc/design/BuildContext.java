package com.hardware.cdc.design;

import lombok.Value;
import lombok.With;

/**
 * Where the builder currently is: the enclosing module and the clock of the
 * enclosing always block. Either may be {@code null}.
 */
@Value
@With
class BuildContext {
    DesignModule module;
    String clock;

    static BuildContext root() {
        return new BuildContext(null, null);
    }
}
