package com.hardware.cdc.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Tool-wide diagnostics (errors/warnings) accumulated while loading and
 * building a design.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
