package com.hardware.cdc.report;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Output formats for an analysis report.
 */
public enum ReportFormat {
    TEXT,
    JSON;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ReportFormat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(format -> format.id().equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
