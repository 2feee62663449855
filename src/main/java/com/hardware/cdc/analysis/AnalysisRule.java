package com.hardware.cdc.analysis;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Rules a crossing can be reported under. Rules are referred to by id on the
 * command line and in reports.
 */
@Getter
@RequiredArgsConstructor
public enum AnalysisRule {
    UNSAFE_CROSSING("unsafe_crossing");

    private final String id;

    public static Optional<AnalysisRule> fromId(String id) {
        return Arrays.stream(values())
                .filter(rule -> rule.id.equals(id))
                .findFirst();
    }
}
