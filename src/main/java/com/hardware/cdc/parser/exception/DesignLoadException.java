package com.hardware.cdc.parser.exception;

import java.util.List;

/**
 * The design could not be loaded: input files are missing or failed to parse.
 * Holds every problem found so they can be reported together.
 */
public class DesignLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String summary;
    private final List<String> problems;

    public DesignLoadException(String summary, List<String> problems) {
        super(problems.isEmpty() ? summary : summary + System.lineSeparator()
                + String.join(System.lineSeparator(), problems));
        this.summary = summary;
        this.problems = List.copyOf(problems);
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getProblems() {
        return problems;
    }
}
