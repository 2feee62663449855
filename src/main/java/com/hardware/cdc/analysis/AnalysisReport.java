package com.hardware.cdc.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Getter;
import lombok.ToString;

/**
 * Result of one analysis run: clock domains, every crossing found and the
 * rules the caller asked to suppress.
 *
 * A crossing is a violation when it is unsafe and its rule is not disabled.
 */
@Getter
@ToString
public class AnalysisReport {
    private final List<ClockDomain> clockDomains;
    private final List<Crossing> crossings;
    private final SortedSet<String> disabledRules;

    public AnalysisReport(List<ClockDomain> clockDomains, List<Crossing> crossings, Collection<String> disabledRules) {
        this.clockDomains = List.copyOf(clockDomains);
        this.crossings = List.copyOf(crossings);
        this.disabledRules = Collections.unmodifiableSortedSet(
                disabledRules != null ? new TreeSet<>(disabledRules) : new TreeSet<>());
    }

    public boolean isReported(Crossing crossing) {
        return !crossing.isSafe() && !disabledRules.contains(crossing.getRule());
    }

    public List<Crossing> violations() {
        return crossings.stream()
                .filter(this::isReported)
                .toList();
    }

    public boolean hasViolations() {
        return crossings.stream().anyMatch(this::isReported);
    }

    /**
     * 0 when there is nothing to report, 1 otherwise.
     */
    public int exitCode() {
        return hasViolations() ? 1 : 0;
    }
}
