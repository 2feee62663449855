package com.hardware.cdc.design;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Getter;
import lombok.ToString;

/**
 * A sequential storage element owned by one module.
 *
 * The clock is unset until the first clocked assignment is seen and is never
 * changed afterwards. Drivers are kept per stage: the whole register under
 * its own name, or a single bit under {@code name[index]}. Assignments to the
 * same stage accumulate their source signals.
 */
@ToString
public class Register {
    @Getter
    private final String name;
    @Getter
    private final String module;
    private final List<Integer> bitIndices;
    private final Map<String, SortedSet<String>> drivers = new LinkedHashMap<>();
    private String clock;

    Register(String name, String module, List<Integer> bitIndices) {
        this.name = name;
        this.module = module;
        this.bitIndices = bitIndices != null ? List.copyOf(bitIndices) : null;
    }

    public Optional<String> getClock() {
        return Optional.ofNullable(clock);
    }

    /**
     * Declared bit positions in declaration order, or empty when the width
     * is not a constant.
     */
    public Optional<List<Integer>> getBitIndices() {
        return Optional.ofNullable(bitIndices);
    }

    public boolean hasBit(int index) {
        return bitIndices == null || bitIndices.contains(index);
    }

    /**
     * Stage key to driving signal names, stages in first-write order and
     * signals sorted.
     */
    public Map<String, SortedSet<String>> getDrivers() {
        Map<String, SortedSet<String>> view = new LinkedHashMap<>();
        drivers.forEach((stage, signals) -> view.put(stage, Collections.unmodifiableSortedSet(signals)));
        return Collections.unmodifiableMap(view);
    }

    public SortedSet<String> getStageDrivers(String stage) {
        SortedSet<String> signals = drivers.get(stage);
        return signals != null ? Collections.unmodifiableSortedSet(signals) : Collections.emptySortedSet();
    }

    public String stageKey(int index) {
        return name + "[" + index + "]";
    }

    boolean assignClockIfUnset(String candidate) {
        if (candidate == null || clock != null) {
            return false;
        }
        clock = candidate;
        return true;
    }

    void recordDrivers(String stage, Collection<String> signals) {
        drivers.computeIfAbsent(stage, key -> new TreeSet<>()).addAll(signals);
    }
}
