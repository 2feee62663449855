package com.hardware.cdc.analysis;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.hardware.cdc.design.DesignGraph;
import com.hardware.cdc.design.Register;

/**
 * Groups registers by their clock. Unclocked registers belong to no domain.
 */
public class ClockDomainDeriver {

    public List<ClockDomain> derive(DesignGraph graph) {
        Map<String, SortedSet<String>> registersByClock = new TreeMap<>();
        for (Register register : graph.getAllRegisters()) {
            register.getClock().ifPresent(clock ->
                    registersByClock.computeIfAbsent(clock, key -> new TreeSet<>()).add(register.getName()));
        }

        return registersByClock.entrySet().stream()
                .map(entry -> new ClockDomain(entry.getKey(), Collections.unmodifiableSortedSet(entry.getValue())))
                .toList();
    }
}
