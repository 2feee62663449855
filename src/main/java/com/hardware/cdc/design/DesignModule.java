package com.hardware.cdc.design;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * A module of the design: its port names, nets and registers, each kept in
 * declaration order. A name is declared at most once; later declarations of
 * the same name are ignored.
 */
@ToString
public class DesignModule {
    @Getter
    private final String name;
    @Getter
    private final String sourceFile;
    private final Set<String> ports = new LinkedHashSet<>();
    private final Map<String, Net> nets = new LinkedHashMap<>();
    private final Map<String, Register> registers = new LinkedHashMap<>();

    DesignModule(String name, String sourceFile) {
        this.name = name;
        this.sourceFile = sourceFile;
    }

    public Set<String> getPorts() {
        return Collections.unmodifiableSet(ports);
    }

    public Map<String, Net> getNets() {
        return Collections.unmodifiableMap(nets);
    }

    public Map<String, Register> getRegisters() {
        return Collections.unmodifiableMap(registers);
    }

    public Optional<Register> findRegister(String registerName) {
        return Optional.ofNullable(registers.get(registerName));
    }

    void addPort(String port) {
        ports.add(port);
    }

    Net declareNet(String netName, String kind) {
        return nets.computeIfAbsent(netName, key -> new Net(key, kind));
    }

    Register declareRegister(String registerName, List<Integer> bitIndices) {
        return registers.computeIfAbsent(registerName, key -> new Register(key, name, bitIndices));
    }
}
