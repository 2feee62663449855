package com.hardware.cdc.design;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of the analyzed design: modules by name, in the order they were
 * defined. Read-only once built.
 */
public class DesignGraph {
    private final Map<String, DesignModule> modules;

    public DesignGraph(Map<String, DesignModule> modules) {
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
    }

    public Map<String, DesignModule> getModules() {
        return modules;
    }

    public Collection<DesignModule> allModules() {
        return modules.values();
    }

    public Optional<DesignModule> findModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public List<Register> getAllRegisters() {
        return modules.values().stream()
                .flatMap(module -> module.getRegisters().values().stream())
                .toList();
    }

    /**
     * Looks a register up in the given module first, then in every module in
     * definition order. When several modules declare the same name the global
     * match is ambiguous; use it for diagnostics only.
     */
    public Optional<Register> findRegister(String name, String scope) {
        if (scope != null) {
            Optional<Register> scoped = findModule(scope).flatMap(module -> module.findRegister(name));
            if (scoped.isPresent()) {
                return scoped;
            }
        }
        return modules.values().stream()
                .map(module -> module.getRegisters().get(name))
                .filter(register -> register != null)
                .findFirst();
    }
}
