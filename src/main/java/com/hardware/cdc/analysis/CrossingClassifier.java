package com.hardware.cdc.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.design.DesignGraph;
import com.hardware.cdc.design.DesignModule;
import com.hardware.cdc.design.Register;

/**
 * Finds every driver of every register stage whose clock differs from the
 * register's clock and decides whether the crossing is synchronized.
 *
 * Signals are resolved inside the owning module only. {@code name[i]}
 * resolves to register {@code name} when no register is literally called
 * {@code name[i]}. Anything that does not resolve has no clock.
 *
 * A crossing into stage S of a clocked register is safe when another stage
 * on the same clock is driven by S and nothing else. This recognizes the
 * two flip-flop synchronizer only; longer chains and reconvergence are not
 * checked.
 */
public class CrossingClassifier {
    private static final Logger log = LoggerFactory.getLogger(CrossingClassifier.class);

    public List<Crossing> classify(DesignGraph graph) {
        List<Crossing> crossings = new ArrayList<>();

        for (DesignModule module : graph.allModules()) {
            for (Register register : module.getRegisters().values()) {
                String targetDomain = register.getClock().orElse(null);

                for (Map.Entry<String, SortedSet<String>> stage : register.getDrivers().entrySet()) {
                    for (String signal : stage.getValue()) {
                        String sourceDomain = resolveSource(module, signal)
                                .flatMap(Register::getClock)
                                .orElse(null);
                        if (Objects.equals(sourceDomain, targetDomain)) {
                            continue;
                        }
                        crossings.add(classify(module, register, stage.getKey(), signal, sourceDomain, targetDomain));
                    }
                }
            }
        }

        return crossings;
    }

    private Crossing classify(DesignModule module, Register register, String stage, String signal,
                              String sourceDomain, String targetDomain) {
        CrossingReason reason = sourceDomain == null
                ? CrossingReason.COMBINATIONAL_PATH
                : CrossingReason.ASYNC_SOURCE;
        boolean safe = false;

        if (targetDomain != null && isSynchronized(module, register, stage, targetDomain)) {
            safe = true;
            reason = CrossingReason.TWO_STAGE_SYNCHRONIZER;
        }

        log.debug("{}.{} <= {} ({} -> {}): {}", module.getName(), stage, signal,
                sourceDomain, targetDomain, reason);

        return Crossing.builder()
                .module(module.getName())
                .signal(signal)
                .register(stage)
                .sourceDomain(sourceDomain)
                .targetDomain(targetDomain)
                .safe(safe)
                .reason(reason)
                .rule(AnalysisRule.UNSAFE_CROSSING.getId())
                .build();
    }

    private boolean isSynchronized(DesignModule module, Register register, String stage, String clock) {
        Set<String> drivenByStageAlone = Set.of(stage);

        for (Register candidate : module.getRegisters().values()) {
            if (!candidate.getClock().map(clock::equals).orElse(false)) {
                continue;
            }
            for (Map.Entry<String, SortedSet<String>> candidateStage : candidate.getDrivers().entrySet()) {
                if (candidate == register && candidateStage.getKey().equals(stage)) {
                    continue;
                }
                if (candidateStage.getValue().equals(drivenByStageAlone)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Optional<Register> resolveSource(DesignModule module, String signal) {
        Optional<Register> exact = module.findRegister(signal);
        if (exact.isPresent()) {
            return exact;
        }
        int bracket = signal.indexOf('[');
        if (bracket > 0 && signal.endsWith("]")) {
            return module.findRegister(signal.substring(0, bracket));
        }
        return Optional.empty();
    }
}
