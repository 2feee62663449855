package com.hardware.cdc.design;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.hardware.cdc.ast.IdentifierNode;
import com.hardware.cdc.ast.SensListNode;
import com.hardware.cdc.ast.SensNode;

/**
 * Picks the signal that clocks an always block.
 *
 * Only edge entries on plain identifiers are candidates. The first
 * candidate whose name does not look like a reset wins; if all of them look
 * like resets the last one is used.
 */
public class FunctionalClockResolver {

    static final List<String> RESET_TOKENS = List.of("rst", "reset", "areset", "srst", "clr");

    public Optional<String> resolve(SensListNode sensList) {
        if (sensList == null) {
            return Optional.empty();
        }

        String lastEdge = null;
        for (SensNode entry : sensList.getEntries()) {
            if (!entry.getType().isEdge() || !(entry.getSignal() instanceof IdentifierNode signal)) {
                continue;
            }
            if (!looksLikeReset(signal.getName())) {
                return Optional.of(signal.getName());
            }
            lastEdge = signal.getName();
        }
        return Optional.ofNullable(lastEdge);
    }

    public boolean looksLikeReset(String signal) {
        String lowered = signal.toLowerCase(Locale.ROOT);
        return RESET_TOKENS.stream().anyMatch(lowered::contains);
    }
}
