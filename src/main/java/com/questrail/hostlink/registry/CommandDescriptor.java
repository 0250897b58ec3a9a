package com.questrail.hostlink.registry;

import com.questrail.hostlink.api.SafetyTier;

import java.util.Objects;

/**
 * Registry entry for one command. Immutable; safe to share across threads.
 */
public record CommandDescriptor(String name, CommandHandler handler, SafetyTier safetyTier) {
    public CommandDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(safetyTier, "safetyTier");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
    }

    public boolean isLossyEligible() {
        return safetyTier == SafetyTier.LOSSY_ELIGIBLE;
    }
}
