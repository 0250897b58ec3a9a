package com.questrail.hostlink.registry;

import com.questrail.hostlink.api.SafetyTier;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandRegistry
 * =============================================================================
 * Closed, immutable table mapping command names to handlers and safety tiers.
 *
 * <h2>Why tiers live here</h2>
 * Both listeners consult this table; neither carries its own eligibility rules.
 * Registering a command therefore forces an explicit {@link SafetyTier}, and a
 * command can only become reachable over the lossy transport by being
 * registered as {@link SafetyTier#LOSSY_ELIGIBLE} in this one place.
 *
 * <h2>Lifecycle</h2>
 * Built once at startup through {@link Builder}. After {@link Builder#build()}
 * the set of commands is closed. Lookups are unsynchronized and safe from any
 * thread.
 */
public final class CommandRegistry {
    private final Map<String, CommandDescriptor> descriptors;

    private CommandRegistry(Map<String, CommandDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
    }

    /**
     * Look up the descriptor for a command name.
     *
     * @return the descriptor, or empty if the command is not registered
     */
    public Optional<CommandDescriptor> classify(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptors.get(name));
    }

    public Collection<CommandDescriptor> descriptors() {
        return descriptors.values();
    }

    public int size() {
        return descriptors.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, CommandDescriptor> descriptors = new LinkedHashMap<>();

        /**
         * Register a command.
         *
         * @throws IllegalArgumentException if the name is already registered
         */
        public Builder register(String name, CommandHandler handler, SafetyTier tier) {
            CommandDescriptor descriptor = new CommandDescriptor(name, handler, tier);
            if (descriptors.putIfAbsent(name, descriptor) != null) {
                throw new IllegalArgumentException("Command already registered: " + name);
            }
            return this;
        }

        /**
         * Register a command whose handler forwards 1:1 to the session API.
         */
        public Builder register(String name, SafetyTier tier) {
            return register(name, CommandHandler.delegating(), tier);
        }

        public Builder registerAll(CommandRegistry other) {
            Objects.requireNonNull(other, "other");
            for (CommandDescriptor d : other.descriptors()) {
                register(d.name(), d.handler(), d.safetyTier());
            }
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(descriptors);
        }
    }
}
