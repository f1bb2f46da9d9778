package com.questrail.interlock.io;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SensorTable
 * -----------------------------------------------------------------------------
 * Capability table mapping each wired {@link SignalName} to its
 * {@link SignalReader}.
 *
 * <p>The table is resolved once, when the chamber is configured. The control
 * cycle never looks signals up by string and never discovers devices at run
 * time; a missing optional signal simply reads as absent.</p>
 */
public final class SensorTable
{
    private final Map<SignalName, SignalReader> readers;

    private SensorTable(Map<SignalName, SignalReader> readers) {
        this.readers = Collections.unmodifiableMap(new EnumMap<>(readers));
    }

    /**
     * Returns the reader for a signal, if the chamber is wired with it.
     */
    public Optional<SignalReader> reader(SignalName signal) {
        return Optional.ofNullable(readers.get(Objects.requireNonNull(signal, "signal")));
    }

    public boolean has(SignalName signal) {
        return readers.containsKey(signal);
    }

    /**
     * Returns the set of wired signals.
     */
    public Set<SignalName> signals() {
        return readers.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<SignalName, SignalReader> readers = new EnumMap<>(SignalName.class);

        private Builder() {}

        public Builder with(SignalName signal, SignalReader reader) {
            readers.put(Objects.requireNonNull(signal, "signal"), Objects.requireNonNull(reader, "reader"));
            return this;
        }

        /**
         * Builds the table.
         *
         * @throws IllegalStateException if a required signal is missing
         */
        public SensorTable build() {
            for (SignalName signal : SignalName.values()) {
                if (signal.isRequired() && !readers.containsKey(signal)) {
                    throw new IllegalStateException("Required signal not wired: " + signal);
                }
            }
            return new SensorTable(readers);
        }
    }
}
