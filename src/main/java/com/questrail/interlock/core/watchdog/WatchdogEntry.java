package com.questrail.interlock.core.watchdog;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * A pending confirmation: a condition that must become true before a monotonic
 * deadline.
 *
 * @param id            unique, increasing registration id
 * @param name          confirmation name, e.g. {@code gate_locked_confirmed}
 * @param predicate     confirmation condition, evaluated against live sensor data
 * @param deadlineNanos monotonic deadline
 * @param description   text logged when the deadline passes
 * @param onTimeout     callback replacing the supervisor's default timeout listener
 * @param metadata      free-form context carried into logs and callbacks
 */
public record WatchdogEntry(
    long id,
    String name,
    BooleanSupplier predicate,
    long deadlineNanos,
    String description,
    Optional<Consumer<WatchdogEntry>> onTimeout,
    Map<String, String> metadata
) {
    public WatchdogEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(onTimeout, "onTimeout");
        metadata = Map.copyOf(Objects.requireNonNull(metadata, "metadata"));
    }

    public WatchdogHandle handle() {
        return new WatchdogHandle(id, name);
    }

    public boolean isOverdue(long nowNanos) {
        return nowNanos - deadlineNanos >= 0;
    }
}
