package com.questrail.interlock.core.watchdog;

import com.questrail.interlock.internal.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * WatchdogSupervisor
 * -----------------------------------------------------------------------------
 * Registry of pending sensor confirmations, each with a deadline.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Every {@link #register} call creates a new entry; there is no
 *       de-duplication by name.</li>
 *   <li>{@link #evaluate(long)} visits entries in registration order. An entry
 *       whose predicate holds is dropped silently. An entry past its deadline is
 *       logged at WARN, handed to its own callback (or to the default timeout
 *       listener) and dropped. A timeout therefore fires exactly once.</li>
 *   <li>A predicate or callback that throws is logged at ERROR and its entry is
 *       dropped; the remaining entries are still evaluated.</li>
 * </ul>
 *
 * <h2>What it does not do</h2>
 * Expiry is advisory. The supervisor never changes the interlock state; it only
 * reports that a commanded transition was not confirmed.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Registration and evaluation both happen on the control-cycle
 * thread, and the supervisor owns no timer or thread of its own.
 */
public final class WatchdogSupervisor
{
    private static final Logger log = LoggerFactory.getLogger(WatchdogSupervisor.class);

    private final MonotonicClock clock;
    private final Consumer<WatchdogEntry> defaultTimeoutListener;
    private final Map<Long, WatchdogEntry> entries = new LinkedHashMap<>();
    private long nextId = 1;

    /**
     * @param clock                  monotonic source for deadlines
     * @param defaultTimeoutListener called for expired entries without a callback of their own
     */
    public WatchdogSupervisor(MonotonicClock clock, Consumer<WatchdogEntry> defaultTimeoutListener) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTimeoutListener = Objects.requireNonNull(defaultTimeoutListener, "defaultTimeoutListener");
    }

    public WatchdogSupervisor(MonotonicClock clock) {
        this(clock, entry -> { });
    }

    /**
     * Registers a confirmation to supervise.
     *
     * @param name        confirmation name
     * @param predicate   condition that confirms the transition
     * @param timeout     time allowed from now, must not be negative
     * @param description text logged on expiry
     * @param onTimeout   optional callback, {@code null} to use the default listener
     * @param metadata    optional context, {@code null} for none
     * @return handle for {@link #cancel(WatchdogHandle)}
     */
    public WatchdogHandle register(String name,
                                   BooleanSupplier predicate,
                                   Duration timeout,
                                   String description,
                                   Consumer<WatchdogEntry> onTimeout,
                                   Map<String, String> metadata) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }

        long id = nextId++;
        WatchdogEntry entry = new WatchdogEntry(
                id,
                name,
                predicate,
                clock.nowNanos() + timeout.toNanos(),
                description,
                Optional.ofNullable(onTimeout),
                metadata == null ? Map.of() : metadata);

        entries.put(id, entry);
        log.debug("Watchdog '{}' armed (id={}, timeout={} ms)", name, id, timeout.toMillis());
        return entry.handle();
    }

    public WatchdogHandle register(String name, BooleanSupplier predicate, Duration timeout, String description) {
        return register(name, predicate, timeout, description, null, null);
    }

    /**
     * Evaluates every entry once against {@code nowNanos}.
     *
     * @return the entries that expired during this evaluation
     */
    public List<WatchdogEntry> evaluate(long nowNanos) {
        List<WatchdogEntry> expired = new ArrayList<>();

        // Callbacks may register new entries; iterate over a copy.
        for (WatchdogEntry entry : new ArrayList<>(entries.values())) {
            try {
                if (entry.predicate().getAsBoolean()) {
                    entries.remove(entry.id());
                    log.debug("Watchdog '{}' confirmed (id={})", entry.name(), entry.id());
                    continue;
                }
                if (!entry.isOverdue(nowNanos)) {
                    continue;
                }

                entries.remove(entry.id());
                expired.add(entry);
                log.warn("Watchdog '{}' timed out: {}", entry.name(), entry.description());
                entry.onTimeout().orElse(defaultTimeoutListener).accept(entry);
            } catch (RuntimeException ex) {
                entries.remove(entry.id());
                log.error("Watchdog '{}' failed and was dropped", entry.name(), ex);
            }
        }
        return expired;
    }

    /**
     * Removes a registered entry.
     *
     * @return {@code true} if the entry was still active
     */
    public boolean cancel(WatchdogHandle handle) {
        Objects.requireNonNull(handle, "handle");
        return entries.remove(handle.id()) != null;
    }

    /**
     * Returns a snapshot of the active entries in registration order.
     */
    public List<WatchdogEntry> active() {
        return List.copyOf(entries.values());
    }

    public boolean isActive(String name) {
        for (WatchdogEntry e : entries.values()) {
            if (e.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return entries.size();
    }
}
