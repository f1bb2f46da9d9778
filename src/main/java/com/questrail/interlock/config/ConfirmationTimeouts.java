package com.questrail.interlock.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ConfirmationTimeouts
 * -----------------------------------------------------------------------------
 * How long the watchdog waits for each {@link ConfirmationKind} before it
 * reports a confirmation timeout.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>{@code partition_open_reached}: 10 s</li>
 *   <li>{@code partition_close_reached}: 10 s</li>
 *   <li>{@code gate_locked_confirmed}: 2 s</li>
 *   <li>{@code gate_unlocked_confirmed}: 2 s</li>
 *   <li>{@code gate_closed_confirmed}: 180 s</li>
 * </ul>
 *
 * <h2>Overrides</h2>
 * Deployments override individual timeouts by key, in seconds. An override is
 * rejected with a warning, and the default kept, when its key is unknown or its
 * value is not a finite positive number.
 */
public final class ConfirmationTimeouts
{
    private static final Logger log = LoggerFactory.getLogger(ConfirmationTimeouts.class);

    private final Map<ConfirmationKind, Duration> timeouts;

    private ConfirmationTimeouts(Map<ConfirmationKind, Duration> timeouts) {
        EnumMap<ConfirmationKind, Duration> copy = new EnumMap<>(ConfirmationKind.class);
        copy.putAll(timeouts);
        for (ConfirmationKind kind : ConfirmationKind.values()) {
            Duration d = copy.get(kind);
            if (d == null) {
                throw new IllegalArgumentException("Missing timeout for " + kind.key());
            }
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(kind.key() + " must be positive");
            }
        }
        this.timeouts = Collections.unmodifiableMap(copy);
    }

    public static ConfirmationTimeouts defaults() {
        Map<ConfirmationKind, Duration> m = new EnumMap<>(ConfirmationKind.class);
        m.put(ConfirmationKind.PARTITION_OPEN_REACHED, Duration.ofSeconds(10));
        m.put(ConfirmationKind.PARTITION_CLOSE_REACHED, Duration.ofSeconds(10));
        m.put(ConfirmationKind.GATE_LOCKED_CONFIRMED, Duration.ofSeconds(2));
        m.put(ConfirmationKind.GATE_UNLOCKED_CONFIRMED, Duration.ofSeconds(2));
        m.put(ConfirmationKind.GATE_CLOSED_CONFIRMED, Duration.ofSeconds(180));
        return new ConfirmationTimeouts(m);
    }

    /**
     * Returns the defaults with the given overrides applied.
     *
     * @param overrides key to seconds; values may be {@link Number}s or numeric strings
     */
    public static ConfirmationTimeouts fromOverrides(Map<String, ?> overrides) {
        return defaults().withOverrides(overrides);
    }

    public Duration timeoutFor(ConfirmationKind kind) {
        return timeouts.get(Objects.requireNonNull(kind, "kind"));
    }

    /**
     * Returns a copy with the valid entries of {@code overrides} applied.
     * Invalid entries are logged and skipped one by one, so a single bad value
     * never discards the valid ones next to it.
     */
    public ConfirmationTimeouts withOverrides(Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides");

        Map<ConfirmationKind, Duration> m = new EnumMap<>(timeouts);
        for (Map.Entry<String, ?> e : overrides.entrySet()) {
            String key = e.getKey();
            if (key == null) {
                log.warn("Ignoring timeout override without a key");
                continue;
            }
            var kind = ConfirmationKind.fromKey(key.trim());
            if (kind.isEmpty()) {
                log.warn("Ignoring unknown timeout override '{}'", key);
                continue;
            }
            Duration parsed = parseSeconds(e.getValue());
            if (parsed == null) {
                log.warn("Invalid value '{}' for timeout '{}', keeping default of {} s",
                        e.getValue(), key, seconds(m.get(kind.get())));
                continue;
            }
            m.put(kind.get(), parsed);
        }
        return new ConfirmationTimeouts(m);
    }

    /**
     * Returns the timeouts keyed by configuration key, in seconds.
     */
    public Map<String, Double> asSeconds() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (ConfirmationKind kind : ConfirmationKind.values()) {
            out.put(kind.key(), seconds(timeouts.get(kind)));
        }
        return out;
    }

    private static Duration parseSeconds(Object value) {
        double seconds;
        if (value instanceof Number n) {
            seconds = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                seconds = Double.parseDouble(s.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        } else {
            return null;
        }

        if (!Double.isFinite(seconds) || seconds <= 0.0) {
            return null;
        }
        long nanos = Math.round(seconds * 1_000_000_000d);
        return nanos > 0 ? Duration.ofNanos(nanos) : null;
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000d;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConfirmationTimeouts other && timeouts.equals(other.timeouts);
    }

    @Override
    public int hashCode() {
        return timeouts.hashCode();
    }

    @Override
    public String toString() {
        return "ConfirmationTimeouts" + asSeconds();
    }
}
