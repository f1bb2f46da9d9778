package com.questrail.interlock.config;

import java.util.Objects;
import java.util.Optional;

/**
 * The physical confirmations the controller supervises after it commands a
 * change. Each kind has its own configurable timeout.
 */
public enum ConfirmationKind
{
    /** Partition reached its upper limit switch after a move up. */
    PARTITION_OPEN_REACHED("partition_open_reached"),
    /** Partition reached its lower limit switch after a move down. */
    PARTITION_CLOSE_REACHED("partition_close_reached"),
    /** Gate reported closed and locked after the lock relay was energized. */
    GATE_LOCKED_CONFIRMED("gate_locked_confirmed"),
    /** Gate reported unlocked after the lock relay was released. */
    GATE_UNLOCKED_CONFIRMED("gate_unlocked_confirmed"),
    /** Client closed the gate again after opening it. */
    GATE_CLOSED_CONFIRMED("gate_closed_confirmed");

    private final String key;

    ConfirmationKind(String key) {
        this.key = key;
    }

    /** Configuration key, also used as the watchdog name. */
    public String key() {
        return key;
    }

    public static Optional<ConfirmationKind> fromKey(String key) {
        Objects.requireNonNull(key, "key");
        for (ConfirmationKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
