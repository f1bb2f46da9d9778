package com.questrail.interlock.core;

import com.questrail.interlock.config.ConfirmationKind;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Maps each {@link ConfirmationKind} to the condition that confirms it.
 * Conditions are evaluated lazily against whatever snapshot is current when
 * the watchdog runs.
 */
public final class ConfirmationPredicates
{
    private ConfirmationPredicates() {}

    public static boolean isConfirmed(ConfirmationKind kind, SensorSnapshot s) {
        return switch (kind) {
            case PARTITION_OPEN_REACHED -> s.partitionUp();
            case PARTITION_CLOSE_REACHED -> s.partitionDown();
            case GATE_LOCKED_CONFIRMED -> s.isGateLocked();
            case GATE_UNLOCKED_CONFIRMED -> s.isGateUnlocked();
            case GATE_CLOSED_CONFIRMED -> !s.chamberOpen();
        };
    }

    public static BooleanSupplier forKind(ConfirmationKind kind, Supplier<SensorSnapshot> snapshots) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(snapshots, "snapshots");
        return () -> isConfirmed(kind, snapshots.get());
    }
}
