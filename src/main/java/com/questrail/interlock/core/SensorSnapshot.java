package com.questrail.interlock.core;

import com.questrail.interlock.api.LockState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of every chamber input, taken once per control cycle.
 * <p>
 * All decisions of one cycle are made against the same snapshot, so a signal
 * that flips mid-cycle cannot be seen with two different values.
 *
 * @param chamberOpen     client-side gate is open
 * @param partitionUp     partition upper limit switch
 * @param partitionDown   partition lower limit switch
 * @param lockConfirmed   lock feedback, empty when the chamber has no feedback line
 * @param motorFault      partition motor driver fault
 * @param productPresence one entry per wired product sensor
 * @param saucePresence   one entry per wired sauce sensor
 */
public record SensorSnapshot(
    boolean chamberOpen,
    boolean partitionUp,
    boolean partitionDown,
    Optional<LockState> lockConfirmed,
    boolean motorFault,
    List<Boolean> productPresence,
    List<Boolean> saucePresence
) {
    private static final SensorSnapshot INITIAL = new SensorSnapshot(
            false, false, false, Optional.empty(), false, List.of(), List.of());

    public SensorSnapshot {
        Objects.requireNonNull(lockConfirmed, "lockConfirmed");
        productPresence = List.copyOf(Objects.requireNonNull(productPresence, "productPresence"));
        saucePresence = List.copyOf(Objects.requireNonNull(saucePresence, "saucePresence"));
    }

    /**
     * Snapshot in effect before the first successful refresh: every input false.
     */
    public static SensorSnapshot initial() {
        return INITIAL;
    }

    public boolean isProductPresent() {
        return productPresence.contains(Boolean.TRUE);
    }

    public boolean isSaucePresent() {
        return saucePresence.contains(Boolean.TRUE);
    }

    /** The gate is closed and, where feedback is wired, reports locked. */
    public boolean isGateLocked() {
        return !chamberOpen && lockConfirmed.map(l -> l == LockState.LOCKED).orElse(true);
    }

    /** Lock feedback reports unlocked, or the gate is already open. */
    public boolean isGateUnlocked() {
        return chamberOpen || lockConfirmed.map(l -> l == LockState.UNLOCKED).orElse(false);
    }
}
