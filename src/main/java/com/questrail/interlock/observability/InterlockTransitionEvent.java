package com.questrail.interlock.observability;

import com.questrail.interlock.api.InterlockState;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a change of the interlock state during one control cycle.
 */
public record InterlockTransitionEvent(
    Instant timestamp,
    String deviceName,
    InterlockState oldState,
    InterlockState newState
) {
    public InterlockTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(oldState, "oldState");
        Objects.requireNonNull(newState, "newState");
    }
}
