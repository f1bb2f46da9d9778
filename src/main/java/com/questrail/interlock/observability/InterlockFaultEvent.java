package com.questrail.interlock.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a fault or anomaly observed by a chamber controller.
 *
 * @param timestamp  wall-clock time the fault was observed
 * @param deviceName chamber that reported it
 * @param kind       fault category
 * @param message    human-readable description
 * @param cause      underlying exception, or {@code null}
 */
public record InterlockFaultEvent(
    Instant timestamp,
    String deviceName,
    FaultKind kind,
    String message,
    Throwable cause
) {
    public InterlockFaultEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
