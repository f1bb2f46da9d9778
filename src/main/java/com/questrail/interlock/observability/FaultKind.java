package com.questrail.interlock.observability;

/**
 * Categories of faults a chamber reports. None of them stops the control cycle.
 */
public enum FaultKind
{
    /** Gate sensed open while the lock is commanded locked in a blocked state. */
    SAFETY_VIOLATION,
    /** Partition motor driver reported a fault. */
    HARDWARE_FAULT,
    /** A commanded transition was not confirmed by the sensors in time. */
    CONFIRMATION_TIMEOUT,
    /** The gate was open when initialization started. */
    INITIALIZATION_FAILURE,
    /** A configuration value was rejected and its default kept. */
    INVALID_CONFIG,
    /** Reading the sensors failed; the previous snapshot stays current. */
    SENSOR_READ_FAILURE,
    /** An unexpected exception escaped reduction or effect execution. */
    CYCLE_FAILURE
}
