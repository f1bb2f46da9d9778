package com.questrail.interlock.io;

/**
 * Logical digital inputs a chamber may be wired with.
 * <p>
 * Only {@link #isRequired() required} signals must be present in a
 * {@link SensorTable}; the others depend on the chamber variant (some chambers
 * carry product and sauce sensors, lock feedback or a motor-fault line, some
 * do not).
 */
public enum SignalName
{
    /** Client-side gate limit switch reports the gate open. */
    CHAMBER_OPEN(true),
    /** Partition upper limit switch. */
    PARTITION_UP(true),
    /** Partition lower limit switch. */
    PARTITION_DOWN(true),
    /** Lock relay feedback, {@code true} when the lock reports locked. */
    LOCK_CONFIRMED(false),
    /** Partition motor driver fault output. */
    MOTOR_FAULT(false),
    PRODUCT_1(false),
    PRODUCT_2(false),
    SAUCE_1(false),
    SAUCE_2(false),
    SAUCE_3(false);

    private final boolean required;

    SignalName(boolean required) {
        this.required = required;
    }

    public boolean isRequired() {
        return required;
    }
}
