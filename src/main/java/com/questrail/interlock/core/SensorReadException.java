package com.questrail.interlock.core;

import com.questrail.interlock.io.SignalName;

/**
 * Thrown when a sensor reader fails during a snapshot refresh.
 */
public final class SensorReadException extends RuntimeException {

    private final SignalName signal;

    public SensorReadException(SignalName signal, Throwable cause) {
        super("Failed to read " + signal, cause);
        this.signal = signal;
    }

    public SignalName signal() {
        return signal;
    }
}
