package com.questrail.interlock.api;

import java.util.Objects;

/**
 * Point-in-time status of a chamber as reported to supervisors.
 *
 * @param deviceName configured chamber name
 * @param state      current interlock state
 * @param lifecycle  coarse lifecycle derived from the state history
 */
public record ChamberStatus(String deviceName, InterlockState state, DeviceLifecycle lifecycle)
{
    public ChamberStatus {
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(lifecycle, "lifecycle");
    }
}
