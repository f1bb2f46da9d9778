package com.questrail.interlock.api;

/**
 * DeviceLifecycle
 * -----------------------------------------------------------------------------
 * Coarse, supervisory view of a chamber, independent of the detailed
 * {@link InterlockState}.
 *
 * <p>This is what a line supervisor needs to decide whether the chamber can be
 * scheduled: it says nothing about the gate or partition positions.</p>
 *
 * <ul>
 *   <li>{@link #UNINITIALIZED}: no cycle has reached initialization yet</li>
 *   <li>{@link #INITIALIZING}: initialization started, working position not yet reached</li>
 *   <li>{@link #WORKING}: working position reached at least once</li>
 *   <li>{@link #ERROR}: initialization failed; the chamber is out of service</li>
 * </ul>
 */
public enum DeviceLifecycle
{
    UNINITIALIZED,
    INITIALIZING,
    WORKING,
    ERROR
}
