package com.questrail.interlock.api;

/**
 * LockState
 * -----------------------------------------------------------------------------
 * State of the client gate lock.
 * <p>
 * Used both for the <b>commanded</b> relay output (what the controller last
 * wrote) and for the optional <b>confirmed</b> lock feedback read back from the
 * hardware. The two are tracked separately and are not assumed to agree.
 */
public enum LockState
{
    LOCKED,
    UNLOCKED
}
