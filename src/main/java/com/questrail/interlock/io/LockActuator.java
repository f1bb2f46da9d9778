package com.questrail.interlock.io;

import com.questrail.interlock.api.LockState;

/**
 * Write capability for the gate lock relay.
 */
@FunctionalInterface
public interface LockActuator
{
    void setLock(LockState state);
}
