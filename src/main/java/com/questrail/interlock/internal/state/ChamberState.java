package com.questrail.interlock.internal.state;

import com.questrail.interlock.api.DeviceLifecycle;
import com.questrail.interlock.api.InterlockState;
import com.questrail.interlock.api.LockState;
import com.questrail.interlock.io.IndicatorColor;

import java.util.Objects;

/**
 * ChamberState
 * -----------------------------------------------------------------------------
 * Immutable controller state carried from one cycle to the next.
 *
 * <p>{@code commandedLock} is what the controller last wrote to the lock relay,
 * not what the lock feedback reports. It and {@code indicator} are {@code null}
 * until first written.</p>
 */
public record ChamberState(
    InterlockState state,
    LockState commandedLock,
    IndicatorColor indicator,
    DeviceLifecycle lifecycle
) {
    public ChamberState {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(lifecycle, "lifecycle");
    }

    /**
     * State of a freshly constructed controller: nothing known, nothing written.
     */
    public static ChamberState initial() {
        return new ChamberState(InterlockState.UNKNOWN, null, null, DeviceLifecycle.UNINITIALIZED);
    }

    public ChamberState withState(InterlockState next) {
        return new ChamberState(next, commandedLock, indicator, lifecycle);
    }

    public ChamberState withCommandedLock(LockState lock) {
        return new ChamberState(state, lock, indicator, lifecycle);
    }

    public ChamberState withIndicator(IndicatorColor color) {
        return new ChamberState(state, commandedLock, color, lifecycle);
    }

    public ChamberState withLifecycle(DeviceLifecycle next) {
        return new ChamberState(state, commandedLock, indicator, next);
    }

    public boolean isLockCommanded() {
        return commandedLock == LockState.LOCKED;
    }
}
