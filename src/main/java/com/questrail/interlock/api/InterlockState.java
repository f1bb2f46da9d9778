package com.questrail.interlock.api;

/**
 * InterlockState
 * -----------------------------------------------------------------------------
 * Exhaustive set of states of the transfer-chamber interlock.
 *
 * <h2>Naming</h2>
 * "Blocked" and "released" describe the client gate: a blocked chamber has its
 * gate lock energized, a released chamber lets the client open the gate.
 * "Opened" and "closed" in the blocked states describe the internal partition
 * facing the production side.
 *
 * <h2>Invariant</h2>
 * Exactly one state is current for a chamber at any instant, and the state only
 * changes inside {@code InterlockController.cycle()}.
 */
public enum InterlockState
{
    /** Constructed, no cycle has run yet. */
    UNKNOWN,

    /** First cycle: deciding whether the chamber can be taken into use. */
    INITIALIZING,

    /**
     * The client gate was open during initialization. Terminal until the
     * process is restarted.
     */
    INIT_ERROR,

    /** Gate unlocked and physically open; partition closed. */
    RELEASED_OPEN,

    /** Gate unlocked but physically closed; partition closed. */
    RELEASED_CLOSED,

    /** Gate locked; partition commanded up, waiting for the upper limit switch. */
    BLOCKED_OPENING,

    /** Gate locked; partition up. Normal working position. */
    BLOCKED_OPENED,

    /** Gate locked; partition commanded down, waiting for the lower limit switch. */
    BLOCKED_CLOSING,

    /** Gate locked; partition down. */
    BLOCKED_CLOSED,

    /** Gate locked; partition up and the conveyor is moving product through. */
    BLOCKED_OPEN_CONVEYOR_MOVING,

    /** Transitional state on the way into maintenance. */
    ENABLING_MAINTENANCE,

    /** Service mode: partition lowered, gate unlocked. */
    MAINTENANCE,

    /** Leaving service mode: waiting for the partition and lock to confirm. */
    DISABLING_MAINTENANCE;

    /**
     * Returns true for the states in which the gate is nominally locked and the
     * chamber-open safety check applies.
     */
    public boolean isBlocked() {
        return switch (this) {
            case BLOCKED_OPENING, BLOCKED_OPENED, BLOCKED_CLOSING, BLOCKED_CLOSED,
                 BLOCKED_OPEN_CONVEYOR_MOVING -> true;
            default -> false;
        };
    }

    /**
     * Returns true for the three maintenance states. The maintenance override
     * is evaluated in every other state.
     */
    public boolean isMaintenance() {
        return this == ENABLING_MAINTENANCE || this == MAINTENANCE || this == DISABLING_MAINTENANCE;
    }
}
