package com.questrail.interlock.internal.state;

import com.questrail.interlock.api.ChamberCommand;
import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.api.LockState;
import com.questrail.interlock.config.ConfirmationKind;
import com.questrail.interlock.io.IndicatorColor;
import com.questrail.interlock.io.PartitionDirection;
import com.questrail.interlock.observability.FaultKind;

import java.util.Objects;

/**
 * One side effect decided by the {@link InterlockReducer}.
 * <p>
 * Effects describe <b>what</b> must happen. Executing them (relay writes, drive
 * commands, watchdog registration, future completion) is the job of the
 * effect executor.
 */
public sealed interface InterlockEffect
{
    /** Write the gate-lock relay. */
    record SetLock(LockState lock) implements InterlockEffect {
        public SetLock {
            Objects.requireNonNull(lock, "lock");
        }
    }

    /** Start the partition moving. */
    record MovePartition(PartitionDirection direction) implements InterlockEffect {
        public MovePartition {
            Objects.requireNonNull(direction, "direction");
        }
    }

    /** Clear a latched motor-driver fault. */
    record ResetMotorFault() implements InterlockEffect {}

    /** Switch the client indicator to a colour. */
    record ShowIndicator(IndicatorColor color) implements InterlockEffect {
        public ShowIndicator {
            Objects.requireNonNull(color, "color");
        }
    }

    /** Mark a pending command as in progress. */
    record TakeCommand(ChamberCommand command) implements InterlockEffect {
        public TakeCommand {
            Objects.requireNonNull(command, "command");
        }
    }

    /** Resolve a recorded command. {@code message} may be {@code null}. */
    record CompleteCommand(ChamberCommand command, CommandResult.Outcome outcome, String message)
            implements InterlockEffect {
        public CompleteCommand {
            Objects.requireNonNull(command, "command");
            Objects.requireNonNull(outcome, "outcome");
        }
    }

    /**
     * Start supervising a confirmation.
     *
     * @param kind     what must be confirmed
     * @param warnOnly expiry is only logged, not reported as a fault
     */
    record ArmWatchdog(ConfirmationKind kind, boolean warnOnly) implements InterlockEffect {
        public ArmWatchdog {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /** Report a fault to the observability sink. */
    record ReportFault(FaultKind kind, String message) implements InterlockEffect {
        public ReportFault {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }
    }
}
