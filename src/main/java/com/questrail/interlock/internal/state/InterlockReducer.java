package com.questrail.interlock.internal.state;

import com.questrail.interlock.api.ChamberCommand;
import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.api.DeviceLifecycle;
import com.questrail.interlock.api.InterlockState;
import com.questrail.interlock.api.LockState;
import com.questrail.interlock.config.ConfirmationKind;
import com.questrail.interlock.core.PendingCommands;
import com.questrail.interlock.core.SensorSnapshot;
import com.questrail.interlock.io.IndicatorColor;
import com.questrail.interlock.io.PartitionDirection;
import com.questrail.interlock.observability.FaultKind;

import java.util.Objects;

/**
 * InterlockReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function of the chamber interlock.
 *
 * <h2>Role in the architecture</h2>
 * Given the prior {@link ChamberState}, the sensor snapshot of the current cycle
 * and the commands recorded in the inbox, the reducer computes:
 * <ul>
 *   <li>the next {@link ChamberState}</li>
 *   <li>the ordered {@link InterlockEffects} to carry it out</li>
 * </ul>
 * It performs no I/O, reads no clock and touches no shared state, so every
 * transition can be unit tested from plain values.
 *
 * <h2>Order of evaluation within one cycle</h2>
 * <ol>
 *   <li>Maintenance override: a pending {@code maintenance_enable} preempts any
 *       non-maintenance state.</li>
 *   <li>{@code UNKNOWN} becomes {@code INITIALIZING} and is handled as such in
 *       the same cycle.</li>
 *   <li>Safety check in blocked states (at most one violation per cycle).</li>
 *   <li>The handler of the current state (at most one transition).</li>
 *   <li>Indicator update.</li>
 * </ol>
 *
 * <h2>Safety</h2>
 * The gate is never unlocked while the partition is away from its closed
 * position, except in maintenance. A gate sensed open while the lock is
 * commanded is reported as a safety violation and never thrown.
 */
public final class InterlockReducer
{
    /**
     * Result of one reduction.
     *
     * @param newState the updated controller state
     * @param effects  effects to be executed by the caller, in order
     */
    public record Result(ChamberState newState, InterlockEffects effects) {}

    private final boolean indicatorFitted;

    /**
     * @param indicatorFitted whether the chamber has an indicator lamp to drive
     */
    public InterlockReducer(boolean indicatorFitted) {
        this.indicatorFitted = indicatorFitted;
    }

    public InterlockReducer() {
        this(false);
    }

    /**
     * Computes one control cycle.
     *
     * @param state    prior state (must not be {@code null})
     * @param sensors  snapshot of this cycle (must not be {@code null})
     * @param commands inbox view of this cycle (must not be {@code null})
     * @return the next state and its effects
     */
    public Result apply(ChamberState state, SensorSnapshot sensors, PendingCommands commands) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(sensors, "sensors");
        Objects.requireNonNull(commands, "commands");

        Step step = new Step(state, sensors, commands);

        if (!step.current().isMaintenance() && step.isPending(ChamberCommand.MAINTENANCE_ENABLE)) {
            step.abortInProgress("preempted by maintenance");
            step.enter(InterlockState.ENABLING_MAINTENANCE);
        }

        if (step.current() == InterlockState.UNKNOWN) {
            step.enter(InterlockState.INITIALIZING);
        }

        if (step.current().isBlocked() && sensors.chamberOpen() && step.state.isLockCommanded()) {
            step.fault(FaultKind.SAFETY_VIOLATION,
                    "Gate open while locked in " + step.current());
        }

        switch (step.current()) {
            case INITIALIZING -> onInitializing(step);
            case INIT_ERROR -> onInitError(step);
            case BLOCKED_OPENING -> onBlockedOpening(step);
            case BLOCKED_OPENED -> onBlockedOpened(step);
            case BLOCKED_CLOSING -> onBlockedClosing(step);
            case BLOCKED_CLOSED -> onBlockedClosed(step);
            case BLOCKED_OPEN_CONVEYOR_MOVING -> onConveyorMoving(step);
            case RELEASED_CLOSED -> onReleasedClosed(step);
            case RELEASED_OPEN -> onReleasedOpen(step);
            case ENABLING_MAINTENANCE -> onEnablingMaintenance(step);
            case MAINTENANCE -> onMaintenance(step);
            case DISABLING_MAINTENANCE -> onDisablingMaintenance(step);
            case UNKNOWN -> { }
        }

        updateIndicator(step);
        return step.result();
    }

    // ---------------------------------------------------------------------
    // State handlers
    // ---------------------------------------------------------------------

    private void onInitializing(Step step) {
        if (step.sensors.chamberOpen()) {
            step.fault(FaultKind.INITIALIZATION_FAILURE, "Gate open during initialization");
            step.enter(InterlockState.INIT_ERROR);
            onInitError(step);
            return;
        }

        step.lock(LockState.LOCKED);
        step.arm(ConfirmationKind.GATE_LOCKED_CONFIRMED);
        if (!step.sensors.partitionUp()) {
            step.move(PartitionDirection.UP);
            step.arm(ConfirmationKind.PARTITION_OPEN_REACHED);
        }
        step.enter(InterlockState.BLOCKED_OPENING);
    }

    private void onInitError(Step step) {
        step.completeIfRecorded(ChamberCommand.INITIALIZE, CommandResult.Outcome.ERROR,
                "initialization failed: gate open");
    }

    private void onBlockedOpening(Step step) {
        if (step.sensors.partitionUp()) {
            step.enter(InterlockState.BLOCKED_OPENED);
            step.completeIfRecorded(ChamberCommand.PARTITION_UP, CommandResult.Outcome.SUCCESS, null);
        }
    }

    private void onBlockedOpened(Step step) {
        step.completeIfRecorded(ChamberCommand.INITIALIZE, CommandResult.Outcome.SUCCESS, null);

        if (step.isPending(ChamberCommand.BLOCK_CHAMBER)) {
            step.complete(ChamberCommand.BLOCK_CHAMBER, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.BLOCKED_OPEN_CONVEYOR_MOVING);
        } else if (step.isPending(ChamberCommand.PARTITION_DOWN)) {
            step.take(ChamberCommand.PARTITION_DOWN);
            step.move(PartitionDirection.DOWN);
            step.arm(ConfirmationKind.PARTITION_CLOSE_REACHED);
            step.enter(InterlockState.BLOCKED_CLOSING);
        }
    }

    private void onBlockedClosing(Step step) {
        if (step.sensors.motorFault()) {
            step.effect(new InterlockEffect.ResetMotorFault());
            step.fault(FaultKind.HARDWARE_FAULT, "Partition motor fault while closing");
            step.completeIfRecorded(ChamberCommand.PARTITION_DOWN, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.BLOCKED_CLOSED);
        } else if (step.sensors.partitionDown()) {
            step.completeIfRecorded(ChamberCommand.PARTITION_DOWN, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.BLOCKED_CLOSED);
        }
    }

    private void onBlockedClosed(Step step) {
        if (step.isPending(ChamberCommand.PARTITION_UP)) {
            step.take(ChamberCommand.PARTITION_UP);
            step.move(PartitionDirection.UP);
            step.arm(ConfirmationKind.PARTITION_OPEN_REACHED);
            step.enter(InterlockState.BLOCKED_OPENING);
        } else if (step.isPending(ChamberCommand.UNBLOCK_FOR_CLIENT)) {
            step.lock(LockState.UNLOCKED);
            step.arm(ConfirmationKind.GATE_UNLOCKED_CONFIRMED);
            step.complete(ChamberCommand.UNBLOCK_FOR_CLIENT, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.RELEASED_CLOSED);
        } else if (step.sensors.motorFault()) {
            step.fault(FaultKind.HARDWARE_FAULT, "Partition motor fault while closed");
            step.effect(new InterlockEffect.ResetMotorFault());
        }
    }

    private void onConveyorMoving(Step step) {
        if (step.isPending(ChamberCommand.UNBLOCK_CHAMBER)) {
            step.complete(ChamberCommand.UNBLOCK_CHAMBER, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.BLOCKED_OPENED);
        }
    }

    private void onReleasedClosed(Step step) {
        if (step.sensors.chamberOpen()) {
            step.enter(InterlockState.RELEASED_OPEN);
            step.effect(new InterlockEffect.ArmWatchdog(ConfirmationKind.GATE_CLOSED_CONFIRMED, true));
        } else if (step.isPending(ChamberCommand.BLOCK_FOR_CLIENT)) {
            step.lock(LockState.LOCKED);
            step.arm(ConfirmationKind.GATE_LOCKED_CONFIRMED);
            step.complete(ChamberCommand.BLOCK_FOR_CLIENT, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.BLOCKED_CLOSED);
        }
    }

    private void onReleasedOpen(Step step) {
        if (!step.sensors.chamberOpen()) {
            step.enter(InterlockState.RELEASED_CLOSED);
        }
    }

    private void onEnablingMaintenance(Step step) {
        if (!step.isRecorded(ChamberCommand.MAINTENANCE_ENABLE)) {
            return;
        }
        step.complete(ChamberCommand.MAINTENANCE_ENABLE, CommandResult.Outcome.SUCCESS, null);
        step.move(PartitionDirection.DOWN);
        step.arm(ConfirmationKind.PARTITION_CLOSE_REACHED);
        step.lock(LockState.UNLOCKED);
        step.enter(InterlockState.MAINTENANCE);
    }

    private void onMaintenance(Step step) {
        if (step.isPending(ChamberCommand.MAINTENANCE_DISABLE)) {
            step.take(ChamberCommand.MAINTENANCE_DISABLE);
            step.move(PartitionDirection.UP);
            step.arm(ConfirmationKind.PARTITION_OPEN_REACHED);
            step.lock(LockState.LOCKED);
            step.arm(ConfirmationKind.GATE_LOCKED_CONFIRMED);
            step.enter(InterlockState.DISABLING_MAINTENANCE);
        }
    }

    private void onDisablingMaintenance(Step step) {
        if (step.sensors.partitionUp()
                && step.sensors.isGateLocked()
                && step.isRecorded(ChamberCommand.MAINTENANCE_DISABLE)) {
            step.complete(ChamberCommand.MAINTENANCE_DISABLE, CommandResult.Outcome.SUCCESS, null);
            step.enter(InterlockState.BLOCKED_OPENED);
        }
    }

    private void updateIndicator(Step step) {
        if (!indicatorFitted) {
            return;
        }
        IndicatorColor desired = step.current() == InterlockState.RELEASED_OPEN
                ? IndicatorColor.WHITE
                : IndicatorColor.RED;
        if (desired != step.state.indicator()) {
            step.effect(new InterlockEffect.ShowIndicator(desired));
            step.state = step.state.withIndicator(desired);
        }
    }

    // ---------------------------------------------------------------------
    // Working state of one reduction
    // ---------------------------------------------------------------------

    private static final class Step {
        private final SensorSnapshot sensors;
        private final InterlockEffects.Builder effects = InterlockEffects.builder();
        private ChamberState state;
        private PendingCommands commands;

        private Step(ChamberState state, SensorSnapshot sensors, PendingCommands commands) {
            this.state = state;
            this.sensors = sensors;
            this.commands = commands;
        }

        InterlockState current() {
            return state.state();
        }

        void enter(InterlockState next) {
            state = state.withState(next);
            switch (next) {
                case INITIALIZING -> state = state.withLifecycle(DeviceLifecycle.INITIALIZING);
                case INIT_ERROR -> state = state.withLifecycle(DeviceLifecycle.ERROR);
                case BLOCKED_OPENED -> {
                    if (state.lifecycle() != DeviceLifecycle.WORKING) {
                        state = state.withLifecycle(DeviceLifecycle.WORKING);
                    }
                }
                default -> { }
            }
        }

        boolean isPending(ChamberCommand command) {
            return commands.isPending(command);
        }

        boolean isRecorded(ChamberCommand command) {
            return commands.isRecorded(command);
        }

        void take(ChamberCommand command) {
            effects.add(new InterlockEffect.TakeCommand(command));
            commands = commands.withTaken(command);
        }

        void complete(ChamberCommand command, CommandResult.Outcome outcome, String message) {
            effects.add(new InterlockEffect.CompleteCommand(command, outcome, message));
            commands = commands.withCompleted(command);
        }

        /**
         * Fails every taken command. Their handling states are never re-entered
         * after the move that was running is abandoned.
         */
        void abortInProgress(String reason) {
            for (ChamberCommand command : commands.acknowledged()) {
                complete(command, CommandResult.Outcome.ERROR, reason);
            }
        }

        void completeIfRecorded(ChamberCommand command, CommandResult.Outcome outcome, String message) {
            if (commands.isRecorded(command)) {
                complete(command, outcome, message);
            }
        }

        void lock(LockState lock) {
            effects.add(new InterlockEffect.SetLock(lock));
            state = state.withCommandedLock(lock);
        }

        void move(PartitionDirection direction) {
            effects.add(new InterlockEffect.MovePartition(direction));
        }

        void arm(ConfirmationKind kind) {
            effects.add(new InterlockEffect.ArmWatchdog(kind, false));
        }

        void fault(FaultKind kind, String message) {
            effects.add(new InterlockEffect.ReportFault(kind, message));
        }

        void effect(InterlockEffect effect) {
            effects.add(effect);
        }

        Result result() {
            return new Result(state, effects.build());
        }
    }
}
