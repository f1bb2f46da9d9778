package com.questrail.interlock.core;

import com.questrail.interlock.api.ChamberCommand;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of the command inbox, taken once per control cycle.
 *
 * @param pending      commands recorded and not yet taken
 * @param acknowledged commands taken by the state machine and awaiting completion
 */
public record PendingCommands(Set<ChamberCommand> pending, Set<ChamberCommand> acknowledged)
{
    private static final PendingCommands NONE = new PendingCommands(Set.of(), Set.of());

    public PendingCommands {
        pending = freeze(Objects.requireNonNull(pending, "pending"));
        acknowledged = freeze(Objects.requireNonNull(acknowledged, "acknowledged"));
    }

    public static PendingCommands none() {
        return NONE;
    }

    /**
     * Convenience factory: the given commands pending, nothing acknowledged.
     */
    public static PendingCommands of(ChamberCommand... commands) {
        EnumSet<ChamberCommand> set = EnumSet.noneOf(ChamberCommand.class);
        Collections.addAll(set, commands);
        return new PendingCommands(set, Set.of());
    }

    /** Recorded and not yet taken. */
    public boolean isPending(ChamberCommand command) {
        return pending.contains(command);
    }

    /** Recorded, whether taken or not. */
    public boolean isRecorded(ChamberCommand command) {
        return pending.contains(command) || acknowledged.contains(command);
    }

    /**
     * Returns the view after {@code command} has been taken.
     */
    public PendingCommands withTaken(ChamberCommand command) {
        if (!pending.contains(command)) {
            return this;
        }
        EnumSet<ChamberCommand> p = copy(pending);
        EnumSet<ChamberCommand> a = copy(acknowledged);
        p.remove(command);
        a.add(command);
        return new PendingCommands(p, a);
    }

    /**
     * Returns the view after {@code command} has been completed.
     */
    public PendingCommands withCompleted(ChamberCommand command) {
        if (!isRecorded(command)) {
            return this;
        }
        EnumSet<ChamberCommand> p = copy(pending);
        EnumSet<ChamberCommand> a = copy(acknowledged);
        p.remove(command);
        a.remove(command);
        return new PendingCommands(p, a);
    }

    private static EnumSet<ChamberCommand> copy(Set<ChamberCommand> s) {
        EnumSet<ChamberCommand> out = EnumSet.noneOf(ChamberCommand.class);
        out.addAll(s);
        return out;
    }

    private static Set<ChamberCommand> freeze(Set<ChamberCommand> s) {
        return Collections.unmodifiableSet(copy(s));
    }
}
