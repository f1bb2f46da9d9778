package com.questrail.interlock.core;

import com.questrail.interlock.api.ChamberCommand;
import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.internal.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CommandInbox
 * -----------------------------------------------------------------------------
 * Hand-off point between external callers and the single-threaded control
 * cycle.
 *
 * <h2>Lifecycle of a command</h2>
 * <ol>
 *   <li>{@link #submit} records it as <em>pending</em>. A second submit of the
 *       same command while it is recorded returns the same future.</li>
 *   <li>The state machine may {@link #take} it, which marks it
 *       <em>acknowledged</em> (in progress). It stays recorded.</li>
 *   <li>{@link #complete} resolves the caller's future and forgets the command.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * {@code submit} and {@code complete} may be called from any thread.
 * {@code peek}, {@code take} and {@code snapshot} are meant for the cycle thread.
 * Recorded commands never expire.
 */
public final class CommandInbox
{
    private static final Logger log = LoggerFactory.getLogger(CommandInbox.class);

    private final MonotonicClock clock;
    private final Map<ChamberCommand, PendingCommand> commands = new ConcurrentHashMap<>();

    public CommandInbox(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records a command. Never blocks on the control cycle.
     *
     * @return future completed exactly once when the command is resolved
     */
    public CompletableFuture<CommandResult> submit(ChamberCommand command) {
        Objects.requireNonNull(command, "command");

        PendingCommand entry = commands.computeIfAbsent(command,
                c -> new PendingCommand(c, clock.nowNanos(), new CompletableFuture<>()));
        log.debug("Command {} recorded (acknowledged={})", command.wireName(), entry.acknowledged);
        return entry.completion;
    }

    /**
     * Records a command by name. Unknown names complete immediately with an error.
     */
    public CompletableFuture<CommandResult> submit(String commandName) {
        Objects.requireNonNull(commandName, "commandName");

        Optional<ChamberCommand> command = ChamberCommand.fromName(commandName);
        if (command.isEmpty()) {
            log.warn("Rejected unknown command '{}'", commandName);
            return CompletableFuture.completedFuture(
                    CommandResult.error(commandName, "unknown command"));
        }
        return submit(command.get());
    }

    /**
     * Returns {@code true} if the command is recorded and not yet taken.
     */
    public boolean peek(ChamberCommand command) {
        PendingCommand entry = commands.get(command);
        return entry != null && !entry.acknowledged;
    }

    /**
     * Marks a pending command as in progress.
     *
     * @return {@code true} if it was pending
     */
    public boolean take(ChamberCommand command) {
        PendingCommand entry = commands.get(command);
        if (entry == null || entry.acknowledged) {
            return false;
        }
        entry.acknowledged = true;
        return true;
    }

    /**
     * Resolves a recorded command and forgets it.
     *
     * @param message optional detail, may be {@code null}
     * @return {@code false} if the command was not recorded
     */
    public boolean complete(ChamberCommand command, CommandResult.Outcome outcome, String message) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(outcome, "outcome");

        PendingCommand entry = commands.remove(command);
        if (entry == null) {
            log.debug("Completion of {} ignored: not recorded", command.wireName());
            return false;
        }

        entry.completion.complete(new CommandResult(command.wireName(), outcome, Optional.ofNullable(message)));
        log.debug("Command {} completed: {}", command.wireName(), outcome);
        return true;
    }

    public boolean isRecorded(ChamberCommand command) {
        return commands.containsKey(command);
    }

    /**
     * Returns an immutable view for one cycle of the state machine.
     */
    public PendingCommands snapshot() {
        EnumSet<ChamberCommand> pending = EnumSet.noneOf(ChamberCommand.class);
        EnumSet<ChamberCommand> acknowledged = EnumSet.noneOf(ChamberCommand.class);
        for (PendingCommand entry : commands.values()) {
            if (entry.acknowledged) {
                acknowledged.add(entry.command);
            } else {
                pending.add(entry.command);
            }
        }
        return new PendingCommands(pending, acknowledged);
    }

    /**
     * Monotonic time at which a recorded command was first submitted.
     */
    public Optional<Long> submittedAtNanos(ChamberCommand command) {
        PendingCommand entry = commands.get(command);
        return entry == null ? Optional.empty() : Optional.of(entry.submittedAtNanos);
    }

    private static final class PendingCommand {
        private final ChamberCommand command;
        private final long submittedAtNanos;
        private final CompletableFuture<CommandResult> completion;
        private volatile boolean acknowledged;

        private PendingCommand(ChamberCommand command, long submittedAtNanos,
                               CompletableFuture<CommandResult> completion) {
            this.command = command;
            this.submittedAtNanos = submittedAtNanos;
            this.completion = completion;
        }
    }
}
