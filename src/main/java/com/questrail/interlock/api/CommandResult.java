package com.questrail.interlock.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Completion delivered to the submitter of a command.
 *
 * @param command the command name as submitted (wire form, without prefix)
 * @param outcome success or error
 * @param message optional human-readable detail, usually present for errors
 */
public record CommandResult(String command, Outcome outcome, Optional<String> message)
{
    public enum Outcome {
        SUCCESS,
        ERROR
    }

    public CommandResult {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(message, "message");
    }

    public static CommandResult success(ChamberCommand command) {
        return new CommandResult(command.wireName(), Outcome.SUCCESS, Optional.empty());
    }

    public static CommandResult error(String command, String message) {
        return new CommandResult(command, Outcome.ERROR, Optional.ofNullable(message));
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
