package com.questrail.interlock.api;

import java.util.concurrent.CompletableFuture;

/**
 * ChamberController
 * -----------------------------------------------------------------------------
 * {@code ChamberController} is the semantic façade through which external
 * actors (line orchestrators, service tools, test harnesses) interact with one
 * transfer chamber.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Accepting named commands and resolving each exactly once</li>
 *   <li>Answering instantaneous sensor queries</li>
 *   <li>Exposing the current interlock state and lifecycle</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Fieldbus or I/O wire protocols</li>
 *   <li>Scheduling the control cycle</li>
 *   <li>Coordinating several chambers</li>
 * </ul>
 *
 * <h2>Threading and Concurrency</h2>
 * All methods of this interface may be called from any thread. Command
 * submission never blocks on the control cycle; the returned future is
 * completed on the cycle thread when the state machine resolves the command.
 */
public interface ChamberController
{
    /**
     * Submits a command.
     * <p>
     * Submitting a command that is already pending is a no-op: the future of
     * the pending submission is returned and the command is not queued twice.
     *
     * @param command command to submit (must not be {@code null})
     * @return future completed with the command's single result
     */
    CompletableFuture<CommandResult> submit(ChamberCommand command);

    /**
     * Submits a command by name. Unknown names complete immediately with
     * {@link CommandResult.Outcome#ERROR}.
     */
    CompletableFuture<CommandResult> submit(String commandName);

    /**
     * Answers a query from the current sensor snapshot.
     *
     * @return {@code true} or {@code false} as the sensors report it
     */
    boolean query(ChamberQuery query);

    /**
     * Answers a query by name: {@code 1} for true, {@code 0} for false and
     * {@link ChamberQuery#UNRECOGNIZED} for unknown names.
     */
    int query(String queryName);

    /**
     * Returns the current status of the chamber.
     */
    ChamberStatus status();
}
