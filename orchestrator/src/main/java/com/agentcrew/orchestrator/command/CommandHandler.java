package com.agentcrew.orchestrator.command;

/**
 * Executes one command variant on the processor thread.
 *
 * Handlers run one at a time, so they need no locking among themselves. A handler
 * must either apply its whole change or fail before touching the assignment store:
 * check first, call collaborators second, write the store last.
 *
 * Failures are reported by throwing; the processor turns any exception into a
 * failed {@link CommandResult}.
 *
 * @param <C> the command record this handler accepts
 */
public interface CommandHandler<C extends Command> {

    /** The command type this handler is registered for. */
    CommandType type();

    CommandResult handle(C command);
}
