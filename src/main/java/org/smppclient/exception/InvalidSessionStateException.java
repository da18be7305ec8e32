package org.smppclient.exception;

import org.smppclient.session.Command;
import org.smppclient.session.SessionState;

/**
 * Thrown when a command is not permitted in the session's current bind state.
 * Nothing has been written to the connection when this is raised and the session
 * stays usable.
 */
public class InvalidSessionStateException extends IllegalStateException {

    private final Command command;
    private final SessionState state;

    public InvalidSessionStateException(Command command, SessionState state) {
        super("Command " + command.getCommandName() + " is not allowed in session state " + state);
        this.command = command;
        this.state = state;
    }

    public Command getCommand() {
        return command;
    }

    public SessionState getState() {
        return state;
    }
}
