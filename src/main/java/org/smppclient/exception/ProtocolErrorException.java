package org.smppclient.exception;

import com.cloudhopper.smpp.pdu.Pdu;
import org.smppclient.session.Command;

/**
 * The peer answered with a non-zero command status. This is a regular protocol outcome;
 * the session remains usable.
 */
public class ProtocolErrorException extends Exception {

    private final Pdu pdu;
    private final Command command;
    private final int commandStatus;
    private final String statusDescription;

    public ProtocolErrorException(Pdu pdu, Command command, String statusDescription) {
        super("(" + pdu.getCommandStatus() + ") " + command.getCommandName() + ": " + statusDescription);
        this.pdu = pdu;
        this.command = command;
        this.commandStatus = pdu.getCommandStatus();
        this.statusDescription = statusDescription;
    }

    public Pdu getPdu() {
        return pdu;
    }

    public Command getCommand() {
        return command;
    }

    public int getCommandStatus() {
        return commandStatus;
    }

    public String getStatusDescription() {
        return statusDescription;
    }
}
