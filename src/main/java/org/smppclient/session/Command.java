package org.smppclient.session;

import com.cloudhopper.smpp.pdu.Pdu;

import java.util.HashMap;
import java.util.Map;

/**
 * SMPP 3.4 commands a client session can send or receive.
 */
public enum Command {
    BIND_RECEIVER(0x00000001, "bind_receiver"),
    BIND_RECEIVER_RESP(0x80000001, "bind_receiver_resp"),
    BIND_TRANSMITTER(0x00000002, "bind_transmitter"),
    BIND_TRANSMITTER_RESP(0x80000002, "bind_transmitter_resp"),
    QUERY_SM(0x00000003, "query_sm"),
    QUERY_SM_RESP(0x80000003, "query_sm_resp"),
    SUBMIT_SM(0x00000004, "submit_sm"),
    SUBMIT_SM_RESP(0x80000004, "submit_sm_resp"),
    DELIVER_SM(0x00000005, "deliver_sm"),
    DELIVER_SM_RESP(0x80000005, "deliver_sm_resp"),
    UNBIND(0x00000006, "unbind"),
    UNBIND_RESP(0x80000006, "unbind_resp"),
    REPLACE_SM(0x00000007, "replace_sm"),
    REPLACE_SM_RESP(0x80000007, "replace_sm_resp"),
    CANCEL_SM(0x00000008, "cancel_sm"),
    CANCEL_SM_RESP(0x80000008, "cancel_sm_resp"),
    BIND_TRANSCEIVER(0x00000009, "bind_transceiver"),
    BIND_TRANSCEIVER_RESP(0x80000009, "bind_transceiver_resp"),
    OUTBIND(0x0000000B, "outbind"),
    ENQUIRE_LINK(0x00000015, "enquire_link"),
    ENQUIRE_LINK_RESP(0x80000015, "enquire_link_resp"),
    SUBMIT_MULTI(0x00000021, "submit_multi"),
    SUBMIT_MULTI_RESP(0x80000021, "submit_multi_resp"),
    ALERT_NOTIFICATION(0x00000102, "alert_notification"),
    DATA_SM(0x00000103, "data_sm"),
    DATA_SM_RESP(0x80000103, "data_sm_resp"),
    GENERIC_NACK(0x80000000, "generic_nack");

    private static final int RESPONSE_BIT = 0x80000000;
    private static final Map<Integer, Command> BY_ID = new HashMap<>();

    static {
        for (Command command : values()) {
            BY_ID.put(command.id, command);
        }
    }

    private final int id;
    private final String commandName;

    Command(int id, String commandName) {
        this.id = id;
        this.commandName = commandName;
    }

    public int getId() {
        return id;
    }

    public String getCommandName() {
        return commandName;
    }

    public boolean isResponse() {
        return (id & RESPONSE_BIT) != 0;
    }

    public boolean isRequest() {
        return !isResponse();
    }

    /**
     * Bind variants that make the peer push messages to this session.
     */
    public boolean isReceiverBind() {
        return this == BIND_RECEIVER || this == BIND_TRANSCEIVER;
    }

    /**
     * @return the command or null if the id is not part of the supported set
     */
    public static Command fromId(int commandId) {
        return BY_ID.get(commandId);
    }

    public static Command forPdu(Pdu pdu) {
        Command command = fromId(pdu.getCommandId());
        if (command == null)
            throw new IllegalArgumentException("Unsupported command id 0x" + Integer.toHexString(pdu.getCommandId()));
        return command;
    }

    @Override
    public String toString() {
        return commandName;
    }
}
