package org.smppclient.session;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.smppclient.session.SessionState.BOUND_RECEIVER;
import static org.smppclient.session.SessionState.BOUND_TRANSCEIVER;
import static org.smppclient.session.SessionState.BOUND_TRANSMITTER;
import static org.smppclient.session.SessionState.OPEN;

/**
 * Static protocol tables: in which states each command may be exchanged, and which
 * responses move the session into a new state.
 */
public final class CommandStateMatrix {

    private static final Map<Command, Set<SessionState>> COMMAND_STATES = new EnumMap<>(Command.class);
    private static final Map<Command, SessionState> STATE_SETTERS = new EnumMap<>(Command.class);

    static {
        Set<SessionState> open = EnumSet.of(OPEN);
        Set<SessionState> anyBound = EnumSet.of(BOUND_TRANSMITTER, BOUND_RECEIVER, BOUND_TRANSCEIVER);
        Set<SessionState> transmitting = EnumSet.of(BOUND_TRANSMITTER, BOUND_TRANSCEIVER);
        Set<SessionState> receiving = EnumSet.of(BOUND_RECEIVER, BOUND_TRANSCEIVER);

        allow(open, Command.BIND_TRANSMITTER, Command.BIND_TRANSMITTER_RESP,
                Command.BIND_RECEIVER, Command.BIND_RECEIVER_RESP,
                Command.BIND_TRANSCEIVER, Command.BIND_TRANSCEIVER_RESP,
                Command.OUTBIND);
        allow(anyBound, Command.UNBIND, Command.UNBIND_RESP,
                Command.DATA_SM, Command.DATA_SM_RESP,
                Command.ENQUIRE_LINK, Command.ENQUIRE_LINK_RESP,
                Command.GENERIC_NACK);
        allow(transmitting, Command.SUBMIT_SM, Command.SUBMIT_SM_RESP,
                Command.SUBMIT_MULTI, Command.SUBMIT_MULTI_RESP);
        allow(receiving, Command.DELIVER_SM, Command.DELIVER_SM_RESP,
                Command.QUERY_SM, Command.QUERY_SM_RESP,
                Command.CANCEL_SM, Command.CANCEL_SM_RESP,
                Command.ALERT_NOTIFICATION);
        allow(EnumSet.of(BOUND_TRANSMITTER), Command.REPLACE_SM, Command.REPLACE_SM_RESP);

        STATE_SETTERS.put(Command.BIND_TRANSMITTER_RESP, BOUND_TRANSMITTER);
        STATE_SETTERS.put(Command.BIND_RECEIVER_RESP, BOUND_RECEIVER);
        STATE_SETTERS.put(Command.BIND_TRANSCEIVER_RESP, BOUND_TRANSCEIVER);
        STATE_SETTERS.put(Command.UNBIND_RESP, OPEN);
    }

    private CommandStateMatrix() {
    }

    private static void allow(Set<SessionState> states, Command... commands) {
        for (Command command : commands) {
            COMMAND_STATES.put(command, Collections.unmodifiableSet(EnumSet.copyOf(states)));
        }
    }

    public static Set<SessionState> allowedStates(Command command) {
        Set<SessionState> states = COMMAND_STATES.get(command);
        return states == null ? Collections.emptySet() : states;
    }

    public static boolean isAllowed(Command command, SessionState state) {
        return allowedStates(command).contains(state);
    }

    /**
     * @return the state entered on receipt of this response, or null if it does not change state
     */
    public static SessionState stateAfter(Command response) {
        return STATE_SETTERS.get(response);
    }

    public static Map<Command, SessionState> stateSetters() {
        return Collections.unmodifiableMap(STATE_SETTERS);
    }
}
