package org.smppclient.session;

/**
 * Bind state of a client session. {@link #CLOSED} is both the initial and the terminal state.
 */
public enum SessionState {
    CLOSED,
    OPEN,
    BOUND_TRANSMITTER,
    BOUND_RECEIVER,
    BOUND_TRANSCEIVER
}
