package org.smppclient;

/**
 * When a session becomes allowed to run its receive loop after a receiver or transceiver bind.
 */
public enum ReceiverRolePolicy {
    /**
     * Granted as soon as the bind request passes the state check, before it is written, so a
     * receive loop started concurrently can run while the bind is in flight. The role is kept
     * even if the bind is rejected.
     */
    ON_BIND_ATTEMPT,
    /**
     * Granted only once the peer confirmed the bind with a successful response.
     */
    ON_BIND_SUCCESS
}
