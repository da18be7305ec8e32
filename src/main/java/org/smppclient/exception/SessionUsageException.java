package org.smppclient.exception;

/**
 * A precondition of a session operation was violated by the caller, e.g. starting the
 * receive loop on a session that never bound as receiver.
 */
public class SessionUsageException extends IllegalStateException {

    public SessionUsageException(String message) {
        super(message);
    }
}
