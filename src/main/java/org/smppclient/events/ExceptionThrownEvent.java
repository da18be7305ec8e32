package org.smppclient.events;

/**
 * A fault on the read path that ended the receive loop or a waiting call.
 */
public class ExceptionThrownEvent implements SessionEvent {

    private final Throwable cause;

    public ExceptionThrownEvent(Throwable cause) {
        this.cause = cause;
    }

    public Throwable getCause() {
        return cause;
    }
}
