package org.smppclient.events;

import org.smppclient.session.SessionState;

public class SessionStateChangedEvent implements SessionEvent {
    private final SessionState previous;
    private final SessionState current;

    public SessionStateChangedEvent(SessionState previous, SessionState current) {
        this.previous = previous;
        this.current = current;
    }

    public SessionState getPrevious() {
        return previous;
    }

    public SessionState getCurrent() {
        return current;
    }
}
