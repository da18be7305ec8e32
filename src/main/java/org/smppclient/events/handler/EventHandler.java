package org.smppclient.events.handler;

import org.smppclient.SmppClientSession;
import org.smppclient.events.SessionEvent;

public interface EventHandler<R extends SessionEvent> {
    boolean canHandle(R sessionEvent, SmppClientSession session);

    void handle(R sessionEvent, SmppClientSession session);
}
