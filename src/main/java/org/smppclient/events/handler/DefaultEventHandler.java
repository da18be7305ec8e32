package org.smppclient.events.handler;

import org.smppclient.SmppClientSession;
import org.smppclient.events.SessionEvent;

/**
 * Handler that accepts every event of its type.
 */
public interface DefaultEventHandler<R extends SessionEvent> extends EventHandler<R> {

    @Override
    default boolean canHandle(R sessionEvent, SmppClientSession session) {
        return true;
    }

}
