package org.smppclient.events.support;

import org.smppclient.SmppClientSession;
import org.smppclient.events.SessionEvent;
import org.smppclient.events.handler.EventHandler;

/**
 * Publishes session events to registered handlers. Synchronous handlers run on the thread that
 * produced the event, in {@link ExecutionOrder}; asynchronous ones on a dispatcher thread.
 */
public interface EventDispatcher {

    enum ExecutionOrder {
        BEFORE,
        NORMAL,
        AFTER
    }

    <E extends SessionEvent> E dispatch(E sessionEvent, SmppClientSession session);

    boolean hasHandlers(Class<? extends SessionEvent> eventType);

    void addHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler);

    void addHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler, ExecutionOrder executionOrder);

    void addAsyncHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler);

    void destroy();
}
