package org.smppclient.events.support;

import org.smppclient.SmppClientSession;
import org.smppclient.events.SessionEvent;
import org.smppclient.events.handler.EventHandler;

public class EventDispatcherImpl implements EventDispatcher {

    private final EventProcessor syncProcessor = EventProcessor.synchronous();
    private final EventProcessor asyncProcessor = EventProcessor.asynchronous("smpp-event");

    @Override
    public <E extends SessionEvent> E dispatch(E sessionEvent, SmppClientSession session) {
        asyncProcessor.dispatch(sessionEvent, session);
        syncProcessor.dispatch(sessionEvent, session);
        return sessionEvent;
    }

    @Override
    public boolean hasHandlers(Class<? extends SessionEvent> eventType) {
        return syncProcessor.hasHandlers(eventType) || asyncProcessor.hasHandlers(eventType);
    }

    @Override
    public void addHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler) {
        addHandler(eventType, eventHandler, ExecutionOrder.NORMAL);
    }

    @Override
    public void addHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler,
            ExecutionOrder executionOrder) {
        syncProcessor.addHandler(eventType, eventHandler, executionOrder);
    }

    @Override
    public void addAsyncHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler) {
        asyncProcessor.addHandler(eventType, eventHandler, ExecutionOrder.NORMAL);
    }

    /**
     * Stops the asynchronous handler thread. Events published afterwards reach synchronous
     * handlers only.
     */
    @Override
    public void destroy() {
        asyncProcessor.shutdown();
    }
}
