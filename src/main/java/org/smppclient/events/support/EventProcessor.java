package org.smppclient.events.support;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.smppclient.SmppClientSession;
import org.smppclient.events.SessionEvent;
import org.smppclient.events.handler.EventHandler;
import org.smppclient.events.support.EventDispatcher.ExecutionOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Handlers registered per event type, kept sorted by {@link ExecutionOrder}. With an executor the
 * handlers run on its thread, otherwise on the thread that publishes the event.
 */
class EventProcessor {
    private static final Logger logger = LoggerFactory.getLogger(EventProcessor.class);

    private static final Comparator<Registration> BY_ORDER = Comparator.comparing(r -> r.order);

    private final ConcurrentMap<Class<? extends SessionEvent>, ImmutableList<Registration>> handlers =
            new ConcurrentHashMap<>();
    private final ExecutorService executor;

    private EventProcessor(ExecutorService executor) {
        this.executor = executor;
    }

    static EventProcessor synchronous() {
        return new EventProcessor(null);
    }

    static EventProcessor asynchronous(String threadName) {
        return new EventProcessor(Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat(threadName + "-%d")
                .setDaemon(true)
                .build()));
    }

    void addHandler(Class<? extends SessionEvent> eventType, EventHandler eventHandler, ExecutionOrder order) {
        Registration registration = new Registration(eventHandler, order);
        // sortedCopyOf is stable, so handlers of equal order keep registration order
        handlers.compute(eventType, (type, current) -> {
            List<Registration> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
            next.add(registration);
            return ImmutableList.sortedCopyOf(BY_ORDER, next);
        });
    }

    boolean hasHandlers(Class<? extends SessionEvent> eventType) {
        ImmutableList<Registration> registered = handlers.get(eventType);
        return registered != null && !registered.isEmpty();
    }

    void dispatch(SessionEvent sessionEvent, SmppClientSession session) {
        ImmutableList<Registration> registered = handlers.get(sessionEvent.getClass());
        if (registered == null)
            return;

        if (executor == null) {
            execute(registered, sessionEvent, session);
            return;
        }
        try {
            executor.execute(() -> execute(registered, sessionEvent, session));
        } catch (RejectedExecutionException e) {
            logger.debug("Dropping {} published after shutdown", sessionEvent.getClass().getSimpleName());
        }
    }

    @SuppressWarnings("unchecked")
    private void execute(List<Registration> registered, SessionEvent sessionEvent, SmppClientSession session) {
        for (Registration registration : registered) {
            EventHandler handler = registration.handler;
            try {
                if (handler.canHandle(sessionEvent, session))
                    handler.handle(sessionEvent, session);
            } catch (RuntimeException e) {
                logger.error("Event handler " + handler + " failed on " + sessionEvent.getClass().getSimpleName(), e);
            }
        }
    }

    void shutdown() {
        if (executor != null)
            executor.shutdown();
    }

    private static final class Registration {
        private final EventHandler handler;
        private final ExecutionOrder order;

        private Registration(EventHandler handler, ExecutionOrder order) {
            this.handler = handler;
            this.order = order;
        }
    }
}
