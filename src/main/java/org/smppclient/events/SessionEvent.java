package org.smppclient.events;

/**
 * Marker for everything published through {@link org.smppclient.events.support.EventDispatcher}.
 */
public interface SessionEvent {
}
