package org.smppclient.client;

import com.cloudhopper.smpp.SmppBindType;
import com.cloudhopper.smpp.type.RecoverablePduException;
import com.cloudhopper.smpp.type.SmppChannelException;
import com.cloudhopper.smpp.type.SmppTimeoutException;
import com.cloudhopper.smpp.type.UnrecoverablePduException;
import org.smppclient.SmppClientSession;
import org.smppclient.SmppClientSessionConfiguration;
import org.smppclient.callback.PushHandler;
import org.smppclient.events.support.EventDispatcher;
import org.smppclient.events.support.EventDispatcherImpl;
import org.smppclient.exception.ProtocolErrorException;
import org.smppclient.session.DefaultSmppClientSession;
import org.smppclient.transport.SocketTransportConnector;
import org.smppclient.transport.TransportConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates client sessions (connect and bind). Sessions created here share one event dispatcher,
 * so handlers registered on {@link #getEventDispatcher()} see the events of all of them.
 */
public class BlockingSmppClient {
    private static final Logger logger = LoggerFactory.getLogger(BlockingSmppClient.class);

    private final EventDispatcher eventDispatcher;
    private final TransportConnector connector;

    public BlockingSmppClient() {
        this(new SocketTransportConnector(), new EventDispatcherImpl());
    }

    public BlockingSmppClient(TransportConnector connector, EventDispatcher eventDispatcher) {
        this.connector = connector;
        this.eventDispatcher = eventDispatcher;
    }

    public EventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    public SmppClientSession createSession(SmppClientSessionConfiguration config) {
        return new DefaultSmppClientSession(config, connector, eventDispatcher);
    }

    /**
     * Connects and binds with the bind type of the configuration. The session is disconnected
     * again if the bind does not succeed.
     */
    public SmppClientSession bind(SmppClientSessionConfiguration config, PushHandler pushHandler)
            throws SmppTimeoutException, SmppChannelException, UnrecoverablePduException, RecoverablePduException,
            ProtocolErrorException, InterruptedException {
        if (config.getType() == null)
            throw new UnrecoverablePduException("Session configuration " + config.getName() + " has no bind type");

        SmppClientSession session = createSession(config);
        if (pushHandler != null)
            session.setPushHandler(pushHandler);

        session.connect();
        try {
            bind(session, config.getType());
        } catch (Exception e) {
            logger.warn("Bind of {} to {}:{} failed: {}", config.getName(), config.getHost(), config.getPort(), e.getMessage());
            session.disconnect();
            throw e;
        }
        return session;
    }

    private void bind(SmppClientSession session, SmppBindType bindType) throws SmppTimeoutException,
            SmppChannelException, UnrecoverablePduException, RecoverablePduException, ProtocolErrorException,
            InterruptedException {
        session.bind(bindType);
        logger.info("Session {} bound as {}", session, bindType);
    }

    public void destroy() {
        eventDispatcher.destroy();
    }
}
