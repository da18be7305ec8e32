package org.smppclient.session;

import com.cloudhopper.smpp.SmppBindType;
import com.cloudhopper.smpp.SmppConstants;
import com.cloudhopper.smpp.pdu.BaseBind;
import com.cloudhopper.smpp.pdu.BaseBindResp;
import com.cloudhopper.smpp.pdu.BindReceiver;
import com.cloudhopper.smpp.pdu.BindTransceiver;
import com.cloudhopper.smpp.pdu.BindTransmitter;
import com.cloudhopper.smpp.pdu.EnquireLink;
import com.cloudhopper.smpp.pdu.EnquireLinkResp;
import com.cloudhopper.smpp.pdu.GenericNack;
import com.cloudhopper.smpp.pdu.Pdu;
import com.cloudhopper.smpp.pdu.PduRequest;
import com.cloudhopper.smpp.pdu.PduResponse;
import com.cloudhopper.smpp.pdu.SubmitSm;
import com.cloudhopper.smpp.pdu.SubmitSmResp;
import com.cloudhopper.smpp.pdu.Unbind;
import com.cloudhopper.smpp.pdu.UnbindResp;
import com.cloudhopper.smpp.transcoder.DefaultPduTranscoder;
import com.cloudhopper.smpp.transcoder.DefaultPduTranscoderContext;
import com.cloudhopper.smpp.transcoder.PduTranscoder;
import com.cloudhopper.smpp.transcoder.PduTranscoderContext;
import com.cloudhopper.smpp.type.RecoverablePduException;
import com.cloudhopper.smpp.type.SmppChannelConnectException;
import com.cloudhopper.smpp.type.SmppChannelException;
import com.cloudhopper.smpp.type.SmppTimeoutException;
import com.cloudhopper.smpp.type.UnrecoverablePduException;
import com.cloudhopper.smpp.util.SequenceNumber;
import com.google.common.io.BaseEncoding;
import org.jboss.netty.buffer.ChannelBuffer;
import org.jboss.netty.buffer.ChannelBuffers;
import org.smppclient.ReceiverRolePolicy;
import org.smppclient.SmppClientSession;
import org.smppclient.SmppClientSessionConfiguration;
import org.smppclient.callback.LoggingPushHandler;
import org.smppclient.callback.PushHandler;
import org.smppclient.events.ExceptionThrownEvent;
import org.smppclient.events.PduReceivedEvent;
import org.smppclient.events.PduSentEvent;
import org.smppclient.events.SessionStateChangedEvent;
import org.smppclient.events.UnexpectedPduResponseReceivedEvent;
import org.smppclient.events.support.EventDispatcher;
import org.smppclient.events.support.EventDispatcherImpl;
import org.smppclient.exception.FramingException;
import org.smppclient.exception.InvalidSessionStateException;
import org.smppclient.exception.ProtocolErrorException;
import org.smppclient.exception.SessionUsageException;
import org.smppclient.transport.FrameTransport;
import org.smppclient.transport.SocketTransportConnector;
import org.smppclient.transport.TransportConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Blocking client session over a single connection.
 * <p>
 * Reads are owned by whoever holds {@code readLock}: the receive loop while it runs, otherwise
 * a caller waiting for its response. Each frame read is routed by its type, so a response
 * reaches the caller waiting on its sequence number no matter which thread read it, and pushes
 * are answered no matter which thread read them. Writes are serialized per frame by the
 * transport.
 */
public class DefaultSmppClientSession implements SmppClientSession {
    private static final Logger logger = LoggerFactory.getLogger(DefaultSmppClientSession.class);

    private final SmppClientSessionConfiguration configuration;
    private final String host;
    private final int port;
    private final TransportConnector connector;
    private final EventDispatcher eventDispatcher;
    private final boolean ownsEventDispatcher;
    private final AtomicReference<SessionState> state;
    private final SessionHistory history;
    private final ResponseWindow window;
    private final SequenceNumber sequenceNumber;
    private final PduTranscoderContext transcoderContext;
    private final PduTranscoder transcoder;
    private final ReentrantLock readLock;
    private final AtomicBoolean used;
    private final AtomicBoolean listening;
    private volatile FrameTransport transport;
    private volatile boolean receiverCapable;
    private volatile boolean stopRequested;
    private volatile boolean unbindReceived;
    private volatile PushHandler pushHandler;

    /**
     * Session with its own event dispatcher, destroyed on {@link #disconnect()}.
     */
    public DefaultSmppClientSession(SmppClientSessionConfiguration configuration) {
        this(configuration, new SocketTransportConnector(), new EventDispatcherImpl(), true);
    }

    /**
     * Session publishing to a shared dispatcher; the caller destroys it.
     */
    public DefaultSmppClientSession(SmppClientSessionConfiguration configuration, TransportConnector connector,
            EventDispatcher eventDispatcher) {
        this(configuration, connector, eventDispatcher, false);
    }

    DefaultSmppClientSession(SmppClientSessionConfiguration configuration, TransportConnector connector,
            EventDispatcher eventDispatcher, boolean ownsEventDispatcher) {
        this.configuration = checkNotNull(configuration, "configuration");
        this.host = checkNotNull(configuration.getHost(), "host");
        this.port = configuration.getPort();
        this.connector = checkNotNull(connector, "connector");
        this.eventDispatcher = checkNotNull(eventDispatcher, "eventDispatcher");
        this.ownsEventDispatcher = ownsEventDispatcher;
        this.state = new AtomicReference<>(SessionState.CLOSED);
        this.history = new SessionHistory();
        this.window = new ResponseWindow();
        this.sequenceNumber = new SequenceNumber();
        this.transcoderContext = new DefaultPduTranscoderContext();
        this.transcoder = new DefaultPduTranscoder(transcoderContext);
        this.readLock = new ReentrantLock();
        this.used = new AtomicBoolean();
        this.listening = new AtomicBoolean();
        this.pushHandler = new LoggingPushHandler();
    }

    @Override
    public void connect() throws SmppChannelConnectException {
        if (used.get())
            throw new SessionUsageException("Session to " + host + ":" + port + " was already connected once; create a new session");

        FrameTransport connected = connector.connect(host, port, configuration.getConnectTimeout(),
                configuration.getReadTimeout(), configuration.getMaxFrameLength());
        if (!used.compareAndSet(false, true)) {
            connected.close();
            throw new SessionUsageException("Session to " + host + ":" + port + " was connected concurrently");
        }

        this.transport = connected;
        changeState(SessionState.OPEN);
    }

    @Override
    public void disconnect() {
        logger.info("Disconnecting from {}:{}...", host, port);
        stopRequested = true;
        FrameTransport current = transport;
        if (current != null)
            current.close();
        changeState(SessionState.CLOSED);
        window.failAll(new SmppChannelException("Session to " + host + ":" + port + " closed"));
        if (ownsEventDispatcher)
            eventDispatcher.destroy();
    }

    @Override
    public void send(Pdu pdu) throws SmppChannelException, UnrecoverablePduException, RecoverablePduException {
        Command command = Command.forPdu(pdu);
        SessionState current = state.get();
        if (!CommandStateMatrix.isAllowed(command, current))
            throw new InvalidSessionStateException(command, current);

        FrameTransport out = requireTransport();
        // assign the next PDU sequence # if its not yet assigned
        if (!pdu.hasSequenceNumberAssigned()) {
            pdu.setSequenceNumber(this.sequenceNumber.next());
        }

        byte[] frame = encode(pdu);
        logPdu("Sending", command, pdu);
        logBytes(">>", frame);
        out.writeFrame(frame);
        history.record(pdu);

        if (eventDispatcher.hasHandlers(PduSentEvent.class))
            eventDispatcher.dispatch(new PduSentEvent(pdu), this);
    }

    @Override
    public Pdu receive() throws SmppTimeoutException, SmppChannelException, RecoverablePduException,
            ProtocolErrorException {
        readLock.lock();
        try {
            return readPdu();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public PduResponse sendRequestAndWait(PduRequest request, long timeoutMillis) throws SmppTimeoutException,
            SmppChannelException, UnrecoverablePduException, RecoverablePduException, ProtocolErrorException,
            InterruptedException {
        Command command = Command.forPdu(request);
        SessionState current = state.get();
        if (!CommandStateMatrix.isAllowed(command, current))
            throw new InvalidSessionStateException(command, current);

        if (!request.hasSequenceNumberAssigned()) {
            request.setSequenceNumber(this.sequenceNumber.next());
        }

        // registered before the write so a fast response always finds its waiter
        PendingResponse pending = new PendingResponse(request);
        window.insert(pending);
        try {
            send(request);
        } catch (Exception e) {
            window.complete(request.getSequenceNumber());
            throw e;
        }

        return awaitResponse(pending, timeoutMillis);
    }

    private PduResponse awaitResponse(PendingResponse pending, long timeoutMillis) throws SmppTimeoutException,
            SmppChannelException, RecoverablePduException, ProtocolErrorException, InterruptedException {
        long deadline = timeoutMillis > 0 ? System.currentTimeMillis() + timeoutMillis : Long.MAX_VALUE;
        try {
            while (!pending.isDone()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    window.complete(pending.getSequenceNumber());
                    throw new SmppTimeoutException("No response to " + Command.forPdu(pending.getRequest())
                            + " [" + pending.getSequenceNumber() + "] within " + timeoutMillis + " ms");
                }

                if (readLock.tryLock()) {
                    try {
                        if (!pending.isDone())
                            readAndRoute();
                    } finally {
                        readLock.unlock();
                    }
                } else {
                    pending.await(Math.min(remaining, configuration.getReadTimeout()));
                }
            }
        } catch (InterruptedException e) {
            window.complete(pending.getSequenceNumber());
            throw e;
        }

        Throwable failure = pending.getFailure();
        if (failure != null) {
            if (failure instanceof SmppChannelException)
                throw (SmppChannelException) failure;
            if (failure instanceof RecoverablePduException)
                throw (RecoverablePduException) failure;
            throw new SmppChannelException("Waiting for response [" + pending.getSequenceNumber() + "] failed: "
                    + failure.getMessage(), failure);
        }

        PduResponse response = pending.getResponse();
        checkStatus(response);
        return response;
    }

    @Override
    public BaseBindResp bind(SmppBindType bindType) throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException {
        return bind(createBindRequest(bindType));
    }

    @Override
    public BaseBindResp bind(BaseBind request) throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException {
        Command command = Command.forPdu(request);
        SessionState current = state.get();
        if (!CommandStateMatrix.isAllowed(command, current))
            throw new InvalidSessionStateException(command, current);

        ReceiverRolePolicy policy = configuration.getReceiverRolePolicy();
        if (command.isReceiverBind() && policy == ReceiverRolePolicy.ON_BIND_ATTEMPT)
            receiverCapable = true;

        logger.info("Binding to {}:{} with {}", host, port, command);
        PduResponse response = sendRequestAndWait(request, configuration.getBindTimeout());
        BaseBindResp bindResp = expectResponse(response, BaseBindResp.class, command);

        if (command.isReceiverBind() && policy == ReceiverRolePolicy.ON_BIND_SUCCESS)
            receiverCapable = true;
        return bindResp;
    }

    private BaseBind createBindRequest(SmppBindType bindType) throws UnrecoverablePduException {
        BaseBind bind;
        if (bindType == SmppBindType.TRANSCEIVER) {
            bind = new BindTransceiver();
        } else if (bindType == SmppBindType.RECEIVER) {
            bind = new BindReceiver();
        } else if (bindType == SmppBindType.TRANSMITTER) {
            bind = new BindTransmitter();
        } else {
            throw new UnrecoverablePduException("Unable to create a bind request for bind type " + bindType);
        }
        bind.setSystemId(configuration.getSystemId());
        bind.setPassword(configuration.getPassword());
        bind.setSystemType(configuration.getSystemType());
        bind.setInterfaceVersion(configuration.getInterfaceVersion());
        bind.setAddressRange(configuration.getAddressRange());
        return bind;
    }

    @Override
    public UnbindResp unbind() throws SmppTimeoutException, SmppChannelException, UnrecoverablePduException,
            RecoverablePduException, ProtocolErrorException, InterruptedException {
        PduResponse response = sendRequestAndWait(new Unbind(), configuration.getResponseTimeout());
        return expectResponse(response, UnbindResp.class, Command.UNBIND);
    }

    @Override
    public SubmitSmResp submit(SubmitSm submitSm) throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException {
        PduResponse response = sendRequestAndWait(submitSm, configuration.getResponseTimeout());
        return expectResponse(response, SubmitSmResp.class, Command.SUBMIT_SM);
    }

    @Override
    public EnquireLinkResp enquireLink() throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException {
        PduResponse response = sendRequestAndWait(new EnquireLink(), configuration.getResponseTimeout());
        return expectResponse(response, EnquireLinkResp.class, Command.ENQUIRE_LINK);
    }

    private <T extends PduResponse> T expectResponse(PduResponse response, Class<T> type, Command requestCommand)
            throws UnrecoverablePduException {
        if (!type.isInstance(response))
            throw new UnrecoverablePduException("Unexpected response " + response.getName() + " to " + requestCommand);
        return type.cast(response);
    }

    @Override
    public void listen() throws SmppChannelException, InterruptedException {
        if (!receiverCapable)
            throw new SessionUsageException("listen() is not allowed for a session that is not bound as receiver or transceiver");
        if (!listening.compareAndSet(false, true))
            throw new SessionUsageException("Receive loop is already running");

        logger.info("Listening for PDUs from {}:{}", host, port);
        try {
            while (!stopRequested && !unbindReceived && state.get() != SessionState.CLOSED) {
                readLock.lockInterruptibly();
                boolean open;
                try {
                    open = readAndRoute();
                } finally {
                    readLock.unlock();
                }
                if (!open)
                    break;
            }
        } finally {
            stopRequested = false;
            listening.set(false);
        }
        // an unbind read by a waiting caller before the loop started also ends it here
        if (unbindReceived) {
            unbindReceived = false;
            logger.info("Receive loop for {}:{} ended by peer unbind", host, port);
        } else {
            logger.info("Receive loop for {}:{} finished", host, port);
        }
    }

    @Override
    public void stopListening() {
        stopRequested = true;
    }

    @Override
    public boolean isListening() {
        return listening.get();
    }

    /**
     * Reads one frame and hands it to whoever it belongs to.
     *
     * @return false once the stream has ended
     */
    private boolean readAndRoute() throws SmppChannelException {
        Pdu pdu;
        try {
            pdu = readPdu();
        } catch (SmppTimeoutException e) {
            logger.trace("Socket timeout, listening again");
            return true;
        } catch (ProtocolErrorException e) {
            // the waiter re-checks the status and raises on its own thread
            pdu = e.getPdu();
        } catch (RecoverablePduException e) {
            logger.warn("Discarding PDU that could not be decoded: {}", e.getMessage());
            Pdu partial = e.getPartialPdu();
            if (partial instanceof PduResponse)
                failPending(partial.getSequenceNumber(), e);
            else
                nackPartialRequest(partial);
            return true;
        } catch (SmppChannelException e) {
            if (state.get() == SessionState.CLOSED)
                return false;
            fireExceptionThrown(e);
            window.failAll(e);
            throw e;
        }

        if (pdu == null) {
            if (state.get() != SessionState.CLOSED) {
                logger.info("Connection closed by {}:{}", host, port);
                disconnect();
            }
            return false;
        }

        route(pdu);
        return true;
    }

    private Pdu readPdu() throws SmppTimeoutException, SmppChannelException, RecoverablePduException,
            ProtocolErrorException {
        FrameTransport in = requireTransport();
        byte[] frame = in.readFrame();
        if (frame == null)
            return null;

        logBytes("<<", frame);
        Pdu pdu;
        try {
            pdu = transcoder.decode(ChannelBuffers.wrappedBuffer(frame));
        } catch (UnrecoverablePduException e) {
            throw new FramingException("Unable to decode frame of " + frame.length + " bytes: " + e.getMessage(), e);
        }
        if (pdu == null)
            throw new FramingException("Frame of " + frame.length + " bytes does not hold a complete PDU");

        history.record(pdu);
        if (eventDispatcher.hasHandlers(PduReceivedEvent.class))
            eventDispatcher.dispatch(new PduReceivedEvent(pdu), this);

        Command command = Command.fromId(pdu.getCommandId());
        if (command == null)
            throw new RecoverablePduException(pdu, "Unsupported command id 0x" + Integer.toHexString(pdu.getCommandId()));
        logPdu("Read", command, pdu);

        checkStatus(pdu);
        applyStateSetter(command);
        return pdu;
    }

    private void checkStatus(Pdu pdu) throws ProtocolErrorException {
        int status = pdu.getCommandStatus();
        if (status != SmppConstants.STATUS_OK)
            throw new ProtocolErrorException(pdu, Command.forPdu(pdu), describeStatus(status));
    }

    private String describeStatus(int status) {
        String description = transcoderContext.lookupResultMessage(status);
        return description != null ? description : "Unknown status 0x" + Integer.toHexString(status);
    }

    private void applyStateSetter(Command command) {
        SessionState next = CommandStateMatrix.stateAfter(command);
        if (next == null)
            return;

        SessionState current = state.get();
        if (!CommandStateMatrix.isAllowed(command, current)) {
            logger.warn("Ignoring state change on {} received in state {}", command, current);
            return;
        }
        if (state.compareAndSet(current, next))
            stateChanged(current, next);
    }

    private void route(Pdu pdu) throws SmppChannelException {
        if (pdu instanceof PduResponse) {
            PduResponse response = (PduResponse) pdu;
            PendingResponse pending = window.complete(response.getSequenceNumber());
            if (pending != null) {
                pending.complete(response);
            } else {
                logger.warn("Received {} [{}] nobody is waiting for", response.getName(), response.getSequenceNumber());
                if (eventDispatcher.hasHandlers(UnexpectedPduResponseReceivedEvent.class))
                    eventDispatcher.dispatch(new UnexpectedPduResponseReceivedEvent(response), this);
            }
        } else if (pdu instanceof PduRequest) {
            handleRequest((PduRequest) pdu);
        } else {
            // alert_notification has no response
            firePush(pdu);
        }
    }

    private void handleRequest(PduRequest request) throws SmppChannelException {
        Command command = Command.forPdu(request);
        switch (command) {
            case UNBIND:
                logger.info("Unbind command received");
                unbindReceived = true;
                break;
            case DELIVER_SM:
            case DATA_SM:
                if (reply(request, command))
                    firePush(request);
                break;
            case ENQUIRE_LINK:
                if (reply(request, command))
                    logger.info("Link enquiry [{}] answered", request.getSequenceNumber());
                break;
            case ALERT_NOTIFICATION:
                firePush(request);
                break;
            default:
                logger.warn("Unhandled SMPP command '{}'", command);
        }
    }

    private boolean reply(PduRequest request, Command command) throws SmppChannelException {
        PduResponse response = request.createResponse();
        try {
            send(response);
            return true;
        } catch (InvalidSessionStateException e) {
            logger.warn("Not answering {} [{}]: {}", command, request.getSequenceNumber(), e.getMessage());
        } catch (SmppChannelException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Unable to encode response to {} [{}]", command, request.getSequenceNumber(), e);
        }
        return false;
    }

    private void failPending(int sequenceNumber, RecoverablePduException e) {
        PendingResponse pending = window.complete(sequenceNumber);
        if (pending != null)
            pending.fail(e);
    }

    private void nackPartialRequest(Pdu partial) throws SmppChannelException {
        if (!(partial instanceof PduRequest))
            return;

        GenericNack nack = new GenericNack();
        nack.setSequenceNumber(partial.getSequenceNumber());
        // a known command whose body did not decode is a length problem, not an unknown command
        if (Command.fromId(partial.getCommandId()) == null)
            nack.setCommandStatus(SmppConstants.STATUS_INVCMDID);
        else
            nack.setCommandStatus(SmppConstants.STATUS_INVMSGLEN);
        try {
            send(nack);
        } catch (InvalidSessionStateException e) {
            logger.warn("Not sending generic_nack [{}]: {}", partial.getSequenceNumber(), e.getMessage());
        } catch (SmppChannelException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Unable to encode generic_nack [{}]", partial.getSequenceNumber(), e);
        }
    }

    private void firePush(Pdu pdu) {
        PushHandler handler = this.pushHandler;
        try {
            handler.onPush(pdu, this);
        } catch (RuntimeException e) {
            logger.error("Push handler failed, handler=" + handler + ", pdu=" + pdu, e);
        }
    }

    private void fireExceptionThrown(Throwable t) {
        if (eventDispatcher.hasHandlers(ExceptionThrownEvent.class))
            eventDispatcher.dispatch(new ExceptionThrownEvent(t), this);
    }

    private void changeState(SessionState next) {
        SessionState previous = state.getAndSet(next);
        if (previous != next)
            stateChanged(previous, next);
    }

    private void stateChanged(SessionState previous, SessionState next) {
        logger.info("Session {}:{} state {} -> {}", host, port, previous, next);
        if (eventDispatcher.hasHandlers(SessionStateChangedEvent.class))
            eventDispatcher.dispatch(new SessionStateChangedEvent(previous, next), this);
    }

    private FrameTransport requireTransport() throws SmppChannelException {
        FrameTransport current = transport;
        if (current == null)
            throw new SmppChannelException("Session to " + host + ":" + port + " is not connected");
        return current;
    }

    private byte[] encode(Pdu pdu) throws UnrecoverablePduException, RecoverablePduException {
        ChannelBuffer buffer = transcoder.encode(pdu);
        byte[] frame = new byte[buffer.readableBytes()];
        buffer.readBytes(frame);
        return frame;
    }

    private void logPdu(String action, Command command, Pdu pdu) {
        if (!logger.isDebugEnabled())
            return;
        if (configuration.getLoggingOptions().isLogPduEnabled())
            logger.debug("{} {} PDU: {}", action, command, pdu);
        else
            logger.debug("{} {} PDU [{}]", action, command, pdu.getSequenceNumber());
    }

    private void logBytes(String direction, byte[] frame) {
        if (logger.isDebugEnabled() && configuration.getLoggingOptions().isLogBytesEnabled())
            logger.debug("{} {} {} bytes", direction, BaseEncoding.base16().lowerCase().encode(frame), frame.length);
    }

    @Override
    public void setPushHandler(PushHandler pushHandler) {
        this.pushHandler = checkNotNull(pushHandler, "pushHandler");
    }

    @Override
    public PushHandler getPushHandler() {
        return pushHandler;
    }

    @Override
    public SessionState getState() {
        return state.get();
    }

    @Override
    public boolean isReceiverCapable() {
        return receiverCapable;
    }

    @Override
    public SessionHistory getHistory() {
        return history;
    }

    @Override
    public SmppClientSessionConfiguration getConfiguration() {
        return configuration;
    }

    public EventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    public ResponseWindow getResponseWindow() {
        return window;
    }

    public int getNextSequenceNumber() {
        return this.sequenceNumber.peek();
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public int getPort() {
        return port;
    }

    @Override
    public String toString() {
        return "DefaultSmppClientSession[" + configuration.getName() + " " + host + ":" + port + " " + state.get() + "]";
    }
}
