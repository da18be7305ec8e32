package org.smppclient;

import com.cloudhopper.smpp.SmppBindType;
import com.cloudhopper.smpp.pdu.BaseBind;
import com.cloudhopper.smpp.pdu.BaseBindResp;
import com.cloudhopper.smpp.pdu.EnquireLinkResp;
import com.cloudhopper.smpp.pdu.Pdu;
import com.cloudhopper.smpp.pdu.PduRequest;
import com.cloudhopper.smpp.pdu.PduResponse;
import com.cloudhopper.smpp.pdu.SubmitSm;
import com.cloudhopper.smpp.pdu.SubmitSmResp;
import com.cloudhopper.smpp.pdu.UnbindResp;
import com.cloudhopper.smpp.type.RecoverablePduException;
import com.cloudhopper.smpp.type.SmppChannelConnectException;
import com.cloudhopper.smpp.type.SmppChannelException;
import com.cloudhopper.smpp.type.SmppTimeoutException;
import com.cloudhopper.smpp.type.UnrecoverablePduException;
import org.smppclient.callback.PushHandler;
import org.smppclient.exception.ProtocolErrorException;
import org.smppclient.session.SessionHistory;
import org.smppclient.session.SessionState;

/**
 * One SMPP client connection: bind state, framed exchange with the peer and, for receiver
 * binds, the loop that answers pushes and keep-alives.
 * <p>
 * Every send is validated against the command/state matrix; a command not allowed in the
 * current state fails with {@link org.smppclient.exception.InvalidSessionStateException}
 * without touching the connection.
 */
public interface SmppClientSession {

    /**
     * Opens the connection: {@code CLOSED -> OPEN}. A session connects at most once.
     */
    void connect() throws SmppChannelConnectException;

    /**
     * Closes the connection and moves to {@code CLOSED}. Calls waiting for a response fail.
     */
    void disconnect();

    void send(Pdu pdu) throws SmppChannelException, UnrecoverablePduException, RecoverablePduException;

    /**
     * Reads one PDU from the peer.
     *
     * @return the PDU, or null if the peer closed the stream
     * @throws SmppTimeoutException   nothing arrived within the read timeout
     * @throws ProtocolErrorException the PDU carries a non-zero command status
     */
    Pdu receive() throws SmppTimeoutException, SmppChannelException, RecoverablePduException,
            ProtocolErrorException;

    /**
     * Sends the request and blocks until the response with the same sequence number arrives.
     *
     * @param timeoutMillis maximum wait, {@code <= 0} waits forever
     */
    PduResponse sendRequestAndWait(PduRequest request, long timeoutMillis) throws SmppTimeoutException,
            SmppChannelException, UnrecoverablePduException, RecoverablePduException, ProtocolErrorException,
            InterruptedException;

    BaseBindResp bind(SmppBindType bindType) throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException;

    BaseBindResp bind(BaseBind request) throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException;

    UnbindResp unbind() throws SmppTimeoutException, SmppChannelException, UnrecoverablePduException,
            RecoverablePduException, ProtocolErrorException, InterruptedException;

    SubmitSmResp submit(SubmitSm submitSm) throws SmppTimeoutException, SmppChannelException,
            UnrecoverablePduException, RecoverablePduException, ProtocolErrorException, InterruptedException;

    EnquireLinkResp enquireLink() throws SmppTimeoutException, SmppChannelException, UnrecoverablePduException,
            RecoverablePduException, ProtocolErrorException, InterruptedException;

    /**
     * Runs the receive loop on the calling thread until the peer unbinds, the session closes,
     * {@link #stopListening()} is called or the transport fails.
     *
     * @throws org.smppclient.exception.SessionUsageException if the session is not receiver capable
     */
    void listen() throws SmppChannelException, InterruptedException;

    void stopListening();

    boolean isListening();

    void setPushHandler(PushHandler pushHandler);

    PushHandler getPushHandler();

    SessionState getState();

    boolean isReceiverCapable();

    SessionHistory getHistory();

    SmppClientSessionConfiguration getConfiguration();

    String getHost();

    int getPort();
}
