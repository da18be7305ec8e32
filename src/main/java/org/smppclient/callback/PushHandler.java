package org.smppclient.callback;

import com.cloudhopper.smpp.pdu.Pdu;
import org.smppclient.SmppClientSession;

/**
 * Receives PDUs the peer sends on its own initiative (deliver_sm, data_sm, alert_notification).
 * Invoked on the reading thread after the response to the push has been sent.
 */
@FunctionalInterface
public interface PushHandler {

    void onPush(Pdu pdu, SmppClientSession session);
}
