package org.smppclient.events;

import com.cloudhopper.smpp.pdu.Pdu;

/**
 * A PDU was written to the connection.
 */
public class PduSentEvent implements SessionEvent {
    private final Pdu pdu;

    public PduSentEvent(Pdu pdu) {
        this.pdu = pdu;
    }

    public Pdu getPdu() {
        return pdu;
    }
}
