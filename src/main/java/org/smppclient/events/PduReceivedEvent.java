package org.smppclient.events;

import com.cloudhopper.smpp.pdu.Pdu;

public class PduReceivedEvent implements SessionEvent {
    private final Pdu pdu;

    public PduReceivedEvent(Pdu pdu) {
        this.pdu = pdu;
    }

    public Pdu getPdu() {
        return pdu;
    }
}
