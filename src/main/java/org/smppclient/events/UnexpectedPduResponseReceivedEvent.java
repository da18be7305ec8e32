package org.smppclient.events;

import com.cloudhopper.smpp.pdu.PduResponse;

/**
 * A response arrived for a sequence number nobody is waiting on.
 */
public class UnexpectedPduResponseReceivedEvent implements SessionEvent {

    private final PduResponse pduResponse;

    public UnexpectedPduResponseReceivedEvent(PduResponse pduResponse) {
        this.pduResponse = pduResponse;
    }

    public PduResponse getPduResponse() {
        return pduResponse;
    }
}
