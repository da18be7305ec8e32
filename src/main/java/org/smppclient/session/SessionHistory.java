package org.smppclient.session;

import com.cloudhopper.smpp.pdu.Pdu;
import com.cloudhopper.smpp.pdu.PduResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of every PDU exchanged by one session, in exchange order. Used for
 * diagnostics only; nothing in the session consults it for control flow.
 */
public class SessionHistory {

    public enum Direction {
        REQUEST,
        RESPONSE
    }

    public static final class Entry {
        private final int sequenceNumber;
        private final Direction direction;
        private final Pdu pdu;
        private final long timestamp;

        Entry(int sequenceNumber, Direction direction, Pdu pdu, long timestamp) {
            this.sequenceNumber = sequenceNumber;
            this.direction = direction;
            this.pdu = pdu;
            this.timestamp = timestamp;
        }

        public int getSequenceNumber() {
            return sequenceNumber;
        }

        public Direction getDirection() {
            return direction;
        }

        public Pdu getPdu() {
            return pdu;
        }

        public long getTimestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return "{" + sequenceNumber + ": {" + direction.name().toLowerCase() + ": " + pdu.getName() + "}}";
        }
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    public void record(Pdu pdu) {
        Direction direction = pdu instanceof PduResponse ? Direction.RESPONSE : Direction.REQUEST;
        entries.add(new Entry(pdu.getSequenceNumber(), direction, pdu, System.currentTimeMillis()));
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> forSequence(int sequenceNumber) {
        List<Entry> ret = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.getSequenceNumber() == sequenceNumber)
                ret.add(entry);
        }
        return ret;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
