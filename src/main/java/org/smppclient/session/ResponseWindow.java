package org.smppclient.session;

import org.smppclient.exception.SessionUsageException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Outstanding requests keyed by sequence number. A sequence number can only be awaited once
 * at a time.
 */
public class ResponseWindow {

    private final ConcurrentMap<Integer, PendingResponse> container = new ConcurrentHashMap<>();

    public Map<Integer, PendingResponse> getContainer() {
        return Collections.unmodifiableMap(container);
    }

    public void insert(PendingResponse pending) {
        int key = pending.getSequenceNumber();
        PendingResponse previous = container.putIfAbsent(key, pending);
        if (previous != null)
            throw new SessionUsageException("Sequence number [" + key + "] is already awaiting a response");

        pending.setInsertTimestamp(System.currentTimeMillis());
    }

    public PendingResponse complete(int key) {
        return container.remove(key);
    }

    public List<PendingResponse> failAll(Throwable cause) {
        List<PendingResponse> ret = new ArrayList<>();
        container.forEach((key, pending) -> {
            PendingResponse val = container.remove(key);
            if (val != null)
                ret.add(val);
        });

        ret.forEach(pending -> pending.fail(cause));
        return ret;
    }

    public int getSize() {
        return container.size();
    }
}
