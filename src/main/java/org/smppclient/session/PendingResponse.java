package org.smppclient.session;

import com.cloudhopper.smpp.pdu.PduRequest;
import com.cloudhopper.smpp.pdu.PduResponse;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A request that has been written and is waiting for the response carrying its sequence number.
 */
public class PendingResponse {

    private final PduRequest request;
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile PduResponse response;
    private volatile Throwable failure;
    private volatile long insertTimestamp;

    public PendingResponse(PduRequest request) {
        this.request = request;
    }

    public PduRequest getRequest() {
        return request;
    }

    public int getSequenceNumber() {
        return request.getSequenceNumber();
    }

    public void complete(PduResponse response) {
        this.response = response;
        done.countDown();
    }

    public void fail(Throwable t) {
        this.failure = t;
        done.countDown();
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    /**
     * @return true if the response or a failure arrived within the timeout
     */
    public boolean await(long timeoutMillis) throws InterruptedException {
        return done.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public PduResponse getResponse() {
        return response;
    }

    public Throwable getFailure() {
        return failure;
    }

    public long getInsertTimestamp() {
        return insertTimestamp;
    }

    void setInsertTimestamp(long insertTimestamp) {
        this.insertTimestamp = insertTimestamp;
    }
}
