package org.smppclient;

import com.cloudhopper.smpp.SmppSessionConfiguration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Session settings: the ch-smpp bind and connection parameters plus the knobs of the blocking
 * session engine.
 */
public class SmppClientSessionConfiguration extends SmppSessionConfiguration {

    public static final long DEFAULT_READ_TIMEOUT = 1000;
    public static final long DEFAULT_RESPONSE_TIMEOUT = 30000;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 128 * 1024;

    // idle poll interval of the receive loop
    private long readTimeout = DEFAULT_READ_TIMEOUT;
    // <= 0 waits forever
    private long responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
    private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;
    private ReceiverRolePolicy receiverRolePolicy = ReceiverRolePolicy.ON_BIND_ATTEMPT;

    public long getReadTimeout() {
        return readTimeout;
    }

    /**
     * @param readTimeout idle poll interval in ms, must be positive
     */
    public void setReadTimeout(long readTimeout) {
        checkArgument(readTimeout > 0, "readTimeout must be > 0 but was %s", readTimeout);
        this.readTimeout = readTimeout;
    }

    public long getResponseTimeout() {
        return responseTimeout;
    }

    public void setResponseTimeout(long responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    public void setMaxFrameLength(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
    }

    public ReceiverRolePolicy getReceiverRolePolicy() {
        return receiverRolePolicy;
    }

    public void setReceiverRolePolicy(ReceiverRolePolicy receiverRolePolicy) {
        this.receiverRolePolicy = receiverRolePolicy;
    }
}
