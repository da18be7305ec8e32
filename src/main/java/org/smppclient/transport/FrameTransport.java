package org.smppclient.transport;

import com.cloudhopper.smpp.type.SmppChannelException;
import com.cloudhopper.smpp.type.SmppTimeoutException;

import java.io.Closeable;

/**
 * Moves whole length-prefixed frames over one connection. Every frame is a 4 byte
 * big-endian total length followed by {@code length - 4} body bytes.
 */
public interface FrameTransport extends Closeable {

    /**
     * Reads exactly one frame, blocking until it is complete.
     *
     * @return the frame (prefix and body), or null if the peer closed the stream before
     * sending any byte of a new frame
     * @throws SmppTimeoutException if nothing arrived within the read timeout; the transport
     *                              stays usable
     * @throws org.smppclient.exception.FramingException if the prefix is garbled or the stream
     *                              ends mid-frame; the transport must be discarded
     */
    byte[] readFrame() throws SmppTimeoutException, SmppChannelException;

    /**
     * Writes one complete frame as a single operation. Concurrent writers never interleave.
     */
    void writeFrame(byte[] frame) throws SmppChannelException;

    boolean isOpen();

    /**
     * Closes the connection. A blocked {@link #readFrame()} returns end-of-stream or fails.
     */
    @Override
    void close();
}
