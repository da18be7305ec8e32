package org.smppclient.transport;

import com.cloudhopper.smpp.type.SmppChannelException;
import com.cloudhopper.smpp.type.SmppTimeoutException;
import org.smppclient.exception.FramingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;

/**
 * Frame transport over a blocking stream pair. Read timeouts surface as
 * {@link SocketTimeoutException} from the input stream.
 */
public class StreamFrameTransport implements FrameTransport {
    private static final Logger logger = LoggerFactory.getLogger(StreamFrameTransport.class);

    private final InputStream in;
    private final OutputStream out;
    private final int maxFrameLength;
    private final Object writeLock = new Object();
    private volatile boolean open = true;

    public StreamFrameTransport(InputStream in, OutputStream out, int maxFrameLength) {
        this.in = in;
        this.out = out;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public byte[] readFrame() throws SmppTimeoutException, SmppChannelException {
        byte[] prefix = new byte[Frames.PREFIX_LENGTH];
        int read = readPrefix(prefix);
        if (read == 0)
            return null;
        if (read < Frames.PREFIX_LENGTH)
            throw new FramingException("Stream closed after " + read + " bytes of length prefix");

        int length = Frames.lengthOf(prefix);
        if (length < Frames.PREFIX_LENGTH || length > maxFrameLength)
            throw new FramingException("Invalid frame length " + length + " (max " + maxFrameLength + ")");

        byte[] frame = new byte[length];
        System.arraycopy(prefix, 0, frame, 0, Frames.PREFIX_LENGTH);
        int offset = Frames.PREFIX_LENGTH;
        while (offset < length) {
            int n = readBlocking(frame, offset, length - offset);
            if (n < 0)
                throw new FramingException("Stream closed after " + offset + " of " + length + " frame bytes");
            offset += n;
        }
        return frame;
    }

    // only an idle wait before the first byte counts as a timeout
    private int readPrefix(byte[] prefix) throws SmppTimeoutException, SmppChannelException {
        int n;
        try {
            n = in.read(prefix, 0, prefix.length);
        } catch (SocketTimeoutException e) {
            throw new SmppTimeoutException("No data within read timeout");
        } catch (IOException e) {
            return handleReadFailure(e);
        }
        if (n < 0)
            return 0;

        int offset = n;
        while (offset < prefix.length) {
            int more = readBlocking(prefix, offset, prefix.length - offset);
            if (more < 0)
                break;
            offset += more;
        }
        return offset;
    }

    private int readBlocking(byte[] buf, int offset, int len) throws SmppChannelException {
        while (true) {
            try {
                return in.read(buf, offset, len);
            } catch (SocketTimeoutException e) {
                logger.trace("Read timeout inside a frame, waiting for the rest");
            } catch (IOException e) {
                handleReadFailure(e);
                return -1;
            }
        }
    }

    private int handleReadFailure(IOException e) throws SmppChannelException {
        if (!open) {
            // closed locally while blocked in read
            return 0;
        }
        throw new SmppChannelException("Read failed: " + e.getMessage(), e);
    }

    @Override
    public void writeFrame(byte[] frame) throws SmppChannelException {
        Frames.checkConsistent(frame);
        synchronized (writeLock) {
            if (!open)
                throw new SmppChannelException("Transport is closed");
            try {
                out.write(frame);
                out.flush();
            } catch (IOException e) {
                throw new SmppChannelException("Write of " + frame.length + " bytes failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open)
            return;
        open = false;
        closeQuietly(in);
        closeQuietly(out);
    }

    private void closeQuietly(java.io.Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Error while closing stream", e);
        }
    }
}
