package org.smppclient.transport;

import org.smppclient.exception.FramingException;

import java.util.Arrays;

/**
 * Length prefix arithmetic shared by the transports.
 */
public final class Frames {

    public static final int PREFIX_LENGTH = 4;

    private Frames() {
    }

    public static int lengthOf(byte[] prefix) {
        return ((prefix[0] & 0xFF) << 24)
                | ((prefix[1] & 0xFF) << 16)
                | ((prefix[2] & 0xFF) << 8)
                | (prefix[3] & 0xFF);
    }

    public static byte[] wrap(byte[] body) {
        byte[] frame = new byte[PREFIX_LENGTH + body.length];
        int length = frame.length;
        frame[0] = (byte) (length >>> 24);
        frame[1] = (byte) (length >>> 16);
        frame[2] = (byte) (length >>> 8);
        frame[3] = (byte) length;
        System.arraycopy(body, 0, frame, PREFIX_LENGTH, body.length);
        return frame;
    }

    public static byte[] unwrap(byte[] frame) throws FramingException {
        checkConsistent(frame);
        return Arrays.copyOfRange(frame, PREFIX_LENGTH, frame.length);
    }

    public static void checkConsistent(byte[] frame) throws FramingException {
        if (frame.length < PREFIX_LENGTH)
            throw new FramingException("Frame of " + frame.length + " bytes has no complete length prefix");
        int declared = lengthOf(frame);
        if (declared != frame.length)
            throw new FramingException("Length prefix " + declared + " does not match frame length " + frame.length);
    }
}
