package org.smppclient.exception;

import com.cloudhopper.smpp.type.SmppChannelException;

/**
 * The byte stream no longer carries well formed frames (garbled length prefix, frame
 * cut short by the peer, undecodable header). The connection must be discarded.
 */
public class FramingException extends SmppChannelException {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
