package org.smppclient.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Frame transport over a connected TCP socket. The socket's read timeout is the idle poll
 * interval of {@link #readFrame()}.
 */
public class SocketFrameTransport extends StreamFrameTransport {
    private static final Logger logger = LoggerFactory.getLogger(SocketFrameTransport.class);

    private final Socket socket;

    public SocketFrameTransport(Socket socket, int maxFrameLength) throws IOException {
        super(socket.getInputStream(), new BufferedOutputStream(socket.getOutputStream()), maxFrameLength);
        this.socket = socket;
    }

    public String getLocalAddressAndPort() {
        return format((InetSocketAddress) socket.getLocalSocketAddress());
    }

    public String getRemoteAddressAndPort() {
        return format((InetSocketAddress) socket.getRemoteSocketAddress());
    }

    private static String format(InetSocketAddress addr) {
        if (addr == null)
            return null;
        return addr.getAddress().getHostAddress() + ":" + addr.getPort();
    }

    @Override
    public boolean isOpen() {
        return super.isOpen() && !socket.isClosed();
    }

    @Override
    public void close() {
        super.close();
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error while closing socket to {}", getRemoteAddressAndPort(), e);
        }
    }

    @Override
    public String toString() {
        return "SocketFrameTransport[" + getLocalAddressAndPort() + " -> " + getRemoteAddressAndPort() + "]";
    }
}
