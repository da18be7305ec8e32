package org.smppclient.transport;

import com.cloudhopper.smpp.type.SmppChannelConnectException;
import com.cloudhopper.smpp.type.SmppChannelConnectTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

public class SocketTransportConnector implements TransportConnector {
    private static final Logger logger = LoggerFactory.getLogger(SocketTransportConnector.class);

    @Override
    public FrameTransport connect(String host, int port, long connectTimeoutMillis, long readTimeoutMillis,
            int maxFrameLength) throws SmppChannelConnectException {
        logger.info("Connecting to {}:{}...", host, port);

        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeoutMillis);
            socket.setSoTimeout((int) readTimeoutMillis);
            return new SocketFrameTransport(socket, maxFrameLength);
        } catch (SocketTimeoutException e) {
            closeQuietly(socket);
            throw new SmppChannelConnectTimeoutException("Connect to " + host + ":" + port + " timed out after "
                    + connectTimeoutMillis + " ms", e);
        } catch (IOException e) {
            closeQuietly(socket);
            throw new SmppChannelConnectException("Connection refused: " + host + ":" + port, e);
        }
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error while closing unconnected socket", e);
        }
    }
}
