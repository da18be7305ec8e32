package org.smppclient.transport;

import com.cloudhopper.smpp.type.SmppChannelConnectException;

/**
 * Opens the connection a session runs over.
 */
public interface TransportConnector {

    FrameTransport connect(String host, int port, long connectTimeoutMillis, long readTimeoutMillis,
            int maxFrameLength) throws SmppChannelConnectException;
}
