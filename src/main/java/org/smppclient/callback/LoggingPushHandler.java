package org.smppclient.callback;

import com.cloudhopper.smpp.pdu.Pdu;
import org.smppclient.SmppClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default push handler; replace it with {@link SmppClientSession#setPushHandler(PushHandler)}.
 */
public class LoggingPushHandler implements PushHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingPushHandler.class);

    @Override
    public void onPush(Pdu pdu, SmppClientSession session) {
        LOGGER.info("Message received handler (should be overridden): " + pdu);
    }
}
