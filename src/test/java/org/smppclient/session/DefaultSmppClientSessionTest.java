package org.smppclient.session;

import com.cloudhopper.smpp.SmppBindType;
import com.cloudhopper.smpp.SmppConstants;
import com.cloudhopper.smpp.pdu.BindReceiverResp;
import com.cloudhopper.smpp.pdu.BindTransceiver;
import com.cloudhopper.smpp.pdu.BindTransmitter;
import com.cloudhopper.smpp.pdu.BindTransmitterResp;
import com.cloudhopper.smpp.pdu.DataSm;
import com.cloudhopper.smpp.pdu.DataSmResp;
import com.cloudhopper.smpp.pdu.DeliverSmResp;
import com.cloudhopper.smpp.pdu.EnquireLink;
import com.cloudhopper.smpp.pdu.EnquireLinkResp;
import com.cloudhopper.smpp.pdu.GenericNack;
import com.cloudhopper.smpp.pdu.Pdu;
import com.cloudhopper.smpp.pdu.PduResponse;
import com.cloudhopper.smpp.pdu.SubmitSm;
import com.cloudhopper.smpp.pdu.SubmitSmResp;
import com.cloudhopper.smpp.pdu.Unbind;
import com.cloudhopper.smpp.pdu.UnbindResp;
import com.cloudhopper.smpp.type.Address;
import com.cloudhopper.smpp.type.RecoverablePduException;
import com.cloudhopper.smpp.type.SmppChannelException;
import com.cloudhopper.smpp.type.SmppTimeoutException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.smppclient.FakePeerTransport;
import org.smppclient.SmppClientSessionConfiguration;
import org.smppclient.events.SessionStateChangedEvent;
import org.smppclient.events.UnexpectedPduResponseReceivedEvent;
import org.smppclient.events.handler.DefaultEventHandler;
import org.smppclient.events.support.EventDispatcherImpl;
import org.smppclient.exception.InvalidSessionStateException;
import org.smppclient.exception.ProtocolErrorException;
import org.smppclient.exception.SessionUsageException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.Assert.*;
import static org.smppclient.SessionTestUtils.*;

public class DefaultSmppClientSessionTest {

    private FakePeerTransport peer;
    private ExecutorService executor;

    @Before
    public void before() {
        peer = new FakePeerTransport();
        executor = Executors.newFixedThreadPool(2);
    }

    @After
    public void after() {
        executor.shutdownNow();
    }

    private static List<Supplier<Pdu>> samplePdus() {
        List<Supplier<Pdu>> ret = new ArrayList<>();
        ret.add(BindTransmitter::new);
        ret.add(Unbind::new);
        ret.add(UnbindResp::new);
        ret.add(() -> createSubmitSm("sample"));
        ret.add(SubmitSmResp::new);
        ret.add(DeliverSmResp::new);
        ret.add(EnquireLink::new);
        ret.add(EnquireLinkResp::new);
        ret.add(() -> {
            DataSm dataSm = new DataSm();
            dataSm.setSourceAddress(new Address((byte) 0x01, (byte) 0x01, "12345"));
            dataSm.setDestAddress(new Address((byte) 0x01, (byte) 0x01, "67890"));
            return dataSm;
        });
        ret.add(DataSmResp::new);
        ret.add(GenericNack::new);
        return ret;
    }

    @Test
    public void testSendSucceedsExactlyWhenAllowed() throws Exception {
        for (SessionState state : SessionState.values()) {
            for (Supplier<Pdu> supplier : samplePdus()) {
                FakePeerTransport statePeer = new FakePeerTransport();
                DefaultSmppClientSession session = sessionIn(state, statePeer);
                assertEquals(state, session.getState());

                Pdu pdu = supplier.get();
                Command command = Command.forPdu(pdu);
                int writesBefore = statePeer.getWriteCalls();
                boolean allowed = CommandStateMatrix.isAllowed(command, state);
                try {
                    session.send(pdu);
                    assertTrue(command + " sent in " + state, allowed);
                    assertEquals(writesBefore + 1, statePeer.getWriteCalls());
                } catch (InvalidSessionStateException e) {
                    assertFalse(command + " rejected in " + state, allowed);
                    assertEquals(command, e.getCommand());
                    assertEquals(state, e.getState());
                    assertEquals(writesBefore, statePeer.getWriteCalls());
                }
            }
        }
    }

    @Test
    public void testSubmitWhileOpenIsRejected() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.OPEN, peer);
        try {
            session.submit(createSubmitSm("hello"));
            fail("submit_sm must not be allowed before bind");
        } catch (InvalidSessionStateException e) {
            assertEquals(Command.SUBMIT_SM, e.getCommand());
            assertTrue(e.getMessage().contains("submit_sm"));
        }
        assertEquals(0, peer.getWriteCalls());
        assertEquals(SessionState.OPEN, session.getState());
        assertEquals(0, session.getResponseWindow().getSize());
    }

    @Test
    public void testConnectOpensOnce() throws Exception {
        DefaultSmppClientSession session = createSession(peer);
        assertEquals(SessionState.CLOSED, session.getState());
        session.connect();
        assertEquals(SessionState.OPEN, session.getState());

        session.disconnect();
        assertEquals(SessionState.CLOSED, session.getState());
        try {
            session.connect();
            fail("second connect must fail");
        } catch (SessionUsageException e) {
            // expected
        }
    }

    @Test
    public void testBindTransceiver() throws Exception {
        List<SessionStateChangedEvent> changes = new CopyOnWriteArrayList<>();
        DefaultSmppClientSession session = createSession(peer);
        session.getEventDispatcher().addHandler(SessionStateChangedEvent.class,
                (DefaultEventHandler<SessionStateChangedEvent>) (event, s) -> changes.add(event));
        session.connect();
        peer.setResponder(FakePeerTransport.acceptAll());

        assertNotNull(session.bind(SmppBindType.TRANSCEIVER));

        assertEquals(SessionState.BOUND_TRANSCEIVER, session.getState());
        assertTrue(session.isReceiverCapable());
        List<BindTransceiver> binds = peer.getWritten(BindTransceiver.class);
        assertEquals(1, binds.size());
        assertEquals("sysId", binds.get(0).getSystemId());
        assertEquals("pass", binds.get(0).getPassword());

        assertEquals(2, changes.size());
        assertEquals(SessionState.CLOSED, changes.get(0).getPrevious());
        assertEquals(SessionState.OPEN, changes.get(1).getPrevious());
        assertEquals(SessionState.BOUND_TRANSCEIVER, changes.get(1).getCurrent());
    }

    @Test
    public void testBindTransmitterIsNotReceiverCapable() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer);
        assertFalse(session.isReceiverCapable());
        try {
            session.listen();
            fail("listen must be refused for a transmitter bind");
        } catch (SessionUsageException e) {
            assertFalse(session.isListening());
        }
    }

    @Test
    public void testBindRejectedKeepsStateOpen() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.OPEN, peer);
        peer.setResponder(request -> {
            PduResponse response = request.createResponse();
            response.setCommandStatus(SmppConstants.STATUS_BINDFAIL);
            return response;
        });

        try {
            session.bind(SmppBindType.TRANSMITTER);
            fail("bind must fail on a non-zero status");
        } catch (ProtocolErrorException e) {
            assertEquals(Command.BIND_TRANSMITTER_RESP, e.getCommand());
            assertEquals(SmppConstants.STATUS_BINDFAIL, e.getCommandStatus());
            assertTrue(e.getMessage().contains("bind_transmitter_resp"));
            assertTrue(e.getMessage().contains(String.valueOf(SmppConstants.STATUS_BINDFAIL)));
        }
        assertEquals(SessionState.OPEN, session.getState());
        assertEquals(0, session.getResponseWindow().getSize());
    }

    @Test
    public void testSubmitErrorStatusKeepsState() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSCEIVER, peer);
        peer.setResponder(request -> {
            PduResponse response = request.createResponse();
            response.setCommandStatus(SmppConstants.STATUS_THROTTLED);
            return response;
        });

        try {
            session.submit(createSubmitSm("throttled"));
            fail("submit must fail on a non-zero status");
        } catch (ProtocolErrorException e) {
            assertEquals(Command.SUBMIT_SM_RESP, e.getCommand());
            assertEquals(SmppConstants.STATUS_THROTTLED, e.getCommandStatus());
            assertNotNull(e.getStatusDescription());
        }
        assertEquals(SessionState.BOUND_TRANSCEIVER, session.getState());

        // the session stays usable
        peer.setResponder(FakePeerTransport.acceptAll());
        assertNotNull(session.enquireLink());
    }

    @Test
    public void testSubmitReturnsMatchingResponse() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer);
        peer.setResponder(request -> {
            PduResponse response = request.createResponse();
            if (response instanceof SubmitSmResp)
                ((SubmitSmResp) response).setMessageId("msg-" + request.getSequenceNumber());
            return response;
        });

        SubmitSm submitSm = createSubmitSm("hello");
        SubmitSmResp resp = session.submit(submitSm);
        assertEquals(submitSm.getSequenceNumber(), resp.getSequenceNumber());
        assertEquals("msg-" + submitSm.getSequenceNumber(), resp.getMessageId());
        assertEquals(0, session.getResponseWindow().getSize());
    }

    @Test
    public void testUnbindReturnsToOpen() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_RECEIVER, peer);
        peer.setResponder(FakePeerTransport.acceptAll());
        assertNotNull(session.unbind());
        assertEquals(SessionState.OPEN, session.getState());
    }

    @Test
    public void testReceiveAppliesStateSetters() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer);

        UnbindResp unbindResp = new UnbindResp();
        unbindResp.setSequenceNumber(42);
        peer.push(unbindResp);
        assertTrue(session.receive() instanceof UnbindResp);
        assertEquals(SessionState.OPEN, session.getState());

        BindReceiverResp bindReceiverResp = new BindReceiverResp();
        bindReceiverResp.setSequenceNumber(43);
        peer.push(bindReceiverResp);
        session.receive();
        assertEquals(SessionState.BOUND_RECEIVER, session.getState());

        // not legal while bound, so no transition
        BindTransmitterResp bindTransmitterResp = new BindTransmitterResp();
        bindTransmitterResp.setSequenceNumber(44);
        peer.push(bindTransmitterResp);
        assertTrue(session.receive() instanceof BindTransmitterResp);
        assertEquals(SessionState.BOUND_RECEIVER, session.getState());
    }

    @Test
    public void testReceiveErrorStatus() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSCEIVER, peer);
        UnbindResp unbindResp = new UnbindResp();
        unbindResp.setSequenceNumber(9);
        unbindResp.setCommandStatus(SmppConstants.STATUS_SYSERR);
        peer.push(unbindResp);

        try {
            session.receive();
            fail("error status must raise");
        } catch (ProtocolErrorException e) {
            assertEquals(Command.UNBIND_RESP, e.getCommand());
            assertEquals(SmppConstants.STATUS_SYSERR, e.getCommandStatus());
            assertSame(e.getPdu(), session.getHistory().forSequence(9).get(0).getPdu());
        }
        assertEquals(SessionState.BOUND_TRANSCEIVER, session.getState());
    }

    @Test
    public void testReceiveTimesOutWhenIdle() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.OPEN, peer);
        try {
            session.receive();
            fail("idle read must time out");
        } catch (SmppTimeoutException e) {
            // expected
        }
        assertEquals(SessionState.OPEN, session.getState());
    }

    @Test
    public void testReceiveEndOfStream() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.OPEN, peer);
        peer.pushEndOfStream();
        assertNull(session.receive());
    }

    @Test
    public void testResponseTimeout() throws Exception {
        SmppClientSessionConfiguration configuration = createDefaultConfiguration(2775);
        configuration.setResponseTimeout(200);
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer, configuration);

        long start = System.currentTimeMillis();
        try {
            session.submit(createSubmitSm("nobody answers"));
            fail("submit must time out");
        } catch (SmppTimeoutException e) {
            assertTrue(e.getMessage().contains("submit_sm"));
        }
        assertTrue(System.currentTimeMillis() - start >= 200);
        assertEquals(0, session.getResponseWindow().getSize());
        assertEquals(SessionState.BOUND_TRANSMITTER, session.getState());
    }

    @Test
    public void testResponsesCorrelatedOutOfOrder() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSCEIVER, peer);
        List<PduResponse> unexpected = new CopyOnWriteArrayList<>();
        session.getEventDispatcher().addHandler(UnexpectedPduResponseReceivedEvent.class,
                (DefaultEventHandler<UnexpectedPduResponseReceivedEvent>) (event, s) -> unexpected.add(event.getPduResponse()));

        Future<SubmitSmResp> first = executor.submit(() -> session.submit(createSubmitSm("first")));
        awaitCondition(() -> peer.getWritten(SubmitSm.class).size() == 1, 2000);
        Future<SubmitSmResp> second = executor.submit(() -> session.submit(createSubmitSm("second")));
        awaitCondition(() -> peer.getWritten(SubmitSm.class).size() == 2, 2000);

        List<SubmitSm> submits = peer.getWritten(SubmitSm.class);
        EnquireLinkResp stray = new EnquireLinkResp();
        stray.setSequenceNumber(4242);
        peer.push(stray);
        peer.push(respond(submits.get(1), "B"));
        peer.push(respond(submits.get(0), "A"));

        assertEquals("A", first.get(2, TimeUnit.SECONDS).getMessageId());
        assertEquals("B", second.get(2, TimeUnit.SECONDS).getMessageId());
        assertEquals(1, unexpected.size());
        assertEquals(4242, unexpected.get(0).getSequenceNumber());
        assertEquals(0, session.getResponseWindow().getSize());
    }

    private static SubmitSmResp respond(SubmitSm submitSm, String messageId) {
        SubmitSmResp resp = submitSm.createResponse();
        resp.setMessageId(messageId);
        return resp;
    }

    @Test
    public void testDisconnectFailsWaitingCall() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer);
        Future<SubmitSmResp> waiting = executor.submit(() -> session.submit(createSubmitSm("lost")));
        awaitCondition(() -> peer.getWritten(SubmitSm.class).size() == 1, 2000);

        session.disconnect();

        try {
            waiting.get(2, TimeUnit.SECONDS);
            fail("waiting call must fail on disconnect");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof SmppChannelException);
        }
        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(0, session.getResponseWindow().getSize());
    }

    @Test
    public void testHistoryRecordsBothDirections() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSCEIVER, peer);
        peer.setResponder(FakePeerTransport.acceptAll());
        SubmitSm submitSm = createSubmitSm("logged");
        session.submit(submitSm);

        List<SessionHistory.Entry> entries = session.getHistory().entries();
        assertEquals(4, entries.size());
        assertEquals(Arrays.asList("bind_transceiver", "bind_transceiver_resp", "submit_sm", "submit_sm_resp"),
                names(entries));

        List<SessionHistory.Entry> forSubmit = session.getHistory().forSequence(submitSm.getSequenceNumber());
        assertEquals(2, forSubmit.size());
        assertEquals(SessionHistory.Direction.REQUEST, forSubmit.get(0).getDirection());
        assertEquals(SessionHistory.Direction.RESPONSE, forSubmit.get(1).getDirection());

        DefaultSmppClientSession other = sessionIn(SessionState.OPEN, new FakePeerTransport());
        assertEquals(0, other.getHistory().size());
    }

    private static List<String> names(List<SessionHistory.Entry> entries) {
        List<String> ret = new ArrayList<>();
        for (SessionHistory.Entry entry : entries) {
            ret.add(Command.forPdu(entry.getPdu()).getCommandName());
        }
        return ret;
    }

    @Test
    public void testSequenceNumbersIncrease() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSCEIVER, peer);
        peer.setResponder(FakePeerTransport.acceptAll());
        EnquireLinkResp first = session.enquireLink();
        EnquireLinkResp second = session.enquireLink();
        assertTrue(second.getSequenceNumber() > first.getSequenceNumber());
    }

    @Test
    public void testUndecodableResponseFailsWaiter() throws Exception {
        SmppClientSessionConfiguration configuration = createDefaultConfiguration(2775);
        configuration.setResponseTimeout(10000);
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer, configuration);
        Future<SubmitSmResp> waiting = executor.submit(() -> session.submit(createSubmitSm("cut short")));
        awaitCondition(() -> peer.getWritten(SubmitSm.class).size() == 1, 2000);
        int sequence = peer.getWritten(SubmitSm.class).get(0).getSequenceNumber();

        // message_id without its terminating NUL
        peer.pushRaw(rawFrame(Command.SUBMIT_SM_RESP.getId(), 0, sequence, "abc".getBytes(StandardCharsets.US_ASCII)));

        try {
            waiting.get(2, TimeUnit.SECONDS);
            fail("waiter must see the decode failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof RecoverablePduException);
        }
        assertEquals(0, session.getResponseWindow().getSize());
        assertEquals(SessionState.BOUND_TRANSMITTER, session.getState());
    }

    @Test
    public void testInterruptedWaiterLeavesWindow() throws Exception {
        DefaultSmppClientSession session = sessionIn(SessionState.BOUND_TRANSMITTER, peer);
        peer.blockReads();
        Future<Pdu> reader = executor.submit(() -> {
            try {
                return session.receive();
            } catch (SmppTimeoutException e) {
                return null;
            }
        });
        awaitCondition(() -> peer.getBlockedReaders() == 1, 2000);

        AtomicReference<Throwable> outcome = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                session.submit(createSubmitSm("interrupted"));
            } catch (Throwable t) {
                outcome.set(t);
            }
        });
        waiter.start();
        awaitCondition(() -> peer.getWritten(SubmitSm.class).size() == 1, 2000);
        assertEquals(1, session.getResponseWindow().getSize());

        waiter.interrupt();
        waiter.join(2000);

        assertTrue(String.valueOf(outcome.get()), outcome.get() instanceof InterruptedException);
        assertEquals(0, session.getResponseWindow().getSize());
        peer.releaseReads();
        reader.get(2, TimeUnit.SECONDS);
    }

    @Test
    public void testOwnedDispatcherDestroyedOnDisconnect() throws Exception {
        AtomicInteger ownedDestroyed = new AtomicInteger();
        DefaultSmppClientSession owner = new DefaultSmppClientSession(createDefaultConfiguration(2775), peer,
                new EventDispatcherImpl() {
                    @Override
                    public void destroy() {
                        ownedDestroyed.incrementAndGet();
                        super.destroy();
                    }
                }, true);
        owner.connect();
        owner.disconnect();
        assertEquals(1, ownedDestroyed.get());

        AtomicInteger sharedDestroyed = new AtomicInteger();
        DefaultSmppClientSession sharing = new DefaultSmppClientSession(createDefaultConfiguration(2775),
                new FakePeerTransport(), new EventDispatcherImpl() {
                    @Override
                    public void destroy() {
                        sharedDestroyed.incrementAndGet();
                        super.destroy();
                    }
                });
        sharing.connect();
        sharing.disconnect();
        assertEquals(0, sharedDestroyed.get());
    }
}
