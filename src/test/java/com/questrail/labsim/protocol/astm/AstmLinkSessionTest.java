package com.questrail.labsim.protocol.astm;

import com.questrail.labsim.protocol.astm.codec.AstmControlCharacters;
import com.questrail.labsim.protocol.astm.internal.exec.AstmTimingPolicy;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;
import com.questrail.labsim.protocol.astm.model.AstmMessage;
import com.questrail.labsim.protocol.astm.observability.AstmProtocolEvent;
import com.questrail.labsim.protocol.astm.observability.AstmTransportEvent;
import com.questrail.labsim.protocol.astm.observability.RecordingObservabilitySink;
import com.questrail.labsim.protocol.astm.transport.PipedLinkConnection;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.questrail.labsim.protocol.astm.codec.AstmControlCharacters.ACK;
import static com.questrail.labsim.protocol.astm.codec.AstmControlCharacters.ENQ;
import static com.questrail.labsim.protocol.astm.codec.AstmControlCharacters.EOT;
import static com.questrail.labsim.protocol.astm.codec.AstmControlCharacters.NAK;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AstmLinkSessionTest
 * -----------------------------------------------------------------------------
 * Drives a real {@link AstmLinkSession} over an in-memory connection with a
 * {@link ScriptedPeer} playing the bridge. Covers the receiver path, the
 * field-query reverse push and the initiator path including contention,
 * retransmission, receiver interrupt and every timeout.
 */
final class AstmLinkSessionTest
{
    private static final String HEADER = "H|\\^&|||A^B^1.0|||||||LIS2-A2";
    private static final String TERMINATOR = "L|1|N";

    /** Short deadlines so timeout paths finish quickly. */
    private static final AstmTimingPolicy FAST = new AstmTimingPolicy(
            Duration.ofMillis(300),
            Duration.ofMillis(300),
            Duration.ofMillis(300),
            Duration.ofMillis(500),
            Duration.ofMillis(100),
            Duration.ZERO,
            3);

    private ExecutorService executor;
    private RecordingObservabilitySink observability;
    private LinkedBlockingQueue<AstmMessage> received;
    private PipedLinkConnection.Pair pipe;
    private ScriptedPeer peer;

    @BeforeEach
    void setUp()
    {
        executor = Executors.newSingleThreadExecutor();
        observability = new RecordingObservabilitySink();
        received = new LinkedBlockingQueue<>();
        pipe = PipedLinkConnection.pair();
        peer = new ScriptedPeer(pipe.peer());
    }

    @AfterEach
    void tearDown() throws InterruptedException
    {
        pipe.peer().close();
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    // ---------------------------------------------------------------------
    // Receiver path
    // ---------------------------------------------------------------------

    @Test
    void enqIsAcknowledged() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
    }

    @Test
    void validHeaderFrameIsAcknowledged() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendFrame(1, HEADER);
        peer.expect(ACK);
    }

    @Test
    void completeMessageIsDeliveredOnEot() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        List<String> records = List.of(
                HEADER,
                "P|1||PAT-001|DOE^JANE||F|19800101",
                "O|1|S-1^LAB|CBC||20250115080000",
                "R|1|^^^WBC|5.8|10^3/uL|4.5-11.0|N||F|20250115080100",
                TERMINATOR);

        peer.send(ENQ);
        peer.expect(ACK);
        int n = 0;
        for (String record : records) {
            n = n % 7 + 1;
            peer.sendFrame(n, record);
            peer.expect(ACK);
        }
        peer.send(EOT);

        AstmMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals(records, message.recordTexts());
        assertFalse(message.isFieldQuery());
        observability.awaitOutcome(ExchangeOutcome.COMPLETED, 2000);

        // Not a query, so nothing is sent back.
        peer.expectSilence(Duration.ofMillis(200));
    }

    @Test
    void frameNumbersWrapFromSevenToOne() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        List<String> sent = new ArrayList<>();
        int n = 0;
        for (int i = 0; i < 9; i++) {
            n = n % 7 + 1;
            String record = "R|" + (i + 1) + "|^^^T" + i + "|" + i;
            sent.add(record);
            peer.sendFrame(n, record);
            peer.expect(ACK);
        }
        peer.send(EOT);

        AstmMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals(sent, message.recordTexts());
    }

    @Test
    void badChecksumIsNakedAndSixthFailureAbortsSession() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        for (int attempt = 1; attempt <= 6; attempt++) {
            peer.sendFrameWithBadChecksum(1, HEADER);
            peer.expect(NAK);
        }
        peer.expect(EOT);
        peer.expectClosed();

        observability.awaitOutcome(ExchangeOutcome.RETRANSMISSION_LIMIT_EXCEEDED, 2000);
        assertEquals(6, observability.getProtocolEvents(AstmProtocolEvent.Kind.FRAME_REJECTED).size());
    }

    @Test
    void fiveFailuresLeaveTheTransferOpen() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        for (int attempt = 1; attempt <= 5; attempt++) {
            peer.sendFrameWithBadChecksum(1, HEADER);
            peer.expect(NAK);
        }
        peer.sendFrame(1, "P|1");
        peer.expect(ACK);

        // The good frame reset the count: five more failures are still tolerated.
        for (int attempt = 1; attempt <= 5; attempt++) {
            peer.sendFrameWithBadChecksum(2, TERMINATOR);
            peer.expect(NAK);
        }
        peer.sendFrame(2, TERMINATOR);
        peer.expect(ACK);
        peer.send(EOT);

        AstmMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals(List.of("P|1", TERMINATOR), message.recordTexts());
    }

    @Test
    void retransmittedFrameIsAcknowledgedButNotAppended() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendFrame(1, "P|1");
        peer.expect(ACK);
        peer.sendFrame(1, "P|1");
        peer.expect(ACK);
        peer.sendFrame(2, TERMINATOR);
        peer.expect(ACK);
        peer.send(EOT);

        AstmMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals(List.of("P|1", TERMINATOR), message.recordTexts());
        assertEquals(1, observability.getProtocolEvents(AstmProtocolEvent.Kind.FRAME_DUPLICATE).size());
    }

    @Test
    void outOfSequenceFrameIsNaked() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendFrame(1, "P|1");
        peer.expect(ACK);
        peer.sendFrame(3, "O|1");
        peer.expect(NAK);
        peer.sendFrame(2, "O|1");
        peer.expect(ACK);
    }

    @Test
    void intermediateFramesAreJoinedIntoOneRecord() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendIntermediateFrame(1, "R|1|^^^WBC|");
        peer.expect(ACK);
        peer.sendFrame(2, "5.8|10^3/uL");
        peer.expect(ACK);
        peer.sendFrame(3, TERMINATOR);
        peer.expect(ACK);
        peer.send(EOT);

        AstmMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals(List.of("R|1|^^^WBC|5.8|10^3/uL", TERMINATOR), message.recordTexts());
    }

    @Test
    void busySimulatorRefusesEstablishment() throws Exception
    {
        start(sessionBuilder(AstmTimingPolicy.defaults()).withAcceptsInbound(false).build());

        peer.send(ENQ);
        peer.expect(NAK);
        peer.send(ENQ);
        peer.expect(NAK);
    }

    @Test
    void receiverTimeoutDiscardsPartialMessage() throws Exception
    {
        start(session(FAST));

        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendFrame(1, "P|1|stale");
        peer.expect(ACK);

        observability.awaitOutcome(ExchangeOutcome.RECEIVER_TIMEOUT, 2000);

        // A new transfer starts from scratch.
        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendFrame(1, "P|1|fresh");
        peer.expect(ACK);
        peer.send(EOT);

        AstmMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals(List.of("P|1|fresh"), message.recordTexts());
    }

    @Test
    void idleConnectionIsClosedAfterIdleTimeout() throws Exception
    {
        start(session(FAST));

        peer.expectClosed();
        assertEquals(1, observability.getTransportEvents(AstmTransportEvent.Kind.IDLE_TIMEOUT).size());
    }

    @Test
    void strayBytesWhileIdleAreIgnored() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send((byte) 'x', AstmControlCharacters.ACK, AstmControlCharacters.EOT);
        peer.send(ENQ);
        peer.expect(ACK);
        assertFalse(observability.getProtocolEvents(AstmProtocolEvent.Kind.STRAY_INPUT).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Field query
    // ---------------------------------------------------------------------

    @Test
    void fieldQueryIsAnsweredWithFieldList() throws Exception
    {
        start(session(AstmTimingPolicy.defaults()));

        peer.send(ENQ);
        peer.expect(ACK);
        peer.sendFrame(1, HEADER);
        peer.expect(ACK);
        peer.sendFrame(2, TERMINATOR);
        peer.expect(ACK);
        peer.send(EOT);

        List<String> answer = peer.receiveMessage();
        assertEquals(StubGenerator.FIELD_LIST.recordTexts(), answer);

        AstmMessage query = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(query);
        assertTrue(query.isFieldQuery());
        observability.awaitOutcome(ExchangeOutcome.COMPLETED, 2000);
        assertEquals(1, observability.getProtocolEvents(AstmProtocolEvent.Kind.FIELD_QUERY_DETECTED).size());
    }

    // ---------------------------------------------------------------------
    // Initiator path
    // ---------------------------------------------------------------------

    @Test
    void proactiveMessageIsSentOnConnect() throws Exception
    {
        start(proactiveSession(AstmTimingPolicy.defaults()));

        assertEquals(StubGenerator.RESULT.recordTexts(), peer.receiveMessage());
        observability.awaitOutcome(ExchangeOutcome.COMPLETED, 2000);

        // Back to receiver afterwards.
        peer.send(ENQ);
        peer.expect(ACK);
    }

    @Test
    void contentionHoldsPriorityAndResendsEnqAfterBackoff() throws Exception
    {
        AstmTimingPolicy policy = AstmTimingPolicy.defaults();
        start(proactiveSession(policy));

        peer.expect(ENQ);
        long sentAt = System.nanoTime();
        peer.send(ENQ);

        // Instrument priority: no ACK for our ENQ, only a second ENQ after the backoff.
        peer.expect(ENQ);
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - sentAt);
        assertTrue(waitedMillis >= 1000, "resent ENQ after only " + waitedMillis + " ms");

        peer.send(ACK);
        List<String> records = new ArrayList<>();
        for (int i = 0; i < StubGenerator.RESULT.size(); i++) {
            AstmFrame frame = peer.readFrame();
            assertEquals(i % 7 + 1, frame.frameNumber());
            records.add(frame.text());
            peer.send(ACK);
        }
        peer.expect(EOT);

        assertEquals(StubGenerator.RESULT.recordTexts(), records);
        observability.awaitOutcome(ExchangeOutcome.COMPLETED, 2000);
        assertEquals(1, observability.getProtocolEvents(AstmProtocolEvent.Kind.CONTENTION).size());
    }

    @Test
    void contentionBeyondRetryLimitAbandonsTransmission() throws Exception
    {
        AstmTimingPolicy policy = FAST.withMaxContentionRetries(1);
        start(proactiveSession(policy));

        peer.expect(ENQ);
        peer.send(ENQ);
        peer.expect(ENQ);
        peer.send(ENQ);

        observability.awaitOutcome(ExchangeOutcome.CONTENTION_UNRESOLVED, 2000);
    }

    @Test
    void nakedFrameIsRetransmittedUnchanged() throws Exception
    {
        start(proactiveSession(AstmTimingPolicy.defaults()));

        peer.expect(ENQ);
        peer.send(ACK);
        AstmFrame first = peer.readFrame();
        peer.send(NAK);
        AstmFrame again = peer.readFrame();
        assertEquals(first, again);
        peer.send(ACK);

        for (int i = 1; i < StubGenerator.RESULT.size(); i++) {
            peer.readFrame();
            peer.send(ACK);
        }
        peer.expect(EOT);
        observability.awaitOutcome(ExchangeOutcome.COMPLETED, 2000);
    }

    @Test
    void sixthNakOnOneFrameAbortsSession() throws Exception
    {
        start(proactiveSession(AstmTimingPolicy.defaults()));

        peer.expect(ENQ);
        peer.send(ACK);
        for (int attempt = 1; attempt <= 6; attempt++) {
            AstmFrame frame = peer.readFrame();
            assertEquals(1, frame.frameNumber());
            peer.send(NAK);
        }
        peer.expect(EOT);
        peer.expectClosed();
        observability.awaitOutcome(ExchangeOutcome.RETRANSMISSION_LIMIT_EXCEEDED, 2000);
    }

    @Test
    void eotInPlaceOfAckIsReceiverInterrupt() throws Exception
    {
        start(proactiveSession(AstmTimingPolicy.defaults()));

        peer.expect(ENQ);
        peer.send(ACK);
        peer.readFrame();
        peer.send(EOT);
        peer.expect(EOT);
        observability.awaitOutcome(ExchangeOutcome.RECEIVER_INTERRUPT, 2000);

        // The session survives and can receive.
        peer.send(ENQ);
        peer.expect(ACK);
    }

    @Test
    void nakToEnqRefusesEstablishment() throws Exception
    {
        start(proactiveSession(AstmTimingPolicy.defaults()));

        peer.expect(ENQ);
        peer.send(NAK);
        observability.awaitOutcome(ExchangeOutcome.ESTABLISHMENT_REFUSED, 2000);

        peer.send(ENQ);
        peer.expect(ACK);
    }

    @Test
    void unansweredEnqTimesOut() throws Exception
    {
        start(proactiveSession(FAST));

        peer.expect(ENQ);
        peer.expect(EOT);
        observability.awaitOutcome(ExchangeOutcome.ESTABLISHMENT_TIMEOUT, 2000);
    }

    @Test
    void unacknowledgedFrameTimesOut() throws Exception
    {
        start(proactiveSession(FAST));

        peer.expect(ENQ);
        peer.send(ACK);
        peer.readFrame();
        peer.expect(EOT);
        observability.awaitOutcome(ExchangeOutcome.FRAME_ACK_TIMEOUT, 2000);
    }

    @Test
    void responseDelayPrecedesEveryTransmission() throws Exception
    {
        start(session(AstmTimingPolicy.defaults().withResponseDelay(Duration.ofMillis(150))));

        long start = System.nanoTime();
        peer.send(ENQ);
        peer.expect(ACK);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMillis >= 150, "ACK after only " + elapsedMillis + " ms");
    }

    @Test
    void transmitRejectsConcurrentUseOutsideIdle() throws Exception
    {
        AstmLinkSession session = session(AstmTimingPolicy.defaults());
        start(session);

        peer.send(ENQ);
        peer.expect(ACK);

        assertThrows(IllegalStateException.class, () -> session.transmit(StubGenerator.RESULT));
    }

    @Test
    void restrictedContentIsRejectedBeforeEnq() throws Exception
    {
        AstmMessage bad = AstmMessage.fromRecordTexts(List.of(
                HEADER, "R|1|^^^X|bad\u0016value", TERMINATOR));
        start(sessionBuilder(FAST).withProactiveMessage(() -> bad).build());

        observability.awaitOutcome(ExchangeOutcome.CONTENT_REJECTED, 2000);
        peer.expectSilence(Duration.ofMillis(100));
        assertEquals(1, observability.getProtocolEvents(AstmProtocolEvent.Kind.CONTENT_REJECTED).size());

        // Nothing was started, so the link is idle and accepts a transfer.
        peer.send(ENQ);
        peer.expect(ACK);
    }

    // ---------------------------------------------------------------------
    // Framing of outbound records
    // ---------------------------------------------------------------------

    @Test
    void longRecordsAreSplitIntoIntermediateFrames()
    {
        String longRecord = "R|1|" + String.join("", Collections.nCopies(496, "x"));
        List<AstmFrame> frames = AstmLinkSession.toFrames(AstmMessage.fromRecordTexts(List.of(longRecord, TERMINATOR)));

        assertEquals(4, frames.size());
        assertEquals(List.of(1, 2, 3, 4), frames.stream().map(AstmFrame::frameNumber).collect(Collectors.toList()));
        assertTrue(frames.get(0).intermediate());
        assertTrue(frames.get(1).intermediate());
        assertFalse(frames.get(2).intermediate());
        assertEquals(AstmLinkSession.MAX_FRAME_TEXT, frames.get(0).text().length());
        assertEquals(longRecord, frames.get(0).text() + frames.get(1).text() + frames.get(2).text());
        assertEquals(TERMINATOR, frames.get(3).text());
    }

    @Test
    void splitNeverSeparatesASurrogatePair()
    {
        String clef = new String(Character.toChars(0x1D11E));
        String record = "C|1|" + "x".repeat(AstmLinkSession.MAX_FRAME_TEXT - 5) + clef + "y";
        List<AstmFrame> frames = AstmLinkSession.toFrames(AstmMessage.fromRecordTexts(List.of(record)));

        assertEquals(2, frames.size());
        assertEquals(AstmLinkSession.MAX_FRAME_TEXT - 1, frames.get(0).text().length());
        assertTrue(frames.get(1).text().startsWith(clef));
        assertEquals(record, frames.get(0).text() + frames.get(1).text());
    }

    @Test
    void outboundFrameNumbersCycleThroughSeven()
    {
        List<String> records = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            records.add("R|" + i);
        }
        List<AstmFrame> frames = AstmLinkSession.toFrames(AstmMessage.fromRecordTexts(records));

        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 1, 2),
                frames.stream().map(AstmFrame::frameNumber).collect(Collectors.toList()));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private AstmLinkSession.Builder sessionBuilder(AstmTimingPolicy policy)
    {
        return AstmLinkSession.builder()
                .withSessionId("test")
                .withConnection(pipe.simulator())
                .withTimingPolicy(policy)
                .withMessageGenerator(new StubGenerator(), "stub")
                .withMessageSink((id, message) -> received.add(message))
                .withObservabilitySink(observability);
    }

    private AstmLinkSession session(AstmTimingPolicy policy)
    {
        return sessionBuilder(policy).build();
    }

    private AstmLinkSession proactiveSession(AstmTimingPolicy policy)
    {
        return sessionBuilder(policy).withProactiveMessage(() -> StubGenerator.RESULT).build();
    }

    private void start(AstmLinkSession session)
    {
        executor.execute(session);
    }

    /**
     * Fixed content, so the tests exercise the link and nothing else.
     */
    static final class StubGenerator implements MessageGenerator
    {
        static final AstmMessage RESULT = AstmMessage.fromRecordTexts(List.of(
                "H|\\^&|||Stub^Analyzer^V1.0|||||||LIS2-A2|20250115080000",
                "P|1||PAT-TEST-001|TEST^PATIENT||M|19900101",
                "O|1|SAMPLE-001^LAB|CBC||20250115080000",
                "R|1|^^^WBC|5.8|10^3/uL|4.5-11.0|N||F|20250115080000",
                TERMINATOR));

        static final AstmMessage FIELD_LIST = AstmMessage.fromRecordTexts(List.of(
                "H|\\^&|||Stub^Analyzer^V1.0|||||||LIS2-A2",
                "R|1|^^^WBC^White Blood Cell Count||10^3/uL|||NUMERIC",
                "R|2|^^^RBC^Red Blood Cell Count||10^6/uL|||NUMERIC",
                TERMINATOR));

        @Override
        public AstmMessage generate(String templateId, Long seed)
        {
            return RESULT;
        }

        @Override
        public AstmMessage fieldQueryResponse(String templateId)
        {
            return FIELD_LIST;
        }
    }
}
