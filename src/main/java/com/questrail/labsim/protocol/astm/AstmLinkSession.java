package com.questrail.labsim.protocol.astm;

import com.questrail.labsim.protocol.astm.codec.AstmControlCharacters;
import com.questrail.labsim.protocol.astm.codec.AstmFrameDecoder;
import com.questrail.labsim.protocol.astm.codec.AstmFrameEncoder;
import com.questrail.labsim.protocol.astm.codec.AstmFrameException;
import com.questrail.labsim.protocol.astm.codec.impl.DefaultAstmFrameDecoder;
import com.questrail.labsim.protocol.astm.codec.impl.DefaultAstmFrameEncoder;
import com.questrail.labsim.protocol.astm.internal.events.LinkControlEvent;
import com.questrail.labsim.protocol.astm.internal.events.LinkEvent;
import com.questrail.labsim.protocol.astm.internal.events.LinkFrameEvent;
import com.questrail.labsim.protocol.astm.internal.events.LinkTimeoutEvent;
import com.questrail.labsim.protocol.astm.internal.exec.AstmTimingPolicy;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;
import com.questrail.labsim.protocol.astm.internal.state.AstmReceiverReducer;
import com.questrail.labsim.protocol.astm.internal.state.AstmSessionState;
import com.questrail.labsim.protocol.astm.internal.state.FrameNumbering;
import com.questrail.labsim.protocol.astm.internal.state.FrameRejection;
import com.questrail.labsim.protocol.astm.internal.state.LinkIntents;
import com.questrail.labsim.protocol.astm.internal.state.SessionPhase;
import com.questrail.labsim.protocol.astm.internal.state.SessionRole;
import com.questrail.labsim.protocol.astm.internal.time.MonotonicClock;
import com.questrail.labsim.protocol.astm.internal.time.SystemMonotonicClock;
import com.questrail.labsim.protocol.astm.internal.time.SystemWallClock;
import com.questrail.labsim.protocol.astm.internal.time.WallClock;
import com.questrail.labsim.protocol.astm.model.AstmMessage;
import com.questrail.labsim.protocol.astm.observability.AstmErrorEvent;
import com.questrail.labsim.protocol.astm.observability.AstmExchangeEvent;
import com.questrail.labsim.protocol.astm.observability.AstmObservabilitySink;
import com.questrail.labsim.protocol.astm.observability.AstmPhaseTransitionEvent;
import com.questrail.labsim.protocol.astm.observability.AstmProtocolEvent;
import com.questrail.labsim.protocol.astm.observability.AstmTransportEvent;
import com.questrail.labsim.protocol.astm.observability.NullObservabilitySink;
import com.questrail.labsim.protocol.astm.transport.LinkConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * AstmLinkSession
 * =============================================================================
 * Drives one LIS1-A link session over one {@link LinkConnection}.
 *
 * <h2>Execution model</h2>
 * A session is a synchronous sequence of deadline-bounded reads on the thread
 * that calls {@link #run()} (inbound connections) or {@link #transmit(AstmMessage)}
 * (outbound push). Its {@link AstmSessionState} is owned by that thread alone.
 * Closing the connection ends every wait with end-of-stream, which is the only
 * cancellation signal.
 *
 * <h2>Receiver role</h2>
 * Bytes are turned into {@link LinkEvent}s and handed to the pure
 * {@link AstmReceiverReducer}; this class executes the resulting
 * {@link LinkIntents} (ACK, NAK, abort, delivery, query response).
 *
 * <h2>Initiator role</h2>
 * {@link #transmit(AstmMessage)} runs ENQ establishment (with contention
 * back-off), frame-by-frame transmission with retransmission on NAK, and EOT.
 * A field query received as Receiver is answered as Initiator on the same
 * connection and thread.
 *
 * <h2>Deadlines</h2>
 * Every wait is bounded by one of the {@link AstmTimingPolicy} durations. An
 * expired deadline ends the current exchange and returns the session to IDLE;
 * an IDLE connection that stays silent past the idle timeout is closed.
 */
public final class AstmLinkSession implements Runnable
{
    private static final Logger log = LoggerFactory.getLogger(AstmLinkSession.class);

    /** LIS1-A limit on text per frame; longer records use ETB frames. */
    static final int MAX_FRAME_TEXT = 240;

    /** A frame longer than this is not going to end well. */
    private static final int MAX_FRAME_BYTES = 64 * 1024;

    private final String sessionId;
    private final LinkConnection connection;
    private final AstmTimingPolicy timingPolicy;
    private final AstmReceiverReducer reducer;
    private final AstmFrameDecoder decoder;
    private final AstmFrameEncoder encoder;
    private final MessageGenerator messageGenerator;
    private final String templateId;
    private final ReceivedMessageSink messageSink;
    private final Supplier<AstmMessage> proactiveMessage;
    private final AstmObservabilitySink observability;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private volatile AstmSessionState state = AstmSessionState.idle();
    private volatile boolean terminated;
    private long receiveDeadlineNanos;

    private AstmLinkSession(Builder b)
    {
        this.sessionId = b.sessionId;
        this.connection = b.connection;
        this.timingPolicy = b.timingPolicy;
        this.reducer = new AstmReceiverReducer(b.acceptsInbound);
        this.decoder = new DefaultAstmFrameDecoder();
        this.encoder = new DefaultAstmFrameEncoder();
        this.messageGenerator = b.messageGenerator;
        this.templateId = b.templateId;
        this.messageSink = b.messageSink;
        this.proactiveMessage = b.proactiveMessage;
        this.observability = b.observability;
        this.clock = SystemMonotonicClock.INSTANCE;
        this.wallClock = b.wallClock;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Latest state snapshot, for observation from other threads.
     */
    public AstmSessionState currentState() {
        return state;
    }

    /**
     * True once the session has closed its connection for good.
     */
    public boolean isTerminated() {
        return terminated;
    }

    // ---------------------------------------------------------------------
    // Receiver loop
    // ---------------------------------------------------------------------

    /**
     * Serves the connection until the peer closes it, the session aborts or the
     * idle timeout expires. Transmits the proactive message first, if one is
     * configured. Always closes the connection on return.
     */
    @Override
    public void run()
    {
        observability.onTransportEvent(new AstmTransportEvent(
                now(), sessionId, AstmTransportEvent.Kind.CONNECTED, connection.remoteAddress()));
        try {
            if (proactiveMessage != null) {
                transmit(proactiveMessage.get());
            }
            receiveLoop();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Session interrupted", sessionId);
        }
        catch (IOException e) {
            log.debug("[{}] Transport failed: {}", sessionId, e.getMessage());
        }
        catch (RuntimeException e) {
            observability.onError(new AstmErrorEvent(now(), sessionId, "Session failed", e));
        }
        finally {
            terminated = true;
            connection.close();
            observability.onTransportEvent(new AstmTransportEvent(
                    now(), sessionId, AstmTransportEvent.Kind.DISCONNECTED, connection.remoteAddress()));
        }
    }

    private void receiveLoop() throws InterruptedException, IOException
    {
        while (!terminated) {
            final boolean idle = state.phase() == SessionPhase.IDLE;
            final int b = idle
                    ? connection.read(timingPolicy.idleTimeout())
                    : connection.read(remaining(receiveDeadlineNanos));

            if (b == LinkConnection.END_OF_STREAM) {
                if (!idle) {
                    report(SessionRole.RECEIVER, ExchangeOutcome.TRANSPORT_CLOSED, state.records().size());
                }
                return;
            }
            if (b == LinkConnection.TIMED_OUT) {
                if (idle) {
                    observability.onTransportEvent(new AstmTransportEvent(
                            now(), sessionId, AstmTransportEvent.Kind.IDLE_TIMEOUT, connection.remoteAddress()));
                    return;
                }
                dispatch(new LinkTimeoutEvent.ReceiverTimeout(now()));
                continue;
            }

            onByte((byte) b);
        }
    }

    private void onByte(byte b) throws InterruptedException, IOException
    {
        switch (b) {
            case AstmControlCharacters.ENQ:
                protocolEvent(AstmProtocolEvent.Kind.ENQ_RECEIVED, "ENQ in " + state.phase());
                dispatch(new LinkControlEvent.EnqReceived(now()));
                break;
            case AstmControlCharacters.EOT:
                if (state.phase() == SessionPhase.IDLE) {
                    protocolEvent(AstmProtocolEvent.Kind.STRAY_INPUT, "EOT outside a transfer");
                }
                dispatch(new LinkControlEvent.EotReceived(now()));
                break;
            case AstmControlCharacters.STX:
                if (state.phase() == SessionPhase.ESTABLISHED_RECEIVER) {
                    receiveFrame();
                } else {
                    protocolEvent(AstmProtocolEvent.Kind.STRAY_INPUT, "STX outside a transfer");
                }
                break;
            default:
                protocolEvent(AstmProtocolEvent.Kind.STRAY_INPUT, AstmControlCharacters.describe(b));
        }
    }

    /**
     * Collects bytes after STX through LF and feeds the decoded frame (or the
     * decode failure) to the reducer.
     */
    private void receiveFrame() throws InterruptedException, IOException
    {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(256);
        buf.write(AstmControlCharacters.STX);

        while (true) {
            int b = connection.read(remaining(receiveDeadlineNanos));
            if (b == LinkConnection.END_OF_STREAM) {
                report(SessionRole.RECEIVER, ExchangeOutcome.TRANSPORT_CLOSED, state.records().size());
                terminated = true;
                return;
            }
            if (b == LinkConnection.TIMED_OUT) {
                dispatch(new LinkTimeoutEvent.ReceiverTimeout(now()));
                return;
            }
            buf.write(b);
            if (b == AstmControlCharacters.LF) {
                break;
            }
            if (buf.size() > MAX_FRAME_BYTES) {
                reject(FrameRejection.MALFORMED_FRAME, "Frame exceeds " + MAX_FRAME_BYTES + " bytes");
                return;
            }
        }

        final byte[] bytes = buf.toByteArray();
        final AstmFrame frame;
        try {
            frame = decoder.decode(bytes);
        }
        catch (AstmFrameException e) {
            reject(FrameRejection.from(e.reason()), e.getMessage());
            return;
        }

        final int last = state.lastAcceptedFrameNumber().orElse(FrameNumbering.UNSET);
        switch (FrameNumbering.classify(last, frame.frameNumber())) {
            case NEW:
                protocolEvent(AstmProtocolEvent.Kind.FRAME_ACCEPTED, frame.toString());
                dispatch(new LinkFrameEvent.FrameReceived(now(), frame));
                break;
            case DUPLICATE:
                protocolEvent(AstmProtocolEvent.Kind.FRAME_DUPLICATE, "Frame " + frame.frameNumber() + " repeated");
                dispatch(new LinkFrameEvent.FrameReceived(now(), frame));
                break;
            default:
                reject(FrameRejection.FRAME_SEQUENCE_ERROR, String.format(
                        "Expected frame %d, got %d", FrameNumbering.next(last), frame.frameNumber()));
        }
    }

    private void reject(FrameRejection reason, String detail) throws InterruptedException, IOException
    {
        protocolEvent(AstmProtocolEvent.Kind.FRAME_REJECTED, reason + ": " + detail);
        dispatch(new LinkFrameEvent.FrameRejected(now(), reason, detail));
    }

    private void dispatch(LinkEvent event) throws InterruptedException, IOException
    {
        final AstmSessionState before = state;
        final AstmReceiverReducer.Result result = reducer.apply(before, event);
        transition(result.newState());

        if (state.phase() == SessionPhase.ESTABLISHED_RECEIVER) {
            receiveDeadlineNanos = clock.nowNanos() + timingPolicy.receiverTimeout().toNanos();
        }
        if (event instanceof LinkTimeoutEvent.ReceiverTimeout
                && before.phase() == SessionPhase.ESTABLISHED_RECEIVER) {
            report(SessionRole.RECEIVER, ExchangeOutcome.RECEIVER_TIMEOUT, before.records().size());
        }

        execute(result.intents());
    }

    private void execute(LinkIntents intents) throws InterruptedException, IOException
    {
        if (intents.isEmpty()) {
            return;
        }
        if (intents.contains(LinkIntents.Kind.SEND_NAK)) {
            send(AstmControlCharacters.NAK);
        }
        if (intents.contains(LinkIntents.Kind.SEND_ACK)) {
            send(AstmControlCharacters.ACK);
        }
        if (intents.contains(LinkIntents.Kind.ABORT_SESSION)) {
            abort();
            report(SessionRole.RECEIVER, ExchangeOutcome.RETRANSMISSION_LIMIT_EXCEEDED, state.records().size());
            return;
        }

        Optional<AstmMessage> message = intents.message();
        if (intents.contains(LinkIntents.Kind.DELIVER_MESSAGE) && message.isPresent()) {
            report(SessionRole.RECEIVER, ExchangeOutcome.COMPLETED, message.get().size());
            deliver(message.get());
        }
        if (intents.contains(LinkIntents.Kind.RESPOND_TO_QUERY)) {
            protocolEvent(AstmProtocolEvent.Kind.FIELD_QUERY_DETECTED, templateId);
            transmit(messageGenerator.fieldQueryResponse(templateId));
        }
    }

    private void deliver(AstmMessage message)
    {
        try {
            messageSink.onMessage(sessionId, message);
        }
        catch (RuntimeException e) {
            observability.onError(new AstmErrorEvent(now(), sessionId, "Received-message sink failed", e));
        }
    }

    // ---------------------------------------------------------------------
    // Initiator path
    // ---------------------------------------------------------------------

    /**
     * Sends one message as Initiator: ENQ, frames, EOT.
     *
     * <p>Every frame is encoded before ENQ goes out; a record the encoder
     * refuses yields {@link ExchangeOutcome#CONTENT_REJECTED} with nothing
     * written to the link.</p>
     *
     * <p>Must be called from the thread that owns the session, with the session
     * IDLE. Failures are reported as the returned outcome, never thrown; after
     * {@link ExchangeOutcome#RETRANSMISSION_LIMIT_EXCEEDED} or
     * {@link ExchangeOutcome#TRANSPORT_CLOSED} the session is terminated.</p>
     *
     * @throws IllegalStateException if a transfer is already in progress
     * @throws InterruptedException  if the thread is interrupted while waiting
     */
    public ExchangeOutcome transmit(AstmMessage message) throws InterruptedException
    {
        Objects.requireNonNull(message, "message");
        if (state.phase() != SessionPhase.IDLE) {
            throw new IllegalStateException("Cannot transmit while " + state.phase());
        }
        if (terminated) {
            return ExchangeOutcome.TRANSPORT_CLOSED;
        }

        final List<AstmFrame> frames = toFrames(message);
        final List<byte[]> encoded = new ArrayList<>(frames.size());
        try {
            for (AstmFrame frame : frames) {
                encoded.add(encoder.encode(frame));
            }
        }
        catch (IllegalArgumentException e) {
            protocolEvent(AstmProtocolEvent.Kind.CONTENT_REJECTED, e.getMessage());
            report(SessionRole.INITIATOR, ExchangeOutcome.CONTENT_REJECTED, message.size());
            return ExchangeOutcome.CONTENT_REJECTED;
        }

        ExchangeOutcome outcome;
        try {
            Optional<ExchangeOutcome> failure = establish();
            outcome = failure.isPresent() ? failure.get() : sendFrames(frames, encoded);
        }
        catch (IOException e) {
            log.debug("[{}] Transport failed during transmit: {}", sessionId, e.getMessage());
            terminated = true;
            outcome = ExchangeOutcome.TRANSPORT_CLOSED;
        }

        if (!terminated) {
            transition(state.reset());
        }
        report(SessionRole.INITIATOR, outcome, message.size());
        return outcome;
    }

    /**
     * ENQ handshake. Empty result means the peer answered ACK.
     */
    private Optional<ExchangeOutcome> establish() throws InterruptedException, IOException
    {
        int contentions = 0;
        while (true) {
            transition(state.beginTransfer(SessionPhase.AWAIT_ESTABLISH_RESPONSE, SessionRole.INITIATOR));
            send(AstmControlCharacters.ENQ);

            final int reply = awaitEstablishReply(clock.nowNanos() + timingPolicy.establishmentTimeout().toNanos());
            switch (reply) {
                case AstmControlCharacters.ACK:
                    transition(state.withPhase(SessionPhase.ESTABLISHED_SENDER));
                    return Optional.empty();

                case AstmControlCharacters.NAK:
                    return Optional.of(ExchangeOutcome.ESTABLISHMENT_REFUSED);

                case AstmControlCharacters.ENQ:
                    transition(state.withPhase(SessionPhase.CONTENTION));
                    if (contentions >= timingPolicy.maxContentionRetries()) {
                        return Optional.of(ExchangeOutcome.CONTENTION_UNRESOLVED);
                    }
                    contentions++;
                    protocolEvent(AstmProtocolEvent.Kind.CONTENTION, String.format(
                            "Peer sent ENQ; holding priority, retry %d of %d after %d ms",
                            contentions, timingPolicy.maxContentionRetries(),
                            timingPolicy.contentionBackoff().toMillis()));
                    if (!drainFor(timingPolicy.contentionBackoff())) {
                        terminated = true;
                        return Optional.of(ExchangeOutcome.TRANSPORT_CLOSED);
                    }
                    break;

                case LinkConnection.TIMED_OUT:
                    terminate();
                    return Optional.of(ExchangeOutcome.ESTABLISHMENT_TIMEOUT);

                default:
                    terminated = true;
                    return Optional.of(ExchangeOutcome.TRANSPORT_CLOSED);
            }
        }
    }

    /**
     * Waits for ACK, NAK or ENQ; anything else is noise and ignored.
     */
    private int awaitEstablishReply(long deadlineNanos) throws InterruptedException
    {
        while (true) {
            int b = connection.read(remaining(deadlineNanos));
            if (b == AstmControlCharacters.ACK
                    || b == AstmControlCharacters.NAK
                    || b == AstmControlCharacters.ENQ
                    || b == LinkConnection.TIMED_OUT
                    || b == LinkConnection.END_OF_STREAM) {
                return b;
            }
            protocolEvent(AstmProtocolEvent.Kind.STRAY_INPUT,
                    AstmControlCharacters.describe((byte) b) + " while awaiting ENQ reply");
        }
    }

    /**
     * Discards input for the full duration.
     *
     * @return false if the peer closed the connection meanwhile
     */
    private boolean drainFor(Duration duration) throws InterruptedException
    {
        final long deadline = clock.nowNanos() + duration.toNanos();
        while (clock.nowNanos() < deadline) {
            if (connection.read(remaining(deadline)) == LinkConnection.END_OF_STREAM) {
                return false;
            }
        }
        return true;
    }

    private ExchangeOutcome sendFrames(List<AstmFrame> frames, List<byte[]> encoded)
            throws InterruptedException, IOException
    {
        for (int f = 0; f < frames.size(); f++) {
            final AstmFrame frame = frames.get(f);
            final byte[] bytes = encoded.get(f);
            int failures = 0;

            while (true) {
                send(bytes);
                protocolEvent(AstmProtocolEvent.Kind.FRAME_SENT, frame.toString());

                final int reply = connection.read(timingPolicy.frameAckTimeout());
                if (reply == AstmControlCharacters.ACK) {
                    transition(state.withFrameAcknowledged(frame.frameNumber()));
                    break;
                }
                if (reply == AstmControlCharacters.EOT) {
                    protocolEvent(AstmProtocolEvent.Kind.RECEIVER_INTERRUPT,
                            "EOT in place of ACK for frame " + frame.frameNumber());
                    terminate();
                    return ExchangeOutcome.RECEIVER_INTERRUPT;
                }
                if (reply == LinkConnection.TIMED_OUT) {
                    terminate();
                    return ExchangeOutcome.FRAME_ACK_TIMEOUT;
                }
                if (reply == LinkConnection.END_OF_STREAM) {
                    terminated = true;
                    return ExchangeOutcome.TRANSPORT_CLOSED;
                }

                // NAK, or any other character, which LIS1-A treats as NAK.
                failures++;
                transition(state.withRetryCount(failures));
                protocolEvent(AstmProtocolEvent.Kind.FRAME_NAKED, String.format(
                        "Frame %d answered with %s (attempt %d)",
                        frame.frameNumber(), AstmControlCharacters.describe((byte) reply), failures));
                if (failures >= AstmReceiverReducer.RETRANSMISSION_LIMIT) {
                    abort();
                    return ExchangeOutcome.RETRANSMISSION_LIMIT_EXCEEDED;
                }
            }
        }

        transition(state.withPhase(SessionPhase.TERMINATING));
        send(AstmControlCharacters.EOT);
        return ExchangeOutcome.COMPLETED;
    }

    /**
     * Splits a message into frames: one record per frame, records longer than
     * {@value #MAX_FRAME_TEXT} characters continued over ETB frames. Numbers
     * start at 1 and cycle through 7.
     */
    static List<AstmFrame> toFrames(AstmMessage message)
    {
        List<AstmFrame> frames = new ArrayList<>();
        int number = FrameNumbering.UNSET;
        for (String text : message.recordTexts()) {
            int start = 0;
            do {
                int end = Math.min(text.length(), start + MAX_FRAME_TEXT);
                if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
                    end--;
                }
                number = FrameNumbering.next(number);
                frames.add(new AstmFrame(number, text.substring(start, end), end < text.length()));
                start = end;
            } while (start < text.length());
        }
        return frames;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * Ends a transfer with EOT and returns to IDLE.
     */
    private void terminate() throws InterruptedException
    {
        transition(state.withPhase(SessionPhase.TERMINATING));
        sendQuietly(AstmControlCharacters.EOT);
    }

    /**
     * Retransmission limit reached: EOT, close, done.
     */
    private void abort() throws InterruptedException
    {
        if (state.phase() != SessionPhase.ABORTED) {
            transition(state.withPhase(SessionPhase.ABORTED));
        }
        sendQuietly(AstmControlCharacters.EOT);
        terminated = true;
        connection.close();
    }

    private void send(byte... bytes) throws InterruptedException, IOException
    {
        Duration delay = timingPolicy.responseDelay();
        if (!delay.isZero()) {
            TimeUnit.NANOSECONDS.sleep(delay.toNanos());
        }
        connection.write(bytes);
    }

    private void sendQuietly(byte b) throws InterruptedException
    {
        if (!connection.isOpen()) {
            return;
        }
        try {
            send(b);
        }
        catch (IOException e) {
            log.debug("[{}] Could not send {}: {}", sessionId, AstmControlCharacters.describe(b), e.getMessage());
        }
    }

    private void transition(AstmSessionState next)
    {
        AstmSessionState previous = state;
        state = next;
        if (previous != next) {
            observability.onPhaseTransition(new AstmPhaseTransitionEvent(now(), sessionId, previous, next));
        }
    }

    private void protocolEvent(AstmProtocolEvent.Kind kind, String detail)
    {
        observability.onProtocolEvent(new AstmProtocolEvent(now(), sessionId, kind, detail));
    }

    private void report(SessionRole role, ExchangeOutcome outcome, int recordCount)
    {
        observability.onExchangeCompleted(new AstmExchangeEvent(now(), sessionId, role, outcome, recordCount));
    }

    private Duration remaining(long deadlineNanos)
    {
        return Duration.ofNanos(Math.max(0, deadlineNanos - clock.nowNanos()));
    }

    private Instant now()
    {
        return wallClock.now();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String sessionId;
        private LinkConnection connection;
        private AstmTimingPolicy timingPolicy = AstmTimingPolicy.defaults();
        private boolean acceptsInbound = true;
        private MessageGenerator messageGenerator;
        private String templateId;
        private ReceivedMessageSink messageSink = (id, message) -> {};
        private Supplier<AstmMessage> proactiveMessage;
        private AstmObservabilitySink observability = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        private Builder() {}

        public Builder withSessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder withConnection(LinkConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder withTimingPolicy(AstmTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        /**
         * When false, every inbound ENQ is answered with NAK.
         */
        public Builder withAcceptsInbound(boolean acceptsInbound) {
            this.acceptsInbound = acceptsInbound;
            return this;
        }

        public Builder withMessageGenerator(MessageGenerator generator, String templateId) {
            this.messageGenerator = generator;
            this.templateId = templateId;
            return this;
        }

        public Builder withMessageSink(ReceivedMessageSink sink) {
            this.messageSink = sink;
            return this;
        }

        /**
         * Message to transmit as Initiator as soon as {@link #run()} starts.
         */
        public Builder withProactiveMessage(Supplier<AstmMessage> message) {
            this.proactiveMessage = message;
            return this;
        }

        public Builder withObservabilitySink(AstmObservabilitySink sink) {
            this.observability = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public AstmLinkSession build() {
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(connection, "connection");
            Objects.requireNonNull(timingPolicy, "timingPolicy");
            Objects.requireNonNull(messageGenerator, "messageGenerator");
            Objects.requireNonNull(templateId, "templateId");
            Objects.requireNonNull(messageSink, "messageSink");
            Objects.requireNonNull(observability, "observability");
            Objects.requireNonNull(wallClock, "wallClock");
            return new AstmLinkSession(this);
        }
    }
}
