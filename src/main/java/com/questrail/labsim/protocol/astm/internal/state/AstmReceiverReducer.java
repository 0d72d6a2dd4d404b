package com.questrail.labsim.protocol.astm.internal.state;

import com.questrail.labsim.protocol.astm.internal.events.LinkControlEvent;
import com.questrail.labsim.protocol.astm.internal.events.LinkEvent;
import com.questrail.labsim.protocol.astm.internal.events.LinkFrameEvent;
import com.questrail.labsim.protocol.astm.internal.events.LinkTimeoutEvent;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;
import com.questrail.labsim.protocol.astm.model.AstmMessage;

import java.util.Objects;

/**
 * AstmReceiverReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function for the receiver side of a link
 * session.
 *
 * <p>Given the current {@link AstmSessionState} and one {@link LinkEvent}, the
 * reducer computes the next state and the {@link LinkIntents} the driver must
 * carry out. It performs no I/O, reads no clock and keeps no state of its own.</p>
 *
 * <h2>Receiver rules</h2>
 * <ul>
 *   <li>ENQ in IDLE: ACK and start a transfer (NAK when not accepting).</li>
 *   <li>ENQ mid-transfer: the peer restarted; discard and ACK again.</li>
 *   <li>Frame with the expected number: append its text, ACK, clear retries.</li>
 *   <li>Frame repeating the last accepted number: ACK without appending.</li>
 *   <li>Checksum, structure or sequence failure: NAK and count it. The
 *       {@value #RETRANSMISSION_LIMIT}th consecutive failure aborts.</li>
 *   <li>EOT: the message is complete; deliver it, and answer it if it is a
 *       field query.</li>
 *   <li>Receiver timeout: discard the partial transfer and return to IDLE.</li>
 * </ul>
 *
 * <p>Events that make no sense in the current phase (a frame while IDLE, an
 * EOT with no transfer) leave the state unchanged and request nothing. The
 * driver logs them.</p>
 */
public final class AstmReceiverReducer
{
    /** Consecutive failures that abort a transfer. */
    public static final int RETRANSMISSION_LIMIT = 6;

    /**
     * Result of applying an event to a session state.
     *
     * @param newState the updated state
     * @param intents  actions to be executed by the caller
     */
    public record Result(AstmSessionState newState, LinkIntents intents) {}

    private final boolean acceptsInbound;

    public AstmReceiverReducer()
    {
        this(true);
    }

    /**
     * @param acceptsInbound false to answer every ENQ with NAK (instrument busy)
     */
    public AstmReceiverReducer(boolean acceptsInbound)
    {
        this.acceptsInbound = acceptsInbound;
    }

    public Result apply(AstmSessionState state, LinkEvent event)
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof LinkControlEvent.EnqReceived) {
            return onEnq(state);
        }
        if (event instanceof LinkFrameEvent.FrameReceived e) {
            return onFrame(state, e.frame());
        }
        if (event instanceof LinkFrameEvent.FrameRejected) {
            return onFailure(state);
        }
        if (event instanceof LinkControlEvent.EotReceived) {
            return onEot(state);
        }
        if (event instanceof LinkTimeoutEvent.ReceiverTimeout) {
            return onReceiverTimeout(state);
        }

        return new Result(state, LinkIntents.none());
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onEnq(AstmSessionState state)
    {
        switch (state.phase()) {
            case IDLE:
            case ESTABLISHED_RECEIVER:
                if (!acceptsInbound) {
                    return new Result(state.reset(), LinkIntents.sendNak());
                }
                return new Result(
                        state.beginTransfer(SessionPhase.ESTABLISHED_RECEIVER, SessionRole.RECEIVER),
                        LinkIntents.sendAck());
            default:
                // Sender-side ENQ handling (contention) belongs to the driver.
                return new Result(state, LinkIntents.none());
        }
    }

    private Result onFrame(AstmSessionState state, AstmFrame frame)
    {
        if (state.phase() != SessionPhase.ESTABLISHED_RECEIVER) {
            return new Result(state, LinkIntents.none());
        }

        switch (FrameNumbering.classify(state.rawLastAccepted(), frame.frameNumber())) {
            case NEW:
                return new Result(
                        state.withAcceptedFrame(frame.frameNumber(), frame.text(), frame.intermediate()),
                        LinkIntents.sendAck());
            case DUPLICATE:
                return new Result(state.withRetryCount(0), LinkIntents.sendAck());
            case OUT_OF_SEQUENCE:
            default:
                return onFailure(state);
        }
    }

    private Result onFailure(AstmSessionState state)
    {
        if (state.phase() != SessionPhase.ESTABLISHED_RECEIVER) {
            return new Result(state, LinkIntents.none());
        }

        int failures = state.retryCount() + 1;
        if (failures >= RETRANSMISSION_LIMIT) {
            return new Result(
                    state.withRetryCount(failures).withPhase(SessionPhase.ABORTED),
                    LinkIntents.nakAndAbort());
        }
        return new Result(state.withRetryCount(failures), LinkIntents.sendNak());
    }

    private Result onEot(AstmSessionState state)
    {
        if (state.phase() != SessionPhase.ESTABLISHED_RECEIVER) {
            return new Result(state, LinkIntents.none());
        }

        // Text of an unterminated ETB sequence is not a record.
        AstmMessage message = AstmMessage.fromRecordTexts(state.records());
        if (message.isEmpty()) {
            return new Result(state.reset(), LinkIntents.none());
        }
        LinkIntents intents = message.isFieldQuery()
                ? LinkIntents.deliverAndRespond(message)
                : LinkIntents.deliver(message);
        return new Result(state.reset(), intents);
    }

    private Result onReceiverTimeout(AstmSessionState state)
    {
        if (state.phase() != SessionPhase.ESTABLISHED_RECEIVER) {
            return new Result(state, LinkIntents.none());
        }
        return new Result(state.reset(), LinkIntents.none());
    }
}
