package com.questrail.labsim.protocol.astm.internal.state;

import com.questrail.labsim.protocol.astm.model.AstmMessage;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * LinkIntents
 * -----------------------------------------------------------------------------
 * Immutable set of actions requested by the {@link AstmReceiverReducer}.
 *
 * <p>The reducer decides <b>what</b> should happen; the session driver decides
 * <b>how</b>: which bytes to write, in which order, and whether the transport
 * is still there to write them to. No intent performs I/O.</p>
 *
 * <p>Execution order when several kinds are present is fixed by the driver:
 * {@code SEND_NAK}/{@code SEND_ACK}, then {@code ABORT_SESSION}, then
 * {@code DELIVER_MESSAGE}, then {@code RESPOND_TO_QUERY}.</p>
 */
public final class LinkIntents
{
    public enum Kind {
        /** Write ACK. */
        SEND_ACK,

        /** Write NAK. */
        SEND_NAK,

        /** Write EOT (if the transport is open) and close the connection. */
        ABORT_SESSION,

        /** Hand the finished message to the received-message sink. */
        DELIVER_MESSAGE,

        /** Answer a field query as Initiator on the same connection. */
        RESPOND_TO_QUERY
    }

    private final Set<Kind> kinds;
    private final AstmMessage message;

    private LinkIntents(Set<Kind> kinds, AstmMessage message) {
        this.kinds = Collections.unmodifiableSet(
                kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        this.message = message;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * The completed message, present with {@link Kind#DELIVER_MESSAGE}.
     */
    public Optional<AstmMessage> message() {
        return Optional.ofNullable(message);
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static LinkIntents none() {
        return new LinkIntents(EnumSet.noneOf(Kind.class), null);
    }

    public static LinkIntents sendAck() {
        return new LinkIntents(EnumSet.of(Kind.SEND_ACK), null);
    }

    public static LinkIntents sendNak() {
        return new LinkIntents(EnumSet.of(Kind.SEND_NAK), null);
    }

    /**
     * NAK the last frame, then abort.
     */
    public static LinkIntents nakAndAbort() {
        return new LinkIntents(EnumSet.of(Kind.SEND_NAK, Kind.ABORT_SESSION), null);
    }

    public static LinkIntents deliver(AstmMessage message) {
        Objects.requireNonNull(message, "message");
        return new LinkIntents(EnumSet.of(Kind.DELIVER_MESSAGE), message);
    }

    public static LinkIntents deliverAndRespond(AstmMessage message) {
        Objects.requireNonNull(message, "message");
        return new LinkIntents(EnumSet.of(Kind.DELIVER_MESSAGE, Kind.RESPOND_TO_QUERY), message);
    }

    @Override
    public String toString() {
        return "LinkIntents" + kinds;
    }
}
