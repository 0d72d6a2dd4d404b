package com.questrail.labsim.protocol.astm.internal.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * AstmSessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one link session.
 *
 * <h2>Ownership</h2>
 * A state value belongs to exactly one session and is replaced, never mutated,
 * on every transition. Sessions share nothing.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code phase} and {@code role}: where the session is in the LIS1-A
 *       state machine and on which side of the transfer</li>
 *   <li>{@code lastAcceptedFrameNumber}: unset until the first frame of a
 *       transfer is accepted</li>
 *   <li>{@code retryCount}: consecutive NAK-triggering failures, 0..6</li>
 *   <li>{@code records}: record texts accepted so far in the current transfer</li>
 *   <li>{@code pendingText}: text of intermediate (ETB) frames not yet closed
 *       by a final frame</li>
 * </ul>
 */
public final class AstmSessionState
{
    private final SessionPhase phase;
    private final SessionRole role;
    private final int lastAcceptedFrameNumber;
    private final int retryCount;
    private final List<String> records;
    private final String pendingText;

    private AstmSessionState(SessionPhase phase,
                             SessionRole role,
                             int lastAcceptedFrameNumber,
                             int retryCount,
                             List<String> records,
                             String pendingText)
    {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.role = Objects.requireNonNull(role, "role");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        this.lastAcceptedFrameNumber = lastAcceptedFrameNumber;
        this.retryCount = retryCount;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.pendingText = Objects.requireNonNull(pendingText, "pendingText");
    }

    /**
     * Initial state of every session: IDLE, receiver role, nothing accepted.
     */
    public static AstmSessionState idle()
    {
        return new AstmSessionState(SessionPhase.IDLE, SessionRole.RECEIVER,
                FrameNumbering.UNSET, 0, List.of(), "");
    }

    public SessionPhase phase() {
        return phase;
    }

    public SessionRole role() {
        return role;
    }

    public OptionalInt lastAcceptedFrameNumber() {
        return lastAcceptedFrameNumber == FrameNumbering.UNSET
                ? OptionalInt.empty()
                : OptionalInt.of(lastAcceptedFrameNumber);
    }

    /** Raw value, {@link FrameNumbering#UNSET} when nothing is accepted. */
    int rawLastAccepted() {
        return lastAcceptedFrameNumber;
    }

    public int retryCount() {
        return retryCount;
    }

    public List<String> records() {
        return records;
    }

    public String pendingText() {
        return pendingText;
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public AstmSessionState withPhase(SessionPhase newPhase)
    {
        return new AstmSessionState(newPhase, role, lastAcceptedFrameNumber,
                retryCount, records, pendingText);
    }

    public AstmSessionState withRetryCount(int newRetryCount)
    {
        return new AstmSessionState(phase, role, lastAcceptedFrameNumber,
                newRetryCount, records, pendingText);
    }

    /**
     * Starts a fresh transfer in the given phase and role, discarding any
     * accepted records and resetting frame numbering and retries.
     */
    public AstmSessionState beginTransfer(SessionPhase newPhase, SessionRole newRole)
    {
        return new AstmSessionState(newPhase, newRole, FrameNumbering.UNSET, 0, List.of(), "");
    }

    /**
     * Returns to IDLE as receiver, discarding any partial transfer.
     */
    public AstmSessionState reset()
    {
        return idle();
    }

    /**
     * Records acceptance of a frame: advances the frame number, clears the
     * retry count and appends (or buffers, for intermediate frames) its text.
     */
    AstmSessionState withAcceptedFrame(int frameNumber, String text, boolean intermediate)
    {
        String combined = pendingText + text;
        if (intermediate) {
            return new AstmSessionState(phase, role, frameNumber, 0, records, combined);
        }
        List<String> appended = new ArrayList<>(records);
        appended.add(combined);
        return new AstmSessionState(phase, role, frameNumber, 0, appended, "");
    }

    /**
     * Records a sender-side frame acknowledgement.
     */
    public AstmSessionState withFrameAcknowledged(int frameNumber)
    {
        return new AstmSessionState(phase, role, frameNumber, 0, records, pendingText);
    }

    @Override
    public String toString() {
        return "AstmSessionState{" +
                "phase=" + phase +
                ", role=" + role +
                ", lastAccepted=" + lastAcceptedFrameNumber +
                ", retryCount=" + retryCount +
                ", records=" + records.size() +
                ", pending=" + !pendingText.isEmpty() +
                '}';
    }
}
