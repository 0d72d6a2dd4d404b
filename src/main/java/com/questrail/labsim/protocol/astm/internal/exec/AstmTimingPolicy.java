package com.questrail.labsim.protocol.astm.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * AstmTimingPolicy
 * -----------------------------------------------------------------------------
 * Deadlines and pacing for a link session.
 *
 * <p>This is <em>operational only</em>. Whether a failure is retried and when a
 * transfer aborts is decided by the state machine; this policy says how long
 * each wait may last.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>establishmentTimeout</b>: wait for a reply to our ENQ (LIS1-A: 15 s)</li>
 *   <li><b>frameAckTimeout</b>: wait for ACK/NAK/EOT after each frame we send
 *       (LIS1-A: 15 s)</li>
 *   <li><b>receiverTimeout</b>: wait for the next frame or EOT while receiving
 *       (LIS1-A: 30 s)</li>
 *   <li><b>idleTimeout</b>: an IDLE connection with no traffic for this long is
 *       closed</li>
 *   <li><b>contentionBackoff</b>: minimum wait before resending ENQ after
 *       contention (LIS1-A instrument side: at least 1 s)</li>
 *   <li><b>responseDelay</b>: pause before every transmission, emulating
 *       instrument latency</li>
 *   <li><b>maxContentionRetries</b>: ENQ resends after contention before the
 *       attempt is abandoned</li>
 * </ul>
 */
public record AstmTimingPolicy(
        Duration establishmentTimeout,
        Duration frameAckTimeout,
        Duration receiverTimeout,
        Duration idleTimeout,
        Duration contentionBackoff,
        Duration responseDelay,
        int maxContentionRetries
) {
    public AstmTimingPolicy {
        Objects.requireNonNull(establishmentTimeout, "establishmentTimeout");
        Objects.requireNonNull(frameAckTimeout, "frameAckTimeout");
        Objects.requireNonNull(receiverTimeout, "receiverTimeout");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(contentionBackoff, "contentionBackoff");
        Objects.requireNonNull(responseDelay, "responseDelay");

        requirePositive(establishmentTimeout, "establishmentTimeout");
        requirePositive(frameAckTimeout, "frameAckTimeout");
        requirePositive(receiverTimeout, "receiverTimeout");
        requirePositive(idleTimeout, "idleTimeout");
        if (contentionBackoff.isNegative()) {
            throw new IllegalArgumentException("contentionBackoff must be non-negative");
        }
        if (responseDelay.isNegative()) {
            throw new IllegalArgumentException("responseDelay must be non-negative");
        }
        if (maxContentionRetries < 0) {
            throw new IllegalArgumentException("maxContentionRetries must be non-negative");
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * LIS1-A defaults: 15 s establishment, 15 s frame ACK, 30 s receiver,
     * 60 s idle, 1 s contention backoff, no response delay, 3 contention retries.
     */
    public static AstmTimingPolicy defaults() {
        return new AstmTimingPolicy(
                Duration.ofSeconds(15),
                Duration.ofSeconds(15),
                Duration.ofSeconds(30),
                Duration.ofSeconds(60),
                Duration.ofSeconds(1),
                Duration.ZERO,
                3
        );
    }

    public AstmTimingPolicy withResponseDelay(Duration delay) {
        return new AstmTimingPolicy(establishmentTimeout, frameAckTimeout, receiverTimeout,
                idleTimeout, contentionBackoff, delay, maxContentionRetries);
    }

    public AstmTimingPolicy withMaxContentionRetries(int retries) {
        return new AstmTimingPolicy(establishmentTimeout, frameAckTimeout, receiverTimeout,
                idleTimeout, contentionBackoff, responseDelay, retries);
    }
}
