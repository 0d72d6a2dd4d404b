package com.questrail.labsim.protocol.astm.runtime;

import com.questrail.labsim.protocol.astm.ExchangeOutcome;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a push batch, one {@link Attempt} per message.
 */
public record PushReport(List<Attempt> attempts) {

    public PushReport {
        attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
    }

    public int total() {
        return attempts.size();
    }

    public int successful() {
        return (int) attempts.stream().filter(Attempt::success).count();
    }

    public int failed() {
        return total() - successful();
    }

    public boolean allSucceeded() {
        return failed() == 0;
    }

    /**
     * One pushed message. Numbers start at 1.
     */
    public record Attempt(int messageNumber, ExchangeOutcome outcome) {
        public Attempt {
            Objects.requireNonNull(outcome, "outcome");
        }

        public boolean success() {
            return outcome.isSuccess();
        }
    }
}
