package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Message terminator (`L`). Closes every message.
 */
public record TerminatorRecord(String text) implements AstmRecord {
    public TerminatorRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.TERMINATOR;
    }
}
