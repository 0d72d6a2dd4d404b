package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Message header (`H`). Opens every message.
 */
public record HeaderRecord(String text) implements AstmRecord {
    public HeaderRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.HEADER;
    }
}
