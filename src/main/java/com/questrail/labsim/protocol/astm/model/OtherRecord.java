package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Any record type the simulator does not interpret (comment, manufacturer,
 * request, scientific). Carried through unchanged.
 */
public record OtherRecord(String text) implements AstmRecord {
    public OtherRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.OTHER;
    }
}
