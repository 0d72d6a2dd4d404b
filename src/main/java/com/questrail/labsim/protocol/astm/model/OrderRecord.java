package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Test order record ({@code O}).
 */
public record OrderRecord(String text) implements AstmRecord {
    public OrderRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.ORDER;
    }

    /** Specimen id (field 2). */
    public String specimenId() {
        return field(2);
    }
}
