package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Result record ({@code R}).
 */
public record ResultRecord(String text) implements AstmRecord {
    public ResultRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.RESULT;
    }

    /** Universal test id, e.g. {@code ^^^WBC} (field 2). */
    public String testId() {
        return field(2);
    }

    /** Measurement value (field 3). */
    public String value() {
        return field(3);
    }

    /** Units (field 4). */
    public String unit() {
        return field(4);
    }
}
