package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Quality-control record (`Q`).
 */
public record QcRecord(String text) implements AstmRecord {
    public QcRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.QC;
    }
}
