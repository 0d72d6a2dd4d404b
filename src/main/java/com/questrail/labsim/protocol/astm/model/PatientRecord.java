package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * Patient information record ({@code P}).
 */
public record PatientRecord(String text) implements AstmRecord {
    public PatientRecord {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public RecordType type() {
        return RecordType.PATIENT;
    }

    /** Laboratory-assigned patient id (field 3). */
    public String patientId() {
        return field(3);
    }
}
