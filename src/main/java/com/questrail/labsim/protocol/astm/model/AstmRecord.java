package com.questrail.labsim.protocol.astm.model;

import java.util.Objects;

/**
 * AstmRecord
 * -----------------------------------------------------------------------------
 * One LIS2-A2 record: a line of {@code |}-delimited fields whose first field is
 * the record type.
 *
 * <p>Records keep their raw text. Field access is positional and lenient:
 * missing fields read as the empty string. Component and repeat delimiters
 * ({@code ^}, {@code \}) are not interpreted.</p>
 */
public sealed interface AstmRecord
        permits HeaderRecord, PatientRecord, OrderRecord, ResultRecord,
                QcRecord, TerminatorRecord, OtherRecord
{
    RecordType type();

    /** Raw record text without a trailing CR. */
    String text();

    /**
     * Returns the field at the given zero-based position, or "" if absent.
     * Position 0 is the record type.
     */
    default String field(int index) {
        String[] parts = text().split("\\|", -1);
        return index >= 0 && index < parts.length ? parts[index] : "";
    }

    /**
     * Parses record text into the matching record type. A single trailing CR is
     * dropped; it separates records and is not part of the record.
     */
    static AstmRecord parse(String recordText) {
        Objects.requireNonNull(recordText, "recordText");
        String text = recordText.endsWith("\r")
                ? recordText.substring(0, recordText.length() - 1)
                : recordText;

        switch (RecordType.of(text)) {
            case HEADER:     return new HeaderRecord(text);
            case PATIENT:    return new PatientRecord(text);
            case ORDER:      return new OrderRecord(text);
            case RESULT:     return new ResultRecord(text);
            case QC:         return new QcRecord(text);
            case TERMINATOR: return new TerminatorRecord(text);
            default:         return new OtherRecord(text);
        }
    }
}
