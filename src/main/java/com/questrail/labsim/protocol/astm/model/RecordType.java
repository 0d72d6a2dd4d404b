package com.questrail.labsim.protocol.astm.model;

/**
 * LIS2-A2 record types, keyed by the first character of the record text.
 */
public enum RecordType {
    HEADER('H'),
    PATIENT('P'),
    ORDER('O'),
    RESULT('R'),
    QC('Q'),
    TERMINATOR('L'),
    /** Comment, manufacturer, scientific and any other record type. */
    OTHER('?');

    private final char code;

    RecordType(char code) {
        this.code = code;
    }

    /**
     * Classifies record text by its leading type character. Lowercase type
     * characters are accepted; empty text is {@link #OTHER}.
     */
    public static RecordType of(String recordText) {
        if (recordText == null || recordText.isEmpty()) {
            return OTHER;
        }
        char c = Character.toUpperCase(recordText.charAt(0));
        for (RecordType t : values()) {
            if (t != OTHER && t.code == c) {
                return t;
            }
        }
        return OTHER;
    }
}
