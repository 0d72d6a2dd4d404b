package com.questrail.labsim.protocol.astm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AstmMessage
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of records delimited by ENQ and EOT on the link.
 *
 * <h2>Indivisibility</h2>
 * A message is handed to the application only when the full exchange ends with
 * EOT. Partial messages never leave the session.
 *
 * <h2>Field queries</h2>
 * A bridge asks for the simulator's field list by sending a header and a
 * terminator with no patient or order record between them. See
 * {@link #isFieldQuery()}.
 */
public final class AstmMessage
{
    private final List<AstmRecord> records;

    private AstmMessage(List<AstmRecord> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public static AstmMessage of(List<? extends AstmRecord> records) {
        Objects.requireNonNull(records, "records");
        return new AstmMessage(new ArrayList<>(records));
    }

    /**
     * Builds a message from record texts, one record per element.
     */
    public static AstmMessage fromRecordTexts(List<String> recordTexts) {
        Objects.requireNonNull(recordTexts, "recordTexts");
        Builder b = builder();
        for (String text : recordTexts) {
            b.addRecordText(text);
        }
        return b.build();
    }

    /**
     * Parses a message written as CR- or LF-separated record lines. Blank lines
     * are skipped.
     */
    public static AstmMessage parse(String text) {
        Objects.requireNonNull(text, "text");
        Builder b = builder();
        for (String line : text.split("\\r\\n|\\r|\\n")) {
            if (!line.isBlank()) {
                b.addRecordText(line);
            }
        }
        return b.build();
    }

    public List<AstmRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Record texts in order, as sent one per frame. */
    public List<String> recordTexts() {
        return records.stream().map(AstmRecord::text).collect(Collectors.toList());
    }

    public <T extends AstmRecord> List<T> recordsOf(Class<T> type) {
        return records.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    /**
     * Returns true if this message is a field query: it contains a header
     * followed (not necessarily immediately) by a terminator with no patient or
     * order record between them.
     */
    public boolean isFieldQuery() {
        boolean inHeader = false;
        for (AstmRecord r : records) {
            switch (r.type()) {
                case HEADER:
                    inHeader = true;
                    break;
                case PATIENT:
                case ORDER:
                    inHeader = false;
                    break;
                case TERMINATOR:
                    if (inHeader) {
                        return true;
                    }
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstmMessage)) return false;
        return records.equals(((AstmMessage) o).records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "AstmMessage" + recordTexts();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<AstmRecord> records = new ArrayList<>();

        private Builder() {}

        public Builder add(AstmRecord record) {
            records.add(Objects.requireNonNull(record, "record"));
            return this;
        }

        public Builder addRecordText(String recordText) {
            return add(AstmRecord.parse(recordText));
        }

        public AstmMessage build() {
            return new AstmMessage(records);
        }
    }
}
