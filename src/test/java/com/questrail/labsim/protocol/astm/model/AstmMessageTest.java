package com.questrail.labsim.protocol.astm.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AstmMessageTest
 * -----------------------------------------------------------------------------
 * Record classification, field access and field-query detection.
 */
final class AstmMessageTest
{
    @Test
    void recordsAreTypedByLeadingCharacter()
    {
        AstmMessage m = AstmMessage.fromRecordTexts(List.of(
                "H|\\^&", "P|1", "O|1|S1", "R|1|^^^WBC|5.8", "Q|1", "C|1|I|note", "L|1|N"));

        assertInstanceOf(HeaderRecord.class, m.records().get(0));
        assertInstanceOf(PatientRecord.class, m.records().get(1));
        assertInstanceOf(OrderRecord.class, m.records().get(2));
        assertInstanceOf(ResultRecord.class, m.records().get(3));
        assertInstanceOf(QcRecord.class, m.records().get(4));
        assertInstanceOf(OtherRecord.class, m.records().get(5));
        assertInstanceOf(TerminatorRecord.class, m.records().get(6));
        assertEquals(RecordType.QC, m.records().get(4).type());
    }

    @Test
    void lowercaseAndEmptyRecordTypes()
    {
        assertEquals(RecordType.RESULT, RecordType.of("r|1"));
        assertEquals(RecordType.OTHER, RecordType.of(""));
        assertEquals(RecordType.OTHER, RecordType.of(null));
    }

    @Test
    void fieldAccessIsPositionalAndLenient()
    {
        ResultRecord r = (ResultRecord) AstmRecord.parse("R|1|^^^WBC^White Blood Cell Count|5.8|10^3/uL");

        assertEquals("R", r.field(0));
        assertEquals("^^^WBC^White Blood Cell Count", r.testId());
        assertEquals("5.8", r.value());
        assertEquals("10^3/uL", r.unit());
        assertEquals("", r.field(12));
        assertEquals("", r.field(-1));
    }

    @Test
    void trailingCarriageReturnIsNotPartOfTheRecord()
    {
        AstmRecord r = AstmRecord.parse("L|1|N\r");
        assertEquals("L|1|N", r.text());
    }

    @Test
    void parseSplitsOnAnyLineEndingAndSkipsBlankLines()
    {
        AstmMessage m = AstmMessage.parse("H|\\^&\rP|1\r\n\nO|1\nL|1|N\r");

        assertEquals(List.of("H|\\^&", "P|1", "O|1", "L|1|N"), m.recordTexts());
        assertEquals(4, m.size());
    }

    @Test
    void headerFollowedDirectlyByTerminatorIsAFieldQuery()
    {
        assertTrue(AstmMessage.parse("H|\\^&\rL|1|N").isFieldQuery());
        assertTrue(AstmMessage.parse("H|\\^&\rC|1|I|x\rL|1|N").isFieldQuery());
    }

    @Test
    void messagesWithPatientOrOrderAreNotFieldQueries()
    {
        assertFalse(AstmMessage.parse("H|\\^&\rO|1|S\rL|1|N").isFieldQuery());
        assertFalse(AstmMessage.parse("H|\\^&\rP|1\rL|1|N").isFieldQuery());
        assertFalse(AstmMessage.parse("H|\\^&").isFieldQuery());
        assertFalse(AstmMessage.parse("P|1\rL|1|N").isFieldQuery());
    }

    @Test
    void recordsOfFiltersByType()
    {
        AstmMessage m = AstmMessage.parse("H|\\^&\rR|1|^^^A|1\rR|2|^^^B|2\rL|1|N");

        List<ResultRecord> results = m.recordsOf(ResultRecord.class);
        assertEquals(2, results.size());
        assertEquals("2", results.get(1).value());
        assertTrue(m.recordsOf(PatientRecord.class).isEmpty());
    }

    @Test
    void equalityFollowsRecordText()
    {
        assertEquals(AstmMessage.parse("H|\\^&\rL|1|N"),
                AstmMessage.fromRecordTexts(List.of("H|\\^&", "L|1|N\r")));
        assertTrue(AstmMessage.parse("\r\n").isEmpty());
    }
}
