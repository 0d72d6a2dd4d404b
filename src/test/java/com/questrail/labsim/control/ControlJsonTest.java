package com.questrail.labsim.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.questrail.labsim.protocol.astm.ExchangeOutcome;
import com.questrail.labsim.protocol.astm.runtime.PushReport;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ControlJsonTest {

    @Test
    void flatObjectKeepsScalarsAndSkipsNestedValues() {
        Map<String, String> m = ControlJson.parseFlatObject(bytes(
                "{\"count\": 3, \"analyzer_type\": \"chemistry\", \"extra\": {\"a\": [1, 2]}, \"none\": null, \"flag\": true}"));

        assertEquals(Map.of("count", "3", "analyzer_type", "chemistry", "flag", "true"), m);
    }

    @Test
    void emptyBodyIsAnEmptyObject() {
        assertTrue(ControlJson.parseFlatObject(new byte[0]).isEmpty());
        assertTrue(ControlJson.parseFlatObject(bytes("   ")).isEmpty());
    }

    @Test
    void nonObjectsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ControlJson.parseFlatObject(bytes("[1]")));
        assertThrows(IllegalArgumentException.class, () -> ControlJson.parseFlatObject(bytes("{\"count\": ")));
        assertThrows(IllegalArgumentException.class, () -> ControlJson.parseFlatObject(bytes("nope")));
    }

    @Test
    void truncatedBodyReportsTheParserError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ControlJson.parseFlatObject(bytes("{\"count\":")));

        assertTrue(e.getMessage().startsWith("Invalid JSON body: "), e.getMessage());
        assertInstanceOf(JsonProcessingException.class, e.getCause());
    }

    @Test
    void pushReportListsEachAttempt() {
        PushReport report = new PushReport(List.of(
                new PushReport.Attempt(1, ExchangeOutcome.COMPLETED),
                new PushReport.Attempt(2, ExchangeOutcome.FRAME_ACK_TIMEOUT)));

        String json = new String(ControlJson.pushReport(report, "hematology"), StandardCharsets.UTF_8);

        assertEquals("{\"status\":\"completed\",\"total\":2,\"successful\":1,\"failed\":1,\"results\":["
                + "{\"message_number\":1,\"success\":true,\"outcome\":\"COMPLETED\",\"analyzer_type\":\"hematology\"},"
                + "{\"message_number\":2,\"success\":false,\"outcome\":\"FRAME_ACK_TIMEOUT\",\"analyzer_type\":\"hematology\"}]}",
                json);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
