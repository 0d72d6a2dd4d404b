package com.questrail.labsim.control;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.questrail.labsim.protocol.astm.runtime.PushReport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streaming JSON for the control surface. Request bodies are flat objects;
 * nested values are skipped.
 */
final class ControlJson
{
    private static final JsonFactory FACTORY = new JsonFactory();

    private ControlJson() {}

    /**
     * Reads the top-level scalar members of a JSON object. An empty body reads
     * as an empty map.
     *
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    static Map<String, String> parseFlatObject(byte[] body)
    {
        Map<String, String> values = new LinkedHashMap<>();
        if (body.length == 0) {
            return values;
        }
        try (JsonParser parser = FACTORY.createParser(body)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                return values;
            }
            if (token != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                JsonToken value = parser.nextToken();
                if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
                    parser.skipChildren();
                } else if (value != JsonToken.VALUE_NULL) {
                    values.put(name, parser.getText());
                }
            }
            if (token != JsonToken.END_OBJECT) {
                throw new IllegalArgumentException("Malformed JSON object");
            }
            return values;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON body: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable request body", e);
        }
    }

    static byte[] health(String service, int activeSessions, List<String> templates, boolean pushEnabled)
    {
        return write(gen -> {
            gen.writeStringField("status", "ok");
            gen.writeStringField("service", service);
            gen.writeNumberField("activeSessions", activeSessions);
            gen.writeBooleanField("pushEnabled", pushEnabled);
            gen.writeArrayFieldStart("templates");
            for (String id : templates) {
                gen.writeString(id);
            }
            gen.writeEndArray();
            gen.writeObjectFieldStart("endpoints");
            gen.writeStringField("POST /push", "Push generated results to the bridge");
            gen.writeStringField("GET /health", "Health check");
            gen.writeEndObject();
        });
    }

    static byte[] pushReport(PushReport report, String templateId)
    {
        return write(gen -> {
            gen.writeStringField("status", "completed");
            gen.writeNumberField("total", report.total());
            gen.writeNumberField("successful", report.successful());
            gen.writeNumberField("failed", report.failed());
            gen.writeArrayFieldStart("results");
            for (PushReport.Attempt attempt : report.attempts()) {
                gen.writeStartObject();
                gen.writeNumberField("message_number", attempt.messageNumber());
                gen.writeBooleanField("success", attempt.success());
                gen.writeStringField("outcome", attempt.outcome().name());
                gen.writeStringField("analyzer_type", templateId);
                gen.writeEndObject();
            }
            gen.writeEndArray();
        });
    }

    static byte[] error(String message)
    {
        return write(gen -> {
            gen.writeStringField("status", "error");
            gen.writeStringField("message", message);
        });
    }

    private interface Body
    {
        void writeFields(JsonGenerator gen) throws IOException;
    }

    private static byte[] write(Body body)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            gen.writeStartObject();
            body.writeFields(gen);
            gen.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
