package com.questrail.labsim.template;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JsonTemplateReader
 * -----------------------------------------------------------------------------
 * Reads one analyzer template document with the Jackson streaming parser.
 *
 * <p>The document is first read into a plain map/list graph, then mapped onto
 * {@link AnalyzerTemplate}. Unknown keys are ignored so templates may carry
 * documentation fields. Required: an {@code analyzer} object and a non-empty
 * {@code fields} array whose entries each have a {@code code} or {@code name}.
 * String values may not contain characters that LIS1-A forbids in frame text.</p>
 */
final class JsonTemplateReader
{
    private final JsonFactory factory = new JsonFactory();

    AnalyzerTemplate read(String id, InputStream in)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(in, "in");

        Object root;
        try (JsonParser parser = factory.createParser(in)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new TemplateException("Template " + id + " is empty");
            }
            root = readValue(parser, token);
        } catch (TemplateException ex) {
            throw new TemplateException("Template " + id + ": " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new TemplateException("Template " + id + " is not valid JSON", ex);
        }

        if (!(root instanceof Map)) {
            throw new TemplateException("Template " + id + " must be a JSON object");
        }
        return toTemplate(id, asMap(root));
    }

    // ---------------------------------------------------------------------
    // Mapping
    // ---------------------------------------------------------------------

    private AnalyzerTemplate toTemplate(String id, Map<String, Object> doc)
    {
        Object analyzerNode = doc.get("analyzer");
        if (!(analyzerNode instanceof Map)) {
            throw new TemplateException("Template " + id + " has no analyzer object");
        }
        Map<String, Object> analyzer = asMap(analyzerNode);
        Map<String, Object> protocol = optionalMap(doc.get("protocol"));
        Map<String, Object> identification = optionalMap(doc.get("identification"));

        Object fieldsNode = doc.get("fields");
        if (!(fieldsNode instanceof List) || ((List<?>) fieldsNode).isEmpty()) {
            throw new TemplateException("Template " + id + " has no fields");
        }

        String manufacturer = text(analyzer, "manufacturer", "Mock");
        String model = text(analyzer, "model", "Analyzer");

        List<TemplateField> fields = new ArrayList<>();
        int seq = 1;
        for (Object node : (List<?>) fieldsNode) {
            if (!(node instanceof Map)) {
                throw new TemplateException("Template " + id + " field " + seq + " is not an object");
            }
            fields.add(toField(id, seq++, asMap(node)));
        }

        Map<String, Object> patient = optionalMap(doc.get("testPatient"));
        Map<String, Object> sample = optionalMap(doc.get("testSample"));
        AnalyzerTemplate.TestPatient p = AnalyzerTemplate.TestPatient.DEFAULT;
        AnalyzerTemplate.TestSample s = AnalyzerTemplate.TestSample.DEFAULT;

        return new AnalyzerTemplate(
                id,
                text(analyzer, "name", id),
                manufacturer,
                model,
                text(protocol, "type", "ASTM"),
                text(protocol, "version", "LIS2-A2"),
                text(identification, "astm_header", manufacturer + "^" + model + "^V1.0"),
                fields,
                new AnalyzerTemplate.TestPatient(
                        text(patient, "id", p.id()),
                        text(patient, "name", p.name()),
                        text(patient, "sex", p.sex()),
                        text(patient, "dob", p.dob())),
                new AnalyzerTemplate.TestSample(
                        text(sample, "id", s.id()),
                        text(sample, "type", s.type())));
    }

    private TemplateField toField(String id, int seq, Map<String, Object> node)
    {
        String name = text(node, "name", null);
        String code = text(node, "code", name);
        if (code == null) {
            throw new TemplateException("Template " + id + " field " + seq + " has neither code nor name");
        }
        if (name == null) {
            name = code;
        }

        List<String> possibleValues = new ArrayList<>();
        Object pv = node.get("possibleValues");
        if (pv instanceof List) {
            for (Object v : (List<?>) pv) {
                possibleValues.add(scalar(v));
            }
        }

        Object seed = node.get("seedValue");
        return new TemplateField(
                code,
                name,
                text(node, "displayName", name),
                text(node, "unit", ""),
                text(node, "normalRange", ""),
                FieldType.parse(text(node, "type", null)),
                seed == null ? null : scalar(seed),
                possibleValues);
    }

    /**
     * Renders a JSON scalar the way it appears in a result record: integral
     * numbers without decimals, other numbers with two.
     */
    static String scalar(Object value)
    {
        if (value instanceof Number) {
            return formatNumber(((Number) value).doubleValue());
        }
        return String.valueOf(value);
    }

    static String formatNumber(double v)
    {
        if (v == Math.rint(v) && !Double.isInfinite(v)) {
            return new BigDecimal(v).toBigInteger().toString();
        }
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static String text(Map<String, Object> map, String key, String fallback)
    {
        Object v = map.get(key);
        return v == null ? fallback : scalar(v);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node)
    {
        return (Map<String, Object>) node;
    }

    private static Map<String, Object> optionalMap(Object node)
    {
        return node instanceof Map ? asMap(node) : Map.of();
    }

    /**
     * Template strings end up in record text, which may not carry LF or the
     * LIS1-A control range 0x01-0x06, 0x10-0x17.
     */
    static String checkFrameSafe(String value)
    {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c >= 0x01 && c <= 0x06) || (c >= 0x10 && c <= 0x17) || c == '\n') {
                throw new TemplateException(String.format(
                        "Value \"%s\" contains restricted character <0x%02X>",
                        value.replace("\n", "\\n"), (int) c));
            }
        }
        return value;
    }

    // ---------------------------------------------------------------------
    // Streaming parse into maps and lists
    // ---------------------------------------------------------------------

    private Object readValue(JsonParser parser, JsonToken token) throws IOException
    {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> checkFrameSafe(parser.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new TemplateException("Unsupported JSON token: " + token);
        };
    }

    private Map<String, Object> readObject(JsonParser parser) throws IOException
    {
        Map<String, Object> map = new LinkedHashMap<>();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_OBJECT) {
                break;
            }
            if (token != JsonToken.FIELD_NAME) {
                throw new TemplateException("Expected field name but found " + token);
            }
            String fieldName = parser.currentName();
            map.put(fieldName, readValue(parser, parser.nextToken()));
        }
        return map;
    }

    private List<Object> readArray(JsonParser parser) throws IOException
    {
        List<Object> list = new ArrayList<>();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            list.add(readValue(parser, token));
        }
        return list;
    }
}
