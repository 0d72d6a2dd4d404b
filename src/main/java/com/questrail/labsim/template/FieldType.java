package com.questrail.labsim.template;

import java.util.Locale;

/**
 * Kind of value a template field reports.
 */
public enum FieldType {
    /** Decimal value, drawn from the field's normal range. */
    NUMERIC,
    /** One of a fixed set of values, e.g. POSITIVE / NEGATIVE. */
    QUALITATIVE,
    /** Free text. */
    TEXT;

    static FieldType parse(String value) {
        if (value == null || value.isBlank()) {
            return NUMERIC;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TemplateException("Unknown field type: " + value, e);
        }
    }
}
