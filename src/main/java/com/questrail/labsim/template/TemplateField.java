package com.questrail.labsim.template;

import java.util.List;
import java.util.Objects;

/**
 * One measurement an analyzer reports.
 *
 * @param code           test code sent in the universal test id ({@code ^^^code})
 * @param name           internal name
 * @param displayName    human-readable name, sent in field-query answers
 * @param unit           units, may be empty
 * @param normalRange    range such as {@code 4.0-10.0}, {@code <5} or {@code >1}; may be empty
 * @param type           value kind
 * @param seedValue      fixed value used for seeded generation, or {@code null}
 * @param possibleValues choices for {@link FieldType#QUALITATIVE} fields
 */
public record TemplateField(
        String code,
        String name,
        String displayName,
        String unit,
        String normalRange,
        FieldType type,
        String seedValue,
        List<String> possibleValues
) {
    public TemplateField {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(normalRange, "normalRange");
        Objects.requireNonNull(type, "type");
        possibleValues = possibleValues == null ? List.of() : List.copyOf(possibleValues);
    }

    public boolean hasSeedValue() {
        return seedValue != null;
    }
}
