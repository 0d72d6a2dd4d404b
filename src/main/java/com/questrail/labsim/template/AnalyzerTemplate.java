package com.questrail.labsim.template;

import java.util.List;
import java.util.Objects;

/**
 * AnalyzerTemplate
 * -----------------------------------------------------------------------------
 * Everything the simulator needs to impersonate one analyzer model: how it
 * identifies itself in the header record, the fields it reports, and the test
 * patient and sample its messages carry.
 *
 * <p>Immutable. Templates are loaded once at startup and shared by every
 * session without synchronization.</p>
 */
public record AnalyzerTemplate(
        String id,
        String name,
        String manufacturer,
        String model,
        String protocolType,
        String protocolVersion,
        String astmHeader,
        List<TemplateField> fields,
        TestPatient testPatient,
        TestSample testSample
) {
    public AnalyzerTemplate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(manufacturer, "manufacturer");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(protocolType, "protocolType");
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        Objects.requireNonNull(astmHeader, "astmHeader");
        Objects.requireNonNull(testPatient, "testPatient");
        Objects.requireNonNull(testSample, "testSample");
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new TemplateException("Template " + id + " defines no fields");
        }
    }

    /**
     * Patient demographics placed in the P record.
     */
    public record TestPatient(String id, String name, String sex, String dob) {
        public static final TestPatient DEFAULT = new TestPatient("PAT-TEST-001", "TEST^PATIENT", "M", "19900101");
    }

    /**
     * Specimen placed in the O record.
     */
    public record TestSample(String id, String type) {
        public static final TestSample DEFAULT = new TestSample("SAMPLE-001", "CBC^Complete Blood Count");
    }
}
