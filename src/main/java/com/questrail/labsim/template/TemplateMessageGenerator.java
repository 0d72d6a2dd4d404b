package com.questrail.labsim.template;

import com.questrail.labsim.protocol.astm.MessageGenerator;
import com.questrail.labsim.protocol.astm.internal.time.WallClock;
import com.questrail.labsim.protocol.astm.model.AstmMessage;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * TemplateMessageGenerator
 * -----------------------------------------------------------------------------
 * {@link MessageGenerator} that builds LIS2-A2 messages from analyzer templates.
 *
 * <h2>Record layout</h2>
 * <pre>
 *   H|\^&amp;|||&lt;astm_header&gt;|||||||LIS2-A2|&lt;timestamp&gt;
 *   P|1||&lt;patient id&gt;|&lt;name&gt;||&lt;sex&gt;|&lt;dob&gt;
 *   O|1|&lt;sample id&gt;^LAB|&lt;sample type&gt;||&lt;timestamp&gt;
 *   R|&lt;seq&gt;|^^^&lt;code&gt;|&lt;value&gt;|&lt;unit&gt;|&lt;range&gt;|N||F|&lt;timestamp&gt;
 *   L|1|N
 * </pre>
 *
 * <h2>Values</h2>
 * With a seed, a field's {@code seedValue} is used when the template has one and
 * a {@link Random} seeded with the given seed fills in the rest, so equal seeds
 * give equal messages. Without a seed every value is random.
 */
public final class TemplateMessageGenerator implements MessageGenerator
{
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String TEXT_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final String TERMINATOR = "L|1|N";

    private final TemplateCatalog catalog;
    private final WallClock wallClock;
    private final ZoneId zone;

    public TemplateMessageGenerator(TemplateCatalog catalog, WallClock wallClock)
    {
        this(catalog, wallClock, ZoneId.systemDefault());
    }

    public TemplateMessageGenerator(TemplateCatalog catalog, WallClock wallClock, ZoneId zone)
    {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public AstmMessage generate(String templateId, Long seed)
    {
        AnalyzerTemplate template = catalog.get(templateId);
        String ts = TIMESTAMP.format(wallClock.now().atZone(zone));
        Random random = seed != null ? new Random(seed) : ThreadLocalRandom.current();

        AnalyzerTemplate.TestPatient patient = template.testPatient();
        AnalyzerTemplate.TestSample sample = template.testSample();

        AstmMessage.Builder b = AstmMessage.builder()
                .addRecordText(header(template) + "|" + ts)
                .addRecordText(String.format("P|1||%s|%s||%s|%s",
                        patient.id(), patient.name(), patient.sex(), patient.dob()))
                .addRecordText(String.format("O|1|%s^LAB|%s||%s", sample.id(), sample.type(), ts));

        int seq = 1;
        for (TemplateField field : template.fields()) {
            String value = seed != null && field.hasSeedValue()
                    ? field.seedValue()
                    : randomValue(field, random);
            b.addRecordText(String.format("R|%d|^^^%s|%s|%s|%s|N||F|%s",
                    seq++, field.code(), value, field.unit(), field.normalRange(), ts));
        }
        return b.addRecordText(TERMINATOR).build();
    }

    @Override
    public AstmMessage fieldQueryResponse(String templateId)
    {
        AnalyzerTemplate template = catalog.get(templateId);

        AstmMessage.Builder b = AstmMessage.builder().addRecordText(header(template));
        int seq = 1;
        for (TemplateField field : template.fields()) {
            b.addRecordText(String.format("R|%d|^^^%s^%s||%s|||%s",
                    seq++, field.code(), field.displayName(), field.unit(), field.type()));
        }
        return b.addRecordText(TERMINATOR).build();
    }

    private static String header(AnalyzerTemplate template)
    {
        return "H|\\^&|||" + template.astmHeader() + "|||||||LIS2-A2";
    }

    /**
     * Draws a value for the field: NUMERIC within its normal range, QUALITATIVE
     * from its possible values, TEXT as an eight-character token.
     */
    static String randomValue(TemplateField field, Random random)
    {
        switch (field.type()) {
            case QUALITATIVE: {
                List<String> choices = field.possibleValues();
                return choices.isEmpty() ? "UNKNOWN" : choices.get(random.nextInt(choices.size()));
            }
            case TEXT: {
                StringBuilder sb = new StringBuilder(8);
                for (int i = 0; i < 8; i++) {
                    sb.append(TEXT_ALPHABET.charAt(random.nextInt(TEXT_ALPHABET.length())));
                }
                return sb.toString();
            }
            case NUMERIC:
            default:
                return JsonTemplateReader.formatNumber(numericValue(field.normalRange(), random));
        }
    }

    private static double numericValue(String normalRange, Random random)
    {
        String range = normalRange.trim();
        try {
            if (range.startsWith("<")) {
                double max = Double.parseDouble(range.substring(1).trim());
                return uniform(random, 0, max * 0.9);
            }
            if (range.startsWith(">")) {
                double min = Double.parseDouble(range.substring(1).trim());
                return uniform(random, min * 1.1, min * 2);
            }
            int dash = range.indexOf('-', 1);
            if (dash > 0) {
                double low = Double.parseDouble(range.substring(0, dash).trim());
                double high = Double.parseDouble(range.substring(dash + 1).trim());
                return uniform(random, low, high);
            }
        } catch (NumberFormatException e) {
            // Unparseable ranges fall through to the generic range.
            return uniform(random, 1, 100);
        }
        return uniform(random, 1, 100);
    }

    private static double uniform(Random random, double low, double high)
    {
        double v = low + (high - low) * random.nextDouble();
        return Math.round(v * 100.0) / 100.0;
    }
}
