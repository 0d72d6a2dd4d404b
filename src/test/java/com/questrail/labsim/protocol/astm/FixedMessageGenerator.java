package com.questrail.labsim.protocol.astm;

import com.questrail.labsim.protocol.astm.model.AstmMessage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test generator with one known template, {@code "fixed"}, that always yields
 * the same short result message.
 */
public final class FixedMessageGenerator implements MessageGenerator
{
    public static final String TEMPLATE = "fixed";

    public static final AstmMessage RESULT = AstmMessage.parse(
            "H|\\^&|||Test^Analyzer^1.0|||||||LIS2-A2\r"
                    + "P|1||PAT-1\r"
                    + "O|1|SAMPLE-1\r"
                    + "R|1|^^^WBC|5.8|10^3/uL|4.5-11.0|N||F\r"
                    + "L|1|N");

    public static final AstmMessage FIELD_LIST = AstmMessage.parse(
            "H|\\^&|||Test^Analyzer^1.0|||||||LIS2-A2\r"
                    + "R|1|^^^WBC^White Blood Cell Count||10^3/uL|||NUMERIC\r"
                    + "L|1|N");

    private final AtomicInteger generated = new AtomicInteger();

    @Override
    public AstmMessage generate(String templateId, Long seed)
    {
        check(templateId);
        generated.incrementAndGet();
        return RESULT;
    }

    @Override
    public AstmMessage fieldQueryResponse(String templateId)
    {
        check(templateId);
        return FIELD_LIST;
    }

    public int generatedCount()
    {
        return generated.get();
    }

    private static void check(String templateId)
    {
        if (!TEMPLATE.equals(templateId)) {
            throw new IllegalArgumentException("Unknown template: " + templateId);
        }
    }
}
