package com.questrail.labsim.protocol.astm;

import com.questrail.labsim.protocol.astm.model.AstmMessage;

/**
 * Source of outbound message content.
 *
 * <p>The link session never builds records itself. What an analyzer reports is
 * decided here, from a template, and the session only moves it over the wire.</p>
 */
public interface MessageGenerator
{
    /**
     * Generates a complete result message: header, patient, order, one result
     * per template field, terminator.
     *
     * @param templateId template to draw fields from
     * @param seed       seed for reproducible values, or {@code null} for random
     * @throws IllegalArgumentException if the template is unknown
     */
    AstmMessage generate(String templateId, Long seed);

    /**
     * Generates the answer to a field query: header, one result record per
     * template field describing the field, terminator.
     *
     * @throws IllegalArgumentException if the template is unknown
     */
    AstmMessage fieldQueryResponse(String templateId);
}
