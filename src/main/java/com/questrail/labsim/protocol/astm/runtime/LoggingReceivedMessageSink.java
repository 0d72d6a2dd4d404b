package com.questrail.labsim.protocol.astm.runtime;

import com.questrail.labsim.protocol.astm.ReceivedMessageSink;
import com.questrail.labsim.protocol.astm.model.AstmMessage;
import com.questrail.labsim.protocol.astm.model.AstmRecord;
import com.questrail.labsim.protocol.astm.model.OrderRecord;
import com.questrail.labsim.protocol.astm.model.PatientRecord;
import com.questrail.labsim.protocol.astm.model.ResultRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ReceivedMessageSink}: logs a one-line summary per record.
 */
public final class LoggingReceivedMessageSink implements ReceivedMessageSink
{
    private static final Logger log = LoggerFactory.getLogger(LoggingReceivedMessageSink.class);

    private static final int PREVIEW_LENGTH = 60;

    @Override
    public void onMessage(String sessionId, AstmMessage message)
    {
        log.info("[{}] Received message with {} records", sessionId, message.size());

        for (AstmRecord record : message.records()) {
            switch (record.type()) {
                case HEADER:
                    log.info("[{}] Header record: {}", sessionId, preview(record));
                    break;
                case PATIENT:
                    log.info("[{}] Patient record: ID={}", sessionId,
                            orUnknown(((PatientRecord) record).patientId()));
                    break;
                case ORDER:
                    log.info("[{}] Order record: Sample={}", sessionId,
                            orUnknown(((OrderRecord) record).specimenId()));
                    break;
                case RESULT:
                    ResultRecord r = (ResultRecord) record;
                    log.info("[{}] Result record: {} = {} {}", sessionId, r.testId(), r.value(), r.unit());
                    break;
                case QC:
                    log.info("[{}] QC record: {}", sessionId, preview(record));
                    break;
                case TERMINATOR:
                    log.debug("[{}] Message terminator received", sessionId);
                    break;
                default:
                    log.debug("[{}] Unrecognised record: {}", sessionId, preview(record));
            }
        }
    }

    private static String preview(AstmRecord record)
    {
        String text = record.text();
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static String orUnknown(String value)
    {
        return value.isEmpty() ? "Unknown" : value;
    }
}
