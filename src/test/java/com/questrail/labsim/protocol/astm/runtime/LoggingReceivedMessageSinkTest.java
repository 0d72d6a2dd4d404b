package com.questrail.labsim.protocol.astm.runtime;

import com.questrail.labsim.protocol.astm.model.AstmMessage;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class LoggingReceivedMessageSinkTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingReceivedMessageSink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void logsOneLinePerRecord() {
        AstmMessage message = AstmMessage.parse(
                "H|\\^&|||Sysmex^XN-1000^V1.0|||||||LIS2-A2\r"
                        + "P|1||PAT-42\r"
                        + "O|1|SAMPLE-7\r"
                        + "R|1|^^^WBC|5.8|10^3/uL\r"
                        + "L|1|N");

        new LoggingReceivedMessageSink().onMessage("astm-1", message);

        List<String> lines = messages();
        assertTrue(lines.contains("[astm-1] Received message with 5 records"), lines::toString);
        assertTrue(lines.contains("[astm-1] Patient record: ID=PAT-42"), lines::toString);
        assertTrue(lines.contains("[astm-1] Order record: Sample=SAMPLE-7"), lines::toString);
        assertTrue(lines.contains("[astm-1] Result record: ^^^WBC = 5.8 10^3/uL"), lines::toString);
    }

    @Test
    void missingIdsReadAsUnknownAndLongRecordsAreTruncated() {
        String longComment = "Q|1|" + "x".repeat(100);
        AstmMessage message = AstmMessage.parse("P|1\rO|1\r" + longComment);

        new LoggingReceivedMessageSink().onMessage("s", message);

        List<String> lines = messages();
        assertTrue(lines.contains("[s] Patient record: ID=Unknown"), lines::toString);
        assertTrue(lines.contains("[s] Order record: Sample=Unknown"), lines::toString);
        assertTrue(lines.contains("[s] QC record: " + longComment.substring(0, 60) + "..."), lines::toString);
    }

    private List<String> messages() {
        return appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }
}
