// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.smelt.debug");

    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        SmeltDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logBlock("should not appear");
        DebugLogger.logReceipts("should not appear");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void categoriesAreIndependent() {
        SmeltDebug.setReceiptLogging(true);

        DebugLogger.logBlock("block line");
        DebugLogger.logReceipts("receipts line");

        assertEquals(1, appender.list.size());
        assertEquals("receipts line", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void formatsArguments() {
        SmeltDebug.setBlockLogging(true);

        DebugLogger.logBlock("number=%d", 42L);

        assertEquals("number=42", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        SmeltDebug.setEnabled(true);
        DebugLogger.log("encoded 0x" + "00".repeat(200));

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("...(184 bytes)..."));
    }
}
