// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core;

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

    private final Logger logger = (Logger) LoggerFactory.getLogger("io.mojave.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        MojaveDebug.setRpcLogging(false);
        logger.detachAppender(appender);
    }

    @Test
    void silentWhenDisabled() {
        DebugLogger.logRpc("should not appear");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        MojaveDebug.setRpcLogging(true);
        DebugLogger.logRpc("payload %s", "{\"privateKey\":\"0x123\"}");

        assertEquals(1, appender.list.size());
        assertEquals("payload {\"privateKey\":\"0x***[REDACTED]***\"}", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void messageWithoutArgsIsNotFormatted() {
        MojaveDebug.setRpcLogging(true);
        DebugLogger.logRpc("[RPC] method=x params=[\"100%\"]");

        assertEquals("[RPC] method=x params=[\"100%\"]", appender.list.get(0).getFormattedMessage());
    }
}
