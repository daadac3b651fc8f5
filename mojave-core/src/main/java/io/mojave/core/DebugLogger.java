// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized verbose logger for RPC traffic.
 *
 * <p>
 * Messages are emitted only when {@link MojaveDebug#isRpcLoggingEnabled()} is
 * set, and always pass through {@link LogSanitizer} since they may contain
 * request params.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.mojave.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!MojaveDebug.isRpcLoggingEnabled()) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
