// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private keys and signed raw transactions</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    private static final Pattern RAW_TX =
            Pattern.compile("\"raw\"\\s*:\\s*\"0x[^\"]+\"");

    // eth_sendRawTransaction carries the signed payload as its only positional param
    private static final Pattern SEND_RAW_PARAMS =
            Pattern.compile("(?<prefix>method=eth_sendRawTransaction\\b.*?params=\\[\")0x[^\"]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY.matcher(sanitized).replaceAll("\"privateKey\":\"0x***[REDACTED]***\"");
        }

        if (sanitized.contains("\"raw\"")) {
            sanitized = RAW_TX.matcher(sanitized).replaceAll("\"raw\":\"0x***[REDACTED]***\"");
        }

        if (sanitized.contains("eth_sendRawTransaction")) {
            sanitized = SEND_RAW_PARAMS.matcher(sanitized).replaceAll("${prefix}0x***[REDACTED]***\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
