// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core;

import java.util.Locale;

/**
 * One-line formatters for RPC debug logs.
 *
 * <p>
 * All formats use a bracketed operation tag and a human-readable duration:
 *
 * <pre>{@code
 * [RPC] method=moj_getProof id=7 params=["0x01"]
 * ✓ [RPC-RESULT] method=moj_getProof duration=1.06ms
 * ✗ [RPC-ERROR] method=eth_call code=-32000 message=execution reverted duration=1.50ms
 * [FORWARD] method=eth_chainId duration=12.40ms
 * }</pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=eth_chainId id=1 params=[]
     */
    public static String formatDispatch(final String method, final Object id, final Object params) {
        return String.format("[RPC] method=%s id=%s params=%s", method, id, params);
    }

    /**
     * Format: ✓ [RPC-RESULT] method=eth_chainId duration=1.06ms
     */
    public static String formatResult(final String method, final long durationMicros) {
        return String.format("✓ [RPC-RESULT] method=%s %s", method, duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=eth_call code=-32000 message=error duration=1.50ms
     */
    public static String formatRpcError(
            final String method, final Object code, final String message, final long durationMicros) {
        return String.format(
                "✗ [RPC-ERROR] method=%s code=%s message=%s %s",
                method, code, message, duration(durationMicros));
    }

    /**
     * Format: [FORWARD] method=eth_chainId duration=12.40ms
     */
    public static String formatForward(final String method, final long durationMicros) {
        return String.format("[FORWARD] method=%s %s", method, duration(durationMicros));
    }

    private static String duration(final long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return "duration=" + formatted;
    }
}
