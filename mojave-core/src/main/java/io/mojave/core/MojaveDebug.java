// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core;

/**
 * Global toggle for verbose per-request RPC logging.
 */
public final class MojaveDebug {

    private static volatile boolean rpcLogging = false;

    private MojaveDebug() {
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }
}
