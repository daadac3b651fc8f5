// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.error;

/**
 * Base runtime exception for all Mojave RPC failures.
 *
 * <p>
 * This sealed class is the root of the exception hierarchy used by the
 * JSON-RPC core, so embedding services can catch every Mojave-specific error
 * with a single clause.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * MojaveException
 * └── {@link RpcException} - a failure with a JSON-RPC error kind and wire code
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class MojaveException extends RuntimeException permits RpcException {

    public MojaveException(final String message) {
        super(message);
    }

    public MojaveException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
