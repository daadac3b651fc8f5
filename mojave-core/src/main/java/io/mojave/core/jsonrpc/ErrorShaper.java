// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mojave.core.error.RpcErrorKind;
import io.mojave.core.error.RpcException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;

/**
 * Converts failures into JSON-RPC error objects.
 *
 * <p>
 * This is the only component that produces wire-level error codes. Failures are
 * mapped as follows:
 * <ul>
 * <li>{@link RpcException} - its kind, code, message and data, unchanged</li>
 * <li>{@link TimeoutException} - {@code INTERNAL_ERROR} with data
 * {@value #TIMEOUT_DATA}</li>
 * <li>anything else - an opaque {@code INTERNAL_ERROR}; the throwable's message,
 * type and stack trace never reach the wire</li>
 * </ul>
 * {@link CompletionException} and {@link ExecutionException} wrappers are
 * removed before mapping.
 *
 * @since 0.1.0
 */
public final class ErrorShaper {

    /** Error data attached to a handler timeout. */
    public static final String TIMEOUT_DATA = "handler timed out";

    private static final JsonRpcError OPAQUE_INTERNAL = new JsonRpcError(
            RpcErrorKind.INTERNAL_ERROR.code(), RpcErrorKind.INTERNAL_ERROR.defaultMessage(), null);

    private ErrorShaper() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the error for a standard kind with its default message and no data.
     *
     * @throws IllegalArgumentException for {@link RpcErrorKind#APPLICATION}, which has no fixed code
     */
    public static JsonRpcError shape(final RpcErrorKind kind) {
        if (kind == RpcErrorKind.APPLICATION) {
            throw new IllegalArgumentException("application errors need an explicit code");
        }
        return new JsonRpcError(kind.code(), kind.defaultMessage(), null);
    }

    public static JsonRpcError shape(final RpcException exception) {
        final JsonNode data;
        try {
            data = exception.data() == null ? null : JsonRpcCodec.toNode(exception.data());
        } catch (IllegalArgumentException e) {
            return OPAQUE_INTERNAL;
        }
        final String message = exception.getMessage() == null
                ? exception.kind().defaultMessage()
                : exception.getMessage();
        return new JsonRpcError(exception.code(), message, data);
    }

    public static JsonRpcError shape(final Throwable failure) {
        final Throwable cause = unwrap(failure);
        if (cause instanceof RpcException) {
            return shape((RpcException) cause);
        }
        if (cause instanceof TimeoutException) {
            return timeout();
        }
        return OPAQUE_INTERNAL;
    }

    public static JsonRpcError timeout() {
        return new JsonRpcError(
                RpcErrorKind.INTERNAL_ERROR.code(),
                RpcErrorKind.INTERNAL_ERROR.defaultMessage(),
                TextNode.valueOf(TIMEOUT_DATA));
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(final Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Checks whether a failure escaped a handler's declared error type.
     */
    public static boolean isUnexpected(final @Nullable Throwable failure) {
        if (failure == null) {
            return false;
        }
        final Throwable cause = unwrap(failure);
        return !(cause instanceof RpcException) && !(cause instanceof TimeoutException);
    }

    public static boolean isTimeout(final @Nullable Throwable failure) {
        return failure != null && unwrap(failure) instanceof TimeoutException;
    }
}
