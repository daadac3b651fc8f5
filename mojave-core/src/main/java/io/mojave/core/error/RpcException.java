// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.error;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Exception carrying a JSON-RPC error: its {@link RpcErrorKind}, wire code,
 * message and optional data.
 *
 * <p>
 * Handlers report expected failures by completing their future exceptionally
 * (or throwing) with an {@code RpcException}. The message and data are sent to
 * the client unchanged, so they must not contain internal details. Any other
 * throwable that escapes a handler is treated as an unexpected fault and
 * replaced by an opaque internal error.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * throw RpcException.invalidParams("expected a block number");
 * throw RpcException.application(-32010, "insufficient balance", Map.of("needed", "0x10"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class RpcException extends MojaveException {

    private final RpcErrorKind kind;
    private final int code;
    private final @Nullable Object data;

    private RpcException(
            final RpcErrorKind kind,
            final int code,
            final String message,
            final @Nullable Object data,
            final @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.data = data;
    }

    /**
     * Creates an exception of a standard kind.
     *
     * @throws IllegalArgumentException if {@code kind} is {@link RpcErrorKind#APPLICATION};
     *                                  use {@link #application(int, String, Object)} instead
     */
    public static RpcException of(
            final RpcErrorKind kind, final @Nullable String message, final @Nullable Object data) {
        Objects.requireNonNull(kind, "kind");
        if (kind == RpcErrorKind.APPLICATION) {
            throw new IllegalArgumentException("application errors need an explicit code");
        }
        return new RpcException(kind, kind.code(), messageOrDefault(message, kind), data, null);
    }

    public static RpcException parseError() {
        return of(RpcErrorKind.PARSE_ERROR, null, null);
    }

    public static RpcException parseError(final Throwable cause) {
        return new RpcException(
                RpcErrorKind.PARSE_ERROR,
                RpcErrorKind.PARSE_ERROR.code(),
                RpcErrorKind.PARSE_ERROR.defaultMessage(),
                null,
                cause);
    }

    /**
     * Creates an invalid-request error; {@code reason} travels as the error data.
     */
    public static RpcException invalidRequest(final @Nullable String reason) {
        return of(RpcErrorKind.INVALID_REQUEST, null, reason);
    }

    public static RpcException methodNotFound() {
        return of(RpcErrorKind.METHOD_NOT_FOUND, null, null);
    }

    public static RpcException invalidParams(final @Nullable String message) {
        return of(RpcErrorKind.INVALID_PARAMS, message, null);
    }

    public static RpcException invalidParams(final @Nullable String message, final Throwable cause) {
        return new RpcException(
                RpcErrorKind.INVALID_PARAMS,
                RpcErrorKind.INVALID_PARAMS.code(),
                messageOrDefault(message, RpcErrorKind.INVALID_PARAMS),
                null,
                cause);
    }

    public static RpcException internal(final @Nullable String message) {
        return of(RpcErrorKind.INTERNAL_ERROR, message, null);
    }

    public static RpcException internal(final @Nullable String message, final Throwable cause) {
        return new RpcException(
                RpcErrorKind.INTERNAL_ERROR,
                RpcErrorKind.INTERNAL_ERROR.code(),
                messageOrDefault(message, RpcErrorKind.INTERNAL_ERROR),
                null,
                cause);
    }

    /**
     * Creates a handler-defined business error.
     *
     * @param code    the wire code, at least {@link RpcErrorKind#MIN_APPLICATION_CODE}
     * @param message the message sent to the client
     * @param data    optional data sent to the client, any Jackson-serializable value
     * @throws IllegalArgumentException if {@code code} lies in the reserved range
     */
    public static RpcException application(
            final int code, final String message, final @Nullable Object data) {
        if (!RpcErrorKind.isApplicationCode(code)) {
            throw new IllegalArgumentException(
                    "application error code must be >= " + RpcErrorKind.MIN_APPLICATION_CODE + ", got: " + code);
        }
        Objects.requireNonNull(message, "message");
        return new RpcException(RpcErrorKind.APPLICATION, code, message, data, null);
    }

    /**
     * Rebuilds an exception from an error object received over the wire, for
     * example from an upstream node.
     *
     * <p>
     * Standard codes keep their kind and the received message. Codes in the
     * application range become {@link RpcErrorKind#APPLICATION}. Anything else
     * (an implementation-specific reserved code) is reported as an internal
     * error that keeps the received message and data.
     */
    public static RpcException fromWire(
            final int code, final @Nullable String message, final @Nullable Object data) {
        final RpcErrorKind kind = RpcErrorKind.fromCode(code);
        if (kind != RpcErrorKind.APPLICATION) {
            return of(kind, message, data);
        }
        if (RpcErrorKind.isApplicationCode(code)) {
            return new RpcException(
                    RpcErrorKind.APPLICATION, code, messageOrDefault(message, kind), data, null);
        }
        return of(RpcErrorKind.INTERNAL_ERROR, message, data);
    }

    public RpcErrorKind kind() {
        return kind;
    }

    public int code() {
        return code;
    }

    public @Nullable Object data() {
        return data;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "kind="
                + kind
                + ", code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + "}";
    }

    private static String messageOrDefault(final @Nullable String message, final RpcErrorKind kind) {
        return message == null || message.isBlank() ? kind.defaultMessage() : message;
    }
}
