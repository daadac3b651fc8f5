// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.error;

/**
 * Closed taxonomy of JSON-RPC error kinds.
 *
 * <p>
 * Every error a client can observe belongs to exactly one of these kinds. The
 * five standard kinds carry a fixed code and default message from the
 * JSON-RPC 2.0 reserved range; {@link #APPLICATION} covers handler-specific
 * business errors whose code is supplied by the handler.
 *
 * <table border="1">
 * <tr><th>Kind</th><th>Code</th><th>Trigger</th></tr>
 * <tr><td>PARSE_ERROR</td><td>-32700</td><td>body is not valid JSON</td></tr>
 * <tr><td>INVALID_REQUEST</td><td>-32600</td><td>JSON that is not a well-formed request or batch</td></tr>
 * <tr><td>METHOD_NOT_FOUND</td><td>-32601</td><td>no exact or fallback handler</td></tr>
 * <tr><td>INVALID_PARAMS</td><td>-32602</td><td>handler rejected its inputs</td></tr>
 * <tr><td>INTERNAL_ERROR</td><td>-32603</td><td>handler failure, timeout or unexpected fault</td></tr>
 * <tr><td>APPLICATION</td><td>&ge; -32000</td><td>handler-defined business error</td></tr>
 * </table>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public enum RpcErrorKind {
    PARSE_ERROR(-32700, "Parse error"),
    INVALID_REQUEST(-32600, "Invalid Request"),
    METHOD_NOT_FOUND(-32601, "Method not found"),
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL_ERROR(-32603, "Internal error"),
    APPLICATION(-32000, "Server error");

    /** Lowest code a handler may use for an application error. */
    public static final int MIN_APPLICATION_CODE = -32000;

    private final int code;
    private final String defaultMessage;

    RpcErrorKind(final int code, final String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    /**
     * Returns the wire code of this kind. For {@link #APPLICATION} this is only
     * the default; the actual code travels with the exception.
     */
    public int code() {
        return code;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /**
     * Returns the standard kind registered for a wire code, or {@link #APPLICATION}
     * when the code is not one of the five reserved codes.
     */
    public static RpcErrorKind fromCode(final int code) {
        for (RpcErrorKind kind : values()) {
            if (kind != APPLICATION && kind.code == code) {
                return kind;
            }
        }
        return APPLICATION;
    }

    /**
     * Checks whether a handler may report {@code code} as an application error.
     */
    public static boolean isApplicationCode(final int code) {
        return code >= MIN_APPLICATION_CODE;
    }
}
