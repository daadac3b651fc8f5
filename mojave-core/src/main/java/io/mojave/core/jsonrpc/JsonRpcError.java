// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * The error member of a JSON-RPC response. Instances are produced by
 * {@link ErrorShaper} only.
 *
 * @param code    the wire code
 * @param message a short description
 * @param data    optional extra information, omitted on the wire when {@code null}
 */
public record JsonRpcError(int code, String message, @Nullable JsonNode data) {}
