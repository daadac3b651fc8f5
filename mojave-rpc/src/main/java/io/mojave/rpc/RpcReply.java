// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * What a transport should send back for one submitted body.
 *
 * <p>
 * {@link #body()} is empty when every request in the submission was a
 * notification. {@link #malformed()} is set when the body could not be read as
 * a JSON-RPC request or batch at all (invalid JSON, or a JSON scalar); an HTTP
 * binding answers those with a 4xx status. Every other outcome, including
 * JSON-RPC errors, is ordinary traffic.
 *
 * @since 0.1.0
 */
public final class RpcReply {

    private static final RpcReply NONE = new RpcReply(null, false);

    private final byte @Nullable [] body;
    private final boolean malformed;

    private RpcReply(final byte @Nullable [] body, final boolean malformed) {
        this.body = body;
        this.malformed = malformed;
    }

    /**
     * Returns the reply for an all-notification submission.
     */
    public static RpcReply none() {
        return NONE;
    }

    public static RpcReply of(final byte[] body) {
        return new RpcReply(Objects.requireNonNull(body, "body"), false);
    }

    public static RpcReply malformed(final byte[] body) {
        return new RpcReply(Objects.requireNonNull(body, "body"), true);
    }

    /**
     * Returns a copy of the response body, or empty if nothing should be sent.
     */
    public Optional<byte[]> body() {
        return body == null ? Optional.empty() : Optional.of(body.clone());
    }

    /**
     * Returns the response body as UTF-8 text, or empty if nothing should be sent.
     */
    public Optional<String> bodyAsString() {
        return body == null ? Optional.empty() : Optional.of(new String(body, StandardCharsets.UTF_8));
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean malformed() {
        return malformed;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RpcReply)) {
            return false;
        }
        final RpcReply other = (RpcReply) o;
        return malformed == other.malformed && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(body) + Boolean.hashCode(malformed);
    }

    @Override
    public String toString() {
        return "RpcReply{body=" + bodyAsString().orElse("<none>") + ", malformed=" + malformed + "}";
    }
}
