// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import io.mojave.core.jsonrpc.Namespace;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link RpcRegistry#lookup(String)}.
 *
 * @param <C> the context type
 */
public sealed interface Resolution<C> permits Resolution.Exact, Resolution.Fallback, Resolution.NotFound {

    /**
     * Returns the resolved handler, or empty for {@link NotFound}.
     */
    Optional<RpcHandler<C>> handler();

    /** A handler registered under the exact method name. */
    record Exact<C>(String method, RpcHandler<C> target) implements Resolution<C> {
        public Exact {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Optional<RpcHandler<C>> handler() {
            return Optional.of(target);
        }
    }

    /** The fallback registered for the method's namespace. */
    record Fallback<C>(Namespace namespace, RpcHandler<C> target) implements Resolution<C> {
        public Fallback {
            Objects.requireNonNull(namespace, "namespace");
            Objects.requireNonNull(target, "target");
        }

        @Override
        public Optional<RpcHandler<C>> handler() {
            return Optional.of(target);
        }
    }

    /** Neither an exact handler nor a namespace fallback. */
    record NotFound<C>(@Nullable String method) implements Resolution<C> {
        @Override
        public Optional<RpcHandler<C>> handler() {
            return Optional.empty();
        }
    }
}
