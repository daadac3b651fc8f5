// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import io.mojave.core.jsonrpc.Namespace;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from method names to handlers, plus one fallback handler
 * per {@link Namespace}.
 *
 * <p>
 * Resolution order for {@link #lookup(String)}:
 * <ol>
 * <li>exact match on the method name</li>
 * <li>fallback registered for the method's namespace (prefix before the first {@code _})</li>
 * <li>{@link Resolution.NotFound}</li>
 * </ol>
 * An exact registration always wins over a fallback, whatever the registration
 * order, so a service can override a few methods of a namespace it otherwise
 * forwards wholesale.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * RpcRegistry<SequencerContext> registry = RpcRegistry.<SequencerContext>builder()
 *         .register("moj_getPendingJobIds", pendingJobs)
 *         .register("eth_sendRawTransaction", submitToMempool)
 *         .registerFallback(Namespace.ETH, UpstreamForwarder.builder(rpcUrl).build())
 *         .build();
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> a built registry is immutable; lookups are
 * safe from any number of threads without locking. The {@link Builder} is not
 * thread-safe.
 *
 * @param <C> the context type passed to handlers
 * @since 0.1.0
 */
public final class RpcRegistry<C> {

    private static final Logger log = LoggerFactory.getLogger(RpcRegistry.class);

    private final Map<String, RpcHandler<C>> handlers;
    private final Map<Namespace, RpcHandler<C>> fallbacks;

    private RpcRegistry(final Map<String, RpcHandler<C>> handlers, final Map<Namespace, RpcHandler<C>> fallbacks) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        this.fallbacks = Collections.unmodifiableMap(new LinkedHashMap<>(fallbacks));
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    /**
     * Resolves a method name to a handler.
     *
     * @param method the method name
     * @return {@link Resolution.Exact}, {@link Resolution.Fallback} or {@link Resolution.NotFound}
     */
    public Resolution<C> lookup(final String method) {
        if (method == null) {
            return new Resolution.NotFound<>(null);
        }
        final RpcHandler<C> exact = handlers.get(method);
        if (exact != null) {
            return new Resolution.Exact<>(method, exact);
        }
        final Optional<Namespace> namespace = Namespace.of(method);
        if (namespace.isPresent()) {
            final RpcHandler<C> fallback = fallbacks.get(namespace.get());
            if (fallback != null) {
                return new Resolution.Fallback<>(namespace.get(), fallback);
            }
        }
        return new Resolution.NotFound<>(method);
    }

    /**
     * Returns the exactly registered method names, in registration order.
     */
    public Set<String> methods() {
        return handlers.keySet();
    }

    /**
     * Returns the namespaces that have a fallback, in registration order.
     */
    public Set<Namespace> namespaces() {
        return fallbacks.keySet();
    }

    @Override
    public String toString() {
        return "RpcRegistry{methods=" + handlers.keySet() + ", fallbacks=" + fallbacks.keySet() + "}";
    }

    /**
     * Collects registrations before the registry is built. Registering a method or
     * namespace twice replaces the earlier handler.
     *
     * @param <C> the context type passed to handlers
     */
    public static final class Builder<C> {
        private final Map<String, RpcHandler<C>> handlers = new LinkedHashMap<>();
        private final Map<Namespace, RpcHandler<C>> fallbacks = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a handler for an exact method name.
         *
         * @throws IllegalArgumentException if {@code method} is empty
         * @throws NullPointerException     if {@code method} or {@code handler} is null
         */
        public Builder<C> register(final String method, final RpcHandler<C> handler) {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(handler, "handler");
            if (method.isEmpty()) {
                throw new IllegalArgumentException("method must not be empty");
            }
            if (handlers.put(method, handler) != null) {
                log.debug("Replacing handler for method {}", method);
            }
            return this;
        }

        /**
         * Registers the fallback for every unregistered method of a namespace.
         *
         * @throws NullPointerException if {@code namespace} or {@code handler} is null
         */
        public Builder<C> registerFallback(final Namespace namespace, final RpcHandler<C> handler) {
            Objects.requireNonNull(namespace, "namespace");
            Objects.requireNonNull(handler, "handler");
            if (fallbacks.put(namespace, handler) != null) {
                log.debug("Replacing fallback for namespace {}", namespace);
            }
            return this;
        }

        /**
         * Registers a fallback by namespace name.
         *
         * @throws IllegalArgumentException if {@code namespace} is empty or contains {@code _}
         */
        public Builder<C> registerFallback(final String namespace, final RpcHandler<C> handler) {
            return registerFallback(new Namespace(namespace), handler);
        }

        public RpcRegistry<C> build() {
            log.debug("Built RPC registry with {} methods and {} fallbacks", handlers.size(), fallbacks.size());
            return new RpcRegistry<>(handlers, fallbacks);
        }
    }
}
