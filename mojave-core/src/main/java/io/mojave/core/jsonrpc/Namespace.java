// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import java.util.Objects;
import java.util.Optional;

/**
 * The prefix of a method name before its first {@code _}, used to route
 * unregistered methods to a fallback handler.
 *
 * <p>
 * {@code eth_chainId} belongs to namespace {@code eth}. A method without an
 * underscore, or starting with one, has no namespace and is never eligible for
 * a fallback.
 *
 * @param name the namespace name, non-empty and free of underscores
 * @since 0.1.0
 */
public record Namespace(String name) {

    public static final Namespace DEBUG = new Namespace("debug");
    public static final Namespace ETH = new Namespace("eth");
    public static final Namespace MOJ = new Namespace("moj");
    public static final Namespace NET = new Namespace("net");
    public static final Namespace TXPOOL = new Namespace("txpool");
    public static final Namespace WEB3 = new Namespace("web3");

    private static final char SEPARATOR = '_';

    public Namespace {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("namespace must not be empty");
        }
        if (name.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("namespace must not contain '_': " + name);
        }
    }

    /**
     * Derives the namespace of a method name.
     *
     * @param method the method name
     * @return the namespace, or empty if the method has no non-empty prefix before {@code _}
     */
    public static Optional<Namespace> of(final String method) {
        if (method == null) {
            return Optional.empty();
        }
        final int separator = method.indexOf(SEPARATOR);
        if (separator <= 0) {
            return Optional.empty();
        }
        return Optional.of(new Namespace(method.substring(0, separator)));
    }

    @Override
    public String toString() {
        return name;
    }
}
