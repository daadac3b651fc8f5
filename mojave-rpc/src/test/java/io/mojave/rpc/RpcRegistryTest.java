// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mojave.core.jsonrpc.Namespace;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RpcRegistryTest {

    private final RpcHandler<String> chainId = RpcHandler.sync((request, ctx) -> "0x1");
    private final RpcHandler<String> forward = RpcHandler.sync((request, ctx) -> "forwarded");

    @Test
    void exactMatch() {
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .register("eth_chainId", chainId)
                .build();

        Resolution<String> resolution = registry.lookup("eth_chainId");
        Resolution.Exact<String> exact = assertInstanceOf(Resolution.Exact.class, resolution);
        assertSame(chainId, exact.target());
        assertSame(chainId, resolution.handler().orElseThrow());
    }

    @Test
    void exactBeatsFallbackWhateverTheOrder() {
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .registerFallback(Namespace.ETH, forward)
                .register("eth_chainId", chainId)
                .build();

        assertSame(chainId, registry.lookup("eth_chainId").handler().orElseThrow());
        assertSame(forward, registry.lookup("eth_getBalance").handler().orElseThrow());

        RpcRegistry<String> reversed = RpcRegistry.<String>builder()
                .register("eth_chainId", chainId)
                .registerFallback(Namespace.ETH, forward)
                .build();

        assertInstanceOf(Resolution.Exact.class, reversed.lookup("eth_chainId"));
        assertSame(chainId, reversed.lookup("eth_chainId").handler().orElseThrow());
        assertSame(forward, reversed.lookup("eth_getBalance").handler().orElseThrow());
    }

    @Test
    void fallbackReportsNamespace() {
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .registerFallback("eth", forward)
                .build();

        Resolution.Fallback<String> fallback =
                assertInstanceOf(Resolution.Fallback.class, registry.lookup("eth_blockNumber"));
        assertEquals(Namespace.ETH, fallback.namespace());
    }

    @Test
    void methodsWithoutNamespaceNeverFallBack() {
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .registerFallback(Namespace.ETH, forward)
                .build();

        assertInstanceOf(Resolution.NotFound.class, registry.lookup("eth"));
        assertInstanceOf(Resolution.NotFound.class, registry.lookup("_eth_call"));
        assertInstanceOf(Resolution.NotFound.class, registry.lookup("debug_traceCall"));
        assertTrue(registry.lookup("ping").handler().isEmpty());
    }

    @Test
    void lastRegistrationWins() {
        RpcHandler<String> replacement = RpcHandler.sync((request, ctx) -> "0x2");
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .register("eth_chainId", chainId)
                .register("eth_chainId", replacement)
                .build();

        assertSame(replacement, registry.lookup("eth_chainId").handler().orElseThrow());
    }

    @Test
    void rejectsInvalidRegistrations() {
        RpcRegistry.Builder<String> builder = RpcRegistry.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.register("", chainId));
        assertThrows(NullPointerException.class, () -> builder.register(null, chainId));
        assertThrows(NullPointerException.class, () -> builder.register("eth_chainId", null));
        assertThrows(IllegalArgumentException.class, () -> builder.registerFallback("", forward));
        assertThrows(IllegalArgumentException.class, () -> builder.registerFallback("eth_", forward));
        assertThrows(NullPointerException.class, () -> builder.registerFallback(Namespace.ETH, null));
    }

    @Test
    void builtRegistryIsImmutable() {
        RpcRegistry.Builder<String> builder = RpcRegistry.<String>builder().register("a", chainId);
        RpcRegistry<String> registry = builder.build();
        builder.register("b", chainId);

        assertEquals(Set.of("a"), registry.methods());
        assertThrows(UnsupportedOperationException.class, () -> registry.methods().add("c"));
    }

    @Test
    void exposesDiagnostics() {
        RpcRegistry<String> registry = RpcRegistry.<String>builder()
                .register("moj_b", chainId)
                .register("moj_a", chainId)
                .registerFallback(Namespace.ETH, forward)
                .registerFallback(Namespace.NET, forward)
                .build();

        assertEquals(List.of("moj_b", "moj_a"), List.copyOf(registry.methods()));
        assertEquals(List.of(Namespace.ETH, Namespace.NET), List.copyOf(registry.namespaces()));
    }
}
