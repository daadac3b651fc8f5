// SPDX-License-Identifier: MIT OR Apache-2.0
package io.mojave.core.jsonrpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mojave.core.error.RpcErrorKind;
import io.mojave.core.error.RpcException;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class ErrorShaperTest {

    @Test
    void shapesStandardKinds() {
        JsonRpcError error = ErrorShaper.shape(RpcErrorKind.PARSE_ERROR);
        assertEquals(-32700, error.code());
        assertEquals("Parse error", error.message());
        assertNull(error.data());

        assertThrows(IllegalArgumentException.class, () -> ErrorShaper.shape(RpcErrorKind.APPLICATION));
    }

    @Test
    void keepsApplicationErrorUnchanged() {
        JsonRpcError error = ErrorShaper.shape(
                (Throwable) RpcException.application(-32010, "insufficient balance", Map.of("needed", "0x10")));

        assertEquals(-32010, error.code());
        assertEquals("insufficient balance", error.message());
        assertEquals("0x10", error.data().get("needed").asText());
    }

    @Test
    void unwrapsCompletionAndExecutionExceptions() {
        Throwable wrapped = new CompletionException(new ExecutionException(RpcException.invalidParams("bad tag")));

        JsonRpcError error = ErrorShaper.shape(wrapped);
        assertEquals(-32602, error.code());
        assertEquals("bad tag", error.message());
    }

    @Test
    void timeoutBecomesInternalErrorWithData() {
        JsonRpcError error = ErrorShaper.shape(new CompletionException(new TimeoutException()));

        assertEquals(-32603, error.code());
        assertEquals("Internal error", error.message());
        assertEquals(ErrorShaper.TIMEOUT_DATA, error.data().asText());
        assertTrue(ErrorShaper.isTimeout(new CompletionException(new TimeoutException())));
    }

    @Test
    void unexpectedFaultIsOpaque() {
        JsonRpcError error = ErrorShaper.shape(new IllegalStateException("db password=hunter2"));

        assertEquals(-32603, error.code());
        assertEquals("Internal error", error.message());
        assertNull(error.data());
        assertTrue(ErrorShaper.isUnexpected(new NullPointerException()));
        assertFalse(ErrorShaper.isUnexpected(RpcException.methodNotFound()));
        assertFalse(ErrorShaper.isUnexpected(null));
    }

    @Test
    void unserializableDataIsOpaque() {
        JsonRpcError error = ErrorShaper.shape(RpcException.application(-32000, "boom", new Object()));

        assertEquals(-32603, error.code());
        assertNull(error.data());
    }
}
