// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class RpcUtilsTest {

    @Test
    void nullDataStaysNull() {
        assertNull(RpcUtils.extractErrorData(null));
    }

    @Test
    void stringDataReturnedAsIs() {
        assertEquals("slot skipped", RpcUtils.extractErrorData("slot skipped"));
    }

    @Test
    void firstNestedStringWins() {
        final Map<String, Object> data = Map.of("err", List.of(Map.of("InstructionError", "custom")));
        assertEquals("custom", RpcUtils.extractErrorData(data));
    }

    @Test
    void arraysAreSearched() {
        assertEquals("b", RpcUtils.extractErrorData(new Object[] {1, "b"}));
    }

    @Test
    void numbersFallBackToString() {
        assertEquals("42", RpcUtils.extractErrorData(42));
    }

    @Test
    void unknownPropertiesIgnored() throws Exception {
        final Map<?, ?> parsed = RpcUtils.MAPPER.readValue("{\"a\":1}", Map.class);
        assertEquals(1, parsed.get("a"));
    }
}
