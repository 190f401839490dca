// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.sun.net.httpserver.HttpServer;
import io.sluice.rpc.reader.RawGenesis;
import io.sluice.rpc.reader.UserRecord;
import io.sluice.rpc.reader.UserTransactionReader;
import io.sluice.rpc.scheduler.RateConfig;
import io.sluice.rpc.scheduler.RetryConfig;
import org.junit.jupiter.api.Test;

class SluiceTest {

    @Test
    void buildWithoutEndpointFails() {
        assertThrows(IllegalStateException.class, () -> Sluice.builder().build());
    }

    @Test
    void readerAndClientShareOneScheduler() throws Exception {
        final RpcTransport transport = mock(RpcTransport.class);
        when(transport.send("getVersion", List.of()))
                .thenReturn(new JsonRpcResponse("2.0", Map.of("solana-core", "1.18.22"), null, "1"));

        try (Sluice sluice = Sluice.builder()
                .transport(transport)
                .rateConfig(new RateConfig(0, 2, 1.0))
                .retryConfig(new RetryConfig(1, 1, 5))
                .build()) {
            final UserTransactionReader reader = sluice.userTransactionReader(tx -> CompletableFuture.completedFuture(
                    Optional.of(new RawGenesis(null, null, null, "carol", null, null, Map.of()))));

            final UserRecord record = reader.fetchUserData("tx1").get(5, TimeUnit.SECONDS).orElseThrow();
            assertTrue(sluice.rpc().testConnection().get(5, TimeUnit.SECONDS));

            assertEquals("carol", record.alias());
            assertEquals(2, sluice.scheduler().getStats().totalRequests());
            assertSame(transport, sluice.transport());
        }
        verify(transport, never()).close();
    }

    @Test
    void closeRejectsFurtherCalls() {
        final Sluice sluice = Sluice.builder().transport(mock(RpcTransport.class)).build();
        sluice.close();

        final ExecutionException ex = assertThrows(
                ExecutionException.class, () -> sluice.rpc().getVersion().get(5, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, ex.getCause());
    }

    @Test
    void rpcUrlBuildsHttpTransport() throws Exception {
        final HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            exchange.getRequestBody().readAllBytes();
            final byte[] bytes = "{\"jsonrpc\":\"2.0\",\"result\":{\"solana-core\":\"1.18.22\",\"feature-set\":7},\"id\":1}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        try (Sluice sluice = Sluice.builder()
                .rpcUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .readTimeout(Duration.ofSeconds(5))
                .header("X-Client", "sluice-test")
                .build()) {
            assertInstanceOf(HttpRpcTransport.class, sluice.transport());
            final NodeVersion version = sluice.rpc().getVersion().get(5, TimeUnit.SECONDS);
            assertEquals("1.18.22", version.solanaCore());
            assertEquals(7L, version.featureSet());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void connectUsesHttpTransportWithDefaults() {
        try (Sluice sluice = Sluice.connect(Sluice.DEVNET_URL)) {
            final HttpRpcTransport transport = assertInstanceOf(HttpRpcTransport.class, sluice.transport());
            assertEquals(Sluice.DEVNET_URL, transport.config().url());
            assertEquals(RateConfig.defaults(), sluice.scheduler().getRateConfig());
            assertEquals(RetryConfig.defaults(), sluice.scheduler().getRetryConfig());
        }
    }

    @Test
    void devnetConstant() {
        assertEquals("https://api.devnet.solana.com", Sluice.DEVNET_URL);
    }
}
