// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sluice.core.error.RpcException;
import io.sluice.rpc.internal.RpcUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpRpcTransportTest {

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void sendSuccessResponse() {
        server.createContext("/", exchange -> respond(exchange, 200, """
                {"jsonrpc":"2.0","result":{"context":{"slot":1},"value":5000},"id":1}
                """));

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl).build();
        final JsonRpcResponse response = transport.send("getBalance", List.of("addr"));

        assertNull(response.error());
        assertEquals(5000, response.resultAsMap().get("value"));
        assertEquals("1", response.id());
    }

    @Test
    void sendsJsonRpcEnvelopeAndHeaders() throws Exception {
        final AtomicReference<String> body = new AtomicReference<>();
        final AtomicReference<String> apiKey = new AtomicReference<>();
        server.createContext("/", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
            respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":null,\"id\":1}");
        });

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl)
                .header("X-Api-Key", "k1")
                .readTimeout(Duration.ofSeconds(5))
                .build();
        transport.send("getVersion", List.of());

        final Map<?, ?> sent = RpcUtils.MAPPER.readValue(body.get(), Map.class);
        assertEquals("2.0", sent.get("jsonrpc"));
        assertEquals("getVersion", sent.get("method"));
        assertEquals(List.of(), sent.get("params"));
        assertInstanceOf(Number.class, sent.get("id"));
        assertEquals("k1", apiKey.get());
    }

    @Test
    void defaultTransportUsesStandardTimeouts() {
        server.createContext("/", exchange -> respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":7,\"id\":1}"));

        final RpcTransport transport = RpcTransport.http(baseUrl);
        final RpcConfig config = assertInstanceOf(HttpRpcTransport.class, transport).config();

        assertEquals(baseUrl, config.url());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertTrue(config.headers().isEmpty());
        assertEquals(7, transport.send("getSlot", List.of()).result());
    }

    @Test
    void builderSettingsReachConfig() {
        final HttpRpcTransport transport = HttpRpcTransport.builder(baseUrl)
                .connectTimeout(Duration.ofSeconds(3))
                .readTimeout(Duration.ofSeconds(4))
                .header("X-Api-Key", "k1")
                .build();

        assertEquals(Duration.ofSeconds(3), transport.config().connectTimeout());
        assertEquals(Duration.ofSeconds(4), transport.config().readTimeout());
        assertEquals(Map.of("X-Api-Key", "k1"), transport.config().headers());
    }

    @Test
    void jsonRpcErrorThrows() {
        server.createContext("/", exchange -> respond(exchange, 200, """
                {"jsonrpc":"2.0","error":{"code":-32005,"message":"Node is behind","data":"slot 10"},"id":1}
                """));

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl).build();
        final RpcException ex = assertThrows(RpcException.class, () -> transport.send("getSlot", List.of()));

        assertEquals(-32005, ex.code());
        assertEquals("slot 10", ex.data());
        assertTrue(ex.getMessage().contains("Node is behind"));
        assertTrue(ex.isRateLimited());
    }

    @Test
    void httpStatusThrowsWithStatus() {
        server.createContext("/", exchange -> respond(exchange, 429, "Too Many Requests"));

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl).build();
        final RpcException ex = assertThrows(RpcException.class, () -> transport.send("getSlot", List.of()));

        assertEquals(429, ex.httpStatus());
        assertEquals(RpcException.HTTP_ERROR, ex.code());
        assertEquals("Too Many Requests", ex.data());
        assertTrue(ex.isRateLimited());
    }

    @Test
    void serverErrorIsFlagged() {
        server.createContext("/", exchange -> respond(exchange, 503, "unavailable"));

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl).build();
        final RpcException ex = assertThrows(RpcException.class, () -> transport.send("getSlot", List.of()));

        assertTrue(ex.isServerError());
    }

    @Test
    void malformedJsonThrowsParseError() {
        server.createContext("/", exchange -> respond(exchange, 200, "not json"));

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl).build();
        final RpcException ex = assertThrows(RpcException.class, () -> transport.send("getSlot", List.of()));

        assertEquals(RpcException.PARSE_ERROR, ex.code());
    }

    @Test
    void connectionFailureCarriesIoCause() {
        server.stop(0);

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        final RpcException ex = assertThrows(RpcException.class, () -> transport.send("getSlot", List.of()));

        assertEquals(RpcException.NETWORK_ERROR, ex.code());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void requestIdsIncrease() {
        final AtomicReference<String> last = new AtomicReference<>();
        server.createContext("/", exchange -> {
            last.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"result\":1,\"id\":1}");
        });

        final RpcTransport transport = HttpRpcTransport.builder(baseUrl).build();
        transport.send("getSlot", List.of());
        transport.send("getSlot", List.of());

        assertTrue(last.get().contains("\"id\":2"));
    }

    private static void respond(final HttpExchange exchange, final int status, final String body) throws IOException {
        exchange.getRequestBody().readAllBytes();
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
