package engine.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import engine.config.EngineConfig;
import engine.model.ProbeRequest;
import engine.model.ProbeResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты StandardHttpClient против локального HttpServer из JDK.
 */
class StandardHttpClientTest {

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hello", exchange -> {
            exchange.getResponseHeaders().add("X-Test", "yes");
            respond(exchange, 200, "hi " + exchange.getRequestHeaders().getFirst("X-Custom"));
        });
        server.createContext("/echo", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            respond(exchange, 200, exchange.getRequestMethod() + ":" + body);
        });
        server.createContext("/redirect", exchange -> redirect(exchange, 302, "/hello"));
        server.createContext("/post-redirect", exchange -> redirect(exchange, 302, "/echo"));
        server.createContext("/loop", exchange -> redirect(exchange, 307, "/loop"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static void redirect(HttpExchange exchange, int status, String location) throws IOException {
        exchange.getRequestBody().readAllBytes();
        exchange.getResponseHeaders().add("Location", location);
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    private static StandardHttpClient client(boolean followRedirects, int maxRedirects) {
        return new StandardHttpClient(HttpClientConfig.builder()
            .connectTimeout(Duration.ofSeconds(2))
            .readTimeout(Duration.ofSeconds(5))
            .followRedirects(followRedirects)
            .maxRedirects(maxRedirects)
            .addDefaultHeader("X-Custom", "default")
            .build());
    }

    @Test
    void testGetCapturesStatusHeadersAndBody() throws Exception {
        ProbeResponse response = client(true, 5).execute(ProbeRequest.builder()
            .url(baseUrl + "/hello")
            .addHeader("X-Custom", "override")
            .addHeader("Host", "ignored.example")
            .build());

        assertEquals(200, response.getStatusCode());
        assertEquals("hi override", response.getBodyAsString());
        assertEquals("yes", response.getHeader("x-test").orElseThrow());
        assertTrue(response.getResponseTime().toNanos() > 0);
    }

    @Test
    void testDefaultHeadersAreSent() throws Exception {
        ProbeResponse response = client(true, 5).execute(ProbeRequest.builder().url(baseUrl + "/hello").build());

        assertEquals("hi default", response.getBodyAsString());
    }

    @Test
    void testPostBody() throws Exception {
        ProbeResponse response = client(true, 5).execute(ProbeRequest.builder()
            .url(baseUrl + "/echo").method("post").body("payload").build());

        assertEquals("POST:payload", response.getBodyAsString());
    }

    @Test
    void testRedirectIsFollowed() throws Exception {
        ProbeResponse response = client(true, 5).execute(ProbeRequest.builder().url(baseUrl + "/redirect").build());

        assertEquals(200, response.getStatusCode());
        assertTrue(response.getBodyAsString().startsWith("hi"));
    }

    @Test
    void testRedirectNotFollowedWhenDisabled() throws Exception {
        ProbeResponse response = client(false, 5).execute(ProbeRequest.builder().url(baseUrl + "/redirect").build());

        assertEquals(302, response.getStatusCode());
        assertEquals("/hello", response.getHeader("Location").orElseThrow());
    }

    @Test
    void testPostRedirectBecomesGet() throws Exception {
        ProbeResponse response = client(true, 5).execute(ProbeRequest.builder()
            .url(baseUrl + "/post-redirect").method("POST").body("data").build());

        assertEquals("GET:", response.getBodyAsString());
    }

    @Test
    void testRedirectLimitReturnsLastRedirect() throws Exception {
        ProbeResponse response = client(true, 2).execute(ProbeRequest.builder().url(baseUrl + "/loop").build());

        assertEquals(307, response.getStatusCode());
    }

    @Test
    void testMalformedUrlFails() {
        IOException error = assertThrows(IOException.class,
            () -> client(true, 5).execute(ProbeRequest.builder().url("http://host/{{BaseURL}} x").build()));

        assertTrue(error.getMessage().startsWith("Malformed URL"));
    }

    @Test
    void testRefusedConnectionIsConnectionLevel() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        String url = "http://127.0.0.1:" + port + "/";

        IOException error = assertThrows(IOException.class,
            () -> client(true, 5).execute(ProbeRequest.builder().url(url).build()));

        assertTrue(ConnectionErrors.isConnectionLevel(error));
    }

    @Test
    void testSupportsHttpSchemesOnly() {
        HttpClient client = HttpClientFactory.createClient(EngineConfig.NetworkSettings.builder().build());

        assertTrue(client instanceof StandardHttpClient);
        assertTrue(client.supports("http://example.com"));
        assertTrue(client.supports("https://example.com"));
        assertFalse(client.supports("ftp://example.com"));
        client.close();
    }
}
