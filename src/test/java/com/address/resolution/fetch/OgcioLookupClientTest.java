package com.address.resolution.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class OgcioLookupClientTest {

    private static final String BODY = "{\"SuggestedAddress\":[{\"Address\":{}}]}";

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(data);
        }
        return bytes.toByteArray();
    }

    @Nested
    @DisplayName("Request building")
    class UnitTests {

        @Test
        @DisplayName("Should URL-encode the query and pass the suggestion count")
        void testBuildUri() {
            OgcioLookupClient client = OgcioLookupClient.builder()
                    .baseUrl("https://example.test/lookup")
                    .maxSuggestions(3)
                    .build();

            URI uri = client.buildUri("香港 中環");

            assertEquals("https://example.test/lookup", uri.getScheme() + "://" + uri.getHost() + uri.getPath());
            assertEquals("q=香港 中環&n=3", URLDecoder.decode(uri.getRawQuery(), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Defaults point at the public endpoint with one suggestion")
        void testDefaults() {
            OgcioLookupClient client = OgcioLookupClient.createDefault();
            assertEquals(OgcioLookupClient.DEFAULT_BASE_URL, client.getBaseUrl());
            assertEquals(1, client.getMaxSuggestions());
        }

        @Test
        @DisplayName("Should reject a non-positive suggestion count")
        void testInvalidMaxSuggestions() {
            assertThrows(IllegalArgumentException.class, () -> OgcioLookupClient.builder().maxSuggestions(0));
        }
    }

    @Nested
    @DisplayName("Against a local stub")
    class StubServerTests {

        private HttpServer server;
        private final AtomicReference<Headers> requestHeaders = new AtomicReference<>();
        private final AtomicReference<String> requestQuery = new AtomicReference<>();
        private volatile int status = 200;
        private volatile byte[] body = BODY.getBytes(StandardCharsets.UTF_8);
        private volatile boolean gzip;

        @BeforeEach
        void startServer() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/lookup", exchange -> {
                requestHeaders.set(exchange.getRequestHeaders());
                requestQuery.set(exchange.getRequestURI().getRawQuery());
                byte[] payload = gzip ? gzip(body) : body;
                if (gzip) {
                    exchange.getResponseHeaders().add("Content-Encoding", "gzip");
                }
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(status, payload.length == 0 ? -1 : payload.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(payload);
                }
            });
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        private OgcioLookupClient client() {
            return OgcioLookupClient.builder()
                    .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/lookup")
                    .timeout(Duration.ofSeconds(5))
                    .build();
        }

        @Test
        @DisplayName("Should send the expected headers and parse the body")
        void testLookup() throws LookupException {
            JsonNode json = client().lookup("香港中環皇后大道中99號");

            assertTrue(json.get("SuggestedAddress").isArray());
            Headers headers = requestHeaders.get();
            assertEquals("application/json", headers.getFirst("Accept"));
            assertEquals("en,zh-Hant", headers.getFirst("Accept-Language"));
            assertEquals("gzip", headers.getFirst("Accept-Encoding"));
            assertEquals("q=香港中環皇后大道中99號&n=1",
                    URLDecoder.decode(requestQuery.get(), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Should decompress gzip responses")
        void testGzip() throws LookupException {
            gzip = true;
            JsonNode json = client().lookup("香港");
            assertEquals(1, json.get("SuggestedAddress").size());
        }

        @Test
        @DisplayName("Non-2xx status is a lookup failure carrying the status")
        void testErrorStatus() {
            status = 503;
            body = "busy".getBytes(StandardCharsets.UTF_8);

            LookupException e = assertThrows(LookupException.class, () -> client().lookup("香港"));
            assertEquals(503, e.getStatusCode());
        }

        @Test
        @DisplayName("Malformed JSON is a lookup failure")
        void testMalformedBody() {
            body = "{not json".getBytes(StandardCharsets.UTF_8);
            assertThrows(LookupException.class, () -> client().lookup("香港"));
        }

        @Test
        @DisplayName("Empty body is a lookup failure")
        void testEmptyBody() {
            body = new byte[0];
            assertThrows(LookupException.class, () -> client().lookup("香港"));
        }

        @Test
        @DisplayName("Connection refused is a lookup failure without status")
        void testConnectionRefused() throws IOException {
            int port;
            try (ServerSocket socket = new ServerSocket(0)) {
                port = socket.getLocalPort();
            }
            OgcioLookupClient client = OgcioLookupClient.builder()
                    .baseUrl("http://127.0.0.1:" + port + "/lookup")
                    .timeout(Duration.ofSeconds(5))
                    .build();

            LookupException e = assertThrows(LookupException.class, () -> client.lookup("香港"));
            assertEquals(-1, e.getStatusCode());
        }
    }
}
