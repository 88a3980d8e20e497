package de.bsommerfeld.reddharvest.retrieval.download;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a loopback {@link HttpServer}; the read timeout is shortened
 * so stalled transfers fail fast.
 */
class DownloaderTest {

    private static final Duration SHORT_READ_TIMEOUT = Duration.ofMillis(500);

    private HttpServer server;
    private ExecutorService serverThreads;
    private final CountDownLatch release = new CountDownLatch(1);
    private Downloader downloader;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverThreads = Executors.newCachedThreadPool();
        server.setExecutor(serverThreads);
        server.start();
        downloader = new Downloader(HttpClient.newBuilder().connectTimeout(Downloader.CONNECT_TIMEOUT).build(),
                SHORT_READ_TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
        serverThreads.shutdownNow();
    }

    private String serve(String path, HttpHandler handler) {
        server.createContext(path, handler);
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        if (contentType != null) {
            exchange.getResponseHeaders().add("Content-Type", contentType);
        }
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    // -- Success --

    @Test
    void fetchBytes_shouldReturnBodyAndReportProgress() throws IOException {
        byte[] payload = new byte[Downloader.CHUNK_SIZE * 2 + 10];
        payload[payload.length - 1] = 7;
        String url = serve("/a.png", exchange -> respond(exchange, 200, "image/png", payload));
        List<Long> progress = new ArrayList<>();

        byte[] result = downloader.fetchBytes(url, (bytesRead, totalBytes) -> progress.add(bytesRead));

        assertArrayEquals(payload, result);
        assertEquals(payload.length, progress.get(progress.size() - 1));
        assertTrue(progress.size() >= 3);
    }

    @Test
    void fetchPage_shouldDecodeWithAnnouncedCharset() throws IOException {
        String url = serve("/page", exchange -> respond(exchange, 200, "text/html; charset=ISO-8859-1",
                "café".getBytes(StandardCharsets.ISO_8859_1)));

        assertEquals("café", downloader.fetchPage(url));
    }

    // -- Failures --

    @Test
    void fetchBytes_shouldThrowIOExceptionForErrorStatus() {
        String url = serve("/missing", exchange -> respond(exchange, 404, "text/plain",
                "gone".getBytes(StandardCharsets.UTF_8)));

        IOException e = assertThrows(IOException.class, () -> downloader.fetchBytes(url));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void fetchBytes_shouldThrowIOExceptionForInvalidUrl() {
        assertThrows(IOException.class, () -> downloader.fetchBytes("not a valid url"));
    }

    @Test
    void fetchPage_shouldThrowIOExceptionForInvalidUrl() {
        assertThrows(IOException.class, () -> downloader.fetchPage("::"));
    }

    @Test
    void fetchBytes_shouldGiveUpWhenBodyStalls() {
        String url = serve("/stall.png", this::stallAfterTenBytes);

        assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(IOException.class, () -> downloader.fetchBytes(url)));
    }

    @Test
    void fetchPage_shouldGiveUpWhenBodyStalls() {
        String url = serve("/stall", this::stallAfterTenBytes);

        assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(IOException.class, () -> downloader.fetchPage(url)));
    }

    @Test
    void fetchBytes_shouldFailCleanlyForOversizedContentLength() {
        String url = serve("/huge.png", exchange -> {
            exchange.sendResponseHeaders(200, 3_000_000_000L);
            OutputStream out = exchange.getResponseBody();
            out.write(new byte[10]);
            out.flush();
            exchange.close();
        });

        assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(IOException.class, () -> downloader.fetchBytes(url)));
    }

    private void stallAfterTenBytes(HttpExchange exchange) throws IOException {
        exchange.sendResponseHeaders(200, 1000);
        OutputStream out = exchange.getResponseBody();
        out.write(new byte[10]);
        out.flush();
        try {
            release.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        exchange.close();
    }

    // -- Helpers --

    @Test
    void initialCapacity_shouldNeverTrustContentLengthBeyondCap() {
        assertEquals(Downloader.CHUNK_SIZE, Downloader.initialCapacity(-1));
        assertEquals(Downloader.CHUNK_SIZE, Downloader.initialCapacity(0));
        assertEquals(100, Downloader.initialCapacity(100));
        assertEquals(Downloader.MAX_PREALLOCATION, Downloader.initialCapacity(3_000_000_000L));
        assertEquals(Downloader.MAX_PREALLOCATION, Downloader.initialCapacity(Integer.MAX_VALUE));
    }

    @Test
    void charset_shouldFallBackToUtf8() {
        assertEquals(StandardCharsets.UTF_8, Downloader.charset(headers(Map.of())));
        assertEquals(StandardCharsets.UTF_8, Downloader.charset(headers(Map.of("Content-Type", "text/html"))));
        assertEquals(StandardCharsets.UTF_8,
                Downloader.charset(headers(Map.of("Content-Type", "text/html; charset=no-such-charset"))));
        assertEquals(StandardCharsets.UTF_8, Downloader.charset(headers(Map.of("Content-Type", "garbage"))));
        assertEquals(StandardCharsets.ISO_8859_1,
                Downloader.charset(headers(Map.of("Content-Type", "text/html; charset=iso-8859-1"))));
    }

    @Test
    void timeouts_shouldMatchConnectAndReadBounds() {
        assertEquals(Duration.ofSeconds(5), Downloader.CONNECT_TIMEOUT);
        assertEquals(Duration.ofSeconds(8), Downloader.READ_TIMEOUT);
        assertEquals(16384, Downloader.CHUNK_SIZE);
    }

    private static HttpHeaders headers(Map<String, String> values) {
        Map<String, List<String>> multi = new HashMap<>();
        values.forEach((name, value) -> multi.put(name, List.of(value)));
        return HttpHeaders.of(multi, (name, value) -> true);
    }
}
