package probe.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import probe.model.HttpMethod;
import probe.model.ProbeRequest;
import probe.model.ProbeResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.net.HttpCookie;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises StandardHttpClient against an in-process HTTP server.
 */
class StandardHttpClientTest {

    private HttpServer server;
    private String baseUrl;
    private final Map<String, String> lastRequest = new ConcurrentHashMap<>();
    private StandardHttpClient httpClient;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/set-cookie", exchange -> {
            exchange.getResponseHeaders().add("Set-Cookie", "sid=abc123; Path=/");
            respond(exchange, 200, "cookie set");
        });
        server.createContext("/echo", exchange -> {
            record(exchange);
            respond(exchange, 200, lastRequest.getOrDefault("body", ""));
        });
        server.createContext("/missing", exchange -> respond(exchange, 404, "not here"));
        server.createContext("/redirect", exchange -> {
            exchange.getResponseHeaders().add("Location", "/echo");
            respond(exchange, 302, "");
        });
        server.createContext("/login-redirect", exchange -> {
            record(exchange);
            exchange.getResponseHeaders().add("Set-Cookie", "sid=s3cret; Path=/");
            exchange.getResponseHeaders().add("Location", "/home");
            respond(exchange, 302, "");
        });
        server.createContext("/home", exchange -> {
            String cookie = exchange.getRequestHeaders().getFirst("Cookie");
            boolean loggedIn = cookie != null && cookie.contains("sid=s3cret");
            lastRequest.put("homeMethod", exchange.getRequestMethod());
            respond(exchange, 200, loggedIn ? "Welcome" : "Please log in");
        });
        server.createContext("/set-cookie-indexed", exchange -> {
            String index = exchange.getRequestURI().getQuery().substring("i=".length());
            exchange.getResponseHeaders().add("Set-Cookie", "c" + index + "=v" + index + "; Path=/");
            exchange.getResponseHeaders().add("Set-Cookie", "shared=last; Path=/");
            respond(exchange, 200, "ok");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        httpClient = new StandardHttpClient(HttpClientConfig.builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(Duration.ofSeconds(5))
            .build());
    }

    @AfterEach
    void tearDown() {
        httpClient.close();
        server.stop(0);
    }

    private void record(HttpExchange exchange) throws IOException {
        lastRequest.clear();
        lastRequest.put("method", exchange.getRequestMethod());
        lastRequest.put("body", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        String cookie = exchange.getRequestHeaders().getFirst("Cookie");
        if (cookie != null) {
            lastRequest.put("cookie", cookie);
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        if (contentType != null) {
            lastRequest.put("contentType", contentType);
        }
        String userAgent = exchange.getRequestHeaders().getFirst("User-Agent");
        if (userAgent != null) {
            lastRequest.put("userAgent", userAgent);
        }
        String custom = exchange.getRequestHeaders().getFirst("X-Probe");
        if (custom != null) {
            lastRequest.put("xProbe", custom);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Server", "nginx/1.18.0");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void testSupportsOnlyHttpSchemes() {
        assertTrue(httpClient.supports("http://example.com"));
        assertTrue(httpClient.supports("https://example.com"));
        assertFalse(httpClient.supports("ftp://example.com"));
        assertFalse(httpClient.supports(null));
    }

    @Test
    void testInvalidUrlIsReturnedAsError() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder().url("invalid-url").build());

        assertTrue(response.hasError());
        assertEquals(0, response.getStatusCode());
    }

    @Test
    void testConnectionRefusedIsReturnedAsError() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);

        ProbeResponse response = httpClient.execute(
            ProbeRequest.builder().url("http://127.0.0.1:" + port + "/").build());

        assertTrue(response.hasError());
    }

    @Test
    void testPostFormBody() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder()
            .url(baseUrl + "/echo")
            .method(HttpMethod.POST)
            .addFormField("username", "admin")
            .addFormField("password", "p@ss word")
            .addHeader("X-Probe", "1")
            .build());

        assertFalse(response.hasError());
        assertEquals(200, response.getStatusCode());
        assertEquals("POST", lastRequest.get("method"));
        assertEquals("username=admin&password=p%40ss+word", lastRequest.get("body"));
        assertEquals(ProbeRequest.FORM_CONTENT_TYPE, lastRequest.get("contentType"));
        assertEquals("1", lastRequest.get("xProbe"));
        assertEquals("username=admin&password=p%40ss+word", response.getBody());
        assertEquals("nginx/1.18.0", response.getHeader("server").orElseThrow());
    }

    @Test
    void testErrorStatusBodyIsRead() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder().url(baseUrl + "/missing").build());

        assertFalse(response.hasError());
        assertEquals(404, response.getStatusCode());
        assertEquals("not here", response.getBody());
    }

    @Test
    void testCookiesPersistAcrossRequests() {
        httpClient.execute(ProbeRequest.builder().url(baseUrl + "/set-cookie").build());
        httpClient.execute(ProbeRequest.builder().url(baseUrl + "/echo").build());

        assertEquals("sid=abc123", lastRequest.get("cookie"));
        List<HttpCookie> cookies = httpClient.cookieStore().getCookies();
        assertEquals(1, cookies.size());
        assertEquals("sid", cookies.get(0).getName());
    }

    @Test
    void testNonPersistingRequestLeavesJarUntouched() {
        httpClient.execute(ProbeRequest.builder().url(baseUrl + "/set-cookie").persistCookies(false).build());

        assertTrue(httpClient.cookieStore().getCookies().isEmpty());
    }

    @Test
    void testRedirectsCanBeDisabled() {
        StandardHttpClient noRedirects = new StandardHttpClient(HttpClientConfig.builder()
            .followRedirects(false)
            .build());

        ProbeResponse response = noRedirects.execute(ProbeRequest.builder().url(baseUrl + "/redirect").build());

        assertEquals(302, response.getStatusCode());
        assertEquals("/echo", response.getHeader("Location").orElseThrow());
    }

    @Test
    void testRedirectsFollowedByDefault() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder().url(baseUrl + "/redirect").build());

        assertEquals(200, response.getStatusCode());
    }

    @Test
    void testDefaultHeadersAreSent() {
        StandardHttpClient withDefaults = new StandardHttpClient(HttpClientConfig.builder()
            .addDefaultHeader("X-Probe", "default")
            .build());

        withDefaults.execute(ProbeRequest.builder().url(baseUrl + "/echo").build());
        assertEquals("default", lastRequest.get("xProbe"));

        withDefaults.execute(ProbeRequest.builder().url(baseUrl + "/echo").addHeader("X-Probe", "override").build());
        assertEquals("override", lastRequest.get("xProbe"));
    }

    @Test
    void testSendsConfiguredUserAgent() {
        httpClient.execute(ProbeRequest.builder().url(baseUrl + "/echo").build());
        assertEquals(HttpClientConfig.DEFAULT_USER_AGENT, lastRequest.get("userAgent"));

        StandardHttpClient custom = new StandardHttpClient(HttpClientConfig.builder()
            .addDefaultHeader("User-Agent", "scanner/2")
            .build());
        custom.execute(ProbeRequest.builder().url(baseUrl + "/echo").build());
        assertEquals("scanner/2", lastRequest.get("userAgent"));
    }

    @Test
    void testCookieSetOnRedirectIsSentToTargetAndStored() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder()
            .url(baseUrl + "/login-redirect")
            .method(HttpMethod.POST)
            .addFormField("username", "admin")
            .addFormField("password", "s3cret")
            .build());

        assertEquals(200, response.getStatusCode());
        assertEquals("Welcome", response.getBody());
        assertEquals("POST", lastRequest.get("method"));
        assertEquals("GET", lastRequest.get("homeMethod"));
        List<HttpCookie> cookies = httpClient.cookieStore().getCookies();
        assertEquals(1, cookies.size());
        assertEquals("sid", cookies.get(0).getName());
    }

    @Test
    void testIsolatedRequestKeepsRedirectCookiesOutOfJar() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder()
            .url(baseUrl + "/login-redirect")
            .persistCookies(false)
            .build());

        assertEquals("Welcome", response.getBody());
        assertTrue(httpClient.cookieStore().getCookies().isEmpty());
    }

    @Test
    void testBodyLengthIsByteCount() {
        ProbeResponse response = httpClient.execute(ProbeRequest.builder()
            .url(baseUrl + "/echo")
            .method(HttpMethod.POST)
            .body("caf\u00e9")
            .build());

        assertEquals("caf\u00e9", response.getBody());
        assertEquals(5, response.getBodyLength());
    }

    @Test
    void testParallelRequestsShareConsistentCookieJar() throws Exception {
        int tasks = 20;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<ProbeResponse>> futures = new ArrayList<>();
            for (int i = 0; i < tasks; i++) {
                String url = baseUrl + "/set-cookie-indexed?i=" + i;
                futures.add(pool.submit(() -> httpClient.execute(ProbeRequest.builder().url(url).build())));
            }
            for (Future<ProbeResponse> future : futures) {
                assertEquals(200, future.get(30, TimeUnit.SECONDS).getStatusCode());
            }
        } finally {
            pool.shutdownNow();
        }

        Set<String> names = new TreeSet<>();
        for (HttpCookie cookie : httpClient.cookieStore().getCookies()) {
            assertTrue(names.add(cookie.getName()), "duplicate cookie " + cookie.getName());
        }
        Set<String> expected = new TreeSet<>();
        for (int i = 0; i < tasks; i++) {
            expected.add("c" + i);
        }
        expected.add("shared");
        assertEquals(expected, names);
    }
}
