package cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import probe.log.LogChannel;
import probe.session.DocumentStore;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the network subcommands against an in-process HTTP server.
 */
class AttackCommandsTest {

    @TempDir
    Path stateDir;

    @TempDir
    Path workDir;

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger requestCount = new AtomicInteger();
    private CliTestSupport cli;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/plain", exchange -> respond(exchange, 200, "hello"));
        server.createContext("/hardened", exchange -> {
            exchange.getResponseHeaders().add("X-XSS-Protection", "1; mode=block");
            exchange.getResponseHeaders().add("Content-Security-Policy", "default-src 'self'");
            exchange.getResponseHeaders().add("X-Frame-Options", "DENY");
            exchange.getResponseHeaders().add("Strict-Transport-Security", "max-age=31536000");
            respond(exchange, 200, "hello");
        });
        server.createContext("/item", exchange -> {
            String query = exchange.getRequestURI().getQuery();
            boolean quoted = query != null && query.contains("'");
            respond(exchange, 200, quoted ? "database error near quote" : "item 1");
        });
        server.createContext("/login", exchange -> {
            if ("GET".equals(exchange.getRequestMethod())) {
                respond(exchange, 200,
                    "<form><input type=\"hidden\" name=\"csrf_token\" value=\"tok-1\"></form>");
                return;
            }
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            if (body.contains("password=s3cret") && body.contains("csrf_token=tok-1")) {
                exchange.getResponseHeaders().add("Set-Cookie", "sid=logged-in; Path=/");
                respond(exchange, 200, "Welcome back");
            } else {
                respond(exchange, 200, "Invalid password");
            }
        });
        server.createContext("/prg-login", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            if (body.contains("password=s3cret")) {
                exchange.getResponseHeaders().add("Set-Cookie", "sid=prg-session; Path=/");
            }
            exchange.getResponseHeaders().add("Location", "/prg-home");
            respond(exchange, 302, "");
        });
        server.createContext("/prg-home", exchange -> {
            String cookie = exchange.getRequestHeaders().getFirst("Cookie");
            respond(exchange, 200, cookie != null && cookie.contains("sid=prg-session") ? "Welcome" : "Please log in");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        cli = new CliTestSupport(stateDir);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        requestCount.incrementAndGet();
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void testScanReportsMissingHeaders() {
        int exitCode = cli.run("scan", baseUrl + "/plain");

        assertEquals(ExitCodes.ISSUES_FOUND, exitCode);
        assertTrue(cli.out().contains("missing-csp"), cli.out());
    }

    @Test
    void testScanOfHardenedResponseIsClean() {
        assertEquals(ExitCodes.OK, cli.run("scan", baseUrl + "/hardened"));
    }

    @Test
    void testRequestTransportFailure() throws IOException {
        int exitCode = cli.run("request", "http://127.0.0.1:1/unreachable");

        assertEquals(ExitCodes.TRANSPORT_FAILURE, exitCode);
        Path errorLog = stateDir.resolve("logs").resolve(LogChannel.ERROR.getFileName());
        assertTrue(Files.readString(errorLog).contains("127.0.0.1:1"));
    }

    @Test
    void testRequestRejectsInvalidJsonBeforeSending() {
        int exitCode = cli.run("request", "-X", "POST", "--json", "-d", "{broken", baseUrl + "/plain");

        assertEquals(ExitCodes.INVALID_INPUT, exitCode);
        assertEquals(0, requestCount.get());
    }

    @Test
    void testInjectFlagsErrorResponses() throws IOException {
        int exitCode = cli.run("inject", "-p", "q", "--category", "sql", "-c", "4", "-f", "json",
            baseUrl + "/item");

        assertEquals(ExitCodes.ISSUES_FOUND, exitCode);
        assertTrue(cli.out().contains("\"injection\""), cli.out());
        assertTrue(cli.out().contains("Error message detected"), cli.out());

        Path log = stateDir.resolve("logs").resolve(LogChannel.INJECTION_TEST.getFileName());
        assertTrue(Files.readString(log).contains("note=Error message detected"));
    }

    @Test
    void testInjectWithoutSignals() {
        int exitCode = cli.run("inject", "-p", "q", "--category", "xss", baseUrl + "/item");

        assertEquals(ExitCodes.OK, exitCode);
        assertTrue(cli.out().contains("No injection signals detected."), cli.out());
    }

    @Test
    void testBruteFindsPasswordWithCsrfToken() throws IOException {
        Path wordlist = Files.writeString(workDir.resolve("passwords.txt"), "letmein\nhunter2\ns3cret\nnever-tried\n");

        int exitCode = cli.run("brute", "--username", "admin", "-w", wordlist.toString(),
            "--csrf-field", "csrf_token", "--failure", "Invalid password", baseUrl + "/login");

        assertEquals(ExitCodes.ISSUES_FOUND, exitCode);
        assertTrue(cli.out().contains("Valid credential found"), cli.out());
        // one CSRF fetch plus three attempts
        assertEquals(4, requestCount.get());
        assertTrue(Files.readString(new DocumentStore(stateDir).pathOf(DocumentStore.SESSION)).contains("sid"));
    }

    @Test
    void testBruteExhaustsWordlist() throws IOException {
        Path wordlist = Files.writeString(workDir.resolve("passwords.txt"), "one\ntwo\n");

        int exitCode = cli.run("brute", "--username", "admin", "-w", wordlist.toString(),
            "--failure", "Invalid password", baseUrl + "/login");

        assertEquals(ExitCodes.OK, exitCode);
        assertTrue(cli.out().contains("No valid password found in 2 attempts."), cli.out());
    }

    @Test
    void testBruteWithMissingWordlistSendsNothing() {
        int exitCode = cli.run("brute", "--username", "admin", "-w", workDir.resolve("absent.txt").toString(),
            baseUrl + "/login");

        assertEquals(ExitCodes.INVALID_INPUT, exitCode);
        assertEquals(0, requestCount.get());
        assertTrue(cli.err().contains("Wordlist not found"), cli.err());
    }

    @Test
    void testLoginAcceptedStoresSession() {
        int exitCode = cli.run("login", "--username", "admin", "--password", "s3cret",
            "--csrf-field", "csrf_token", "--success", "Welcome", baseUrl + "/login");

        assertEquals(ExitCodes.OK, exitCode);
        assertTrue(new DocumentStore(stateDir).exists(DocumentStore.SESSION));
    }

    @Test
    void testLoginRejected() {
        int exitCode = cli.run("login", "--username", "admin", "--password", "wrong",
            "--csrf-field", "csrf_token", "--success", "Welcome", baseUrl + "/login");

        assertEquals(ExitCodes.LOGIN_REJECTED, exitCode);
        assertFalse(new DocumentStore(stateDir).exists(DocumentStore.SESSION));
    }

    @Test
    void testLoginThroughRedirectStoresSessionCookie() throws IOException {
        int exitCode = cli.run("login", "--username", "admin", "--password", "s3cret",
            "--success", "Welcome", baseUrl + "/prg-login");

        assertEquals(ExitCodes.OK, exitCode);
        String session = Files.readString(new DocumentStore(stateDir).pathOf(DocumentStore.SESSION));
        assertTrue(session.contains("prg-session"), session);
    }
}
