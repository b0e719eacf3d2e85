package probe.bruteforce;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import probe.http.HttpClient;
import probe.model.HttpMethod;
import probe.model.ProbeRequest;
import probe.model.ProbeResponse;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BruteForceEngineTest {

    private static final String LOGIN_URL = "http://target.test/login";
    private static final String LOGIN_PAGE =
        "<form method=\"post\"><input type=\"hidden\" name=\"csrf_token\" value=\"tok-42\"></form>";

    @Mock
    private HttpClient mockHttpClient;

    private BruteForceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new BruteForceEngine(mockHttpClient);
    }

    private static ProbeResponse response(int status, String body) {
        return ProbeResponse.builder().statusCode(status).body(body).build();
    }

    private static BruteForceConfig.Builder config() {
        return BruteForceConfig.builder()
            .loginUrl(LOGIN_URL)
            .username("admin");
    }

    private void answerLogin(String correctPassword) {
        when(mockHttpClient.execute(any(ProbeRequest.class))).thenAnswer(invocation -> {
            ProbeRequest request = invocation.getArgument(0);
            if (request.getMethod() == HttpMethod.GET) {
                return response(200, LOGIN_PAGE);
            }
            return request.getBody().contains("password=" + correctPassword)
                ? response(200, "Welcome admin")
                : response(200, "Invalid credentials");
        });
    }

    @Test
    void testSuccessOnThirdAttemptWithCsrf() {
        answerLogin("letmein");
        BruteForceConfig cfg = config()
            .csrfField("csrf_token")
            .failureIndicator("Invalid")
            .build();

        BruteForceResult result = engine.run(cfg, PasswordSource.of("123456", "password", "letmein", "qwerty"));

        assertEquals(BruteForceState.SUCCESS, result.getState());
        assertTrue(result.isSuccess());
        Credential credential = result.getCredential().orElseThrow();
        assertEquals("admin", credential.username());
        assertEquals("letmein", credential.password());
        assertEquals(3, result.getAttemptCount());
        // one CSRF page fetch plus three login posts
        assertEquals(4, result.getRequestCount());
        assertEquals("tok-42", result.getCsrfToken().orElseThrow());
        verify(mockHttpClient, times(4)).execute(any(ProbeRequest.class));
    }

    @Test
    void testFormCarriesUserPasswordAndToken() {
        answerLogin("nope");
        BruteForceConfig cfg = config()
            .usernameField("user")
            .passwordField("pass")
            .csrfField("csrf_token")
            .build();

        engine.run(cfg, PasswordSource.of("s3cret"));

        ArgumentCaptor<ProbeRequest> captor = ArgumentCaptor.forClass(ProbeRequest.class);
        verify(mockHttpClient, times(2)).execute(captor.capture());
        ProbeRequest csrfFetch = captor.getAllValues().get(0);
        ProbeRequest post = captor.getAllValues().get(1);
        assertEquals(HttpMethod.GET, csrfFetch.getMethod());
        assertEquals(HttpMethod.POST, post.getMethod());
        assertEquals(LOGIN_URL, post.getUrl());
        assertEquals("user=admin&pass=s3cret&csrf_token=tok-42", post.getBody());
        assertEquals(ProbeRequest.FORM_CONTENT_TYPE, post.getBodyContentType());
    }

    @Test
    void testExhaustionSendsOnePostPerPassword() {
        answerLogin("not-in-list");
        BruteForceConfig cfg = config().failureIndicator("Invalid").build();

        BruteForceResult result = engine.run(cfg, PasswordSource.of("a", "b", "c", "d", "e"));

        assertEquals(BruteForceState.EXHAUSTED, result.getState());
        assertTrue(result.getCredential().isEmpty());
        assertEquals(5, result.getAttemptCount());
        assertEquals(5, result.getRequestCount());
        assertFalse(result.isCsrfRequested());
        verify(mockHttpClient, times(5)).execute(any(ProbeRequest.class));
    }

    @Test
    void testNoCsrfFieldMeansNoPageFetch() {
        answerLogin("x");

        engine.run(config().failureIndicator("Invalid").build(), PasswordSource.of("y"));

        ArgumentCaptor<ProbeRequest> captor = ArgumentCaptor.forClass(ProbeRequest.class);
        verify(mockHttpClient, times(1)).execute(captor.capture());
        assertEquals(HttpMethod.POST, captor.getValue().getMethod());
        assertEquals("username=admin&password=y", captor.getValue().getBody());
    }

    @Test
    void testMissingCsrfTokenContinuesWithoutToken() {
        when(mockHttpClient.execute(any(ProbeRequest.class))).thenAnswer(invocation -> {
            ProbeRequest request = invocation.getArgument(0);
            return request.getMethod() == HttpMethod.GET
                ? response(200, "<form></form>")
                : response(200, "Invalid");
        });

        BruteForceResult result = engine.run(
            config().csrfField("csrf_token").failureIndicator("Invalid").build(),
            PasswordSource.of("a"));

        assertEquals(BruteForceState.EXHAUSTED, result.getState());
        assertTrue(result.getCsrfToken().isEmpty());
        assertTrue(result.isCsrfRequested());
        assertEquals(2, result.getRequestCount());

        ArgumentCaptor<ProbeRequest> captor = ArgumentCaptor.forClass(ProbeRequest.class);
        verify(mockHttpClient, times(2)).execute(captor.capture());
        assertFalse(captor.getAllValues().get(1).getBody().contains("csrf_token"));
    }

    @Test
    void testTransportErrorsAreRecordedAndIterationContinues() {
        when(mockHttpClient.execute(any(ProbeRequest.class))).thenAnswer(invocation -> {
            ProbeRequest request = invocation.getArgument(0);
            if (request.getBody().contains("password=flaky")) {
                return ProbeResponse.builder().statusCode(0).error(new SocketTimeoutException("Read timed out")).build();
            }
            return request.getBody().contains("password=right")
                ? response(200, "Welcome")
                : response(200, "Invalid");
        });

        BruteForceResult result = engine.run(
            config().failureIndicator("Invalid").build(),
            PasswordSource.of("wrong", "flaky", "right"));

        assertEquals(BruteForceState.SUCCESS, result.getState());
        assertEquals(3, result.getAttemptCount());
        assertEquals(1, result.getTransportFailureCount());
        LoginAttempt flaky = result.getAttempts().get(1);
        assertTrue(flaky.isTransportFailure());
        assertFalse(flaky.success());
        assertTrue(flaky.result().getError().orElseThrow().contains("Read timed out"));
    }

    @Test
    void testSuccessIndicatorTakesPrecedence() {
        when(mockHttpClient.execute(any(ProbeRequest.class)))
            .thenReturn(response(200, "Welcome! Invalid session banner"));

        BruteForceResult result = engine.run(
            config().successIndicator("welcome").failureIndicator("invalid").build(),
            PasswordSource.of("first"));

        assertTrue(result.isSuccess());
        assertEquals("first", result.getCredential().orElseThrow().password());
    }

    @Test
    void testStatusOnlyCriteriaStopsAtFirst200() {
        when(mockHttpClient.execute(any(ProbeRequest.class)))
            .thenReturn(response(401, "no"), response(401, "no"), response(200, "ok"));

        BruteForceResult result = engine.run(config().build(), PasswordSource.of("a", "b", "c", "d"));

        assertEquals("c", result.getCredential().orElseThrow().password());
        verify(mockHttpClient, times(3)).execute(any(ProbeRequest.class));
    }

    @Test
    void testEmptySourceIsExhaustedWithoutPosts() {
        BruteForceResult result = engine.run(config().build(), PasswordSource.of(List.of()));

        assertEquals(BruteForceState.EXHAUSTED, result.getState());
        assertEquals(0, result.getRequestCount());
        verifyNoInteractions(mockHttpClient);
    }

    @Test
    void testStateTransitionsAreReported() {
        answerLogin("b");
        List<BruteForceState> states = new ArrayList<>();
        BruteForceProgressListener listener = new BruteForceProgressListener() {
            @Override
            public void onStateChange(BruteForceState from, BruteForceState to) {
                states.add(to);
            }

            @Override
            public void onAttempt(LoginAttempt attempt) {
            }
        };

        engine.run(config().csrfField("csrf_token").failureIndicator("Invalid").progressListener(listener).build(),
            PasswordSource.of("a", "b"));

        assertEquals(List.of(BruteForceState.CSRF_FETCH, BruteForceState.ITERATING, BruteForceState.SUCCESS), states);
    }

    @Test
    void testFileSourceIsConsumedInOrder(@TempDir Path tempDir) throws IOException {
        answerLogin("third");
        Path wordlist = tempDir.resolve("words.txt");
        Files.writeString(wordlist, "first\n\nsecond\r\nthird\nfourth\n");

        BruteForceResult result;
        try (PasswordSource source = PasswordSource.fromFile(wordlist)) {
            result = engine.run(config().failureIndicator("Invalid").build(), source);
            assertEquals(3, source.getConsumed());
        }

        assertEquals("third", result.getCredential().orElseThrow().password());
        assertEquals(List.of("first", "second", "third"),
            result.getAttempts().stream().map(LoginAttempt::password).collect(java.util.stream.Collectors.toList()));
    }

    @Test
    void testLatin1LineInWordlistDoesNotAbortRun(@TempDir Path tempDir) throws IOException {
        answerLogin("secret");
        Path wordlist = tempDir.resolve("words.txt");
        Files.write(wordlist, new byte[]{'a', 'l', 'p', 'h', 'a', '\n', 'c', 'a', 'f', (byte) 0xE9, '\n',
            's', 'e', 'c', 'r', 'e', 't', '\n'});

        BruteForceResult result;
        try (PasswordSource source = PasswordSource.fromFile(wordlist)) {
            result = engine.run(config().failureIndicator("Invalid").build(), source);
        }

        assertEquals(BruteForceState.SUCCESS, result.getState());
        assertEquals("secret", result.getCredential().orElseThrow().password());
        assertEquals(3, result.getAttemptCount());
        assertEquals("alpha", result.getAttempts().get(0).password());
    }

    @Test
    void testNegativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> config().requestDelayMs(-1).build());
    }
}
