package cli;

import probe.http.HttpClient;
import probe.http.HttpClientConfig;
import probe.http.HttpClientFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Builds HTTP clients from command line options.
 */
public final class HttpClientHelper {

    private HttpClientHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Create a client honouring the shared options.
     *
     * @param options        parsed common options
     * @param defaultHeaders headers sent with every request unless a request overrides them
     * @return configured client
     * @throws IllegalArgumentException if the timeout is not positive
     */
    public static HttpClient createClient(CommonOptions options, Map<String, String> defaultHeaders) {
        if (options.timeoutSeconds <= 0) {
            throw new IllegalArgumentException("--timeout must be > 0, got " + options.timeoutSeconds);
        }
        Duration timeout = Duration.ofSeconds(options.timeoutSeconds);

        HttpClientConfig config = HttpClientConfig.builder()
            .timeout(timeout)
            .followRedirects(!options.noRedirects)
            .verifySsl(!options.noVerifySsl)
            .defaultHeaders(defaultHeaders)
            .build();

        return HttpClientFactory.createClient(config);
    }
}
