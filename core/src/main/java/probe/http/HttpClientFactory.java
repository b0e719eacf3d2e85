package probe.http;

import java.util.logging.Logger;

/**
 * Factory for HTTP clients.
 */
public final class HttpClientFactory {
    private static final Logger logger = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
        // Prevent instantiation
    }

    /**
     * Create an HTTP client from the given configuration.
     *
     * @param config HTTP client configuration
     * @return client instance
     */
    public static HttpClient createClient(HttpClientConfig config) {
        logger.fine("Creating HTTP client (verifySsl=" + config.isVerifySsl() +
                    ", followRedirects=" + config.isFollowRedirects() +
                    ", defaultHeaders=" + config.getDefaultHeaders().size() + ")");
        return new StandardHttpClient(config);
    }

    /**
     * Create a client with the default configuration.
     *
     * @return standard HTTP client
     */
    public static HttpClient createDefaultClient() {
        return createClient(HttpClientConfig.defaultConfig());
    }
}
