package probe.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for a {@link StandardHttpClient}.
 *
 * <p>Defaults: 30 s connect and read timeouts, redirects followed, certificates verified,
 * {@value #DEFAULT_USER_AGENT} as User-Agent. Default headers are sent with every request
 * and may override the User-Agent; request headers override both.
 */
public final class HttpClientConfig {
    public static final String DEFAULT_USER_AGENT = "http-probe/1.0";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final boolean followRedirects;
    private final boolean verifySsl;
    private final String userAgent;
    private final Map<String, String> defaultHeaders;

    private HttpClientConfig(Builder builder) {
        this.connectTimeout = positive(builder.connectTimeout, "connectTimeout");
        this.readTimeout = positive(builder.readTimeout, "readTimeout");
        this.followRedirects = builder.followRedirects;
        this.verifySsl = builder.verifySsl;
        this.userAgent = builder.userAgent;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
    }

    private static Duration positive(Duration timeout, String name) {
        if (timeout == null) {
            return DEFAULT_TIMEOUT;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + timeout);
        }
        return timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HttpClientConfig defaultConfig() {
        return builder().build();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public boolean isVerifySsl() {
        return verifySsl;
    }

    /**
     * @return User-Agent to send, or null to leave the JDK default
     */
    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    @Override
    public String toString() {
        return "HttpClientConfig{connectTimeout=" + connectTimeout +
            ", readTimeout=" + readTimeout +
            ", followRedirects=" + followRedirects +
            ", verifySsl=" + verifySsl +
            ", defaultHeaders=" + defaultHeaders.keySet() + "}";
    }

    public static class Builder {
        private Duration connectTimeout;
        private Duration readTimeout;
        private boolean followRedirects = true;
        private boolean verifySsl = true;
        private String userAgent = DEFAULT_USER_AGENT;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        /**
         * Same value for connect and read timeouts.
         */
        public Builder timeout(Duration timeout) {
            this.connectTimeout = timeout;
            this.readTimeout = timeout;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder verifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Replace the default headers.
         */
        public Builder defaultHeaders(Map<String, String> headers) {
            this.defaultHeaders.clear();
            if (headers != null) {
                this.defaultHeaders.putAll(headers);
            }
            return this;
        }

        public Builder addDefaultHeader(String name, String value) {
            this.defaultHeaders.put(name, value);
            return this;
        }

        public HttpClientConfig build() {
            return new HttpClientConfig(this);
        }
    }
}
