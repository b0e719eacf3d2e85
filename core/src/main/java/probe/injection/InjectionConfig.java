package probe.injection;

import probe.payload.Payload;

import java.util.*;

/**
 * Parameters of one injection run.
 */
public final class InjectionConfig {
    public static final int DEFAULT_CONCURRENCY = 10;
    public static final double DEFAULT_DELAY_THRESHOLD_MS = 1000.0;

    private final String urlTemplate;
    private final List<Payload> payloads;
    private final int concurrency;
    private final double delayThresholdMs;
    private final boolean isolateCookies;
    private final Map<String, String> headers;
    private final InjectionProgressListener progressListener;

    private InjectionConfig(Builder builder) {
        this.urlTemplate = Objects.requireNonNull(builder.urlTemplate, "urlTemplate cannot be null");
        this.payloads = builder.payloads != null ? List.copyOf(builder.payloads) : List.of();
        if (builder.concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0, got " + builder.concurrency);
        }
        this.concurrency = builder.concurrency;
        this.delayThresholdMs = builder.delayThresholdMs;
        this.isolateCookies = builder.isolateCookies;
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        this.progressListener = builder.progressListener != null
            ? builder.progressListener
            : InjectionProgressListener.noOp();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * URL ending at the injection point, e.g. {@code http://host/search?q=}.
     */
    public String getUrlTemplate() {
        return urlTemplate;
    }

    public List<Payload> getPayloads() {
        return payloads;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public double getDelayThresholdMs() {
        return delayThresholdMs;
    }

    /**
     * When set, responses do not write to the shared cookie jar during the run.
     */
    public boolean isIsolateCookies() {
        return isolateCookies;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public InjectionProgressListener getProgressListener() {
        return progressListener;
    }

    public static class Builder {
        private String urlTemplate;
        private List<Payload> payloads;
        private int concurrency = DEFAULT_CONCURRENCY;
        private double delayThresholdMs = DEFAULT_DELAY_THRESHOLD_MS;
        private boolean isolateCookies;
        private Map<String, String> headers;
        private InjectionProgressListener progressListener;

        public Builder urlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
            return this;
        }

        public Builder payloads(List<Payload> payloads) {
            this.payloads = payloads;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder delayThresholdMs(double delayThresholdMs) {
            this.delayThresholdMs = delayThresholdMs;
            return this;
        }

        public Builder isolateCookies(boolean isolateCookies) {
            this.isolateCookies = isolateCookies;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder progressListener(InjectionProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public InjectionConfig build() {
            return new InjectionConfig(this);
        }
    }
}
