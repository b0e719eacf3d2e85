package probe.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Represents an HTTP request issued by the probing engines.
 * Immutable once built.
 */
public final class ProbeRequest {
    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final String url;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final Map<String, String> formFields;
    private final String body;
    private final String bodyContentType;
    private final int timeoutMs;
    private final boolean persistCookies;

    private ProbeRequest(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url cannot be null");
        this.method = Objects.requireNonNull(builder.method, "method cannot be null");
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        this.formFields = builder.formFields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.formFields))
            : Collections.emptyMap();

        if (!formFields.isEmpty()) {
            if (builder.body != null) {
                throw new IllegalArgumentException("Request cannot carry both a raw body and form fields");
            }
            this.body = encodeForm(formFields);
            this.bodyContentType = FORM_CONTENT_TYPE;
        } else {
            this.body = builder.body;
            this.bodyContentType = builder.bodyContentType;
        }

        this.timeoutMs = Math.max(builder.timeoutMs, 0);
        this.persistCookies = builder.persistCookies;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getUrl() {
        return url;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Form fields in insertion order; empty unless the body was built from a form.
     */
    public Map<String, String> getFormFields() {
        return formFields;
    }

    public String getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    public String getBodyContentType() {
        return bodyContentType;
    }

    /**
     * Per-request timeout in milliseconds, 0 means "use the client default".
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }

    public boolean isPersistCookies() {
        return persistCookies;
    }

    private static String encodeForm(Map<String, String> fields) {
        StringBuilder encoded = new StringBuilder();
        fields.forEach((key, value) -> {
            if (encoded.length() > 0) {
                encoded.append('&');
            }
            encoded.append(URLEncoder.encode(key, StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8));
        });
        return encoded.toString();
    }

    @Override
    public String toString() {
        return method + " " + url;
    }

    public static class Builder {
        private String url;
        private HttpMethod method = HttpMethod.GET;
        private Map<String, String> headers;
        private Map<String, String> formFields;
        private String body;
        private String bodyContentType;
        private int timeoutMs;
        private boolean persistCookies = true;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers != null ? new LinkedHashMap<>(headers) : null;
            return this;
        }

        public Builder addHeader(String key, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(key, value);
            return this;
        }

        public Builder formFields(Map<String, String> formFields) {
            this.formFields = formFields != null ? new LinkedHashMap<>(formFields) : null;
            return this;
        }

        public Builder addFormField(String key, String value) {
            if (this.formFields == null) {
                this.formFields = new LinkedHashMap<>();
            }
            this.formFields.put(key, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder bodyContentType(String bodyContentType) {
            this.bodyContentType = bodyContentType;
            return this;
        }

        public Builder timeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder persistCookies(boolean persistCookies) {
            this.persistCookies = persistCookies;
            return this;
        }

        public ProbeRequest build() {
            return new ProbeRequest(this);
        }
    }
}
