package probe.model;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Raw HTTP exchange outcome as returned by an {@link probe.http.HttpClient}.
 * On transport failure the status code is 0, the body is null and the error is set.
 * Timing is measured by the caller, see {@link ProbeResult}.
 */
public final class ProbeResponse {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final int bodyLength;
    private final Optional<Exception> error;

    private ProbeResponse(Builder builder) {
        this.statusCode = builder.statusCode;
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        this.body = builder.body;
        this.bodyLength = builder.bodyLength >= 0
            ? builder.bodyLength
            : (body != null ? body.getBytes(StandardCharsets.UTF_8).length : 0);
        this.error = Optional.ofNullable(builder.error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    /**
     * Size of the body in bytes as received, or the UTF-8 length of the body text when
     * the client did not report one.
     */
    public int getBodyLength() {
        return bodyLength;
    }

    public Optional<Exception> getError() {
        return error;
    }

    public boolean hasError() {
        return error.isPresent();
    }

    /**
     * Whether a header with this name is present, ignoring case.
     */
    public boolean hasHeader(String name) {
        return findHeaderValues(name) != null;
    }

    /**
     * First value of the named header, ignoring case.
     */
    public Optional<String> getHeader(String name) {
        List<String> values = findHeaderValues(name);
        return values != null && !values.isEmpty()
            ? Optional.ofNullable(values.get(0))
            : Optional.empty();
    }

    private List<String> findHeaderValues(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        if (hasError()) {
            return "ProbeResponse{error=" + error.get().getMessage() + "}";
        }
        return "ProbeResponse{statusCode=" + statusCode +
               ", bodyLength=" + bodyLength + "}";
    }

    public static class Builder {
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private int bodyLength = -1;
        private Exception error;

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder headers(Map<String, List<String>> headers) {
            this.headers = headers != null ? new LinkedHashMap<>(headers) : null;
            return this;
        }

        public Builder addHeader(String key, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder bodyLength(int bodyLength) {
            this.bodyLength = bodyLength;
            return this;
        }

        public Builder error(Exception error) {
            this.error = error;
            return this;
        }

        public ProbeResponse build() {
            return new ProbeResponse(this);
        }
    }
}
