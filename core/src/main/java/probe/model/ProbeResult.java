package probe.model;

import java.util.*;

/**
 * Per-request record produced by the probing engines.
 *
 * <p>A result is either a completed exchange (status code present) or a transport
 * failure (error present), never both. Instances are only created through
 * {@link #completed(ProbeRequest, ProbeResponse, double)} and
 * {@link #failed(ProbeRequest, String, double)}.
 */
public final class ProbeResult {
    private static final int DEFAULT_EXCERPT_LENGTH = 200;

    private final ProbeRequest request;
    private final Integer statusCode;
    private final double elapsedMs;
    private final String body;
    private final int bodyLength;
    private final Map<String, List<String>> headers;
    private final ProbeResponse response;
    private final String error;

    private ProbeResult(ProbeRequest request, ProbeResponse response, double elapsedMs, String error) {
        this.request = Objects.requireNonNull(request, "request cannot be null");
        this.elapsedMs = elapsedMs;
        this.response = response;
        this.error = error;
        if (response != null) {
            this.statusCode = response.getStatusCode();
            this.body = response.getBody() != null ? response.getBody() : "";
            this.bodyLength = response.getBodyLength();
            this.headers = response.getHeaders();
        } else {
            this.statusCode = null;
            this.body = "";
            this.bodyLength = 0;
            this.headers = Collections.emptyMap();
        }
    }

    /**
     * Result of an exchange that produced an HTTP response.
     *
     * @throws IllegalArgumentException if the response carries a transport error
     */
    public static ProbeResult completed(ProbeRequest request, ProbeResponse response, double elapsedMs) {
        Objects.requireNonNull(response, "response cannot be null");
        if (response.hasError()) {
            throw new IllegalArgumentException("Response carries a transport error, use failed(...)");
        }
        return new ProbeResult(request, response, elapsedMs, null);
    }

    /**
     * Result of an exchange that failed before a response was obtained.
     */
    public static ProbeResult failed(ProbeRequest request, String error, double elapsedMs) {
        String message = error != null && !error.isBlank() ? error : "Transport error";
        return new ProbeResult(request, null, elapsedMs, message);
    }

    /**
     * Convert a client response into a result, choosing the failed form when the
     * client reported a transport error. The error text names the method and URL.
     */
    public static ProbeResult from(ProbeRequest request, ProbeResponse response, double elapsedMs) {
        if (response.hasError()) {
            Exception cause = response.getError().get();
            String detail = cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
            return failed(request, request.getMethod() + " " + request.getUrl() + " failed - " + detail, elapsedMs);
        }
        return completed(request, response, elapsedMs);
    }

    public ProbeRequest getRequest() {
        return request;
    }

    public OptionalInt getStatusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    public double getElapsedMs() {
        return elapsedMs;
    }

    /**
     * Body size in bytes.
     */
    public int getBodyLength() {
        return bodyLength;
    }

    public String getBody() {
        return body;
    }

    public String getBodyExcerpt() {
        return getBodyExcerpt(DEFAULT_EXCERPT_LENGTH);
    }

    public String getBodyExcerpt(int maxLength) {
        if (body.length() <= maxLength) {
            return body;
        }
        return body.substring(0, maxLength) + "...";
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * The underlying response, present only for completed exchanges.
     */
    public Optional<ProbeResponse> getResponse() {
        return Optional.ofNullable(response);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isCompleted() {
        return statusCode != null;
    }

    public boolean isFailed() {
        return error != null;
    }

    @Override
    public String toString() {
        if (isFailed()) {
            return "ProbeResult{" + request + ", error=" + error + "}";
        }
        return "ProbeResult{" + request +
               ", status=" + statusCode +
               ", elapsed=" + String.format(Locale.ROOT, "%.1f", elapsedMs) + "ms" +
               ", bodyLength=" + bodyLength + "}";
    }
}
