package probe.model;

/**
 * HTTP methods the toolkit is able to issue.
 */
public enum HttpMethod {
    GET(false),
    POST(true),
    PUT(true),
    DELETE(false),
    HEAD(false);

    private final boolean bodyAllowed;

    HttpMethod(boolean bodyAllowed) {
        this.bodyAllowed = bodyAllowed;
    }

    /**
     * Whether a request body is normally sent with this method.
     */
    public boolean isBodyAllowed() {
        return bodyAllowed;
    }

    /**
     * Parse a method name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is not a supported method
     */
    public static HttpMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HTTP method cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: '" + value + "'", e);
        }
    }
}
