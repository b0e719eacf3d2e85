package probe.bruteforce;

import java.util.Optional;

/**
 * Extracts an anti-forgery token from a login page by plain substring scanning.
 *
 * <p>The scan looks for the marker {@code name="<field>"}, then for the first
 * {@code value="} after it, and returns the text up to the next double quote.
 * This is intentionally not an HTML parser: markup where the value attribute precedes
 * the name attribute, or uses single quotes, yields no token.
 */
public final class CsrfTokenExtractor {

    private static final String VALUE_MARKER = "value=\"";

    private CsrfTokenExtractor() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param body      response body of the login page, may be null
     * @param fieldName name of the hidden CSRF input
     * @return the token, or empty if the field or a well-formed value is not found
     */
    public static Optional<String> extract(String body, String fieldName) {
        if (body == null || fieldName == null || fieldName.isEmpty()) {
            return Optional.empty();
        }

        String fieldMarker = "name=\"" + fieldName + "\"";
        int fieldIndex = body.indexOf(fieldMarker);
        if (fieldIndex < 0) {
            return Optional.empty();
        }

        int valueIndex = body.indexOf(VALUE_MARKER, fieldIndex + fieldMarker.length());
        if (valueIndex < 0) {
            return Optional.empty();
        }

        int tokenStart = valueIndex + VALUE_MARKER.length();
        int tokenEnd = body.indexOf('"', tokenStart);
        if (tokenEnd < 0) {
            return Optional.empty();
        }

        return Optional.of(body.substring(tokenStart, tokenEnd));
    }
}
