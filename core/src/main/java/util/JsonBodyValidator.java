package util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Checks that a request body is well-formed JSON before it is sent.
 */
public final class JsonBodyValidator {
    public static final String JSON_CONTENT_TYPE = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonBodyValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isValid(String body) {
        try {
            validate(body);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException with the parser message if the body is not JSON
     */
    public static void validate(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("JSON body is empty");
        }
        try {
            MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON body: " + e.getOriginalMessage(), e);
        }
    }
}
