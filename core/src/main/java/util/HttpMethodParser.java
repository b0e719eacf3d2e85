package util;

import probe.model.HttpMethod;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Parses user supplied HTTP method names.
 */
public final class HttpMethodParser {
    private static final Logger logger = Logger.getLogger(HttpMethodParser.class.getName());

    private HttpMethodParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Case-insensitive lookup. Unknown or empty names fall back to GET.
     */
    public static HttpMethod parse(String name) {
        if (name == null || name.isBlank()) {
            return HttpMethod.GET;
        }
        try {
            return HttpMethod.fromString(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Unsupported HTTP method '" + name + "', using GET");
            return HttpMethod.GET;
        }
    }
}
