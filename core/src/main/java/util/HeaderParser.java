package util;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses {@code Name: Value} header arguments.
 */
public final class HeaderParser {

    private HeaderParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Parse a single header line.
     *
     * @throws IllegalArgumentException if there is no colon or the name is empty
     */
    public static Map.Entry<String, String> parse(String header) {
        if (header == null) {
            throw new IllegalArgumentException("Header cannot be null");
        }
        int colon = header.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Malformed header '" + header + "', expected 'Name: Value'");
        }
        String name = header.substring(0, colon).trim();
        if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid header name in '" + header + "'");
        }
        return Map.entry(name, header.substring(colon + 1).trim());
    }

    /**
     * Parse several header lines keeping their order. A repeated name keeps the last value.
     */
    public static Map<String, String> parseAll(Collection<String> headers) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (headers == null) {
            return parsed;
        }
        for (String header : headers) {
            Map.Entry<String, String> entry = parse(header);
            parsed.put(entry.getKey(), entry.getValue());
        }
        return parsed;
    }
}
