package probe.payload;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Vulnerability classes payloads are grouped under.
 * The key is the identifier used in stored payload documents and on the command line.
 */
public enum PayloadCategory {
    SQL("sql", "SQL injection"),
    XSS("xss", "Cross-site scripting"),
    PATH_TRAVERSAL("path_traversal", "Path traversal"),
    COMMAND_INJECTION("command_injection", "OS command injection");

    private final String key;
    private final String displayName;

    PayloadCategory(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a category from its key (case-insensitive, '-' accepted for '_').
     *
     * @throws IllegalArgumentException for unknown categories
     */
    public static PayloadCategory fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Payload category cannot be empty");
        }
        String normalized = key.trim().toLowerCase().replace('-', '_');
        for (PayloadCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException(
            String.format("Unknown payload category: '%s'. Valid values: %s", key, validKeys()));
    }

    public static String validKeys() {
        return Arrays.stream(values()).map(PayloadCategory::getKey).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return key;
    }
}
