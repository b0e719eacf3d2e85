package report;

import java.util.Locale;

/**
 * Supported output formats.
 */
public enum ReportFormat {
    /**
     * Human readable tables with optional ANSI colors.
     */
    CONSOLE("Console output with colors"),

    /**
     * Pretty printed JSON for scripting and CI pipelines.
     */
    JSON("JSON format");

    private final String description;

    ReportFormat(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse a format name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown formats
     */
    public static ReportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report format cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: '" + value + "'. Valid values: console, json", e);
        }
    }
}
