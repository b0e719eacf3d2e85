package report;

/**
 * Creates {@link Reporter} instances for each {@link ReportFormat}.
 *
 * <pre>{@code
 * Reporter console = ReporterFactory.createReporter(ReportFormat.CONSOLE, false);
 * Reporter json = ReporterFactory.createReporter(ReportFormat.JSON);
 * }</pre>
 */
public final class ReporterFactory {

    private ReporterFactory() {
        // Utility class
    }

    /**
     * @param format    output format
     * @param useColors ANSI colors, only used by {@link ReportFormat#CONSOLE}
     * @throws NullPointerException if {@code format} is null
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors) {
        return switch (format) {
            case CONSOLE -> new ConsoleReporter(useColors);
            case JSON -> new JsonReporter();
        };
    }

    /**
     * Reporter with default settings; console output is colored.
     */
    public static Reporter createReporter(ReportFormat format) {
        return createReporter(format, true);
    }
}
