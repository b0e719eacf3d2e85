package report;

import probe.bruteforce.BruteForceResult;
import probe.bruteforce.BruteForceState;
import probe.bruteforce.Credential;
import probe.bruteforce.LoginAttempt;
import probe.injection.InjectionOutcome;
import probe.injection.InjectionReport;
import probe.model.Finding;
import probe.model.ProbeRequest;
import probe.model.ProbeResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Console-based reporter with colored output.
 */
public final class ConsoleReporter implements Reporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final int PAYLOAD_COLUMN_WIDTH = 36;
    private static final int MAX_LISTED_ATTEMPTS = 20;

    private final boolean useColors;

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public ConsoleReporter() {
        this(true);
    }

    @Override
    public void generate(ExchangeReport report, PrintWriter writer) throws IOException {
        ProbeResult result = report.getResult();
        ProbeRequest request = result.getRequest();

        printHeader(writer, "HTTP Exchange");
        writer.println("Request: " + colorize(request.getMethod().name(), ANSI_CYAN) + " " + request.getUrl());
        request.getHeaders().forEach((name, value) -> writer.println(colorize("  " + name + ": " + value, ANSI_GRAY)));
        if (request.hasBody()) {
            writer.println(colorize("  Body: " + request.getBody(), ANSI_GRAY));
        }
        writer.println();

        if (result.isFailed()) {
            printError(writer, result.getError().orElse("Transport error"));
            return;
        }

        int status = result.getStatusCode().getAsInt();
        writer.println("Status: " + colorize(String.valueOf(status), statusColor(status)));
        writer.println("Time: " + formatMillis(result.getElapsedMs()));
        writer.println("Length: " + result.getBodyLength() + " bytes");

        printSection(writer, "Response Headers");
        result.getHeaders().forEach((name, values) ->
            writer.println("  " + name + ": " + String.join(", ", values)));

        printSection(writer, "Body");
        writer.println(result.getBody().isEmpty() ? colorize("(empty)", ANSI_GRAY) : result.getBodyExcerpt());

        printSection(writer, "Findings");
        printFindings(writer, report.getFindings());
    }

    @Override
    public void generate(InjectionReport report, PrintWriter writer) throws IOException {
        printHeader(writer, "Injection Test");
        writer.println("Target: " + report.getUrlTemplate());
        writer.println("Payloads: " + report.size() + "  Concurrency: " + report.getConcurrency());
        writer.println("Duration: " + formatDuration(report.getDuration()));

        printSection(writer, "Results");
        if (report.size() == 0) {
            writer.println(colorize("No payloads were tested.", ANSI_GRAY));
        } else {
            writer.println(colorize(String.format(Locale.ROOT, "%4s  %-18s %-" + PAYLOAD_COLUMN_WIDTH + "s %6s %10s %8s  %s",
                "#", "CATEGORY", "PAYLOAD", "STATUS", "TIME", "LENGTH", "NOTE"), ANSI_BOLD));

            List<InjectionOutcome> outcomes = report.getOutcomes();
            for (int i = 0; i < outcomes.size(); i++) {
                printOutcomeRow(writer, i + 1, outcomes.get(i));
            }
        }

        printSection(writer, "Summary");
        writer.println("Completed: " + report.getCompletedCount());
        writer.println("Failed: " + colorize(String.valueOf(report.getFailedCount()),
            report.getFailedCount() > 0 ? ANSI_YELLOW : ANSI_GREEN));
        writer.println("Signalled: " + colorize(String.valueOf(report.getSignalledCount()),
            report.getSignalledCount() > 0 ? ANSI_RED : ANSI_GREEN));

        Map<String, Integer> findingCounts = new LinkedHashMap<>();
        for (InjectionOutcome outcome : report.getOutcomes()) {
            for (Finding finding : outcome.getFindings()) {
                findingCounts.merge(finding.getLabel(), 1, Integer::sum);
            }
        }
        if (!findingCounts.isEmpty()) {
            writer.println();
            writer.println(colorize("Response findings:", ANSI_BOLD));
            findingCounts.forEach((label, count) ->
                writer.println("  " + colorize(label, ANSI_YELLOW) + " (" + count + " responses)"));
        }

        writer.println();
        if (report.getSignalledCount() == 0 && report.size() > 0) {
            printSuccess(writer, "No injection signals detected.");
        }
    }

    @Override
    public void generate(BruteForceResult result, PrintWriter writer) throws IOException {
        printHeader(writer, "Brute-Force Run");
        writer.println("Login URL: " + result.getLoginUrl());
        writer.println("Username: " + result.getUsername());
        writer.println("State: " + colorize(result.getState().name(), stateColor(result.getState())));
        writer.println("Attempts: " + result.getAttemptCount() + "  Requests: " + result.getRequestCount() +
                       "  Transport failures: " + result.getTransportFailureCount());
        if (result.isCsrfRequested()) {
            writer.println("CSRF token: " + result.getCsrfToken().orElse(colorize("not found", ANSI_YELLOW)));
        }
        writer.println("Duration: " + formatDuration(result.getDuration()));

        List<LoginAttempt> attempts = result.getAttempts();
        if (!attempts.isEmpty()) {
            printSection(writer, "Attempts");
            int skipped = Math.max(0, attempts.size() - MAX_LISTED_ATTEMPTS);
            if (skipped > 0) {
                writer.println(colorize("  ... " + skipped + " earlier attempts omitted", ANSI_GRAY));
            }
            for (LoginAttempt attempt : attempts.subList(skipped, attempts.size())) {
                printAttemptRow(writer, attempt);
            }
        }

        writer.println();
        result.getErrorMessage().ifPresent(message -> printError(writer, message));

        if (result.getCredential().isPresent()) {
            Credential credential = result.getCredential().get();
            printSuccess(writer, "Valid credential found: " +
                colorize(credential.username() + " / " + credential.password(), ANSI_BOLD));
        } else if (result.getState() == BruteForceState.EXHAUSTED) {
            writer.println(colorize("No valid password found in " + result.getAttemptCount() + " attempts.", ANSI_YELLOW));
            writer.println();
        }
    }

    private void printOutcomeRow(PrintWriter writer, int number, InjectionOutcome outcome) {
        ProbeResult result = outcome.getResult();
        String payload = truncate(outcome.getPayload().value(), PAYLOAD_COLUMN_WIDTH);
        String category = outcome.getPayload().category().getKey();

        if (result.isFailed()) {
            writer.println(String.format(Locale.ROOT, "%4d  %-18s %-" + PAYLOAD_COLUMN_WIDTH + "s %6s %10s %8s  %s",
                number, category, payload, "-", formatMillis(result.getElapsedMs()), "-",
                colorize("ERROR " + result.getError().orElse(""), ANSI_RED)));
            return;
        }

        int status = result.getStatusCode().getAsInt();
        String note = outcome.getSignal().map(signal -> colorize(signal.getNote(), ANSI_RED)).orElse("");
        writer.println(String.format(Locale.ROOT, "%4d  %-18s %-" + PAYLOAD_COLUMN_WIDTH + "s %6s %10s %8d  %s",
            number, category, payload, colorize(String.valueOf(status), statusColor(status)),
            formatMillis(result.getElapsedMs()), result.getBodyLength(), note));
    }

    private void printAttemptRow(PrintWriter writer, LoginAttempt attempt) {
        ProbeResult result = attempt.result();
        String outcome;
        if (attempt.isTransportFailure()) {
            outcome = colorize("ERROR " + result.getError().orElse(""), ANSI_RED);
        } else if (attempt.success()) {
            outcome = colorize("SUCCESS", ANSI_GREEN);
        } else {
            outcome = colorize("failed", ANSI_GRAY);
        }
        String status = result.getStatusCode().isPresent() ? String.valueOf(result.getStatusCode().getAsInt()) : "-";
        writer.println(String.format(Locale.ROOT, "  #%-5d %-24s %4s  %s",
            attempt.number(), truncate(attempt.password(), 24), status, outcome));
    }

    private void printFindings(PrintWriter writer, List<Finding> findings) {
        if (findings.isEmpty()) {
            printSuccess(writer, "No findings.");
            return;
        }
        for (Finding finding : findings) {
            String detail = finding.getDetail().map(d -> " (" + d + ")").orElse("");
            writer.println(colorize("  [!] ", ANSI_YELLOW) + colorize(finding.getLabel(), ANSI_BOLD) + detail);
            writer.println(colorize("      " + finding.getType().getDescription(), ANSI_GRAY));
        }
        writer.println();
    }

    private void printHeader(PrintWriter writer, String title) {
        writer.println(colorize(ANSI_BOLD + "=".repeat(60), ANSI_BLUE));
        writer.println(colorize(ANSI_BOLD + title, ANSI_BLUE));
        writer.println(colorize(ANSI_BOLD + "=".repeat(60), ANSI_BLUE));
        writer.println();
    }

    private void printSection(PrintWriter writer, String title) {
        writer.println();
        writer.println(colorize(ANSI_BOLD + title, ANSI_BLUE));
        writer.println(colorize("-".repeat(60), ANSI_BLUE));
    }

    private void printError(PrintWriter writer, String message) {
        writer.println(colorize("ERROR: ", ANSI_RED) + message);
        writer.println();
    }

    private void printSuccess(PrintWriter writer, String message) {
        writer.println(colorize("✓ ", ANSI_GREEN) + message);
        writer.println();
    }

    private String statusColor(int status) {
        if (status >= 500) {
            return ANSI_RED;
        }
        if (status >= 400) {
            return ANSI_YELLOW;
        }
        if (status >= 300) {
            return ANSI_CYAN;
        }
        return ANSI_GREEN;
    }

    private String stateColor(BruteForceState state) {
        return switch (state) {
            case SUCCESS -> ANSI_GREEN;
            case EXHAUSTED -> ANSI_YELLOW;
            case ABORTED -> ANSI_RED;
            default -> ANSI_GRAY;
        };
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }

    private static String truncate(String value, int width) {
        String singleLine = value.replace('\n', ' ').replace('\r', ' ');
        return singleLine.length() <= width ? singleLine : singleLine.substring(0, width - 3) + "...";
    }

    private static String formatMillis(double millis) {
        return String.format(Locale.ROOT, "%.1fms", millis);
    }

    private String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.2fs", duration.toMillis() / 1000.0);
        }
        long minutes = seconds / 60;
        long remainingSeconds = seconds % 60;
        return minutes + "m " + remainingSeconds + "s";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CONSOLE;
    }
}
