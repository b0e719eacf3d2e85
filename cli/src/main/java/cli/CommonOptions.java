package cli;

import picocli.CommandLine.Option;
import report.ReportFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by every subcommand.
 */
public class CommonOptions {

    @Option(
        names = {"--state-dir"},
        description = "Directory holding session, headers and payload documents (default: ${DEFAULT-VALUE})",
        defaultValue = "${sys:user.home}/.http-probe"
    )
    Path stateDir;

    @Option(
        names = {"--log-dir"},
        description = "Directory for activity logs (default: <state-dir>/logs)"
    )
    Path logDir;

    @Option(
        names = {"--no-activity-log"},
        description = "Do not write activity log files"
    )
    boolean noActivityLog;

    @Option(
        names = {"-t", "--timeout"},
        description = "Connect and read timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    int timeoutSeconds;

    @Option(
        names = {"--no-verify-ssl"},
        description = "Disable SSL certificate verification (for testing only!)"
    )
    boolean noVerifySsl;

    @Option(
        names = {"--no-redirects"},
        description = "Do not follow HTTP redirects"
    )
    boolean noRedirects;

    @Option(
        names = {"-H", "--header"},
        description = "Extra request header (format: 'Name: Value'), repeatable"
    )
    List<String> headers = new ArrayList<>();

    @Option(
        names = {"--no-session"},
        description = "Neither load nor save session cookies and headers"
    )
    boolean noSession;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: console, json (default: console)",
        defaultValue = "console"
    )
    String format;

    @Option(
        names = {"-nc", "--no-color"},
        description = "Disable colored output"
    )
    boolean noColor;

    @Option(
        names = {"-o", "--output"},
        description = "Output file for the report (optional, defaults to stdout)"
    )
    Path outputFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    boolean verbose;

    public Path getStateDir() {
        return stateDir;
    }

    public Path getLogDir() {
        return logDir != null ? logDir : stateDir.resolve("logs");
    }

    public ReportFormat getReportFormat() {
        return ReportFormat.fromString(format);
    }

    public boolean isVerbose() {
        return verbose;
    }
}
