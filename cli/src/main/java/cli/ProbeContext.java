package cli;

import probe.http.HttpClient;
import probe.log.ActivityLog;
import probe.log.LogChannel;
import probe.model.ProbeRequest;
import probe.model.ProbeResponse;
import probe.model.ProbeResult;
import probe.session.DocumentStore;
import probe.session.SessionDocument;
import probe.session.SessionManager;
import report.ReportFormat;
import report.Reporter;
import report.ReporterFactory;
import util.HeaderParser;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-invocation wiring: document store, activity log, output and the shared HTTP client.
 *
 * <p>The client is created on first use so commands that only edit stored documents never
 * open one. Default headers are merged in this order, later entries winning: saved custom
 * headers, session headers, {@code -H} options.
 */
final class ProbeContext implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProbeContext.class.getName());

    private final CommonOptions options;
    private final PrintWriter out;
    private final PrintWriter err;
    private final DocumentStore store;
    private final ActivityLog activityLog;
    private final Map<String, String> commandLineHeaders;
    private final ReportFormat reportFormat;

    private SessionDocument session;
    private HttpClient httpClient;

    private ProbeContext(CommonOptions options, PrintWriter out, PrintWriter err,
                         Map<String, String> commandLineHeaders, ReportFormat reportFormat) {
        this.options = options;
        this.out = out;
        this.err = err;
        this.store = new DocumentStore(options.getStateDir());
        this.activityLog = options.noActivityLog
            ? ActivityLog.disabled()
            : ActivityLog.inDirectory(options.getLogDir());
        this.commandLineHeaders = commandLineHeaders;
        this.reportFormat = reportFormat;
    }

    /**
     * Validate the shared options and build the context.
     *
     * @throws IllegalArgumentException for malformed headers or an unknown format
     */
    static ProbeContext open(CommonOptions options, PrintWriter out, PrintWriter err) {
        Map<String, String> headers = HeaderParser.parseAll(options.headers);
        ReportFormat format = options.getReportFormat();
        return new ProbeContext(options, out, err, headers, format);
    }

    CommonOptions options() {
        return options;
    }

    PrintWriter out() {
        return out;
    }

    PrintWriter err() {
        return err;
    }

    DocumentStore store() {
        return store;
    }

    ActivityLog activityLog() {
        return activityLog;
    }

    boolean isJsonOutput() {
        return reportFormat == ReportFormat.JSON;
    }

    /**
     * Shared client for this invocation, restoring stored session cookies on creation.
     */
    HttpClient httpClient() {
        if (httpClient == null) {
            httpClient = HttpClientHelper.createClient(options, defaultHeaders());
            if (!options.noSession) {
                int restored = SessionManager.restore(session(), httpClient.cookieStore());
                logger.fine("Restored " + restored + " session cookie(s)");
            }
        }
        return httpClient;
    }

    Map<String, String> defaultHeaders() {
        Map<String, String> merged = new LinkedHashMap<>(store.loadHeaders());
        if (!options.noSession) {
            merged.putAll(session().headers());
        }
        merged.putAll(commandLineHeaders);
        return merged;
    }

    /**
     * Send one request through the shared client, timing the client call only.
     */
    ProbeResult send(ProbeRequest request) {
        HttpClient client = httpClient();
        long start = System.nanoTime();
        ProbeResponse response = client.execute(request);
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        return ProbeResult.from(request, response, elapsedMs);
    }

    /**
     * Persist the client's cookie jar unless sessions are disabled or no client was used.
     */
    void saveSession() {
        if (options.noSession || httpClient == null) {
            return;
        }
        SessionDocument updated = SessionManager.capture(httpClient.cookieStore(), session().headers());
        try {
            store.saveSession(updated);
            session = updated;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to save session to " + store.getDirectory(), e);
            logError("Failed to save session: " + e.getMessage());
        }
    }

    void log(LogChannel channel, String text) {
        activityLog.append(channel, text);
    }

    void logError(String text) {
        activityLog.append(LogChannel.ERROR, text);
    }

    /**
     * Render through the configured reporter, to the output file when one is given.
     */
    void render(ReportAction action) throws IOException {
        Reporter reporter = ReporterFactory.createReporter(reportFormat, !options.noColor);
        Path outputFile = options.outputFile;
        if (outputFile != null) {
            try (PrintWriter fileWriter = new PrintWriter(Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8))) {
                action.render(reporter, fileWriter);
            }
            out.println("Report written to: " + outputFile);
        } else {
            action.render(reporter, out);
        }
        out.flush();
    }

    private SessionDocument session() {
        if (session == null) {
            session = store.loadSession();
        }
        return session;
    }

    @Override
    public void close() {
        if (httpClient != null) {
            httpClient.close();
        }
        out.flush();
        err.flush();
    }

    @FunctionalInterface
    interface ReportAction {
        void render(Reporter reporter, PrintWriter writer) throws IOException;
    }
}
