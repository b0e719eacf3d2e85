package report;

import probe.bruteforce.BruteForceResult;
import probe.injection.InjectionReport;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Renders run results in one output format.
 *
 * <p>Usage:
 * <pre>{@code
 * Reporter reporter = ReporterFactory.createReporter(ReportFormat.CONSOLE);
 * try (PrintWriter writer = new PrintWriter(System.out)) {
 *     reporter.generate(injectionReport, writer);
 * }
 * }</pre>
 *
 * @see ReporterFactory
 */
public interface Reporter {

    /**
     * Render a single request/response exchange and its findings.
     *
     * @throws IOException if writing fails
     */
    void generate(ExchangeReport report, PrintWriter writer) throws IOException;

    /**
     * Render an injection run: one row per payload, in payload order.
     *
     * @throws IOException if writing fails
     */
    void generate(InjectionReport report, PrintWriter writer) throws IOException;

    /**
     * Render a brute-force run.
     *
     * @throws IOException if writing fails
     */
    void generate(BruteForceResult result, PrintWriter writer) throws IOException;

    ReportFormat getFormat();
}
