package report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import probe.bruteforce.BruteForceResult;
import probe.bruteforce.LoginAttempt;
import probe.injection.InjectionOutcome;
import probe.injection.InjectionReport;
import probe.model.Finding;
import probe.model.ProbeRequest;
import probe.model.ProbeResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON reporter for scripting and CI pipelines.
 *
 * <p>Output is pretty printed, timestamps are ISO-8601 strings and every list keeps the
 * order of the underlying run. Injection outcomes are listed in payload order.
 */
public final class JsonReporter implements Reporter {

    private final ObjectMapper objectMapper;

    public JsonReporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(ExchangeReport report, PrintWriter writer) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", "exchange");
        json.put("timestamp", report.getTimestamp());
        json.put("request", buildRequest(report.getResult().getRequest()));
        json.put("result", buildResult(report.getResult(), true));
        json.put("findings", buildFindings(report.getFindings()));
        write(json, writer);
    }

    @Override
    public void generate(InjectionReport report, PrintWriter writer) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", "injection");
        json.put("urlTemplate", report.getUrlTemplate());
        json.put("concurrency", report.getConcurrency());
        json.put("startTime", report.getStartTime());
        json.put("endTime", report.getEndTime());
        json.put("durationMs", report.getDuration().toMillis());

        List<Map<String, Object>> outcomes = new ArrayList<>();
        for (InjectionOutcome outcome : report.getOutcomes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("category", outcome.getPayload().category().getKey());
            entry.put("payload", outcome.getPayload().value());
            entry.put("url", outcome.getResult().getRequest().getUrl());
            entry.putAll(buildResult(outcome.getResult(), false));
            entry.put("note", outcome.getSignal().map(signal -> signal.getNote()).orElse(null));
            entry.put("findings", buildFindings(outcome.getFindings()));
            outcomes.add(entry);
        }
        json.put("outcomes", outcomes);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", report.size());
        summary.put("completed", report.getCompletedCount());
        summary.put("failed", report.getFailedCount());
        summary.put("signalled", report.getSignalledCount());
        json.put("summary", summary);

        write(json, writer);
    }

    @Override
    public void generate(BruteForceResult result, PrintWriter writer) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", "bruteforce");
        json.put("loginUrl", result.getLoginUrl());
        json.put("username", result.getUsername());
        json.put("state", result.getState().name());
        json.put("success", result.isSuccess());
        json.put("password", result.getCredential().map(credential -> credential.password()).orElse(null));
        json.put("csrfRequested", result.isCsrfRequested());
        json.put("csrfToken", result.getCsrfToken().orElse(null));
        json.put("attemptCount", result.getAttemptCount());
        json.put("requestCount", result.getRequestCount());
        json.put("transportFailures", result.getTransportFailureCount());
        json.put("error", result.getErrorMessage().orElse(null));
        json.put("startTime", result.getStartTime());
        json.put("endTime", result.getEndTime());
        json.put("durationMs", result.getDuration().toMillis());

        List<Map<String, Object>> attempts = new ArrayList<>();
        for (LoginAttempt attempt : result.getAttempts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("number", attempt.number());
            entry.put("password", attempt.password());
            entry.put("success", attempt.success());
            entry.putAll(buildResult(attempt.result(), false));
            attempts.add(entry);
        }
        json.put("attempts", attempts);

        write(json, writer);
    }

    private Map<String, Object> buildRequest(ProbeRequest request) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("method", request.getMethod().name());
        json.put("url", request.getUrl());
        json.put("headers", request.getHeaders());
        if (request.hasBody()) {
            json.put("body", request.getBody());
            json.put("contentType", request.getBodyContentType());
        }
        return json;
    }

    private Map<String, Object> buildResult(ProbeResult result, boolean includeBody) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("status", result.getStatusCode().isPresent() ? result.getStatusCode().getAsInt() : null);
        json.put("elapsedMs", result.getElapsedMs());
        json.put("bodyLength", result.getBodyLength());
        json.put("error", result.getError().orElse(null));
        if (includeBody && result.isCompleted()) {
            json.put("headers", result.getHeaders());
            json.put("body", result.getBody());
        }
        return json;
    }

    private List<Map<String, Object>> buildFindings(List<Finding> findings) {
        List<Map<String, Object>> json = new ArrayList<>();
        for (Finding finding : findings) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", finding.getLabel());
            entry.put("description", finding.getType().getDescription());
            finding.getDetail().ifPresent(detail -> entry.put("detail", detail));
            json.add(entry);
        }
        return json;
    }

    private void write(Map<String, Object> json, PrintWriter writer) throws IOException {
        writer.println(objectMapper.writeValueAsString(json));
        writer.flush();
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
