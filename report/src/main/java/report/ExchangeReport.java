package report;

import probe.model.Finding;
import probe.model.ProbeResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One request/response exchange together with the classifier findings for it.
 * Findings are empty when the exchange failed at the transport level.
 */
public final class ExchangeReport {
    private final ProbeResult result;
    private final List<Finding> findings;
    private final Instant timestamp;

    public ExchangeReport(ProbeResult result, List<Finding> findings, Instant timestamp) {
        this.result = Objects.requireNonNull(result, "result cannot be null");
        this.findings = findings != null ? List.copyOf(findings) : List.of();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ExchangeReport of(ProbeResult result, List<Finding> findings) {
        return new ExchangeReport(result, findings, Instant.now());
    }

    public ProbeResult getResult() {
        return result;
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
