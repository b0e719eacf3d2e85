package probe.injection;

import probe.model.Finding;
import probe.model.ProbeResult;
import probe.payload.Payload;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluation of a single payload: the request result, the injection signal (if any)
 * and the classifier findings for completed exchanges.
 */
public final class InjectionOutcome {
    private final Payload payload;
    private final ProbeResult result;
    private final InjectionSignal signal;
    private final List<Finding> findings;

    public InjectionOutcome(Payload payload, ProbeResult result, InjectionSignal signal, List<Finding> findings) {
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
        this.result = Objects.requireNonNull(result, "result cannot be null");
        this.signal = signal;
        this.findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public Payload getPayload() {
        return payload;
    }

    public ProbeResult getResult() {
        return result;
    }

    public Optional<InjectionSignal> getSignal() {
        return Optional.ofNullable(signal);
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public boolean isSignalled() {
        return signal != null;
    }

    @Override
    public String toString() {
        return "InjectionOutcome{payload=" + payload +
               ", result=" + result +
               (signal != null ? ", signal=" + signal.getNote() : "") + "}";
    }
}
