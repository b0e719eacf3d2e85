package probe.injection;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Full report of an injection run. Outcomes are index-aligned with the submitted payloads.
 */
public final class InjectionReport {
    private final String urlTemplate;
    private final int concurrency;
    private final List<InjectionOutcome> outcomes;
    private final Instant startTime;
    private final Instant endTime;

    public InjectionReport(String urlTemplate, int concurrency, List<InjectionOutcome> outcomes,
                           Instant startTime, Instant endTime) {
        this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate cannot be null");
        this.concurrency = concurrency;
        this.outcomes = List.copyOf(outcomes);
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getUrlTemplate() {
        return urlTemplate;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public List<InjectionOutcome> getOutcomes() {
        return outcomes;
    }

    public int size() {
        return outcomes.size();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public long getCompletedCount() {
        return outcomes.stream().filter(o -> o.getResult().isCompleted()).count();
    }

    public long getFailedCount() {
        return outcomes.stream().filter(o -> o.getResult().isFailed()).count();
    }

    public long getSignalledCount() {
        return outcomes.stream().filter(InjectionOutcome::isSignalled).count();
    }

    public List<InjectionOutcome> getSignalledOutcomes() {
        return outcomes.stream().filter(InjectionOutcome::isSignalled).toList();
    }

    @Override
    public String toString() {
        return "InjectionReport{template='" + urlTemplate + '\'' +
               ", payloads=" + outcomes.size() +
               ", signalled=" + getSignalledCount() +
               ", failed=" + getFailedCount() + '}';
    }
}
