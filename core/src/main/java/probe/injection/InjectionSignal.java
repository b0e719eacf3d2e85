package probe.injection;

import probe.model.ProbeResult;

import java.util.Locale;
import java.util.Optional;

/**
 * Annotation attached to an injection outcome when the response looks interesting.
 * Constants are declared in priority order; the first matching signal wins.
 */
public enum InjectionSignal {
    ERROR_MESSAGE("Error message detected"),
    SERVER_ERROR("Server error"),
    SQL_SYNTAX("Possible SQL syntax"),
    TIME_DELAY("Time-based delay detected");

    private final String note;

    InjectionSignal(String note) {
        this.note = note;
    }

    public String getNote() {
        return note;
    }

    /**
     * Detect the signal for a completed result. Failed results never carry a signal.
     *
     * @param result            result to inspect
     * @param delayThresholdMs  elapsed time at or above which a delay is reported
     * @return the highest-priority matching signal, if any
     */
    public static Optional<InjectionSignal> detect(ProbeResult result, double delayThresholdMs) {
        if (!result.isCompleted()) {
            return Optional.empty();
        }

        String body = result.getBody().toLowerCase(Locale.ROOT);
        if (body.contains("error")) {
            return Optional.of(ERROR_MESSAGE);
        }
        if (result.getStatusCode().getAsInt() >= 500) {
            return Optional.of(SERVER_ERROR);
        }
        if (body.contains("syntax")) {
            return Optional.of(SQL_SYNTAX);
        }
        if (result.getElapsedMs() >= delayThresholdMs) {
            return Optional.of(TIME_DELAY);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return note;
    }
}
