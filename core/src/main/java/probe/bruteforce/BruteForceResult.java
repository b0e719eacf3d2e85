package probe.bruteforce;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Outcome of a brute-force run.
 */
public final class BruteForceResult {
    private final String loginUrl;
    private final String username;
    private final BruteForceState state;
    private final Credential credential;
    private final List<LoginAttempt> attempts;
    private final String csrfToken;
    private final boolean csrfRequested;
    private final int requestCount;
    private final String errorMessage;
    private final Instant startTime;
    private final Instant endTime;

    private BruteForceResult(Builder builder) {
        this.loginUrl = Objects.requireNonNull(builder.loginUrl, "loginUrl cannot be null");
        this.username = builder.username;
        this.state = Objects.requireNonNull(builder.state, "state cannot be null");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Result state must be terminal, got " + state);
        }
        if ((state == BruteForceState.SUCCESS) != (builder.credential != null)) {
            throw new IllegalArgumentException("A credential is present exactly when the state is SUCCESS");
        }
        this.credential = builder.credential;
        this.attempts = builder.attempts != null ? List.copyOf(builder.attempts) : List.of();
        this.csrfToken = builder.csrfToken;
        this.csrfRequested = builder.csrfRequested;
        this.requestCount = builder.requestCount;
        this.errorMessage = builder.errorMessage;
        this.startTime = builder.startTime != null ? builder.startTime : Instant.now();
        this.endTime = builder.endTime != null ? builder.endTime : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLoginUrl() {
        return loginUrl;
    }

    public String getUsername() {
        return username;
    }

    public BruteForceState getState() {
        return state;
    }

    public boolean isSuccess() {
        return state == BruteForceState.SUCCESS;
    }

    public Optional<Credential> getCredential() {
        return Optional.ofNullable(credential);
    }

    public List<LoginAttempt> getAttempts() {
        return attempts;
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public long getTransportFailureCount() {
        return attempts.stream().filter(LoginAttempt::isTransportFailure).count();
    }

    public Optional<String> getCsrfToken() {
        return Optional.ofNullable(csrfToken);
    }

    /**
     * Whether a CSRF field was configured and the login page was fetched for it.
     */
    public boolean isCsrfRequested() {
        return csrfRequested;
    }

    /**
     * Total HTTP requests issued, including the CSRF page fetch.
     */
    public int getRequestCount() {
        return requestCount;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
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

    @Override
    public String toString() {
        return "BruteForceResult{state=" + state +
               ", attempts=" + attempts.size() +
               ", requests=" + requestCount +
               (credential != null ? ", credential=" + credential : "") +
               (errorMessage != null ? ", error='" + errorMessage + "'" : "") + '}';
    }

    public static class Builder {
        private String loginUrl;
        private String username;
        private BruteForceState state;
        private Credential credential;
        private List<LoginAttempt> attempts;
        private String csrfToken;
        private boolean csrfRequested;
        private int requestCount;
        private String errorMessage;
        private Instant startTime;
        private Instant endTime;

        public Builder loginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder state(BruteForceState state) {
            this.state = state;
            return this;
        }

        public Builder credential(Credential credential) {
            this.credential = credential;
            return this;
        }

        public Builder attempts(List<LoginAttempt> attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder csrfToken(String csrfToken) {
            this.csrfToken = csrfToken;
            return this;
        }

        public Builder csrfRequested(boolean csrfRequested) {
            this.csrfRequested = csrfRequested;
            return this;
        }

        public Builder requestCount(int requestCount) {
            this.requestCount = requestCount;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public BruteForceResult build() {
            return new BruteForceResult(this);
        }
    }
}
