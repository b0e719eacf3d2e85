package probe.bruteforce;

import java.util.*;

/**
 * Parameters of a brute-force run against a login form.
 */
public final class BruteForceConfig {
    private final String loginUrl;
    private final String usernameField;
    private final String passwordField;
    private final String csrfField;
    private final String username;
    private final String successIndicator;
    private final String failureIndicator;
    private final Map<String, String> headers;
    private final int requestDelayMs;
    private final BruteForceProgressListener progressListener;

    private BruteForceConfig(Builder builder) {
        this.loginUrl = requireText(builder.loginUrl, "loginUrl");
        this.usernameField = requireText(builder.usernameField, "usernameField");
        this.passwordField = requireText(builder.passwordField, "passwordField");
        this.csrfField = builder.csrfField != null && !builder.csrfField.isBlank() ? builder.csrfField : null;
        this.username = Objects.requireNonNull(builder.username, "username cannot be null");
        this.successIndicator = emptyToNull(builder.successIndicator);
        this.failureIndicator = emptyToNull(builder.failureIndicator);
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        if (builder.requestDelayMs < 0) {
            throw new IllegalArgumentException("requestDelayMs must be >= 0");
        }
        this.requestDelayMs = builder.requestDelayMs;
        this.progressListener = builder.progressListener != null
            ? builder.progressListener
            : BruteForceProgressListener.noOp();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLoginUrl() {
        return loginUrl;
    }

    public String getUsernameField() {
        return usernameField;
    }

    public String getPasswordField() {
        return passwordField;
    }

    public Optional<String> getCsrfField() {
        return Optional.ofNullable(csrfField);
    }

    public String getUsername() {
        return username;
    }

    public Optional<String> getSuccessIndicator() {
        return Optional.ofNullable(successIndicator);
    }

    public Optional<String> getFailureIndicator() {
        return Optional.ofNullable(failureIndicator);
    }

    public LoginSuccessCriteria getSuccessCriteria() {
        return new LoginSuccessCriteria(successIndicator, failureIndicator);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Pause before each login attempt after the first, 0 to disable.
     */
    public int getRequestDelayMs() {
        return requestDelayMs;
    }

    public BruteForceProgressListener getProgressListener() {
        return progressListener;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    public static class Builder {
        private String loginUrl;
        private String usernameField = "username";
        private String passwordField = "password";
        private String csrfField;
        private String username;
        private String successIndicator;
        private String failureIndicator;
        private Map<String, String> headers;
        private int requestDelayMs;
        private BruteForceProgressListener progressListener;

        public Builder loginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
            return this;
        }

        public Builder usernameField(String usernameField) {
            this.usernameField = usernameField;
            return this;
        }

        public Builder passwordField(String passwordField) {
            this.passwordField = passwordField;
            return this;
        }

        public Builder csrfField(String csrfField) {
            this.csrfField = csrfField;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder successIndicator(String successIndicator) {
            this.successIndicator = successIndicator;
            return this;
        }

        public Builder failureIndicator(String failureIndicator) {
            this.failureIndicator = failureIndicator;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder requestDelayMs(int requestDelayMs) {
            this.requestDelayMs = requestDelayMs;
            return this;
        }

        public Builder progressListener(BruteForceProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public BruteForceConfig build() {
            return new BruteForceConfig(this);
        }
    }
}
