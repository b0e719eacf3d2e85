package probe.bruteforce;

import probe.model.ProbeResult;

import java.util.Locale;

/**
 * Decides whether a login attempt succeeded.
 *
 * <p>An attempt is a success when:
 * <ul>
 *   <li>a success indicator is set and appears in the body, or</li>
 *   <li>a failure indicator is set and does not appear in the body, or</li>
 *   <li>neither indicator is set and the status code is 200.</li>
 * </ul>
 * Indicator matching ignores case. The success indicator is checked first: when it
 * matches, the attempt succeeds even if the failure indicator also appears.
 */
public final class LoginSuccessCriteria {
    private final String successIndicator;
    private final String failureIndicator;

    public LoginSuccessCriteria(String successIndicator, String failureIndicator) {
        this.successIndicator = normalize(successIndicator);
        this.failureIndicator = normalize(failureIndicator);
    }

    public static LoginSuccessCriteria statusOnly() {
        return new LoginSuccessCriteria(null, null);
    }

    /**
     * Evaluate a completed attempt. Failed attempts are never a success.
     */
    public boolean isSuccess(ProbeResult result) {
        if (!result.isCompleted()) {
            return false;
        }

        String body = result.getBody().toLowerCase(Locale.ROOT);

        if (successIndicator != null && body.contains(successIndicator.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (failureIndicator != null && !body.contains(failureIndicator.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return successIndicator == null && failureIndicator == null
            && result.getStatusCode().getAsInt() == 200;
    }

    public String getSuccessIndicator() {
        return successIndicator;
    }

    public String getFailureIndicator() {
        return failureIndicator;
    }

    private static String normalize(String indicator) {
        return indicator == null || indicator.isEmpty() ? null : indicator;
    }

    @Override
    public String toString() {
        return "LoginSuccessCriteria{success=" + successIndicator + ", failure=" + failureIndicator + "}";
    }
}
