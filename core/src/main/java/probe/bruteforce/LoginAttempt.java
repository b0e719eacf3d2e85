package probe.bruteforce;

import probe.model.ProbeResult;

/**
 * One POST against the login form.
 *
 * @param number   1-based attempt number
 * @param password candidate password sent
 * @param result   request result, completed or failed
 * @param success  whether the attempt was classified as a successful login
 */
public record LoginAttempt(int number, String password, ProbeResult result, boolean success) {

    public boolean isTransportFailure() {
        return result.isFailed();
    }
}
