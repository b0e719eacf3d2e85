package probe.bruteforce;

import probe.model.ProbeResult;

/**
 * Username/password pair accepted by the target, with the response that confirmed it.
 */
public record Credential(String username, String password, ProbeResult result) {

    @Override
    public String toString() {
        return "Credential{username='" + username + "', password='" + password + "'}";
    }
}
