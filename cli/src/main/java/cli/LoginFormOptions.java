package cli;

import picocli.CommandLine.Option;
import probe.bruteforce.BruteForceConfig;

/**
 * Login form description shared by {@code brute} and {@code login}.
 */
class LoginFormOptions {

    @Option(names = {"--user-field"}, description = "Username form field (default: ${DEFAULT-VALUE})",
        defaultValue = "username")
    String usernameField;

    @Option(names = {"--pass-field"}, description = "Password form field (default: ${DEFAULT-VALUE})",
        defaultValue = "password")
    String passwordField;

    @Option(names = {"--csrf-field"}, description = "Hidden CSRF field to scrape from the login page and send back")
    String csrfField;

    @Option(names = {"--success"}, description = "Text that appears in the body after a successful login")
    String successIndicator;

    @Option(names = {"--failure"}, description = "Text that appears in the body after a failed login")
    String failureIndicator;

    BruteForceConfig.Builder applyTo(BruteForceConfig.Builder builder) {
        return builder
            .usernameField(usernameField)
            .passwordField(passwordField)
            .csrfField(csrfField)
            .successIndicator(successIndicator)
            .failureIndicator(failureIndicator);
    }
}
